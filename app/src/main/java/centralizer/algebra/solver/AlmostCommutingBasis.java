package centralizer.algebra.solver;

import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.operator.PseudoDifferentialOperator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Base de operadores casi conmutantes de Wilson para un L en forma normal de orden n:
 * {@code P_k = (L^(k/n))_+}, {@code k = 0..m}.
 * <p>
 * Cada {@code P_k} es mónico de orden k y {@code [L, P_k]} tiene orden {@code <= n-2}; para k múltiplo
 * de n, {@code P_k = L^(k/n)} y el conmutador es cero.
 */
@Slf4j
public final class AlmostCommutingBasis {

    /**
     * Prohibido construir esta clase utilidad
     */
    private AlmostCommutingBasis() {
    }

    public static List<DifferentialOperator> compute(DifferentialOperator reference, int upToOrder) {
        int n = reference.order();
        List<DifferentialOperator> basis = new ArrayList<>(upToOrder + 1);
        basis.add(DifferentialOperator.one(reference.ring(), reference.symbol()));
        if (upToOrder == 0) return basis;

        // Q^k necesita Q hasta el orden 1-k para que su parte positiva sea exacta.
        int precision = Math.min(0, 1 - upToOrder);
        PseudoDifferentialOperator root = PseudoDifferentialOperator.nthRoot(reference, n, precision);
        log.debug("Raíz {}-ésima de L calculada hasta el orden {}", n, precision);

        PseudoDifferentialOperator power = root;
        for (int k = 1; k <= upToOrder; k++) {
            if (k > 1) power = power.compose(root);
            DifferentialOperator pk = power.positivePart();
            basis.add(pk);
            log.debug("    P_{} calculado (orden {})", k, pk.order());
        }
        return basis;
    }
}
