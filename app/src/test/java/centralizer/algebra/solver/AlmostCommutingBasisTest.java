package centralizer.algebra.solver;

import centralizer.config.CommutatorConfig;
import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.factory.CoefficientRingFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Base casi conmutante {@code P_k = (L^(k/n))_+}.
 */
class AlmostCommutingBasisTest {

    private static DifferentialOperator genericOperator(int n, int degree) {
        CoefficientRingFactory.Layout layout = CoefficientRingFactory.create(n, n, degree, CommutatorConfig.defaults());
        PolynomialRing ring = layout.ring();
        List<Polynomial> c = new ArrayList<>(Collections.nCopies(n + 1, ring.zero()));
        for (int i = 0; i < layout.coefficients().size(); i++) {
            c.set(i, layout.coefficients().get(i));
        }
        c.set(n, ring.one());
        return DifferentialOperator.of(ring, DifferentialOperator.DEFAULT_SYMBOL, c);
    }

    @Test
    @DisplayName("Cada P_k es mónico de orden k")
    void compute_shouldGiveMonicOperatorsOfEachOrder() {
        // ARRANGE
        DifferentialOperator l = genericOperator(3, 1);

        // ACT
        List<DifferentialOperator> basis = AlmostCommutingBasis.compute(l, 5);

        // ASSERT
        assertEquals(6, basis.size());
        for (int k = 0; k <= 5; k++) {
            assertEquals(k, basis.get(k).order(), "Orden de P_" + k);
            assertTrue(basis.get(k).leadingCoefficient().isOne(), "P_" + k + " debe ser mónico");
        }
    }

    @Test
    @DisplayName("Para k múltiplo de n, P_k = L^(k/n)")
    void compute_multiplesOfOrder_shouldBePowersOfL() {
        DifferentialOperator l = genericOperator(2, 1);

        List<DifferentialOperator> basis = AlmostCommutingBasis.compute(l, 4);

        assertEquals(l, basis.get(2));
        assertEquals(l.power(2), basis.get(4));
        assertTrue(l.bracket(basis.get(4)).isZero());
    }

    @Test
    @DisplayName("Casi conmutación: [L, P_k] tiene orden <= n-2")
    void compute_bracketOrder_shouldBeBounded() {
        DifferentialOperator l = genericOperator(3, 1);

        List<DifferentialOperator> basis = AlmostCommutingBasis.compute(l, 4);

        for (DifferentialOperator pk : basis) {
            assertTrue(l.bracket(pk).order() <= 1, "Orden de [L, P] para " + pk);
        }
    }
}
