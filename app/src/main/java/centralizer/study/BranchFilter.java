package centralizer.study;

import centralizer.domain.analysis.Branch;
import centralizer.domain.operator.DifferentialOperator;

import java.util.function.Predicate;

/**
 * Filtro de ramas triviales: descarta las ramas en las que el operador P se anula por completo.
 */
public final class BranchFilter {

    private BranchFilter() {}

    /**
     * {@code true} si {@code branch.eval(candidate)} no es el operador cero.
     */
    public static boolean isNonTrivial(Branch branch, DifferentialOperator candidate) {
        return !branch.eval(candidate).isZero();
    }

    public static Predicate<Branch> nonTrivial(DifferentialOperator candidate) {
        return branch -> isNonTrivial(branch, candidate);
    }
}
