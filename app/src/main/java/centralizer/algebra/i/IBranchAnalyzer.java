package centralizer.algebra.i;

import centralizer.domain.analysis.Branch;
import centralizer.domain.analysis.BranchHint;
import centralizer.domain.ideal.Ideal;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Variable;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Búsqueda por casos sobre un ideal: devuelve las ramas consistentes en orden estable.
 */
public interface IBranchAnalyzer {

    /**
     * Secuencia perezosa de ramas. Los errores de la asignación inicial se lanzan al llamar,
     * no al consumir la secuencia.
     */
    Stream<Branch> analyze(Ideal ideal,
                           Map<Variable, Polynomial> initialAssignment,
                           List<BranchHint> hints,
                           PolynomialRing baseRing);

    default List<Branch> analyzeAll(Ideal ideal,
                                    Map<Variable, Polynomial> initialAssignment,
                                    List<BranchHint> hints,
                                    PolynomialRing baseRing) {
        return analyze(ideal, initialAssignment, hints, baseRing).collect(Collectors.toList());
    }
}
