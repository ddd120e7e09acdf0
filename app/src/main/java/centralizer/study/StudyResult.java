package centralizer.study;

import centralizer.domain.analysis.Branch;
import centralizer.domain.commutator.CommutatorSystem;
import centralizer.domain.operator.DifferentialOperator;

import java.util.List;

/**
 * Resultado de un estudio: el sistema de conmutación y las ramas no triviales que sobreviven al
 * filtro, en orden de descubrimiento.
 *
 * @param system         Sistema (L, P, H) construido.
 * @param branches       Ramas no triviales.
 * @param discarded      Ramas descartadas por el filtro.
 * @param analysisMillis Tiempo del análisis por casos (sin la construcción).
 */
public record StudyResult(CommutatorSystem system, List<Branch> branches, int discarded, long analysisMillis) {

    public StudyResult {
        branches = List.copyOf(branches);
    }

    /**
     * P particularizado en la rama i-ésima de la lista.
     */
    public DifferentialOperator candidateIn(int i) {
        return branches.get(i).eval(system.candidate());
    }
}
