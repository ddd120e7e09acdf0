package centralizer.domain.analysis;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.Variable;

import java.util.Objects;

/**
 * Preferencia ordenada de ramificación. Orientativa: la búsqueda puede ramificar también
 * sobre otras variables.
 *
 * @param kind     Tipo de pista.
 * @param variable Variable sobre la que ramificar primero.
 * @param value    Valor candidato (constante o expresión en variables no asignadas).
 */
public record BranchHint(HintKind kind, Variable variable, Polynomial value) {

    public BranchHint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(value, "value");
    }

    public static BranchHint var(Variable variable, Polynomial value) {
        return new BranchHint(HintKind.VAR, variable, value);
    }

    @Override
    public String toString() {
        return "(" + kind.name().toLowerCase() + ", " + variable + ", " + value + ")";
    }
}
