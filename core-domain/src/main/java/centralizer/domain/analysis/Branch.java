package centralizer.domain.analysis;

import centralizer.domain.ideal.Ideal;
import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.Rational;
import centralizer.domain.ring.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hoja consistente del árbol de casos.
 * <p>
 * Una rama describe el conjunto de especializaciones que satisfacen a la vez la asignación parcial,
 * el ideal residual y las condiciones de no anulación introducidas por las divisiones {@code v ≠ a}.
 * El ideal residual está saturado respecto a esas condiciones y se guarda como base reducida.
 * Inmutable: evaluar dos veces la misma expresión da el mismo resultado.
 *
 * @param index      Posición de la rama en el orden de descubrimiento (estable).
 * @param residual   Ideal residual reducido.
 * @param solution   Asignación parcial de la rama.
 * @param conditions Polinomios que no se anulan en la rama.
 */
public record Branch(int index, Ideal residual, PartialSolution solution, List<Polynomial> conditions) {

    public Branch {
        Objects.requireNonNull(residual, "residual");
        Objects.requireNonNull(solution, "solution");
        if (residual.ring() != solution.ring()) {
            throw new IllegalArgumentException("El ideal residual y la asignación usan anillos distintos");
        }
        conditions = List.copyOf(conditions);
    }

    /**
     * Sustituye la asignación y reduce módulo el ideal residual.
     */
    public Polynomial eval(Polynomial expression) {
        return residual.normalForm(solution.apply(expression));
    }

    public DifferentialOperator eval(DifferentialOperator operator) {
        return operator.mapCoefficients(this::eval);
    }

    /**
     * Incógnitas del anillo que la rama no fija (aparezcan o no en el ideal residual).
     */
    public List<Variable> remainingVariables() {
        List<Variable> out = new ArrayList<>();
        for (Variable v : residual.ring().unknowns()) {
            if (!solution.isAssigned(v)) out.add(v);
        }
        return out;
    }

    /**
     * Comprueba si un punto racional (con valor para todas las incógnitas) pertenece a la rama.
     */
    public boolean contains(Map<Integer, Rational> point) {
        for (Variable v : solution.assignedVariables()) {
            Rational expected = solution.valueOf(v).orElseThrow().evaluate(point);
            if (!expected.equals(point.get(v.index()))) return false;
        }
        for (Polynomial g : residual.generators()) {
            if (!g.evaluate(point).isZero()) return false;
        }
        for (Polynomial c : conditions) {
            if (c.evaluate(point).isZero()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Branch#" + index + "[solution=" + solution + ", residual=" + residual + ", conditions=" + conditions + "]";
    }
}
