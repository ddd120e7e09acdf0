package centralizer.domain.analysis;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Variable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Asignación parcial {@code variable -> valor} sobre las incógnitas de un anillo.
 * <p>
 * Invariante: ningún valor menciona una variable asignada (la asignación está cerrada bajo
 * composición). Añadir {@code v = e} sustituye primero la asignación actual en {@code e} y después
 * {@code v = e} en los valores existentes. Inmutable.
 */
public final class PartialSolution {

    private final PolynomialRing ring;
    private final Map<Integer, Polynomial> values;

    private PartialSolution(PolynomialRing ring, Map<Integer, Polynomial> values) {
        this.ring = ring;
        this.values = Collections.unmodifiableMap(values);
    }

    public static PartialSolution empty(PolynomialRing ring) {
        return new PartialSolution(ring, new TreeMap<>());
    }

    /**
     * Construye una asignación validando anillo y variables. Los valores pueden referirse a otras
     * variables asignadas siempre que no haya ciclos: se cierran en orden de handle.
     */
    public static PartialSolution of(PolynomialRing ring, Map<Variable, Polynomial> assignment) {
        PartialSolution solution = empty(ring);
        Map<Variable, Polynomial> sorted = new TreeMap<>((a, b) -> Integer.compare(a.index(), b.index()));
        sorted.putAll(assignment);
        for (Map.Entry<Variable, Polynomial> e : sorted.entrySet()) {
            solution = solution.with(e.getKey(), e.getValue());
        }
        return solution;
    }

    public PartialSolution with(Variable variable, Polynomial value) {
        if (!ring.owns(variable)) {
            throw new IllegalArgumentException("La variable " + variable + " no pertenece a " + ring);
        }
        if (!variable.isUnknown()) {
            throw new IllegalArgumentException("Sólo se pueden asignar incógnitas, no el símbolo " + variable);
        }
        if (value.ring() != ring) {
            throw new IllegalArgumentException("El valor " + value + " pertenece a otro anillo");
        }
        if (values.containsKey(variable.index())) {
            throw new IllegalArgumentException("La variable " + variable + " ya está asignada");
        }
        Polynomial closed = value.substitute(values);
        if (closed.uses(variable.index())) {
            throw new IllegalArgumentException("Asignación cíclica: " + variable + " = " + closed);
        }
        Map<Integer, Polynomial> single = Map.of(variable.index(), closed);
        Map<Integer, Polynomial> next = new TreeMap<>();
        values.forEach((k, v) -> next.put(k, v.substitute(single)));
        next.put(variable.index(), closed);
        return new PartialSolution(ring, next);
    }

    public PolynomialRing ring() {
        return ring;
    }

    public boolean isAssigned(Variable variable) {
        return values.containsKey(variable.index());
    }

    public Optional<Polynomial> valueOf(Variable variable) {
        return Optional.ofNullable(values.get(variable.index()));
    }

    /**
     * Vista por handle, apta para {@link Polynomial#substitute(Map)}.
     */
    public Map<Integer, Polynomial> asSubstitution() {
        return values;
    }

    public List<Variable> assignedVariables() {
        return values.keySet().stream().map(ring::variable).collect(Collectors.toList());
    }

    public Polynomial apply(Polynomial p) {
        return p.substitute(values);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialSolution)) return false;
        PartialSolution that = (PartialSolution) o;
        return ring == that.ring && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> ring.variable(e.getKey()).name() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
