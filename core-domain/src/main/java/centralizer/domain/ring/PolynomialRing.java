package centralizer.domain.ring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Anillo conmutativo de polinomios sobre {@link Rational}.
 * <p>
 * El registro de variables se construye con {@link Builder} (sólo se puede añadir) y queda
 * congelado al llamar a {@link Builder#build()}. A partir de ese momento el anillo es inmutable
 * y puede compartirse entre el constructor del conmutador, el analizador y todas las ramas.
 * <p>
 * Como mucho una variable tiene el papel {@link Variable.Role#SYMBOL}: es la variable sobre la que
 * actúa la derivación (x' = 1); las incógnitas son constantes para la derivación.
 */
public final class PolynomialRing {

    private final List<Variable> variables;
    private final Map<String, Variable> byName;
    private final Variable derivationVariable;
    private final PolynomialRing parent;

    private final Polynomial zero;
    private final Polynomial one;

    private PolynomialRing(List<Variable> variables, PolynomialRing parent) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        Map<String, Variable> names = new LinkedHashMap<>();
        Variable symbol = null;
        for (Variable v : variables) {
            names.put(v.name(), v);
            if (v.role() == Variable.Role.SYMBOL) {
                symbol = v;
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.derivationVariable = symbol;
        this.parent = parent;
        this.zero = new Polynomial(this, Map.of());
        this.one = new Polynomial(this, Map.of(Monomial.one(variables.size()), Rational.ONE));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int variableCount() {
        return variables.size();
    }

    public List<Variable> variables() {
        return variables;
    }

    public Variable variable(int index) {
        return variables.get(index);
    }

    public Variable variable(String name) {
        Variable v = byName.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Variable desconocida en el anillo: " + name);
        }
        return v;
    }

    public Optional<Variable> findVariable(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean owns(Variable variable) {
        return variable.index() < variables.size() && variables.get(variable.index()).equals(variable);
    }

    public List<Variable> unknowns() {
        List<Variable> out = new ArrayList<>();
        for (Variable v : variables) {
            if (v.isUnknown()) out.add(v);
        }
        return out;
    }

    public Optional<Variable> derivationVariable() {
        return Optional.ofNullable(derivationVariable);
    }

    /**
     * Anillo del que éste es una extensión temporal, si lo es.
     */
    public Optional<PolynomialRing> parent() {
        return Optional.ofNullable(parent);
    }

    // --- Constructores de elementos ---

    public Polynomial zero() {
        return zero;
    }

    public Polynomial one() {
        return one;
    }

    public Polynomial constant(Rational value) {
        if (value.isZero()) return zero;
        return new Polynomial(this, Map.of(Monomial.one(variables.size()), value));
    }

    public Polynomial constant(long value) {
        return constant(Rational.of(value));
    }

    public Polynomial gen(Variable variable) {
        requireOwned(variable);
        return new Polynomial(this, Map.of(Monomial.of(variables.size(), variable.index(), 1), Rational.ONE));
    }

    public Polynomial gen(String name) {
        return gen(variable(name));
    }

    public Polynomial term(Rational coefficient, Monomial monomial) {
        if (monomial.size() != variables.size()) {
            throw new IllegalArgumentException("El monomio no pertenece a este anillo");
        }
        if (coefficient.isZero()) return zero;
        return new Polynomial(this, Map.of(monomial, coefficient));
    }

    // --- Extensiones temporales ---

    /**
     * Crea un anillo nuevo con una incógnita auxiliar añadida al final del registro.
     * Este anillo no se modifica; los polinomios se trasladan con {@link PolynomialRing#embed}
     * y se devuelven con {@link PolynomialRing#restrict}.
     */
    public PolynomialRing extend(String auxiliaryName) {
        if (byName.containsKey(auxiliaryName)) {
            throw new IllegalArgumentException("La variable auxiliar ya existe en el anillo: " + auxiliaryName);
        }
        List<Variable> extended = new ArrayList<>(variables);
        extended.add(new Variable(variables.size(), auxiliaryName, Variable.Role.UNKNOWN));
        return new PolynomialRing(extended, this);
    }

    /**
     * Traslada un polinomio de un anillo padre a esta extensión.
     */
    public Polynomial embed(Polynomial p) {
        if (p.ring() == this) return p;
        if (parent != p.ring()) {
            throw new IllegalArgumentException("El polinomio no pertenece al anillo base de esta extensión");
        }
        Map<Monomial, Rational> terms = new LinkedHashMap<>();
        p.terms().forEach((m, c) -> terms.put(m.resize(variables.size()), c));
        return new Polynomial(this, terms);
    }

    /**
     * Devuelve al anillo padre un polinomio de esta extensión que no usa las variables auxiliares.
     */
    public Polynomial restrict(Polynomial p) {
        if (parent == null) {
            throw new IllegalStateException("El anillo no es una extensión");
        }
        requireSameRing(p);
        Map<Monomial, Rational> terms = new LinkedHashMap<>();
        p.terms().forEach((m, c) -> terms.put(m.resize(parent.variableCount()), c));
        return new Polynomial(parent, terms);
    }

    void requireOwned(Variable variable) {
        if (!owns(variable)) {
            throw new IllegalArgumentException("La variable " + variable + " no pertenece a este anillo");
        }
    }

    void requireSameRing(Polynomial p) {
        if (p.ring() != this) {
            throw new IllegalArgumentException("El polinomio " + p + " pertenece a otro anillo");
        }
    }

    @Override
    public String toString() {
        return "Q[" + String.join(", ", byName.keySet()) + "]";
    }

    /**
     * Registro de variables en construcción. Sólo permite añadir.
     */
    public static final class Builder {

        private final List<Variable> variables = new ArrayList<>();
        private final Map<String, Variable> names = new LinkedHashMap<>();
        private boolean hasSymbol;
        private boolean built;

        private Builder() {
        }

        public Variable unknown(String name) {
            return register(name, Variable.Role.UNKNOWN);
        }

        /**
         * Registra la variable formal sobre la que actúa la derivación. Sólo puede haber una.
         */
        public Variable symbol(String name) {
            if (hasSymbol) {
                throw new IllegalStateException("El anillo ya tiene una variable de derivación");
            }
            hasSymbol = true;
            return register(name, Variable.Role.SYMBOL);
        }

        public int size() {
            return variables.size();
        }

        public PolynomialRing build() {
            if (built) {
                throw new IllegalStateException("El registro de variables ya fue congelado");
            }
            built = true;
            return new PolynomialRing(variables, null);
        }

        private Variable register(String name, Variable.Role role) {
            if (built) {
                throw new IllegalStateException("El registro de variables ya fue congelado");
            }
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Nombre de variable vacío");
            }
            if (names.containsKey(name)) {
                throw new IllegalArgumentException("Nombre de variable duplicado: " + name);
            }
            Variable v = new Variable(variables.size(), name, role);
            variables.add(v);
            names.put(name, v);
            return v;
        }
    }
}
