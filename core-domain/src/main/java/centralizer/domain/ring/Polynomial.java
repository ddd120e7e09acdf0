package centralizer.domain.ring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Polinomio disperso e inmutable con coeficientes racionales.
 * <p>
 * Nunca almacena términos nulos, así que el polinomio cero es el mapa vacío. Todas las
 * operaciones binarias exigen que ambos operandos pertenezcan al mismo {@link PolynomialRing}.
 */
public final class Polynomial {

    private static final MonomialOrder DISPLAY_ORDER = MonomialOrder.grevlex();

    private final PolynomialRing ring;
    private final Map<Monomial, Rational> terms;

    Polynomial(PolynomialRing ring, Map<Monomial, Rational> terms) {
        this.ring = ring;
        Map<Monomial, Rational> clean = new HashMap<>(terms.size() * 2);
        terms.forEach((m, c) -> {
            if (!c.isZero()) clean.put(m, c);
        });
        this.terms = Collections.unmodifiableMap(clean);
    }

    public PolynomialRing ring() {
        return ring;
    }

    public Map<Monomial, Rational> terms() {
        return terms;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && terms.keySet().iterator().next().isOne());
    }

    public boolean isOne() {
        return isConstant() && constantValue().isOne();
    }

    /**
     * Valor del término independiente.
     */
    public Rational constantValue() {
        Rational c = terms.get(Monomial.one(ring.variableCount()));
        return c == null ? Rational.ZERO : c;
    }

    public int termCount() {
        return terms.size();
    }

    // --- Aritmética ---

    public Polynomial add(Polynomial other) {
        ring.requireSameRing(other);
        if (other.isZero()) return this;
        if (this.isZero()) return other;
        Map<Monomial, Rational> sum = new HashMap<>(terms);
        other.terms.forEach((m, c) -> sum.merge(m, c, Rational::add));
        return new Polynomial(ring, sum);
    }

    public Polynomial subtract(Polynomial other) {
        ring.requireSameRing(other);
        if (other.isZero()) return this;
        Map<Monomial, Rational> diff = new HashMap<>(terms);
        other.terms.forEach((m, c) -> diff.merge(m, c.negate(), Rational::add));
        return new Polynomial(ring, diff);
    }

    public Polynomial negate() {
        return scale(Rational.MINUS_ONE);
    }

    public Polynomial scale(Rational factor) {
        if (factor.isZero()) return ring.zero();
        if (factor.isOne()) return this;
        Map<Monomial, Rational> out = new HashMap<>(terms.size() * 2);
        terms.forEach((m, c) -> out.put(m, c.multiply(factor)));
        return new Polynomial(ring, out);
    }

    /**
     * Multiplica por el término {@code coefficient * monomial}.
     */
    public Polynomial multiply(Rational coefficient, Monomial monomial) {
        if (coefficient.isZero() || isZero()) return ring.zero();
        Map<Monomial, Rational> out = new HashMap<>(terms.size() * 2);
        terms.forEach((m, c) -> out.put(m.multiply(monomial), c.multiply(coefficient)));
        return new Polynomial(ring, out);
    }

    public Polynomial multiply(Polynomial other) {
        ring.requireSameRing(other);
        if (isZero() || other.isZero()) return ring.zero();
        if (other.isConstant()) return scale(other.constantValue());
        if (this.isConstant()) return other.scale(constantValue());
        Map<Monomial, Rational> out = new HashMap<>();
        for (Map.Entry<Monomial, Rational> a : terms.entrySet()) {
            for (Map.Entry<Monomial, Rational> b : other.terms.entrySet()) {
                out.merge(a.getKey().multiply(b.getKey()), a.getValue().multiply(b.getValue()), Rational::add);
            }
        }
        return new Polynomial(ring, out);
    }

    public Polynomial pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Exponente negativo: " + exponent);
        }
        Polynomial result = ring.one();
        Polynomial base = this;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) result = result.multiply(base);
            e >>= 1;
            if (e > 0) base = base.multiply(base);
        }
        return result;
    }

    // --- Derivación ---

    /**
     * Derivación del anillo: derivada parcial respecto a la variable formal (x' = 1).
     * Sin variable de derivación todo elemento es constante.
     */
    public Polynomial derivative() {
        return ring.derivationVariable()
                .map(v -> derivative(v.index()))
                .orElse(ring.zero());
    }

    public Polynomial derivative(int variable) {
        Map<Monomial, Rational> out = new HashMap<>();
        terms.forEach((m, c) -> {
            int e = m.exponent(variable);
            if (e > 0) {
                int[] exps = m.exponentsView().clone();
                exps[variable] = e - 1;
                out.merge(new Monomial(exps), c.multiply(e), Rational::add);
            }
        });
        return new Polynomial(ring, out);
    }

    // --- Sustitución y evaluación ---

    /**
     * Sustituye simultáneamente cada variable presente en {@code values} (por handle) por su valor.
     * Las variables ausentes del mapa se conservan.
     */
    public Polynomial substitute(Map<Integer, Polynomial> values) {
        if (values.isEmpty() || isZero()) return this;
        boolean touches = false;
        for (Monomial m : terms.keySet()) {
            for (Integer v : values.keySet()) {
                if (m.exponent(v) > 0) {
                    touches = true;
                    break;
                }
            }
            if (touches) break;
        }
        if (!touches) return this;

        Map<Long, Polynomial> powerCache = new HashMap<>();
        Polynomial result = ring.zero();
        for (Map.Entry<Monomial, Rational> t : terms.entrySet()) {
            Monomial m = t.getKey();
            int[] kept = m.exponentsView().clone();
            Polynomial factor = ring.one();
            for (Map.Entry<Integer, Polynomial> s : values.entrySet()) {
                int v = s.getKey();
                int e = m.exponent(v);
                if (e == 0) continue;
                ring.requireSameRing(s.getValue());
                kept[v] = 0;
                long key = ((long) v << 32) | e;
                Polynomial power = powerCache.computeIfAbsent(key, k -> s.getValue().pow(e));
                factor = factor.multiply(power);
            }
            result = result.add(factor.multiply(t.getValue(), new Monomial(kept)));
        }
        return result;
    }

    /**
     * Evaluación completa en un punto racional. Todas las variables usadas deben tener valor.
     */
    public Rational evaluate(Map<Integer, Rational> point) {
        Rational sum = Rational.ZERO;
        for (Map.Entry<Monomial, Rational> t : terms.entrySet()) {
            Rational value = t.getValue();
            int[] exps = t.getKey().exponentsView();
            for (int i = 0; i < exps.length; i++) {
                if (exps[i] == 0) continue;
                Rational x = point.get(i);
                if (x == null) {
                    throw new IllegalArgumentException("Falta valor para la variable " + ring.variable(i));
                }
                value = value.multiply(x.pow(exps[i]));
            }
            sum = sum.add(value);
        }
        return sum;
    }

    /**
     * Descompone el polinomio según las potencias de una variable: {@code p = Σ coef_k * v^k}.
     * Los coeficientes ya no contienen {@code v}.
     */
    public NavigableMap<Integer, Polynomial> coefficientsIn(int variable) {
        Map<Integer, Map<Monomial, Rational>> grouped = new HashMap<>();
        terms.forEach((m, c) -> grouped
                .computeIfAbsent(m.exponent(variable), k -> new HashMap<>())
                .put(m.without(variable), c));
        NavigableMap<Integer, Polynomial> out = new TreeMap<>();
        grouped.forEach((k, t) -> out.put(k, new Polynomial(ring, t)));
        return out;
    }

    // --- Estructura ---

    public int totalDegree() {
        int d = -1;
        for (Monomial m : terms.keySet()) {
            d = Math.max(d, m.degree());
        }
        return d;
    }

    public int degreeIn(int variable) {
        int d = isZero() ? -1 : 0;
        for (Monomial m : terms.keySet()) {
            d = Math.max(d, m.exponent(variable));
        }
        return d;
    }

    public boolean uses(int variable) {
        for (Monomial m : terms.keySet()) {
            if (m.exponent(variable) > 0) return true;
        }
        return false;
    }

    /**
     * Variables que aparecen en algún término, ordenadas por handle.
     */
    public List<Variable> variables() {
        boolean[] used = new boolean[ring.variableCount()];
        for (Monomial m : terms.keySet()) {
            int[] exps = m.exponentsView();
            for (int i = 0; i < exps.length; i++) {
                if (exps[i] > 0) used[i] = true;
            }
        }
        List<Variable> out = new ArrayList<>();
        for (int i = 0; i < used.length; i++) {
            if (used[i]) out.add(ring.variable(i));
        }
        return out;
    }

    public Monomial leadingMonomial(MonomialOrder order) {
        Monomial best = null;
        for (Monomial m : terms.keySet()) {
            if (best == null || order.compare(m, best) > 0) best = m;
        }
        if (best == null) {
            throw new IllegalStateException("El polinomio cero no tiene monomio líder");
        }
        return best;
    }

    public Rational leadingCoefficient(MonomialOrder order) {
        return terms.get(leadingMonomial(order));
    }

    public Rational coefficient(Monomial monomial) {
        Rational c = terms.get(monomial);
        return c == null ? Rational.ZERO : c;
    }

    /**
     * Normaliza el coeficiente líder a 1.
     */
    public Polynomial monic(MonomialOrder order) {
        if (isZero()) return this;
        return scale(leadingCoefficient(order).inverse());
    }

    public List<Monomial> sortedMonomials(MonomialOrder order) {
        List<Monomial> list = new ArrayList<>(terms.keySet());
        list.sort(order.reversed());
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial)) return false;
        Polynomial that = (Polynomial) o;
        return ring == that.ring && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (isZero()) return "0";
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Monomial m : sortedMonomials(DISPLAY_ORDER)) {
            Rational c = terms.get(m);
            boolean negative = c.signum() < 0;
            Rational abs = negative ? c.negate() : c;
            if (first) {
                if (negative) sb.append('-');
            } else {
                sb.append(negative ? " - " : " + ");
            }
            first = false;
            String mono = renderMonomial(m);
            if (mono.isEmpty()) {
                sb.append(abs);
            } else if (abs.isOne()) {
                sb.append(mono);
            } else {
                sb.append(abs).append('*').append(mono);
            }
        }
        return sb.toString();
    }

    private String renderMonomial(Monomial m) {
        Map<String, Integer> parts = new LinkedHashMap<>();
        for (int i = 0; i < m.size(); i++) {
            if (m.exponent(i) > 0) parts.put(ring.variable(i).name(), m.exponent(i));
        }
        StringBuilder sb = new StringBuilder();
        parts.forEach((name, e) -> {
            if (sb.length() > 0) sb.append('*');
            sb.append(name);
            if (e > 1) sb.append('^').append(e);
        });
        return sb.toString();
    }
}
