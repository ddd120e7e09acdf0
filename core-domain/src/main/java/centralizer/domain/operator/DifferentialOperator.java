package centralizer.domain.operator;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Operador diferencial lineal {@code a_n ∂^n + ... + a_1 ∂ + a_0} con coeficientes en un
 * {@link PolynomialRing}. La derivación {@code ∂} actúa sobre los coeficientes con la derivación
 * del anillo (d/dx sobre la variable formal, cero sobre las incógnitas).
 * <p>
 * Inmutable. La composición sigue la regla de Leibniz
 * {@code ∂^i · b = Σ_k C(i,k) b^(k) ∂^(i-k)}: asociativa pero no conmutativa.
 */
public final class DifferentialOperator {

    public static final String DEFAULT_SYMBOL = "z";

    private final PolynomialRing ring;
    private final String symbol;
    private final List<Polynomial> coefficients;

    private DifferentialOperator(PolynomialRing ring, String symbol, List<Polynomial> coefficients) {
        this.ring = ring;
        this.symbol = symbol;
        int last = coefficients.size() - 1;
        while (last >= 0 && coefficients.get(last).isZero()) {
            last--;
        }
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(coefficients.subList(0, last + 1)));
    }

    /**
     * @param coefficients Coeficientes indexados por orden: {@code coefficients.get(i)} acompaña a {@code ∂^i}.
     */
    public static DifferentialOperator of(PolynomialRing ring, String symbol, List<Polynomial> coefficients) {
        for (Polynomial c : coefficients) {
            if (c.ring() != ring) {
                throw new IllegalArgumentException("Coeficiente " + c + " fuera del anillo " + ring);
            }
        }
        return new DifferentialOperator(ring, symbol, coefficients);
    }

    public static DifferentialOperator zero(PolynomialRing ring, String symbol) {
        return new DifferentialOperator(ring, symbol, List.of());
    }

    public static DifferentialOperator one(PolynomialRing ring, String symbol) {
        return scalar(ring.one(), symbol);
    }

    public static DifferentialOperator scalar(Polynomial value, String symbol) {
        return new DifferentialOperator(value.ring(), symbol, List.of(value));
    }

    /**
     * El operador {@code ∂^order}.
     */
    public static DifferentialOperator derivation(PolynomialRing ring, String symbol, int order) {
        if (order < 0) {
            throw new IllegalArgumentException("Orden negativo: " + order);
        }
        List<Polynomial> c = new ArrayList<>(Collections.nCopies(order + 1, ring.zero()));
        c.set(order, ring.one());
        return new DifferentialOperator(ring, symbol, c);
    }

    public PolynomialRing ring() {
        return ring;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Orden del operador: índice del coeficiente no nulo más alto ({@code -1} para el operador cero).
     */
    public int order() {
        return coefficients.size() - 1;
    }

    public Polynomial coefficient(int order) {
        if (order < 0 || order >= coefficients.size()) return ring.zero();
        return coefficients.get(order);
    }

    public List<Polynomial> coefficients() {
        return coefficients;
    }

    public Polynomial leadingCoefficient() {
        return isZero() ? ring.zero() : coefficients.get(coefficients.size() - 1);
    }

    public boolean isZero() {
        return coefficients.isEmpty();
    }

    // --- Aritmética ---

    public DifferentialOperator add(DifferentialOperator other) {
        requireCompatible(other);
        int size = Math.max(coefficients.size(), other.coefficients.size());
        List<Polynomial> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(coefficient(i).add(other.coefficient(i)));
        }
        return new DifferentialOperator(ring, symbol, out);
    }

    public DifferentialOperator subtract(DifferentialOperator other) {
        requireCompatible(other);
        int size = Math.max(coefficients.size(), other.coefficients.size());
        List<Polynomial> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(coefficient(i).subtract(other.coefficient(i)));
        }
        return new DifferentialOperator(ring, symbol, out);
    }

    public DifferentialOperator negate() {
        return mapCoefficients(Polynomial::negate);
    }

    /**
     * Producto por la izquierda con un elemento del anillo: {@code p · A}.
     */
    public DifferentialOperator multiply(Polynomial p) {
        if (p.ring() != ring) {
            throw new IllegalArgumentException("Escalar de otro anillo: " + p);
        }
        return mapCoefficients(c -> p.multiply(c));
    }

    /**
     * Composición {@code this ∘ other}.
     */
    public DifferentialOperator compose(DifferentialOperator other) {
        requireCompatible(other);
        if (isZero() || other.isZero()) return zero(ring, symbol);

        int size = order() + other.order() + 1;
        List<Polynomial> out = new ArrayList<>(Collections.nCopies(size, ring.zero()));

        for (int j = 0; j <= other.order(); j++) {
            Polynomial b = other.coefficient(j);
            if (b.isZero()) continue;
            // Derivadas sucesivas de b, hasta el orden de this o hasta anularse.
            List<Polynomial> derivatives = new ArrayList<>();
            derivatives.add(b);
            for (int i = 0; i <= order(); i++) {
                Polynomial a = coefficients.get(i);
                if (a.isZero()) continue;
                for (int k = 0; k <= i; k++) {
                    while (derivatives.size() <= k) {
                        derivatives.add(derivatives.get(derivatives.size() - 1).derivative());
                    }
                    Polynomial bk = derivatives.get(k);
                    if (bk.isZero()) break;
                    Rational binom = Binomials.of(i, k);
                    int target = i + j - k;
                    out.set(target, out.get(target).add(a.multiply(bk).scale(binom)));
                }
            }
        }
        return new DifferentialOperator(ring, symbol, out);
    }

    /**
     * Conmutador {@code [this, other] = this∘other − other∘this}.
     */
    public DifferentialOperator bracket(DifferentialOperator other) {
        return compose(other).subtract(other.compose(this));
    }

    public DifferentialOperator power(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Exponente negativo: " + exponent);
        }
        DifferentialOperator result = one(ring, symbol);
        for (int i = 0; i < exponent; i++) {
            result = result.compose(this);
        }
        return result;
    }

    public DifferentialOperator mapCoefficients(UnaryOperator<Polynomial> f) {
        List<Polynomial> out = new ArrayList<>(coefficients.size());
        for (Polynomial c : coefficients) {
            out.add(f.apply(c));
        }
        return of(ring, symbol, out);
    }

    public DifferentialOperator substitute(Map<Integer, Polynomial> assignment) {
        return mapCoefficients(c -> c.substitute(assignment));
    }

    private void requireCompatible(DifferentialOperator other) {
        if (other.ring != ring) {
            throw new IllegalArgumentException("Operadores de anillos distintos");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DifferentialOperator)) return false;
        DifferentialOperator that = (DifferentialOperator) o;
        return ring == that.ring && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return coefficients.hashCode();
    }

    @Override
    public String toString() {
        if (isZero()) return "0";
        StringBuilder sb = new StringBuilder();
        for (int i = order(); i >= 0; i--) {
            Polynomial c = coefficients.get(i);
            if (c.isZero()) continue;
            if (sb.length() > 0) sb.append(" + ");
            if (i == 0) {
                sb.append(c.termCount() > 1 ? "(" + c + ")" : c.toString());
                continue;
            }
            if (!c.isOne()) {
                sb.append(c.termCount() > 1 ? "(" + c + ")" : c.toString()).append('*');
            }
            sb.append(symbol).append('[').append(i).append(']');
        }
        return sb.toString();
    }
}
