package centralizer.domain.operator;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Operador pseudodiferencial truncado {@code Σ a_k ∂^k}, con k entero (también negativo).
 * <p>
 * Sólo los coeficientes de orden {@code >= precision} son fiables; por debajo de la precisión el
 * operador es desconocido y {@link #coefficient(int)} lo rechaza. La composición propaga la
 * precisión como {@code max(A.prec + B.top, B.prec + A.top)} y usa el binomio generalizado para
 * las potencias negativas: {@code ∂^α · b = Σ_k C(α,k) b^(k) ∂^(α-k)}.
 */
public final class PseudoDifferentialOperator {

    private final PolynomialRing ring;
    private final String symbol;
    private final NavigableMap<Integer, Polynomial> coefficients;
    private final int precision;

    private PseudoDifferentialOperator(PolynomialRing ring, String symbol,
                                       Map<Integer, Polynomial> coefficients, int precision) {
        this.ring = ring;
        this.symbol = symbol;
        this.precision = precision;
        TreeMap<Integer, Polynomial> clean = new TreeMap<>();
        coefficients.forEach((order, c) -> {
            if (order >= precision && !c.isZero()) clean.put(order, c);
        });
        this.coefficients = Collections.unmodifiableNavigableMap(clean);
    }

    public static PseudoDifferentialOperator fromDifferential(DifferentialOperator op, int precision) {
        Map<Integer, Polynomial> c = new TreeMap<>();
        for (int i = 0; i <= op.order(); i++) {
            c.put(i, op.coefficient(i));
        }
        return new PseudoDifferentialOperator(op.ring(), op.symbol(), c, precision);
    }

    /**
     * Raíz n-ésima {@code Q = ∂ + q_0 + q_1 ∂^(-1) + ...} de un operador mónico de orden n,
     * calculada hasta el orden {@code precision} incluido.
     * <p>
     * El coeficiente de orden {@code n-1-k} de {@code Q^n} es {@code n·q_k} más términos que sólo
     * dependen de {@code q_0..q_(k-1)}, así que cada {@code q_k} se despeja en un paso.
     */
    public static PseudoDifferentialOperator nthRoot(DifferentialOperator op, int n, int precision) {
        if (n < 1 || op.order() != n || !op.leadingCoefficient().isOne()) {
            throw new IllegalArgumentException("Se necesita un operador mónico de orden " + n + ": " + op);
        }
        if (precision > 1) {
            throw new IllegalArgumentException("La precisión de la raíz debe ser <= 1: " + precision);
        }
        PolynomialRing ring = op.ring();
        Rational inverseN = Rational.of(1, n);
        Map<Integer, Polynomial> q = new TreeMap<>();
        q.put(1, ring.one());

        for (int k = 0; -k >= precision; k++) {
            PseudoDifferentialOperator current = new PseudoDifferentialOperator(ring, op.symbol(), q, -k);
            int level = n - 1 - k;
            Polynomial known = current.power(n).coefficient(level);
            Polynomial target = op.coefficient(level);
            q.put(-k, target.subtract(known).scale(inverseN));
        }
        return new PseudoDifferentialOperator(ring, op.symbol(), q, precision);
    }

    public PolynomialRing ring() {
        return ring;
    }

    public int precision() {
        return precision;
    }

    /**
     * Mayor orden con coeficiente no nulo.
     */
    public int top() {
        if (coefficients.isEmpty()) {
            throw new IllegalStateException("El operador es cero hasta la precisión " + precision);
        }
        return coefficients.lastKey();
    }

    public boolean isZero() {
        return coefficients.isEmpty();
    }

    public Polynomial coefficient(int order) {
        if (order < precision) {
            throw new IllegalStateException("Orden " + order + " por debajo de la precisión " + precision);
        }
        Polynomial c = coefficients.get(order);
        return c == null ? ring.zero() : c;
    }

    public PseudoDifferentialOperator compose(PseudoDifferentialOperator other) {
        if (other.ring != ring) {
            throw new IllegalArgumentException("Operadores de anillos distintos");
        }
        if (isZero() || other.isZero()) {
            return new PseudoDifferentialOperator(ring, symbol, Map.of(), Math.max(precision, other.precision));
        }
        int resultPrecision = Math.max(precision + other.top(), other.precision + top());
        Map<Integer, Polynomial> out = new TreeMap<>();

        for (Map.Entry<Integer, Polynomial> right : other.coefficients.entrySet()) {
            int beta = right.getKey();
            List<Polynomial> derivatives = new ArrayList<>();
            derivatives.add(right.getValue());
            for (Map.Entry<Integer, Polynomial> left : coefficients.entrySet()) {
                int alpha = left.getKey();
                for (int k = 0; alpha + beta - k >= resultPrecision; k++) {
                    if (alpha >= 0 && k > alpha) break;
                    while (derivatives.size() <= k) {
                        derivatives.add(derivatives.get(derivatives.size() - 1).derivative());
                    }
                    Polynomial bk = derivatives.get(k);
                    if (bk.isZero()) break;
                    Polynomial term = left.getValue().multiply(bk).scale(Binomials.of(alpha, k));
                    out.merge(alpha + beta - k, term, Polynomial::add);
                }
            }
        }
        return new PseudoDifferentialOperator(ring, symbol, out, resultPrecision);
    }

    public PseudoDifferentialOperator power(int exponent) {
        if (exponent < 1) {
            throw new IllegalArgumentException("Sólo se admiten potencias positivas: " + exponent);
        }
        PseudoDifferentialOperator result = this;
        for (int i = 1; i < exponent; i++) {
            result = result.compose(this);
        }
        return result;
    }

    /**
     * Parte diferencial {@code (A)_+}: los términos de orden {@code >= 0}.
     */
    public DifferentialOperator positivePart() {
        if (precision > 0) {
            throw new IllegalStateException("Precisión insuficiente para la parte positiva: " + precision);
        }
        if (isZero()) return DifferentialOperator.zero(ring, symbol);
        List<Polynomial> c = new ArrayList<>();
        for (int i = 0; i <= Math.max(top(), 0); i++) {
            c.add(coefficient(i));
        }
        return DifferentialOperator.of(ring, symbol, c);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Polynomial> e : coefficients.descendingMap().entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append('(').append(e.getValue()).append(")*").append(symbol).append('[').append(e.getKey()).append(']');
        }
        sb.append(" + O(").append(symbol).append('[').append(precision - 1).append("])");
        return sb.toString();
    }
}
