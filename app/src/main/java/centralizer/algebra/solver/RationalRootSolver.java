package centralizer.algebra.solver;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.Rational;
import centralizer.domain.ring.Variable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeSet;

/**
 * Raíces racionales de un polinomio univariante con coeficientes racionales.
 * <p>
 * Criterio de la raíz racional: tras quitar denominadores, toda raíz {@code p/q} cumple que
 * {@code p} divide al término independiente y {@code q} al coeficiente líder. Los divisores se
 * enumeran por división de prueba, suficiente para los tamaños de coeficiente que aparecen en los
 * sistemas de conmutación.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class RationalRootSolver {

    /**
     * Por encima de este valor absoluto no se enumeran divisores: sólo se prueba el divisor 1.
     */
    private static final BigInteger MAX_DIVISOR_SEARCH = BigInteger.valueOf(1_000_000L);

    private RationalRootSolver() {}

    /**
     * Raíces racionales distintas de {@code p} en la variable {@code v}, en orden ascendente.
     *
     * @throws IllegalArgumentException si {@code p} usa otra variable además de {@code v}.
     */
    public static List<Rational> roots(Polynomial p, Variable v) {
        for (Variable used : p.variables()) {
            if (used.index() != v.index()) {
                throw new IllegalArgumentException("El polinomio " + p + " no es univariante en " + v.name());
            }
        }
        if (p.isZero() || p.isConstant()) return List.of();

        NavigableMap<Integer, Polynomial> byPower = p.coefficientsIn(v.index());
        int degree = byPower.lastKey();
        int lowest = byPower.firstKey();

        // 1. Coeficientes enteros a_0..a_n (sin denominadores)
        BigInteger lcm = BigInteger.ONE;
        for (Polynomial c : byPower.values()) {
            BigInteger den = c.constantValue().denominator();
            lcm = lcm.divide(lcm.gcd(den)).multiply(den);
        }
        BigInteger[] a = new BigInteger[degree + 1];
        for (int k = 0; k <= degree; k++) {
            Polynomial c = byPower.get(k);
            Rational value = c == null ? Rational.ZERO : c.constantValue();
            a[k] = value.numerator().multiply(lcm.divide(value.denominator()));
        }

        TreeSet<Rational> roots = new TreeSet<>();
        // 2. Raíz cero si falta término independiente
        if (lowest > 0) roots.add(Rational.ZERO);
        if (degree == lowest) return new ArrayList<>(roots);

        // 3. Candidatos ±p/q del polinomio deflactado
        List<BigInteger> pDivisors = divisors(a[lowest].abs());
        List<BigInteger> qDivisors = divisors(a[degree].abs());
        for (BigInteger num : pDivisors) {
            for (BigInteger den : qDivisors) {
                Rational candidate = Rational.of(num, den);
                if (isRoot(a, lowest, candidate)) roots.add(candidate);
                if (isRoot(a, lowest, candidate.negate())) roots.add(candidate.negate());
            }
        }
        return new ArrayList<>(roots);
    }

    private static boolean isRoot(BigInteger[] a, int lowest, Rational x) {
        // Horner
        Rational acc = Rational.ZERO;
        for (int k = a.length - 1; k >= lowest; k--) {
            acc = acc.multiply(x).add(Rational.of(a[k], BigInteger.ONE));
        }
        return acc.isZero();
    }

    private static List<BigInteger> divisors(BigInteger n) {
        List<BigInteger> out = new ArrayList<>();
        if (n.signum() == 0 || n.compareTo(MAX_DIVISOR_SEARCH) > 0) {
            if (n.signum() != 0) out.add(BigInteger.ONE);
            return out;
        }
        long value = n.longValueExact();
        for (long d = 1; d * d <= value; d++) {
            if (value % d == 0) {
                out.add(BigInteger.valueOf(d));
                if (d != value / d) out.add(BigInteger.valueOf(value / d));
            }
        }
        return out;
    }

    /**
     * Busca en una lista de polinomios el primero univariante en {@code v} y devuelve sus raíces.
     */
    public static List<Rational> rootsFromFirstUnivariate(List<Polynomial> polynomials, Variable v) {
        for (Polynomial p : polynomials) {
            if (p.isConstant() || !p.uses(v.index())) continue;
            List<Variable> used = p.variables();
            if (used.size() == 1) {
                return roots(p, v);
            }
        }
        return List.of();
    }
}
