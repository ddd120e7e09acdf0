package centralizer.domain.operator;

import centralizer.domain.ring.Rational;

import java.math.BigInteger;

/**
 * Coeficientes binomiales generalizados {@code C(α, k) = α(α-1)...(α-k+1) / k!} para α entero,
 * también negativo (necesario para los órdenes negativos de los operadores pseudodiferenciales).
 */
final class Binomials {

    private Binomials() {
    }

    static Rational of(int alpha, int k) {
        if (k < 0) return Rational.ZERO;
        if (alpha >= 0 && k > alpha) return Rational.ZERO;
        BigInteger num = BigInteger.ONE;
        BigInteger den = BigInteger.ONE;
        for (int i = 0; i < k; i++) {
            num = num.multiply(BigInteger.valueOf((long) alpha - i));
            den = den.multiply(BigInteger.valueOf(i + 1L));
        }
        return Rational.of(num, den);
    }
}
