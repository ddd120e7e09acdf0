package centralizer.domain.ring;

import java.util.Arrays;

/**
 * Producto de potencias de variables, indexado por el handle de cada variable.
 * Inmutable; el vector de exponentes tiene la longitud del anillo al que pertenece.
 */
public final class Monomial {

    private final int[] exponents;
    private final int degree;
    private final int hash;

    Monomial(int[] exponents) {
        this.exponents = exponents;
        int d = 0;
        for (int e : exponents) {
            d += e;
        }
        this.degree = d;
        this.hash = Arrays.hashCode(exponents);
    }

    public static Monomial one(int variableCount) {
        return new Monomial(new int[variableCount]);
    }

    public static Monomial of(int variableCount, int variable, int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Exponente negativo: " + exponent);
        }
        int[] e = new int[variableCount];
        e[variable] = exponent;
        return new Monomial(e);
    }

    public int size() {
        return exponents.length;
    }

    public int exponent(int variable) {
        return exponents[variable];
    }

    public int degree() {
        return degree;
    }

    public boolean isOne() {
        return degree == 0;
    }

    public Monomial multiply(Monomial other) {
        int[] e = new int[exponents.length];
        for (int i = 0; i < e.length; i++) {
            e[i] = exponents[i] + other.exponents[i];
        }
        return new Monomial(e);
    }

    public boolean divides(Monomial other) {
        for (int i = 0; i < exponents.length; i++) {
            if (exponents[i] > other.exponents[i]) return false;
        }
        return true;
    }

    /**
     * Cociente exacto {@code this / divisor}. Requiere {@code divisor.divides(this)}.
     */
    public Monomial divide(Monomial divisor) {
        int[] e = new int[exponents.length];
        for (int i = 0; i < e.length; i++) {
            e[i] = exponents[i] - divisor.exponents[i];
            if (e[i] < 0) {
                throw new IllegalArgumentException("El monomio no es divisible");
            }
        }
        return new Monomial(e);
    }

    public Monomial lcm(Monomial other) {
        int[] e = new int[exponents.length];
        for (int i = 0; i < e.length; i++) {
            e[i] = Math.max(exponents[i], other.exponents[i]);
        }
        return new Monomial(e);
    }

    public boolean isCoprimeWith(Monomial other) {
        for (int i = 0; i < exponents.length; i++) {
            if (exponents[i] > 0 && other.exponents[i] > 0) return false;
        }
        return true;
    }

    /**
     * Misma potencia con la variable indicada eliminada (exponente a cero).
     */
    public Monomial without(int variable) {
        if (exponents[variable] == 0) return this;
        int[] e = exponents.clone();
        e[variable] = 0;
        return new Monomial(e);
    }

    /**
     * Cambia la longitud del vector de exponentes (extensión o restricción de anillo).
     * Al restringir, las posiciones eliminadas deben tener exponente cero.
     */
    public Monomial resize(int variableCount) {
        for (int i = variableCount; i < exponents.length; i++) {
            if (exponents[i] != 0) {
                throw new IllegalArgumentException("El monomio usa la variable " + i + " fuera del anillo destino");
            }
        }
        return new Monomial(Arrays.copyOf(exponents, variableCount));
    }

    int[] exponentsView() {
        return exponents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Monomial)) return false;
        Monomial that = (Monomial) o;
        return hash == that.hash && Arrays.equals(exponents, that.exponents);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(exponents);
    }
}
