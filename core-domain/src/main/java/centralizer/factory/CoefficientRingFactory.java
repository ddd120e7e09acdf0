package centralizer.factory;

import centralizer.config.CommutatorConfig;
import centralizer.domain.ring.Monomial;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;
import centralizer.domain.ring.Variable;
import centralizer.exception.DegreeOverflowException;

import java.util.ArrayList;
import java.util.List;

/**
 * Fábrica del anillo de coeficientes y del ansatz polinómico de L.
 * <p>
 * Registra, en este orden y una sola vez:
 * <ol>
 * <li>Las incógnitas del ansatz {@code b_i_j} (fila i = coeficiente {@code u_i}, columna j = potencia de x).</li>
 * <li>Las incógnitas de los huecos de P, {@code c_0 .. c_m}.</li>
 * <li>La variable polinómica {@code x}, sobre la que actúa la derivación.</li>
 * </ol>
 * Tras la construcción el registro queda congelado.
 */
public final class CoefficientRingFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private CoefficientRingFactory() {
    }

    /**
     * Número de incógnitas que registrará el anillo: {@code (n-1)(d+1) + (m+1)}.
     *
     * @throws DegreeOverflowException si el recuento desborda o supera {@code config.maxUnknowns}.
     */
    public static int unknownCount(int orderL, int orderP, int degree, CommutatorConfig config) {
        int count;
        try {
            count = Math.addExact(Math.multiplyExact(orderL - 1, Math.addExact(degree, 1)), Math.addExact(orderP, 1));
        } catch (ArithmeticException e) {
            throw new DegreeOverflowException(String.format(
                    "El número de incógnitas para (n=%d, m=%d, d=%d) desborda", orderL, orderP, degree), e);
        }
        if (count > config.getMaxUnknowns()) {
            throw new DegreeOverflowException(String.format(
                    "Se necesitan %d incógnitas para (n=%d, m=%d, d=%d); el máximo configurado es %d",
                    count, orderL, orderP, degree, config.getMaxUnknowns()));
        }
        return count;
    }

    public static Layout create(int orderL, int orderP, int degree, CommutatorConfig config) {
        unknownCount(orderL, orderP, degree, config);

        PolynomialRing.Builder builder = PolynomialRing.builder();
        List<List<Variable>> ansatz = new ArrayList<>();
        for (int i = 0; i <= orderL - 2; i++) {
            List<Variable> row = new ArrayList<>();
            for (int j = 0; j <= degree; j++) {
                row.add(builder.unknown(config.getAnsatzName() + "_" + i + "_" + j));
            }
            ansatz.add(row);
        }
        List<Variable> flags = new ArrayList<>();
        for (int k = 0; k <= orderP; k++) {
            flags.add(builder.unknown(config.getFlagName() + "_" + k));
        }
        Variable x = builder.symbol(config.getPolynomialVariable());
        PolynomialRing ring = builder.build();

        // u_i = Σ_j b_i_j x^j
        List<Polynomial> coefficients = new ArrayList<>();
        for (List<Variable> row : ansatz) {
            Polynomial u = ring.zero();
            for (int j = 0; j < row.size(); j++) {
                Monomial xj = Monomial.of(ring.variableCount(), x.index(), j);
                u = u.add(ring.gen(row.get(j)).multiply(ring.term(Rational.ONE, xj)));
            }
            coefficients.add(u);
        }
        return new Layout(ring, ansatz, flags, x, coefficients);
    }

    /**
     * Distribución de variables del anillo creado.
     *
     * @param ring         Anillo congelado.
     * @param ansatz       Incógnitas {@code b_i_j} por fila.
     * @param flags        Incógnitas {@code c_k}.
     * @param symbol       Variable polinómica x.
     * @param coefficients Ansatz {@code u_0 .. u_(n-2)} de los coeficientes de L.
     */
    public record Layout(PolynomialRing ring, List<List<Variable>> ansatz, List<Variable> flags,
                         Variable symbol, List<Polynomial> coefficients) {
    }
}
