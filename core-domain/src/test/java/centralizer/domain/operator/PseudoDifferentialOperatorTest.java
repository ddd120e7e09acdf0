package centralizer.domain.operator;

import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Raíces n-ésimas truncadas y partes positivas de sus potencias.
 */
class PseudoDifferentialOperatorTest {

    private static final String Z = DifferentialOperator.DEFAULT_SYMBOL;

    private PolynomialRing ring;
    private Polynomial u;
    private DifferentialOperator schrodinger;

    @BeforeEach
    void setUp() {
        PolynomialRing.Builder builder = PolynomialRing.builder();
        builder.unknown("a");
        builder.unknown("b");
        builder.symbol("x");
        ring = builder.build();
        // u = a + b x
        u = ring.gen("a").add(ring.gen("b").multiply(ring.gen("x")));
        schrodinger = DifferentialOperator.of(ring, Z, List.of(u, ring.zero(), ring.one()));
    }

    @Test
    @DisplayName("Q^2 = L hasta la precisión calculada")
    void nthRoot_squared_shouldRecoverOperator() {
        // ACT
        PseudoDifferentialOperator q = PseudoDifferentialOperator.nthRoot(schrodinger, 2, -3);
        PseudoDifferentialOperator square = q.power(2);

        // ASSERT
        assertEquals(1, q.top());
        assertTrue(q.coefficient(0).isZero(), "Forma normal: sin término de orden cero en la raíz");
        for (int order = square.precision(); order <= 2; order++) {
            assertEquals(schrodinger.coefficient(order), square.coefficient(order), "Orden " + order);
        }
    }

    @Test
    @DisplayName("KdV: (L^(3/2))_+ = ∂^3 + 3/2 u ∂ + 3/4 u'")
    void positivePart_shouldGiveKdvOperator() {
        PseudoDifferentialOperator q = PseudoDifferentialOperator.nthRoot(schrodinger, 2, -2);

        DifferentialOperator p3 = q.power(3).positivePart();

        assertEquals(3, p3.order());
        assertEquals(ring.one(), p3.coefficient(3));
        assertTrue(p3.coefficient(2).isZero());
        assertEquals(u.scale(Rational.of(3, 2)), p3.coefficient(1));
        assertEquals(u.derivative().scale(Rational.of(3, 4)), p3.coefficient(0));
    }

    @Test
    @DisplayName("La raíz exige un operador mónico del orden indicado")
    void nthRoot_nonMonic_shouldThrow() {
        DifferentialOperator twice = schrodinger.multiply(ring.constant(2));

        assertThrows(IllegalArgumentException.class, () -> PseudoDifferentialOperator.nthRoot(twice, 2, -1));
        assertThrows(IllegalArgumentException.class, () -> PseudoDifferentialOperator.nthRoot(schrodinger, 3, -1));
    }

    @Test
    @DisplayName("Leer por debajo de la precisión es un error")
    void coefficient_belowPrecision_shouldThrow() {
        PseudoDifferentialOperator q = PseudoDifferentialOperator.nthRoot(schrodinger, 2, -1);

        assertThrows(IllegalStateException.class, () -> q.coefficient(-2));
    }
}
