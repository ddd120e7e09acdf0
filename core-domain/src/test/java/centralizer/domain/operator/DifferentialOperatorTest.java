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
 * Álgebra de operadores diferenciales: regla de Leibniz y conmutadores.
 */
class DifferentialOperatorTest {

    private static final String Z = DifferentialOperator.DEFAULT_SYMBOL;

    private PolynomialRing ring;
    private Polynomial x;
    private Polynomial a;

    @BeforeEach
    void setUp() {
        PolynomialRing.Builder builder = PolynomialRing.builder();
        builder.unknown("a");
        builder.symbol("x");
        ring = builder.build();
        x = ring.gen("x");
        a = ring.gen("a");
    }

    @Test
    @DisplayName("Relación canónica: [∂, x] = 1")
    void bracket_derivationAndX_shouldBeOne() {
        DifferentialOperator d = DifferentialOperator.derivation(ring, Z, 1);
        DifferentialOperator mx = DifferentialOperator.scalar(x, Z);

        assertEquals(DifferentialOperator.one(ring, Z), d.bracket(mx));
        assertEquals(DifferentialOperator.one(ring, Z).negate(), mx.bracket(d));
    }

    @Test
    @DisplayName("Leibniz: ∂^2 · x^3 = x^3 ∂^2 + 6x^2 ∂ + 6x")
    void compose_shouldFollowLeibniz() {
        DifferentialOperator d2 = DifferentialOperator.derivation(ring, Z, 2);
        DifferentialOperator cube = DifferentialOperator.scalar(x.pow(3), Z);

        DifferentialOperator result = d2.compose(cube);

        assertEquals(2, result.order());
        assertEquals(x.pow(3), result.coefficient(2));
        assertEquals(x.pow(2).scale(Rational.of(6)), result.coefficient(1));
        assertEquals(x.scale(Rational.of(6)), result.coefficient(0));
    }

    @Test
    @DisplayName("Las incógnitas son constantes para la derivación: [∂, a] = 0")
    void bracket_withUnknown_shouldVanish() {
        DifferentialOperator d = DifferentialOperator.derivation(ring, Z, 3);

        assertTrue(d.bracket(DifferentialOperator.scalar(a, Z)).isZero());
    }

    @Test
    @DisplayName("La composición es asociativa")
    void compose_shouldBeAssociative() {
        DifferentialOperator p = DifferentialOperator.of(ring, Z, List.of(x, a, ring.one()));
        DifferentialOperator q = DifferentialOperator.of(ring, Z, List.of(a.multiply(x), x.pow(2)));
        DifferentialOperator r = DifferentialOperator.of(ring, Z, List.of(ring.one(), ring.zero(), x));

        assertEquals(p.compose(q).compose(r), p.compose(q.compose(r)));
    }

    @Test
    @DisplayName("Orden, coeficientes y potencia")
    void structure_shouldBeConsistent() {
        DifferentialOperator d = DifferentialOperator.derivation(ring, Z, 1);

        assertEquals(DifferentialOperator.derivation(ring, Z, 3), d.power(3));
        assertEquals(-1, DifferentialOperator.zero(ring, Z).order());
        assertTrue(DifferentialOperator.of(ring, Z, List.of(ring.zero(), ring.zero())).isZero());
        assertEquals(ring.zero(), d.coefficient(7));
        assertEquals("z[2] + (a + x)", DifferentialOperator.of(ring, Z, List.of(a.add(x), ring.zero(), ring.one())).toString());
    }

    @Test
    @DisplayName("Binomio generalizado para exponentes negativos")
    void binomials_shouldSupportNegativeAlpha() {
        assertEquals(Rational.of(1), Binomials.of(-1, 2));
        assertEquals(Rational.of(-1), Binomials.of(-1, 1));
        assertEquals(Rational.of(3), Binomials.of(-2, 2));
        assertEquals(Rational.of(10), Binomials.of(5, 2));
        assertEquals(Rational.ZERO, Binomials.of(2, 3));
    }
}
