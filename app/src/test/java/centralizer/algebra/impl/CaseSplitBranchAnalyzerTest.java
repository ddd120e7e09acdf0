package centralizer.algebra.impl;

import centralizer.config.AnalysisConfig;
import centralizer.domain.analysis.Branch;
import centralizer.domain.analysis.BranchHint;
import centralizer.domain.commutator.CommutatorSystem;
import centralizer.domain.ideal.Ideal;
import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;
import centralizer.domain.ring.Variable;
import centralizer.exception.InconsistentAssignmentException;
import centralizer.exception.SearchOverflowException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Árbol de casos sobre ideales pequeños y sobre los sistemas de conmutación de (2, 2), (2, 3) y (2, 4).
 */
@Slf4j
class CaseSplitBranchAnalyzerTest {

    private AlmostCommutingCommutatorBuilder builder;
    private CaseSplitBranchAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        builder = new AlmostCommutingCommutatorBuilder();
        analyzer = new CaseSplitBranchAnalyzer();
    }

    private static Map<Variable, Polynomial> assign(PolynomialRing ring, Object... pairs) {
        Map<Variable, Polynomial> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put(ring.variable((String) pairs[i]), ring.constant((Integer) pairs[i + 1]));
        }
        return out;
    }

    // --------------------------------------------------------------------------
    // Escenarios del sistema de conmutación
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Escenario 1: (2, 2, 0) con c_2 = 1 da una única rama con P = L + c_1 ∂ + c_0")
    void analyze_trivialSystem_shouldGiveSingleBranch() {
        // ARRANGE
        CommutatorSystem system = builder.build(2, 2, 0);
        PolynomialRing ring = system.ring();

        // ACT
        List<Branch> branches = analyzer.analyzeAll(system.ideal(), assign(ring, "c_2", 1), List.of(), ring);

        // ASSERT
        assertEquals(1, branches.size());
        Branch branch = branches.get(0);
        DifferentialOperator p = branch.eval(system.candidate());
        assertEquals(2, p.order());
        assertTrue(p.leadingCoefficient().isOne());
        assertEquals(ring.gen("c_1"), p.coefficient(1));
        assertEquals(ring.gen("b_0_0").add(ring.gen("c_0")), p.coefficient(0));
        assertTrue(branch.eval(system.reference()).bracket(p).isZero());
    }

    @Test
    @DisplayName("Escenario 2: una asignación inicial inconsistente falla antes de ramificar")
    void analyze_inconsistentAssignment_shouldThrowEagerly() {
        CommutatorSystem system = builder.build(2, 3, 1);
        PolynomialRing ring = system.ring();
        Map<Variable, Polynomial> initial = assign(ring, "c_3", 1, "b_0_1", 1);

        assertThrows(InconsistentAssignmentException.class,
                () -> analyzer.analyze(system.ideal(), initial, List.of(), ring));
    }

    @Test
    @DisplayName("Escenario 3: fijar los múltiplos de n da menos ramas que sugerirlos como pistas")
    void analyze_forcedZerosVersusHints() {
        // ARRANGE
        CommutatorSystem system = builder.build(2, 4, 1);
        PolynomialRing ring = system.ring();
        Map<Variable, Polynomial> forced = assign(ring, "c_4", 1, "c_0", 0, "c_2", 0);
        Map<Variable, Polynomial> normalizedOnly = assign(ring, "c_4", 1);
        List<BranchHint> hints = List.of(
                BranchHint.var(ring.variable("c_0"), ring.zero()),
                BranchHint.var(ring.variable("c_2"), ring.zero()));

        // ACT
        List<Branch> withForcedZeros = analyzer.analyzeAll(system.ideal(), forced, hints, ring);
        List<Branch> withHints = analyzer.analyzeAll(system.ideal(), normalizedOnly, hints, ring);

        // ASSERT
        log.info("Ramas con ceros fijados: {}, con pistas: {}", withForcedZeros.size(), withHints.size());
        assertEquals(4, withForcedZeros.size());
        assertEquals(16, withHints.size());
        assertTrue(withForcedZeros.size() < withHints.size());
    }

    @Test
    @DisplayName("Orden estable de descubrimiento: primero v = 0, después v ≠ 0")
    void analyze_shouldFollowDepthFirstOrder() {
        CommutatorSystem system = builder.build(2, 4, 1);
        PolynomialRing ring = system.ring();
        Variable b0 = ring.variable("b_0_0");
        Variable b1 = ring.variable("b_0_1");

        List<Branch> branches = analyzer.analyzeAll(system.ideal(), assign(ring, "c_4", 1, "c_0", 0, "c_2", 0), List.of(), ring);

        for (int i = 0; i < branches.size(); i++) {
            assertEquals(i, branches.get(i).index());
        }
        // 1: b0 = 0, b1 = 0   2: b0 = 0, b1 ≠ 0   3: b0 ≠ 0, b1 = 0   4: b0 ≠ 0, b1 ≠ 0
        assertEquals(Optional.of(ring.zero()), branches.get(0).solution().valueOf(b0));
        assertEquals(Optional.of(ring.zero()), branches.get(0).solution().valueOf(b1));
        assertEquals(Optional.of(ring.zero()), branches.get(1).solution().valueOf(b0));
        assertFalse(branches.get(1).solution().isAssigned(b1));
        assertEquals(Optional.of(ring.zero()), branches.get(1).solution().valueOf(ring.variable("c_1")));
        assertFalse(branches.get(2).solution().isAssigned(b0));
        assertEquals(List.of(ring.gen(b0)), branches.get(2).conditions());
        assertEquals(Optional.of(ring.zero()), branches.get(3).solution().valueOf(ring.variable("c_3")));

        // Mismo resultado en una segunda ejecución
        List<Branch> again = analyzer.analyzeAll(system.ideal(), assign(ring, "c_4", 1, "c_0", 0, "c_2", 0), List.of(), ring);
        assertEquals(branches.stream().map(b -> b.solution().toString()).collect(Collectors.toList()),
                again.stream().map(b -> b.solution().toString()).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Corrección: todo generador de H se anula en cada rama; eval es idempotente")
    void analyze_branchesShouldBeSound() {
        CommutatorSystem system = builder.build(2, 3, 1);
        PolynomialRing ring = system.ring();

        List<Branch> branches = analyzer.analyzeAll(system.ideal(), assign(ring, "c_3", 1), List.of(), ring);

        assertFalse(branches.isEmpty());
        for (Branch branch : branches) {
            for (Polynomial h : system.ideal().generators()) {
                assertTrue(branch.eval(h).isZero(), "El generador " + h + " no se anula en " + branch);
            }
            DifferentialOperator p = branch.eval(system.candidate());
            assertEquals(p, branch.eval(p));
            assertTrue(branch.eval(system.bracket()).isZero());
        }
    }

    // --------------------------------------------------------------------------
    // Ideales pequeños
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Partición: (ab) se divide en {a = 0} y {a ≠ 0, b = 0}")
    void analyze_shouldPartitionVariety() {
        // ARRANGE
        PolynomialRing.Builder rb = PolynomialRing.builder();
        Variable a = rb.unknown("a");
        Variable b = rb.unknown("b");
        PolynomialRing ring = rb.build();
        Ideal ideal = Ideal.of(ring, ring.gen(a).multiply(ring.gen(b)));

        // ACT
        List<Branch> branches = analyzer.analyzeAll(ideal, Map.of(), List.of(), ring);

        // ASSERT
        assertEquals(2, branches.size());
        List<Map<Integer, Rational>> varietyPoints = List.of(
                Map.of(a.index(), Rational.ZERO, b.index(), Rational.ZERO),
                Map.of(a.index(), Rational.ZERO, b.index(), Rational.of(5)),
                Map.of(a.index(), Rational.of(-3, 2), b.index(), Rational.ZERO));
        for (Map<Integer, Rational> point : varietyPoints) {
            long matches = branches.stream().filter(br -> br.contains(point)).count();
            assertEquals(1, matches, "Cada punto de la variedad pertenece a exactamente una rama: " + point);
        }
        Map<Integer, Rational> outside = Map.of(a.index(), Rational.ONE, b.index(), Rational.ONE);
        assertTrue(branches.stream().noneMatch(br -> br.contains(outside)));
    }

    @Test
    @DisplayName("Partición con pista no constante: (c²) con la pista c = a + 1 no repite puntos")
    void analyze_nonConstantHint_shouldKeepBranchesDisjoint() {
        // ARRANGE
        PolynomialRing.Builder rb = PolynomialRing.builder();
        Variable a = rb.unknown("a");
        Variable c = rb.unknown("c");
        PolynomialRing ring = rb.build();
        Ideal ideal = Ideal.of(ring, ring.gen(c).pow(2));
        List<BranchHint> hints = List.of(BranchHint.var(c, ring.gen(a).add(ring.one())));

        // ACT
        List<Branch> branches = analyzer.analyzeAll(ideal, Map.of(), hints, ring);

        // ASSERT
        log.info("Ramas con pista no constante: {}", branches);
        assertEquals(2, branches.size());
        assertEquals(Optional.of(ring.constant(-1)), branches.get(0).solution().valueOf(a));
        assertEquals(Optional.of(ring.zero()), branches.get(1).solution().valueOf(c));
        assertFalse(branches.get(1).conditions().isEmpty());
        for (Rational value : List.of(Rational.of(-1), Rational.ZERO, Rational.of(2), Rational.of(1, 2))) {
            Map<Integer, Rational> point = Map.of(a.index(), value, c.index(), Rational.ZERO);
            long matches = branches.stream().filter(br -> br.contains(point)).count();
            assertEquals(1, matches, "Cada punto de la variedad pertenece a exactamente una rama: " + point);
        }
        Map<Integer, Rational> outside = Map.of(a.index(), Rational.ZERO, c.index(), Rational.ONE);
        assertTrue(branches.stream().noneMatch(br -> br.contains(outside)));
    }

    @Test
    @DisplayName("Una pista cuyo valor acaba mencionando su propia variable divide con el valor 0")
    void analyze_selfReferencingHint_shouldFallBackToZero() {
        // ARRANGE: b = a hace que la pista a = b se lea como a = a
        PolynomialRing.Builder rb = PolynomialRing.builder();
        Variable a = rb.unknown("a");
        Variable b = rb.unknown("b");
        PolynomialRing ring = rb.build();
        Polynomial pa = ring.gen(a);
        Ideal ideal = Ideal.of(ring, pa.pow(2).subtract(pa));
        Map<Variable, Polynomial> initial = Map.of(b, pa);
        List<BranchHint> hints = List.of(BranchHint.var(a, ring.gen(b)));

        // ACT
        List<Branch> branches = analyzer.analyzeAll(ideal, initial, hints, ring);

        // ASSERT
        assertEquals(2, branches.size());
        assertEquals(Optional.of(ring.zero()), branches.get(0).solution().valueOf(a));
        assertEquals(Optional.of(ring.one()), branches.get(1).solution().valueOf(a));
        assertEquals(Optional.of(ring.one()), branches.get(1).solution().valueOf(b));
    }

    @Test
    @DisplayName("El residuo de cada rama es la saturación de H sustituido por sus condiciones")
    void analyze_residualShouldMatchLocalizedIdeal() {
        // ARRANGE
        CommutatorSystem system = builder.build(2, 4, 1);
        PolynomialRing ring = system.ring();

        // ACT
        List<Branch> branches = analyzer.analyzeAll(system.ideal(), assign(ring, "c_4", 1, "c_0", 0, "c_2", 0), List.of(), ring);

        // ASSERT
        for (Branch branch : branches) {
            List<Polynomial> substituted = system.ideal().generators().stream()
                    .map(g -> branch.solution().apply(g))
                    .collect(Collectors.toList());
            Polynomial multiplier = branch.conditions().stream().reduce(ring.one(), Polynomial::multiply);
            assertEquals(Ideal.saturation(ring, substituted, multiplier), branch.residual(),
                    "Residuo inesperado en " + branch);
        }
    }

    @Test
    @DisplayName("Las raíces racionales de un polinomio univariante son candidatos de división")
    void analyze_shouldSplitOnRationalRoots() {
        PolynomialRing.Builder rb = PolynomialRing.builder();
        Variable a = rb.unknown("a");
        rb.unknown("b");
        PolynomialRing ring = rb.build();
        Polynomial pa = ring.gen(a);
        Ideal ideal = Ideal.of(ring, pa.pow(3).subtract(pa));

        List<Branch> branches = analyzer.analyzeAll(ideal, Map.of(), List.of(), ring);

        List<Polynomial> values = branches.stream()
                .map(br -> br.solution().valueOf(a).orElseThrow())
                .collect(Collectors.toList());
        assertEquals(List.of(ring.zero(), ring.constant(-1), ring.one()), values);
        assertTrue(branches.stream().allMatch(br -> br.residual().isZero()));
    }

    @Test
    @DisplayName("Propagación: una ecuación lineal con coeficiente constante no ramifica")
    void analyze_linearEquation_shouldBeForced() {
        PolynomialRing.Builder rb = PolynomialRing.builder();
        Variable a = rb.unknown("a");
        Variable b = rb.unknown("b");
        PolynomialRing ring = rb.build();
        Ideal ideal = Ideal.of(ring, ring.gen(a).scale(Rational.of(2)).subtract(ring.gen(b)).add(ring.one()));

        List<Branch> branches = analyzer.analyzeAll(ideal, Map.of(), List.of(), ring);

        assertEquals(1, branches.size());
        assertEquals(List.of(b), branches.get(0).remainingVariables());
        assertEquals(ring.gen(b).subtract(ring.one()).scale(Rational.of(1, 2)),
                branches.get(0).solution().valueOf(a).orElseThrow());
    }

    @Test
    @DisplayName("La secuencia es perezosa: la primera rama llega antes de agotar el límite de nodos")
    void analyze_shouldBeLazy() {
        CommutatorSystem system = builder.build(2, 4, 1);
        PolynomialRing ring = system.ring();
        List<BranchHint> hints = List.of(
                BranchHint.var(ring.variable("c_0"), ring.zero()),
                BranchHint.var(ring.variable("c_2"), ring.zero()));
        CaseSplitBranchAnalyzer tight = new CaseSplitBranchAnalyzer(AnalysisConfig.defaults().withMaxNodes(5));

        Optional<Branch> first = tight.analyze(system.ideal(), assign(ring, "c_4", 1), hints, ring).findFirst();

        assertTrue(first.isPresent());
        assertThrows(SearchOverflowException.class,
                () -> tight.analyzeAll(system.ideal(), assign(ring, "c_4", 1), hints, ring));
    }

    @Test
    @DisplayName("Salvaguarda de profundidad: SearchOverflowException")
    void analyze_depthGuard_shouldThrow() {
        CommutatorSystem system = builder.build(2, 3, 1);
        PolynomialRing ring = system.ring();
        CaseSplitBranchAnalyzer shallow = new CaseSplitBranchAnalyzer(AnalysisConfig.defaults().withMaxDepth(0));

        assertThrows(SearchOverflowException.class,
                () -> shallow.analyzeAll(system.ideal(), assign(ring, "c_3", 1), List.of(), ring));
    }

    @Test
    @DisplayName("Validación de entradas: anillo ajeno y pistas sobre el símbolo formal")
    void analyze_invalidInput_shouldThrow() {
        CommutatorSystem system = builder.build(2, 2, 0);
        CommutatorSystem other = builder.build(2, 2, 0);
        PolynomialRing ring = system.ring();
        Variable x = ring.derivationVariable().orElseThrow();

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(system.ideal(), Map.of(), List.of(), other.ring()));
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(system.ideal(), Map.of(), List.of(BranchHint.var(x, ring.zero())), ring));
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(system.ideal(), Map.of(ring.variable("c_1"), other.ring().one()), List.of(), ring));
    }
}
