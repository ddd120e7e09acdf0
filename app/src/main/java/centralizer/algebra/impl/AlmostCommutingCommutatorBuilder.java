package centralizer.algebra.impl;

import centralizer.algebra.i.ICommutatorBuilder;
import centralizer.algebra.solver.AlmostCommutingBasis;
import centralizer.config.CommutatorConfig;
import centralizer.domain.commutator.CommutatorSystem;
import centralizer.domain.ideal.Ideal;
import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.exception.InvalidOrderException;
import centralizer.factory.CoefficientRingFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Constructor del sistema de conmutación para un L genérico en forma normal.
 * <p>
 * Pasos:
 * <ol>
 * <li>Anillo de coeficientes con el ansatz {@code u_i = Σ b_i_j x^j} y los huecos {@code c_k}.</li>
 * <li>{@code L = ∂^n + u_(n-2) ∂^(n-2) + ... + u_0} (líder 1, sin término {@code ∂^(n-1)}).</li>
 * <li>{@code P = Σ c_k P_k} sobre la base casi conmutante {@code P_k = (L^(k/n))_+}.</li>
 * <li>{@code [L, P]}: cada coeficiente se separa por potencias de x y cada parte no nula es un
 * generador de H.</li>
 * </ol>
 * La expansión del conmutador domina el coste; se mide y se devuelve en el resultado.
 */
@Slf4j
public class AlmostCommutingCommutatorBuilder implements ICommutatorBuilder {

    private final CommutatorConfig config;

    public AlmostCommutingCommutatorBuilder() {
        this(CommutatorConfig.defaults());
    }

    public AlmostCommutingCommutatorBuilder(CommutatorConfig config) {
        this.config = config;
    }

    @Override
    public CommutatorSystem build(int orderL, int orderP, int degree) {
        if (orderL < 1 || orderP < orderL || degree < 0) {
            throw InvalidOrderException.of(orderL, orderP, degree);
        }
        long startTime = System.currentTimeMillis();
        log.debug("Calculando ecuaciones de conmutación para L_{} hasta orden {} y grado {}", orderL, orderP, degree);

        // 1. Anillo y ansatz
        CoefficientRingFactory.Layout layout = CoefficientRingFactory.create(orderL, orderP, degree, config);
        PolynomialRing ring = layout.ring();
        String symbol = config.getOperatorSymbol();
        log.debug("Anillo de coeficientes: {}", ring);

        // 2. Operador de referencia en forma normal
        DifferentialOperator reference = normalForm(ring, symbol, orderL, layout.coefficients());
        log.debug("L = {}", reference);

        // 3. Base casi conmutante y operador genérico
        List<DifferentialOperator> basis = AlmostCommutingBasis.compute(reference, orderP);
        DifferentialOperator candidate = DifferentialOperator.zero(ring, symbol);
        for (int k = 0; k <= orderP; k++) {
            candidate = candidate.add(basis.get(k).multiply(ring.gen(layout.flags().get(k))));
        }
        log.debug("P genérico de orden {} construido", candidate.order());

        // 4. Conmutador y extracción de ecuaciones
        DifferentialOperator bracket = reference.bracket(candidate);
        List<Polynomial> equations = extractEquations(bracket, layout.symbol().index());
        Ideal ideal = Ideal.of(ring, equations);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Sistema de conmutación (n={}, m={}, d={}) construido: {} ecuaciones en {} incógnitas ({} ms)",
                orderL, orderP, degree, ideal.generators().size(), ring.unknowns().size(), elapsed);

        return new CommutatorSystem(ring, reference, candidate, basis, bracket, ideal,
                layout.flags(), layout.ansatz(), elapsed);
    }

    private static DifferentialOperator normalForm(PolynomialRing ring, String symbol, int order,
                                                   List<Polynomial> lowerCoefficients) {
        List<Polynomial> c = new ArrayList<>(Collections.nCopies(order + 1, ring.zero()));
        for (int i = 0; i < lowerCoefficients.size(); i++) {
            c.set(i, lowerCoefficients.get(i));
        }
        c.set(order, ring.one());
        return DifferentialOperator.of(ring, symbol, c);
    }

    /**
     * Un generador por cada potencia de x de cada nivel del conmutador, en orden de nivel
     * ascendente y potencia ascendente. Los niveles nulos no aportan nada.
     */
    private static List<Polynomial> extractEquations(DifferentialOperator bracket, int symbolIndex) {
        List<Polynomial> equations = new ArrayList<>();
        for (int level = 0; level <= bracket.order(); level++) {
            Polynomial h = bracket.coefficient(level);
            if (h.isZero()) {
                log.debug("    Nivel {} del conmutador: idénticamente nulo", level);
                continue;
            }
            Map<Integer, Polynomial> byPower = h.coefficientsIn(symbolIndex);
            byPower.values().stream().filter(p -> !p.isZero()).forEach(equations::add);
            log.debug("    Nivel {} del conmutador: {} ecuaciones", level, byPower.size());
        }
        return equations;
    }
}
