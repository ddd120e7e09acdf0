package centralizer.study;

import centralizer.algebra.i.IBranchAnalyzer;
import centralizer.algebra.i.ICommutatorBuilder;
import centralizer.algebra.impl.AlmostCommutingCommutatorBuilder;
import centralizer.algebra.impl.CaseSplitBranchAnalyzer;
import centralizer.config.StudyConfig;
import centralizer.domain.analysis.Branch;
import centralizer.domain.analysis.BranchHint;
import centralizer.domain.commutator.CommutatorSystem;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Variable;
import centralizer.exception.CentralizerException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orquestador de un estudio de centralizador.
 * <p>
 * Responsabilidades:
 * 1. Construir el sistema de conmutación (L, P, H).
 * 2. Derivar la asignación inicial y las pistas a partir de {@link StudyConfig}.
 * 3. Ejecutar el analizador por casos y filtrar las ramas triviales.
 */
@Slf4j
public class CentralizerStudy {

    private final ICommutatorBuilder builder;
    private final IBranchAnalyzer analyzer;

    public CentralizerStudy() {
        this(new AlmostCommutingCommutatorBuilder(), new CaseSplitBranchAnalyzer());
    }

    public CentralizerStudy(ICommutatorBuilder builder, IBranchAnalyzer analyzer) {
        this.builder = builder;
        this.analyzer = analyzer;
    }

    public StudyResult run(StudyConfig config) {
        log.info("Estudio iniciado: L de orden {}, P de orden {}, grado {}",
                config.orderL(), config.orderP(), config.degree());

        CommutatorSystem system = builder.build(config.orderL(), config.orderP(), config.degree());
        Map<Variable, Polynomial> initial = initialAssignment(system, config);
        List<BranchHint> hints = hints(system, config);

        long startTime = System.currentTimeMillis();
        List<Branch> branches;
        try {
            branches = analyzer.analyzeAll(system.ideal(), initial, hints, system.ring());
        } catch (CentralizerException e) {
            log.error("El análisis por casos falló para {}: {}", config, e.getMessage());
            throw e;
        }
        long analysisMillis = System.currentTimeMillis() - startTime;

        List<Branch> kept = new ArrayList<>();
        for (Branch branch : branches) {
            if (BranchFilter.isNonTrivial(branch, system.candidate())) {
                kept.add(branch);
            } else {
                log.debug("Rama {} descartada: P se anula", branch.index());
            }
        }
        for (int i = 0; i < kept.size(); i++) {
            Branch branch = kept.get(i);
            log.info("branch {} of {}: {}", i + 1, kept.size(), branch.solution());
            log.debug("    P = {}", branch.eval(system.candidate()));
        }
        log.info("Estudio terminado: {} ramas ({} triviales descartadas) en {} ms",
                kept.size(), branches.size() - kept.size(), analysisMillis);
        return new StudyResult(system, kept, branches.size() - kept.size(), analysisMillis);
    }

    /**
     * {@code c_m = 1} si se normaliza y {@code c_k = 0} para los múltiplos de n por debajo de m
     * si se excluyen las potencias triviales.
     */
    static Map<Variable, Polynomial> initialAssignment(CommutatorSystem system, StudyConfig config) {
        PolynomialRing ring = system.ring();
        Map<Variable, Polynomial> initial = new LinkedHashMap<>();
        if (config.normalizeLeading()) {
            initial.put(system.flag(config.orderP()), ring.one());
        }
        if (config.excludeTrivialPowers()) {
            for (int k : trivialPowers(config)) {
                initial.put(system.flag(k), ring.zero());
            }
        }
        return initial;
    }

    static List<BranchHint> hints(CommutatorSystem system, StudyConfig config) {
        List<BranchHint> hints = new ArrayList<>();
        if (!config.excludeTrivialPowers()) {
            for (int k : trivialPowers(config)) {
                hints.add(BranchHint.var(system.flag(k), system.ring().zero()));
            }
        }
        return hints;
    }

    private static List<Integer> trivialPowers(StudyConfig config) {
        List<Integer> out = new ArrayList<>();
        for (int k = 0; k < config.orderP(); k += config.orderL()) {
            out.add(k);
        }
        return out;
    }
}
