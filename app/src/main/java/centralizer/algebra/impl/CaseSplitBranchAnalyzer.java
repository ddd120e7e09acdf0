package centralizer.algebra.impl;

import centralizer.algebra.i.IBranchAnalyzer;
import centralizer.algebra.solver.RationalRootSolver;
import centralizer.config.AnalysisConfig;
import centralizer.domain.analysis.Branch;
import centralizer.domain.analysis.BranchHint;
import centralizer.domain.analysis.PartialSolution;
import centralizer.domain.ideal.Ideal;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;
import centralizer.domain.ring.Variable;
import centralizer.exception.InconsistentAssignmentException;
import centralizer.exception.SearchOverflowException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Analizador por casos basado en bases de Gröbner.
 * <p>
 * Recorre en profundidad un árbol de nodos {@code (asignación, condiciones ≠ 0, variables decididas)}.
 * En cada nodo:
 * <ol>
 * <li>Sustituye la asignación en los generadores originales y satura por el producto de las
 * condiciones. Si la base resultante es {@code {1}} el nodo se descarta.</li>
 * <li>Propaga las ecuaciones forzadas {@code a·v + r} (a constante): {@code v = -r/a}.</li>
 * <li>Si el residuo es el ideal cero, o no queda variable sobre la que dividir, emite una rama.</li>
 * <li>Si no, divide sobre una variable: un hijo por valor candidato y un último hijo "distinto de
 * todos los candidatos". Un candidato no constante sólo conserva los puntos en los que difiere de
 * los anteriores.</li>
 * </ol>
 * Cada división asigna o decide una variable, así que la búsqueda termina; aun así se vigilan la
 * profundidad y el número de nodos ({@link AnalysisConfig}).
 * <p>
 * Las ramas se producen de forma perezosa: el stream sólo expande nodos cuando se consume.
 */
@Slf4j
public class CaseSplitBranchAnalyzer implements IBranchAnalyzer {

    private final AnalysisConfig config;

    public CaseSplitBranchAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public CaseSplitBranchAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public Stream<Branch> analyze(Ideal ideal,
                                  Map<Variable, Polynomial> initialAssignment,
                                  List<BranchHint> hints,
                                  PolynomialRing baseRing) {
        if (ideal.ring() != baseRing) {
            throw new IllegalArgumentException("El ideal no pertenece al anillo base " + baseRing);
        }
        validateHints(hints, baseRing);
        PartialSolution initial = PartialSolution.of(baseRing, initialAssignment);

        // Inconsistencia de partida: se detecta antes de devolver el stream
        Ideal start = ideal.substitute(initial.asSubstitution());
        if (start.isWholeRing()) {
            throw new InconsistentAssignmentException(
                    "La asignación inicial " + initial + " hace inconsistente el sistema " + ideal);
        }
        log.debug("Análisis por casos: {} generadores, asignación inicial {}, {} pistas",
                ideal.generators().size(), initial, hints.size());

        Search search = new Search(ideal, List.copyOf(hints), initial);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(search, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private static void validateHints(List<BranchHint> hints, PolynomialRing ring) {
        for (BranchHint hint : hints) {
            if (!ring.owns(hint.variable()) || !hint.variable().isUnknown()) {
                throw new IllegalArgumentException("Pista sobre una variable ajena: " + hint);
            }
            if (hint.value().ring() != ring) {
                throw new IllegalArgumentException("Pista con un valor de otro anillo: " + hint);
            }
            if (hint.value().uses(hint.variable().index())) {
                throw new IllegalArgumentException("El valor de la pista menciona su propia variable: " + hint);
            }
        }
    }

    /**
     * Nodo pendiente del árbol de casos.
     */
    private record SearchNode(PartialSolution solution, List<Polynomial> conditions,
                              Set<Integer> decided, int depth) {
    }

    /**
     * Estado de una búsqueda concreta. Cada llamada a {@code analyze} tiene el suyo, así que el
     * analizador no guarda estado entre ejecuciones.
     */
    private final class Search implements Iterator<Branch> {

        private final Ideal original;
        private final PolynomialRing ring;
        private final List<BranchHint> hints;
        private final Deque<SearchNode> stack = new ArrayDeque<>();

        private Branch pending;
        private int emitted;
        private int processed;
        private int pruned;
        private boolean finished;

        Search(Ideal original, List<BranchHint> hints, PartialSolution initial) {
            this.original = original;
            this.ring = original.ring();
            this.hints = hints;
            stack.push(new SearchNode(initial, List.of(), Set.of(), 0));
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !finished) {
                pending = advance();
                if (pending == null) {
                    finished = true;
                    log.debug("Búsqueda terminada: {} ramas, {} nodos procesados, {} podados",
                            emitted, processed, pruned);
                }
            }
            return pending != null;
        }

        @Override
        public Branch next() {
            if (!hasNext()) throw new NoSuchElementException();
            Branch b = pending;
            pending = null;
            return b;
        }

        private Branch advance() {
            while (!stack.isEmpty()) {
                SearchNode node = stack.pop();
                checkGuards(node);

                // 1. Residuo localizado + propagación de ecuaciones forzadas. Los valores forzados se
                // sustituyen en la base del residuo y sólo se vuelve a saturar al final de cada ronda.
                PartialSolution solution = node.solution();
                Ideal residual = localize(solution, node.conditions());
                while (!residual.isWholeRing()) {
                    boolean propagated = false;
                    Optional<Map.Entry<Variable, Polynomial>> forced = findForced(residual);
                    while (forced.isPresent()) {
                        Variable v = forced.get().getKey();
                        Polynomial value = forced.get().getValue();
                        log.trace("    Forzado {} = {}", v.name(), value);
                        solution = solution.with(v, value);
                        residual = residual.reduced().substitute(Map.of(v.index(), value));
                        propagated = true;
                        forced = residual.isWholeRing() ? Optional.empty() : findForced(residual);
                    }
                    if (!propagated || residual.isWholeRing()) break;
                    residual = saturate(residual.generators(), solution, node.conditions());
                }
                if (residual.isWholeRing()) {
                    pruned++;
                    log.trace("Nodo inconsistente (profundidad {}): {}", node.depth(), solution);
                    continue;
                }

                List<Polynomial> conditions = applyConditions(solution, node.conditions());

                // 2. ¿Terminal?
                if (residual.isZero()) {
                    return emit(residual, solution, conditions);
                }
                Optional<Split> split = chooseSplit(residual, solution, node.decided());
                if (split.isEmpty()) {
                    return emit(residual, solution, conditions);
                }

                // 3. Hijos: candidatos en orden y, al final, "distinto de todos"
                expand(node, solution, residual, split.get());
            }
            return null;
        }

        private void checkGuards(SearchNode node) {
            processed++;
            if (processed > config.getMaxNodes()) {
                throw new SearchOverflowException(
                        "Se superó el máximo de " + config.getMaxNodes() + " nodos en el árbol de casos");
            }
            if (node.depth() > config.getMaxDepth()) {
                throw new SearchOverflowException(
                        "Se superó la profundidad máxima " + config.getMaxDepth() + " en el árbol de casos");
            }
        }

        private Branch emit(Ideal residual, PartialSolution solution, List<Polynomial> conditions) {
            Branch branch = new Branch(emitted++, residual, solution, conditions);
            log.trace("Rama {}: {}", branch.index(), branch);
            return branch;
        }

        private Ideal localize(PartialSolution solution, List<Polynomial> conditions) {
            List<Polynomial> generators = new ArrayList<>(original.generators().size());
            for (Polynomial g : original.generators()) {
                generators.add(solution.apply(g));
            }
            return saturate(generators, solution, conditions);
        }

        /**
         * {@code (generators) : (Π condiciones)^∞}, con la asignación ya aplicada a las condiciones.
         */
        private Ideal saturate(List<Polynomial> generators, PartialSolution solution, List<Polynomial> conditions) {
            Polynomial multiplier = ring.one();
            for (Polynomial c : conditions) {
                multiplier = multiplier.multiply(solution.apply(c));
            }
            return Ideal.saturation(ring, generators, multiplier);
        }

        private List<Polynomial> applyConditions(PartialSolution solution, List<Polynomial> conditions) {
            List<Polynomial> out = new ArrayList<>(conditions.size());
            for (Polynomial c : conditions) {
                Polynomial applied = solution.apply(c);
                if (!applied.isConstant()) out.add(applied);
            }
            return out;
        }

        /**
         * Primer elemento de la base de la forma {@code a·v + r} con {@code a} constante; dentro de
         * él, la incógnita de menor handle.
         */
        private Optional<Map.Entry<Variable, Polynomial>> findForced(Ideal residual) {
            for (Polynomial g : residual.basis()) {
                for (Variable v : g.variables()) {
                    if (!v.isUnknown() || g.degreeIn(v.index()) != 1) continue;
                    NavigableMap<Integer, Polynomial> parts = g.coefficientsIn(v.index());
                    Polynomial a = parts.get(1);
                    if (!a.isConstant()) continue;
                    Polynomial rest = parts.getOrDefault(0, ring.zero());
                    Rational factor = a.constantValue().inverse().negate();
                    return Optional.of(Map.entry(v, rest.scale(factor)));
                }
            }
            return Optional.empty();
        }

        private Optional<Split> chooseSplit(Ideal residual, PartialSolution solution, Set<Integer> decided) {
            // (a) Pistas, en el orden dado
            for (BranchHint hint : hints) {
                Variable v = hint.variable();
                if (solution.isAssigned(v) || decided.contains(v.index())) continue;
                Polynomial value = solution.apply(hint.value());
                if (value.uses(v.index())) {
                    log.debug("Pista {} descartada: tras la asignación su valor {} menciona {}; se usa 0",
                            hint, value, v.name());
                    value = ring.zero();
                }
                log.trace("    Dividiendo sobre {} por pista ({})", v.name(), value);
                return Optional.of(new Split(v, value));
            }

            // (b) Elementos de menor grado total; nombre lexicográficamente menor
            List<Polynomial> basis = residual.basis();
            int minDegree = Integer.MAX_VALUE;
            Variable best = null;
            for (Polynomial g : basis) {
                int degree = g.totalDegree();
                if (degree > minDegree) continue;
                for (Variable v : g.variables()) {
                    if (!v.isUnknown() || decided.contains(v.index())) continue;
                    if (degree < minDegree || best == null || v.name().compareTo(best.name()) < 0) {
                        minDegree = degree;
                        best = v;
                    }
                }
            }
            if (best == null) return Optional.empty();
            log.trace("    Dividiendo sobre {} (grado mínimo {})", best.name(), minDegree);
            return Optional.of(new Split(best, ring.zero()));
        }

        private void expand(SearchNode node, PartialSolution solution, Ideal residual, Split split) {
            Variable v = split.variable();
            Set<Polynomial> candidates = new LinkedHashSet<>();
            candidates.add(split.firstValue());
            for (Rational root : RationalRootSolver.rootsFromFirstUnivariate(residual.basis(), v)) {
                candidates.add(ring.constant(root));
            }

            int depth = node.depth() + 1;
            List<SearchNode> children = new ArrayList<>(candidates.size() + 1);
            List<Polynomial> previous = new ArrayList<>(candidates.size());
            Polynomial excluded = ring.one();
            Polynomial gen = ring.gen(v);
            for (Polynomial value : candidates) {
                children.add(new SearchNode(solution.with(v, value),
                        distinctFromPrevious(node.conditions(), value, previous), node.decided(), depth));
                previous.add(value);
                excluded = excluded.multiply(gen.subtract(value));
            }
            List<Polynomial> conditions = new ArrayList<>(node.conditions());
            conditions.add(excluded);
            Set<Integer> decided = new HashSet<>(node.decided());
            decided.add(v.index());
            children.add(new SearchNode(solution, List.copyOf(conditions), Set.copyOf(decided), depth));

            log.trace("Nodo profundidad {}: {} hijos sobre {} (candidatos {})",
                    node.depth(), children.size(), v.name(), candidates);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        /**
         * Condiciones del hijo {@code v = value}: las del padre más {@code Π (value - anterior)} cuando
         * ese producto no es constante. Con candidatos no constantes (pistas en otras incógnitas) dos
         * hermanos pueden coincidir en un punto; éste queda sólo en el primero.
         */
        private List<Polynomial> distinctFromPrevious(List<Polynomial> conditions, Polynomial value,
                                                      List<Polynomial> previous) {
            Polynomial separation = ring.one();
            for (Polynomial p : previous) {
                separation = separation.multiply(value.subtract(p));
            }
            if (separation.isConstant()) return conditions;
            List<Polynomial> out = new ArrayList<>(conditions);
            out.add(separation);
            return List.copyOf(out);
        }
    }

    /**
     * Variable elegida y primer valor candidato (pista o cero).
     */
    private record Split(Variable variable, Polynomial firstValue) {
    }
}
