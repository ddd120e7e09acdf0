package centralizer.domain.ideal;

import centralizer.domain.ring.Monomial;
import centralizer.domain.ring.MonomialOrder;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Rational;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Algoritmo de Buchberger con bases reducidas.
 * <p>
 * Proporciona la reducción canónica que hace decidibles la pertenencia y la trivialidad
 * de un ideal. Incluye la saturación por un elemento (truco de Rabinowitsch con una variable
 * auxiliar en un anillo de trabajo) que el analizador de ramas usa para las ramas {@code v ≠ a}.
 * Esta clase es thread safe: no guarda estado.
 */
@Slf4j
public final class GroebnerEngine {

    private static final String AUXILIARY_PREFIX = "_t";

    /**
     * Prohibido construir esta clase utilidad
     */
    private GroebnerEngine() {
    }

    /**
     * Base de Gröbner reducida (mónica, ordenada por monomio líder descendente).
     * Devuelve {@code [1]} si el ideal es el anillo entero y la lista vacía para el ideal cero.
     */
    public static List<Polynomial> basis(List<Polynomial> generators, MonomialOrder order) {
        List<Polynomial> g = new ArrayList<>();
        List<Monomial> lms = new ArrayList<>();
        PolynomialRing ring = null;
        for (Polynomial p : generators) {
            if (ring == null) ring = p.ring();
            if (p.ring() != ring) {
                throw new IllegalArgumentException("Generadores de anillos distintos");
            }
            if (p.isZero()) continue;
            if (p.isConstant()) return List.of(ring.one());
            Polynomial monic = p.monic(order);
            g.add(monic);
            lms.add(monic.leadingMonomial(order));
        }
        if (g.isEmpty()) return List.of();

        List<int[]> pending = new ArrayList<>();
        Set<Long> pendingKeys = new HashSet<>();
        for (int j = 1; j < g.size(); j++) {
            for (int i = 0; i < j; i++) {
                pending.add(new int[]{i, j});
                pendingKeys.add(key(i, j));
            }
        }

        while (!pending.isEmpty()) {
            int best = selectPair(pending, lms, order);
            int[] pair = pending.remove(best);
            int i = pair[0];
            int j = pair[1];
            pendingKeys.remove(key(i, j));

            Monomial lmI = lms.get(i);
            Monomial lmJ = lms.get(j);
            // Criterio del producto: líderes coprimos reducen a cero.
            if (lmI.isCoprimeWith(lmJ)) continue;
            Monomial lcm = lmI.lcm(lmJ);
            if (chainCriterion(i, j, lcm, lms, pendingKeys)) continue;

            Polynomial s = g.get(i).multiply(Rational.ONE, lcm.divide(lmI))
                    .subtract(g.get(j).multiply(Rational.ONE, lcm.divide(lmJ)));
            Polynomial h = reduce(s, g, lms, order);
            if (h.isZero()) continue;
            if (h.isConstant()) return List.of(ring.one());

            Polynomial monic = h.monic(order);
            int k = g.size();
            g.add(monic);
            lms.add(monic.leadingMonomial(order));
            for (int a = 0; a < k; a++) {
                pending.add(new int[]{a, k});
                pendingKeys.add(key(a, k));
            }
        }
        List<Polynomial> reduced = interreduce(g, lms, order);
        log.trace("Base de Gröbner: {} generadores -> {} elementos ({} intermedios)",
                generators.size(), reduced.size(), g.size());
        return reduced;
    }

    /**
     * Forma normal completa de {@code p} respecto a {@code basis}.
     */
    public static Polynomial reduce(Polynomial p, List<Polynomial> basis, MonomialOrder order) {
        List<Monomial> lms = new ArrayList<>(basis.size());
        for (Polynomial b : basis) {
            lms.add(b.leadingMonomial(order));
        }
        return reduce(p, basis, lms, order);
    }

    /**
     * Saturación {@code (generators) : multiplier^∞}, como base reducida en grevlex.
     * Equivale a trabajar en la localización donde {@code multiplier} es invertible.
     */
    public static List<Polynomial> saturate(List<Polynomial> generators, Polynomial multiplier) {
        MonomialOrder grevlex = MonomialOrder.grevlex();
        if (multiplier.isZero()) return List.of(multiplier.ring().one());
        if (multiplier.isConstant()) return basis(generators, grevlex);

        PolynomialRing base = multiplier.ring();
        PolynomialRing work = base.extend(auxiliaryName(base));
        int t = base.variableCount();

        List<Polynomial> lifted = new ArrayList<>(generators.size() + 1);
        for (Polynomial p : generators) {
            lifted.add(work.embed(p));
        }
        // 1 - t * multiplier
        lifted.add(work.one().subtract(work.gen(work.variable(t)).multiply(work.embed(multiplier))));

        List<Polynomial> eliminated = basis(lifted, MonomialOrder.eliminating(t));
        List<Polynomial> kept = new ArrayList<>();
        for (Polynomial p : eliminated) {
            if (!p.uses(t)) kept.add(work.restrict(p));
        }
        if (kept.isEmpty()) return List.of();
        return basis(kept, grevlex);
    }

    private static Polynomial reduce(Polynomial p, List<Polynomial> basis, List<Monomial> lms, MonomialOrder order) {
        Polynomial remainder = p.ring().zero();
        Polynomial f = p;
        while (!f.isZero()) {
            Monomial lm = f.leadingMonomial(order);
            Rational lc = f.coefficient(lm);
            int divisor = -1;
            for (int k = 0; k < lms.size(); k++) {
                if (lms.get(k).divides(lm)) {
                    divisor = k;
                    break;
                }
            }
            if (divisor >= 0) {
                Polynomial g = basis.get(divisor);
                Rational factor = lc.divide(g.coefficient(lms.get(divisor)));
                f = f.subtract(g.multiply(factor, lm.divide(lms.get(divisor))));
            } else {
                Polynomial leading = p.ring().term(lc, lm);
                remainder = remainder.add(leading);
                f = f.subtract(leading);
            }
        }
        return remainder;
    }

    private static List<Polynomial> interreduce(List<Polynomial> g, List<Monomial> lms, MonomialOrder order) {
        List<Polynomial> minimal = new ArrayList<>();
        List<Monomial> minimalLms = new ArrayList<>();
        for (int a = 0; a < g.size(); a++) {
            boolean redundant = false;
            for (int b = 0; b < g.size() && !redundant; b++) {
                if (a == b) continue;
                if (lms.get(b).divides(lms.get(a))) {
                    // A igual líder se conserva el primero.
                    redundant = !lms.get(a).equals(lms.get(b)) || b < a;
                }
            }
            if (!redundant) {
                minimal.add(g.get(a));
                minimalLms.add(lms.get(a));
            }
        }

        List<Polynomial> reduced = new ArrayList<>(minimal.size());
        for (int a = 0; a < minimal.size(); a++) {
            List<Polynomial> others = new ArrayList<>(minimal);
            List<Monomial> otherLms = new ArrayList<>(minimalLms);
            others.remove(a);
            otherLms.remove(a);
            reduced.add(reduce(minimal.get(a), others, otherLms, order).monic(order));
        }
        reduced.sort((p, q) -> order.compare(q.leadingMonomial(order), p.leadingMonomial(order)));
        return List.copyOf(reduced);
    }

    /**
     * Segundo criterio de Buchberger: el par (i, j) sobra si existe k con LM(k) | lcm(i, j)
     * y los pares (i, k), (j, k) ya fueron tratados.
     */
    private static boolean chainCriterion(int i, int j, Monomial lcm, List<Monomial> lms, Set<Long> pendingKeys) {
        for (int k = 0; k < lms.size(); k++) {
            if (k == i || k == j) continue;
            if (!lms.get(k).divides(lcm)) continue;
            if (!pendingKeys.contains(key(i, k)) && !pendingKeys.contains(key(j, k))) {
                return true;
            }
        }
        return false;
    }

    // Estrategia normal: el par con menor mcm según el orden.
    private static int selectPair(List<int[]> pending, List<Monomial> lms, MonomialOrder order) {
        int best = 0;
        Monomial bestLcm = null;
        for (int p = 0; p < pending.size(); p++) {
            int[] pair = pending.get(p);
            Monomial lcm = lms.get(pair[0]).lcm(lms.get(pair[1]));
            if (bestLcm == null || order.compare(lcm, bestLcm) < 0) {
                best = p;
                bestLcm = lcm;
            }
        }
        return best;
    }

    private static long key(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | hi;
    }

    private static String auxiliaryName(PolynomialRing ring) {
        String name = AUXILIARY_PREFIX;
        int suffix = 0;
        while (ring.findVariable(name).isPresent()) {
            name = AUXILIARY_PREFIX + (++suffix);
        }
        return name;
    }
}
