package centralizer.domain.ideal;

import centralizer.domain.ring.MonomialOrder;
import centralizer.domain.ring.Polynomial;
import centralizer.domain.ring.PolynomialRing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ideal finitamente generado de un {@link PolynomialRing}.
 * <p>
 * Conserva el orden de los generadores tal y como se dieron (sin los nulos). La base de Gröbner
 * reducida en grevlex se calcula la primera vez que se necesita y se memoriza: el valor del ideal
 * no cambia nunca, sólo se evita repetir el cálculo.
 */
public final class Ideal {

    private static final MonomialOrder ORDER = MonomialOrder.grevlex();

    private final PolynomialRing ring;
    private final List<Polynomial> generators;
    private volatile List<Polynomial> basis;

    private Ideal(PolynomialRing ring, List<Polynomial> generators, List<Polynomial> basis) {
        this.ring = ring;
        this.generators = generators;
        this.basis = basis;
    }

    public static Ideal of(PolynomialRing ring, Collection<Polynomial> generators) {
        List<Polynomial> nonZero = new ArrayList<>();
        for (Polynomial p : generators) {
            if (p.ring() != ring) {
                throw new IllegalArgumentException("El generador " + p + " no pertenece a " + ring);
            }
            if (!p.isZero()) nonZero.add(p);
        }
        return new Ideal(ring, List.copyOf(nonZero), null);
    }

    public static Ideal of(PolynomialRing ring, Polynomial... generators) {
        return of(ring, List.of(generators));
    }

    public static Ideal zero(PolynomialRing ring) {
        return new Ideal(ring, List.of(), List.of());
    }

    /**
     * Ideal cuyos generadores ya forman una base de Gröbner reducida en grevlex.
     */
    static Ideal fromReducedBasis(PolynomialRing ring, List<Polynomial> reducedBasis) {
        List<Polynomial> copy = List.copyOf(reducedBasis);
        return new Ideal(ring, copy, copy);
    }

    /**
     * Ideal {@code (generators) : multiplier^∞}; sus generadores son su base reducida.
     */
    public static Ideal saturation(PolynomialRing ring, Collection<Polynomial> generators, Polynomial multiplier) {
        Ideal ideal = of(ring, generators);
        if (multiplier.ring() != ring) {
            throw new IllegalArgumentException("El multiplicador pertenece a otro anillo");
        }
        return fromReducedBasis(ring, GroebnerEngine.saturate(ideal.generators, multiplier));
    }

    public PolynomialRing ring() {
        return ring;
    }

    public List<Polynomial> generators() {
        return generators;
    }

    /**
     * Base de Gröbner reducida (grevlex). Forma canónica del ideal.
     */
    public List<Polynomial> basis() {
        List<Polynomial> b = basis;
        if (b == null) {
            b = GroebnerEngine.basis(generators, ORDER);
            basis = b;
        }
        return b;
    }

    /**
     * El ideal reducido a su base canónica como generadores.
     */
    public Ideal reduced() {
        return fromReducedBasis(ring, basis());
    }

    public Polynomial normalForm(Polynomial p) {
        if (p.ring() != ring) {
            throw new IllegalArgumentException("El polinomio " + p + " pertenece a otro anillo");
        }
        List<Polynomial> b = basis();
        if (b.isEmpty()) return p;
        return GroebnerEngine.reduce(p, b, ORDER);
    }

    public boolean contains(Polynomial p) {
        return normalForm(p).isZero();
    }

    /**
     * {@code true} si el ideal contiene una constante no nula (sistema inconsistente).
     */
    public boolean isWholeRing() {
        List<Polynomial> b = basis();
        return b.size() == 1 && b.get(0).isConstant();
    }

    /**
     * {@code true} si no hay ningún generador no nulo.
     */
    public boolean isZero() {
        return generators.isEmpty();
    }

    public Ideal substitute(Map<Integer, Polynomial> assignment) {
        if (assignment.isEmpty()) return this;
        List<Polynomial> out = new ArrayList<>(generators.size());
        for (Polynomial g : generators) {
            out.add(g.substitute(assignment));
        }
        return of(ring, out);
    }

    public Ideal plus(Collection<Polynomial> more) {
        List<Polynomial> all = new ArrayList<>(generators);
        all.addAll(more);
        return of(ring, all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ideal)) return false;
        Ideal that = (Ideal) o;
        return ring == that.ring && basis().equals(that.basis());
    }

    @Override
    public int hashCode() {
        return basis().hashCode();
    }

    @Override
    public String toString() {
        return generators.stream().map(Polynomial::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
