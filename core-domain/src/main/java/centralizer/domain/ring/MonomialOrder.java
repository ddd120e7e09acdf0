package centralizer.domain.ring;

import java.util.Comparator;

/**
 * Orden monomial admisible. {@code compare(a, b) > 0} significa que {@code a} es mayor.
 * <p>
 * El orden por defecto de todas las formas canónicas es {@link #grevlex()}.
 */
public interface MonomialOrder extends Comparator<Monomial> {

    /**
     * Grado total primero; a igual grado gana el monomio con menor exponente
     * en la última variable en la que difieren.
     */
    static MonomialOrder grevlex() {
        return MonomialOrder::compareGrevlex;
    }

    /**
     * Lexicográfico puro con la variable de menor handle como la mayor.
     */
    static MonomialOrder lex() {
        return (a, b) -> {
            int[] ea = a.exponentsView();
            int[] eb = b.exponentsView();
            for (int i = 0; i < ea.length; i++) {
                if (ea[i] != eb[i]) {
                    return Integer.compare(ea[i], eb[i]);
                }
            }
            return 0;
        };
    }

    /**
     * Orden de bloques para eliminación: las variables con handle {@code >= firstEliminated}
     * dominan (grevlex dentro del bloque) y el resto se compara en grevlex.
     * Los elementos de una base de Gröbner libres del bloque eliminado forman una base
     * del ideal de eliminación.
     */
    static MonomialOrder eliminating(int firstEliminated) {
        return (a, b) -> {
            int c = compareGrevlexRange(a.exponentsView(), b.exponentsView(), firstEliminated, a.size());
            if (c != 0) return c;
            return compareGrevlexRange(a.exponentsView(), b.exponentsView(), 0, firstEliminated);
        };
    }

    private static int compareGrevlex(Monomial a, Monomial b) {
        return compareGrevlexRange(a.exponentsView(), b.exponentsView(), 0, a.size());
    }

    private static int compareGrevlexRange(int[] ea, int[] eb, int from, int to) {
        int da = 0;
        int db = 0;
        for (int i = from; i < to; i++) {
            da += ea[i];
            db += eb[i];
        }
        if (da != db) {
            return Integer.compare(da, db);
        }
        for (int i = to - 1; i >= from; i--) {
            if (ea[i] != eb[i]) {
                return Integer.compare(eb[i], ea[i]);
            }
        }
        return 0;
    }
}
