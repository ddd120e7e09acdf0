package centralizer.domain.ring;

/**
 * Indeterminada de un {@link PolynomialRing}.
 * <p>
 * El índice es el "handle" permanente de la variable dentro de su anillo: las sustituciones,
 * asignaciones de ramas y exponentes de monomios se indexan por él. El nombre sólo se usa
 * para mostrar y para el desempate lexicográfico del analizador de ramas.
 *
 * @param index Posición estable de la variable en el registro del anillo.
 * @param name  Nombre único para mostrar (ej: {@code c_3}, {@code b_0_1}, {@code x}).
 * @param role  Papel de la variable: incógnita algebraica o símbolo formal.
 */
public record Variable(int index, String name, Role role) {

    public enum Role {
        /**
         * Coeficiente desconocido (constante para la derivación).
         */
        UNKNOWN,
        /**
         * Símbolo formal sobre el que actúa la derivación (ej: {@code x}, con x' = 1).
         */
        SYMBOL
    }

    public boolean isUnknown() {
        return role == Role.UNKNOWN;
    }

    @Override
    public String toString() {
        return name;
    }
}
