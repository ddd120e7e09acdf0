package centralizer.domain.analysis;

/**
 * Tipos de pista de ramificación.
 */
public enum HintKind {
    /**
     * Probar primero {@code variable = valor} antes de ramificar libremente.
     */
    VAR
}
