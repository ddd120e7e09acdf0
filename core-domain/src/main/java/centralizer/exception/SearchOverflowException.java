package centralizer.exception;

/**
 * Salvaguarda contra expansiones sin fin del árbol de casos (profundidad o número de nodos).
 */
public class SearchOverflowException extends CentralizerException {

    public SearchOverflowException(String message) {
        super(message);
    }
}
