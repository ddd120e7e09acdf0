package centralizer.exception;

/**
 * El número de incógnitas que piden los parámetros no se puede nombrar/registrar.
 */
public class DegreeOverflowException extends CentralizerException {

    public DegreeOverflowException(String message) {
        super(message);
    }

    public DegreeOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
