package centralizer.exception;

/**
 * La asignación inicial ya hace que el ideal sea el anillo entero, antes de ramificar.
 */
public class InconsistentAssignmentException extends CentralizerException {

    public InconsistentAssignmentException(String message) {
        super(message);
    }
}
