package centralizer.exception;

/**
 * Parámetros estructurales inválidos: {@code orderL < 1}, {@code orderP < orderL} o grado negativo.
 */
public class InvalidOrderException extends CentralizerException {

    public InvalidOrderException(String message) {
        super(message);
    }

    public static InvalidOrderException of(int orderL, int orderP, int degree) {
        return new InvalidOrderException(String.format(
                "Parámetros inválidos (orderL=%d, orderP=%d, degree=%d): se requiere orderL >= 1, orderP >= orderL y degree >= 0",
                orderL, orderP, degree));
    }
}
