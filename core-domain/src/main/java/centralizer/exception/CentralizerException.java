package centralizer.exception;

/**
 * Raíz de los fallos terminales del cálculo de centralizadores.
 * Ninguno admite resultados parciales: un conjunto de ramas incompleto llevaría a conclusiones
 * matemáticas incorrectas.
 */
public abstract class CentralizerException extends RuntimeException {

    protected CentralizerException(String message) {
        super(message);
    }

    protected CentralizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
