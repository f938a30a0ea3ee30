package hydrocascade.exception;

/**
 * Excepción base del motor de operación en cascada.
 */
public class CascadeException extends RuntimeException {

    public CascadeException(String message) {
        super(message);
    }

    public CascadeException(String message, Throwable cause) {
        super(message, cause);
    }
}
