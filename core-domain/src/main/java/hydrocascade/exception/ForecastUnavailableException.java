package hydrocascade.exception;

/**
 * El adaptador de pronóstico no pudo producir una secuencia válida
 * (forzamiento insuficiente, timeout o fallo del modelo hidrológico).
 * <p>
 * Es recuperable: el motor aplica la regla ordinaria en ese paso.
 */
public class ForecastUnavailableException extends Exception {

    public ForecastUnavailableException(String message) {
        super(message);
    }

    public ForecastUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
