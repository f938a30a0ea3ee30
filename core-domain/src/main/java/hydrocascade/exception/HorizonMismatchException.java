package hydrocascade.exception;

/**
 * La serie de aportes externos de un embalse es más corta que el horizonte configurado.
 */
public class HorizonMismatchException extends ConfigurationException {

    private final int expectedLength;
    private final int actualLength;

    public HorizonMismatchException(String reservoirId, int expectedLength, int actualLength) {
        super(reservoirId, String.format(
                "La serie de aportes externos tiene %d pasos, pero el horizonte exige %d.",
                actualLength, expectedLength));
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
