package hydrocascade.exception;

import hydrocascade.domain.simulation.CascadeSimulationResult;

/**
 * Fallo inesperado durante una ejecución ya iniciada.
 * <p>
 * El paso en curso no se confirma: el resultado parcial es coherente hasta el último
 * paso completado.
 */
public class SimulationAbortedException extends CascadeException {

    private final transient CascadeSimulationResult partialResult;

    public SimulationAbortedException(String message, CascadeSimulationResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public CascadeSimulationResult getPartialResult() {
        return partialResult;
    }

    public int getCompletedSteps() {
        return partialResult.completedSteps();
    }
}
