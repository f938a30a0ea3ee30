package hydrocascade.operation.policy;

import hydrocascade.domain.reservoir.ReservoirSnapshot;

/**
 * Política de operación de un embalse: traduce el estado actual (y opcionalmente un
 * pronóstico) en un caudal de desagüe solicitado.
 * <p>
 * Es una función pura: sin estado oculto, determinista dado
 * {@code (zona, caudal de entrada, pronóstico)}.
 */
public interface OperatingPolicy {

    /**
     * @param reservoir     Estado del embalse al inicio del paso.
     * @param currentInflow Caudal total de entrada del paso (externo + tránsitos).
     * @param forecast      Secuencia pronosticada de caudales, o null si no hay pronóstico.
     * @param step          Paso de tiempo.
     */
    ReleaseDecision decide(ReservoirSnapshot reservoir, double currentInflow, double[] forecast, int step);

    /**
     * Indica si la política consume pronósticos. El motor solo consulta al adaptador en ese caso.
     */
    default boolean usesForecast() {
        return false;
    }

    /**
     * Recorta un caudal a {@code [0, maxReleaseRate]}. Valores no finitos se tratan como 0.
     */
    static double clampToReleaseRange(double release, double maxReleaseRate) {
        if (!Double.isFinite(release) || release <= 0.0) {
            return 0.0;
        }
        return Math.min(release, maxReleaseRate);
    }
}
