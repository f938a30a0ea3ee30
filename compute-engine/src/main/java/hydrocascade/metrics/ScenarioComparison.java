package hydrocascade.metrics;

import java.util.Map;

/**
 * Resultado de comparar dos ejecuciones de la misma cascada.
 *
 * @param reservoirs                 Comparación por embalse, en orden de inserción.
 * @param systemPeakOutflowReduction Reducción del caudal máximo de salida del sistema.
 */
public record ScenarioComparison(
        Map<String, ReservoirComparison> reservoirs,
        double systemPeakOutflowReduction
) {

    public ReservoirComparison of(String reservoirId) {
        ReservoirComparison comparison = reservoirs.get(reservoirId);
        if (comparison == null) {
            throw new IllegalArgumentException("No hay comparación para el embalse " + reservoirId);
        }
        return comparison;
    }

    /**
     * true si el escenario alternativo cumple el nivel límite en todos los embalses.
     */
    public boolean candidateCompliant() {
        return reservoirs.values().stream().allMatch(ReservoirComparison::candidateCompliant);
    }
}
