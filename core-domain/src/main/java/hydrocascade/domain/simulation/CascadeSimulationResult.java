package hydrocascade.domain.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resultado de una ejecución: series por embalse, incidencias y métricas.
 * Es una tabla estructurada lista para exportar o representar.
 *
 * @param completedSteps   Pasos completados (igual al horizonte salvo ejecución abortada).
 * @param horizon          Horizonte configurado.
 * @param deltaTime        Paso de tiempo.
 * @param series           Series por embalse, en orden de inserción.
 * @param diagnostics      Incidencias recuperables por paso.
 * @param metrics          Métricas por embalse y del sistema.
 * @param simulationTime   Tiempo de cómputo [ms].
 */
public record CascadeSimulationResult(
        int completedSteps,
        int horizon,
        double deltaTime,
        Map<String, ReservoirTimeSeries> series,
        List<StepDiagnostic> diagnostics,
        SystemMetrics metrics,
        long simulationTime
) {

    public CascadeSimulationResult {
        series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isComplete() {
        return completedSteps == horizon;
    }

    public ReservoirTimeSeries seriesOf(String reservoirId) {
        ReservoirTimeSeries s = series.get(reservoirId);
        if (s == null) {
            throw new IllegalArgumentException("No hay series para el embalse " + reservoirId);
        }
        return s;
    }

    public List<StepDiagnostic> diagnosticsOf(String reservoirId) {
        return diagnostics.stream().filter(d -> d.reservoirId().equals(reservoirId)).toList();
    }
}
