package hydrocascade.domain.simulation;

import lombok.Builder;

import java.util.Map;

/**
 * Indicadores agregados de la cascada.
 *
 * @param reservoirs                  Métricas por embalse, en orden de inserción.
 * @param floodLimitCompliant         Todos los embalses respetaron su nivel límite.
 * @param maxAbsoluteResidual         Mayor residuo de balance (en valor absoluto).
 * @param balanceClosed               Todos los balances cierran dentro de la tolerancia.
 * @param systemPeakOutflow           Máximo de la suma de desagües de los embalses de salida.
 * @param totalCapacity               Capacidad total de la cascada.
 * @param diagnosticCount             Incidencias registradas.
 * @param massBalanceViolationCount   Incidencias de vertido forzado o reducción de desagüe.
 */
@Builder
public record SystemMetrics(
        Map<String, ReservoirMetrics> reservoirs,
        boolean floodLimitCompliant,
        double maxAbsoluteResidual,
        boolean balanceClosed,
        double systemPeakOutflow,
        double totalCapacity,
        int diagnosticCount,
        int massBalanceViolationCount
) {

    public ReservoirMetrics of(String reservoirId) {
        ReservoirMetrics metrics = reservoirs.get(reservoirId);
        if (metrics == null) {
            throw new IllegalArgumentException("No hay métricas para el embalse " + reservoirId);
        }
        return metrics;
    }
}
