package hydrocascade.domain.simulation;

import lombok.Builder;

/**
 * Indicadores de desempeño de un embalse en una ejecución.
 *
 * @param reservoirId               Embalse.
 * @param peakInflow                Máximo caudal de entrada.
 * @param peakOutflow               Máximo caudal entregado.
 * @param peakShavingRatio          {@code (peakInflow − peakOutflow) / peakInflow}; 0 si no hubo entrada.
 * @param maxLevel                  Cota máxima alcanzada (incluye la inicial).
 * @param minLevel                  Cota mínima alcanzada (incluye la inicial).
 * @param floodLimitLevel           Nivel límite de avenidas.
 * @param floodLimitCompliant       {@code maxLevel ≤ floodLimitLevel}.
 * @param waterBalanceResidual      {@code Σ(in − out)·Δt − (final − inicial)}.
 * @param balanceClosed             Residuo dentro de la tolerancia relativa.
 * @param forcedSpillVolume         Volumen vertido por exceder la capacidad.
 * @param forcedSpillSteps          Pasos con vertido forzado.
 * @param curtailedSteps            Pasos con desagüe reducido por falta de volumen.
 * @param preReleaseSteps           Pasos con prevertido activo.
 * @param forecastUnavailableSteps  Pasos sin pronóstico disponible.
 * @param meanInflow                Caudal medio de entrada.
 * @param meanOutflow               Caudal medio entregado.
 */
@Builder
public record ReservoirMetrics(
        String reservoirId,
        double peakInflow,
        double peakOutflow,
        double peakShavingRatio,
        double maxLevel,
        double minLevel,
        double floodLimitLevel,
        boolean floodLimitCompliant,
        double waterBalanceResidual,
        boolean balanceClosed,
        double forcedSpillVolume,
        int forcedSpillSteps,
        int curtailedSteps,
        int preReleaseSteps,
        int forecastUnavailableSteps,
        double meanInflow,
        double meanOutflow
) {}
