package hydrocascade.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de la operación basada en pronóstico (prevertido) de un embalse.
 * <p>
 * Si el máximo del caudal pronosticado en el horizonte de previsión supera
 * {@code caudalActual × preReleaseFactor}, el embalse libera {@code caudalActual × preReleaseGain}.
 */
@Value
@Builder
@With
public class ForecastConfig {

    /**
     * Horizonte de previsión (número de pasos futuros pronosticados).
     */
    int leadTime;

    /**
     * Umbral relativo que dispara el prevertido.
     */
    @Builder.Default
    double preReleaseFactor = 1.5;

    /**
     * Ganancia aplicada al caudal actual durante el prevertido.
     */
    @Builder.Default
    double preReleaseGain = 1.2;

    /**
     * Tiempo máximo de espera al adaptador de pronóstico [ms].
     */
    @Builder.Default
    long timeoutMillis = 2000L;
}
