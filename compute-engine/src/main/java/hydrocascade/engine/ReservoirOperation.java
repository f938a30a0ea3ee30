package hydrocascade.engine;

import hydrocascade.forecast.ForecastAdapter;
import hydrocascade.operation.policy.OperatingPolicy;

import java.util.Objects;

/**
 * Modo de operación de un embalse durante una ejecución: su política y, si la política
 * consume pronósticos, el adaptador que los proporciona.
 *
 * @param policy           Política de operación.
 * @param forecastAdapter  Adaptador de pronóstico; nulo si la política no lo usa.
 * @param leadTime         Pasos pronosticados por consulta.
 */
public record ReservoirOperation(
        OperatingPolicy policy,
        ForecastAdapter forecastAdapter,
        int leadTime
) {

    public ReservoirOperation {
        Objects.requireNonNull(policy, "La política de operación no puede ser nula.");
        if (forecastAdapter != null && leadTime < 1) {
            throw new IllegalArgumentException("El horizonte de previsión debe ser de al menos un paso: " + leadTime);
        }
    }

    public static ReservoirOperation regular(OperatingPolicy policy) {
        return new ReservoirOperation(policy, null, 0);
    }

    public boolean queriesForecast() {
        return forecastAdapter != null && policy.usesForecast();
    }
}
