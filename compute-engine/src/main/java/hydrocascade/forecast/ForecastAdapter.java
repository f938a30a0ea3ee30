package hydrocascade.forecast;

import hydrocascade.exception.ForecastUnavailableException;

/**
 * Contrato con el proveedor de pronósticos de caudal de entrada.
 */
public interface ForecastAdapter {

    /**
     * Devuelve el caudal de entrada pronosticado para los pasos
     * {@code currentStep ... currentStep + leadTime - 1}, empezando por el paso actual.
     *
     * @param currentStep Paso actual de la simulación.
     * @param leadTime    Número de pasos pronosticados (≥ 1).
     * @return Secuencia de longitud {@code leadTime}.
     * @throws ForecastUnavailableException si no es posible producir el pronóstico.
     */
    double[] forecast(int currentStep, int leadTime) throws ForecastUnavailableException;
}
