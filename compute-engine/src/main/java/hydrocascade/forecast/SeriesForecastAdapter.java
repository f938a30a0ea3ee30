package hydrocascade.forecast;

import hydrocascade.exception.ForecastUnavailableException;

import java.util.Arrays;

/**
 * Pronóstico perfecto a partir de una serie de caudales conocida de antemano.
 */
public class SeriesForecastAdapter implements ForecastAdapter {

    private final double[] series;

    public SeriesForecastAdapter(double[] series) {
        this.series = series.clone();
    }

    @Override
    public double[] forecast(int currentStep, int leadTime) throws ForecastUnavailableException {
        int from = currentStep;
        if (from + leadTime > series.length) {
            throw new ForecastUnavailableException(String.format(
                    "La serie solo cubre %d pasos; no hay pronóstico de %d pasos desde el paso %d.",
                    series.length, leadTime, currentStep));
        }
        return Arrays.copyOfRange(series, from, from + leadTime);
    }
}
