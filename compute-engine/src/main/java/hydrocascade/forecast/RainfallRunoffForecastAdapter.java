package hydrocascade.forecast;

import hydrocascade.exception.ForecastUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Pronóstico de caudal a partir de un forzamiento meteorológico previsto y un
 * {@link RunoffModel}.
 * <p>
 * La lámina de escorrentía se convierte a caudal con el área de la cuenca:
 * {@code Q = mm · 1e-3 · área[km²] · 1e6 / Δt[s]}. Los valores no finitos o negativos
 * que devuelva el modelo se sustituyen por 0.
 */
@Slf4j
public class RainfallRunoffForecastAdapter implements ForecastAdapter {

    private final RunoffModel model;
    private final double[] rainfall;
    private final double[] evaporation;
    private final double catchmentAreaKm2;
    private final double stepSeconds;

    public RainfallRunoffForecastAdapter(RunoffModel model,
                                         double[] rainfall,
                                         double[] evaporation,
                                         double catchmentAreaKm2,
                                         double stepSeconds) {
        if (!(catchmentAreaKm2 > 0.0) || !(stepSeconds > 0.0)) {
            throw new IllegalArgumentException("El área de la cuenca y la duración del paso deben ser positivas.");
        }
        this.model = model;
        this.rainfall = rainfall.clone();
        this.evaporation = evaporation.clone();
        this.catchmentAreaKm2 = catchmentAreaKm2;
        this.stepSeconds = stepSeconds;
    }

    @Override
    public double[] forecast(int currentStep, int leadTime) throws ForecastUnavailableException {
        int from = currentStep;
        int to = from + leadTime;
        if (to > rainfall.length || to > evaporation.length) {
            throw new ForecastUnavailableException(String.format(
                    "Forzamiento insuficiente: se necesitan los pasos [%d, %d) y solo hay %d.",
                    from, to, Math.min(rainfall.length, evaporation.length)));
        }

        double[] runoff;
        try {
            runoff = model.runoff(
                    Arrays.copyOfRange(rainfall, from, to),
                    Arrays.copyOfRange(evaporation, from, to));
        } catch (RuntimeException e) {
            throw new ForecastUnavailableException("El modelo lluvia-escorrentía falló en el paso " + currentStep, e);
        }
        if (runoff == null || runoff.length != leadTime) {
            throw new ForecastUnavailableException("El modelo lluvia-escorrentía devolvió una serie de longitud inesperada.");
        }

        double[] discharge = new double[leadTime];
        for (int i = 0; i < leadTime; i++) {
            double depth = Double.isFinite(runoff[i]) ? Math.max(0.0, runoff[i]) : 0.0;
            discharge[i] = depth * 1e-3 * catchmentAreaKm2 * 1e6 / stepSeconds;
        }
        log.debug("Pronóstico lluvia-escorrentía en el paso {}: {}", currentStep, discharge);
        return discharge;
    }
}
