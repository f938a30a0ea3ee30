package hydrocascade.forecast;

import hydrocascade.exception.ForecastUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Cuenca de 36 km² con paso horario: 1 mm de escorrentía equivale a 10 m³/s.
 */
class RainfallRunoffForecastAdapterTest {

    private static final double AREA_KM2 = 36.0;
    private static final double HOUR = 3600.0;

    private final double[] rainfall = {0.0, 10.0, 20.0, 30.0};
    private final double[] evaporation = {0.0, 0.0, 0.0, 0.0};

    @Test
    @DisplayName("Convierte la lámina de escorrentía del horizonte de previsión a caudal")
    void forecast_shouldConvertRunoffDepthToDischarge() throws ForecastUnavailableException {
        RainfallRunoffForecastAdapter adapter = new RainfallRunoffForecastAdapter(
                new RunoffCoefficientModel(0.5), rainfall, evaporation, AREA_KM2, HOUR);

        double[] forecast = adapter.forecast(1, 3);

        assertThat(forecast).hasSize(3);
        assertThat(forecast[0]).isCloseTo(50.0, within(1e-9));
        assertThat(forecast[1]).isCloseTo(100.0, within(1e-9));
        assertThat(forecast[2]).isCloseTo(150.0, within(1e-9));
        assertThat(adapter.forecast(0, 1)[0]).isZero();
    }

    @Test
    @DisplayName("Sin forzamiento suficiente para el horizonte el pronóstico no está disponible")
    void forecast_shouldFailWhenForcingIsShort() {
        RainfallRunoffForecastAdapter adapter = new RainfallRunoffForecastAdapter(
                new RunoffCoefficientModel(0.5), rainfall, evaporation, AREA_KM2, HOUR);

        assertThatThrownBy(() -> adapter.forecast(2, 3))
                .isInstanceOf(ForecastUnavailableException.class)
                .hasMessageContaining("insuficiente");
    }

    @Test
    @DisplayName("Los valores no finitos o negativos del modelo se sustituyen por cero")
    void forecast_shouldSanitizeModelOutput() throws ForecastUnavailableException {
        RunoffModel noisy = (rain, evap) -> new double[]{Double.NaN, -4.0, 2.0};
        RainfallRunoffForecastAdapter adapter = new RainfallRunoffForecastAdapter(
                noisy, rainfall, evaporation, AREA_KM2, HOUR);

        double[] forecast = adapter.forecast(0, 3);

        assertThat(forecast[0]).isZero();
        assertThat(forecast[1]).isZero();
        assertThat(forecast[2]).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Un fallo del modelo o una salida de longitud distinta se traduce en pronóstico no disponible")
    void forecast_shouldWrapModelFailures() {
        RainfallRunoffForecastAdapter failing = new RainfallRunoffForecastAdapter(
                (rain, evap) -> {
                    throw new IllegalStateException("modelo sin calibrar");
                }, rainfall, evaporation, AREA_KM2, HOUR);
        RainfallRunoffForecastAdapter truncated = new RainfallRunoffForecastAdapter(
                (rain, evap) -> new double[]{1.0}, rainfall, evaporation, AREA_KM2, HOUR);

        assertThatThrownBy(() -> failing.forecast(0, 2))
                .isInstanceOf(ForecastUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> truncated.forecast(0, 2))
                .isInstanceOf(ForecastUnavailableException.class);
    }

    @Test
    @DisplayName("El modelo de coeficiente descuenta la evaporación")
    void runoffCoefficientModel() {
        RunoffCoefficientModel model = new RunoffCoefficientModel(0.4);

        assertThat(model.runoff(new double[]{10.0, 2.0}, new double[]{5.0, 4.0}))
                .containsExactly(2.0, 0.0);
        assertThatThrownBy(() -> new RunoffCoefficientModel(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
