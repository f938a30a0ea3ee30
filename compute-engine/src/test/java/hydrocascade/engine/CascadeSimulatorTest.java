package hydrocascade.engine;

import hydrocascade.config.CascadeConfig;
import hydrocascade.config.ForecastConfig;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.domain.simulation.CascadeSimulationResult;
import hydrocascade.domain.simulation.DiagnosticType;
import hydrocascade.domain.simulation.ReservoirTimeSeries;
import hydrocascade.domain.simulation.StepDiagnostic;
import hydrocascade.exception.ConfigurationException;
import hydrocascade.forecast.ForecastAdapter;
import hydrocascade.forecast.SeriesForecastAdapter;
import hydrocascade.operation.rule.ZoneRuleTable;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static hydrocascade.engine.CascadeScenarios.linearReservoir;
import static hydrocascade.engine.CascadeScenarios.scheduling;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Pruebas de la fachada de simulación.
 */
@Slf4j
class CascadeSimulatorTest {

    private static final double[] FLOOD = {100.0, 100.0, 200.0, 300.0, 250.0, 150.0, 100.0, 100.0};

    /**
     * Embalse en zona normal (cota 50) con caudal de circulación 50 y prevertido configurado.
     */
    static CascadeConfig forecastCascade(long timeoutMillis) {
        ReservoirConfig reservoir = linearReservoir("R", 10000.0, 5000.0, 800.0, ZoneRuleTable.standard(50.0, 10.0))
                .withForecast(ForecastConfig.builder().leadTime(3).timeoutMillis(timeoutMillis).build());
        return CascadeConfig.builder()
                .reservoirs(List.of(reservoir))
                .externalInflows(Map.of("R", FLOOD))
                .scheduling(scheduling(5))
                .build();
    }

    @Test
    @DisplayName("Con pronóstico de pico el embalse prevacía 1.2 veces la entrada; sin pronóstico aplica la regla de zona")
    void runFullSimulation_shouldPreReleaseAheadOfPeak() {
        // --- 1. Arrange ---
        CascadeConfig config = forecastCascade(2000);

        try (CascadeSimulator simulator = new CascadeSimulator(config, Map.of("R", new SeriesForecastAdapter(FLOOD)))) {
            // --- 2. Act ---
            CascadeSimulationResult withForecast = simulator.runFullSimulation();
            CascadeSimulationResult baseline = simulator.runWithoutForecast();

            // --- 3. Assert ---
            ReservoirTimeSeries r = withForecast.seriesOf("R");
            // Paso 0: entrada 100, pronóstico [100, 100, 200] → max 200 > 150
            assertThat(r.preReleaseActive()[0]).isTrue();
            assertThat(r.requestedRelease()[0]).isCloseTo(120.0, within(1e-9));
            // Paso 2: entrada 200, pronóstico [200, 300, 250] → 300 ≤ 300, sin prevertido
            assertThat(r.preReleaseActive()[2]).isFalse();
            assertThat(r.requestedRelease()[2]).isEqualTo(50.0);

            assertThat(baseline.seriesOf("R").preReleaseActive()).containsOnly(false);
            assertThat(baseline.seriesOf("R").requestedRelease()).containsOnly(50.0);
            assertThat(withForecast.seriesOf("R").finalStorage()).isLessThan(baseline.seriesOf("R").finalStorage());
            log.info("Volumen final con prevertido {} frente a {} sin él",
                    withForecast.seriesOf("R").finalStorage(), baseline.seriesOf("R").finalStorage());
        }
    }

    @Test
    @DisplayName("Cada ejecución parte del estado inicial")
    void runFullSimulation_isRepeatable() {
        try (CascadeSimulator simulator = new CascadeSimulator(CascadeScenarios.delayedChain(6))) {
            CascadeSimulationResult first = simulator.runFullSimulation();
            CascadeSimulationResult second = simulator.runFullSimulation();

            assertThat(second.series()).isEqualTo(first.series());
            assertThat(simulator.getTopology().completedSteps()).isEqualTo(6);
        }
    }

    @Test
    @DisplayName("Un adaptador lento agota su tiempo y la simulación continúa con la regla de zona")
    void runFullSimulation_slowForecastIsUnavailable() {
        ForecastAdapter slow = (step, leadTime) -> {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new double[]{1e6, 1e6, 1e6};
        };

        try (CascadeSimulator simulator = new CascadeSimulator(forecastCascade(30), Map.of("R", slow))) {
            CascadeSimulationResult result = simulator.runFullSimulation();

            assertThat(result.isComplete()).isTrue();
            assertThat(result.seriesOf("R").preReleaseActive()).containsOnly(false);
            assertThat(result.diagnosticsOf("R"))
                    .extracting(StepDiagnostic::type)
                    .containsOnly(DiagnosticType.FORECAST_UNAVAILABLE)
                    .hasSize(5);
            assertThat(result.metrics().of("R").forecastUnavailableSteps()).isEqualTo(5);
        }
    }

    @Test
    @DisplayName("El simulador trabaja sobre una copia de las series de aportes")
    void runFullSimulation_usesInflowsCapturedAtConstruction() {
        CascadeConfig config = CascadeScenarios.fillingReservoir(4);

        try (CascadeSimulator simulator = new CascadeSimulator(config)) {
            double[] callerSeries = config.getExternalInflows().get("R");
            callerSeries[0] = Double.NaN;
            callerSeries[1] = -50.0;

            CascadeSimulationResult result = simulator.runFullSimulation();

            assertThat(result.isComplete()).isTrue();
            assertThat(result.seriesOf("R").storage()[0]).isCloseTo(520.0, within(1e-9));
            assertThat(result.seriesOf("R").storage()[1]).isCloseTo(540.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Un embalse sin adaptador se detecta antes de preparar los adaptadores de los demás")
    void constructor_shouldCheckEveryAdapterBeforeWrapping() {
        ForecastConfig forecast = ForecastConfig.builder().leadTime(3).build();
        CascadeConfig config = CascadeConfig.builder()
                .reservoirs(List.of(
                        linearReservoir("R", 10000.0, 5000.0, 800.0, ZoneRuleTable.standard(50.0, 10.0)).withForecast(forecast),
                        linearReservoir("S", 10000.0, 5000.0, 800.0, ZoneRuleTable.standard(50.0, 10.0)).withForecast(forecast)))
                .externalInflows(Map.of("R", FLOOD))
                .scheduling(scheduling(5))
                .build();
        ForecastAdapter adapter = mock(ForecastAdapter.class);

        assertThatThrownBy(() -> new CascadeSimulator(config, Map.of("R", adapter)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("[S]");
        verifyNoInteractions(adapter);
    }

    @Test
    @DisplayName("Configuración de pronóstico sin adaptador, o adaptador de un embalse inexistente, es un error")
    void constructor_shouldValidateForecastAdapters() {
        CascadeConfig config = forecastCascade(2000);

        assertThatThrownBy(() -> new CascadeSimulator(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("[R]");
        assertThatThrownBy(() -> new CascadeSimulator(config, Map.of(
                "R", new SeriesForecastAdapter(FLOOD),
                "X", new SeriesForecastAdapter(FLOOD))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("[X]");
    }
}
