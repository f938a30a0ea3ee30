package hydrocascade.metrics;

import hydrocascade.domain.simulation.CascadeSimulationResult;
import hydrocascade.engine.CascadeScenarios;
import hydrocascade.engine.CascadeSimulator;
import hydrocascade.forecast.SeriesForecastAdapter;
import hydrocascade.config.CascadeConfig;
import hydrocascade.config.ForecastConfig;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.operation.rule.ZoneRuleTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioComparatorTest {

    private final ScenarioComparator comparator = new ScenarioComparator();

    @Test
    @DisplayName("El prevertido reduce la cota máxima respecto a la operación sin pronóstico")
    void compare_preReleaseLowersMaxLevel() {
        // --- 1. Arrange --- (embalse cerca del nivel límite y crecida anunciada)
        double[] flood = {100.0, 100.0, 100.0, 400.0, 600.0, 500.0, 200.0, 100.0, 100.0, 100.0, 100.0, 100.0};
        ReservoirConfig reservoir = CascadeScenarios
                .linearReservoir("R", 10000.0, 7500.0, 300.0, ZoneRuleTable.standard(100.0, 10.0))
                .withForecast(ForecastConfig.builder().leadTime(3).preReleaseGain(3.0).build());
        CascadeConfig config = CascadeConfig.builder()
                .reservoirs(List.of(reservoir))
                .externalInflows(Map.of("R", flood))
                .scheduling(CascadeScenarios.scheduling(9))
                .build();

        // --- 2. Act ---
        ScenarioComparison comparison;
        try (CascadeSimulator simulator = new CascadeSimulator(config, Map.of("R", new SeriesForecastAdapter(flood)))) {
            CascadeSimulationResult baseline = simulator.runWithoutForecast();
            CascadeSimulationResult candidate = simulator.runFullSimulation();
            comparison = comparator.compare(baseline, candidate);
        }

        // --- 3. Assert ---
        ReservoirComparison r = comparison.of("R");
        assertThat(r.maxLevelReduction()).isPositive();
        assertThat(r.candidateMaxLevel()).isLessThan(r.baselineMaxLevel());
        assertThat(r.baselineCompliant()).isFalse();
        assertThat(comparison.candidateCompliant()).isEqualTo(r.candidateCompliant());
    }

    @Test
    @DisplayName("Solo se comparan ejecuciones de la misma cascada")
    void compare_rejectsDifferentCascades() {
        CascadeSimulationResult chain;
        CascadeSimulationResult single;
        try (CascadeSimulator a = new CascadeSimulator(CascadeScenarios.delayedChain(4));
             CascadeSimulator b = new CascadeSimulator(CascadeScenarios.fillingReservoir(4))) {
            chain = a.runFullSimulation();
            single = b.runFullSimulation();
        }

        assertThatThrownBy(() -> comparator.compare(chain, single)).isInstanceOf(IllegalArgumentException.class);
        assertThat(comparator.compare(chain, chain).systemPeakOutflowReduction()).isZero();
    }
}
