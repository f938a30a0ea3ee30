package hydrocascade.operation.policy;

import hydrocascade.config.ForecastConfig;
import hydrocascade.domain.reservoir.OperatingZone;
import hydrocascade.domain.reservoir.ReservoirSnapshot;
import hydrocascade.operation.rule.ZoneRuleTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Pruebas de la operación con prevertido.
 */
class ForecastAwarePolicyTest {

    private ForecastAwarePolicy policy;
    private ReservoirSnapshot normalReservoir;

    @BeforeEach
    void setUp() {
        ForecastConfig forecast = ForecastConfig.builder().leadTime(3).build();
        policy = new ForecastAwarePolicy(ZoneRuleTable.standard(50.0, 10.0), forecast);
        normalReservoir = new ReservoirSnapshot("R1", 8000.0, 112.0, OperatingZone.NORMAL, 15000.0, 800.0, 120.0);
    }

    @Test
    @DisplayName("Un pico pronosticado por encima de 1.5 veces la entrada activa el prevertido de 1.2 veces la entrada")
    void decide_shouldPreReleaseWhenPeakIsForecast() {
        // --- 2. Act ---
        ReleaseDecision decision = policy.decide(normalReservoir, 100.0, new double[]{100.0, 200.0, 300.0}, 0);

        // --- 3. Assert ---
        assertThat(decision.preReleaseActive()).isTrue();
        assertThat(decision.requestedRelease()).isCloseTo(120.0, within(1e-9));
        assertThat(decision.zone()).isEqualTo(OperatingZone.NORMAL);
    }

    @Test
    @DisplayName("Sin pico suficiente, o sin pronóstico, se aplica la regla de la zona")
    void decide_shouldFallBackToZoneRule() {
        ReleaseDecision flat = policy.decide(normalReservoir, 100.0, new double[]{120.0, 150.0, 140.0}, 0);
        ReleaseDecision none = policy.decide(normalReservoir, 100.0, null, 0);
        ReleaseDecision empty = policy.decide(normalReservoir, 100.0, new double[0], 0);

        assertThat(flat.preReleaseActive()).isFalse();
        assertThat(flat.requestedRelease()).isEqualTo(50.0);
        assertThat(none).isEqualTo(flat);
        assertThat(empty).isEqualTo(flat);
    }

    @Test
    @DisplayName("La decisión es determinista para la misma zona, entrada y pronóstico")
    void decide_isDeterministic() {
        double[] forecast = {90.0, 400.0, 10.0};

        ReleaseDecision first = policy.decide(normalReservoir, 200.0, forecast, 4);
        for (int i = 0; i < 10; i++) {
            assertThat(policy.decide(normalReservoir, 200.0, forecast.clone(), 4)).isEqualTo(first);
        }
        assertThat(policy.usesForecast()).isTrue();
    }

    @Test
    @DisplayName("El prevertido también respeta el desagüe máximo")
    void decide_preReleaseIsClamped() {
        ReleaseDecision decision = policy.decide(normalReservoir, 700.0, new double[]{2000.0}, 0);

        assertThat(decision.preReleaseActive()).isTrue();
        assertThat(decision.requestedRelease()).isEqualTo(800.0);
    }
}
