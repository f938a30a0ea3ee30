package hydrocascade.operation.policy;

import hydrocascade.config.ForecastConfig;
import hydrocascade.domain.reservoir.ReservoirSnapshot;
import hydrocascade.operation.rule.ZoneRuleTable;
import lombok.Getter;

/**
 * Operación con prevertido basado en pronóstico.
 * <p>
 * La guarda se evalúa antes de consultar la tabla de zonas:
 * si {@code max(pronóstico) > caudalActual × preReleaseFactor} se libera
 * {@code caudalActual × preReleaseGain}; en otro caso se aplica la regla de la zona.
 * Sin pronóstico (null o vacío) siempre se aplica la regla ordinaria.
 * <p>
 * La guarda se reevalúa en cada paso, sin histéresis.
 */
public class ForecastAwarePolicy implements OperatingPolicy {

    private final ZoneRulePolicy regularPolicy;
    @Getter
    private final double preReleaseFactor;
    @Getter
    private final double preReleaseGain;

    public ForecastAwarePolicy(ZoneRulePolicy regularPolicy, double preReleaseFactor, double preReleaseGain) {
        this.regularPolicy = regularPolicy;
        this.preReleaseFactor = preReleaseFactor;
        this.preReleaseGain = preReleaseGain;
    }

    public ForecastAwarePolicy(ZoneRuleTable rules, ForecastConfig forecastConfig) {
        this(new ZoneRulePolicy(rules), forecastConfig.getPreReleaseFactor(), forecastConfig.getPreReleaseGain());
    }

    @Override
    public ReleaseDecision decide(ReservoirSnapshot reservoir, double currentInflow, double[] forecast, int step) {
        if (isPreReleaseTriggered(currentInflow, forecast)) {
            double release = OperatingPolicy.clampToReleaseRange(
                    currentInflow * preReleaseGain, reservoir.maxReleaseRate());
            return new ReleaseDecision(release, reservoir.zone(), true);
        }
        return regularPolicy.decide(reservoir, currentInflow, null, step);
    }

    @Override
    public boolean usesForecast() {
        return true;
    }

    boolean isPreReleaseTriggered(double currentInflow, double[] forecast) {
        if (forecast == null || forecast.length == 0) {
            return false;
        }
        double maxForecast = Double.NEGATIVE_INFINITY;
        for (double value : forecast) {
            maxForecast = Math.max(maxForecast, value);
        }
        return maxForecast > currentInflow * preReleaseFactor;
    }
}
