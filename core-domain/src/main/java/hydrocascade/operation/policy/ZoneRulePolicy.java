package hydrocascade.operation.policy;

import hydrocascade.domain.reservoir.OperatingZone;
import hydrocascade.domain.reservoir.ReservoirSnapshot;
import hydrocascade.operation.rule.ReleaseContext;
import hydrocascade.operation.rule.ZoneRuleTable;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Operación ordinaria: la zona actual selecciona la regla de la tabla.
 */
@RequiredArgsConstructor
public class ZoneRulePolicy implements OperatingPolicy {

    @Getter
    private final ZoneRuleTable rules;

    @Override
    public ReleaseDecision decide(ReservoirSnapshot reservoir, double currentInflow, double[] forecast, int step) {
        OperatingZone zone = reservoir.zone();
        ReleaseContext context = new ReleaseContext(
                zone,
                reservoir.level(),
                reservoir.storage(),
                currentInflow,
                reservoir.maxReleaseRate(),
                step
        );
        double raw = rules.ruleFor(zone).release(context);
        return new ReleaseDecision(
                OperatingPolicy.clampToReleaseRange(raw, reservoir.maxReleaseRate()),
                zone,
                false
        );
    }
}
