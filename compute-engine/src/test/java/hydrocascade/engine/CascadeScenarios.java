package hydrocascade.engine;

import hydrocascade.config.CascadeConfig;
import hydrocascade.config.CurvePoint;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.config.RoutingLinkConfig;
import hydrocascade.config.SchedulingConfig;
import hydrocascade.config.ZoneBoundaries;
import hydrocascade.operation.rule.InflowProportionalRule;
import hydrocascade.operation.rule.ZoneRuleTable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Cascadas de prueba compartidas por los tests del motor, las métricas y la exportación.
 * <p>
 * Los embalses sencillos tienen una curva lineal: cota = 100 · volumen / capacidad.
 */
public final class CascadeScenarios {

    private CascadeScenarios() {
    }

    public static ReservoirConfig linearReservoir(String id, double capacity, double initialStorage,
                                                  double maxReleaseRate, ZoneRuleTable rules) {
        return ReservoirConfig.builder()
                .id(id)
                .capacity(capacity)
                .storageLevelCurve(List.of(new CurvePoint(0.0, 0.0), new CurvePoint(capacity, 100.0)))
                .zoneBoundaries(new ZoneBoundaries(10.0, 20.0, 80.0, 95.0))
                .floodLimitLevel(80.0)
                .maxReleaseRate(maxReleaseRate)
                .initialStorage(initialStorage)
                .zoneRules(rules)
                .build();
    }

    public static ReservoirConfig passThroughReservoir(String id, double capacity, double initialStorage,
                                                      double maxReleaseRate) {
        return linearReservoir(id, capacity, initialStorage, maxReleaseRate,
                ZoneRuleTable.uniform(InflowProportionalRule.passThrough()));
    }

    public static double[] constant(double value, int length) {
        double[] series = new double[length];
        Arrays.fill(series, value);
        return series;
    }

    public static SchedulingConfig scheduling(int horizon) {
        return SchedulingConfig.builder().horizon(horizon).deltaTime(1.0).build();
    }

    /**
     * Cadena A → B (τ=2) → C (τ=1) de embalses de paso; 100 de aporte constante en A.
     */
    public static CascadeConfig delayedChain(int horizon) {
        return CascadeConfig.builder()
                .reservoirs(List.of(
                        passThroughReservoir("A", 10000.0, 0.0, 1000.0),
                        passThroughReservoir("B", 10000.0, 0.0, 1000.0),
                        passThroughReservoir("C", 10000.0, 0.0, 1000.0)))
                .links(List.of(RoutingLinkConfig.of("A", "B", 2), RoutingLinkConfig.of("B", "C", 1)))
                .externalInflows(Map.of("A", constant(100.0, horizon)))
                .scheduling(scheduling(horizon))
                .build();
    }

    /**
     * Embalse a media capacidad con entrada 50 y desagüe máximo 30: gana 20 por paso
     * hasta llenarse en el paso 24.
     */
    public static CascadeConfig fillingReservoir(int horizon) {
        return CascadeConfig.builder()
                .reservoirs(List.of(passThroughReservoir("R", 1000.0, 500.0, 30.0)))
                .externalInflows(Map.of("R", constant(50.0, horizon)))
                .scheduling(scheduling(horizon))
                .build();
    }
}
