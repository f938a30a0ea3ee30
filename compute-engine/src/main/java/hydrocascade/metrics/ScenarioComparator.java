package hydrocascade.metrics;

import hydrocascade.domain.simulation.CascadeSimulationResult;
import hydrocascade.domain.simulation.ReservoirMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compara un escenario base (p. ej. operación sin pronóstico) con un escenario
 * alternativo (p. ej. operación con prevertido) sobre la misma cascada.
 */
@Slf4j
public class ScenarioComparator {

    public ScenarioComparison compare(CascadeSimulationResult baseline, CascadeSimulationResult candidate) {
        Map<String, ReservoirMetrics> base = baseline.metrics().reservoirs();
        Map<String, ReservoirMetrics> cand = candidate.metrics().reservoirs();
        if (!base.keySet().equals(cand.keySet())) {
            throw new IllegalArgumentException("Los escenarios no corresponden a la misma cascada: "
                    + base.keySet() + " frente a " + cand.keySet());
        }

        Map<String, ReservoirComparison> comparisons = new LinkedHashMap<>();
        for (Map.Entry<String, ReservoirMetrics> entry : base.entrySet()) {
            ReservoirMetrics b = entry.getValue();
            ReservoirMetrics c = cand.get(entry.getKey());
            comparisons.put(entry.getKey(), new ReservoirComparison(
                    entry.getKey(),
                    b.maxLevel(),
                    c.maxLevel(),
                    b.maxLevel() - c.maxLevel(),
                    b.peakOutflow(),
                    c.peakOutflow(),
                    b.peakOutflow() - c.peakOutflow(),
                    b.floodLimitCompliant(),
                    c.floodLimitCompliant()
            ));
        }

        double systemReduction = baseline.metrics().systemPeakOutflow() - candidate.metrics().systemPeakOutflow();
        log.info("Comparación de escenarios: reducción del caudal máximo del sistema {}", String.format("%.3f", systemReduction));
        return new ScenarioComparison(Collections.unmodifiableMap(comparisons), systemReduction);
    }
}
