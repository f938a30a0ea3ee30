package hydrocascade.metrics;

import hydrocascade.config.SchedulingConfig;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.reservoir.MassBalanceOutcome;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.simulation.ReservoirMetrics;
import hydrocascade.domain.simulation.StepDiagnostic;
import hydrocascade.domain.simulation.SystemMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Acumula los pasos confirmados de una ejecución y calcula los indicadores de desempeño.
 * <p>
 * Solo recibe pasos ya confirmados, de modo que las métricas de una ejecución abortada
 * describen exactamente los pasos completados.
 */
public class MetricsCollector {

    private final Map<String, ReservoirAccumulator> accumulators = new LinkedHashMap<>();
    private final Set<String> outletIds;
    private final double deltaTime;
    private final double balanceTolerance;
    private final double totalCapacity;

    private double stepSystemOutflow;
    private double systemPeakOutflow;

    public MetricsCollector(CascadeTopology topology, SchedulingConfig scheduling) {
        this.deltaTime = scheduling.getDeltaTime();
        this.balanceTolerance = scheduling.getBalanceTolerance();
        this.totalCapacity = topology.totalCapacity();
        this.outletIds = topology.outlets().stream().map(Reservoir::getId).collect(Collectors.toSet());
        for (Reservoir reservoir : topology.getReservoirs()) {
            accumulators.put(reservoir.getId(), new ReservoirAccumulator(reservoir));
        }
    }

    /**
     * Registra el paso confirmado de un embalse.
     */
    public void record(String reservoirId, MassBalanceOutcome outcome, boolean preReleaseActive, boolean forecastUnavailable) {
        ReservoirAccumulator acc = accumulators.get(reservoirId);
        if (acc == null) {
            throw new IllegalArgumentException("Embalse desconocido para las métricas: " + reservoirId);
        }
        acc.add(outcome, preReleaseActive, forecastUnavailable, deltaTime);
        if (outletIds.contains(reservoirId)) {
            stepSystemOutflow += outcome.actualRelease();
        }
    }

    /**
     * Cierra el paso actual: actualiza el caudal máximo de salida del sistema.
     */
    public void closeStep() {
        systemPeakOutflow = Math.max(systemPeakOutflow, stepSystemOutflow);
        stepSystemOutflow = 0.0;
    }

    public SystemMetrics collect(List<StepDiagnostic> diagnostics) {
        Map<String, ReservoirMetrics> perReservoir = new LinkedHashMap<>();
        accumulators.forEach((id, acc) -> perReservoir.put(id, acc.toMetrics(deltaTime, balanceTolerance)));

        boolean compliant = perReservoir.values().stream().allMatch(ReservoirMetrics::floodLimitCompliant);
        boolean closed = perReservoir.values().stream().allMatch(ReservoirMetrics::balanceClosed);
        double maxResidual = perReservoir.values().stream()
                .mapToDouble(m -> Math.abs(m.waterBalanceResidual()))
                .max()
                .orElse(0.0);
        int violations = (int) diagnostics.stream().filter(StepDiagnostic::isMassBalanceViolation).count();

        return SystemMetrics.builder()
                .reservoirs(perReservoir)
                .floodLimitCompliant(compliant)
                .maxAbsoluteResidual(maxResidual)
                .balanceClosed(closed)
                .systemPeakOutflow(systemPeakOutflow)
                .totalCapacity(totalCapacity)
                .diagnosticCount(diagnostics.size())
                .massBalanceViolationCount(violations)
                .build();
    }

    /**
     * Tolerancia absoluta del cierre de balance: relativa al mayor de 1, el volumen
     * que atravesó el embalse y los volúmenes inicial y final.
     */
    static boolean isBalanceClosed(double residual, double throughput, double initialStorage,
                                   double finalStorage, double tolerance) {
        double scale = Math.max(Math.max(1.0, throughput), Math.max(initialStorage, finalStorage));
        return Math.abs(residual) <= tolerance * scale;
    }

    private static final class ReservoirAccumulator {

        private final String id;
        private final double floodLimitLevel;
        private final double initialStorage;
        private double finalStorage;

        private int steps;
        private double peakInflow;
        private double peakOutflow;
        private double maxLevel;
        private double minLevel;
        private double inflowVolume;
        private double outflowVolume;
        private double sumInflow;
        private double sumOutflow;
        private double forcedSpillVolume;
        private int forcedSpillSteps;
        private int curtailedSteps;
        private int preReleaseSteps;
        private int forecastUnavailableSteps;

        ReservoirAccumulator(Reservoir reservoir) {
            this.id = reservoir.getId();
            this.floodLimitLevel = reservoir.getFloodLimitLevel();
            this.initialStorage = reservoir.getInitialStorage();
            this.finalStorage = initialStorage;
            double initialLevel = reservoir.getCurve().levelAt(initialStorage);
            this.maxLevel = initialLevel;
            this.minLevel = initialLevel;
        }

        void add(MassBalanceOutcome outcome, boolean preRelease, boolean forecastUnavailable, double deltaTime) {
            steps++;
            peakInflow = Math.max(peakInflow, outcome.inflow());
            peakOutflow = Math.max(peakOutflow, outcome.actualRelease());
            maxLevel = Math.max(maxLevel, outcome.newLevel());
            minLevel = Math.min(minLevel, outcome.newLevel());
            sumInflow += outcome.inflow();
            sumOutflow += outcome.actualRelease();
            inflowVolume += outcome.inflow() * deltaTime;
            outflowVolume += outcome.actualRelease() * deltaTime;
            finalStorage = outcome.newStorage();
            if (outcome.isForcedSpill()) {
                forcedSpillSteps++;
                forcedSpillVolume += outcome.spill() * deltaTime;
            }
            if (outcome.isCurtailed()) {
                curtailedSteps++;
            }
            if (preRelease) {
                preReleaseSteps++;
            }
            if (forecastUnavailable) {
                forecastUnavailableSteps++;
            }
        }

        ReservoirMetrics toMetrics(double deltaTime, double tolerance) {
            double residual = (inflowVolume - outflowVolume) - (finalStorage - initialStorage);
            boolean closed = isBalanceClosed(residual, inflowVolume + outflowVolume,
                    initialStorage, finalStorage, tolerance);
            double shaving = peakInflow > 0.0 ? (peakInflow - peakOutflow) / peakInflow : 0.0;

            return ReservoirMetrics.builder()
                    .reservoirId(id)
                    .peakInflow(peakInflow)
                    .peakOutflow(peakOutflow)
                    .peakShavingRatio(shaving)
                    .maxLevel(maxLevel)
                    .minLevel(minLevel)
                    .floodLimitLevel(floodLimitLevel)
                    .floodLimitCompliant(maxLevel <= floodLimitLevel)
                    .waterBalanceResidual(residual)
                    .balanceClosed(closed)
                    .forcedSpillVolume(forcedSpillVolume)
                    .forcedSpillSteps(forcedSpillSteps)
                    .curtailedSteps(curtailedSteps)
                    .preReleaseSteps(preReleaseSteps)
                    .forecastUnavailableSteps(forecastUnavailableSteps)
                    .meanInflow(steps == 0 ? 0.0 : sumInflow / steps)
                    .meanOutflow(steps == 0 ? 0.0 : sumOutflow / steps)
                    .build();
        }
    }
}
