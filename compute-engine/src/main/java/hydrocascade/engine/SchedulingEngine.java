package hydrocascade.engine;

import hydrocascade.config.SchedulingConfig;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.reservoir.MassBalanceOutcome;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.simulation.CascadeSimulationResult;
import hydrocascade.domain.simulation.DiagnosticType;
import hydrocascade.domain.simulation.StepDiagnostic;
import hydrocascade.exception.ConfigurationException;
import hydrocascade.exception.HorizonMismatchException;
import hydrocascade.exception.SimulationAbortedException;
import hydrocascade.metrics.MetricsCollector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Motor de programación por pasos de la cascada.
 * <p>
 * En cada paso recorre las capas de evaluación de la topología. Los embalses de una
 * misma capa son independientes en el paso actual y se evalúan en el pool de hilos
 * cuando {@code parallelism > 1}. Cada evaluación produce un {@link PendingStep}; solo
 * cuando todas las capas terminan sin error se confirman todos los embalses, de modo que
 * un paso se aplica entero o no se aplica.
 * <p>
 * El motor no guarda estado de simulación: todo el estado vive en la topología.
 */
@Slf4j
public class SchedulingEngine implements AutoCloseable {

    @Getter
    private final int parallelism;
    private final ExecutorService threadPool;

    public SchedulingEngine(int parallelism) {
        this.parallelism = Math.max(parallelism, 1);
        this.threadPool = Executors.newFixedThreadPool(this.parallelism);
        log.info("SchedulingEngine inicializado con {} hilo(s).", this.parallelism);
    }

    /**
     * Ejecuta el horizonte completo sobre una topología sin pasos confirmados.
     *
     * @param topology        Cascada a simular (se muta).
     * @param externalInflows Serie de aportes externos por embalse; los ausentes reciben 0.
     * @param operations      Modo de operación por embalse (obligatorio para todos).
     * @param scheduling      Horizonte, Δt y tolerancias.
     * @throws ConfigurationException      si faltan operaciones o las series no encajan con la topología.
     * @throws SimulationAbortedException  si un paso falla de forma inesperada.
     */
    public CascadeSimulationResult run(CascadeTopology topology,
                                       Map<String, double[]> externalInflows,
                                       Map<String, ReservoirOperation> operations,
                                       SchedulingConfig scheduling) {
        validateInputs(topology, externalInflows, operations, scheduling);
        if (topology.completedSteps() != 0) {
            throw new IllegalStateException("La topología ya tiene " + topology.completedSteps()
                    + " pasos confirmados; reiníciela antes de ejecutar.");
        }

        long startTime = System.currentTimeMillis();
        int horizon = scheduling.getHorizon();
        MetricsCollector collector = new MetricsCollector(topology, scheduling);
        List<StepDiagnostic> diagnostics = new ArrayList<>();
        log.info("Iniciando programación: {} embalses, {} pasos, Δt={}.",
                topology.getReservoirs().size(), horizon, scheduling.getDeltaTime());

        for (int step = 0; step < horizon; step++) {
            try {
                List<PendingStep> pending = evaluateStep(step, topology, externalInflows, operations, scheduling);
                commitStep(step, pending, collector, diagnostics);
            } catch (ExecutionException e) {
                throw abort(step, topology, scheduling, collector, diagnostics, startTime, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw abort(step, topology, scheduling, collector, diagnostics, startTime, e);
            } catch (RuntimeException e) {
                throw abort(step, topology, scheduling, collector, diagnostics, startTime, e);
            }
        }

        CascadeSimulationResult result = buildResult(horizon, topology, scheduling, collector, diagnostics, startTime);
        log.info("Programación completada en {} ms. {} incidencias.", result.simulationTime(), diagnostics.size());
        return result;
    }

    private List<PendingStep> evaluateStep(int step,
                                           CascadeTopology topology,
                                           Map<String, double[]> externalInflows,
                                           Map<String, ReservoirOperation> operations,
                                           SchedulingConfig scheduling) throws ExecutionException, InterruptedException {
        StepOutflowLookup lookup = new StepOutflowLookup(topology, step);
        List<PendingStep> pending = new ArrayList<>(topology.getReservoirs().size());

        for (List<Reservoir> layer : topology.getEvaluationLayers()) {
            List<ReservoirStepTask> tasks = new ArrayList<>(layer.size());
            for (Reservoir reservoir : layer) {
                double[] series = externalInflows.get(reservoir.getId());
                tasks.add(new ReservoirStepTask(
                        step,
                        reservoir,
                        topology.incomingLinks(reservoir.getId()),
                        series == null ? 0.0 : series[step],
                        operations.get(reservoir.getId()),
                        lookup,
                        scheduling.getDeltaTime()
                ));
            }

            if (parallelism > 1 && tasks.size() > 1) {
                List<Future<PendingStep>> futures = threadPool.invokeAll(tasks);
                for (Future<PendingStep> future : futures) {
                    pending.add(future.get());
                }
            } else {
                for (ReservoirStepTask task : tasks) {
                    pending.add(task.call());
                }
            }
        }
        return pending;
    }

    private void commitStep(int step, List<PendingStep> pending, MetricsCollector collector, List<StepDiagnostic> diagnostics) {
        for (PendingStep p : pending) {
            Reservoir reservoir = p.reservoir();
            MassBalanceOutcome outcome = p.outcome();
            reservoir.commit(step, outcome, p.decision().preReleaseActive());
            collector.record(reservoir.getId(), outcome, p.decision().preReleaseActive(), p.forecastUnavailable());
            recordDiagnostics(step, p, diagnostics);
        }
        collector.closeStep();
        if (log.isDebugEnabled()) {
            log.debug("Paso {} confirmado para {} embalses.", step, pending.size());
        }
    }

    private void recordDiagnostics(int step, PendingStep p, List<StepDiagnostic> diagnostics) {
        String id = p.reservoir().getId();
        MassBalanceOutcome outcome = p.outcome();

        if (p.forecastUnavailable()) {
            log.warn("Paso {}: pronóstico no disponible para {} ({}). Se aplica la regla ordinaria.",
                    step, id, p.forecastFailure());
            diagnostics.add(new StepDiagnostic(step, id, DiagnosticType.FORECAST_UNAVAILABLE, p.forecastFailure()));
        }
        if (outcome.isForcedSpill()) {
            String message = String.format("Vertido forzado de %.3f: el volumen superaría la capacidad.", outcome.spill());
            log.warn("Paso {}: {} {}", step, id, message);
            diagnostics.add(new StepDiagnostic(step, id, DiagnosticType.FORCED_SPILL, message));
        }
        if (outcome.isCurtailed()) {
            String message = String.format("Desagüe reducido en %.3f por volumen insuficiente.", outcome.curtailment());
            log.warn("Paso {}: {} {}", step, id, message);
            diagnostics.add(new StepDiagnostic(step, id, DiagnosticType.RELEASE_CURTAILED, message));
        }
        if (outcome.zonesCrossed() > 1) {
            String message = "Transición " + outcome.previousZone() + " -> " + outcome.newZone()
                    + " atravesando " + outcome.zonesCrossed() + " fronteras en un paso.";
            log.info("Paso {}: {} {}", step, id, message);
            diagnostics.add(new StepDiagnostic(step, id, DiagnosticType.MULTI_ZONE_TRANSITION, message));
        }
    }

    private SimulationAbortedException abort(int step,
                                             CascadeTopology topology,
                                             SchedulingConfig scheduling,
                                             MetricsCollector collector,
                                             List<StepDiagnostic> diagnostics,
                                             long startTime,
                                             Throwable cause) {
        log.error("Simulación abortada en el paso {}. Se conservan {} pasos completados.", step, step, cause);
        CascadeSimulationResult partial = buildResult(step, topology, scheduling, collector, diagnostics, startTime);
        return new SimulationAbortedException("Simulación abortada en el paso " + step + ": " + cause.getMessage(),
                partial, cause);
    }

    private static CascadeSimulationResult buildResult(int completedSteps,
                                                       CascadeTopology topology,
                                                       SchedulingConfig scheduling,
                                                       MetricsCollector collector,
                                                       List<StepDiagnostic> diagnostics,
                                                       long startTime) {
        return new CascadeSimulationResult(
                completedSteps,
                scheduling.getHorizon(),
                scheduling.getDeltaTime(),
                topology.timeSeries(),
                diagnostics,
                collector.collect(diagnostics),
                System.currentTimeMillis() - startTime
        );
    }

    private static void validateInputs(CascadeTopology topology,
                                       Map<String, double[]> externalInflows,
                                       Map<String, ReservoirOperation> operations,
                                       SchedulingConfig scheduling) {
        for (Reservoir reservoir : topology.getReservoirs()) {
            if (!operations.containsKey(reservoir.getId())) {
                throw new ConfigurationException(reservoir.getId(), "No hay modo de operación para el embalse.");
            }
        }
        for (Map.Entry<String, double[]> entry : externalInflows.entrySet()) {
            if (!topology.contains(entry.getKey())) {
                throw new ConfigurationException(entry.getKey(), "Serie de aportes externos para un embalse inexistente.");
            }
            int length = entry.getValue() == null ? 0 : entry.getValue().length;
            if (length < scheduling.getHorizon()) {
                throw new HorizonMismatchException(entry.getKey(), scheduling.getHorizon(), length);
            }
            double[] series = entry.getValue();
            for (int t = 0; t < scheduling.getHorizon(); t++) {
                if (!Double.isFinite(series[t]) || series[t] < 0.0) {
                    throw new ConfigurationException(entry.getKey(), "Aporte externo inválido en el paso " + t + ": " + series[t]);
                }
            }
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("SchedulingEngine cerrado.");
    }
}
