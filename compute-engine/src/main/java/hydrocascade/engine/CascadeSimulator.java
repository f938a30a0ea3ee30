package hydrocascade.engine;

import hydrocascade.config.CascadeConfig;
import hydrocascade.config.ForecastConfig;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.simulation.CascadeSimulationResult;
import hydrocascade.exception.ConfigurationException;
import hydrocascade.factory.CascadeTopologyFactory;
import hydrocascade.forecast.ForecastAdapter;
import hydrocascade.forecast.TimeLimitedForecastAdapter;
import hydrocascade.operation.policy.ForecastAwarePolicy;
import hydrocascade.operation.policy.ZoneRulePolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fachada de simulación de una cascada.
 * <p>
 * Construye la topología a partir de la configuración, asigna a cada embalse su
 * política (con prevertido si tiene configuración de pronóstico) y delega la ejecución
 * en el {@link SchedulingEngine}. Los adaptadores de pronóstico se envuelven en un
 * {@link TimeLimitedForecastAdapter} con el tiempo máximo configurado.
 */
@Slf4j
public class CascadeSimulator implements AutoCloseable {

    @Getter
    private final CascadeConfig config;
    @Getter
    private final CascadeTopology topology;
    private final SchedulingEngine engine;
    private final Map<String, double[]> externalInflows;
    private final Map<String, ReservoirOperation> forecastOperations;
    private final Map<String, ReservoirOperation> regularOperations;
    private final List<TimeLimitedForecastAdapter> timeLimitedAdapters = new ArrayList<>();

    public CascadeSimulator(CascadeConfig config) {
        this(config, Map.of());
    }

    /**
     * @param config            Configuración completa de la cascada.
     * @param forecastAdapters  Adaptador de pronóstico por embalse. Todo embalse con
     *                          {@link ForecastConfig} necesita uno.
     * @throws ConfigurationException si la configuración es inválida.
     */
    public CascadeSimulator(CascadeConfig config, Map<String, ForecastAdapter> forecastAdapters) {
        this.config = config;
        this.topology = new CascadeTopologyFactory().create(config);

        for (String id : forecastAdapters.keySet()) {
            if (!topology.contains(id)) {
                throw new ConfigurationException(id, "Adaptador de pronóstico para un embalse inexistente.");
            }
        }
        for (ReservoirConfig reservoir : config.getReservoirs()) {
            if (reservoir.participatesInForecast() && forecastAdapters.get(reservoir.id()) == null) {
                throw new ConfigurationException(reservoir.id(),
                        "El embalse tiene configuración de pronóstico pero no hay adaptador.");
            }
        }
        Map<String, double[]> inflows = new LinkedHashMap<>();
        if (config.getExternalInflows() != null) {
            config.getExternalInflows().forEach((id, series) -> inflows.put(id, series.clone()));
        }
        this.externalInflows = Collections.unmodifiableMap(inflows);

        Map<String, ReservoirOperation> withForecast = new LinkedHashMap<>();
        Map<String, ReservoirOperation> regular = new LinkedHashMap<>();
        for (ReservoirConfig reservoir : config.getReservoirs()) {
            ZoneRulePolicy zonePolicy = new ZoneRulePolicy(reservoir.zoneRules());
            regular.put(reservoir.id(), ReservoirOperation.regular(zonePolicy));

            if (reservoir.participatesInForecast()) {
                ForecastAdapter adapter = forecastAdapters.get(reservoir.id());
                ForecastConfig forecast = reservoir.forecast();
                TimeLimitedForecastAdapter limited = new TimeLimitedForecastAdapter(adapter, forecast.getTimeoutMillis());
                timeLimitedAdapters.add(limited);
                withForecast.put(reservoir.id(), new ReservoirOperation(
                        new ForecastAwarePolicy(zonePolicy, forecast.getPreReleaseFactor(), forecast.getPreReleaseGain()),
                        limited,
                        forecast.getLeadTime()));
            } else {
                if (forecastAdapters.containsKey(reservoir.id())) {
                    log.warn("El embalse {} no tiene configuración de pronóstico; se ignora su adaptador.", reservoir.id());
                }
                withForecast.put(reservoir.id(), ReservoirOperation.regular(zonePolicy));
            }
        }
        this.forecastOperations = Collections.unmodifiableMap(withForecast);
        this.regularOperations = Collections.unmodifiableMap(regular);
        this.engine = new SchedulingEngine(config.getScheduling().getParallelism());

        log.info("CascadeSimulator inicializado: {} embalses, {} con prevertido.",
                config.getReservoirs().size(), timeLimitedAdapters.size());
    }

    /**
     * Reinicia la cascada y ejecuta el horizonte completo con las políticas configuradas.
     */
    public CascadeSimulationResult runFullSimulation() {
        log.info("Ejecutando simulación completa.");
        return execute(forecastOperations);
    }

    /**
     * Reinicia la cascada y ejecuta el horizonte completo solo con las reglas de zona,
     * sin consultar pronósticos. Sirve de escenario base para comparar el prevertido.
     */
    public CascadeSimulationResult runWithoutForecast() {
        log.info("Ejecutando simulación sin pronóstico (escenario base).");
        return execute(regularOperations);
    }

    private CascadeSimulationResult execute(Map<String, ReservoirOperation> operations) {
        topology.reset();
        return engine.run(topology, externalInflows, operations, config.getScheduling());
    }

    @Override
    public void close() {
        engine.close();
        timeLimitedAdapters.forEach(TimeLimitedForecastAdapter::close);
        log.info("CascadeSimulator cerrado.");
    }
}
