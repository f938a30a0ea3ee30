package hydrocascade.factory;

import hydrocascade.config.CascadeConfig;
import hydrocascade.config.CurvePoint;
import hydrocascade.config.ForecastConfig;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.config.RoutingLinkConfig;
import hydrocascade.config.SchedulingConfig;
import hydrocascade.domain.reservoir.OperatingZone;
import hydrocascade.domain.reservoir.PiecewiseLinearStorageCurve;
import hydrocascade.exception.ConfigurationException;
import hydrocascade.exception.HorizonMismatchException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validación completa de una {@link CascadeConfig} antes de construir nada.
 * <p>
 * Cada error identifica la entidad defectuosa. La estructura del grafo (ids duplicados,
 * enlaces a embalses inexistentes, ciclos de retardo nulo) la verifica
 * {@link hydrocascade.domain.cascade.CascadeTopology} al construirse.
 */
public class CascadeConfigValidator {

    private static final String SCHEDULING = "scheduling";

    public void validate(CascadeConfig config) {
        if (config == null) {
            throw new ConfigurationException("cascade", "La configuración no puede ser nula.");
        }
        validateScheduling(config.getScheduling());
        if (config.getReservoirs() == null || config.getReservoirs().isEmpty()) {
            throw new ConfigurationException("cascade", "La cascada debe contener al menos un embalse.");
        }
        config.getReservoirs().forEach(this::validateReservoir);
        if (config.getLinks() != null) {
            config.getLinks().forEach(this::validateLink);
        }
        validateInflows(config);
    }

    void validateScheduling(SchedulingConfig scheduling) {
        if (scheduling == null) {
            throw new ConfigurationException(SCHEDULING, "Falta la configuración temporal.");
        }
        if (scheduling.getHorizon() < 1) {
            throw new ConfigurationException(SCHEDULING, "El horizonte debe ser de al menos un paso: " + scheduling.getHorizon());
        }
        if (!(scheduling.getDeltaTime() > 0.0) || !Double.isFinite(scheduling.getDeltaTime())) {
            throw new ConfigurationException(SCHEDULING, "El paso de tiempo debe ser positivo y finito: " + scheduling.getDeltaTime());
        }
        if (scheduling.getParallelism() < 1) {
            throw new ConfigurationException(SCHEDULING, "El paralelismo debe ser al menos 1: " + scheduling.getParallelism());
        }
        if (!(scheduling.getBalanceTolerance() > 0.0)) {
            throw new ConfigurationException(SCHEDULING, "La tolerancia del balance debe ser positiva.");
        }
    }

    void validateReservoir(ReservoirConfig reservoir) {
        if (reservoir == null) {
            throw new ConfigurationException("cascade", "Embalse nulo en la configuración.");
        }
        String id = reservoir.id();
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("cascade", "Embalse sin identificador.");
        }
        if (!(reservoir.capacity() > 0.0) || !Double.isFinite(reservoir.capacity())) {
            throw new ConfigurationException(id, "La capacidad debe ser positiva y finita: " + reservoir.capacity());
        }
        if (!(reservoir.maxReleaseRate() > 0.0) || !Double.isFinite(reservoir.maxReleaseRate())) {
            throw new ConfigurationException(id, "El desagüe máximo debe ser positivo y finito: " + reservoir.maxReleaseRate());
        }
        if (!Double.isFinite(reservoir.floodLimitLevel())) {
            throw new ConfigurationException(id, "El nivel límite de avenidas debe ser finito.");
        }

        List<CurvePoint> curve = reservoir.storageLevelCurve();
        if (!PiecewiseLinearStorageCurve.isStrictlyMonotonic(curve)) {
            throw new ConfigurationException(id,
                    "La curva cota-volumen no es monótona: necesita al menos dos puntos estrictamente crecientes en volumen y cota.");
        }
        double curveMin = curve.get(0).storage();
        double curveMax = curve.get(curve.size() - 1).storage();
        if (curveMin > 0.0 || curveMax < reservoir.capacity()) {
            throw new ConfigurationException(id, String.format(
                    "La curva cota-volumen cubre [%.3f, %.3f] y no abarca el rango [0, %.3f].",
                    curveMin, curveMax, reservoir.capacity()));
        }

        if (reservoir.zoneBoundaries() == null || !reservoir.zoneBoundaries().isStrictlyOrdered()) {
            throw new ConfigurationException(id,
                    "Las cotas de zona deben ser finitas y estrictamente crecientes (muerta < normal < avenidas < sobrealmacenamiento): "
                            + reservoir.zoneBoundaries());
        }

        if (reservoir.zoneRules() == null) {
            throw new ConfigurationException(id, "Falta la tabla de reglas por zona.");
        }
        Set<OperatingZone> missing = reservoir.zoneRules().missingZones();
        if (!missing.isEmpty()) {
            throw new ConfigurationException(id, "La tabla de reglas no cubre las zonas " + missing);
        }

        double initialStorage = resolveInitialStorage(reservoir);
        if (!Double.isFinite(initialStorage) || initialStorage < 0.0 || initialStorage > reservoir.capacity()) {
            throw new ConfigurationException(id, String.format(
                    "El estado inicial (volumen %.3f) está fuera de [0, %.3f].", initialStorage, reservoir.capacity()));
        }

        if (reservoir.forecast() != null) {
            validateForecast(id, reservoir.forecast());
        }
    }

    void validateForecast(String reservoirId, ForecastConfig forecast) {
        if (forecast.getLeadTime() < 1) {
            throw new ConfigurationException(reservoirId, "El horizonte de previsión debe ser de al menos un paso.");
        }
        if (!(forecast.getPreReleaseFactor() > 0.0) || !(forecast.getPreReleaseGain() > 0.0)) {
            throw new ConfigurationException(reservoirId, "El factor y la ganancia de prevertido deben ser positivos.");
        }
        if (forecast.getTimeoutMillis() <= 0) {
            throw new ConfigurationException(reservoirId, "El tiempo máximo del pronóstico debe ser positivo.");
        }
    }

    void validateLink(RoutingLinkConfig link) {
        if (link == null) {
            throw new ConfigurationException("cascade", "Enlace nulo en la configuración.");
        }
        String entity = link.upstreamId() + "->" + link.downstreamId();
        if (link.upstreamId() == null || link.downstreamId() == null) {
            throw new ConfigurationException(entity, "El enlace necesita embalse de aguas arriba y de aguas abajo.");
        }
        if (link.travelTime() < 0) {
            throw new ConfigurationException(entity, "El tiempo de tránsito no puede ser negativo: " + link.travelTime());
        }
        if (!Double.isFinite(link.lateralInflow()) || link.lateralInflow() < 0.0) {
            throw new ConfigurationException(entity, "El aporte lateral debe ser finito y no negativo.");
        }
        if (!Double.isFinite(link.warmUpOutflow()) || link.warmUpOutflow() < 0.0) {
            throw new ConfigurationException(entity, "El caudal de calentamiento debe ser finito y no negativo.");
        }
    }

    void validateInflows(CascadeConfig config) {
        Map<String, double[]> inflows = config.getExternalInflows() == null ? Map.of() : config.getExternalInflows();
        Set<String> ids = config.getReservoirs().stream().map(ReservoirConfig::id).collect(Collectors.toSet());
        int horizon = config.getScheduling().getHorizon();

        for (Map.Entry<String, double[]> entry : inflows.entrySet()) {
            String id = entry.getKey();
            if (!ids.contains(id)) {
                throw new ConfigurationException(id, "Serie de aportes externos para un embalse inexistente.");
            }
            double[] series = entry.getValue();
            int length = series == null ? 0 : series.length;
            if (length < horizon) {
                throw new HorizonMismatchException(id, horizon, length);
            }
            for (int t = 0; t < horizon; t++) {
                if (!Double.isFinite(series[t]) || series[t] < 0.0) {
                    throw new ConfigurationException(id, "Aporte externo inválido en el paso " + t + ": " + series[t]);
                }
            }
        }
    }

    /**
     * Volumen inicial declarado: a partir de la cota si existe, si no el volumen explícito.
     */
    static double resolveInitialStorage(ReservoirConfig reservoir) {
        if (reservoir.initialLevel() != null) {
            return new PiecewiseLinearStorageCurve(reservoir.storageLevelCurve()).storageAt(reservoir.initialLevel());
        }
        return reservoir.initialStorage();
    }
}
