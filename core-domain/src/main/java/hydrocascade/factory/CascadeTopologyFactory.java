package hydrocascade.factory;

import hydrocascade.config.CascadeConfig;
import hydrocascade.config.ReservoirConfig;
import hydrocascade.config.RoutingLinkConfig;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.reservoir.PiecewiseLinearStorageCurve;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.routing.RoutingLink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Construye la topología de la cascada a partir de su configuración.
 * <p>
 * Toda la validación ocurre antes de crear ningún embalse: una configuración inválida
 * nunca produce estado.
 */
@Slf4j
public class CascadeTopologyFactory {

    private final CascadeConfigValidator validator;

    public CascadeTopologyFactory() {
        this(new CascadeConfigValidator());
    }

    public CascadeTopologyFactory(CascadeConfigValidator validator) {
        this.validator = validator;
    }

    /**
     * @throws hydrocascade.exception.ConfigurationException   si la configuración es inválida.
     * @throws hydrocascade.exception.HorizonMismatchException si una serie de aportes es más corta que el horizonte.
     */
    public CascadeTopology create(CascadeConfig config) {
        validator.validate(config);

        List<Reservoir> reservoirs = config.getReservoirs().stream()
                .map(CascadeTopologyFactory::createReservoir)
                .toList();
        List<RoutingLink> links = config.getLinks() == null
                ? List.of()
                : config.getLinks().stream().map(CascadeTopologyFactory::createLink).toList();

        CascadeTopology topology = new CascadeTopology(reservoirs, links);
        log.info("Topología creada: {} embalses, {} enlaces, {} capas de evaluación.",
                reservoirs.size(), links.size(), topology.getEvaluationLayers().size());
        return topology;
    }

    public static Reservoir createReservoir(ReservoirConfig config) {
        return new Reservoir(
                config.id(),
                config.capacity(),
                new PiecewiseLinearStorageCurve(config.storageLevelCurve()),
                config.zoneBoundaries(),
                config.floodLimitLevel(),
                config.maxReleaseRate(),
                CascadeConfigValidator.resolveInitialStorage(config)
        );
    }

    public static RoutingLink createLink(RoutingLinkConfig config) {
        return new RoutingLink(
                config.upstreamId(),
                config.downstreamId(),
                config.travelTime(),
                config.lateralInflow(),
                config.warmUpOutflow()
        );
    }
}
