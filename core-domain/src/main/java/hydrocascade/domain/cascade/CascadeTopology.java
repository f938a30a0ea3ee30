package hydrocascade.domain.cascade;

import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.routing.RoutingLink;
import hydrocascade.domain.simulation.ReservoirTimeSeries;
import hydrocascade.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Grafo dirigido de embalses y enlaces de tránsito. Es el único propietario del
 * estado mutable de la simulación.
 * <p>
 * Solo los enlaces con tránsito nulo crean dependencias dentro de un mismo paso, así que
 * el orden de evaluación se obtiene por capas (Kahn) sobre esas aristas. Un ciclo cuyo
 * retardo total es cero no tiene orden posible y se rechaza al construir; los ciclos con
 * retardo positivo solo leen historia ya confirmada y son válidos.
 * <p>
 * Dentro de una capa los embalses son mutuamente independientes en el paso actual y
 * pueden evaluarse en cualquier orden o en paralelo.
 */
public class CascadeTopology {

    private final Map<String, Reservoir> reservoirs;
    private final List<RoutingLink> links;
    private final Map<String, List<RoutingLink>> incoming;
    private final Map<String, List<RoutingLink>> outgoing;
    private final List<List<Reservoir>> evaluationLayers;
    private final List<Reservoir> evaluationOrder;

    public CascadeTopology(List<Reservoir> reservoirList, List<RoutingLink> linkList) {
        if (reservoirList == null || reservoirList.isEmpty()) {
            throw new ConfigurationException("cascade", "La cascada debe contener al menos un embalse.");
        }
        Map<String, Reservoir> byId = new LinkedHashMap<>();
        for (Reservoir reservoir : reservoirList) {
            if (byId.putIfAbsent(reservoir.getId(), reservoir) != null) {
                throw new ConfigurationException(reservoir.getId(), "Identificador de embalse duplicado.");
            }
        }
        this.reservoirs = Collections.unmodifiableMap(byId);
        this.links = linkList == null ? List.of() : List.copyOf(linkList);

        Map<String, List<RoutingLink>> in = new HashMap<>();
        Map<String, List<RoutingLink>> out = new HashMap<>();
        byId.keySet().forEach(id -> {
            in.put(id, new ArrayList<>());
            out.put(id, new ArrayList<>());
        });
        for (RoutingLink link : this.links) {
            requireKnown(link, link.getUpstreamId());
            requireKnown(link, link.getDownstreamId());
            out.get(link.getUpstreamId()).add(link);
            in.get(link.getDownstreamId()).add(link);
        }
        this.incoming = freeze(in);
        this.outgoing = freeze(out);

        this.evaluationLayers = computeLayers();
        this.evaluationOrder = evaluationLayers.stream()
                .flatMap(List::stream)
                .collect(Collectors.toUnmodifiableList());
    }

    private void requireKnown(RoutingLink link, String reservoirId) {
        if (!reservoirs.containsKey(reservoirId)) {
            throw new ConfigurationException(link.toString(),
                    "El enlace referencia un embalse inexistente: " + reservoirId);
        }
    }

    private List<List<Reservoir>> computeLayers() {
        Map<String, Integer> pending = new HashMap<>();
        reservoirs.keySet().forEach(id -> pending.put(id, 0));
        for (RoutingLink link : links) {
            if (link.isInstantaneous()) {
                pending.merge(link.getDownstreamId(), 1, Integer::sum);
            }
        }

        Set<String> placed = new HashSet<>();
        List<List<Reservoir>> layers = new ArrayList<>();
        while (placed.size() < reservoirs.size()) {
            // Orden de inserción dentro de la capa
            List<Reservoir> layer = reservoirs.values().stream()
                    .filter(r -> !placed.contains(r.getId()) && pending.get(r.getId()) == 0)
                    .collect(Collectors.toList());
            if (layer.isEmpty()) {
                break;
            }
            for (Reservoir reservoir : layer) {
                placed.add(reservoir.getId());
                for (RoutingLink link : outgoing.get(reservoir.getId())) {
                    if (link.isInstantaneous()) {
                        pending.merge(link.getDownstreamId(), -1, Integer::sum);
                    }
                }
            }
            layers.add(Collections.unmodifiableList(layer));
        }

        if (placed.size() < reservoirs.size()) {
            String cycle = reservoirs.keySet().stream()
                    .filter(id -> !placed.contains(id))
                    .collect(Collectors.joining(", "));
            throw new ConfigurationException(cycle,
                    "Ciclo con retardo total nulo: los embalses dependen de sí mismos en el mismo paso.");
        }
        return Collections.unmodifiableList(layers);
    }

    /**
     * @throws IllegalArgumentException si el embalse no pertenece a la cascada.
     */
    public Reservoir reservoir(String id) {
        Reservoir reservoir = reservoirs.get(id);
        if (reservoir == null) {
            throw new IllegalArgumentException("Embalse desconocido: " + id);
        }
        return reservoir;
    }

    public boolean contains(String id) {
        return reservoirs.containsKey(id);
    }

    public Collection<Reservoir> getReservoirs() {
        return reservoirs.values();
    }

    public List<RoutingLink> getLinks() {
        return links;
    }

    public List<RoutingLink> incomingLinks(String reservoirId) {
        return incoming.getOrDefault(reservoirId, List.of());
    }

    public List<RoutingLink> outgoingLinks(String reservoirId) {
        return outgoing.getOrDefault(reservoirId, List.of());
    }

    public List<List<Reservoir>> getEvaluationLayers() {
        return evaluationLayers;
    }

    public List<Reservoir> getEvaluationOrder() {
        return evaluationOrder;
    }

    /**
     * Embalses sin enlaces de salida: su desagüe es la salida del sistema.
     */
    public List<Reservoir> outlets() {
        return reservoirs.values().stream()
                .filter(r -> outgoing.get(r.getId()).isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public int maxTravelTime() {
        return links.stream().mapToInt(RoutingLink::getTravelTime).max().orElse(0);
    }

    public double totalCapacity() {
        return reservoirs.values().stream().mapToDouble(Reservoir::getCapacity).sum();
    }

    /**
     * Número de pasos confirmados por todos los embalses.
     */
    public int completedSteps() {
        return reservoirs.values().stream().mapToInt(Reservoir::getCompletedSteps).min().orElse(0);
    }

    /**
     * Devuelve todos los embalses al estado inicial.
     */
    public void reset() {
        reservoirs.values().forEach(Reservoir::reset);
    }

    /**
     * Series temporales registradas, en orden de inserción.
     */
    public Map<String, ReservoirTimeSeries> timeSeries() {
        Map<String, ReservoirTimeSeries> series = new LinkedHashMap<>();
        reservoirs.values().forEach(r -> series.put(r.getId(), r.toTimeSeries()));
        return series;
    }

    private static Map<String, List<RoutingLink>> freeze(Map<String, List<RoutingLink>> source) {
        Map<String, List<RoutingLink>> frozen = new HashMap<>();
        source.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
