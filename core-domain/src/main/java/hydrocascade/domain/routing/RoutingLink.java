package hydrocascade.domain.routing;

import lombok.Getter;

import java.util.Objects;

/**
 * Conexión inmutable aguas arriba → aguas abajo con un tiempo de tránsito entero.
 * <p>
 * En el paso {@code t} entrega el caudal del embalse de aguas arriba registrado en
 * {@code t − travelTime}, más el aporte lateral. Mientras {@code t − travelTime < 0}
 * no existe ese dato y se entrega el caudal de calentamiento configurado
 * ({@code warmUpOutflow}, 0 por defecto) más el aporte lateral.
 */
@Getter
public final class RoutingLink {

    private final String upstreamId;
    private final String downstreamId;
    private final int travelTime;
    private final double lateralInflow;
    private final double warmUpOutflow;

    public RoutingLink(String upstreamId, String downstreamId, int travelTime,
                       double lateralInflow, double warmUpOutflow) {
        this.upstreamId = Objects.requireNonNull(upstreamId, "El embalse de aguas arriba no puede ser nulo.");
        this.downstreamId = Objects.requireNonNull(downstreamId, "El embalse de aguas abajo no puede ser nulo.");
        if (travelTime < 0) {
            throw new IllegalArgumentException("El tiempo de tránsito no puede ser negativo: " + travelTime);
        }
        this.travelTime = travelTime;
        this.lateralInflow = lateralInflow;
        this.warmUpOutflow = warmUpOutflow;
    }

    /**
     * Aporte que llega al embalse de aguas abajo en el paso {@code step}.
     */
    public double contributionAt(int step, OutflowLookup lookup) {
        int sourceStep = step - travelTime;
        double upstream = sourceStep < 0
                ? warmUpOutflow
                : lookup.outflowAt(upstreamId, sourceStep);
        return upstream + lateralInflow;
    }

    /**
     * true si el aporte depende del caudal del mismo paso (tránsito nulo).
     */
    public boolean isInstantaneous() {
        return travelTime == 0;
    }

    @Override
    public String toString() {
        return upstreamId + "->" + downstreamId + " (τ=" + travelTime + ")";
    }
}
