package hydrocascade.config;

import lombok.Builder;
import lombok.With;

/**
 * Conexión aguas arriba → aguas abajo entre dos embalses.
 *
 * @param upstreamId     Embalse que vierte.
 * @param downstreamId   Embalse que recibe.
 * @param travelTime     Tiempo de tránsito en pasos (entero no negativo).
 * @param lateralInflow  Aporte intermedio constante que entra por el extremo de aguas abajo.
 * @param warmUpOutflow  Caudal supuesto del embalse de aguas arriba antes de que exista historia
 *                       ({@code t < travelTime}). Por defecto 0.
 */
@Builder
@With
public record RoutingLinkConfig(
        String upstreamId,
        String downstreamId,
        int travelTime,
        double lateralInflow,
        double warmUpOutflow
) {

    public static RoutingLinkConfig of(String upstreamId, String downstreamId, int travelTime) {
        return new RoutingLinkConfig(upstreamId, downstreamId, travelTime, 0.0, 0.0);
    }
}
