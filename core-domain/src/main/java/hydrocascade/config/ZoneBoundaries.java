package hydrocascade.config;

import hydrocascade.domain.reservoir.OperatingZone;
import lombok.Builder;
import lombok.With;

/**
 * Cotas que delimitan las zonas de operación de un embalse.
 * <p>
 * Cada cota es el borde inferior (inclusivo) de su zona y el borde superior
 * (exclusivo) de la anterior. La zona de sobrealmacenamiento queda abierta hacia arriba
 * y la zona muerta hacia abajo: cualquier cota tiene una zona bien definida.
 *
 * @param deadLevel          Nivel muerto [m]. Informativo: por debajo sigue siendo zona muerta.
 * @param normalLevel        Borde inferior de la zona normal (conservación) [m].
 * @param floodControlLevel  Borde inferior de la zona de control de avenidas [m].
 * @param surchargeLevel     Borde inferior de la zona de sobrealmacenamiento [m].
 */
@Builder
@With
public record ZoneBoundaries(
        double deadLevel,
        double normalLevel,
        double floodControlLevel,
        double surchargeLevel
) {

    /**
     * @return true si las cotas son finitas y estrictamente crecientes.
     */
    public boolean isStrictlyOrdered() {
        return Double.isFinite(deadLevel) && Double.isFinite(surchargeLevel)
                && deadLevel < normalLevel
                && normalLevel < floodControlLevel
                && floodControlLevel < surchargeLevel;
    }

    /**
     * Localiza la zona de operación correspondiente a una cota.
     */
    public OperatingZone classify(double level) {
        if (level >= surchargeLevel) {
            return OperatingZone.SURCHARGE;
        }
        if (level >= floodControlLevel) {
            return OperatingZone.FLOOD_CONTROL;
        }
        if (level >= normalLevel) {
            return OperatingZone.NORMAL;
        }
        return OperatingZone.DEAD;
    }

    /**
     * Borde inferior de una zona. La zona muerta devuelve el nivel muerto.
     */
    public double lowerEdgeOf(OperatingZone zone) {
        return switch (zone) {
            case DEAD -> deadLevel;
            case NORMAL -> normalLevel;
            case FLOOD_CONTROL -> floodControlLevel;
            case SURCHARGE -> surchargeLevel;
        };
    }
}
