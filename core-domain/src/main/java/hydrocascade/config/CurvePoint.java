package hydrocascade.config;

/**
 * Punto de la curva cota-volumen de un embalse.
 *
 * @param storage Volumen almacenado (unidades de caudal × unidades de Δt).
 * @param level   Cota de la lámina de agua [m].
 */
public record CurvePoint(double storage, double level) {}
