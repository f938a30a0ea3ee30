package hydrocascade.operation.rule;

import hydrocascade.domain.reservoir.OperatingZone;

/**
 * Datos que una regla de desagüe puede consultar.
 *
 * @param zone            Zona de operación actual.
 * @param level           Cota actual [m].
 * @param storage         Volumen actual.
 * @param inflow          Caudal total de entrada del paso.
 * @param maxReleaseRate  Caudal máximo de desagüe del embalse.
 * @param step            Paso de tiempo.
 */
public record ReleaseContext(
        OperatingZone zone,
        double level,
        double storage,
        double inflow,
        double maxReleaseRate,
        int step
) {}
