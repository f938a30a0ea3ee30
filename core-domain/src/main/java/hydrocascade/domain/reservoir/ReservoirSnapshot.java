package hydrocascade.domain.reservoir;

/**
 * Vista inmutable del estado de un embalse al inicio de un paso.
 * Es lo único que ven las políticas de operación.
 */
public record ReservoirSnapshot(
        String id,
        double storage,
        double level,
        OperatingZone zone,
        double capacity,
        double maxReleaseRate,
        double floodLimitLevel
) {}
