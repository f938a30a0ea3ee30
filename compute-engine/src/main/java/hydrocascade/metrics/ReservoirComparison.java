package hydrocascade.metrics;

/**
 * Comparación de un embalse entre un escenario base y un escenario alternativo.
 * Las reducciones son positivas cuando el escenario alternativo mejora al base.
 */
public record ReservoirComparison(
        String reservoirId,
        double baselineMaxLevel,
        double candidateMaxLevel,
        double maxLevelReduction,
        double baselinePeakOutflow,
        double candidatePeakOutflow,
        double peakOutflowReduction,
        boolean baselineCompliant,
        boolean candidateCompliant
) {}
