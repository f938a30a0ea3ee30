package hydrocascade.domain.simulation;

/**
 * Incidencia recuperable de un paso para un embalse.
 */
public record StepDiagnostic(
        int step,
        String reservoirId,
        DiagnosticType type,
        String message
) {

    /**
     * Balance forzado (vertido o reducción de desagüe).
     */
    public boolean isMassBalanceViolation() {
        return type == DiagnosticType.FORCED_SPILL || type == DiagnosticType.RELEASE_CURTAILED;
    }
}
