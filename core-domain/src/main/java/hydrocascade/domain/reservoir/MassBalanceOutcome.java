package hydrocascade.domain.reservoir;

/**
 * Resultado de aplicar el balance de masas de un paso, antes o después de confirmarlo.
 *
 * @param inflow            Caudal total de entrada.
 * @param requestedRelease  Caudal solicitado por la política.
 * @param actualRelease     Caudal realmente entregado aguas abajo (incluye el vertido forzado).
 * @param spill             Vertido forzado por exceder la capacidad (caudal).
 * @param curtailment       Reducción del desagüe por falta de volumen (caudal).
 * @param previousStorage   Volumen al inicio del paso.
 * @param newStorage        Volumen al final del paso, siempre en {@code [0, capacity]}.
 * @param newLevel          Cota correspondiente a {@code newStorage}.
 * @param previousZone      Zona al inicio del paso.
 * @param newZone           Zona al final del paso.
 */
public record MassBalanceOutcome(
        double inflow,
        double requestedRelease,
        double actualRelease,
        double spill,
        double curtailment,
        double previousStorage,
        double newStorage,
        double newLevel,
        OperatingZone previousZone,
        OperatingZone newZone
) {

    public boolean isForcedSpill() {
        return spill > 0.0;
    }

    public boolean isCurtailed() {
        return curtailment > 0.0;
    }

    /**
     * Número de fronteras de zona atravesadas en el paso (0 si no hay cambio de zona).
     */
    public int zonesCrossed() {
        return Math.abs(newZone.ordinal() - previousZone.ordinal());
    }
}
