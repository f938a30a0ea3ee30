package hydrocascade.engine;

import hydrocascade.domain.reservoir.MassBalanceOutcome;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.operation.policy.ReleaseDecision;

/**
 * Paso calculado pero aún no confirmado de un embalse.
 *
 * @param reservoir        Embalse evaluado.
 * @param decision         Decisión de la política.
 * @param outcome          Balance de masas calculado sobre el estado actual.
 * @param forecastFailure  Motivo por el que no hubo pronóstico, o nulo.
 */
record PendingStep(
        Reservoir reservoir,
        ReleaseDecision decision,
        MassBalanceOutcome outcome,
        String forecastFailure
) {

    boolean forecastUnavailable() {
        return forecastFailure != null;
    }
}
