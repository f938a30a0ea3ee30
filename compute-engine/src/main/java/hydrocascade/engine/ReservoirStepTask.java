package hydrocascade.engine;

import hydrocascade.domain.reservoir.MassBalanceOutcome;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirSnapshot;
import hydrocascade.domain.routing.RoutingLink;
import hydrocascade.exception.ForecastUnavailableException;
import hydrocascade.operation.policy.ReleaseDecision;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Tarea que evalúa un embalse en un paso: entrada total, pronóstico, decisión y
 * balance de masas. No modifica el embalse; solo publica su desagüe provisional para
 * los tránsitos instantáneos de capas posteriores.
 */
@RequiredArgsConstructor
class ReservoirStepTask implements Callable<PendingStep> {

    private final int step;
    private final Reservoir reservoir;
    private final List<RoutingLink> incomingLinks;
    private final double externalInflow;
    private final ReservoirOperation operation;
    private final StepOutflowLookup lookup;
    private final double deltaTime;

    @Override
    public PendingStep call() {
        double inflow = externalInflow;
        for (RoutingLink link : incomingLinks) {
            inflow += link.contributionAt(step, lookup);
        }

        double[] forecast = null;
        String forecastFailure = null;
        if (operation.queriesForecast()) {
            try {
                forecast = fetchForecast();
            } catch (ForecastUnavailableException e) {
                forecastFailure = e.getMessage();
            }
        }

        ReservoirSnapshot snapshot = reservoir.snapshot();
        ReleaseDecision decision = operation.policy().decide(snapshot, inflow, forecast, step);
        MassBalanceOutcome outcome = reservoir.computeMassBalance(inflow, decision.requestedRelease(), deltaTime);
        lookup.stage(reservoir.getId(), outcome.actualRelease());
        return new PendingStep(reservoir, decision, outcome, forecastFailure);
    }

    private double[] fetchForecast() throws ForecastUnavailableException {
        int leadTime = operation.leadTime();
        double[] forecast;
        try {
            forecast = operation.forecastAdapter().forecast(step, leadTime);
        } catch (RuntimeException e) {
            throw new ForecastUnavailableException("El adaptador de pronóstico falló en el paso " + step, e);
        }
        if (forecast == null || forecast.length != leadTime) {
            throw new ForecastUnavailableException(String.format(
                    "Pronóstico truncado: se esperaban %d valores y se recibieron %d.",
                    leadTime, forecast == null ? 0 : forecast.length));
        }
        for (double value : forecast) {
            if (!Double.isFinite(value) || value < 0.0) {
                throw new ForecastUnavailableException("Pronóstico con valores inválidos: " + value);
            }
        }
        return forecast;
    }
}
