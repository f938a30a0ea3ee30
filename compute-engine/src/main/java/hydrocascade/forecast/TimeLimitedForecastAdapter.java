package hydrocascade.forecast;

import hydrocascade.exception.ForecastUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorador que limita el tiempo de respuesta de otro {@link ForecastAdapter}.
 * <p>
 * Si el adaptador envuelto no responde a tiempo o falla de forma inesperada, la llamada
 * termina con {@link ForecastUnavailableException} y la simulación sigue con la regla
 * ordinaria.
 */
@Slf4j
public class TimeLimitedForecastAdapter implements ForecastAdapter, AutoCloseable {

    private final ForecastAdapter delegate;
    private final long timeoutMillis;
    private final ExecutorService executor;

    public TimeLimitedForecastAdapter(ForecastAdapter delegate, long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("El tiempo máximo debe ser positivo: " + timeoutMillis);
        }
        this.delegate = delegate;
        this.timeoutMillis = timeoutMillis;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "forecast-" + delegate.getClass().getSimpleName());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public double[] forecast(int currentStep, int leadTime) throws ForecastUnavailableException {
        Future<double[]> future = executor.submit(() -> delegate.forecast(currentStep, leadTime));
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ForecastUnavailableException(
                    "El pronóstico del paso " + currentStep + " superó " + timeoutMillis + " ms.", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ForecastUnavailableException unavailable) {
                throw unavailable;
            }
            throw new ForecastUnavailableException("Fallo inesperado del adaptador de pronóstico.", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ForecastUnavailableException("Espera del pronóstico interrumpida.", e);
        }
    }

    public ForecastAdapter getDelegate() {
        return delegate;
    }

    @Override
    public void close() {
        if (!executor.isShutdown()) {
            executor.shutdownNow();
        }
        log.debug("Adaptador de pronóstico con tiempo limitado cerrado.");
    }
}
