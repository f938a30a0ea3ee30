package hydrocascade.domain.simulation;

import hydrocascade.domain.reservoir.OperatingZone;

import java.util.Arrays;
import java.util.Objects;

/**
 * Series temporales registradas para un embalse. El índice es el paso de tiempo;
 * {@code storage[t]} y {@code level[t]} son el estado al final del paso {@code t}.
 *
 * @param reservoirId        Embalse.
 * @param initialStorage     Volumen antes del primer paso.
 * @param inflow             Caudal total de entrada por paso.
 * @param requestedRelease   Caudal solicitado por la política.
 * @param outflow            Caudal realmente entregado (incluye vertido forzado).
 * @param spill              Vertido forzado por paso.
 * @param storage            Volumen al final de cada paso.
 * @param level              Cota al final de cada paso.
 * @param zone               Zona al final de cada paso.
 * @param preReleaseActive   Prevertido activo en el paso.
 */
public record ReservoirTimeSeries(
        String reservoirId,
        double initialStorage,
        double[] inflow,
        double[] requestedRelease,
        double[] outflow,
        double[] spill,
        double[] storage,
        double[] level,
        OperatingZone[] zone,
        boolean[] preReleaseActive
) {

    public ReservoirTimeSeries {
        Objects.requireNonNull(reservoirId, "El identificador del embalse no puede ser nulo.");
        int length = inflow.length;
        if (requestedRelease.length != length || outflow.length != length || spill.length != length
                || storage.length != length || level.length != length
                || zone.length != length || preReleaseActive.length != length) {
            throw new IllegalArgumentException("Todas las series del embalse " + reservoirId + " deben tener la misma longitud.");
        }
        inflow = inflow.clone();
        requestedRelease = requestedRelease.clone();
        outflow = outflow.clone();
        spill = spill.clone();
        storage = storage.clone();
        level = level.clone();
        zone = zone.clone();
        preReleaseActive = preReleaseActive.clone();
    }

    public int stepCount() {
        return inflow.length;
    }

    public double finalStorage() {
        return storage.length == 0 ? initialStorage : storage[storage.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReservoirTimeSeries that = (ReservoirTimeSeries) o;
        return reservoirId.equals(that.reservoirId)
                && Double.compare(initialStorage, that.initialStorage) == 0
                && Arrays.equals(inflow, that.inflow)
                && Arrays.equals(requestedRelease, that.requestedRelease)
                && Arrays.equals(outflow, that.outflow)
                && Arrays.equals(spill, that.spill)
                && Arrays.equals(storage, that.storage)
                && Arrays.equals(level, that.level)
                && Arrays.equals(zone, that.zone)
                && Arrays.equals(preReleaseActive, that.preReleaseActive);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(reservoirId, initialStorage);
        result = 31 * result + Arrays.hashCode(inflow);
        result = 31 * result + Arrays.hashCode(outflow);
        result = 31 * result + Arrays.hashCode(storage);
        result = 31 * result + Arrays.hashCode(level);
        return result;
    }

    @Override
    public String toString() {
        return "ReservoirTimeSeries[" + reservoirId + ", pasos=" + stepCount() + "]";
    }
}
