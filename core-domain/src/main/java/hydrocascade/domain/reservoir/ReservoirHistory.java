package hydrocascade.domain.reservoir;

import hydrocascade.domain.simulation.ReservoirTimeSeries;

import java.util.Arrays;

/**
 * Historia por pasos de un embalse. Solo admite añadir el paso siguiente.
 * <p>
 * Se conserva completa: el tránsito más largo aguas abajo siempre encuentra su dato
 * y la misma historia alimenta las series de resultados.
 */
class ReservoirHistory {

    private static final int INITIAL_CAPACITY = 64;

    private double[] inflow = new double[INITIAL_CAPACITY];
    private double[] requestedRelease = new double[INITIAL_CAPACITY];
    private double[] outflow = new double[INITIAL_CAPACITY];
    private double[] spill = new double[INITIAL_CAPACITY];
    private double[] storage = new double[INITIAL_CAPACITY];
    private double[] level = new double[INITIAL_CAPACITY];
    private OperatingZone[] zone = new OperatingZone[INITIAL_CAPACITY];
    private boolean[] preRelease = new boolean[INITIAL_CAPACITY];
    private int size;

    int size() {
        return size;
    }

    void append(MassBalanceOutcome outcome, boolean preReleaseActive) {
        ensureCapacity(size + 1);
        inflow[size] = outcome.inflow();
        requestedRelease[size] = outcome.requestedRelease();
        outflow[size] = outcome.actualRelease();
        spill[size] = outcome.spill();
        storage[size] = outcome.newStorage();
        level[size] = outcome.newLevel();
        zone[size] = outcome.newZone();
        preRelease[size] = preReleaseActive;
        size++;
    }

    double outflowAt(int step) {
        if (step < 0 || step >= size) {
            throw new IndexOutOfBoundsException(
                    "El paso " + step + " no está registrado en la historia [0, " + (size - 1) + "].");
        }
        return outflow[step];
    }

    void clear() {
        size = 0;
    }

    ReservoirTimeSeries toTimeSeries(String reservoirId, double initialStorage) {
        return new ReservoirTimeSeries(
                reservoirId,
                initialStorage,
                Arrays.copyOf(inflow, size),
                Arrays.copyOf(requestedRelease, size),
                Arrays.copyOf(outflow, size),
                Arrays.copyOf(spill, size),
                Arrays.copyOf(storage, size),
                Arrays.copyOf(level, size),
                Arrays.copyOf(zone, size),
                Arrays.copyOf(preRelease, size)
        );
    }

    private void ensureCapacity(int required) {
        if (required <= outflow.length) {
            return;
        }
        int newLength = Math.max(required, outflow.length * 2);
        inflow = Arrays.copyOf(inflow, newLength);
        requestedRelease = Arrays.copyOf(requestedRelease, newLength);
        outflow = Arrays.copyOf(outflow, newLength);
        spill = Arrays.copyOf(spill, newLength);
        storage = Arrays.copyOf(storage, newLength);
        level = Arrays.copyOf(level, newLength);
        zone = Arrays.copyOf(zone, newLength);
        preRelease = Arrays.copyOf(preRelease, newLength);
    }
}
