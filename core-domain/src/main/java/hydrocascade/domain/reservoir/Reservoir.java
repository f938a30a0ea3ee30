package hydrocascade.domain.reservoir;

import hydrocascade.config.ZoneBoundaries;
import hydrocascade.domain.simulation.ReservoirTimeSeries;
import lombok.Getter;

import java.util.Objects;

/**
 * Embalse de la cascada: estado hidráulico mutable bajo la ley de balance de masas.
 * <p>
 * Invariantes:
 * <ul>
 *     <li>{@code 0 ≤ storage ≤ capacity} en todo momento.</li>
 *     <li>{@code level == curve.levelAt(storage)} y {@code zone == zoneFor(level)}.</li>
 *     <li>Solo el motor de programación lo muta, una única vez por paso.</li>
 * </ul>
 * El cálculo del balance ({@link #computeMassBalance}) es puro; la confirmación
 * ({@link #commit}) es la única operación que cambia el estado. Así un paso fallido
 * nunca deja un balance aplicado a medias.
 */
public class Reservoir {

    @Getter
    private final String id;
    @Getter
    private final double capacity;
    @Getter
    private final StorageLevelCurve curve;
    @Getter
    private final ZoneBoundaries zoneBoundaries;
    @Getter
    private final double floodLimitLevel;
    @Getter
    private final double maxReleaseRate;
    @Getter
    private final double initialStorage;

    @Getter
    private double storage;
    @Getter
    private double level;
    @Getter
    private OperatingZone zone;

    private final ReservoirHistory history = new ReservoirHistory();

    public Reservoir(String id,
                     double capacity,
                     StorageLevelCurve curve,
                     ZoneBoundaries zoneBoundaries,
                     double floodLimitLevel,
                     double maxReleaseRate,
                     double initialStorage) {
        this.id = Objects.requireNonNull(id, "El identificador del embalse no puede ser nulo.");
        this.curve = Objects.requireNonNull(curve, "La curva cota-volumen no puede ser nula.");
        this.zoneBoundaries = Objects.requireNonNull(zoneBoundaries, "Las cotas de zona no pueden ser nulas.");
        if (!(capacity > 0.0) || !Double.isFinite(capacity)) {
            throw new IllegalArgumentException("La capacidad del embalse " + id + " debe ser positiva y finita.");
        }
        if (initialStorage < 0.0 || initialStorage > capacity) {
            throw new IllegalArgumentException(String.format(
                    "El volumen inicial del embalse %s (%.3f) está fuera de [0, %.3f].", id, initialStorage, capacity));
        }
        this.capacity = capacity;
        this.floodLimitLevel = floodLimitLevel;
        this.maxReleaseRate = maxReleaseRate;
        this.initialStorage = initialStorage;
        setStorage(initialStorage);
    }

    /**
     * Zona de operación de una cota: borde inferior inclusivo, superior exclusivo;
     * sobrealmacenamiento abierto hacia arriba.
     */
    public OperatingZone zoneFor(double level) {
        return zoneBoundaries.classify(level);
    }

    public ReservoirSnapshot snapshot() {
        return new ReservoirSnapshot(id, storage, level, zone, capacity, maxReleaseRate, floodLimitLevel);
    }

    /**
     * Calcula el balance de masas de un paso sin modificar el estado.
     * <p>
     * {@code newStorage = clamp(storage + (inflow − release)·Δt, 0, capacity)}.
     * El exceso sobre la capacidad se convierte en vertido forzado y se suma al desagüe;
     * si el volumen no alcanza, el desagüe se limita a {@code storage/Δt + inflow}.
     * En ambos casos el caudal resultante es el que se transita aguas abajo.
     *
     * @param inflow           Caudal total de entrada (no negativo).
     * @param requestedRelease Caudal solicitado por la política.
     * @param deltaTime        Paso de tiempo (positivo).
     */
    public MassBalanceOutcome computeMassBalance(double inflow, double requestedRelease, double deltaTime) {
        if (!(deltaTime > 0.0)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser positivo: " + deltaTime);
        }
        double release = Math.max(0.0, requestedRelease);
        double unclamped = storage + (inflow - release) * deltaTime;

        double actualRelease = release;
        double spill = 0.0;
        double curtailment = 0.0;
        double newStorage;

        if (unclamped > capacity) {
            spill = (unclamped - capacity) / deltaTime;
            actualRelease = release + spill;
            newStorage = capacity;
        } else if (unclamped < 0.0) {
            actualRelease = Math.max(0.0, storage / deltaTime + inflow);
            curtailment = release - actualRelease;
            newStorage = 0.0;
        } else {
            newStorage = unclamped;
        }

        double newLevel = curve.levelAt(newStorage);
        return new MassBalanceOutcome(
                inflow,
                release,
                actualRelease,
                spill,
                curtailment,
                storage,
                newStorage,
                newLevel,
                zone,
                zoneFor(newLevel)
        );
    }

    /**
     * Confirma un balance calculado previamente y lo añade a la historia.
     *
     * @throws IllegalStateException si el paso no es el siguiente o el resultado se calculó
     *                               sobre un estado distinto del actual.
     */
    public void commit(int step, MassBalanceOutcome outcome, boolean preReleaseActive) {
        if (step != history.size()) {
            throw new IllegalStateException(String.format(
                    "El embalse %s esperaba confirmar el paso %d, no el %d.", id, history.size(), step));
        }
        if (Double.compare(outcome.previousStorage(), storage) != 0) {
            throw new IllegalStateException("El balance del embalse " + id
                    + " se calculó sobre un estado obsoleto (paso " + step + ").");
        }
        setStorage(outcome.newStorage());
        history.append(outcome, preReleaseActive);
    }

    /**
     * Calcula y confirma el balance de un paso.
     *
     * @return El resultado confirmado; {@code actualRelease} es el caudal a transitar.
     */
    public MassBalanceOutcome applyMassBalance(int step, double inflow, double requestedRelease, double deltaTime) {
        MassBalanceOutcome outcome = computeMassBalance(inflow, requestedRelease, deltaTime);
        commit(step, outcome, false);
        return outcome;
    }

    /**
     * Caudal realmente entregado en un paso ya confirmado.
     */
    public double outflowAt(int step) {
        return history.outflowAt(step);
    }

    public int getCompletedSteps() {
        return history.size();
    }

    /**
     * Devuelve el embalse a su estado inicial y descarta la historia.
     */
    public void reset() {
        history.clear();
        setStorage(initialStorage);
    }

    public ReservoirTimeSeries toTimeSeries() {
        return history.toTimeSeries(id, initialStorage);
    }

    private void setStorage(double newStorage) {
        this.storage = newStorage;
        this.level = curve.levelAt(newStorage);
        this.zone = zoneFor(this.level);
    }
}
