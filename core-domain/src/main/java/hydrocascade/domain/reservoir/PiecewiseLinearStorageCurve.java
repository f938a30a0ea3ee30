package hydrocascade.domain.reservoir;

import hydrocascade.config.CurvePoint;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Curva cota-volumen tabulada con interpolación lineal entre puntos.
 * <p>
 * Fuera de la tabla se extrapola con el primer o último tramo. Los puntos deben ser
 * estrictamente crecientes en volumen y en cota para que la curva sea invertible.
 */
public class PiecewiseLinearStorageCurve implements StorageLevelCurve {

    private final double[] storages;
    private final double[] levels;

    public PiecewiseLinearStorageCurve(List<CurvePoint> points) {
        Objects.requireNonNull(points, "La curva cota-volumen no puede ser nula.");
        if (!isStrictlyMonotonic(points)) {
            throw new IllegalArgumentException(
                    "La curva cota-volumen necesita al menos dos puntos finitos estrictamente crecientes en volumen y cota.");
        }
        this.storages = points.stream().mapToDouble(CurvePoint::storage).toArray();
        this.levels = points.stream().mapToDouble(CurvePoint::level).toArray();
    }

    /**
     * Comprueba que una tabla puede construir una curva válida.
     */
    public static boolean isStrictlyMonotonic(List<CurvePoint> points) {
        if (points == null || points.size() < 2) {
            return false;
        }
        for (int i = 0; i < points.size(); i++) {
            CurvePoint p = points.get(i);
            if (p == null || !Double.isFinite(p.storage()) || !Double.isFinite(p.level())) {
                return false;
            }
            if (i > 0) {
                CurvePoint prev = points.get(i - 1);
                if (p.storage() <= prev.storage() || p.level() <= prev.level()) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public double levelAt(double storage) {
        return interpolate(storages, levels, storage);
    }

    @Override
    public double storageAt(double level) {
        return interpolate(levels, storages, level);
    }

    public double minStorage() {
        return storages[0];
    }

    public double maxStorage() {
        return storages[storages.length - 1];
    }

    private static double interpolate(double[] xs, double[] ys, double x) {
        int last = xs.length - 1;
        int segment;
        if (x <= xs[0]) {
            segment = 0;
        } else if (x >= xs[last]) {
            segment = last - 1;
        } else {
            int idx = Arrays.binarySearch(xs, x);
            if (idx >= 0) {
                return ys[idx];
            }
            segment = (-idx - 1) - 1;
        }
        double t = (x - xs[segment]) / (xs[segment + 1] - xs[segment]);
        return ys[segment] + t * (ys[segment + 1] - ys[segment]);
    }
}
