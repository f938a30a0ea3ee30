package hydrocascade.domain.routing;

/**
 * Resuelve el caudal realmente entregado por un embalse en un paso.
 */
@FunctionalInterface
public interface OutflowLookup {
    double outflowAt(String reservoirId, int step);
}
