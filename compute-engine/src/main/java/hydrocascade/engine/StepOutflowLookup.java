package hydrocascade.engine;

import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.routing.OutflowLookup;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consulta de desagües durante la evaluación de un paso.
 * <p>
 * Los pasos anteriores se leen de la historia confirmada de cada embalse; el paso en
 * curso se lee de los desagües ya calculados en capas anteriores y todavía sin confirmar.
 */
class StepOutflowLookup implements OutflowLookup {

    private final CascadeTopology topology;
    private final int currentStep;
    private final Map<String, Double> staged = new ConcurrentHashMap<>();

    StepOutflowLookup(CascadeTopology topology, int currentStep) {
        this.topology = topology;
        this.currentStep = currentStep;
    }

    void stage(String reservoirId, double outflow) {
        staged.put(reservoirId, outflow);
    }

    @Override
    public double outflowAt(String reservoirId, int step) {
        if (step < currentStep) {
            return topology.reservoir(reservoirId).outflowAt(step);
        }
        if (step > currentStep) {
            throw new IllegalStateException("Consulta de un paso futuro (" + step + ") durante el paso " + currentStep);
        }
        Double outflow = staged.get(reservoirId);
        if (outflow == null) {
            throw new IllegalStateException("El embalse " + reservoirId
                    + " todavía no se ha evaluado en el paso " + currentStep);
        }
        return outflow;
    }
}
