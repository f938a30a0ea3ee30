package hydrocascade.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * Contenedor principal de la configuración de una simulación en cascada.
 * Agrupa los embalses, sus conexiones, los aportes externos y la configuración temporal.
 */
@Value
@Builder
@With
public class CascadeConfig {

    /**
     * Parámetros estáticos de cada embalse. El orden se usa para desempatar la evaluación.
     */
    List<ReservoirConfig> reservoirs;

    /**
     * Aristas de la cascada.
     */
    @Builder.Default
    List<RoutingLinkConfig> links = List.of();

    /**
     * Serie de aportes externos por embalse (longitud ≥ horizonte).
     * Un embalse sin serie recibe aporte externo nulo.
     */
    @Builder.Default
    Map<String, double[]> externalInflows = Map.of();

    /**
     * Configuración temporal del motor.
     */
    SchedulingConfig scheduling;
}
