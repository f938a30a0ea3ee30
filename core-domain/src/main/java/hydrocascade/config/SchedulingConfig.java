package hydrocascade.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración temporal y de ejecución del motor de programación.
 */
@Value
@Builder
@With
public class SchedulingConfig {

    /**
     * Número de pasos de tiempo a simular. No hay ejecuciones abiertas.
     */
    int horizon;

    /**
     * Paso de tiempo (Δt). El volumen se mide en unidades de caudal × unidades de Δt.
     */
    double deltaTime;

    /**
     * Hilos usados para evaluar en paralelo los embalses independientes de un mismo paso.
     * 1 = ejecución secuencial.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Tolerancia relativa del cierre del balance hídrico.
     */
    @Builder.Default
    double balanceTolerance = 1e-6;
}
