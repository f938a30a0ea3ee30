package hydrocascade.domain.simulation;

/**
 * Condiciones recuperables registradas durante una ejecución.
 */
public enum DiagnosticType {
    /**
     * El adaptador de pronóstico falló o agotó el tiempo: se aplicó la regla ordinaria.
     */
    FORECAST_UNAVAILABLE,
    /**
     * El volumen habría superado la capacidad: el exceso se vertió.
     */
    FORCED_SPILL,
    /**
     * El volumen no alcanzaba para el desagüe solicitado: se redujo.
     */
    RELEASE_CURTAILED,
    /**
     * La cota atravesó más de una frontera de zona en un único paso.
     */
    MULTI_ZONE_TRANSITION
}
