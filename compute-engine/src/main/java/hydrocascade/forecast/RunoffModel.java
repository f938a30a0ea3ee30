package hydrocascade.forecast;

/**
 * Modelo hidrológico de transformación lluvia-escorrentía.
 * <p>
 * Se trata como una caja negra: recibe el forzamiento de un tramo temporal y devuelve
 * la lámina de escorrentía generada en cada paso.
 */
@FunctionalInterface
public interface RunoffModel {

    /**
     * @param rainfall    Precipitación por paso [mm].
     * @param evaporation Evaporación potencial por paso [mm].
     * @return Lámina de escorrentía por paso [mm], de la misma longitud que la entrada.
     */
    double[] runoff(double[] rainfall, double[] evaporation);
}
