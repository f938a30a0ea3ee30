package hydrocascade.domain.reservoir;

/**
 * Clasificación del estado de un embalse según su cota.
 * El orden de declaración es el orden creciente de cotas.
 */
public enum OperatingZone {
    /**
     * Por debajo de la zona normal: solo suministro mínimo.
     */
    DEAD,
    /**
     * Zona de conservación: caudal de circulación/ecológico.
     */
    NORMAL,
    /**
     * Por encima del nivel de control de avenidas: se maximiza el desagüe.
     */
    FLOOD_CONTROL,
    /**
     * Sobrealmacenamiento, abierta hacia arriba.
     */
    SURCHARGE
}
