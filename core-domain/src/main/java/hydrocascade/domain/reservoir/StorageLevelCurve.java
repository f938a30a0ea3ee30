package hydrocascade.domain.reservoir;

/**
 * Relación monótona e invertible entre volumen almacenado y cota.
 */
public interface StorageLevelCurve {

    double levelAt(double storage);

    double storageAt(double level);
}
