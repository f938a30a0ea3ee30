package hydrocascade.forecast;

import lombok.Getter;

/**
 * Modelo de coeficiente de escorrentía: {@code escorrentía = c · max(0, lluvia − evaporación)}.
 * Sustituto sencillo de un modelo hidrológico completo.
 */
@Getter
public class RunoffCoefficientModel implements RunoffModel {

    private final double coefficient;

    public RunoffCoefficientModel(double coefficient) {
        if (coefficient < 0.0 || coefficient > 1.0) {
            throw new IllegalArgumentException("El coeficiente de escorrentía debe estar en [0, 1]: " + coefficient);
        }
        this.coefficient = coefficient;
    }

    @Override
    public double[] runoff(double[] rainfall, double[] evaporation) {
        double[] runoff = new double[rainfall.length];
        for (int i = 0; i < rainfall.length; i++) {
            double evap = i < evaporation.length ? evaporation[i] : 0.0;
            runoff[i] = coefficient * Math.max(0.0, rainfall[i] - evap);
        }
        return runoff;
    }
}
