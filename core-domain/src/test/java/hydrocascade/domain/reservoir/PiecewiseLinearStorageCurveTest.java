package hydrocascade.domain.reservoir;

import hydrocascade.config.CurvePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PiecewiseLinearStorageCurveTest {

    private final PiecewiseLinearStorageCurve curve = new PiecewiseLinearStorageCurve(List.of(
            new CurvePoint(0.0, 90.0),
            new CurvePoint(2000.0, 100.0),
            new CurvePoint(6000.0, 110.0)
    ));

    @Test
    @DisplayName("Interpola linealmente la cota entre puntos de la tabla")
    void levelAt_shouldInterpolateBetweenPoints() {
        assertThat(curve.levelAt(0.0)).isEqualTo(90.0);
        assertThat(curve.levelAt(2000.0)).isEqualTo(100.0);
        assertThat(curve.levelAt(1000.0)).isCloseTo(95.0, within(1e-9));
        assertThat(curve.levelAt(4000.0)).isCloseTo(105.0, within(1e-9));
    }

    @Test
    @DisplayName("La curva inversa devuelve el volumen de una cota")
    void storageAt_shouldInvertLevelAt() {
        for (double storage : new double[]{0.0, 500.0, 2000.0, 3100.0, 6000.0}) {
            assertThat(curve.storageAt(curve.levelAt(storage))).isCloseTo(storage, within(1e-6));
        }
    }

    @Test
    @DisplayName("Fuera de la tabla extrapola con el tramo extremo")
    void levelAt_shouldExtrapolateWithEdgeSegments() {
        assertThat(curve.levelAt(7000.0)).isCloseTo(112.5, within(1e-9));
        assertThat(curve.levelAt(-1000.0)).isCloseTo(85.0, within(1e-9));
    }

    @Test
    @DisplayName("Rechaza curvas no monótonas o con un solo punto")
    void constructor_shouldRejectInvalidTables() {
        assertThatThrownBy(() -> new PiecewiseLinearStorageCurve(List.of(new CurvePoint(0.0, 90.0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PiecewiseLinearStorageCurve(List.of(
                new CurvePoint(0.0, 90.0),
                new CurvePoint(1000.0, 95.0),
                new CurvePoint(2000.0, 94.0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PiecewiseLinearStorageCurve.isStrictlyMonotonic(List.of(
                new CurvePoint(0.0, 90.0),
                new CurvePoint(0.0, 95.0)))).isFalse();
    }
}
