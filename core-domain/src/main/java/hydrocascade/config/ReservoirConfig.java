package hydrocascade.config;

import hydrocascade.operation.rule.ZoneRuleTable;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Objeto de valor inmutable con los parámetros estáticos de un embalse y su estado inicial.
 *
 * @param id                 Identificador único dentro de la cascada.
 * @param capacity           Volumen máximo almacenable.
 * @param storageLevelCurve  Curva cota-volumen (al menos dos puntos, estrictamente creciente en ambos ejes,
 *                           cubriendo el rango {@code [0, capacity]}).
 * @param zoneBoundaries     Cotas de las zonas de operación.
 * @param floodLimitLevel    Nivel límite de avenidas [m] usado para evaluar el cumplimiento.
 * @param maxReleaseRate     Caudal máximo de desagüe controlado.
 * @param initialStorage     Volumen inicial. Se ignora si {@code initialLevel} no es nulo.
 * @param initialLevel       Cota inicial opcional; si está presente el volumen se obtiene de la curva.
 * @param zoneRules          Regla de desagüe por zona.
 * @param forecast           Configuración de prevertido. Nulo = el embalse no usa pronóstico.
 */
@Builder
@With
public record ReservoirConfig(
        String id,
        double capacity,
        List<CurvePoint> storageLevelCurve,
        ZoneBoundaries zoneBoundaries,
        double floodLimitLevel,
        double maxReleaseRate,
        double initialStorage,
        Double initialLevel,
        ZoneRuleTable zoneRules,
        ForecastConfig forecast
) {

    public boolean participatesInForecast() {
        return forecast != null;
    }

    /**
     * Embalse de referencia para pruebas: gran embalse de cabecera con
     * nivel muerto 100 m, zona normal desde 105 m, control de avenidas desde 120 m
     * y sobrealmacenamiento desde 125 m. Arranca en la cota 115 m.
     */
    public static ReservoirConfig getTestingReservoir(String id) {
        return ReservoirConfig.builder()
                .id(id)
                .capacity(15000.0)
                .storageLevelCurve(List.of(
                        new CurvePoint(0.0, 90.0),
                        new CurvePoint(2000.0, 100.0),
                        new CurvePoint(6000.0, 110.0),
                        new CurvePoint(10500.0, 120.0),
                        new CurvePoint(15000.0, 130.0)))
                .zoneBoundaries(new ZoneBoundaries(100.0, 105.0, 120.0, 125.0))
                .floodLimitLevel(120.0)
                .maxReleaseRate(800.0)
                .initialLevel(115.0)
                .zoneRules(ZoneRuleTable.standard(100.0, 30.0))
                .build();
    }
}
