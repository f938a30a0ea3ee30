package hydrocascade.operation.rule;

import hydrocascade.domain.reservoir.OperatingZone;
import lombok.Builder;
import lombok.Singular;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tabla zona → regla de desagüe de un embalse.
 * <p>
 * Sustituye a la cadena de if/else sobre cotas: la zona se obtiene primero y la regla
 * se busca en la tabla.
 */
@Builder
public record ZoneRuleTable(@Singular Map<OperatingZone, ReleaseRule> rules) {

    /**
     * Preajuste habitual: avenidas y sobrealmacenamiento al máximo, caudal de circulación en
     * la zona normal y suministro mínimo en la zona muerta.
     */
    public static ZoneRuleTable standard(double circulationRelease, double supplyRelease) {
        return ZoneRuleTable.builder()
                .rule(OperatingZone.DEAD, new ConstantReleaseRule(supplyRelease))
                .rule(OperatingZone.NORMAL, new ConstantReleaseRule(circulationRelease))
                .rule(OperatingZone.FLOOD_CONTROL, new MaxReleaseRule())
                .rule(OperatingZone.SURCHARGE, new MaxReleaseRule())
                .build();
    }

    /**
     * Misma regla en todas las zonas.
     */
    public static ZoneRuleTable uniform(ReleaseRule rule) {
        ZoneRuleTableBuilder builder = ZoneRuleTable.builder();
        for (OperatingZone zone : OperatingZone.values()) {
            builder.rule(zone, rule);
        }
        return builder.build();
    }

    /**
     * @throws IllegalStateException si la zona no tiene regla (la validación de
     *                               configuración lo impide antes de simular).
     */
    public ReleaseRule ruleFor(OperatingZone zone) {
        ReleaseRule rule = rules.get(zone);
        if (rule == null) {
            throw new IllegalStateException("No hay regla de desagüe para la zona " + zone);
        }
        return rule;
    }

    public Set<OperatingZone> missingZones() {
        Set<OperatingZone> missing = EnumSet.allOf(OperatingZone.class);
        rules.forEach((zone, rule) -> {
            if (rule != null) {
                missing.remove(zone);
            }
        });
        return missing;
    }
}
