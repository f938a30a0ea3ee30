package hydrocascade.operation.policy;

import hydrocascade.domain.reservoir.OperatingZone;

/**
 * Resultado de una decisión de operación.
 *
 * @param requestedRelease  Caudal solicitado, ya recortado a {@code [0, maxReleaseRate]}.
 *                          El embalse puede reducirlo (volumen insuficiente) o ampliarlo (vertido forzado).
 * @param zone              Zona en la que se tomó la decisión.
 * @param preReleaseActive  true si la regla de prevertido sustituyó a la regla de la zona.
 */
public record ReleaseDecision(
        double requestedRelease,
        OperatingZone zone,
        boolean preReleaseActive
) {}
