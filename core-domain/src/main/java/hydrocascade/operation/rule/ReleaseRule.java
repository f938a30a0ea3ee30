package hydrocascade.operation.rule;

/**
 * Estrategia que calcula el caudal de desagüe objetivo de una zona.
 * <p>
 * Las implementaciones deben ser funciones puras: mismo contexto, mismo resultado.
 * El recorte a {@code [0, maxReleaseRate]} lo aplica la política, no la regla.
 */
@FunctionalInterface
public interface ReleaseRule {
    double release(ReleaseContext context);
}
