package hydrocascade.operation.rule;

/**
 * Desagüe proporcional al caudal de entrada: {@code inflow × factor}.
 * <p>
 * Con factor 1 el embalse es de paso; junto al recorte de la política equivale a
 * {@code min(maxRelease, inflow)}.
 *
 * @param factor Multiplicador sobre el caudal de entrada (no negativo).
 */
public record InflowProportionalRule(double factor) implements ReleaseRule {

    public static InflowProportionalRule passThrough() {
        return new InflowProportionalRule(1.0);
    }

    @Override
    public double release(ReleaseContext context) {
        return context.inflow() * factor;
    }
}
