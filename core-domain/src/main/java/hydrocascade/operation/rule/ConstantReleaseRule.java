package hydrocascade.operation.rule;

/**
 * Desagüe constante: caudal de circulación/ecológico o suministro mínimo.
 *
 * @param rate Caudal liberado en cada paso.
 */
public record ConstantReleaseRule(double rate) implements ReleaseRule {

    @Override
    public double release(ReleaseContext context) {
        return rate;
    }
}
