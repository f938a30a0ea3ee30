package hydrocascade.operation.rule;

/**
 * Desagüe al caudal máximo del embalse (zona de avenidas).
 */
public record MaxReleaseRule() implements ReleaseRule {

    @Override
    public double release(ReleaseContext context) {
        return context.maxReleaseRate();
    }
}
