package net.cratedigger.domain.recommendation;

/**
 * How hard the pipeline tries to fill a short batch with additional provider rounds.
 */
public enum BackfillStrategy {
    /** Never top up. */
    OFF(0),
    /** Top up within the configured iteration budget. */
    STANDARD(1),
    /** Top up with twice the configured iteration budget. */
    AGGRESSIVE(2);

    private final int iterationMultiplier;

    BackfillStrategy(int iterationMultiplier) {
        this.iterationMultiplier = iterationMultiplier;
    }

    public int effectiveIterations(int configuredIterations) {
        return Math.max(0, configuredIterations) * iterationMultiplier;
    }
}
