package net.cratedigger.service.pipeline;

/**
 * Filtering stages, in execution order.
 */
public enum PipelineStage {
    SANITIZE(false),
    SCHEMA_VALIDATE(false),
    DEDUPLICATE(true),
    STYLE_GUARD(true),
    SAFETY_GATE(true);

    private final boolean reviewable;

    PipelineStage(boolean reviewable) {
        this.reviewable = reviewable;
    }

    /**
     * Whether items removed by this stage are offered to the review queue.
     * Malformed input is never offered.
     */
    public boolean reviewable() {
        return reviewable;
    }
}
