package net.cratedigger.service.pipeline;

/**
 * Completes a cache computation that was cancelled, carrying the partial result so
 * the cancelled run can still return it. Never cached.
 */
public class PipelineCancelledException extends RuntimeException {

    private final transient PipelineResult partialResult;

    public PipelineCancelledException(PipelineResult partialResult) {
        super("Recommendation run cancelled after " + partialResult.recommendations().size() + " items");
        this.partialResult = partialResult;
    }

    public PipelineResult partialResult() {
        return partialResult;
    }
}
