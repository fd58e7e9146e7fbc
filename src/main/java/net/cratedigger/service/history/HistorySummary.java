package net.cratedigger.service.history;

/**
 * Aggregate counts over the suggestion history.
 *
 * @param suggestions total {@code Suggested} entries
 * @param rejected total {@code Rejected} entries
 * @param disliked total {@code Disliked} entries
 * @param accepted total {@code Accepted} entries
 * @param overSuggested distinct items suggested at least the configured threshold without being accepted
 */
public record HistorySummary(int suggestions, int rejected, int disliked, int accepted, int overSuggested) {
}
