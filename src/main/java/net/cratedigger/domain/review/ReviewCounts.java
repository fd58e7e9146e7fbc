package net.cratedigger.domain.review;

/**
 * Number of queued items per review status.
 */
public record ReviewCounts(int pending, int accepted, int rejected, int neverAgain) {

    public int total() {
        return pending + accepted + rejected + neverAgain;
    }
}
