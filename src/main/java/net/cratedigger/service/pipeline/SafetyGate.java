package net.cratedigger.service.pipeline;

import java.util.Optional;
import net.cratedigger.domain.recommendation.Recommendation;

/**
 * Pluggable policy that can veto individual recommendations. Vetoed items go to the
 * filtered bucket and are offered for review.
 */
@FunctionalInterface
public interface SafetyGate {

    /**
     * @return the veto reason, or empty to let the item through
     */
    Optional<String> veto(Recommendation item);
}
