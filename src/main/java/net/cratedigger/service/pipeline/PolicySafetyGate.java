package net.cratedigger.service.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import net.cratedigger.config.RecommendationProperties;
import net.cratedigger.domain.recommendation.Recommendation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Default {@link SafetyGate}: vetoes low-confidence items and items mentioning a blocked term.
 */
@Component
public class PolicySafetyGate implements SafetyGate {

    private final double minConfidence;
    private final List<String> blockedTerms;

    @Autowired
    public PolicySafetyGate(RecommendationProperties properties) {
        this(properties.getMinConfidence(), properties.getBlockedTerms());
    }

    public PolicySafetyGate(double minConfidence, List<String> blockedTerms) {
        this.minConfidence = minConfidence;
        this.blockedTerms = blockedTerms == null ? List.of() : blockedTerms.stream()
            .filter(StringUtils::hasText)
            .map(term -> term.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    @Override
    public Optional<String> veto(Recommendation item) {
        if (item.confidence() < minConfidence) {
            return Optional.of(String.format(Locale.ROOT, "confidence %.2f below %.2f", item.confidence(), minConfidence));
        }
        if (blockedTerms.isEmpty()) {
            return Optional.empty();
        }
        String haystack = Stream.of(item.artist(), item.album(), item.genre(), item.reason())
            .filter(StringUtils::hasText)
            .map(text -> text.toLowerCase(Locale.ROOT))
            .reduce("", (left, right) -> left + "\n" + right);
        return blockedTerms.stream()
            .filter(haystack::contains)
            .findFirst()
            .map(term -> "blocked term '" + term + "'");
    }
}
