package net.cratedigger.service.pipeline;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.domain.recommendation.RecommendationMode;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.library.LibraryCatalog;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Renders the provider prompt for a batch or a top-up round.
 */
@Component
public class RecommendationPromptBuilder {

    private static final int TOP_GENRE_COUNT = 8;

    private final LibraryCatalog library;
    private final SuggestionHistory history;

    public RecommendationPromptBuilder(LibraryCatalog library, SuggestionHistory history) {
        this.library = Objects.requireNonNull(library, "library must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    /**
     * @param request run settings
     * @param count number of candidates to ask for
     * @param alreadyChosen items accepted earlier in the run, excluded from the answer
     */
    public String build(PipelineRequest request, int count, Collection<Recommendation> alreadyChosen) {
        StringBuilder prompt = new StringBuilder();
        String unit = request.mode() == RecommendationMode.ALBUMS ? "albums" : "artists";
        prompt.append("Recommend exactly ").append(count).append(' ').append(unit)
            .append(" for a music collection.\n");

        List<String> genres = library.topGenres(TOP_GENRE_COUNT);
        if (!genres.isEmpty()) {
            prompt.append("The collection leans towards: ").append(String.join(", ", genres)).append(".\n");
        }
        if (!request.styleFilters().isEmpty()) {
            prompt.append(request.relaxStyleMatching() ? "Prefer these styles: " : "Only these styles: ")
                .append(String.join(", ", request.styleFilters())).append(".\n");
        }
        prompt.append("Do not suggest anything already in the collection.\n");

        String exclusions = history.exclusionPrompt();
        if (StringUtils.hasText(exclusions)) {
            prompt.append(exclusions).append('\n');
        }
        if (alreadyChosen != null && !alreadyChosen.isEmpty()) {
            prompt.append("ALREADY_CHOSEN: ")
                .append(alreadyChosen.stream().map(Recommendation::displayName).collect(Collectors.joining("; ")))
                .append('\n');
        }
        prompt.append("Answer with a JSON object {\"recommendations\": [...]} where each entry has ")
            .append("artist, ")
            .append(request.mode() == RecommendationMode.ALBUMS ? "album, " : "")
            .append("genre, year, confidence (0 to 1) and reason.");
        return prompt.toString();
    }
}
