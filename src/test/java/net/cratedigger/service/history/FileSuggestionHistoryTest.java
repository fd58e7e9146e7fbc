package net.cratedigger.service.history;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import net.cratedigger.config.HistoryProperties;
import net.cratedigger.domain.history.DislikeLevel;
import net.cratedigger.domain.history.HistoryRecord;
import net.cratedigger.domain.recommendation.Recommendation;
import net.cratedigger.support.persistence.JsonDocumentStore;
import net.cratedigger.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

class FileSuggestionHistoryTest {

    @TempDir
    Path dataDir;

    private MutableClock clock;
    private Path file;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        file = dataDir.resolve("recommendation_history.json");
    }

    private FileSuggestionHistory open() {
        return new FileSuggestionHistory(
            new JsonDocumentStore<>(file, JsonMapper.builder().build(), new TypeReference<List<HistoryRecord>>() { }),
            new HistoryProperties(),
            clock);
    }

    @Test
    void should_IgnoreRejection_When_SuggestedInsideGuardWindow() {
        FileSuggestionHistory history = open();
        history.recordSuggestions(List.of(Recommendation.of("Yes", "Fragile", "Rock", 0.9)));

        clock.advance(Duration.ofHours(2));
        boolean recorded = history.recordRejected("Yes", "Fragile", "meh");

        assertThat(recorded).isFalse();
        assertThat(history.wasRejectedOrDisliked("Yes", "Fragile")).isFalse();
    }

    @Test
    void should_RecordRejection_When_GuardWindowElapsed() {
        FileSuggestionHistory history = open();
        history.recordSuggestions(List.of(Recommendation.of("Yes", "Fragile", "Rock", 0.9)));

        clock.advance(Duration.ofHours(25));

        assertThat(history.recordRejected("yes", "FRAGILE", "meh")).isTrue();
        assertThat(history.wasRejectedOrDisliked("Yes", "Fragile")).isTrue();
    }

    @Test
    void should_ForgetRejection_When_MemoryWindowElapsed() {
        FileSuggestionHistory history = open();
        assertThat(history.recordRejected("Can", "Tago Mago", null)).isTrue();

        clock.advance(Duration.ofDays(29));
        assertThat(history.wasRejectedOrDisliked("Can", "Tago Mago")).isTrue();

        clock.advance(Duration.ofDays(2));
        assertThat(history.wasRejectedOrDisliked("Can", "Tago Mago")).isFalse();
    }

    @Test
    void should_RememberDislikeIndefinitely_When_NoLaterAcceptance() {
        FileSuggestionHistory history = open();
        history.recordDisliked("Faust", "IV", DislikeLevel.NORMAL);

        clock.advance(Duration.ofDays(365));

        assertThat(history.wasRejectedOrDisliked("Faust", "IV")).isTrue();
    }

    @Test
    void should_ClearExclusion_When_AcceptedAfterRejection() {
        FileSuggestionHistory history = open();
        history.recordRejected("Can", "Tago Mago", null);
        clock.advance(Duration.ofMinutes(1));
        history.recordAccepted("Can", "Tago Mago");

        assertThat(history.wasRejectedOrDisliked("Can", "Tago Mago")).isFalse();
    }

    @Test
    void should_ListNeverAndAvoidLines_When_BuildingExclusionPrompt() {
        FileSuggestionHistory history = open();
        history.recordDisliked("Faust", "IV", DislikeLevel.NEVER_AGAIN);
        history.recordRejected("Can", "Tago Mago", null);

        String prompt = history.exclusionPrompt();

        assertThat(prompt).contains("NEVER_RECOMMEND: Faust - IV");
        assertThat(prompt).contains("AVOID: Can - Tago Mago");
    }

    @Test
    void should_ReloadEntries_When_HistoryReopened() {
        FileSuggestionHistory history = open();
        history.recordSuggestions(List.of(
            Recommendation.of("Yes", "Fragile", "Rock", 0.9),
            Recommendation.of("Can", "Tago Mago", "Krautrock", 0.7)));
        history.recordDisliked("Faust", "IV", DislikeLevel.STRONG);

        FileSuggestionHistory reopened = open();

        assertThat(reopened.summary()).isEqualTo(new HistorySummary(2, 0, 1, 0, 0));
        assertThat(reopened.wasRejectedOrDisliked("faust", "iv")).isTrue();
        assertThat(file).content().contains("\"status\"").contains("\"Suggested\"").contains("\"Disliked\"");
    }

    @Test
    void should_CountOverSuggestedKeys_When_SuggestedRepeatedly() {
        FileSuggestionHistory history = open();
        for (int i = 0; i < 3; i++) {
            history.recordSuggestions(List.of(Recommendation.of("Yes", "Fragile", "Rock", 0.9)));
            clock.advance(Duration.ofDays(1));
        }

        assertThat(history.summary().overSuggested()).isEqualTo(1);
        assertThat(history.exclusionPrompt()).contains("AVOID: Yes - Fragile");
    }
}
