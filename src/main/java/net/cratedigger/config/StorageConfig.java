package net.cratedigger.config;

import java.time.Clock;
import java.util.List;
import net.cratedigger.adapters.library.JsonLibraryCatalog;
import net.cratedigger.adapters.library.LibraryEntry;
import net.cratedigger.application.review.ApprovalSelection;
import net.cratedigger.domain.history.HistoryRecord;
import net.cratedigger.domain.review.ReviewItem;
import net.cratedigger.service.history.FileSuggestionHistory;
import net.cratedigger.service.history.SuggestionHistory;
import net.cratedigger.service.review.FileReviewQueue;
import net.cratedigger.service.review.ReviewQueue;
import net.cratedigger.support.persistence.JsonDocumentStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * File-backed stores for the review queue, suggestion history, approval selection and library.
 */
@Configuration
public class StorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReviewQueue reviewQueue(StorageProperties storage, ObjectMapper objectMapper, Clock clock) {
        return new FileReviewQueue(
            new JsonDocumentStore<>(storage.reviewQueuePath(), objectMapper, new TypeReference<List<ReviewItem>>() { }),
            clock);
    }

    @Bean
    public SuggestionHistory suggestionHistory(StorageProperties storage, HistoryProperties history,
                                               ObjectMapper objectMapper, Clock clock) {
        return new FileSuggestionHistory(
            new JsonDocumentStore<>(storage.historyPath(), objectMapper, new TypeReference<List<HistoryRecord>>() { }),
            history,
            clock);
    }

    @Bean
    public ApprovalSelection approvalSelection(StorageProperties storage, ObjectMapper objectMapper) {
        return new ApprovalSelection(
            new JsonDocumentStore<>(storage.selectionPath(), objectMapper, new TypeReference<List<String>>() { }));
    }

    @Bean
    public JsonLibraryCatalog libraryCatalog(StorageProperties storage, ObjectMapper objectMapper) {
        return new JsonLibraryCatalog(
            new JsonDocumentStore<>(storage.libraryPath(), objectMapper, new TypeReference<List<LibraryEntry>>() { }));
    }
}
