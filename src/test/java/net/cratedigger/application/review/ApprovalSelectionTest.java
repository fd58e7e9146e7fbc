package net.cratedigger.application.review;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import net.cratedigger.domain.review.ReviewKey;
import net.cratedigger.support.persistence.JsonDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

class ApprovalSelectionTest {

    @TempDir
    Path dataDir;

    private ApprovalSelection open() {
        return new ApprovalSelection(new JsonDocumentStore<>(dataDir.resolve("approval_selection.json"),
            JsonMapper.builder().build(), new TypeReference<List<String>>() { }));
    }

    @Test
    void should_PersistSelection_When_Replaced() {
        ApprovalSelection selection = open();
        selection.replace(List.of(ReviewKey.of("Yes", "Fragile"), ReviewKey.of("Can", "Tago Mago")));

        assertThat(open().keys()).containsExactly(ReviewKey.of("yes", "fragile"), ReviewKey.of("can", "tago mago"));
    }

    @Test
    void should_EmptySelection_When_Cleared() {
        ApprovalSelection selection = open();
        selection.replace(List.of(ReviewKey.of("Yes", "Fragile"), ReviewKey.of("Can", "Tago Mago")));

        assertThat(selection.clearSelection()).isEqualTo(2);
        assertThat(selection.keys()).isEmpty();
        assertThat(open().keys()).isEmpty();
    }

    @Test
    void should_RemoveOnlyProcessedKeys_When_ClearedPartially() {
        ApprovalSelection selection = open();
        selection.replace(List.of(ReviewKey.of("Yes", "Fragile"), ReviewKey.of("Can", "Tago Mago")));

        int cleared = selection.clearSelection(List.of(ReviewKey.of("YES", "Fragile")));

        assertThat(cleared).isEqualTo(1);
        assertThat(selection.keys()).containsExactly(ReviewKey.of("can", "tago mago"));
    }
}
