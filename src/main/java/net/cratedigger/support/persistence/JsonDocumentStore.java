package net.cratedigger.support.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.function.Supplier;
import net.cratedigger.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads and rewrites one JSON document on disk.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so a
 * reader never observes a half-written document. Storage failures are logged and
 * reported through return values instead of exceptions: callers keep their
 * in-memory state and retry on the next mutation.</p>
 *
 * @param <T> document type
 */
public class JsonDocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final TypeReference<T> documentType;

    public JsonDocumentStore(Path path, ObjectMapper objectMapper, TypeReference<T> documentType) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.documentType = Objects.requireNonNull(documentType, "documentType must not be null");
    }

    public Path path() {
        return path;
    }

    /**
     * Loads the document, falling back when the file is missing, empty or unreadable.
     *
     * @param fallback supplies the value used when nothing usable is on disk
     * @return parsed document or the fallback value
     */
    public T load(Supplier<T> fallback) {
        if (!Files.exists(path)) {
            return fallback.get();
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return fallback.get();
            }
            T document = objectMapper.readValue(json, documentType);
            return document == null ? fallback.get() : document;
        } catch (IOException | JacksonException e) {
            LoggingUtils.warn(log, e, "Failed to read {}; starting from an empty document", path);
            return fallback.get();
        }
    }

    /**
     * Atomically replaces the document on disk.
     *
     * @return {@code true} when the document was written
     */
    public boolean save(T document) {
        Path temp = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            temp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp);
            return true;
        } catch (IOException | JacksonException e) {
            LoggingUtils.warn(log, e, "Failed to persist {}; in-memory state retained", path);
            deleteQuietly(temp);
            return false;
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            log.debug("Could not remove temp file {}: {}", temp, cleanupFailure.getMessage());
        }
    }
}
