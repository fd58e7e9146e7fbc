package net.cratedigger.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Locations of the JSON documents backing the review queue, history and library.
 */
@Component
@ConfigurationProperties(prefix = "cratedigger.storage")
public class StorageProperties {

    private String dataDir = "./data";
    private String reviewQueueFile = "review_queue.json";
    private String historyFile = "recommendation_history.json";
    private String selectionFile = "approval_selection.json";
    private String libraryFile = "library.json";

    public Path resolve(String fileName) {
        return Paths.get(dataDir).resolve(fileName);
    }

    public Path reviewQueuePath() {
        return resolve(reviewQueueFile);
    }

    public Path historyPath() {
        return resolve(historyFile);
    }

    public Path selectionPath() {
        return resolve(selectionFile);
    }

    public Path libraryPath() {
        return resolve(libraryFile);
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getReviewQueueFile() {
        return reviewQueueFile;
    }

    public void setReviewQueueFile(String reviewQueueFile) {
        this.reviewQueueFile = reviewQueueFile;
    }

    public String getHistoryFile() {
        return historyFile;
    }

    public void setHistoryFile(String historyFile) {
        this.historyFile = historyFile;
    }

    public String getSelectionFile() {
        return selectionFile;
    }

    public void setSelectionFile(String selectionFile) {
        this.selectionFile = selectionFile;
    }

    public String getLibraryFile() {
        return libraryFile;
    }

    public void setLibraryFile(String libraryFile) {
        this.libraryFile = libraryFile;
    }
}
