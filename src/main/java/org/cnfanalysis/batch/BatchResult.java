package org.cnfanalysis.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Esito aggregato di un'esecuzione batch con i file falliti e il motivo.
 */
public final class BatchResult {

    private final int totalFiles;
    private int successCount = 0;
    private int errorCount = 0;
    private int skippedCount = 0;
    private int timeoutCount = 0;
    private final List<String> failures = new ArrayList<>();

    public BatchResult(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    void incrementSuccess() { successCount++; }
    void incrementSkipped() { skippedCount++; }

    void recordError(Path file, String reason) {
        errorCount++;
        failures.add(file.getFileName() + ": " + reason);
    }

    void recordTimeout(Path file, int seconds) {
        timeoutCount++;
        failures.add(file.getFileName() + ": timeout dopo " + seconds + " secondi");
    }

    public int getTotalFiles() { return totalFiles; }
    public int getSuccessCount() { return successCount; }
    public int getErrorCount() { return errorCount; }
    public int getSkippedCount() { return skippedCount; }
    public int getTimeoutCount() { return timeoutCount; }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * @return true se nessun file è fallito né scaduto
     */
    public boolean isFullySuccessful() {
        return errorCount == 0 && timeoutCount == 0;
    }

    @Override
    public String toString() {
        return "BatchResult{totale=" + totalFiles + ", successi=" + successCount + ", errori=" + errorCount
                + ", saltati=" + skippedCount + ", timeout=" + timeoutCount + "}";
    }
}
