package io.github.golens.analyzer;

/**
 * Callback interface for reporting progress during a batch analysis.
 * Implementations should be thread-safe as they may be called from worker threads.
 */
@FunctionalInterface
public interface AnalyzerProgressCallback {
    /**
     * @param completed Number of files completed in the current pass
     * @param total Total number of files in the pass
     * @param description The pass being run (e.g., "Extracting declarations")
     */
    void onProgress(int completed, int total, String description);

    AnalyzerProgressCallback NOOP = (completed, total, description) -> {};
}
