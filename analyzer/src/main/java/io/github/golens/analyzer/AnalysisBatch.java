package io.github.golens.analyzer;

import io.github.golens.analyzer.model.FileAnalysis;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of analysing several files. A file that failed is reported in {@code failures} and has no analysis;
 * its siblings are unaffected.
 */
public record AnalysisBatch(List<FileAnalysis> analyses, List<FileFailure> failures) {

    public AnalysisBatch {
        analyses = List.copyOf(analyses);
        failures = List.copyOf(failures);
    }

    public Optional<FileAnalysis> analysisOf(String file) {
        return analyses.stream().filter(a -> a.filePath().equals(file)).findFirst();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** A file that could not be analysed. */
    public record FileFailure(String file, AnalysisException error) {
        public String reason() {
            return error.getMessage();
        }
    }
}
