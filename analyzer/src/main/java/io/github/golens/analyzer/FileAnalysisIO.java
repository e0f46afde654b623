package io.github.golens.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.github.golens.analyzer.model.CallGraph;
import io.github.golens.analyzer.model.FileAnalysis;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** JSON persistence for analysis results, for the storage and reporting tools that consume them. */
public final class FileAnalysisIO {
    private static final Logger log = LogManager.getLogger(FileAnalysisIO.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private FileAnalysisIO() {}

    public static String toJson(FileAnalysis analysis) {
        try {
            return MAPPER.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FileAnalysis fromJson(String json) throws IOException {
        return MAPPER.readValue(json, FileAnalysis.class);
    }

    /** Writes the analysis as JSON, creating parent directories. */
    public static void save(FileAnalysis analysis, Path file) throws IOException {
        write(analysis, file);
        log.debug("Saved analysis of {} to {}", analysis.filePath(), file);
    }

    public static void save(CallGraph graph, Path file) throws IOException {
        write(graph, file);
        log.debug("Saved call graph ({} nodes, {} edges) to {}", graph.nodes().size(), graph.edges().size(), file);
    }

    /** Reads a saved analysis; empty when the file is missing or holds something else. */
    public static Optional<FileAnalysis> loadAnalysis(Path file) {
        return load(file, FileAnalysis.class);
    }

    public static Optional<CallGraph> loadCallGraph(Path file) {
        return load(file, CallGraph.class);
    }

    private static void write(Object value, Path file) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), value);
    }

    private static <T> Optional<T> load(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            log.debug("Analysis file does not exist: {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(file.toFile(), type));
        } catch (MismatchedInputException mie) {
            log.warn("{} does not hold a {} ({})", file, type.getSimpleName(), mie.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to load {} from {}: {}", type.getSimpleName(), file, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
