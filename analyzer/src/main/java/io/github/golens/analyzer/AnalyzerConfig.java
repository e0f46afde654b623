package io.github.golens.analyzer;

import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Analyzer settings, read from the environment.
 *
 * <ul>
 *   <li>{@code GOLENS_ANALYSIS_THREADS} (or system property {@code golens.analysis.threads}): size of the worker
 *       pool for per-file passes. Defaults to the number of available processors.</li>
 *   <li>{@code GOLENS_INCLUDE_TEST_FILES} (or {@code golens.include.test.files}): whether {@code _test.go} files take
 *       part in batch analysis. Defaults to {@code true}.</li>
 * </ul>
 *
 * System properties take precedence over environment variables.
 */
public record AnalyzerConfig(int analysisThreads, boolean includeTestFiles) {
    private static final Logger logger = LogManager.getLogger(AnalyzerConfig.class);

    static final String THREADS_ENV = "GOLENS_ANALYSIS_THREADS";
    static final String THREADS_PROPERTY = "golens.analysis.threads";
    static final String TEST_FILES_ENV = "GOLENS_INCLUDE_TEST_FILES";
    static final String TEST_FILES_PROPERTY = "golens.include.test.files";

    public AnalyzerConfig {
        if (analysisThreads < 1) {
            throw new IllegalArgumentException("analysisThreads must be positive, got " + analysisThreads);
        }
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(Math.max(1, Runtime.getRuntime().availableProcessors()), true);
    }

    public static AnalyzerConfig fromEnvironment() {
        var defaults = defaults();
        int threads = defaults.analysisThreads();
        var threadSetting = setting(THREADS_PROPERTY, THREADS_ENV);
        if (threadSetting != null) {
            try {
                threads = Math.max(1, Integer.parseInt(threadSetting.trim()));
                logger.info("{} override in effect; analysis threads: {}", THREADS_ENV, threads);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {} value '{}'", THREADS_ENV, threadSetting);
            }
        }

        boolean includeTests = defaults.includeTestFiles();
        var testSetting = setting(TEST_FILES_PROPERTY, TEST_FILES_ENV);
        if (testSetting != null) {
            includeTests = Boolean.parseBoolean(testSetting.trim().toLowerCase(Locale.ROOT));
            logger.info("{} override in effect; include test files: {}", TEST_FILES_ENV, includeTests);
        }
        return new AnalyzerConfig(threads, includeTests);
    }

    private static @Nullable String setting(String property, String env) {
        var value = System.getProperty(property);
        return value != null ? value : System.getenv(env);
    }
}
