package io.github.golens.analyzer;

/** Raised when a file cannot be read or no syntax tree can be obtained for it. Aborts that file only. */
public class AnalysisException extends Exception {
    private final String file;

    public AnalysisException(String file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public AnalysisException(String file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public String file() {
        return file;
    }
}
