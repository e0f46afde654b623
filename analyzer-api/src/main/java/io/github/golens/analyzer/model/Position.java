package io.github.golens.analyzer.model;

/**
 * A location in a Go source file. Lines and columns are 1-based; columns count UTF-8 bytes, the way the Go toolchain
 * reports them.
 *
 * @param file the file path as the analysis knows it (relative to the project root)
 * @param line 1-based line number
 * @param column 1-based byte column
 */
public record Position(String file, int line, int column) {

    public Position {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based, got %d:%d".formatted(line, column));
        }
    }

    /** Key used to deduplicate occurrences within one file. */
    public String lineColumnKey() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
