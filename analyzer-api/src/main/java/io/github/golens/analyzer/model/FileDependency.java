package io.github.golens.analyzer.model;

/**
 * An import of a file, as a dependency edge.
 *
 * @param importPath the imported package path
 * @param alias the name the file uses for it
 * @param stdlib true for standard library packages (paths without a dot in them)
 */
public record FileDependency(String importPath, String alias, boolean stdlib) {

    public static FileDependency of(String importPath, String alias) {
        return new FileDependency(importPath, alias, !importPath.contains("."));
    }
}
