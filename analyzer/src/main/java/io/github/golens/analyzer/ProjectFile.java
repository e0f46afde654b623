package io.github.golens.analyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A Go source file relative to the project root. The relative path, with forward slashes, is the file identity used
 * in positions, call edges and references.
 */
public class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    public ProjectFile(Path root, Path relPath) {
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root.toAbsolutePath().normalize();
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    /** Identity of this file inside analysis results. */
    public String id() {
        return relPath.toString().replace('\\', '/');
    }

    public boolean isTestFile() {
        return relPath.getFileName().toString().endsWith("_test.go");
    }

    public String read() throws IOException {
        return Files.readString(absPath());
    }

    @Override
    public int compareTo(ProjectFile other) {
        return id().compareTo(other.id());
    }

    @Override
    public String toString() {
        return id();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
