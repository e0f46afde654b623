package io.github.golens.testutil;

import io.github.golens.analyzer.ProjectFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/** Writes Go sources defined by content-filename pairs into a project directory. */
public class InlineGoProjectCreator {

    private InlineGoProjectCreator() {}

    public static TestProjectBuilder code(String contents, String filename) {
        return new TestProjectBuilder().addFileContents(contents, filename);
    }

    public static class TestProjectBuilder {
        private final List<FileContents> entries = new ArrayList<>();

        private TestProjectBuilder() {}

        public TestProjectBuilder addFileContents(String contents, String filename) {
            entries.add(new FileContents(filename, contents));
            return this;
        }

        public TestProject build(Path root) throws IOException {
            var files = new ArrayList<ProjectFile>();
            for (var entry : entries) {
                var absPath = root.resolve(entry.relPath());
                Files.createDirectories(absPath.getParent());
                Files.writeString(absPath, entry.contents(), StandardOpenOption.CREATE_NEW);
                files.add(new ProjectFile(root, entry.relPath()));
            }
            return new TestProject(root, files);
        }
    }

    private record FileContents(String relPath, String contents) {}

    public record TestProject(Path root, List<ProjectFile> files) {
        public ProjectFile file(String relPath) {
            return files.stream()
                    .filter(f -> f.id().equals(relPath))
                    .findFirst()
                    .orElseThrow(() -> new NoSuchElementException(relPath));
        }
    }
}
