package io.github.golens.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.github.golens.analyzer.model.RefType;
import io.github.golens.analyzer.model.ReferenceRecord;
import io.github.golens.analyzer.model.SymbolKind;
import io.github.golens.testutil.InlineGoProjectCreator;
import io.github.golens.testutil.InlineGoProjectCreator.TestProject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GoAnalyzerTest {

    private static final String UTIL =
            """
            package util

            // Helper doubles n.
            func Helper(n int) int {
            	return n * 2
            }
            """;

    private static final String MAIN =
            """
            package main

            import (
            	"fmt"
            	"example.com/app/util"
            )

            func main() {
            	total := util.Helper(1)
            	total = util.Helper(total)
            	fmt.Println(total)
            }
            """;

    @TempDir
    Path root;

    private TestProject project() throws IOException {
        return InlineGoProjectCreator.code(UTIL, "util/util.go")
                .addFileContents(MAIN, "main.go")
                .addFileContents("package util\n\nfunc TestHelper() {}\n", "util/util_test.go")
                .build(root);
    }

    private static GoAnalyzer analyzer() {
        return new GoAnalyzer(new AnalyzerConfig(2, false));
    }

    @Test
    public void testBatchAcrossFiles() throws IOException {
        var project = project();
        var analyzer = analyzer();

        var batch = analyzer.analyzeFiles(project.files());

        assertFalse(batch.hasFailures());
        assertEquals(List.of("main.go", "util/util.go"), batch.analyses().stream().map(a -> a.filePath()).toList());
        assertFalse(analyzer.isEmpty());

        var helper = analyzer.lookupSymbol("util.Helper").orElseThrow();
        assertEquals(SymbolKind.FUNCTION, helper.kind());
        assertEquals("Helper doubles n.", helper.docComment());

        var graph = analyzer.buildCallGraph();
        var edge = graph.edge("main.main", "util.Helper").orElseThrow();
        assertEquals(2, edge.count());
        assertFalse(graph.node("util.Helper").orElseThrow().external());
        assertTrue(graph.node("fmt.Println").orElseThrow().external());

        var calls = analyzer.callHierarchy("main.go", "main");
        assertEquals(3, calls.size());
        assertEquals("example.com/app/util", calls.get(0).calleeImportPath());

        var helperRefs = analyzer.referencesOf("util.Helper");
        assertEquals(
                List.of(RefType.DECLARATION),
                helperRefs.stream().map(ReferenceRecord::refType).toList());
        assertEquals(2, analyzer.referencesOf("example.com/app/util.Helper").size());
    }

    @Test
    public void testTestFilesFollowConfiguration() throws IOException {
        var project = project();

        var withoutTests = analyzer().analyzeFiles(project.files());
        assertTrue(withoutTests.analysisOf("util/util_test.go").isEmpty());

        var withTests = new GoAnalyzer(new AnalyzerConfig(1, true)).analyzeFiles(project.files());
        assertTrue(withTests.analysisOf("util/util_test.go").isPresent());
    }

    @Test
    public void testMissingFileFailsAlone() throws IOException {
        var project = project();
        var files = new ArrayList<>(project.files());
        files.add(new ProjectFile(root, "missing.go"));
        var analyzer = analyzer();

        var batch = analyzer.analyzeFiles(files);

        assertTrue(batch.hasFailures());
        assertEquals(1, batch.failures().size());
        assertEquals("missing.go", batch.failures().get(0).file());
        assertEquals(2, batch.analyses().size());
        assertTrue(analyzer.lookupSymbol("main.main").isPresent());
    }

    @Test
    public void testAnalyzeFileThrowsForUnreadableFile() {
        var analyzer = analyzer();

        var e = assertThrows(AnalysisException.class, () -> analyzer.analyzeFile(new ProjectFile(root, "nope.go")));
        assertEquals("nope.go", e.file());
    }

    @Test
    public void testReanalysisIsIdempotent() throws IOException {
        var project = project();
        var analyzer = analyzer();

        var firstBatch = analyzer.analyzeFiles(project.files());
        var firstSymbols = analyzer.getAllDeclarations();
        var firstRefs = analyzer.referencesOf("example.com/app/util.Helper");
        var firstCalls = analyzer.callHierarchy("main.go", "main");
        var firstGraph = analyzer.buildCallGraph();

        var secondBatch = analyzer.analyzeFiles(project.files());

        assertEquals(firstBatch.analyses(), secondBatch.analyses());
        assertEquals(firstBatch.analyses().get(0), analyzer.getAnalysis("main.go").orElseThrow());
        assertEquals(firstSymbols, analyzer.getAllDeclarations());
        assertEquals(firstRefs, analyzer.referencesOf("example.com/app/util.Helper"));
        assertEquals(firstCalls, analyzer.callHierarchy("main.go", "main"));
        assertEquals(firstGraph, analyzer.buildCallGraph());
    }

    @Test
    public void testFunctionSourceAndFileDeclarations() throws Exception {
        var project = project();
        var analyzer = analyzer();

        analyzer.analyzeFile(project.file("util/util.go"));

        assertEquals(
                "func Helper(n int) int {\n\treturn n * 2\n}",
                analyzer.getFunctionSource("util.Helper").orElseThrow());
        assertTrue(analyzer.getFunctionSource("util.Missing").isEmpty());
        assertEquals(
                List.of("Helper"),
                analyzer.getDeclarationsInFile("util/util.go").stream().map(s -> s.name()).toList());
        assertTrue(analyzer.getDeclarationsInFile("main.go").isEmpty());
    }

    @Test
    public void testProgressIsReportedPerPass() throws IOException {
        var project = project();
        var events = Collections.synchronizedList(new ArrayList<String>());

        analyzer().analyzeFiles(
                project.files(), (completed, total, description) -> events.add(description + " " + completed + "/" + total));

        assertEquals(4, events.size());
        assertTrue(events.contains("Extracting declarations 2/2"));
        assertTrue(events.contains("Resolving calls and references 2/2"));
    }

    @Test
    public void testEmptyAnalyzer() {
        var analyzer = analyzer();

        assertTrue(analyzer.isEmpty());
        assertTrue(analyzer.analyzeFiles(List.of()).analyses().isEmpty());
        assertTrue(analyzer.buildCallGraph().nodes().isEmpty());
    }
}
