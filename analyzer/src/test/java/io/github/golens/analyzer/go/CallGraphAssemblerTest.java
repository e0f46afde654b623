package io.github.golens.analyzer.go;

import static org.junit.jupiter.api.Assertions.*;

import io.github.golens.analyzer.model.CallGraphEdge;
import io.github.golens.analyzer.model.CallGraphNode;
import io.github.golens.analyzer.model.FileAnalysis;
import io.github.golens.testutil.GoTestSources;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CallGraphAssemblerTest {

    private static FileAnalysis analyze(String path, String source) {
        var context = new AnalysisContext();
        var file = GoTestSources.parse(path, source);
        var analysis = GoTestSources.firstPass(file, context);
        analysis.setCalls(new CallHierarchyBuilder().build(file, analysis));
        return analysis.build();
    }

    private static final String UTIL =
            """
            package util

            func Helper(n int) int { return n }
            """;

    private static final String MAIN =
            """
            package main

            import (
            	"fmt"
            	"example.com/app/util"
            )

            type Service struct{}

            func (s *Service) Run() {
            	s.log("start")
            }

            func (s *Service) log(msg string) {
            	fmt.Println(msg)
            }

            func main() {
            	util.Helper(1)
            	util.Helper(2)
            	items := make([]int, 0)
            	fmt.Println(len(items))
            	local()
            	unknown()
            }

            func local() {}
            """;

    @Test
    public void testDeclaredFunctionsBecomeNodes() {
        var graph = new CallGraphAssembler().assemble(List.of(analyze("main.go", MAIN), analyze("util/util.go", UTIL)));

        var run = graph.node("main.Service.Run").orElseThrow();
        assertFalse(run.external());
        assertEquals("Service", run.receiver());
        assertEquals("main.go", run.filePath());
        assertEquals(10, run.line());

        var helper = graph.node("util.Helper").orElseThrow();
        assertFalse(helper.external());
        assertEquals("util", helper.packageName());
        assertEquals("util/util.go", helper.filePath());
    }

    @Test
    public void testRepeatedCallsCollapseIntoOneEdge() {
        var graph = new CallGraphAssembler().assemble(List.of(analyze("main.go", MAIN), analyze("util/util.go", UTIL)));

        var edge = graph.edge("main.main", "util.Helper").orElseThrow();
        assertEquals(2, edge.count());
        assertEquals(List.of("1"), edge.argumentTexts());
        assertEquals(19, edge.line());
        assertEquals(1, graph.edges().stream()
                .filter(e -> e.source().equals("main.main") && e.target().equals("util.Helper"))
                .count());
    }

    @Test
    public void testExternalAndBuiltinCallees() {
        var graph = new CallGraphAssembler().assemble(List.of(analyze("main.go", MAIN)));

        var println = graph.node("fmt.Println").orElseThrow();
        assertTrue(println.external());
        assertEquals("fmt", println.packageName());
        assertNull(println.filePath());
        assertEquals(1, graph.nodes().stream().filter(n -> n.id().equals("fmt.Println")).count());

        // util is not part of this graph, so the imported helper is external too
        assertTrue(graph.node("util.Helper").orElseThrow().external());

        assertTrue(graph.node("builtin.len").orElseThrow().external());
        assertTrue(graph.edge("main.main", "builtin.make").isPresent());
        assertTrue(graph.node("unknown").orElseThrow().external());
        assertTrue(graph.edge("main.main", "main.local").isPresent());
    }

    @Test
    public void testReceiverCallLinksToUniqueMethod() {
        var graph = new CallGraphAssembler().assemble(List.of(analyze("main.go", MAIN)));

        assertTrue(graph.edge("main.Service.Run", "main.Service.log").isPresent());
        assertTrue(graph.edge("main.Service.log", "fmt.Println").isPresent());
    }

    @Test
    public void testEveryEdgeEndpointIsANode() {
        var graph = new CallGraphAssembler().assemble(List.of(analyze("main.go", MAIN), analyze("util/util.go", UTIL)));

        var ids = graph.nodes().stream().map(CallGraphNode::id).toList();
        for (CallGraphEdge edge : graph.edges()) {
            assertTrue(ids.contains(edge.source()), edge.source());
            assertTrue(ids.contains(edge.target()), edge.target());
        }
        assertEquals(ids.size(), ids.stream().distinct().count());
    }

    @Test
    public void testEmptyInput() {
        var graph = new CallGraphAssembler().assemble(List.of());

        assertTrue(graph.nodes().isEmpty());
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    public void testSplitName() {
        assertEquals(new CallGraphAssembler.SplitName("s", "log"), CallGraphAssembler.SplitName.of("s.log"));
        assertEquals(new CallGraphAssembler.SplitName(null, "run"), CallGraphAssembler.SplitName.of("run"));
        assertNull(CallGraphAssembler.SplitName.of("(f()).g").receiver());
    }
}
