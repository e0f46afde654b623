package io.github.golens.analyzer.go;

import static org.junit.jupiter.api.Assertions.*;

import io.github.golens.analyzer.model.Position;
import io.github.golens.analyzer.model.Symbol;
import io.github.golens.testutil.GoTestSources;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

public class CodeBlockExtractorTest {

    private static final String SOURCE =
            """
            package shapes

            type Square struct{ side int }
            type Circle struct{ radius int }

            func (s *Square) Area() int {
            	return s.side * s.side
            }

            func (c Circle) Area() int {
            	return 3 * c.radius * c.radius
            }

            func Describe(name string) string {
            	return "shape " + name
            }
            """;

    private static List<Symbol> extract(ParsedGoFile file) {
        var analysis = new DeclarationExtractor().extract(file);
        new CodeBlockExtractor(new StatementDecomposer()).extract(file, analysis);
        return analysis.build().functions();
    }

    @Test
    public void testCodeBlocksAreExactSourceSlices() {
        var functions = extract(GoTestSources.parse("shapes.go", SOURCE));

        assertEquals(3, functions.size());
        assertEquals(
                """
                func (s *Square) Area() int {
                	return s.side * s.side
                }""",
                functions.get(0).codeBlock());
        assertEquals(
                """
                func (c Circle) Area() int {
                	return 3 * c.radius * c.radius
                }""",
                functions.get(1).codeBlock());
        assertTrue(functions.get(2).codeBlock().startsWith("func Describe(name string) string {"));
    }

    @Test
    public void testBodiesAreDecomposed() {
        var functions = extract(GoTestSources.parse("shapes.go", SOURCE));

        var describe = functions.get(2);
        assertEquals(1, describe.statements().size());
        assertEquals("return", describe.statements().get(0).kind());
        assertEquals("return \"shape \" + name", describe.statements().get(0).text());
    }

    @Test
    public void testInconsistentOffsetsLeaveCodeBlockEmpty() {
        var parsed = GoTestSources.parse("shapes.go", SOURCE);
        var real = parsed.positions();
        PositionService pastTheEnd = new PositionService() {
            @Override
            public Position positionOf(TSNode node) {
                return real.positionOf(node);
            }

            @Override
            public int startOffset(TSNode node) {
                return real.startOffset(node);
            }

            @Override
            public int endOffset(TSNode node) {
                return parsed.source().byteLength() + 100;
            }
        };
        PositionService reversed = new PositionService() {
            @Override
            public Position positionOf(TSNode node) {
                return real.positionOf(node);
            }

            @Override
            public int startOffset(TSNode node) {
                return real.endOffset(node);
            }

            @Override
            public int endOffset(TSNode node) {
                return real.startOffset(node);
            }
        };

        for (var positions : List.of(pastTheEnd, reversed)) {
            var file = new ParsedGoFile(parsed.filePath(), parsed.source(), parsed.tree(), positions);
            var functions = extract(file);
            assertEquals(3, functions.size());
            functions.forEach(f -> assertEquals("", f.codeBlock(), f.name()));
        }
    }
}
