package io.github.golens.analyzer.go;

import static org.junit.jupiter.api.Assertions.*;

import io.github.golens.analyzer.model.RefType;
import io.github.golens.analyzer.model.ReferenceRecord;
import io.github.golens.testutil.GoTestSources;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ReferenceResolverTest {

    private static List<ReferenceRecord> resolve(String source) {
        var context = new AnalysisContext();
        var file = GoTestSources.parse("main.go", source);
        var analysis = GoTestSources.firstPass(file, context);
        return new ReferenceResolver().resolve(file, analysis, context.symbolTable());
    }

    private static List<ReferenceRecord> referencesTo(List<ReferenceRecord> records, String symbol) {
        return records.stream().filter(r -> r.symbol().equals(symbol)).toList();
    }

    @Test
    public void testDeclarationAndCallSite() {
        var records = resolve(
                """
                package main

                func Add(a, b int) int { return a + b }

                func Use() int {
                	return Add(1, 2)
                }
                """);

        var add = referencesTo(records, "main.Add");
        assertEquals(2, add.size());
        assertEquals(RefType.DECLARATION, add.get(0).refType());
        assertEquals(3, add.get(0).position().line());
        assertEquals(6, add.get(0).position().column());
        assertTrue(add.get(0).resolved());
        assertEquals(RefType.USAGE, add.get(1).refType());
        assertEquals(6, add.get(1).position().line());
        assertTrue(add.get(1).resolved());
    }

    @Test
    public void testModificationThenUsage() {
        var records = resolve(
                """
                package main

                func compute() int { return 1 }
                func use(v int) {}

                func run() {
                	var count int
                	count = compute()
                	use(count)
                }
                """);

        var count = referencesTo(records, "count");
        assertEquals(
                List.of(RefType.DECLARATION, RefType.MODIFICATION, RefType.USAGE),
                count.stream().map(ReferenceRecord::refType).toList());
        assertEquals(List.of(7, 8, 9), count.stream().map(r -> r.position().line()).toList());
        assertFalse(count.get(0).resolved());

        var compute = referencesTo(records, "main.compute");
        assertEquals(List.of(RefType.DECLARATION, RefType.USAGE), compute.stream().map(ReferenceRecord::refType).toList());
    }

    @Test
    public void testImportedMembersResolveToImportPath() {
        var records = resolve(
                """
                package main

                import (
                	"strings"
                	str "strings"
                )

                func Shout(msg string) string {
                	var b strings.Builder
                	b.WriteString(str.ToLower(msg))
                	return strings.ToUpper(b.String())
                }
                """);

        var builder = referencesTo(records, "strings.Builder");
        assertEquals(1, builder.size());
        assertTrue(builder.get(0).resolved());

        var lower = referencesTo(records, "strings.ToLower");
        assertEquals(1, lower.size());
        assertEquals(RefType.USAGE, lower.get(0).refType());

        var upper = referencesTo(records, "strings.ToUpper");
        assertEquals(1, upper.size());
        assertEquals(11, upper.get(0).position().line());
        assertTrue(upper.get(0).resolved());

        // package names themselves are not references
        assertTrue(referencesTo(records, "strings").isEmpty());
        assertTrue(referencesTo(records, "str").isEmpty());
    }

    @Test
    public void testFieldAssignmentThroughReceiver() {
        var records = resolve(
                """
                package main

                type Counter struct {
                	total int
                }

                func (c *Counter) Reset() {
                	c.total = 0
                	report(c.total)
                }

                func report(n int) {}
                """);

        var field = referencesTo(records, "c.total");
        assertEquals(
                List.of(RefType.MODIFICATION, RefType.USAGE),
                field.stream().map(ReferenceRecord::refType).toList());
        assertFalse(field.get(0).resolved());

        var method = referencesTo(records, "main.Counter.Reset");
        assertEquals(1, method.size());
        assertEquals(RefType.DECLARATION, method.get(0).refType());

        var counterType = referencesTo(records, "main.Counter");
        assertEquals(RefType.DECLARATION, counterType.get(0).refType());
        assertEquals(RefType.USAGE, counterType.get(1).refType());
    }

    @Test
    public void testMemberDeclarationsAreQualifiedByTheirType() {
        var records = resolve(
                """
                package pkg

                type Point struct {
                	Name string
                	*Logger
                }

                type Runner interface {
                	Run() error
                }
                """);

        var name = referencesTo(records, "pkg.Point.Name");
        assertEquals(1, name.size());
        assertEquals(RefType.DECLARATION, name.get(0).refType());
        assertEquals(4, name.get(0).position().line());
        assertTrue(name.get(0).resolved());
        assertTrue(referencesTo(records, "Name").isEmpty());

        var run = referencesTo(records, "pkg.Runner.Run");
        assertEquals(1, run.size());
        assertEquals(RefType.DECLARATION, run.get(0).refType());

        // embedded types stay references to the type
        assertTrue(referencesTo(records, "pkg.Point.Logger").isEmpty());
        assertEquals(RefType.USAGE, referencesTo(records, "Logger").get(0).refType());
    }

    @Test
    public void testBuiltinsKeywordsAndShortNamesAreSkipped() {
        var records = resolve(
                """
                package main

                func size(items []string) int {
                	n := len(items)
                	if n == 0 {
                		return 0
                	}
                	return n + cap(items)
                }
                """);

        assertTrue(referencesTo(records, "len").isEmpty());
        assertTrue(referencesTo(records, "cap").isEmpty());
        assertTrue(referencesTo(records, "int").isEmpty());
        assertTrue(referencesTo(records, "string").isEmpty());
        assertTrue(referencesTo(records, "n").isEmpty());

        var items = referencesTo(records, "items");
        assertEquals(
                List.of(RefType.DECLARATION, RefType.USAGE, RefType.USAGE),
                items.stream().map(ReferenceRecord::refType).toList());
    }

    @Test
    public void testUnresolvedNamesKeepTheirSpelling() {
        var records = resolve(
                """
                package main

                func main() {
                	Missing()
                }
                """);

        var missing = referencesTo(records, "Missing");
        assertEquals(1, missing.size());
        assertEquals(RefType.USAGE, missing.get(0).refType());
        assertFalse(missing.get(0).resolved());
    }

    @Test
    public void testAtMostOneRecordPerPosition() {
        var records = resolve(
                """
                package main

                import "fmt"

                type Point struct{ X, Y int }

                func (p Point) Shift(dx int) Point {
                	p.X = p.X + dx
                	fmt.Println(p.X, dx)
                	return p
                }
                """);

        var seen = new HashSet<String>();
        for (var record : records) {
            assertTrue(seen.add(record.position().lineColumnKey()), "duplicate at " + record.position());
        }
        assertFalse(records.isEmpty());
    }
}
