package io.github.golens.analyzer.go;

import static org.junit.jupiter.api.Assertions.*;

import io.github.golens.analyzer.model.Position;
import io.github.golens.analyzer.model.Symbol;
import io.github.golens.analyzer.model.SymbolKind;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class SymbolTableTest {

    private static Symbol function(String name, String file, int line) {
        return Symbol.simple(name, SymbolKind.FUNCTION, "func()", null, new Position(file, line, 6), "");
    }

    @Test
    public void testLookupByQualifiedAndSimpleName() {
        var table = new SymbolTable();
        table.insert("main.Add", function("Add", "main.go", 3));
        table.insert("util.Add", function("Add", "util/util.go", 3));
        table.insert("main.Service.Add", function("Add", "main.go", 9));

        assertTrue(table.lookup("main.Add").isPresent());
        assertTrue(table.lookup("Add").isEmpty());
        assertEquals(
                List.of("main.Add", "main.Service.Add", "util.Add"),
                table.lookupBySimpleName("Add").stream().map(Map.Entry::getKey).toList());
        assertEquals(
                List.of("main.Service.Add"),
                table.lookupBySimpleName("Service.Add").stream().map(Map.Entry::getKey).toList());
        assertTrue(table.lookupBySimpleName("Missing").isEmpty());
    }

    @Test
    public void testLaterInsertReplacesEarlier() {
        var table = new SymbolTable();
        var first = function("Run", "a.go", 1);
        var second = function("Run", "b.go", 7);
        table.insert("main.Run", first);
        table.insert("main.Run", second);

        assertEquals(1, table.size());
        assertEquals(second, table.lookup("main.Run").orElseThrow());
        assertFalse(table.isDeclarationSite(first.position()));
        assertTrue(table.isDeclarationSite(second.position()));
    }

    @Test
    public void testParametersAreDeclarationSites() {
        var table = new SymbolTable();
        var parameter = Symbol.simple("amount", SymbolKind.PARAMETER, "int", null, new Position("a.go", 3, 12), "");
        var unnamed = Symbol.simple("", SymbolKind.PARAMETER, "int", null, new Position("a.go", 3, 30), "");
        var function = new Symbol("Pay", SymbolKind.FUNCTION, "func(amount int)", null, true,
                new Position("a.go", 3, 6), "", List.of(), List.of(), List.of(parameter, unnamed), List.of(),
                null, null, "", List.of());
        table.insert("main.Pay", function);

        assertTrue(table.isDeclarationSite(new Position("a.go", 3, 6)));
        assertTrue(table.isDeclarationSite(new Position("a.go", 3, 12)));
        assertFalse(table.isDeclarationSite(new Position("a.go", 3, 30)));
    }

    @Test
    public void testConcurrentInserts() throws InterruptedException {
        var table = new SymbolTable();
        var executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            int n = i;
            executor.submit(() -> table.insert("pkg.F" + n, function("F" + n, "f.go", n + 1)));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(200, table.size());
        assertEquals(1, table.lookupBySimpleName("F42").size());
    }
}
