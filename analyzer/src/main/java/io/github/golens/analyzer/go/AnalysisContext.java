package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.ReferenceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the passes of one analysis: the symbol table, the caller-keyed call index and the
 * symbol-keyed reference index. Registering a file's calls or references replaces whatever that file registered
 * before, so re-analysing unchanged input leaves the indices unchanged.
 */
public final class AnalysisContext {
    private final SymbolTable symbolTable = new SymbolTable();
    private final ConcurrentHashMap<String, List<CallEdge>> callIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<ReferenceRecord>> referenceIndex = new ConcurrentHashMap<>();

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public static String callKey(String file, String callerName) {
        return file + ":" + callerName;
    }

    public synchronized void registerCalls(String file, List<CallEdge> edges) {
        callIndex.keySet().removeIf(key -> key.startsWith(file + ":"));
        for (var edge : edges) {
            callIndex.merge(callKey(file, edge.callerName()), List.of(edge), AnalysisContext::append);
        }
    }

    public List<CallEdge> callsFrom(String file, String callerName) {
        return callIndex.getOrDefault(callKey(file, callerName), List.of());
    }

    public synchronized void registerReferences(String file, List<ReferenceRecord> records) {
        referenceIndex.replaceAll((symbol, existing) -> existing.stream()
                .filter(r -> !r.position().file().equals(file))
                .toList());
        referenceIndex.values().removeIf(List::isEmpty);
        for (var record : records) {
            referenceIndex.merge(record.symbol(), List.of(record), AnalysisContext::append);
        }
    }

    public List<ReferenceRecord> referencesOf(String symbol) {
        return referenceIndex.getOrDefault(symbol, List.of());
    }

    private static <T> List<T> append(List<T> existing, List<T> added) {
        var merged = new ArrayList<T>(existing.size() + added.size());
        merged.addAll(existing);
        merged.addAll(added);
        return List.copyOf(merged);
    }
}
