package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.Position;
import io.github.golens.analyzer.model.Symbol;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Qualified name to declaration index shared by every file of an analysis. A later insert under the same qualified
 * name replaces the earlier declaration. Safe for concurrent use.
 */
public final class SymbolTable {
    private static final Logger log = LogManager.getLogger(SymbolTable.class);

    private final ConcurrentHashMap<String, Symbol> symbols = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> qualifiedNamesBySimpleName = new ConcurrentHashMap<>();
    private final Set<Position> declarationSites = ConcurrentHashMap.newKeySet();

    public void insert(String qualifiedName, Symbol symbol) {
        symbols.compute(qualifiedName, (qn, previous) -> {
            if (previous != null) {
                log.trace("{} redeclared at {}, replacing declaration at {}", qn, symbol.position(), previous.position());
                declarationSitesOf(previous).forEach(declarationSites::remove);
            }
            declarationSites.addAll(declarationSitesOf(symbol));
            return symbol;
        });
        qualifiedNamesBySimpleName
                .computeIfAbsent(QualifiedNames.simpleName(qualifiedName), k -> ConcurrentHashMap.newKeySet())
                .add(qualifiedName);
    }

    /** Commits the declarations of one file, in their declaration order. */
    public void insertAll(Map<String, Symbol> staged) {
        staged.forEach(this::insert);
    }

    public Optional<Symbol> lookup(String qualifiedName) {
        return Optional.ofNullable(symbols.get(qualifiedName));
    }

    /**
     * Entries whose qualified name equals {@code name} or ends with {@code .name}, ordered by qualified name.
     */
    public List<Map.Entry<String, Symbol>> lookupBySimpleName(String name) {
        var result = new ArrayList<Map.Entry<String, Symbol>>();
        var exact = symbols.get(name);
        if (exact != null) {
            result.add(Map.entry(name, exact));
        }
        var candidates = qualifiedNamesBySimpleName.getOrDefault(QualifiedNames.simpleName(name), Set.of());
        for (var qn : candidates) {
            if (qn.equals(name) || !qn.endsWith("." + name)) continue;
            var symbol = symbols.get(qn);
            if (symbol != null) {
                result.add(Map.entry(qn, symbol));
            }
        }
        result.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));
        return result;
    }

    /**
     * Whether a position is where a registered declaration, or one of its parameters, results or fields, names
     * itself.
     */
    public boolean isDeclarationSite(Position position) {
        return declarationSites.contains(position);
    }

    public int size() {
        return symbols.size();
    }

    /** Snapshot of all entries, ordered by qualified name. */
    public List<Map.Entry<String, Symbol>> entries() {
        var result = new ArrayList<>(symbols.entrySet());
        result.sort(Map.Entry.comparingByKey());
        return result.stream().map(e -> Map.entry(e.getKey(), e.getValue())).toList();
    }

    private static List<Position> declarationSitesOf(Symbol symbol) {
        var sites = new ArrayList<Position>();
        sites.add(symbol.position());
        Stream.of(symbol.parameters(), symbol.results(), symbol.fields())
                .flatMap(List::stream)
                .filter(child -> !child.name().isEmpty())
                .forEach(child -> sites.add(child.position()));
        return sites;
    }
}
