package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.Symbol;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Import alias to import path mapping of one file. */
public final class ImportTable {
    private final Map<String, String> pathsByAlias = new LinkedHashMap<>();

    public ImportTable(List<Symbol> imports) {
        for (var imp : imports) {
            if (imp.literalValue() != null) {
                pathsByAlias.put(imp.name(), imp.literalValue());
            }
        }
    }

    public Optional<String> pathFor(String alias) {
        return Optional.ofNullable(pathsByAlias.get(alias));
    }

    public boolean isAlias(String name) {
        return pathsByAlias.containsKey(name);
    }
}
