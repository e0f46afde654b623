package io.github.golens.analyzer;

import io.github.golens.analyzer.model.Symbol;
import java.util.List;
import java.util.Optional;

public interface IAnalyzer extends CallGraphProvider, UsagesProvider, SourceCodeProvider {

    default boolean isEmpty() {
        return getAllDeclarations().isEmpty();
    }

    /**
     * Finds the declaration registered under the exact, case-sensitive qualified name. When several files declare
     * the same qualified name the most recently committed declaration wins.
     */
    default Optional<Symbol> lookupSymbol(String qualifiedName) {
        throw new UnsupportedOperationException();
    }

    default List<Symbol> getAllDeclarations() {
        throw new UnsupportedOperationException();
    }

    /** Gets all top-level declarations of a given file. */
    default List<Symbol> getDeclarationsInFile(String file) {
        throw new UnsupportedOperationException();
    }
}
