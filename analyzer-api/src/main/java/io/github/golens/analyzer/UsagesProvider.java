package io.github.golens.analyzer;

import io.github.golens.analyzer.model.ReferenceRecord;
import java.util.List;

/** Implemented by analyzers that can readily classify references to a symbol. */
public interface UsagesProvider {

    default List<ReferenceRecord> referencesOf(String qualifiedName) {
        throw new UnsupportedOperationException();
    }
}
