package io.github.golens.analyzer;

import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.CallGraph;
import java.util.List;

/** Implemented by analyzers that can readily provide call hierarchy and call graph analysis. */
public interface CallGraphProvider {

    /**
     * Returns the calls made by the named function or method of the given file, in source order.
     *
     * @param file file path as passed to the analyzer
     * @param functionName simple name of the function or method
     */
    default List<CallEdge> callHierarchy(String file, String functionName) {
        throw new UnsupportedOperationException();
    }

    /** Assembles the repository call graph from every file analyzed so far. */
    default CallGraph buildCallGraph() {
        throw new UnsupportedOperationException();
    }
}
