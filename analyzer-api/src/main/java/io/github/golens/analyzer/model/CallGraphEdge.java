package io.github.golens.analyzer.model;

import java.util.List;

/**
 * A caller-to-callee relation, aggregated over every call site between the two.
 *
 * @param line line of the first call site seen
 * @param argumentTexts arguments of the first call site seen
 * @param count number of call sites
 */
public record CallGraphEdge(String source, String target, int line, List<String> argumentTexts, int count) {

    public CallGraphEdge {
        argumentTexts = List.copyOf(argumentTexts);
    }

    public CallGraphEdge incremented() {
        return new CallGraphEdge(source, target, line, argumentTexts, count + 1);
    }
}
