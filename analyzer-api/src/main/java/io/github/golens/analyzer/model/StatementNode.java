package io.github.golens.analyzer.model;

import java.util.List;

/**
 * Structural summary of one statement in a function body.
 *
 * @param kind statement kind such as {@code assignment} or {@code for_loop}; statements without a dedicated kind
 *     carry their raw syntax node type
 * @param text short textual form, e.g. {@code "count = compute()"} or {@code "for ..."}
 * @param position start of the statement
 * @param conditions condition and case expressions
 * @param touchedVariables variables assigned, declared or iterated by the statement
 * @param calleeNames callees of the calls the statement makes
 * @param children nested statements
 */
public record StatementNode(
        String kind,
        String text,
        Position position,
        List<String> conditions,
        List<String> touchedVariables,
        List<String> calleeNames,
        List<StatementNode> children) {

    public StatementNode {
        conditions = List.copyOf(conditions);
        touchedVariables = List.copyOf(touchedVariables);
        calleeNames = List.copyOf(calleeNames);
        children = List.copyOf(children);
    }

    /** Number of nodes in this subtree, including this one. */
    public int subtreeSize() {
        int size = 1;
        for (var child : children) {
            size += child.subtreeSize();
        }
        return size;
    }
}
