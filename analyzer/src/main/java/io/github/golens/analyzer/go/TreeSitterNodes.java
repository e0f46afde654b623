package io.github.golens.analyzer.go;

import io.github.golens.analyzer.SourceContent;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers over tree-sitter nodes shared by the analysis passes. */
public final class TreeSitterNodes {

    private TreeSitterNodes() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Child stored under the given grammar field, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Named children, comments excluded. */
    public static List<TSNode> namedChildren(@Nullable TSNode node) {
        var result = new ArrayList<TSNode>();
        if (!isPresent(node)) {
            return result;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child) && !GoTreeSitterNodeTypes.COMMENT.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /** Named children of the given type. */
    public static List<TSNode> namedChildrenOfType(@Nullable TSNode node, String type) {
        return namedChildren(node).stream().filter(c -> type.equals(c.getType())).toList();
    }

    /** First child, named or anonymous, whose type is one of the given types. */
    public static @Nullable TSNode firstChildOfType(TSNode node, String... types) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!isPresent(child)) continue;
            for (var type : types) {
                if (type.equals(child.getType())) {
                    return child;
                }
            }
        }
        return null;
    }

    /** Whether any direct child, named or anonymous, has the given type. */
    public static boolean hasChildOfType(TSNode node, String type) {
        return firstChildOfType(node, type) != null;
    }

    /** Recursively finds all nodes matching the predicate, in document order. */
    public static List<TSNode> findAll(@Nullable TSNode root, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        collect(root, predicate, results);
        return results;
    }

    private static void collect(@Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }
        if (predicate.test(node)) {
            results.add(node);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collect(node.getChild(i), predicate, results);
        }
    }

    public static List<TSNode> findAllByType(@Nullable TSNode root, String nodeType) {
        return findAll(root, node -> nodeType.equals(node.getType()));
    }

    /** Statements of a block or case body, flattening the grammar's statement_list wrapper. */
    public static List<TSNode> statementsOf(@Nullable TSNode container) {
        var result = new ArrayList<TSNode>();
        for (var child : namedChildren(container)) {
            if (GoTreeSitterNodeTypes.STATEMENT_LIST.equals(child.getType())) {
                result.addAll(namedChildren(child));
            } else {
                result.add(child);
            }
        }
        return result;
    }

    /** Trimmed source text of a node, empty for a missing node. */
    public static String text(@Nullable TSNode node, SourceContent source) {
        return source.substringFrom(node).trim();
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
