package io.github.golens.analyzer.model;

import org.jetbrains.annotations.Nullable;

/**
 * A function or method in the repository call graph.
 *
 * @param id qualified name, unique within a graph
 * @param receiver receiver type for methods, operand text for unresolved method calls
 * @param filePath declaring file; null for external nodes
 * @param line declaration line; 0 for external nodes
 * @param external true when synthesized for a callee with no declaration in the analyzed files
 */
public record CallGraphNode(
        String id,
        String packageName,
        String name,
        @Nullable String receiver,
        @Nullable String filePath,
        int line,
        boolean external) {}
