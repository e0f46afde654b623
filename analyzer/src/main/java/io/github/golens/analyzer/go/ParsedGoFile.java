package io.github.golens.analyzer.go;

import io.github.golens.analyzer.SourceContent;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A Go file with its syntax tree. Holds the tree so its nodes stay valid while passes run.
 *
 * @param filePath file identity used in every position
 */
public record ParsedGoFile(String filePath, SourceContent source, TSTree tree, PositionService positions) {

    public TSNode root() {
        return tree.getRootNode();
    }

    public String text(TSNode node) {
        return TreeSitterNodes.text(node, source);
    }
}
