package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.Position;
import org.treesitter.TSNode;

/** Tree-sitter rows and byte columns are 0-based; positions are reported 1-based. */
public final class TreeSitterPositions implements PositionService {
    private final String file;

    public TreeSitterPositions(String file) {
        this.file = file;
    }

    @Override
    public Position positionOf(TSNode node) {
        var point = node.getStartPoint();
        return new Position(file, point.getRow() + 1, point.getColumn() + 1);
    }

    @Override
    public int startOffset(TSNode node) {
        return node.getStartByte();
    }

    @Override
    public int endOffset(TSNode node) {
        return node.getEndByte();
    }
}
