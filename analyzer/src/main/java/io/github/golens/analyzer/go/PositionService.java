package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.Position;
import org.treesitter.TSNode;

/** Maps syntax nodes of one file to source positions and byte offsets. */
public interface PositionService {

    Position positionOf(TSNode node);

    int startOffset(TSNode node);

    int endOffset(TSNode node);
}
