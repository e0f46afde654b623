package io.github.golens.analyzer.go;

import io.github.golens.analyzer.AnalysisException;
import io.github.golens.analyzer.SourceContent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterGo;

/** Produces tree-sitter syntax trees for Go source text. Safe to share between threads. */
public final class GoParser {
    private static final Logger log = LogManager.getLogger(GoParser.class);

    // TSParser instances are not thread-safe
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterGo());
        return parser;
    });

    public ParsedGoFile parse(String filePath, SourceContent source) throws AnalysisException {
        var tree = PARSER.get().parseString(null, source.text());
        if (tree == null || !TreeSitterNodes.isPresent(tree.getRootNode())) {
            throw new AnalysisException(filePath, "parser produced no syntax tree");
        }
        var root = tree.getRootNode();
        if (!GoTreeSitterNodeTypes.SOURCE_FILE.equals(root.getType())) {
            throw new AnalysisException(filePath, "unexpected root node " + root.getType());
        }
        if (root.hasError()) {
            log.debug("Syntax errors in {}; analysing the recoverable parts", filePath);
        }
        return new ParsedGoFile(filePath, source, tree, new TreeSitterPositions(filePath));
    }
}
