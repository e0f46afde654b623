package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.FUNCTION_DECLARATION;
import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.METHOD_DECLARATION;
import static io.github.golens.analyzer.go.TreeSitterNodes.field;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Attaches the literal source and decomposed body to every function and method of a file. Each declaration is found
 * again by name and, for methods, by receiver type text.
 */
public final class CodeBlockExtractor {
    private static final Logger log = LogManager.getLogger(CodeBlockExtractor.class);

    private final StatementDecomposer decomposer;

    public CodeBlockExtractor(StatementDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    public void extract(ParsedGoFile file, FileAnalysisBuilder builder) {
        var formatter = new NodeFormatter(file.source());
        Map<String, Deque<TSNode>> declarations = new HashMap<>();
        for (var node : TreeSitterNodes.namedChildren(file.root())) {
            if (!FUNCTION_DECLARATION.equals(node.getType()) && !METHOD_DECLARATION.equals(node.getType())) {
                continue;
            }
            var name = field(node, "name");
            if (name == null) continue;
            var key = key(file.text(name), receiverText(node, formatter));
            declarations.computeIfAbsent(key, k -> new ArrayDeque<>()).add(node);
        }

        var functions = builder.functions();
        for (int i = 0; i < functions.size(); i++) {
            var symbol = functions.get(i);
            var candidates = declarations.get(key(symbol.name(), symbol.receiverText()));
            if (candidates == null || candidates.isEmpty()) {
                log.debug("No declaration node for {} in {}", symbol.name(), file.filePath());
                continue;
            }
            var node = candidates.poll();
            var code = file.source()
                    .sliceExact(file.positions().startOffset(node), file.positions().endOffset(node));
            var statements = decomposer.decomposeBody(file, field(node, "body"));
            builder.replaceFunction(i, symbol.withCodeBlock(code, statements));
        }
    }

    private static @Nullable String receiverText(TSNode declaration, NodeFormatter formatter) {
        if (!METHOD_DECLARATION.equals(declaration.getType())) {
            return null;
        }
        var receivers = TreeSitterNodes.namedChildren(field(declaration, "receiver"));
        return receivers.isEmpty() ? null : formatter.format(field(receivers.get(0), "type"));
    }

    private static String key(String name, @Nullable String receiverText) {
        return receiverText == null ? name : receiverText + "." + name;
    }
}
