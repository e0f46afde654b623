package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;
import static io.github.golens.analyzer.go.TreeSitterNodes.field;

import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.Position;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Second pass: records every call expression of a file as a {@link CallEdge} of the top-level function or method
 * that syntactically contains it. Calls in function literals belong to the declaration the literal appears in;
 * calls outside any declaration the first pass extracted, such as package-level initializers or methods skipped for
 * a malformed receiver, have no caller and are not recorded.
 */
public final class CallHierarchyBuilder {
    private static final Logger log = LogManager.getLogger(CallHierarchyBuilder.class);

    public List<CallEdge> build(ParsedGoFile file, FileAnalysisBuilder analysis) {
        var imports = new ImportTable(analysis.imports());
        var formatter = new NodeFormatter(file.source());
        var edges = new ArrayList<CallEdge>();
        var extracted = extractedFunctions(analysis);
        int dropped = 0;

        for (var node : TreeSitterNodes.namedChildren(file.root())) {
            var enclosing = enclosingDeclaration(node, file, extracted);
            var calls = TreeSitterNodes.findAllByType(node, CALL_EXPRESSION);
            if (enclosing == null) {
                dropped += calls.size();
                continue;
            }
            for (var call : calls) {
                edges.add(edgeFor(call, enclosing, file, formatter, imports));
            }
        }
        if (dropped > 0) {
            log.trace("{} calls outside any extracted function in {}", dropped, file.filePath());
        }
        log.debug("Recorded {} call edges in {}", edges.size(), file.filePath());
        return edges;
    }

    private record Enclosing(String qualifiedName, String name) {}

    /** Functions and methods of the first pass, keyed by the position of their name. */
    private static Map<Position, Enclosing> extractedFunctions(FileAnalysisBuilder analysis) {
        var byPosition = new HashMap<Position, Enclosing>();
        var functions = analysis.functions();
        var qualifiedNames = analysis.functionQualifiedNames();
        for (int i = 0; i < functions.size(); i++) {
            var function = functions.get(i);
            byPosition.put(function.position(), new Enclosing(qualifiedNames.get(i), function.name()));
        }
        return byPosition;
    }

    /** The extracted declaration a top-level node stands for; null for anything the first pass skipped. */
    private static @Nullable Enclosing enclosingDeclaration(
            TSNode node, ParsedGoFile file, Map<Position, Enclosing> extracted) {
        if (!METHOD_DECLARATION.equals(node.getType()) && !FUNCTION_DECLARATION.equals(node.getType())) {
            return null;
        }
        var nameNode = field(node, "name");
        if (nameNode == null) {
            return null;
        }
        return extracted.get(file.positions().positionOf(nameNode));
    }

    private static CallEdge edgeFor(
            TSNode call, Enclosing enclosing, ParsedGoFile file, NodeFormatter formatter, ImportTable imports) {
        var function = field(call, "function");
        String calleeName;
        String packageHint = null;
        String importPath = null;
        if (function != null && SELECTOR_EXPRESSION.equals(function.getType())) {
            var operand = field(function, "operand");
            var member = field(function, "field");
            var operandText = formatter.format(operand);
            calleeName = operandText + "." + file.text(member);
            if (operand != null && IDENTIFIER.equals(operand.getType()) && imports.isAlias(operandText)) {
                packageHint = operandText;
                importPath = imports.pathFor(operandText).orElse(null);
            }
        } else {
            calleeName = formatter.format(function);
        }

        var arguments = TreeSitterNodes.namedChildren(field(call, "arguments")).stream()
                .map(formatter::format)
                .toList();
        return new CallEdge(
                enclosing.qualifiedName(),
                enclosing.name(),
                file.filePath(),
                calleeName,
                packageHint,
                importPath,
                file.positions().positionOf(call),
                arguments);
    }
}
