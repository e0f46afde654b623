package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;

import io.github.golens.analyzer.SourceContent;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Renders types and expressions as compact single-line text. Composite type literals are abbreviated
 * ({@code struct{...}}, {@code interface{...}}, {@code func(...) ...}), everything else keeps its source text with
 * whitespace runs collapsed.
 */
public final class NodeFormatter {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SourceContent source;

    public NodeFormatter(SourceContent source) {
        this.source = source;
    }

    public String format(@Nullable TSNode node) {
        if (!TreeSitterNodes.isPresent(node)) {
            return "";
        }
        return switch (node.getType()) {
            case STRUCT_TYPE -> "struct{...}";
            case INTERFACE_TYPE -> "interface{...}";
            case FUNCTION_TYPE -> TreeSitterNodes.isPresent(node.getChildByFieldName("result"))
                    ? "func(...) ..."
                    : "func(...)";
            case FUNC_LITERAL -> "func(...) {...}";
            case POINTER_TYPE -> "*" + format(node.getNamedChild(0));
            default -> collapse(source.substringFrom(node));
        };
    }

    public static String collapse(String text) {
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    /** Removes the pointer marker, package qualifier and type arguments from a type name. */
    public static String stripTypeName(String typeText) {
        var name = typeText.trim();
        while (name.startsWith("*")) {
            name = name.substring(1).trim();
        }
        int bracket = name.indexOf('[');
        if (bracket > 0) {
            name = name.substring(0, bracket);
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
