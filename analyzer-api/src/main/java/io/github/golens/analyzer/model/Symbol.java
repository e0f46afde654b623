package io.github.golens.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A single declaration discovered in a Go file. Symbols are immutable; attaching a code block produces a new
 * instance via {@link #withCodeBlock(String, List)}.
 *
 * @param name simple name; empty for unnamed parameters and results
 * @param kind declaration kind
 * @param declaredType type text as written, {@code "inferred"} for untyped initialized constants and variables
 * @param literalValue initializer text for constants and variables, import path for imports
 * @param exported true when the name starts with an upper-case letter
 * @param position where the declared name appears
 * @param docComment doc comment text without comment markers, empty when absent
 * @param fields struct fields, or the method signatures of an interface
 * @param methodNames interface method names and embedded interface types
 * @param parameters function, method and interface-method parameters
 * @param results function, method and interface-method results
 * @param receiverType receiver type name with pointer marker and type arguments removed, methods only
 * @param receiverText receiver type as written, methods only
 * @param codeBlock literal source of a function or method declaration
 * @param statements decomposed body statements of a function or method
 */
public record Symbol(
        String name,
        SymbolKind kind,
        String declaredType,
        @Nullable String literalValue,
        boolean exported,
        Position position,
        String docComment,
        List<Symbol> fields,
        List<String> methodNames,
        List<Symbol> parameters,
        List<Symbol> results,
        @Nullable String receiverType,
        @Nullable String receiverText,
        String codeBlock,
        List<StatementNode> statements) {

    public Symbol {
        fields = List.copyOf(fields);
        methodNames = List.copyOf(methodNames);
        parameters = List.copyOf(parameters);
        results = List.copyOf(results);
        statements = List.copyOf(statements);
    }

    /** Creates a leaf symbol (constant, variable, field, parameter, ...) with no children. */
    public static Symbol simple(
            String name,
            SymbolKind kind,
            String declaredType,
            @Nullable String literalValue,
            Position position,
            String docComment) {
        return new Symbol(
                name,
                kind,
                declaredType,
                literalValue,
                isExportedName(name),
                position,
                docComment,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                null,
                null,
                "",
                List.of());
    }

    public Symbol withCodeBlock(String code, List<StatementNode> bodyStatements) {
        return new Symbol(
                name,
                kind,
                declaredType,
                literalValue,
                exported,
                position,
                docComment,
                fields,
                methodNames,
                parameters,
                results,
                receiverType,
                receiverText,
                code,
                bodyStatements);
    }

    @JsonIgnore
    public boolean isMethod() {
        return kind == SymbolKind.METHOD;
    }

    /** Go visibility: a name is exported when its first character is an upper-case letter. */
    public static boolean isExportedName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.codePointAt(0));
    }
}
