package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;
import static io.github.golens.analyzer.go.TreeSitterNodes.field;
import static io.github.golens.analyzer.go.TreeSitterNodes.namedChildren;
import static io.github.golens.analyzer.go.TreeSitterNodes.namedChildrenOfType;

import io.github.golens.analyzer.model.FileDependency;
import io.github.golens.analyzer.model.Symbol;
import io.github.golens.analyzer.model.SymbolKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * First pass: collects the package name and every top-level declaration of a file, and stages them under their
 * qualified names. Declarations that cannot be understood are skipped with a warning.
 */
public final class DeclarationExtractor {
    private static final Logger log = LogManager.getLogger(DeclarationExtractor.class);

    static final String INFERRED_TYPE = "inferred";

    public FileAnalysisBuilder extract(ParsedGoFile file) {
        var builder = new FileAnalysisBuilder(file.filePath());
        var pass = new Pass(file, builder);
        pass.run();
        log.debug(
                "Extracted {} declarations from {} (package {})",
                builder.stagedSymbols().size(),
                file.filePath(),
                builder.packageName());
        return builder;
    }

    private static final class Pass {
        private final ParsedGoFile file;
        private final FileAnalysisBuilder builder;
        private final NodeFormatter formatter;

        Pass(ParsedGoFile file, FileAnalysisBuilder builder) {
            this.file = file;
            this.builder = builder;
            this.formatter = new NodeFormatter(file.source());
        }

        void run() {
            var topLevel = namedChildren(file.root());
            // package name first, so qualified names are right regardless of declaration order
            topLevel.stream()
                    .filter(n -> PACKAGE_CLAUSE.equals(n.getType()))
                    .findFirst()
                    .ifPresentOrElse(
                            clause -> builder.setPackageName(file.text(clause.getNamedChild(0))),
                            () -> builder.warn("missing package clause"));

            for (var node : topLevel) {
                switch (node.getType()) {
                    case PACKAGE_CLAUSE -> {}
                    case IMPORT_DECLARATION -> extractImports(node);
                    case CONST_DECLARATION -> extractValues(node, CONST_SPEC, SymbolKind.CONSTANT);
                    case VAR_DECLARATION -> extractValues(node, VAR_SPEC, SymbolKind.VARIABLE);
                    case TYPE_DECLARATION -> extractTypes(node);
                    case FUNCTION_DECLARATION, METHOD_DECLARATION -> extractFunction(node);
                    case ERROR -> builder.warn("unparseable region at " + file.positions().positionOf(node));
                    default -> log.trace("Ignoring top-level {} in {}", node.getType(), file.filePath());
                }
            }
            if (file.root().hasError() && builder.warnings.isEmpty()) {
                builder.warn("syntax errors; some declarations may be incomplete");
            }
        }

        private void extractImports(TSNode declaration) {
            for (var spec : specs(declaration, Set.of(IMPORT_SPEC))) {
                var pathNode = field(spec, "path");
                if (pathNode == null) {
                    builder.warn("import without a path at " + file.positions().positionOf(spec));
                    continue;
                }
                var path = unquote(file.text(pathNode));
                var aliasNode = field(spec, "name");
                var alias = aliasNode != null ? file.text(aliasNode) : QualifiedNames.lastPathSegment(path);
                var doc = docOf(spec, declaration);
                builder.imports.add(
                        Symbol.simple(alias, SymbolKind.IMPORT, "", path, file.positions().positionOf(spec), doc));
                builder.dependencies.add(FileDependency.of(path, alias));
            }
        }

        private void extractValues(TSNode declaration, String specType, SymbolKind kind) {
            var target = kind == SymbolKind.CONSTANT ? builder.constants : builder.variables;
            for (var spec : specs(declaration, Set.of(specType))) {
                var names = namedChildrenOfType(spec, IDENTIFIER);
                if (names.isEmpty()) {
                    builder.warn("%s without names at %s".formatted(specType, file.positions().positionOf(spec)));
                    continue;
                }
                var typeNode = field(spec, "type");
                var values = namedChildren(field(spec, "value"));
                var doc = docOf(spec, declaration);
                for (int i = 0; i < names.size(); i++) {
                    var nameNode = names.get(i);
                    var name = file.text(nameNode);
                    String declaredType;
                    if (typeNode != null) {
                        declaredType = formatter.format(typeNode);
                    } else {
                        declaredType = i < values.size() ? INFERRED_TYPE : "";
                    }
                    var value = i < values.size() ? formatter.format(values.get(i)) : null;
                    var symbol = Symbol.simple(
                            name, kind, declaredType, value, file.positions().positionOf(nameNode), doc);
                    target.add(symbol);
                    if (!"_".equals(name)) {
                        builder.stage(QualifiedNames.of(builder.packageName(), name), symbol);
                    }
                }
            }
        }

        private void extractTypes(TSNode declaration) {
            for (var spec : specs(declaration, Set.of(TYPE_SPEC, TYPE_ALIAS))) {
                var nameNode = field(spec, "name");
                var typeNode = field(spec, "type");
                if (nameNode == null || typeNode == null) {
                    builder.warn("incomplete type declaration at " + file.positions().positionOf(spec));
                    continue;
                }
                var name = file.text(nameNode);
                var position = file.positions().positionOf(nameNode);
                var doc = docOf(spec, declaration);
                boolean alias = TYPE_ALIAS.equals(spec.getType());

                Symbol symbol;
                if (!alias && STRUCT_TYPE.equals(typeNode.getType())) {
                    symbol = new Symbol(name, SymbolKind.STRUCT, formatter.format(typeNode), null,
                            Symbol.isExportedName(name), position, doc, structFields(typeNode), List.of(),
                            List.of(), List.of(), null, null, "", List.of());
                    builder.structs.add(symbol);
                } else if (!alias && INTERFACE_TYPE.equals(typeNode.getType())) {
                    var methods = new ArrayList<Symbol>();
                    var methodNames = new ArrayList<String>();
                    interfaceElements(typeNode, methods, methodNames);
                    symbol = new Symbol(name, SymbolKind.INTERFACE, formatter.format(typeNode), null,
                            Symbol.isExportedName(name), position, doc, methods, methodNames,
                            List.of(), List.of(), null, null, "", List.of());
                    builder.interfaces.add(symbol);
                } else {
                    symbol = Symbol.simple(name, SymbolKind.TYPE, formatter.format(typeNode), null, position, doc);
                    builder.types.add(symbol);
                }
                builder.stage(QualifiedNames.of(builder.packageName(), name), symbol);
            }
        }

        private List<Symbol> structFields(TSNode structType) {
            var fields = new ArrayList<Symbol>();
            for (var list : namedChildrenOfType(structType, FIELD_DECLARATION_LIST)) {
                for (var declaration : namedChildrenOfType(list, FIELD_DECLARATION)) {
                    var typeNode = field(declaration, "type");
                    if (typeNode == null) {
                        builder.warn("field without a type at " + file.positions().positionOf(declaration));
                        continue;
                    }
                    var doc = DocComments.docFor(declaration, file.source());
                    var names = namedChildrenOfType(declaration, FIELD_IDENTIFIER);
                    if (names.isEmpty()) {
                        var pointer = TreeSitterNodes.hasChildOfType(declaration, "*") ? "*" : "";
                        var typeText = pointer + formatter.format(typeNode);
                        fields.add(Symbol.simple(
                                NodeFormatter.stripTypeName(typeText),
                                SymbolKind.EMBEDDED_FIELD,
                                typeText,
                                null,
                                file.positions().positionOf(declaration),
                                doc));
                        continue;
                    }
                    var typeText = formatter.format(typeNode);
                    for (var nameNode : names) {
                        fields.add(Symbol.simple(
                                file.text(nameNode),
                                SymbolKind.FIELD,
                                typeText,
                                null,
                                file.positions().positionOf(nameNode),
                                doc));
                    }
                }
            }
            return fields;
        }

        private void interfaceElements(TSNode interfaceType, List<Symbol> methods, List<String> methodNames) {
            for (var element : namedChildren(interfaceType)) {
                switch (element.getType()) {
                    case METHOD_ELEM, METHOD_SPEC -> {
                        var nameNode = field(element, "name");
                        if (nameNode == null) {
                            builder.warn("interface method without a name at "
                                    + file.positions().positionOf(element));
                            continue;
                        }
                        var name = file.text(nameNode);
                        methodNames.add(name);
                        methods.add(callable(element, nameNode, SymbolKind.METHOD, null, null));
                    }
                    case TYPE_ELEM, CONSTRAINT_ELEM, INTERFACE_TYPE_NAME, TYPE_IDENTIFIER, QUALIFIED_TYPE ->
                        methodNames.add(formatter.format(element));
                    default -> log.trace("Ignoring interface element {}", element.getType());
                }
            }
        }

        private void extractFunction(TSNode declaration) {
            var nameNode = field(declaration, "name");
            if (nameNode == null) {
                builder.warn("function without a name at " + file.positions().positionOf(declaration));
                return;
            }
            var name = file.text(nameNode);
            if (name.isEmpty()) {
                builder.warn("function without a name at " + file.positions().positionOf(declaration));
                return;
            }
            if (METHOD_DECLARATION.equals(declaration.getType())) {
                var receiverText = receiverTypeText(declaration);
                if (receiverText == null) {
                    builder.warn("method %s without a receiver type at %s"
                            .formatted(name, file.positions().positionOf(declaration)));
                    return;
                }
                var receiverType = NodeFormatter.stripTypeName(receiverText);
                var symbol = callable(declaration, nameNode, SymbolKind.METHOD, receiverType, receiverText);
                builder.addFunction(QualifiedNames.of(builder.packageName(), receiverType, name), symbol);
            } else {
                var symbol = callable(declaration, nameNode, SymbolKind.FUNCTION, null, null);
                builder.addFunction(QualifiedNames.of(builder.packageName(), name), symbol);
            }
        }

        private @Nullable String receiverTypeText(TSNode method) {
            var receivers = namedChildren(field(method, "receiver"));
            if (receivers.isEmpty()) {
                return null;
            }
            var typeNode = field(receivers.get(0), "type");
            return typeNode == null ? null : formatter.format(typeNode);
        }

        /** Function, method or interface method signature. */
        private Symbol callable(
                TSNode node,
                TSNode nameNode,
                SymbolKind kind,
                @Nullable String receiverType,
                @Nullable String receiverText) {
            var name = file.text(nameNode);
            var parameterList = field(node, "parameters");
            var parameters = parameters(parameterList, SymbolKind.PARAMETER);
            var resultNode = field(node, "result");
            List<Symbol> results;
            if (resultNode == null) {
                results = List.of();
            } else if (PARAMETER_LIST.equals(resultNode.getType())) {
                results = parameters(resultNode, SymbolKind.RESULT);
            } else {
                results = List.of(Symbol.simple(
                        "", SymbolKind.RESULT, formatter.format(resultNode), null,
                        file.positions().positionOf(resultNode), ""));
            }

            var signature = "func" + NodeFormatter.collapse(file.text(parameterList));
            if (resultNode != null) {
                signature += " " + NodeFormatter.collapse(file.text(resultNode));
            }
            var doc = DocComments.docFor(node, file.source());
            return new Symbol(name, kind, signature, null, Symbol.isExportedName(name),
                    file.positions().positionOf(nameNode), doc, List.of(), List.of(), parameters, results,
                    receiverType, receiverText, "", List.of());
        }

        private List<Symbol> parameters(@Nullable TSNode parameterList, SymbolKind kind) {
            var result = new ArrayList<Symbol>();
            for (var declaration : namedChildren(parameterList)) {
                boolean variadic = VARIADIC_PARAMETER_DECLARATION.equals(declaration.getType());
                if (!variadic && !PARAMETER_DECLARATION.equals(declaration.getType())) {
                    continue;
                }
                var typeText = formatter.format(field(declaration, "type"));
                if (variadic) {
                    typeText = "..." + typeText;
                }
                var names = namedChildrenOfType(declaration, IDENTIFIER);
                if (names.isEmpty()) {
                    result.add(Symbol.simple(
                            "", kind, typeText, null, file.positions().positionOf(declaration), ""));
                    continue;
                }
                for (var nameNode : names) {
                    result.add(Symbol.simple(
                            file.text(nameNode), kind, typeText, null, file.positions().positionOf(nameNode), ""));
                }
            }
            return result;
        }

        /** Specs of a declaration, whether it declares one spec or a parenthesized group. */
        private List<TSNode> specs(TSNode declaration, Set<String> specTypes) {
            var result = new ArrayList<TSNode>();
            for (var child : namedChildren(declaration)) {
                var type = child.getType();
                if (specTypes.contains(type)) {
                    result.add(child);
                } else if (IMPORT_SPEC_LIST.equals(type) || VAR_SPEC_LIST.equals(type)) {
                    namedChildren(child).stream()
                            .filter(spec -> specTypes.contains(spec.getType()))
                            .forEach(result::add);
                }
            }
            return result;
        }

        private String docOf(TSNode spec, TSNode declaration) {
            var doc = DocComments.docFor(spec, file.source());
            return doc.isEmpty() ? DocComments.docFor(declaration, file.source()) : doc;
        }

        private static String unquote(String literal) {
            if (literal.length() >= 2) {
                char first = literal.charAt(0);
                char last = literal.charAt(literal.length() - 1);
                if ((first == '"' || first == '`') && first == last) {
                    return literal.substring(1, literal.length() - 1);
                }
            }
            return literal;
        }
    }
}
