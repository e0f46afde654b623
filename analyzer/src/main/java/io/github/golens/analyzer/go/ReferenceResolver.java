package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;
import static io.github.golens.analyzer.go.TreeSitterNodes.field;

import io.github.golens.analyzer.model.Position;
import io.github.golens.analyzer.model.RefType;
import io.github.golens.analyzer.model.ReferenceRecord;
import io.github.golens.analyzer.model.SymbolKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Third pass: classifies every name occurrence of a file as a declaration, usage or modification. Names that
 * resolve against the symbol table or an import are recorded under their qualified name, anything else under the
 * name as written. Each source position yields at most one record.
 */
public final class ReferenceResolver {
    private static final Logger log = LogManager.getLogger(ReferenceResolver.class);

    private static final Set<String> SKIPPED_SUBTREES = Set.of(PACKAGE_CLAUSE, IMPORT_DECLARATION, COMMENT, LABEL_NAME);
    private static final Set<String> DECLARING_FIELD_PARENTS =
            Set.of(METHOD_DECLARATION, FIELD_DECLARATION, METHOD_ELEM, METHOD_SPEC);

    public List<ReferenceRecord> resolve(ParsedGoFile file, FileAnalysisBuilder analysis, SymbolTable symbols) {
        var pass = new Pass(file, analysis, symbols);
        pass.collectAssignmentTargets();
        pass.collectLocalDeclarations();
        pass.visit(file.root());
        log.debug("Classified {} references in {}", pass.records.size(), file.filePath());
        return pass.records;
    }

    private static final class Pass {
        private final ParsedGoFile file;
        private final SymbolTable symbols;
        private final String packageName;
        private final ImportTable imports;
        private final NodeFormatter formatter;
        private final Map<Position, String> declaredHere = new HashMap<>();
        private final Set<String> assignmentTargets = new HashSet<>();
        private final Set<Position> localDeclarations = new HashSet<>();
        private final Set<String> seenPositions = new HashSet<>();
        private final List<ReferenceRecord> records = new ArrayList<>();

        Pass(ParsedGoFile file, FileAnalysisBuilder analysis, SymbolTable symbols) {
            this.file = file;
            this.symbols = symbols;
            this.packageName = analysis.packageName();
            this.imports = new ImportTable(analysis.imports());
            this.formatter = new NodeFormatter(file.source());
            analysis.stagedSymbols().forEach((qn, symbol) -> {
                declaredHere.put(symbol.position(), qn);
                // named struct fields and interface methods are declared as Type.Member
                for (var member : symbol.fields()) {
                    if (member.kind() == SymbolKind.FIELD || member.kind() == SymbolKind.METHOD) {
                        declaredHere.put(member.position(), QualifiedNames.of(qn, member.name()));
                    }
                }
            });
        }

        void collectAssignmentTargets() {
            var assignments = TreeSitterNodes.findAll(
                    file.root(),
                    n -> ASSIGNMENT_STATEMENT.equals(n.getType()) || SHORT_VAR_DECLARATION.equals(n.getType()));
            for (var assignment : assignments) {
                for (var target : TreeSitterNodes.namedChildren(field(assignment, "left"))) {
                    if (IDENTIFIER.equals(target.getType())) {
                        assignmentTargets.add(targetKey(file.text(target), file.positions().positionOf(target)));
                    } else if (SELECTOR_EXPRESSION.equals(target.getType())) {
                        var member = field(target, "field");
                        if (member != null) {
                            assignmentTargets.add(
                                    targetKey(formatter.format(target), file.positions().positionOf(member)));
                        }
                    }
                }
            }
        }

        /** Parameters, receivers, local var/const names and range variables declared with {@code :=}. */
        void collectLocalDeclarations() {
            var declaring = TreeSitterNodes.findAll(file.root(), n -> switch (n.getType()) {
                case PARAMETER_DECLARATION, VARIADIC_PARAMETER_DECLARATION, VAR_SPEC, CONST_SPEC -> true;
                default -> false;
            });
            for (var node : declaring) {
                TreeSitterNodes.namedChildrenOfType(node, IDENTIFIER)
                        .forEach(name -> localDeclarations.add(file.positions().positionOf(name)));
            }
            for (var range : TreeSitterNodes.findAllByType(file.root(), RANGE_CLAUSE)) {
                if (TreeSitterNodes.hasChildOfType(range, ":=")) {
                    TreeSitterNodes.namedChildren(field(range, "left"))
                            .forEach(name -> localDeclarations.add(file.positions().positionOf(name)));
                }
            }
        }

        void visit(TSNode node) {
            var type = node.getType();
            if (SKIPPED_SUBTREES.contains(type)) {
                return;
            }
            switch (type) {
                case CALL_EXPRESSION -> {
                    var function = field(node, "function");
                    if (function != null && IDENTIFIER.equals(function.getType())) {
                        recordName(function, true);
                    } else if (function != null && SELECTOR_EXPRESSION.equals(function.getType())) {
                        recordSelector(function, true);
                    }
                }
                case SELECTOR_EXPRESSION -> {
                    recordSelector(node, false);
                    var operand = field(node, "operand");
                    if (operand != null && !isImportOperand(operand)) {
                        visit(operand);
                    }
                    return;
                }
                case QUALIFIED_TYPE -> {
                    recordQualifiedType(node);
                    return;
                }
                case IDENTIFIER, TYPE_IDENTIFIER -> {
                    recordName(node, false);
                    return;
                }
                case FIELD_IDENTIFIER -> {
                    var parent = node.getParent();
                    if (TreeSitterNodes.isPresent(parent) && DECLARING_FIELD_PARENTS.contains(parent.getType())) {
                        recordName(node, false);
                    }
                    return;
                }
                default -> {}
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                var child = node.getChild(i);
                if (TreeSitterNodes.isPresent(child)) {
                    visit(child);
                }
            }
        }

        private void recordName(TSNode node, boolean callee) {
            var name = file.text(node);
            if (name.length() <= 1 || GoBuiltins.isReserved(name)) {
                return;
            }
            var position = file.positions().positionOf(node);
            var qualified = Optional.ofNullable(declaredHere.get(position)).or(() -> resolveSimpleName(name));
            RefType refType;
            if (callee) {
                refType = RefType.USAGE;
            } else if (declaredHere.containsKey(position)
                    || symbols.isDeclarationSite(position)
                    || localDeclarations.contains(position)) {
                refType = RefType.DECLARATION;
            } else if (assignmentTargets.contains(targetKey(name, position))) {
                refType = RefType.MODIFICATION;
            } else {
                refType = RefType.USAGE;
            }
            add(new ReferenceRecord(qualified.orElse(name), refType, position, qualified.isPresent()));
        }

        private void recordSelector(TSNode selector, boolean callee) {
            var operand = field(selector, "operand");
            var member = field(selector, "field");
            if (operand == null || member == null) {
                return;
            }
            var position = file.positions().positionOf(member);
            var text = formatter.format(selector);
            var importPath = isImportOperand(operand) ? imports.pathFor(file.text(operand)) : Optional.<String>empty();
            var symbol = importPath.map(path -> path + "." + file.text(member)).orElse(text);
            var refType = !callee && assignmentTargets.contains(targetKey(text, position))
                    ? RefType.MODIFICATION
                    : RefType.USAGE;
            add(new ReferenceRecord(symbol, refType, position, importPath.isPresent()));
        }

        private void recordQualifiedType(TSNode qualifiedType) {
            var packageNode = field(qualifiedType, "package");
            var nameNode = field(qualifiedType, "name");
            if (packageNode == null || nameNode == null) {
                return;
            }
            var importPath = imports.pathFor(file.text(packageNode));
            var symbol = importPath
                    .map(path -> path + "." + file.text(nameNode))
                    .orElse(formatter.format(qualifiedType));
            add(new ReferenceRecord(
                    symbol, RefType.USAGE, file.positions().positionOf(nameNode), importPath.isPresent()));
        }

        private boolean isImportOperand(@Nullable TSNode operand) {
            return operand != null && IDENTIFIER.equals(operand.getType()) && imports.isAlias(file.text(operand));
        }

        /** Same-package declaration first, then any non-method declaration with that simple name. */
        private Optional<String> resolveSimpleName(String name) {
            var samePackage = QualifiedNames.of(packageName, name);
            if (symbols.lookup(samePackage).isPresent()) {
                return Optional.of(samePackage);
            }
            return symbols.lookupBySimpleName(name).stream()
                    .filter(e -> e.getValue().kind() != SymbolKind.METHOD)
                    .map(Map.Entry::getKey)
                    .findFirst();
        }

        private void add(ReferenceRecord record) {
            if (seenPositions.add(record.position().lineColumnKey())) {
                records.add(record);
            } else {
                log.trace("Skipping second reference at {}", record.position());
            }
        }

        private static String targetKey(String name, Position position) {
            return name + "_" + position.file() + "_" + position.lineColumnKey();
        }
    }
}
