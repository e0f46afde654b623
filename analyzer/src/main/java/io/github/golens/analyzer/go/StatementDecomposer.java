package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;
import static io.github.golens.analyzer.go.TreeSitterNodes.field;
import static io.github.golens.analyzer.go.TreeSitterNodes.namedChildren;

import io.github.golens.analyzer.model.StatementNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Turns function body statements into {@link StatementNode} trees: one root node per statement of the body, with
 * loop, branch and case bodies as children.
 */
public final class StatementDecomposer {

    public List<StatementNode> decomposeBody(ParsedGoFile file, @Nullable TSNode body) {
        var pass = new Pass(file);
        return TreeSitterNodes.statementsOf(body).stream().map(pass::decompose).toList();
    }

    public StatementNode decompose(ParsedGoFile file, TSNode statement) {
        return new Pass(file).decompose(statement);
    }

    private static final class Pass {
        private final ParsedGoFile file;
        private final NodeFormatter formatter;

        Pass(ParsedGoFile file) {
            this.file = file;
            this.formatter = new NodeFormatter(file.source());
        }

        StatementNode decompose(TSNode statement) {
            return switch (GoStatementType.of(statement.getType())) {
                case ASSIGNMENT -> assignment(statement, operatorOf(statement));
                case SHORT_VAR -> assignment(statement, ":=");
                case BLOCK -> node(statement, "block", "{...}").children(body(statement)).build();
                case BREAK -> branch(statement, "break");
                case CONTINUE -> branch(statement, "continue");
                case GOTO -> branch(statement, "goto");
                case FALLTHROUGH -> node(statement, "fallthrough", "fallthrough").build();
                case VAR -> declaration(statement, "variable_declaration", "var", VAR_SPEC);
                case CONST -> declaration(statement, "constant_declaration", "const", CONST_SPEC);
                case TYPE -> declaration(statement, "declaration", "type", TYPE_SPEC, TYPE_ALIAS);
                case EXPRESSION -> expression(statement);
                case INC -> incDec(statement, "++");
                case DEC -> incDec(statement, "--");
                case IF -> ifStatement(statement);
                case FOR -> forStatement(statement);
                case SWITCH -> switchStatement(statement);
                case TYPE_SWITCH -> typeSwitch(statement);
                case SELECT -> select(statement);
                case RETURN -> returnStatement(statement);
                case GO -> deferred(statement, "go");
                case DEFER -> deferred(statement, "defer");
                case LABELED -> labeled(statement);
                case SEND -> node(statement, "send", formatter.format(statement))
                        .callees(callsIn(statement))
                        .build();
                case OTHER -> node(statement, statement.getType(), formatter.format(statement)).build();
            };
        }

        private StatementNode assignment(TSNode statement, String operator) {
            var left = expressionTexts(field(statement, "left"));
            var right = expressionTexts(field(statement, "right"));
            var text = String.join(", ", left) + " " + operator + " " + String.join(", ", right);
            return node(statement, "assignment", text)
                    .variables(left)
                    .callees(callsIn(field(statement, "right")))
                    .build();
        }

        private String operatorOf(TSNode assignment) {
            var operator = field(assignment, "operator");
            if (operator != null) {
                return file.text(operator);
            }
            // the token between the two expression lists
            for (int i = 0; i < assignment.getChildCount(); i++) {
                var child = assignment.getChild(i);
                if (TreeSitterNodes.isPresent(child) && !EXPRESSION_LIST.equals(child.getType())
                        && !COMMENT.equals(child.getType())) {
                    return child.getType();
                }
            }
            return "=";
        }

        private StatementNode branch(TSNode statement, String keyword) {
            var label = TreeSitterNodes.firstChildOfType(statement, LABEL_NAME);
            var text = label == null ? keyword : keyword + " " + file.text(label);
            return node(statement, keyword, text).build();
        }

        private StatementNode declaration(TSNode statement, String kind, String keyword, String... specTypes) {
            var names = new ArrayList<String>();
            var callees = new ArrayList<String>();
            for (var spec : TreeSitterNodes.findAll(statement, n -> List.of(specTypes).contains(n.getType()))) {
                var nameNode = field(spec, "name");
                if (TYPE_SPEC.equals(spec.getType()) || TYPE_ALIAS.equals(spec.getType())) {
                    if (nameNode != null) names.add(file.text(nameNode));
                } else {
                    TreeSitterNodes.namedChildrenOfType(spec, IDENTIFIER).forEach(n -> names.add(file.text(n)));
                    callees.addAll(callsIn(field(spec, "value")));
                }
            }
            return node(statement, kind, keyword + " " + String.join(", ", names))
                    .variables(names)
                    .callees(callees)
                    .build();
        }

        private StatementNode expression(TSNode statement) {
            var expression = statement.getNamedChild(0);
            var text = formatter.format(expression);
            var kind = CALL_EXPRESSION.equals(expression.getType()) ? "function_call" : "expression";
            return node(statement, kind, text).callees(callsIn(expression)).build();
        }

        private StatementNode incDec(TSNode statement, String operator) {
            var target = formatter.format(statement.getNamedChild(0));
            return node(statement, "inc_dec", target + operator).variables(List.of(target)).build();
        }

        private StatementNode ifStatement(TSNode statement) {
            var initializer = field(statement, "initializer");
            var condition = field(statement, "condition");
            var builder = node(statement, "if_statement", "if ...")
                    .conditions(textsOf(condition))
                    .variables(assignedBy(initializer))
                    .callees(concat(callsIn(initializer), callsIn(condition)));
            var children = new ArrayList<StatementNode>();
            var consequence = field(statement, "consequence");
            if (consequence != null) {
                children.add(decompose(consequence));
            }
            var alternative = field(statement, "alternative");
            if (alternative != null) {
                var elseNode = decompose(alternative);
                children.add(new StatementNode("else_clause", elseNode.text(), elseNode.position(),
                        elseNode.conditions(), elseNode.touchedVariables(), elseNode.calleeNames(),
                        elseNode.children()));
            }
            return builder.children(children).build();
        }

        private StatementNode forStatement(TSNode statement) {
            var body = body(field(statement, "body"));
            var range = TreeSitterNodes.firstChildOfType(statement, RANGE_CLAUSE);
            if (range != null) {
                var right = field(range, "right");
                return node(statement, "range_loop", "for ... range ...")
                        .variables(expressionTexts(field(range, "left")))
                        .conditions(List.of("range " + formatter.format(right)))
                        .callees(callsIn(right))
                        .children(body)
                        .build();
            }

            var builder = node(statement, "for_loop", "for ...").children(body);
            var clause = TreeSitterNodes.firstChildOfType(statement, FOR_CLAUSE);
            if (clause != null) {
                var initializer = field(clause, "initializer");
                var condition = field(clause, "condition");
                return builder.conditions(textsOf(condition))
                        .variables(assignedBy(initializer))
                        .callees(concat(callsIn(initializer), callsIn(condition)))
                        .build();
            }
            var bodyNode = field(statement, "body");
            for (var child : namedChildren(statement)) {
                if (bodyNode == null || !TreeSitterNodes.sameNode(child, bodyNode)) {
                    builder.conditions(List.of(formatter.format(child))).callees(callsIn(child));
                }
            }
            return builder.build();
        }

        private StatementNode switchStatement(TSNode statement) {
            var initializer = field(statement, "initializer");
            var value = field(statement, "value");
            var cases = new ArrayList<StatementNode>();
            for (var child : namedChildren(statement)) {
                if (EXPRESSION_CASE.equals(child.getType()) || DEFAULT_CASE.equals(child.getType())) {
                    cases.add(caseClause(child, null));
                }
            }
            return node(statement, "switch", "switch ...")
                    .conditions(textsOf(value))
                    .variables(assignedBy(initializer))
                    .callees(concat(callsIn(initializer), callsIn(value)))
                    .children(cases)
                    .build();
        }

        private StatementNode typeSwitch(TSNode statement) {
            var value = field(statement, "value");
            var alias = field(statement, "alias");
            var cases = new ArrayList<StatementNode>();
            for (var child : namedChildren(statement)) {
                if (TYPE_CASE.equals(child.getType()) || DEFAULT_CASE.equals(child.getType())) {
                    cases.add(caseClause(child, null));
                }
            }
            return node(statement, "type_switch", "switch ....(type)")
                    .conditions(textsOf(value))
                    .variables(expressionTexts(alias))
                    .callees(callsIn(value))
                    .children(cases)
                    .build();
        }

        private StatementNode select(TSNode statement) {
            var cases = new ArrayList<StatementNode>();
            for (var child : namedChildren(statement)) {
                if (COMMUNICATION_CASE.equals(child.getType()) || DEFAULT_CASE.equals(child.getType())) {
                    cases.add(caseClause(child, field(child, "communication")));
                }
            }
            return node(statement, "select", "select").children(cases).build();
        }

        /** A case or default clause; {@code communication} is the select case's send or receive. */
        private StatementNode caseClause(TSNode clause, @Nullable TSNode communication) {
            if (DEFAULT_CASE.equals(clause.getType())) {
                return node(clause, "default", "default").children(body(clause)).build();
            }
            var values = new ArrayList<String>();
            var statements = new ArrayList<StatementNode>();
            for (var child : namedChildren(clause)) {
                if (communication != null && TreeSitterNodes.sameNode(child, communication)) {
                    values.add(formatter.format(child));
                } else if (STATEMENT_LIST.equals(child.getType())) {
                    TreeSitterNodes.statementsOf(child).forEach(s -> statements.add(decompose(s)));
                } else if (GoStatementType.isStatement(child.getType())) {
                    statements.add(decompose(child));
                } else {
                    values.addAll(expressionTexts(child));
                }
            }
            return node(clause, "case", "case " + String.join(", ", values))
                    .conditions(values)
                    .children(statements)
                    .build();
        }

        private StatementNode returnStatement(TSNode statement) {
            var results = new ArrayList<String>();
            var callees = new ArrayList<String>();
            for (var child : namedChildren(statement)) {
                results.addAll(expressionTexts(child));
                callees.addAll(callsIn(child));
            }
            var text = results.isEmpty() ? "return" : "return " + String.join(", ", results);
            return node(statement, "return", text).callees(callees).build();
        }

        private StatementNode deferred(TSNode statement, String keyword) {
            var expression = statement.getNamedChild(0);
            return node(statement, keyword, keyword + " " + formatter.format(expression))
                    .callees(callsIn(expression))
                    .build();
        }

        private StatementNode labeled(TSNode statement) {
            var label = field(statement, "label");
            var labelText = label == null ? "" : file.text(label);
            var inner = new ArrayList<StatementNode>();
            for (var child : namedChildren(statement)) {
                if (label == null || !TreeSitterNodes.sameNode(child, label)) {
                    inner.add(decompose(child));
                }
            }
            return node(statement, "labeled", labelText + ":").children(inner).build();
        }

        private List<StatementNode> body(@Nullable TSNode block) {
            return TreeSitterNodes.statementsOf(block).stream().map(this::decompose).toList();
        }

        /** Elements of an expression list, or the single expression itself. */
        private List<String> expressionTexts(@Nullable TSNode node) {
            if (!TreeSitterNodes.isPresent(node)) {
                return List.of();
            }
            if (EXPRESSION_LIST.equals(node.getType())) {
                return namedChildren(node).stream().map(formatter::format).toList();
            }
            return List.of(formatter.format(node));
        }

        private List<String> textsOf(@Nullable TSNode node) {
            return TreeSitterNodes.isPresent(node) ? List.of(formatter.format(node)) : List.of();
        }

        /** Variables written by a simple statement such as an if or for initializer. */
        private List<String> assignedBy(@Nullable TSNode simpleStatement) {
            if (!TreeSitterNodes.isPresent(simpleStatement)) {
                return List.of();
            }
            return switch (GoStatementType.of(simpleStatement.getType())) {
                case ASSIGNMENT, SHORT_VAR -> expressionTexts(field(simpleStatement, "left"));
                case INC, DEC -> List.of(formatter.format(simpleStatement.getNamedChild(0)));
                default -> List.of();
            };
        }

        /** Callee texts of every call inside a node, outermost first. */
        private List<String> callsIn(@Nullable TSNode node) {
            return TreeSitterNodes.findAllByType(node, CALL_EXPRESSION).stream()
                    .map(call -> formatter.format(field(call, "function")))
                    .toList();
        }

        private Builder node(TSNode statement, String kind, String text) {
            return new Builder(kind, text, statement);
        }

        private static List<String> concat(List<String> first, List<String> second) {
            var result = new ArrayList<>(first);
            result.addAll(second);
            return result;
        }

        private final class Builder {
            private final String kind;
            private final String text;
            private final TSNode statement;
            private List<String> conditions = List.of();
            private List<String> variables = List.of();
            private List<String> callees = List.of();
            private List<StatementNode> children = List.of();

            Builder(String kind, String text, TSNode statement) {
                this.kind = kind;
                this.text = text;
                this.statement = statement;
            }

            Builder conditions(List<String> values) {
                this.conditions = Objects.requireNonNull(values);
                return this;
            }

            Builder variables(List<String> values) {
                this.variables = Objects.requireNonNull(values);
                return this;
            }

            Builder callees(List<String> values) {
                this.callees = Objects.requireNonNull(values);
                return this;
            }

            Builder children(List<StatementNode> values) {
                this.children = Objects.requireNonNull(values);
                return this;
            }

            StatementNode build() {
                return new StatementNode(kind, text, file.positions().positionOf(statement), conditions, variables,
                        callees, children);
            }
        }
    }
}
