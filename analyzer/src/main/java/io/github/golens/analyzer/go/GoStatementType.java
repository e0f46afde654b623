package io.github.golens.analyzer.go;

import static io.github.golens.analyzer.go.GoTreeSitterNodeTypes.*;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Statement node types the decomposer understands. Anything else is {@link #OTHER}. */
public enum GoStatementType {
    ASSIGNMENT(ASSIGNMENT_STATEMENT),
    SHORT_VAR(SHORT_VAR_DECLARATION),
    BLOCK(GoTreeSitterNodeTypes.BLOCK),
    BREAK(BREAK_STATEMENT),
    CONTINUE(CONTINUE_STATEMENT),
    GOTO(GOTO_STATEMENT),
    FALLTHROUGH(FALLTHROUGH_STATEMENT),
    VAR(VAR_DECLARATION),
    CONST(CONST_DECLARATION),
    TYPE(TYPE_DECLARATION),
    EXPRESSION(EXPRESSION_STATEMENT),
    INC(INC_STATEMENT),
    DEC(DEC_STATEMENT),
    IF(IF_STATEMENT),
    FOR(FOR_STATEMENT),
    SWITCH(EXPRESSION_SWITCH_STATEMENT),
    TYPE_SWITCH(TYPE_SWITCH_STATEMENT),
    SELECT(SELECT_STATEMENT),
    RETURN(RETURN_STATEMENT),
    GO(GO_STATEMENT),
    DEFER(DEFER_STATEMENT),
    LABELED(LABELED_STATEMENT),
    SEND(SEND_STATEMENT),
    OTHER(null);

    private static final Map<String, GoStatementType> BY_NODE_TYPE = new HashMap<>();

    static {
        for (var type : values()) {
            if (type.nodeType != null) {
                BY_NODE_TYPE.put(type.nodeType, type);
            }
        }
    }

    private final @Nullable String nodeType;

    GoStatementType(@Nullable String nodeType) {
        this.nodeType = nodeType;
    }

    public static GoStatementType of(String nodeType) {
        return BY_NODE_TYPE.getOrDefault(nodeType, OTHER);
    }

    public static boolean isStatement(String nodeType) {
        return BY_NODE_TYPE.containsKey(nodeType);
    }
}
