package io.github.golens.analyzer.model;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One call expression attributed to its enclosing function or method.
 *
 * @param callerQualifiedName qualified name of the enclosing declaration, e.g. {@code main.Service.Run}
 * @param callerName simple name of the enclosing declaration
 * @param file file containing the call
 * @param calleeName callee as written: {@code Add}, {@code fmt.Println}, or the callee expression text
 * @param calleePackageHint import alias qualifying the callee, when the selector operand is one
 * @param calleeImportPath import path behind {@code calleePackageHint}
 * @param position position of the call expression
 * @param argumentTexts argument expressions in order
 */
public record CallEdge(
        String callerQualifiedName,
        String callerName,
        String file,
        String calleeName,
        @Nullable String calleePackageHint,
        @Nullable String calleeImportPath,
        Position position,
        List<String> argumentTexts) {

    public CallEdge {
        argumentTexts = List.copyOf(argumentTexts);
    }

    /** The callee name without its package or receiver qualifier. */
    public String calleeMemberName() {
        int dot = calleeName.lastIndexOf('.');
        return dot < 0 ? calleeName : calleeName.substring(dot + 1);
    }
}
