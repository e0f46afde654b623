package io.github.golens.analyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The kinds of declaration the analyzer records, with their wire names. */
public enum SymbolKind {
    IMPORT("import"),
    CONSTANT("constant"),
    VARIABLE("variable"),
    TYPE("type"),
    STRUCT("struct"),
    INTERFACE("interface"),
    FUNCTION("function"),
    METHOD("method"),
    FIELD("field"),
    EMBEDDED_FIELD("embedded field"),
    PARAMETER("parameter"),
    RESULT("result");

    private final String wireName;

    SymbolKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }

    @JsonCreator
    public static SymbolKind fromWireName(String wireName) {
        for (var kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown symbol kind: " + wireName);
    }
}
