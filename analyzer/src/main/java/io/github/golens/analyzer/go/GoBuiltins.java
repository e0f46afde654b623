package io.github.golens.analyzer.go;

import java.util.Set;

/** Go keywords, predeclared types and builtin functions. */
public final class GoBuiltins {

    public static final Set<String> KEYWORDS = Set.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for", "func",
            "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select", "struct",
            "switch", "type", "var");

    public static final Set<String> TYPES = Set.of(
            "any", "bool", "byte", "comparable", "complex64", "complex128", "error", "float32", "float64", "int",
            "int8", "int16", "int32", "int64", "rune", "string", "uint", "uint8", "uint16", "uint32", "uint64",
            "uintptr");

    public static final Set<String> FUNCTIONS = Set.of(
            "append", "cap", "clear", "close", "complex", "copy", "delete", "imag", "len", "make", "max", "min",
            "new", "panic", "print", "println", "real", "recover");

    public static final Set<String> CONSTANTS = Set.of("true", "false", "iota", "nil");

    private GoBuiltins() {}

    public static boolean isReserved(String name) {
        return KEYWORDS.contains(name) || TYPES.contains(name) || FUNCTIONS.contains(name) || CONSTANTS.contains(name);
    }

    public static boolean isBuiltinFunction(String name) {
        return FUNCTIONS.contains(name);
    }
}
