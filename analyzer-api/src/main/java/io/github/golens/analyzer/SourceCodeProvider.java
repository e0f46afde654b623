package io.github.golens.analyzer;

import java.util.Optional;

/** Implemented by analyzers that can readily provide source code snippets. */
public interface SourceCodeProvider {

    /**
     * Gets the literal source of a function or method declaration, by qualified name
     * ({@code pkg.Func} or {@code pkg.Receiver.Method}). Empty when unknown or when the declaration's offsets
     * could not be trusted.
     */
    Optional<String> getFunctionSource(String qualifiedName);
}
