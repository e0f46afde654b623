package io.github.golens.analyzer.go;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Iterables;
import org.jetbrains.annotations.Nullable;

/** Builds {@code package.[Receiver.]name} keys. */
public final class QualifiedNames {
    private static final Joiner DOT_JOINER = Joiner.on('.').skipNulls();
    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();

    private QualifiedNames() {}

    public static String of(String packageName, String name) {
        return DOT_JOINER.join(Strings.emptyToNull(packageName), name);
    }

    public static String of(String packageName, @Nullable String receiverType, String name) {
        return DOT_JOINER.join(Strings.emptyToNull(packageName), Strings.emptyToNull(receiverType), name);
    }

    /** Trailing segment of a qualified name. */
    public static String simpleName(String qualifiedName) {
        return Iterables.getLast(DOT_SPLITTER.split(qualifiedName));
    }

    /** Default alias of an import: the last segment of its path. */
    public static String lastPathSegment(String importPath) {
        return Iterables.getLast(PATH_SPLITTER.split(importPath), importPath);
    }
}
