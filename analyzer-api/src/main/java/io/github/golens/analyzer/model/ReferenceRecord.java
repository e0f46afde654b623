package io.github.golens.analyzer.model;

/**
 * A classified occurrence of a name.
 *
 * @param symbol qualified name when the occurrence resolved against the symbol table or an import, otherwise the
 *     raw name as written
 * @param refType declaration, usage or modification
 * @param position where the name occurs
 * @param resolved whether {@code symbol} is a resolved qualified name
 */
public record ReferenceRecord(String symbol, RefType refType, Position position, boolean resolved) {}
