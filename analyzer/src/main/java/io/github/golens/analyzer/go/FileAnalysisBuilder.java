package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.FileAnalysis;
import io.github.golens.analyzer.model.FileDependency;
import io.github.golens.analyzer.model.ReferenceRecord;
import io.github.golens.analyzer.model.Symbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mutable shell of a {@link FileAnalysis} while the passes run over a file. Declarations are staged here and
 * committed to the {@link SymbolTable} by the driver.
 */
public final class FileAnalysisBuilder {
    private static final Logger log = LogManager.getLogger(FileAnalysisBuilder.class);

    private final String filePath;
    private String packageName = "";

    final List<Symbol> imports = new ArrayList<>();
    final List<Symbol> constants = new ArrayList<>();
    final List<Symbol> variables = new ArrayList<>();
    final List<Symbol> types = new ArrayList<>();
    final List<Symbol> structs = new ArrayList<>();
    final List<Symbol> interfaces = new ArrayList<>();
    final List<Symbol> functions = new ArrayList<>();
    final List<String> functionQualifiedNames = new ArrayList<>();
    final List<FileDependency> dependencies = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    private final List<CallEdge> calls = new ArrayList<>();
    private final List<ReferenceRecord> references = new ArrayList<>();
    private final Map<String, Symbol> staged = new LinkedHashMap<>();

    public FileAnalysisBuilder(String filePath) {
        this.filePath = filePath;
    }

    public String filePath() {
        return filePath;
    }

    public String packageName() {
        return packageName;
    }

    void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    /** Stages a declaration for the symbol table; a later declaration with the same name replaces it. */
    void stage(String qualifiedName, Symbol symbol) {
        staged.put(qualifiedName, symbol);
    }

    void addFunction(String qualifiedName, Symbol symbol) {
        functions.add(symbol);
        functionQualifiedNames.add(qualifiedName);
        stage(qualifiedName, symbol);
    }

    void replaceFunction(int index, Symbol symbol) {
        var qualifiedName = functionQualifiedNames.get(index);
        var previous = functions.set(index, symbol);
        if (staged.get(qualifiedName) == previous) {
            staged.put(qualifiedName, symbol);
        }
    }

    void warn(String message) {
        log.warn("{}: {}", filePath, message);
        warnings.add(message);
    }

    public List<Symbol> imports() {
        return Collections.unmodifiableList(imports);
    }

    public List<Symbol> functions() {
        return Collections.unmodifiableList(functions);
    }

    public List<String> functionQualifiedNames() {
        return Collections.unmodifiableList(functionQualifiedNames);
    }

    public Map<String, Symbol> stagedSymbols() {
        return Collections.unmodifiableMap(staged);
    }

    public void setCalls(List<CallEdge> edges) {
        calls.clear();
        calls.addAll(edges);
    }

    public void setReferences(List<ReferenceRecord> records) {
        references.clear();
        references.addAll(records);
    }

    public FileAnalysis build() {
        return new FileAnalysis(
                filePath,
                packageName,
                imports,
                constants,
                variables,
                types,
                structs,
                interfaces,
                functions,
                calls,
                references,
                dependencies,
                warnings);
    }
}
