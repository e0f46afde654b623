package io.github.golens.analyzer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Everything the analyzer learned about one Go file. Produced once per analysis run and not mutated afterwards.
 *
 * @param warnings declarations that were skipped because they could not be understood
 */
public record FileAnalysis(
        String filePath,
        String packageName,
        List<Symbol> imports,
        List<Symbol> constants,
        List<Symbol> variables,
        List<Symbol> types,
        List<Symbol> structs,
        List<Symbol> interfaces,
        List<Symbol> functions,
        List<CallEdge> calls,
        List<ReferenceRecord> references,
        List<FileDependency> dependencies,
        List<String> warnings) {

    public FileAnalysis {
        imports = List.copyOf(imports);
        constants = List.copyOf(constants);
        variables = List.copyOf(variables);
        types = List.copyOf(types);
        structs = List.copyOf(structs);
        interfaces = List.copyOf(interfaces);
        functions = List.copyOf(functions);
        calls = List.copyOf(calls);
        references = List.copyOf(references);
        dependencies = List.copyOf(dependencies);
        warnings = List.copyOf(warnings);
    }

    /** All top-level declarations, in category order. */
    public List<Symbol> declarations() {
        var all = new ArrayList<Symbol>();
        Stream.of(imports, constants, variables, types, structs, interfaces, functions)
                .forEach(all::addAll);
        return all;
    }
}
