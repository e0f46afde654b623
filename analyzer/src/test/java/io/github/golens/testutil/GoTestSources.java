package io.github.golens.testutil;

import io.github.golens.analyzer.AnalysisException;
import io.github.golens.analyzer.SourceContent;
import io.github.golens.analyzer.go.AnalysisContext;
import io.github.golens.analyzer.go.CodeBlockExtractor;
import io.github.golens.analyzer.go.DeclarationExtractor;
import io.github.golens.analyzer.go.FileAnalysisBuilder;
import io.github.golens.analyzer.go.GoParser;
import io.github.golens.analyzer.go.ParsedGoFile;
import io.github.golens.analyzer.go.StatementDecomposer;

/** Parses inline Go sources and runs the first pass over them, for tests of individual passes. */
public final class GoTestSources {
    private static final GoParser PARSER = new GoParser();

    private GoTestSources() {}

    public static ParsedGoFile parse(String path, String source) {
        try {
            return PARSER.parse(path, SourceContent.of(source));
        } catch (AnalysisException e) {
            throw new AssertionError("Test source did not parse", e);
        }
    }

    /** Declarations and code blocks of one file, committed to the context's symbol table. */
    public static FileAnalysisBuilder firstPass(ParsedGoFile file, AnalysisContext context) {
        var analysis = new DeclarationExtractor().extract(file);
        new CodeBlockExtractor(new StatementDecomposer()).extract(file, analysis);
        context.symbolTable().insertAll(analysis.stagedSymbols());
        return analysis;
    }
}
