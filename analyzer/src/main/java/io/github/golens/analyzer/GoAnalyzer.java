package io.github.golens.analyzer;

import io.github.golens.analyzer.AnalysisBatch.FileFailure;
import io.github.golens.analyzer.go.AnalysisContext;
import io.github.golens.analyzer.go.CallGraphAssembler;
import io.github.golens.analyzer.go.CallHierarchyBuilder;
import io.github.golens.analyzer.go.CodeBlockExtractor;
import io.github.golens.analyzer.go.DeclarationExtractor;
import io.github.golens.analyzer.go.FileAnalysisBuilder;
import io.github.golens.analyzer.go.GoParser;
import io.github.golens.analyzer.go.ParsedGoFile;
import io.github.golens.analyzer.go.ReferenceResolver;
import io.github.golens.analyzer.go.StatementDecomposer;
import io.github.golens.analyzer.go.SymbolTable;
import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.CallGraph;
import io.github.golens.analyzer.model.FileAnalysis;
import io.github.golens.analyzer.model.ReferenceRecord;
import io.github.golens.analyzer.model.Symbol;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Semantic analyzer for Go sources. Runs three passes over the files it is given:
 *
 * <ol>
 *   <li>declarations and code blocks, per file and in parallel, committed to the shared symbol table in file order
 *       once every file is done;</li>
 *   <li>call hierarchy;</li>
 *   <li>reference classification, which needs the complete symbol table.</li>
 * </ol>
 *
 * A file that cannot be read or parsed fails alone. Results accumulate across calls; analysing a file again replaces
 * what was known about it.
 */
public class GoAnalyzer implements IAnalyzer {
    private static final Logger log = LogManager.getLogger(GoAnalyzer.class);

    private final AnalyzerConfig config;
    private final GoParser parser = new GoParser();
    private final AnalysisContext context = new AnalysisContext();
    private final DeclarationExtractor declarationExtractor = new DeclarationExtractor();
    private final CodeBlockExtractor codeBlockExtractor = new CodeBlockExtractor(new StatementDecomposer());
    private final CallHierarchyBuilder callHierarchyBuilder = new CallHierarchyBuilder();
    private final ReferenceResolver referenceResolver = new ReferenceResolver();
    private final CallGraphAssembler callGraphAssembler = new CallGraphAssembler();
    private final Map<String, FileAnalysis> analyses = new ConcurrentHashMap<>();

    public GoAnalyzer() {
        this(AnalyzerConfig.fromEnvironment());
    }

    public GoAnalyzer(AnalyzerConfig config) {
        this.config = config;
    }

    private record Parsed(ParsedGoFile file, FileAnalysisBuilder analysis) {}

    /** Analyzes a single file against everything analyzed so far. */
    public FileAnalysis analyzeFile(ProjectFile file) throws AnalysisException {
        var batch = run(List.of(file), AnalyzerProgressCallback.NOOP);
        if (batch.hasFailures()) {
            throw batch.failures().get(0).error();
        }
        return batch.analyses().get(0);
    }

    public AnalysisBatch analyzeFiles(Collection<ProjectFile> files) {
        return analyzeFiles(files, AnalyzerProgressCallback.NOOP);
    }

    public AnalysisBatch analyzeFiles(Collection<ProjectFile> files, AnalyzerProgressCallback progress) {
        var selected = files.stream()
                .distinct()
                .filter(f -> config.includeTestFiles() || !f.isTestFile())
                .sorted()
                .toList();
        return run(selected, progress);
    }

    private AnalysisBatch run(List<ProjectFile> files, AnalyzerProgressCallback progress) {
        var failures = new ArrayList<FileFailure>();
        var results = new ArrayList<FileAnalysis>();
        if (files.isEmpty()) {
            return new AnalysisBatch(results, failures);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.analysisThreads(), files.size()));
        try {
            var parsedFiles = new LinkedHashMap<ProjectFile, Parsed>();
            var passOne = runAll(executor, files, this::extractDeclarations, "Extracting declarations", progress);
            passOne.forEach((file, outcome) -> {
                if (outcome.error() == null) {
                    parsedFiles.put(file, outcome.value());
                } else {
                    failures.add(new FileFailure(file.id(), outcome.error()));
                }
            });

            // passes two and three see every declaration of the batch
            var table = context.symbolTable();
            parsedFiles.values().forEach(p -> table.insertAll(p.analysis().stagedSymbols()));

            var passTwoAndThree = runAll(
                    executor,
                    List.copyOf(parsedFiles.keySet()),
                    file -> resolveCallsAndReferences(parsedFiles.get(file)),
                    "Resolving calls and references",
                    progress);
            passTwoAndThree.forEach((file, outcome) -> {
                var analysis = outcome.value();
                if (outcome.error() == null && analysis != null) {
                    context.registerCalls(analysis.filePath(), analysis.calls());
                    context.registerReferences(analysis.filePath(), analysis.references());
                    analyses.put(analysis.filePath(), analysis);
                    results.add(analysis);
                } else {
                    failures.add(new FileFailure(file.id(), outcome.error()));
                }
            });
        } finally {
            executor.shutdownNow();
        }

        failures.forEach(f -> log.error("Analysis of {} failed: {}", f.file(), f.reason(), f.error().getCause()));
        log.debug(
                "Analyzed {} files, {} failed; {} symbols known",
                results.size(),
                failures.size(),
                context.symbolTable().size());
        return new AnalysisBatch(results, failures);
    }

    @FunctionalInterface
    private interface FileTask<T> {
        T apply(ProjectFile file) throws AnalysisException;
    }

    /** Either the result of a per-file task or the exception the file failed with. */
    private record Outcome<T>(@Nullable T value, @Nullable AnalysisException error) {}

    /** Runs a task for every file on the executor and returns the outcomes in file order. */
    private <T> Map<ProjectFile, Outcome<T>> runAll(
            ExecutorService executor,
            List<ProjectFile> files,
            FileTask<T> task,
            String description,
            AnalyzerProgressCallback progress) {
        var completed = new AtomicInteger();
        var futures = new LinkedHashMap<ProjectFile, Future<T>>();
        for (var file : files) {
            Callable<T> callable = () -> {
                try {
                    return task.apply(file);
                } finally {
                    progress.onProgress(completed.incrementAndGet(), files.size(), description);
                }
            };
            futures.put(file, executor.submit(callable));
        }

        var outcomes = new LinkedHashMap<ProjectFile, Outcome<T>>();
        for (var entry : futures.entrySet()) {
            var file = entry.getKey();
            try {
                outcomes.put(file, new Outcome<>(entry.getValue().get(), null));
            } catch (ExecutionException e) {
                var cause = e.getCause();
                var error = cause instanceof AnalysisException ae
                        ? ae
                        : new AnalysisException(file.id(), "analysis failed: " + cause, cause);
                outcomes.put(file, new Outcome<>(null, error));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.put(file, new Outcome<>(null, new AnalysisException(file.id(), "interrupted", e)));
            }
        }
        return outcomes;
    }

    private Parsed extractDeclarations(ProjectFile file) throws AnalysisException {
        String text;
        try {
            text = file.read();
        } catch (IOException e) {
            throw new AnalysisException(file.id(), "cannot read file", e);
        }
        var parsed = parser.parse(file.id(), SourceContent.of(text));
        var analysis = declarationExtractor.extract(parsed);
        codeBlockExtractor.extract(parsed, analysis);
        return new Parsed(parsed, analysis);
    }

    private FileAnalysis resolveCallsAndReferences(Parsed parsed) {
        var analysis = parsed.analysis();
        analysis.setCalls(callHierarchyBuilder.build(parsed.file(), analysis));
        analysis.setReferences(referenceResolver.resolve(parsed.file(), analysis, context.symbolTable()));
        return analysis.build();
    }

    public Optional<FileAnalysis> getAnalysis(String file) {
        return Optional.ofNullable(analyses.get(file));
    }

    public SymbolTable symbolTable() {
        return context.symbolTable();
    }

    @Override
    public List<CallEdge> callHierarchy(String file, String functionName) {
        return context.callsFrom(file, functionName);
    }

    @Override
    public CallGraph buildCallGraph() {
        return callGraphAssembler.assemble(analyses.values());
    }

    @Override
    public List<ReferenceRecord> referencesOf(String qualifiedName) {
        return context.referencesOf(qualifiedName);
    }

    @Override
    public Optional<Symbol> lookupSymbol(String qualifiedName) {
        return context.symbolTable().lookup(qualifiedName);
    }

    @Override
    public Optional<String> getFunctionSource(String qualifiedName) {
        return lookupSymbol(qualifiedName)
                .filter(s -> s.kind().isCallable())
                .map(Symbol::codeBlock)
                .filter(code -> !code.isEmpty());
    }

    @Override
    public List<Symbol> getAllDeclarations() {
        return context.symbolTable().entries().stream().map(Map.Entry::getValue).toList();
    }

    @Override
    public List<Symbol> getDeclarationsInFile(String file) {
        return getAnalysis(file).map(FileAnalysis::declarations).orElse(List.of());
    }
}
