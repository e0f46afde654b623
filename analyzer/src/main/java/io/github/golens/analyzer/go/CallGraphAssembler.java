package io.github.golens.analyzer.go;

import io.github.golens.analyzer.model.CallEdge;
import io.github.golens.analyzer.model.CallGraph;
import io.github.golens.analyzer.model.CallGraphEdge;
import io.github.golens.analyzer.model.CallGraphNode;
import io.github.golens.analyzer.model.FileAnalysis;
import io.github.golens.analyzer.model.Symbol;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Merges the call edges of every analyzed file into one graph. Each function and method is a node; callees with no
 * declaration among the files become external nodes, created once. Repeated calls between the same pair collapse
 * into one edge with a count.
 */
public final class CallGraphAssembler {
    private static final Logger log = LogManager.getLogger(CallGraphAssembler.class);

    static final String BUILTIN_PACKAGE = "builtin";
    private static final Pattern SELECTOR_CALLEE = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}_][\\p{L}\\p{N}_]*)+");

    public CallGraph assemble(Collection<FileAnalysis> analyses) {
        var ordered = analyses.stream().sorted(Comparator.comparing(FileAnalysis::filePath)).toList();
        var nodes = new LinkedHashMap<String, CallGraphNode>();
        for (var analysis : ordered) {
            for (var function : analysis.functions()) {
                var id = qualifiedName(analysis.packageName(), function);
                nodes.put(id, new CallGraphNode(
                        id,
                        analysis.packageName(),
                        function.name(),
                        function.receiverType(),
                        analysis.filePath(),
                        function.position().line(),
                        false));
            }
        }
        int declared = nodes.size();

        var edges = new LinkedHashMap<String, CallGraphEdge>();
        for (var analysis : ordered) {
            for (var call : analysis.calls()) {
                var target = resolveTarget(call, analysis.packageName(), nodes);
                edges.merge(
                        call.callerQualifiedName() + "->" + target,
                        new CallGraphEdge(
                                call.callerQualifiedName(), target, call.position().line(), call.argumentTexts(), 1),
                        (existing, added) -> existing.incremented());
            }
        }
        log.debug(
                "Call graph: {} declared nodes, {} external nodes, {} edges",
                declared,
                nodes.size() - declared,
                edges.size());
        return new CallGraph(new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()));
    }

    private static String qualifiedName(String packageName, Symbol function) {
        return function.isMethod()
                ? QualifiedNames.of(packageName, function.receiverType(), function.name())
                : QualifiedNames.of(packageName, function.name());
    }

    /** Target node id for a call, adding an external node when the callee is not declared. */
    private static String resolveTarget(CallEdge call, String callerPackage, Map<String, CallGraphNode> nodes) {
        var callee = call.calleeName();
        var member = call.calleeMemberName();
        if (call.calleePackageHint() != null) {
            var id = call.calleePackageHint() + "." + member;
            if (!nodes.containsKey(id)) {
                nodes.put(id, new CallGraphNode(id, call.calleePackageHint(), member, null, null, 0, true));
            }
            return id;
        }

        if (!callee.contains(".")) {
            var samePackage = QualifiedNames.of(callerPackage, callee);
            if (nodes.containsKey(samePackage)) {
                return samePackage;
            }
            if (GoBuiltins.isBuiltinFunction(callee)) {
                var id = BUILTIN_PACKAGE + "." + callee;
                nodes.computeIfAbsent(id, k -> new CallGraphNode(k, BUILTIN_PACKAGE, callee, null, null, 0, true));
                return id;
            }
            nodes.computeIfAbsent(callee, k -> new CallGraphNode(k, "", callee, null, null, 0, true));
            return callee;
        }

        if (!SELECTOR_CALLEE.matcher(callee).matches()) {
            nodes.computeIfAbsent(callee, k -> new CallGraphNode(k, "", callee, null, null, 0, true));
            return callee;
        }

        // receiver.method on a value: link to the method when the caller's package declares exactly one by that name
        var methods = nodes.values().stream()
                .filter(n -> !n.external() && n.receiver() != null)
                .filter(n -> n.name().equals(member) && n.packageName().equals(callerPackage))
                .toList();
        if (methods.size() == 1) {
            return methods.get(0).id();
        }
        var split = SplitName.of(callee);
        nodes.computeIfAbsent(callee, k -> new CallGraphNode(k, "", split.function(), split.receiver(), null, 0, true));
        return callee;
    }

    /** {@code receiver.function}, split at the first dot; names starting with a parenthesis have no receiver. */
    record SplitName(@Nullable String receiver, String function) {
        static SplitName of(String name) {
            int dot = name.indexOf('.');
            if (dot < 0 || name.startsWith("(")) {
                return new SplitName(null, name);
            }
            return new SplitName(name.substring(0, dot), name.substring(dot + 1));
        }
    }
}
