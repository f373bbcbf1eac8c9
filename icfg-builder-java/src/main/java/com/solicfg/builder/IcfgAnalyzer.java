package com.solicfg.builder;

import com.solicfg.builder.config.BuildConfig;
import com.solicfg.builder.frontend.FrontEndAdapter;
import com.solicfg.builder.graph.*;
import com.solicfg.builder.ir.FunctionId;
import com.solicfg.builder.ir.ProjectInput;
import com.solicfg.builder.resolve.CallResolver;
import com.solicfg.builder.resolve.CallSiteCollector;
import com.solicfg.builder.resolve.TypeHierarchy;

import java.util.List;
import java.util.Map;

/**
 * Orchestrates one construction run: front end, call resolution, graph building.
 */
public class IcfgAnalyzer {

    private final BuildConfig config;

    public IcfgAnalyzer(BuildConfig config) {
        this.config = config;
    }

    public Icfg analyze(FrontEndAdapter frontEnd) {
        return analyze(frontEnd.load());
    }

    public Icfg analyze(ProjectInput input) {
        // 1. Type hierarchy and resolver
        TypeHierarchy hierarchy = new TypeHierarchy(input.contracts());
        CallResolver resolver = new CallResolver(hierarchy);

        // 2. Resolve call sites of every function
        Map<FunctionId, List<CallSite>> callSites = new CallSiteCollector(resolver).collect(input.functions());

        // 3. Import and wire
        Icfg icfg = new IcfgBuilder(config.getMaxNodes(), config.getMaxEdges())
                .build(input.functions(), callSites);

        long unresolved = callSites.values().stream()
                .flatMap(List::stream)
                .filter(s -> !s.isResolved())
                .count();
        System.err.println("[icfg] Discovered " + input.functions().size() + " implemented functions across "
                + input.contracts().size() + " contracts in " + input.projectName());
        System.err.println("[icfg] ICFG: " + icfg.nodeCount() + " nodes, "
                + icfg.edges(EdgeKind.INTRA).size() + " intra, "
                + icfg.edges(EdgeKind.CALL).size() + " call, "
                + icfg.edges(EdgeKind.RETURN).size() + " return edges; "
                + unresolved + " unresolved call sites");
        return icfg;
    }
}
