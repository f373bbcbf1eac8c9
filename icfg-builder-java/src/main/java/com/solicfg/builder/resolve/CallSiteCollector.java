package com.solicfg.builder.resolve;

import com.solicfg.builder.graph.CallSite;
import com.solicfg.builder.ir.CallTarget;
import com.solicfg.builder.ir.FunctionGraph;
import com.solicfg.builder.ir.FunctionId;

import java.util.*;

/**
 * Finds the call-site nodes of every function and resolves their candidates.
 */
public class CallSiteCollector {

    private final CallResolver resolver;

    public CallSiteCollector(CallResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @return call sites per function, in function order; functions without calls are absent
     */
    public Map<FunctionId, List<CallSite>> collect(List<FunctionGraph> functions) {
        Map<FunctionId, List<CallSite>> result = new LinkedHashMap<>();
        for (FunctionGraph fg : functions) {
            List<CallSite> sites = new ArrayList<>();
            for (FunctionGraph.Statement s : fg.nodes()) {
                if (!s.hasCalls()) continue;
                Set<FunctionId> candidates = new LinkedHashSet<>();
                for (CallTarget call : s.calls()) {
                    candidates.addAll(resolver.resolve(call, fg.id()));
                }
                sites.add(new CallSite(s.localId(), returnSiteOf(fg, s.localId()), candidates));
            }
            if (!sites.isEmpty()) {
                result.put(fg.id(), sites);
            }
        }
        return result;
    }

    /**
     * The single intra successor of {@code node}. A call node without successors, or one that
     * branches (a call in a condition), returns to itself so every outgoing branch stays reachable.
     */
    static int returnSiteOf(FunctionGraph fg, int node) {
        Integer successor = null;
        for (FunctionGraph.Flow flow : fg.flows()) {
            if (flow.from() != node) continue;
            if (successor != null && successor != flow.to()) return node;
            successor = flow.to();
        }
        return successor != null ? successor : node;
    }
}
