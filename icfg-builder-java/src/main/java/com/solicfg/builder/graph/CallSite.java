package com.solicfg.builder.graph;

import com.solicfg.builder.ir.FunctionId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A node of a FunctionGraph that evaluates one or more calls, with its resolved candidates.
 * Node ids are local to the caller's FunctionGraph.
 *
 * @param node        local id of the calling node
 * @param returnSite  local id of the node control resumes at after the call
 * @param candidates  ordered candidate callees; empty when nothing in the project matches
 */
public record CallSite(int node, int returnSite, Set<FunctionId> candidates) {

    public CallSite {
        candidates = Collections.unmodifiableSet(new LinkedHashSet<>(candidates));
    }

    public boolean isResolved() {
        return !candidates.isEmpty();
    }
}
