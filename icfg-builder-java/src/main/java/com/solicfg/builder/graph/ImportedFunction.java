package com.solicfg.builder.graph;

import com.solicfg.builder.ir.FunctionId;

import java.util.List;

/**
 * Index entry for one imported FunctionGraph. Its nodes occupy the contiguous global
 * id range {@code [firstNode, firstNode + nodeCount)}.
 */
public record ImportedFunction(FunctionId id, int entry, List<Integer> exits, int firstNode, int nodeCount) {

    public ImportedFunction {
        exits = List.copyOf(exits);
    }

    public boolean contains(int nodeId) {
        return nodeId >= firstNode && nodeId < firstNode + nodeCount;
    }
}
