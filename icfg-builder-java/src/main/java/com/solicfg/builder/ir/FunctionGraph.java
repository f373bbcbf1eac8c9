package com.solicfg.builder.ir;

import java.util.List;

/**
 * Intra-procedural CFG of one function as supplied by the front end.
 * Node ids are local to the function; the graph builder assigns global ids on import.
 *
 * @param id     identity of the function
 * @param nodes  nodes in front-end order
 * @param entry  local id of the single entry node
 * @param exits  local ids of the exit nodes (may be empty for functions that never return)
 * @param flows  intra-procedural edges between local ids
 */
public record FunctionGraph(
    FunctionId id,
    List<Statement> nodes,
    int entry,
    List<Integer> exits,
    List<Flow> flows
) {
    public FunctionGraph {
        nodes = List.copyOf(nodes);
        exits = List.copyOf(exits);
        flows = List.copyOf(flows);
    }

    /**
     * One control-flow point of the function.
     *
     * @param calls call expressions evaluated at this node; empty for plain statements
     */
    public record Statement(int localId, String label, String repr, List<CallTarget> calls) {
        public Statement {
            calls = List.copyOf(calls);
        }

        public boolean hasCalls() {
            return !calls.isEmpty();
        }
    }

    /** Intra-procedural edge {@code from -> to}, local ids. */
    public record Flow(int from, int to) {}
}
