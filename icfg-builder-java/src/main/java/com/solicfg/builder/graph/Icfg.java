package com.solicfg.builder.graph;

import com.solicfg.builder.ir.FunctionId;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable interprocedural control flow graph produced by {@link IcfgBuilder}.
 *
 * Node ids are dense: node {@code i} is {@code nodes().get(i)}. Edge order is the
 * order of construction (all intra edges first, then call/return linkage), which is
 * stable for identical input.
 */
public final class Icfg {

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<FunctionId, ImportedFunction> functions;
    private final Map<Integer, Set<FunctionId>> callTargets;
    private final Map<Integer, List<Edge>> outgoing = new HashMap<>();
    private final Map<Integer, List<Edge>> incoming = new HashMap<>();

    Icfg(List<Node> nodes,
         List<Edge> edges,
         Map<FunctionId, ImportedFunction> functions,
         Map<Integer, Set<FunctionId>> callTargets) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.callTargets = Collections.unmodifiableMap(new LinkedHashMap<>(callTargets));
        for (Edge e : this.edges) {
            outgoing.computeIfAbsent(e.src(), k -> new ArrayList<>()).add(e);
            incoming.computeIfAbsent(e.dst(), k -> new ArrayList<>()).add(e);
        }
    }

    public List<Node> nodes() { return nodes; }

    public List<Edge> edges() { return edges; }

    public int nodeCount() { return nodes.size(); }

    public int edgeCount() { return edges.size(); }

    public Node node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return nodes.get(id);
    }

    public List<Edge> edges(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }

    public List<Edge> outgoing(int id) {
        return outgoing.getOrDefault(id, Collections.emptyList());
    }

    public List<Edge> incoming(int id) {
        return incoming.getOrDefault(id, Collections.emptyList());
    }

    public List<Node> successors(int id) {
        return outgoing(id).stream().map(e -> nodes.get(e.dst())).collect(Collectors.toList());
    }

    public List<Node> predecessors(int id) {
        return incoming(id).stream().map(e -> nodes.get(e.src())).collect(Collectors.toList());
    }

    /** Imported functions keyed by identity, in import order. */
    public Map<FunctionId, ImportedFunction> functions() { return functions; }

    public Optional<ImportedFunction> function(FunctionId id) {
        return Optional.ofNullable(functions.get(id));
    }

    public List<Node> nodesOf(FunctionId id) {
        ImportedFunction f = functions.get(id);
        if (f == null) return Collections.emptyList();
        return nodes.subList(f.firstNode(), f.firstNode() + f.nodeCount());
    }

    /**
     * Candidate callees recorded for a call-site node. Empty for plain statements
     * and for UNRESOLVED_EXTERNAL nodes.
     */
    public Set<FunctionId> callTargetsOf(int id) {
        return callTargets.getOrDefault(id, Collections.emptySet());
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).collect(Collectors.toList());
    }
}
