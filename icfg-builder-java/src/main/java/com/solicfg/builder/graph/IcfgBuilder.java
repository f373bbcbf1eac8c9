package com.solicfg.builder.graph;

import com.solicfg.builder.graph.GraphConstructionException.DanglingReferenceException;
import com.solicfg.builder.graph.GraphConstructionException.GraphTooLargeException;
import com.solicfg.builder.graph.GraphConstructionException.IdentityCollisionException;
import com.solicfg.builder.ir.FunctionGraph;
import com.solicfg.builder.ir.FunctionId;

import java.util.*;

/**
 * Merges per-function CFGs into one ICFG and splices call/return edges at call sites.
 *
 * Pass one imports every FunctionGraph exactly once, assigning global node ids in
 * first-encounter order, and records identity -> (entry, exits). Pass two wires
 * CALL edges to candidate entries and RETURN edges from candidate exits using the
 * complete index, so callee order in the input does not matter. Recursive calls
 * simply point back at an already imported entry node.
 */
public class IcfgBuilder {

    private final int maxNodes;
    private final int maxEdges;

    public IcfgBuilder() {
        this(0, 0);
    }

    /**
     * @param maxNodes node ceiling, 0 for unlimited
     * @param maxEdges edge ceiling, 0 for unlimited
     */
    public IcfgBuilder(int maxNodes, int maxEdges) {
        if (maxNodes < 0 || maxEdges < 0) {
            throw new IllegalArgumentException("Ceilings must be >= 0, got nodes=" + maxNodes + " edges=" + maxEdges);
        }
        this.maxNodes = maxNodes;
        this.maxEdges = maxEdges;
    }

    /**
     * Builds the ICFG.
     *
     * @param functions  all FunctionGraphs of the project, in the order ids should be assigned
     * @param callSites  resolved call sites per function; functions without calls may be absent
     * @throws GraphConstructionException on identity collisions, dangling references or an exceeded ceiling
     */
    public Icfg build(List<FunctionGraph> functions, Map<FunctionId, List<CallSite>> callSites) {
        Map<FunctionId, FunctionGraph> byId = indexFunctions(functions);
        validateCallSites(byId, callSites);

        Arena arena = new Arena();

        // Pass one: import
        for (FunctionGraph fg : byId.values()) {
            arena.importFunction(fg, callSites.getOrDefault(fg.id(), Collections.emptyList()));
        }

        // Pass two: wire
        for (FunctionGraph fg : byId.values()) {
            for (CallSite site : callSites.getOrDefault(fg.id(), Collections.emptyList())) {
                arena.link(fg.id(), site);
            }
        }

        arena.verifyEdges();
        return new Icfg(arena.nodes, arena.edges, arena.index, arena.callTargets);
    }

    private Map<FunctionId, FunctionGraph> indexFunctions(List<FunctionGraph> functions) {
        Map<FunctionId, FunctionGraph> byId = new LinkedHashMap<>();
        for (FunctionGraph fg : functions) {
            if (byId.putIfAbsent(fg.id(), fg) != null) {
                throw new IdentityCollisionException("Duplicate function identity: " + fg.id());
            }
        }
        return byId;
    }

    private void validateCallSites(Map<FunctionId, FunctionGraph> byId, Map<FunctionId, List<CallSite>> callSites) {
        for (Map.Entry<FunctionId, List<CallSite>> entry : callSites.entrySet()) {
            FunctionGraph caller = byId.get(entry.getKey());
            if (caller == null) {
                throw new DanglingReferenceException("Call sites reported for unknown function: " + entry.getKey());
            }
            Set<Integer> localIds = new HashSet<>();
            for (FunctionGraph.Statement s : caller.nodes()) localIds.add(s.localId());

            for (CallSite site : entry.getValue()) {
                if (!localIds.contains(site.node())) {
                    throw new DanglingReferenceException("Call site node " + site.node()
                            + " does not exist in " + caller.id());
                }
                if (!localIds.contains(site.returnSite())) {
                    throw new DanglingReferenceException("Return site node " + site.returnSite()
                            + " does not exist in " + caller.id());
                }
                for (FunctionId candidate : site.candidates()) {
                    if (!byId.containsKey(candidate)) {
                        throw new DanglingReferenceException("Call at " + caller.id() + "#" + site.node()
                                + " targets " + candidate + ", which has no FunctionGraph");
                    }
                }
            }
        }
    }

    /** Mutable construction state; discarded once the immutable Icfg is created. */
    private final class Arena {
        final List<Node> nodes = new ArrayList<>();
        final List<Edge> edges = new ArrayList<>();
        final Map<FunctionId, ImportedFunction> index = new LinkedHashMap<>();
        final Map<Integer, Set<FunctionId>> callTargets = new LinkedHashMap<>();
        // function -> (local id -> global id)
        final Map<FunctionId, Map<Integer, Integer>> globalIds = new HashMap<>();

        void importFunction(FunctionGraph fg, List<CallSite> sites) {
            Map<Integer, CallSite> siteByNode = new HashMap<>();
            Set<Integer> returnSites = new HashSet<>();
            for (CallSite site : sites) {
                siteByNode.put(site.node(), site);
                if (site.isResolved()) returnSites.add(site.returnSite());
            }
            Set<Integer> exits = new HashSet<>(fg.exits());

            int first = nodes.size();
            Map<Integer, Integer> local = new LinkedHashMap<>();
            for (FunctionGraph.Statement s : fg.nodes()) {
                if (local.containsKey(s.localId())) {
                    throw new IdentityCollisionException("Duplicate node id " + s.localId() + " in " + fg.id());
                }
                int id = addNode(s.label(), s.repr(), kindOf(s.localId(), fg.entry(), exits, siteByNode, returnSites), fg.id());
                local.put(s.localId(), id);
            }

            Integer entry = local.get(fg.entry());
            if (entry == null) {
                throw new DanglingReferenceException("Entry node " + fg.entry() + " does not exist in " + fg.id());
            }
            List<Integer> exitIds = new ArrayList<>();
            for (int exit : fg.exits()) {
                Integer id = local.get(exit);
                if (id == null) {
                    throw new DanglingReferenceException("Exit node " + exit + " does not exist in " + fg.id());
                }
                exitIds.add(id);
            }

            for (FunctionGraph.Flow flow : fg.flows()) {
                Integer src = local.get(flow.from());
                Integer dst = local.get(flow.to());
                if (src == null || dst == null) {
                    throw new DanglingReferenceException("Intra edge " + flow.from() + " -> " + flow.to()
                            + " references a missing node in " + fg.id());
                }
                addEdge(src, dst, EdgeKind.INTRA);
            }

            for (CallSite site : sites) {
                callTargets.put(local.get(site.node()), site.candidates());
            }

            globalIds.put(fg.id(), local);
            index.put(fg.id(), new ImportedFunction(fg.id(), entry, exitIds, first, fg.nodes().size()));
        }

        void link(FunctionId caller, CallSite site) {
            Map<Integer, Integer> local = globalIds.get(caller);
            int callNode = local.get(site.node());
            int returnSite = local.get(site.returnSite());
            for (FunctionId candidate : site.candidates()) {
                ImportedFunction callee = index.get(candidate);
                addEdge(callNode, callee.entry(), EdgeKind.CALL);
                for (int exit : callee.exits()) {
                    addEdge(exit, returnSite, EdgeKind.RETURN);
                }
            }
        }

        int addNode(String label, String repr, NodeKind kind, FunctionId function) {
            if (maxNodes > 0 && nodes.size() >= maxNodes) {
                throw new GraphTooLargeException("Graph too large: node ceiling " + maxNodes
                        + " exceeded while importing " + function);
            }
            int id = nodes.size();
            nodes.add(new Node(id, label, repr, kind, function));
            return id;
        }

        void addEdge(int src, int dst, EdgeKind kind) {
            if (maxEdges > 0 && edges.size() >= maxEdges) {
                throw new GraphTooLargeException("Graph too large: edge ceiling " + maxEdges
                        + " exceeded at " + kind.wireName() + " edge " + src + " -> " + dst);
            }
            edges.add(new Edge(src, dst, kind));
        }

        void verifyEdges() {
            int n = nodes.size();
            for (Edge e : edges) {
                if (e.src() < 0 || e.src() >= n || e.dst() < 0 || e.dst() >= n) {
                    throw new DanglingReferenceException("Edge " + e.src() + " -> " + e.dst()
                            + " references a node outside [0, " + n + ")");
                }
            }
        }
    }

    private static NodeKind kindOf(int localId,
                                   int entry,
                                   Set<Integer> exits,
                                   Map<Integer, CallSite> siteByNode,
                                   Set<Integer> returnSites) {
        CallSite site = siteByNode.get(localId);
        if (site != null) {
            return site.isResolved() ? NodeKind.CALL_SITE : NodeKind.UNRESOLVED_EXTERNAL;
        }
        if (localId == entry) return NodeKind.ENTRY;
        if (exits.contains(localId)) return NodeKind.EXIT;
        if (returnSites.contains(localId)) return NodeKind.RETURN_SITE;
        return NodeKind.STATEMENT;
    }
}
