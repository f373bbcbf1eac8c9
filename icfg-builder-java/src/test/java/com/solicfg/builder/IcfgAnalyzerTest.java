package com.solicfg.builder;

import com.solicfg.builder.config.BuildConfig;
import com.solicfg.builder.frontend.JsonModelFrontEnd;
import com.solicfg.builder.graph.*;
import com.solicfg.builder.graph.GraphConstructionException.GraphTooLargeException;
import com.solicfg.builder.ir.FunctionId;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: builds the ICFG of the vault-project fixture.
 */
class IcfgAnalyzerTest {

    private static final Path MODEL = JsonModelFrontEndTest.FIXTURE_ROOT.resolve("model.json");

    private static Icfg icfg;

    @BeforeAll
    static void runAnalysis() {
        icfg = new IcfgAnalyzer(BuildConfig.defaults()).analyze(new JsonModelFrontEnd(MODEL));
    }

    private static ImportedFunction fn(String scope, String signature) {
        return icfg.function(new FunctionId(scope, signature)).orElseThrow();
    }

    @Test
    void nodeAndEdgeCountsMatchFixture() {
        assertEquals(26, icfg.nodeCount());
        assertEquals(18, icfg.edges(EdgeKind.INTRA).size());
        assertEquals(8, icfg.edges(EdgeKind.CALL).size());
        assertEquals(10, icfg.edges(EdgeKind.RETURN).size());
    }

    @Test
    void functionsImportedInDeclarationOrder() {
        List<String> order = icfg.functions().keySet().stream().map(FunctionId::toString).collect(Collectors.toList());
        assertEquals(List.of(
                "Ownable._checkOwner()",
                "LendingStrategy.harvest()",
                "LendingStrategy._accrue()",
                "StakingStrategy.harvest()",
                "Vault.harvestAll(address)",
                "Vault.ping(uint256)",
                "Vault.pong(uint256)",
                "MathLib.fact(uint256)"), order);
        assertEquals(0, fn("Ownable", "_checkOwner()").firstNode());
        assertEquals(22, fn("MathLib", "fact(uint256)").firstNode());
    }

    @Test
    void interfaceCallFansOutToBothStrategies() {
        ImportedFunction harvestAll = fn("Vault", "harvestAll(address)");
        int callNode = harvestAll.firstNode() + 2;
        int returnSite = harvestAll.firstNode() + 3;

        List<Integer> targets = icfg.outgoing(callNode).stream()
                .filter(e -> e.kind() == EdgeKind.CALL)
                .map(Edge::dst)
                .collect(Collectors.toList());
        assertEquals(List.of(fn("LendingStrategy", "harvest()").entry(), fn("StakingStrategy", "harvest()").entry()),
                targets);

        List<Integer> returnSources = icfg.incoming(returnSite).stream()
                .filter(e -> e.kind() == EdgeKind.RETURN)
                .map(Edge::src)
                .collect(Collectors.toList());
        assertEquals(List.of(fn("LendingStrategy", "harvest()").exits().get(0),
                             fn("StakingStrategy", "harvest()").exits().get(0)), returnSources);
    }

    @Test
    void inheritedInternalCallLinksToBaseContract() {
        int callNode = fn("Vault", "harvestAll(address)").firstNode() + 1;
        assertEquals(Set.of(new FunctionId("Ownable", "_checkOwner()")), icfg.callTargetsOf(callNode));
    }

    @Test
    void libraryCallReturnsFromBothExits() {
        ImportedFunction fact = fn("MathLib", "fact(uint256)");
        int callNode = fn("Vault", "harvestAll(address)").firstNode() + 3;
        int returnSite = callNode + 1;

        long returns = icfg.edges(EdgeKind.RETURN).stream()
                .filter(e -> e.dst() == returnSite && fact.exits().contains(e.src()))
                .count();
        assertEquals(2, returns);
        assertTrue(icfg.outgoing(callNode).contains(new Edge(callNode, fact.entry(), EdgeKind.CALL)));
    }

    @Test
    void recursionLinksBackToOwnEntry() {
        ImportedFunction fact = fn("MathLib", "fact(uint256)");
        int recursiveCall = fact.firstNode() + 3;

        assertEquals(4, icfg.nodesOf(fact.id()).size());
        assertTrue(icfg.edges().contains(new Edge(recursiveCall, fact.entry(), EdgeKind.CALL)));
        assertTrue(icfg.edges().contains(new Edge(recursiveCall, recursiveCall, EdgeKind.RETURN)),
                "A call without successor returns to itself");
    }

    @Test
    void mutualRecursionFormsCycle() {
        ImportedFunction ping = fn("Vault", "ping(uint256)");
        ImportedFunction pong = fn("Vault", "pong(uint256)");
        assertTrue(icfg.edges().contains(new Edge(ping.firstNode() + 1, pong.entry(), EdgeKind.CALL)));
        assertTrue(icfg.edges().contains(new Edge(pong.firstNode() + 1, ping.entry(), EdgeKind.CALL)));
    }

    @Test
    void lowLevelAndExternalCallsAreUnresolved() {
        List<Node> unresolved = icfg.nodesOfKind(NodeKind.UNRESOLVED_EXTERNAL);
        assertEquals(List.of(
                        "(ok, None) = treasury.call{value: reward}()",
                        "IERC20(token).transfer(msg.sender,bonus)"),
                unresolved.stream().map(Node::repr).collect(Collectors.toList()));
        for (Node n : unresolved) {
            assertTrue(icfg.outgoing(n.id()).stream().noneMatch(e -> e.kind() == EdgeKind.CALL));
            assertEquals(1, icfg.successors(n.id()).size());
        }
    }

    @Test
    void everyEdgeReferencesExistingNodes() {
        for (Edge e : icfg.edges()) {
            assertTrue(e.src() >= 0 && e.src() < icfg.nodeCount());
            assertTrue(e.dst() >= 0 && e.dst() < icfg.nodeCount());
        }
    }

    @Test
    void repeatedRunsAreIdentical() {
        Icfg again = new IcfgAnalyzer(BuildConfig.defaults()).analyze(new JsonModelFrontEnd(MODEL));
        assertEquals(icfg.nodes(), again.nodes());
        assertEquals(icfg.edges(), again.edges());
    }

    @Test
    void configuredCeilingAbortsConstruction() {
        BuildConfig tight = BuildConfig.defaults().withMaxNodes(10);
        assertThrows(GraphTooLargeException.class,
                () -> new IcfgAnalyzer(tight).analyze(new JsonModelFrontEnd(MODEL)));

        BuildConfig fewEdges = BuildConfig.defaults().withMaxEdges(20);
        assertThrows(GraphTooLargeException.class,
                () -> new IcfgAnalyzer(fewEdges).analyze(new JsonModelFrontEnd(MODEL)));
    }
}
