package com.solicfg.builder;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.solicfg.builder.export.IcfgDocument;
import com.solicfg.builder.export.IcfgJsonExporter;
import com.solicfg.builder.export.IcfgJsonReader;
import com.solicfg.builder.graph.*;
import com.solicfg.builder.ir.FunctionGraph;
import com.solicfg.builder.ir.FunctionId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IcfgJsonExporterTest {

    private static final FunctionId CALLER = new FunctionId("Vault", "deposit(uint256)");
    private static final FunctionId CALLEE = new FunctionId("Vault", "_mint(address,uint256)");

    private static Icfg makeGraph() {
        FunctionGraph caller = new FunctionGraph(CALLER,
                List.of(new FunctionGraph.Statement(0, "ENTRY_POINT", "ENTRY_POINT", List.of()),
                        new FunctionGraph.Statement(1, "EXPRESSION", "_mint(msg.sender,\"amount\")", List.of()),
                        new FunctionGraph.Statement(2, "END_FUNCTION", "émission <done>", List.of())),
                0, List.of(2),
                List.of(new FunctionGraph.Flow(0, 1), new FunctionGraph.Flow(1, 2)));
        FunctionGraph callee = new FunctionGraph(CALLEE,
                List.of(new FunctionGraph.Statement(0, "ENTRY_POINT", "ENTRY_POINT", List.of()),
                        new FunctionGraph.Statement(1, "EXPRESSION", "balances[to] += amount", List.of())),
                0, List.of(1),
                List.of(new FunctionGraph.Flow(0, 1)));
        return new IcfgBuilder().build(List.of(caller, callee),
                Map.of(CALLER, List.of(new CallSite(1, 2, Set.of(CALLEE)))));
    }

    private static String export(IcfgJsonExporter exporter) {
        StringWriter out = new StringWriter();
        exporter.write(makeGraph(), out);
        return out.toString();
    }

    @Test
    void documentHasExactlyNodesAndEdgesKeys() {
        JsonObject root = JsonParser.parseString(export(new IcfgJsonExporter())).getAsJsonObject();

        assertEquals(Set.of("nodes", "edges"), root.keySet());
        JsonObject node = root.getAsJsonArray("nodes").get(0).getAsJsonObject();
        assertEquals(Set.of("id", "label", "repr"), node.keySet());
        JsonObject edge = root.getAsJsonArray("edges").get(0).getAsJsonObject();
        assertEquals(Set.of("src", "dst", "kind"), edge.keySet());
    }

    @Test
    void edgeKindsOmittedWhenDisabled() {
        JsonObject root = JsonParser.parseString(export(new IcfgJsonExporter(false))).getAsJsonObject();
        JsonObject edge = root.getAsJsonArray("edges").get(0).getAsJsonObject();
        assertEquals(Set.of("src", "dst"), edge.keySet());
    }

    @Test
    void roundTripPreservesCounts() {
        Icfg icfg = makeGraph();
        StringWriter out = new StringWriter();
        new IcfgJsonExporter().write(icfg, out);

        IcfgDocument doc = new IcfgJsonReader().read(new StringReader(out.toString()));

        assertEquals(icfg.nodeCount(), doc.nodes.size());
        assertEquals(icfg.edgeCount(), doc.edges.size());
        assertEquals(1, doc.edges.stream().filter(e -> "call".equals(e.kind)).count());
        assertEquals(1, doc.edges.stream().filter(e -> "return".equals(e.kind)).count());
    }

    @Test
    void reprPassedThroughUnchanged() {
        IcfgDocument doc = new IcfgJsonReader().read(new StringReader(export(new IcfgJsonExporter())));
        assertEquals("_mint(msg.sender,\"amount\")", doc.nodes.get(1).repr);
        assertEquals("émission <done>", doc.nodes.get(2).repr);
    }

    @Test
    void noHtmlOrUnicodeEscaping() {
        String json = export(new IcfgJsonExporter());
        assertTrue(json.contains("émission <done>"), "Non-ASCII and angle brackets must be written verbatim");
    }

    @Test
    void deterministicOutput() {
        assertEquals(export(new IcfgJsonExporter()), export(new IcfgJsonExporter()),
                "Identical input should produce identical output");
    }

    @Test
    void outputDirCreatedIfAbsent(@TempDir Path tmp) throws Exception {
        Path nested = tmp.resolve("a/b/icfg.json");
        new IcfgJsonExporter().write(makeGraph(), nested);

        assertTrue(Files.exists(nested));
        IcfgDocument doc = new IcfgJsonReader().read(nested);
        assertEquals(5, doc.nodes.size());
    }
}
