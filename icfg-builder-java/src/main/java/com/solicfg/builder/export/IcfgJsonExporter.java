package com.solicfg.builder.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.solicfg.builder.graph.Edge;
import com.solicfg.builder.graph.Icfg;
import com.solicfg.builder.graph.Node;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Writes an ICFG as {@code {"nodes":[{id,label,repr}], "edges":[{src,dst,kind}]}}.
 * Nodes are emitted in id order and edges in construction order, so a deterministic
 * graph gives byte-identical output.
 */
public class IcfgJsonExporter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private final boolean includeEdgeKinds;

    public IcfgJsonExporter() {
        this(true);
    }

    public IcfgJsonExporter(boolean includeEdgeKinds) {
        this.includeEdgeKinds = includeEdgeKinds;
    }

    public IcfgDocument toDocument(Icfg icfg) {
        IcfgDocument doc = new IcfgDocument();
        doc.nodes = new ArrayList<>(icfg.nodeCount());
        for (Node n : icfg.nodes()) {
            IcfgDocument.JsonNode jn = new IcfgDocument.JsonNode();
            jn.id = n.id();
            jn.label = n.label();
            jn.repr = n.repr();
            doc.nodes.add(jn);
        }
        doc.edges = new ArrayList<>(icfg.edgeCount());
        for (Edge e : icfg.edges()) {
            IcfgDocument.JsonEdge je = new IcfgDocument.JsonEdge();
            je.src = e.src();
            je.dst = e.dst();
            je.kind = includeEdgeKinds ? e.kind().wireName() : null;
            doc.edges.add(je);
        }
        return doc;
    }

    public void write(Icfg icfg, Writer out) {
        try {
            GSON.toJson(toDocument(icfg), out);
            out.flush();
        } catch (IOException e) {
            throw new ExportException("Failed to write ICFG JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Writes to {@code path}, creating parent directories as needed.
     */
    public void write(Icfg icfg, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ExportException("Could not create output directory for: " + path, e);
        }
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(icfg, w);
        } catch (IOException e) {
            throw new ExportException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        System.err.println("[icfg] Wrote ICFG JSON to " + path);
    }
}
