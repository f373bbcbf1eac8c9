package com.solicfg.builder.export;

import com.solicfg.builder.graph.Edge;
import com.solicfg.builder.graph.Icfg;
import com.solicfg.builder.graph.Node;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an ICFG in Graphviz DOT.
 *
 * Node {@code i} becomes {@code n<i>}, labelled with the node label and its repr
 * (cut to {@code reprMaxLength} characters). CALL edges are dashed, RETURN edges dotted.
 */
public class DotExporter {

    private final int reprMaxLength;

    public DotExporter() {
        this(80);
    }

    public DotExporter(int reprMaxLength) {
        if (reprMaxLength < 0) {
            throw new IllegalArgumentException("reprMaxLength must be >= 0, got " + reprMaxLength);
        }
        this.reprMaxLength = reprMaxLength;
    }

    public void write(Icfg icfg, Writer out) {
        try {
            out.write("digraph ICFG {\n");
            out.write("  node [shape=box,fontname=\"DejaVu Sans\"];\n");
            for (Node n : icfg.nodes()) {
                out.write("  n" + n.id() + " [label=\"" + labelOf(n) + "\"];\n");
            }
            for (Edge e : icfg.edges()) {
                out.write("  n" + e.src() + " -> n" + e.dst() + edgeAttributes(e) + ";\n");
            }
            out.write("}\n");
            out.flush();
        } catch (IOException e) {
            throw new ExportException("Failed to write ICFG DOT: " + e.getMessage(), e);
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
        System.err.println("[icfg] Wrote ICFG DOT to " + path);
    }

    String labelOf(Node n) {
        String repr = n.repr();
        if (repr.length() > reprMaxLength) {
            int cut = reprMaxLength;
            // keep surrogate pairs whole
            if (cut > 0 && Character.isHighSurrogate(repr.charAt(cut - 1))) cut--;
            repr = repr.substring(0, cut);
        }
        return escape(n.label()) + "\\n" + escape(repr);
    }

    private static String edgeAttributes(Edge e) {
        return switch (e.kind()) {
            case INTRA -> "";
            case CALL -> " [style=dashed]";
            case RETURN -> " [style=dotted]";
        };
    }

    /** Escapes text for a double-quoted DOT ID. */
    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r') continue;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append(' ');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
