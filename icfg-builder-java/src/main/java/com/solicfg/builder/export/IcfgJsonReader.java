package com.solicfg.builder.export;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads back a document written by {@link IcfgJsonExporter}.
 */
public class IcfgJsonReader {

    private static final Gson GSON = new Gson();

    public IcfgDocument read(Reader in) {
        IcfgDocument doc;
        try {
            doc = GSON.fromJson(in, IcfgDocument.class);
        } catch (JsonParseException e) {
            throw new ExportException("Malformed ICFG JSON: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ExportException("ICFG JSON is empty", null);
        }
        if (doc.nodes == null) doc.nodes = new ArrayList<>();
        if (doc.edges == null) doc.edges = new ArrayList<>();
        return doc;
    }

    public IcfgDocument read(Path path) {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (IOException e) {
            throw new ExportException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
