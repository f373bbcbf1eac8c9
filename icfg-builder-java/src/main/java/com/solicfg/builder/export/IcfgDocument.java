package com.solicfg.builder.export;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * JSON shape of an exported ICFG. Downstream tools parse this directly:
 * keep field names and nesting stable.
 */
public class IcfgDocument {

    @SerializedName("nodes") public List<JsonNode> nodes;
    @SerializedName("edges") public List<JsonEdge> edges;

    public static class JsonNode {
        @SerializedName("id")    public int id;
        @SerializedName("label") public String label;
        @SerializedName("repr")  public String repr;
    }

    public static class JsonEdge {
        @SerializedName("src")  public int src;
        @SerializedName("dst")  public int dst;
        @SerializedName("kind") public String kind;  // omitted when null
    }
}
