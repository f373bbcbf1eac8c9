package com.solicfg.builder.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional build configuration JSON.
 * Every field is optional; getters apply the defaults.
 */
public class BuildConfig {

    /** Node ceiling for the merged graph (default: 0, unlimited). */
    @SerializedName("max_nodes")
    private Integer maxNodes;

    /** Edge ceiling for the merged graph (default: 0, unlimited). */
    @SerializedName("max_edges")
    private Integer maxEdges;

    /** Characters of a node's repr shown in DOT labels (default: 80). */
    @SerializedName("dot_repr_max_length")
    private Integer dotReprMaxLength;

    /** Whether JSON edges carry their kind attribute (default: true). */
    @SerializedName("json_edge_kinds")
    private Boolean jsonEdgeKinds;

    public static BuildConfig defaults() {
        return new BuildConfig();
    }

    public int getMaxNodes()          { return maxNodes != null ? maxNodes : 0; }
    public int getMaxEdges()          { return maxEdges != null ? maxEdges : 0; }
    public int getDotReprMaxLength()  { return dotReprMaxLength != null ? dotReprMaxLength : 80; }
    public boolean isJsonEdgeKinds()  { return jsonEdgeKinds == null || jsonEdgeKinds; }

    public BuildConfig withMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
        return this;
    }

    public BuildConfig withMaxEdges(int maxEdges) {
        this.maxEdges = maxEdges;
        return this;
    }
}
