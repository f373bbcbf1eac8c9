package com.solicfg.builder.graph;

import com.solicfg.builder.ir.FunctionId;

/**
 * A control-flow point of the merged graph. Ids are unique across the whole graph
 * and equal the node's index in {@link Icfg#nodes()}.
 *
 * @param repr opaque statement text from the front end, never rewritten
 */
public record Node(int id, String label, String repr, NodeKind kind, FunctionId function) {}
