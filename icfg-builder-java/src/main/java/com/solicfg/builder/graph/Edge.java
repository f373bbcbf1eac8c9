package com.solicfg.builder.graph;

/**
 * Directed edge between two global node ids. Parallel edges are allowed.
 */
public record Edge(int src, int dst, EdgeKind kind) {}
