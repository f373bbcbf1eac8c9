package com.solicfg.builder.graph;

public enum NodeKind {
    ENTRY,
    EXIT,
    STATEMENT,
    CALL_SITE,
    RETURN_SITE,
    /** Node whose calls resolved to no candidate in the project. */
    UNRESOLVED_EXTERNAL
}
