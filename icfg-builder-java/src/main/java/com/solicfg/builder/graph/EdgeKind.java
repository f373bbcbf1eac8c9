package com.solicfg.builder.graph;

import java.util.Locale;

public enum EdgeKind {
    INTRA,
    CALL,
    RETURN;

    /** Lowercase form used by the exporters. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
