package com.solicfg.builder.graph;

/**
 * Structural invariant violation found while building the ICFG.
 * Construction is aborted; no partial graph is returned.
 */
public class GraphConstructionException extends RuntimeException {

    public GraphConstructionException(String message) { super(message); }

    /** Two distinct declarations map to the same identity key. */
    public static class IdentityCollisionException extends GraphConstructionException {
        public IdentityCollisionException(String message) { super(message); }
    }

    /** An edge, entry/exit marker or call candidate names something that was never created. */
    public static class DanglingReferenceException extends GraphConstructionException {
        public DanglingReferenceException(String message) { super(message); }
    }

    /** The configured node or edge ceiling was exceeded. */
    public static class GraphTooLargeException extends GraphConstructionException {
        public GraphTooLargeException(String message) { super(message); }
    }
}
