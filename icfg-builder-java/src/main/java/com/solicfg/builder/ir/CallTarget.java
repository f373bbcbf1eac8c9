package com.solicfg.builder.ir;

/**
 * The resolvable description of one call expression inside a node.
 *
 * @param kind      how the target is named
 * @param contract  receiver or library type; nullable for internal/super calls
 * @param signature callee signature, e.g. {@code transfer(address,uint256)}; nullable for low-level calls
 */
public record CallTarget(CallKind kind, String contract, String signature) {

    public CallTarget {
        if (kind == null) {
            throw new IllegalArgumentException("CallTarget kind must not be null");
        }
    }

    public static CallTarget internal(String signature) {
        return new CallTarget(CallKind.INTERNAL, null, signature);
    }

    public static CallTarget highLevel(String contract, String signature) {
        return new CallTarget(CallKind.HIGH_LEVEL, contract, signature);
    }

    public static CallTarget library(String library, String signature) {
        return new CallTarget(CallKind.LIBRARY, library, signature);
    }

    public static CallTarget lowLevel() {
        return new CallTarget(CallKind.LOW_LEVEL, null, null);
    }
}
