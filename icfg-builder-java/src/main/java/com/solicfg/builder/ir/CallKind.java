package com.solicfg.builder.ir;

/**
 * How a call expression names its target, as reported by the front end.
 */
public enum CallKind {
    /** Same-contract or inherited call, statically bound. */
    INTERNAL,
    /** {@code super.f()}: dispatch continues past the caller's own contract. */
    SUPER,
    /** External call through a contract- or interface-typed receiver. */
    HIGH_LEVEL,
    /** Call into a library function. */
    LIBRARY,
    /** call / delegatecall / staticcall / send / transfer on a raw address. */
    LOW_LEVEL
}
