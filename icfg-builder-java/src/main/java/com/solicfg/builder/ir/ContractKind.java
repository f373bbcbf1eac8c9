package com.solicfg.builder.ir;

public enum ContractKind {
    CONTRACT,
    ABSTRACT,
    INTERFACE,
    LIBRARY;

    /** Only plain contracts can be deployed and so be the runtime receiver of a call. */
    public boolean isConcrete() {
        return this == CONTRACT;
    }
}
