package com.solicfg.builder.ir;

/**
 * Identity of a function across the whole project: declaring contract plus signature.
 * Used to deduplicate FunctionGraph imports and as the result of call resolution.
 *
 * Canonical form: {@code <contract>.<signature>}, e.g. {@code Vault.harvestAll(address)}.
 */
public record FunctionId(String scope, String signature) {

    public FunctionId {
        if (scope == null || scope.isEmpty()) {
            throw new IllegalArgumentException("FunctionId scope must not be empty");
        }
        if (signature == null || signature.isEmpty()) {
            throw new IllegalArgumentException("FunctionId signature must not be empty (scope " + scope + ")");
        }
    }

    /** Function name without the parameter list. */
    public String name() {
        int paren = signature.indexOf('(');
        return paren >= 0 ? signature.substring(0, paren) : signature;
    }

    @Override
    public String toString() {
        return scope + "." + signature;
    }
}
