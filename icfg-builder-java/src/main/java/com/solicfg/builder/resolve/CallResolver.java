package com.solicfg.builder.resolve;

import com.solicfg.builder.ir.CallTarget;
import com.solicfg.builder.ir.ContractDecl;
import com.solicfg.builder.ir.FunctionId;

import java.util.*;

/**
 * Resolves a call expression to the ordered set of functions it may invoke.
 *
 * Library calls and internal calls qualified with a contract name are statically bound.
 * Unqualified internal calls and {@code super} calls are virtual: the body they run
 * depends on the most derived contract of the instance, so every concrete subtype of
 * the calling contract contributes its target. Calls through a contract or interface
 * type are resolved by class hierarchy analysis over the receiver type. Candidates
 * are ordered by project declaration order. Low-level calls and receivers outside the
 * project resolve to the empty set.
 */
public class CallResolver {

    private final TypeHierarchy hierarchy;

    // "<type>::<signature>" -> CHA result
    private final Map<String, Set<FunctionId>> resolveTable = new HashMap<>();

    public CallResolver(TypeHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    /**
     * @param target call expression as described by the front end
     * @param caller function containing the call; its scope is the calling contract
     * @return unmodifiable, insertion-ordered candidate set, possibly empty
     */
    public Set<FunctionId> resolve(CallTarget target, FunctionId caller) {
        if (target.signature() == null) return Collections.emptySet();

        return switch (target.kind()) {
            case INTERNAL -> resolveInternal(target, caller);
            case SUPER -> resolveSuper(caller.scope(), target.signature());
            case LIBRARY -> hierarchy.contains(target.contract())
                    ? single(hierarchy.dispatch(target.contract(), target.signature()))
                    : Collections.emptySet();
            case HIGH_LEVEL -> resolveVirtual(target.contract(), target.signature());
            case LOW_LEVEL -> Collections.emptySet();
        };
    }

    private Set<FunctionId> resolveInternal(CallTarget target, FunctionId caller) {
        if (target.contract() != null) {
            String scope = target.contract();
            if (!hierarchy.contains(scope)) return Collections.emptySet();
            Optional<FunctionId> bound = hierarchy.dispatch(scope, target.signature());
            if (bound.isPresent()) return single(bound);
            // Declared but unimplemented here: the body comes from a deriving contract.
            return resolveVirtual(scope, target.signature());
        }

        String scope = caller.scope();
        if (!hierarchy.contains(scope)) return Collections.emptySet();
        Set<FunctionId> result = new LinkedHashSet<>();
        hierarchy.dispatch(scope, target.signature()).ifPresent(result::add);
        result.addAll(resolveVirtual(scope, target.signature()));
        return Collections.unmodifiableSet(result);
    }

    private Set<FunctionId> resolveSuper(String scope, String signature) {
        if (!hierarchy.contains(scope)) return Collections.emptySet();
        String key = "super:" + scope + "::" + signature;
        Set<FunctionId> callees = resolveTable.get(key);
        if (callees == null) {
            Set<FunctionId> result = new LinkedHashSet<>();
            hierarchy.dispatchSuper(scope, signature).ifPresent(result::add);
            for (ContractDecl decl : hierarchy.subtypesOf(scope)) {
                if (decl.kind().isConcrete()) {
                    hierarchy.dispatchSuper(decl.name(), scope, signature).ifPresent(result::add);
                }
            }
            callees = Collections.unmodifiableSet(result);
            resolveTable.put(key, callees);
        }
        return callees;
    }

    private Set<FunctionId> resolveVirtual(String type, String signature) {
        if (!hierarchy.contains(type)) return Collections.emptySet();
        String key = type + "::" + signature;
        Set<FunctionId> callees = resolveTable.get(key);
        if (callees == null) {
            Set<FunctionId> result = new LinkedHashSet<>();
            for (ContractDecl decl : hierarchy.subtypesOf(type)) {
                if (decl.kind().isConcrete()) {
                    hierarchy.dispatch(decl.name(), signature).ifPresent(result::add);
                }
            }
            callees = Collections.unmodifiableSet(result);
            resolveTable.put(key, callees);
        }
        return callees;
    }

    private static Set<FunctionId> single(Optional<FunctionId> id) {
        return id.map(Collections::singleton).orElse(Collections.emptySet());
    }
}
