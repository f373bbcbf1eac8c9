package com.solicfg.builder.resolve;

import com.solicfg.builder.graph.GraphConstructionException;
import com.solicfg.builder.graph.GraphConstructionException.IdentityCollisionException;
import com.solicfg.builder.ir.ContractDecl;
import com.solicfg.builder.ir.FunctionId;

import java.util.*;

/**
 * Inheritance structure of the scanned project.
 *
 * Linearization follows Solidity's C3 rule: bases are declared most-base first, so for
 * {@code contract D is B, C} the order is D, C, B, ... Bases that are not part of the
 * project are ignored.
 */
public class TypeHierarchy {

    public static class LinearizationException extends GraphConstructionException {
        public LinearizationException(String message) { super(message); }
    }

    private final Map<String, ContractDecl> contracts = new LinkedHashMap<>();
    private final Map<String, List<String>> linearizations = new HashMap<>();

    public TypeHierarchy(List<ContractDecl> decls) {
        for (ContractDecl decl : decls) {
            if (contracts.putIfAbsent(decl.name(), decl) != null) {
                throw new IdentityCollisionException("Duplicate contract name: " + decl.name());
            }
        }
        for (ContractDecl decl : decls) {
            for (String base : decl.bases()) {
                if (!contracts.containsKey(base)) {
                    System.err.println("[icfg] WARNING: base contract not in project (ignored): "
                            + decl.name() + " is " + base);
                }
            }
        }
    }

    public boolean contains(String name) {
        return name != null && contracts.containsKey(name);
    }

    public Optional<ContractDecl> contract(String name) {
        return Optional.ofNullable(name == null ? null : contracts.get(name));
    }

    /** Contracts in project declaration order. */
    public Collection<ContractDecl> contracts() {
        return Collections.unmodifiableCollection(contracts.values());
    }

    /**
     * C3 linearization of {@code name}, most-derived first. Empty if the contract is unknown.
     *
     * @throws LinearizationException on cyclic or inconsistent inheritance
     */
    public List<String> linearization(String name) {
        if (!contains(name)) return Collections.emptyList();
        return linearize(name, new ArrayDeque<>());
    }

    public boolean isSubtypeOf(String sub, String sup) {
        return linearization(sub).contains(sup);
    }

    /** {@code name} itself and every transitive subtype, in declaration order. */
    public List<ContractDecl> subtypesOf(String name) {
        List<ContractDecl> result = new ArrayList<>();
        if (!contains(name)) return result;
        for (ContractDecl decl : contracts.values()) {
            if (isSubtypeOf(decl.name(), name)) {
                result.add(decl);
            }
        }
        return result;
    }

    /**
     * The implementation {@code signature} binds to when invoked on an instance of {@code contract}:
     * the first contract along the linearization that implements it.
     */
    public Optional<FunctionId> dispatch(String contract, String signature) {
        return firstImplementation(linearization(contract), signature);
    }

    /** Like {@link #dispatch} but skips {@code contract} itself, as {@code super.f()} does. */
    public Optional<FunctionId> dispatchSuper(String contract, String signature) {
        return dispatchSuper(contract, contract, signature);
    }

    /**
     * Target of {@code super.f()} written in {@code scope} when the running instance is
     * {@code runtime}: the first implementation after {@code scope} in the linearization of
     * {@code runtime}. Empty if {@code scope} is not a base of {@code runtime}.
     */
    public Optional<FunctionId> dispatchSuper(String runtime, String scope, String signature) {
        List<String> order = linearization(runtime);
        int at = order.indexOf(scope);
        if (at < 0) return Optional.empty();
        return firstImplementation(order.subList(at + 1, order.size()), signature);
    }

    private Optional<FunctionId> firstImplementation(List<String> order, String signature) {
        for (String name : order) {
            if (contracts.get(name).implementsFunction(signature)) {
                return Optional.of(new FunctionId(name, signature));
            }
        }
        return Optional.empty();
    }

    private List<String> linearize(String name, Deque<String> inProgress) {
        List<String> cached = linearizations.get(name);
        if (cached != null) return cached;
        if (inProgress.contains(name)) {
            throw new LinearizationException("Cyclic inheritance involving " + name);
        }
        inProgress.push(name);

        List<String> bases = new ArrayList<>();
        for (String base : contracts.get(name).bases()) {
            if (contracts.containsKey(base)) bases.add(base);
        }
        Collections.reverse(bases);

        List<List<String>> sequences = new ArrayList<>();
        for (String base : bases) {
            sequences.add(new ArrayList<>(linearize(base, inProgress)));
        }
        sequences.add(new ArrayList<>(bases));

        List<String> result = new ArrayList<>();
        result.add(name);
        result.addAll(merge(sequences, name));

        inProgress.pop();
        List<String> linearization = Collections.unmodifiableList(result);
        linearizations.put(name, linearization);
        return linearization;
    }

    private static List<String> merge(List<List<String>> sequences, String owner) {
        List<String> out = new ArrayList<>();
        while (true) {
            sequences.removeIf(List::isEmpty);
            if (sequences.isEmpty()) return out;

            String next = null;
            for (List<String> seq : sequences) {
                String head = seq.get(0);
                boolean inTail = sequences.stream().anyMatch(s -> s.indexOf(head) > 0);
                if (!inTail) {
                    next = head;
                    break;
                }
            }
            if (next == null) {
                throw new LinearizationException("Linearization of inheritance graph impossible for " + owner);
            }
            out.add(next);
            for (List<String> seq : sequences) {
                if (seq.get(0).equals(next)) seq.remove(0);
            }
        }
    }
}
