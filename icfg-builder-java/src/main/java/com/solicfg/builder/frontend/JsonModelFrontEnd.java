package com.solicfg.builder.frontend;

import com.solicfg.builder.ir.*;

import java.nio.file.Path;
import java.util.*;

/**
 * FrontEndAdapter over a project model JSON file.
 *
 * Converts the model into ContractDecls and FunctionGraphs:
 * unimplemented functions are skipped, the entry defaults to the first node, and
 * when no node is flagged as exit every node without successors is an exit.
 */
public class JsonModelFrontEnd implements FrontEndAdapter {

    private final Path modelPath;

    public JsonModelFrontEnd(Path modelPath) {
        this.modelPath = modelPath;
    }

    @Override
    public ProjectInput load() {
        return convert(new ProjectModelReader().read(modelPath));
    }

    /**
     * Converts an already deserialized model.
     *
     * @throws ProjectModelReader.ModelReadException on unknown kinds or missing names
     */
    public static ProjectInput convert(ProjectModel.ModelRoot root) {
        List<ContractDecl> contracts = new ArrayList<>();
        List<FunctionGraph> functions = new ArrayList<>();

        for (ProjectModel.ModelContract mc : root.contracts) {
            if (mc.name == null || mc.name.isEmpty()) {
                throw new ProjectModelReader.ModelReadException("Contract without a name in project " + root.project);
            }
            Set<String> implemented = new LinkedHashSet<>();
            for (ProjectModel.ModelFunction mf : orEmpty(mc.functions)) {
                if (mf.signature == null || mf.signature.isEmpty()) {
                    throw new ProjectModelReader.ModelReadException("Function without a signature in " + mc.name);
                }
                if (!isImplemented(mf)) {
                    continue;
                }
                implemented.add(mf.signature);
                functions.add(toFunctionGraph(new FunctionId(mc.name, mf.signature), mf));
            }
            contracts.add(new ContractDecl(mc.name, contractKind(mc), orEmpty(mc.bases), implemented));
        }

        String name = root.project != null ? root.project : "unknown";
        return new ProjectInput(name, contracts, functions);
    }

    private static boolean isImplemented(ProjectModel.ModelFunction mf) {
        boolean flagged = mf.implemented == null || mf.implemented;
        return flagged && mf.nodes != null && !mf.nodes.isEmpty();
    }

    private static FunctionGraph toFunctionGraph(FunctionId id, ProjectModel.ModelFunction mf) {
        List<FunctionGraph.Statement> nodes = new ArrayList<>();
        List<FunctionGraph.Flow> flows = new ArrayList<>();
        Integer entry = null;
        List<Integer> flaggedExits = new ArrayList<>();
        List<Integer> leaves = new ArrayList<>();

        for (ProjectModel.ModelNode mn : mf.nodes) {
            String label = mn.label != null && !mn.label.isEmpty() ? mn.label : id.scope() + "::" + id.signature();
            String repr = mn.repr != null ? mn.repr : "";
            List<CallTarget> calls = new ArrayList<>();
            for (ProjectModel.ModelCall call : orEmpty(mn.calls)) {
                calls.add(new CallTarget(callKind(call, id), call.contract, call.function));
            }
            nodes.add(new FunctionGraph.Statement(mn.id, label, repr, calls));

            if (mn.entry && entry == null) entry = mn.id;
            if (mn.exit) flaggedExits.add(mn.id);
            List<Integer> sons = orEmpty(mn.sons);
            if (sons.isEmpty()) leaves.add(mn.id);
            for (int son : sons) {
                flows.add(new FunctionGraph.Flow(mn.id, son));
            }
        }

        int entryId = entry != null ? entry : mf.nodes.get(0).id;
        List<Integer> exits = flaggedExits.isEmpty() ? leaves : flaggedExits;
        return new FunctionGraph(id, nodes, entryId, exits, flows);
    }

    private static ContractKind contractKind(ProjectModel.ModelContract mc) {
        if (mc.kind == null) return ContractKind.CONTRACT;
        return switch (mc.kind) {
            case "contract" -> ContractKind.CONTRACT;
            case "abstract" -> ContractKind.ABSTRACT;
            case "interface" -> ContractKind.INTERFACE;
            case "library" -> ContractKind.LIBRARY;
            default -> throw new ProjectModelReader.ModelReadException(
                    "Unknown contract kind '" + mc.kind + "' for " + mc.name);
        };
    }

    private static CallKind callKind(ProjectModel.ModelCall call, FunctionId caller) {
        if (call.kind == null) {
            throw new ProjectModelReader.ModelReadException("Call without a kind in " + caller);
        }
        return switch (call.kind) {
            case "internal" -> CallKind.INTERNAL;
            case "super" -> CallKind.SUPER;
            case "high_level" -> CallKind.HIGH_LEVEL;
            case "library" -> CallKind.LIBRARY;
            case "low_level" -> CallKind.LOW_LEVEL;
            default -> throw new ProjectModelReader.ModelReadException(
                    "Unknown call kind '" + call.kind + "' in " + caller);
        };
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
