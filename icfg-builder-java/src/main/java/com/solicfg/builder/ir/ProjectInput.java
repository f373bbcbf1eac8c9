package com.solicfg.builder.ir;

import java.util.List;

/**
 * Everything the front end hands to the core for one project: the type declarations
 * the call resolver needs and the FunctionGraph of every implemented function.
 */
public record ProjectInput(
    String projectName,
    List<ContractDecl> contracts,
    List<FunctionGraph> functions
) {
    public ProjectInput {
        contracts = List.copyOf(contracts);
        functions = List.copyOf(functions);
    }
}
