package com.solicfg.builder.ir;

import java.util.List;
import java.util.Set;

/**
 * A contract, interface or library of the scanned project.
 *
 * @param name                   contract name, unique within the project
 * @param kind                   contract / abstract / interface / library
 * @param bases                  direct bases in declaration order (most-base first)
 * @param implementedSignatures  signatures of the functions this contract itself implements
 */
public record ContractDecl(
    String name,
    ContractKind kind,
    List<String> bases,
    Set<String> implementedSignatures
) {
    public ContractDecl {
        bases = List.copyOf(bases);
        implementedSignatures = Set.copyOf(implementedSignatures);
    }

    public boolean implementsFunction(String signature) {
        return implementedSignatures.contains(signature);
    }
}
