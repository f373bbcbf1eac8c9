package com.solicfg.builder.frontend;

import com.solicfg.builder.ir.ProjectInput;

/**
 * Source of the per-function CFGs and type declarations of one project.
 * Implementations must return the complete function set in a single call.
 */
public interface FrontEndAdapter {

    ProjectInput load();
}
