package com.codeontology.core.model;

import java.util.Locale;

/**
 * Whether the module providing a macro is known.
 */
public enum ResolutionStatus {
    /** Provided by Kernel or Kernel.SpecialForms. */
    KERNEL,
    /** Qualified or resolved through an import or require. */
    RESOLVED,
    /** Provider unknown. */
    UNRESOLVED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
