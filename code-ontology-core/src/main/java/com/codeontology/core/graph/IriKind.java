package com.codeontology.core.graph;

/**
 * Entity kinds recognisable from the shape of an IRI.
 */
public enum IriKind {
    /** {@code base#Module} */
    MODULE,
    /** {@code base#Module/name/arity} */
    FUNCTION,
    /** {@code .../arity/clause/N} */
    CLAUSE,
    /** {@code .../clause/N/param/M} */
    PARAMETER,
    /** {@code base#file/path} */
    FILE,
    /** {@code base#file/path/Lstart-end} */
    LOCATION,
    /** {@code base#repo/hash} */
    REPOSITORY,
    /** {@code base#repo/hash/commit/sha} */
    COMMIT
}
