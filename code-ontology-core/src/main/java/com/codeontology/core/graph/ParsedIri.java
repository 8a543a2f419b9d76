package com.codeontology.core.graph;

import java.util.Objects;

/**
 * Components recovered from an IRI by {@link IriParser}.
 *
 * <p>Only the components meaningful for {@code kind} are set; the rest are null.
 *
 * @param kind recognised entity kind
 * @param baseIri base namespace including the trailing {@code #}, or null when the prefix
 *                could not be recovered
 * @param module decoded module name
 * @param function decoded function name
 * @param arity function arity
 * @param clause clause index (0-indexed)
 * @param parameter parameter index (0-indexed)
 * @param path decoded file path
 * @param startLine location start line
 * @param endLine location end line
 * @param repositoryHash repository hash segment
 * @param sha commit SHA
 */
public record ParsedIri(
    IriKind kind,
    String baseIri,
    String module,
    String function,
    Integer arity,
    Integer clause,
    Integer parameter,
    String path,
    Integer startLine,
    Integer endLine,
    String repositoryHash,
    String sha
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedIri {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    static ParsedIri module(String base, String module) {
        return new ParsedIri(IriKind.MODULE, base, module, null, null, null, null, null, null, null, null, null);
    }

    static ParsedIri function(String base, String module, String function, int arity) {
        return new ParsedIri(IriKind.FUNCTION, base, module, function, arity, null, null, null, null, null, null, null);
    }

    static ParsedIri clause(String base, String module, String function, Integer arity, int clause) {
        return new ParsedIri(IriKind.CLAUSE, base, module, function, arity, clause, null, null, null, null, null, null);
    }

    static ParsedIri parameter(String base, String module, String function, Integer arity, int clause, int parameter) {
        return new ParsedIri(IriKind.PARAMETER, base, module, function, arity, clause, parameter,
            null, null, null, null, null);
    }

    static ParsedIri file(String base, String path) {
        return new ParsedIri(IriKind.FILE, base, null, null, null, null, null, path, null, null, null, null);
    }

    static ParsedIri location(String base, String path, int startLine, int endLine) {
        return new ParsedIri(IriKind.LOCATION, base, null, null, null, null, null, path, startLine, endLine, null, null);
    }

    static ParsedIri repository(String base, String hash) {
        return new ParsedIri(IriKind.REPOSITORY, base, null, null, null, null, null, null, null, null, hash, null);
    }

    static ParsedIri commit(String base, String hash, String sha) {
        return new ParsedIri(IriKind.COMMIT, base, null, null, null, null, null, null, null, null, hash, sha);
    }
}
