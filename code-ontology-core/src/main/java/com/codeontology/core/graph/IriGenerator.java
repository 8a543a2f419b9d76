package com.codeontology.core.graph;

import com.codeontology.core.util.ContentHash;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Deterministic IRI construction for every code entity.
 *
 * <p>IRIs embed the logical path of the entity so that they stay human-traceable:
 * <pre>{@code
 * https://example.org/code#MyApp.Users                      module
 * https://example.org/code#MyApp.Users/get_user/1           function
 * https://example.org/code#MyApp.Users/get_user/1/clause/0  first clause
 * https://example.org/code#MyApp.Users/get_user/1/clause/0/param/0
 * https://example.org/code#file/lib/users.ex/L10-25         source location
 * }</pre>
 *
 * <p>Path indices are 0-indexed. Ordinal data properties stored on the entities themselves
 * ({@code clauseOrder}, {@code parameterPosition}) are 1-indexed; the two conventions are
 * deliberately kept apart.
 *
 * <p>Names are percent-encoded byte-wise except for {@code [A-Za-z0-9_.-]}, so
 * {@code valid?} becomes {@code valid%3F}.
 *
 * @see IriParser
 * @since 1.0.0
 */
public final class IriGenerator {

    private static final int REPOSITORY_HASH_LENGTH = 8;
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private IriGenerator() {
        // Utility class - no instantiation
    }

    // ==================== Escaping ====================

    /**
     * Percent-encodes a name for use as one IRI path segment.
     *
     * @param name raw name
     * @return encoded name
     */
    public static String escapeName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        StringBuilder sb = new StringBuilder(name.length());
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isSafe(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escapeName(String)}.
     *
     * @param escaped encoded name
     * @return decoded name
     */
    public static String unescapeName(String escaped) {
        Objects.requireNonNull(escaped, "escaped must not be null");
        byte[] bytes = escaped.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '%' && i + 2 < bytes.length) {
                int hi = Character.digit(bytes[i + 1], 16);
                int lo = Character.digit(bytes[i + 2], 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    i += 2;
                    continue;
                }
            }
            out.write(bytes[i]);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static boolean isSafe(int c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || c == '_' || c == '.' || c == '-';
    }

    // ==================== Code structure ====================

    /**
     * Generates the IRI of a module.
     *
     * @param baseIri base namespace, ending in {@code #} or {@code /}
     * @param moduleName dotted module name; a leading {@code Elixir.} is dropped
     * @return module IRI
     */
    public static Iri forModule(String baseIri, String moduleName) {
        requireBase(baseIri);
        return new Iri(baseIri + escapeName(moduleString(moduleName)));
    }

    /**
     * Generates the IRI of a function, identified by module, name and arity.
     *
     * @param baseIri base namespace
     * @param module dotted module name
     * @param functionName function name
     * @param arity function arity
     * @return function IRI
     */
    public static Iri forFunction(String baseIri, String module, String functionName, int arity) {
        requireBase(baseIri);
        requireNonNegative(arity, "arity");
        return new Iri(baseIri + escapeName(moduleString(module)) + "/"
            + escapeName(functionName) + "/" + arity);
    }

    public static Iri forClause(Iri functionIri, int index) {
        requireNonNegative(index, "clause index");
        return functionIri.resolve("/clause/" + index);
    }

    public static Iri forParameter(Iri clauseIri, int index) {
        requireNonNegative(index, "parameter index");
        return clauseIri.resolve("/param/" + index);
    }

    /**
     * Generates the IRI of a type definition.
     *
     * @param baseIri base namespace
     * @param module owning module
     * @param typeName type name
     * @param arity number of type parameters
     * @return type IRI
     */
    public static Iri forType(String baseIri, String module, String typeName, int arity) {
        requireBase(baseIri);
        requireNonNegative(arity, "arity");
        return new Iri(baseIri + escapeName(moduleString(module)) + "/type/"
            + escapeName(typeName) + "/" + arity);
    }

    /**
     * Generates the IRI of a behaviour callback declaration.
     *
     * <p>Callbacks live under {@code /callback/} so that a module may define both a callback and
     * a function with the same name and arity.
     *
     * @param behaviourIri module IRI of the behaviour
     * @param name callback name
     * @param arity callback arity
     * @return callback IRI
     */
    public static Iri forCallback(Iri behaviourIri, String name, int arity) {
        requireNonNegative(arity, "arity");
        return behaviourIri.resolve("/callback/" + escapeName(name) + "/" + arity);
    }

    public static Iri forStructField(Iri structIri, String fieldName) {
        return structIri.resolve("/field/" + escapeName(fieldName));
    }

    /**
     * Generates the IRI of a protocol implementation.
     *
     * @param baseIri base namespace
     * @param protocol protocol module name
     * @param forType implemented data type
     * @return implementation IRI ({@code Protocol.for.Type})
     */
    public static Iri forProtocolImplementation(String baseIri, String protocol, String forType) {
        requireBase(baseIri);
        return new Iri(baseIri + escapeName(moduleString(protocol)) + ".for." + escapeName(moduleString(forType)));
    }

    public static Iri forAnonymousFunction(Iri contextIri, int index) {
        requireNonNegative(index, "anonymous function index");
        return contextIri.resolve("/anon/" + index);
    }

    public static Iri forAnonymousClause(Iri anonymousIri, int index) {
        requireNonNegative(index, "clause index");
        return anonymousIri.resolve("/clause/" + index);
    }

    /**
     * Generates the IRI of a capture expression. {@code &} cannot start a function name, so
     * the segment never meets a function IRI.
     *
     * @param contextIri enclosing module
     * @param index capture index within the module (0-indexed)
     * @return capture IRI ({@code {context}/&/{index}})
     */
    public static Iri forCapture(Iri contextIri, int index) {
        requireNonNegative(index, "capture index");
        return contextIri.resolve("/&/" + index);
    }

    public static Iri forCapturedVariable(Iri anonymousIri, String variableName) {
        return anonymousIri.resolve("/capture/" + escapeName(variableName));
    }

    // ==================== Directives and attributes ====================

    public static Iri forAlias(Iri moduleIri, int index) {
        return directive(moduleIri, "alias", index);
    }

    public static Iri forImport(Iri moduleIri, int index) {
        return directive(moduleIri, "import", index);
    }

    public static Iri forRequire(Iri moduleIri, int index) {
        return directive(moduleIri, "require", index);
    }

    public static Iri forUse(Iri moduleIri, int index) {
        return directive(moduleIri, "use", index);
    }

    private static Iri directive(Iri moduleIri, String kind, int index) {
        requireNonNegative(index, kind + " index");
        return moduleIri.resolve("/" + kind + "/" + index);
    }

    /**
     * Generates the IRI of a module attribute occurrence.
     *
     * @param baseIri base namespace
     * @param module owning module
     * @param attributeName attribute name without {@code @}
     * @param index occurrence index, or null for the single occurrence
     * @return attribute IRI
     */
    public static Iri forAttribute(String baseIri, String module, String attributeName, Integer index) {
        requireBase(baseIri);
        String iri = baseIri + escapeName(moduleString(module)) + "/attribute/" + escapeName(attributeName);
        if (index != null) {
            requireNonNegative(index, "attribute index");
            iri = iri + "/" + index;
        }
        return new Iri(iri);
    }

    // ==================== Calls, control flow, metaprogramming ====================

    /**
     * Generates the IRI of a call site inside a function.
     *
     * @param baseIri base namespace
     * @param module caller module
     * @param function caller function name
     * @param arity caller arity
     * @param index call index within the caller (0-indexed)
     * @return call IRI
     */
    public static Iri forCall(String baseIri, String module, String function, int arity, int index) {
        requireBase(baseIri);
        requireNonNegative(index, "call index");
        return new Iri(baseIri + "call/" + functionPath(module, function, arity) + "/" + index);
    }

    /**
     * Generates the IRI of a control-flow expression inside a function.
     *
     * @param baseIri base namespace
     * @param kind expression keyword ({@code if}, {@code case}, {@code try}, ...)
     * @param module enclosing module
     * @param function enclosing function name
     * @param arity enclosing function arity
     * @param index expression index within the function for that kind (0-indexed)
     * @return control-flow IRI
     */
    public static Iri forControlFlow(String baseIri, String kind, String module, String function,
                                     int arity, int index) {
        requireBase(baseIri);
        requireNonNegative(index, "control flow index");
        return new Iri(baseIri + escapeName(kind) + "/" + functionPath(module, function, arity) + "/" + index);
    }

    public static Iri forQuote(String baseIri, String module, int index) {
        requireBase(baseIri);
        requireNonNegative(index, "quote index");
        return new Iri(baseIri + escapeName(moduleString(module)) + "/quote/" + index);
    }

    public static Iri forUnquote(Iri quoteIri, int index) {
        requireNonNegative(index, "unquote index");
        return quoteIri.resolve("/unquote/" + index);
    }

    public static Iri forHygieneViolation(Iri quoteIri, int index) {
        requireNonNegative(index, "violation index");
        return quoteIri.resolve("/violation/" + index);
    }

    public static Iri forMacroInvocation(String baseIri, String module, String macroId, int index) {
        requireBase(baseIri);
        requireNonNegative(index, "invocation index");
        return new Iri(baseIri + escapeName(moduleString(module)) + "/invocation/"
            + escapeName(macroId) + "/" + index);
    }

    public static Iri forChildSpec(Iri supervisorIri, String childId, int index) {
        requireNonNegative(index, "child index");
        return supervisorIri.resolve("/child/" + escapeName(childId) + "/" + index);
    }

    /**
     * Generates the IRI of an expression node outside any module.
     *
     * @param baseIri base namespace
     * @param counter counter value taken from the build context
     * @return expression IRI ({@code {base}expr/{counter}})
     */
    public static Iri forExpression(String baseIri, int counter) {
        requireBase(baseIri);
        requireNonNegative(counter, "expression counter");
        return new Iri(baseIri + "expr/" + counter);
    }

    /**
     * Generates the IRI of an expression node built inside a module.
     *
     * <p>The counter restarts for every module, so the module is part of the IRI.
     *
     * @param baseIri base namespace
     * @param module enclosing module, or null for the unscoped form
     * @param counter counter value taken from the build context
     * @return expression IRI ({@code {base}expr/{module}/{counter}})
     */
    public static Iri forExpression(String baseIri, String module, int counter) {
        if (module == null) {
            return forExpression(baseIri, counter);
        }
        requireBase(baseIri);
        requireNonNegative(counter, "expression counter");
        return new Iri(baseIri + "expr/" + escapeName(moduleString(module)) + "/" + counter);
    }

    // ==================== Files and provenance ====================

    /**
     * Generates the IRI of a source file.
     *
     * @param baseIri base namespace
     * @param relativePath path relative to the project root; backslashes become slashes
     * @return file IRI
     */
    public static Iri forSourceFile(String baseIri, String relativePath) {
        requireBase(baseIri);
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        String[] segments = relativePath.replace('\\', '/').split("/", -1);
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                path.append('/');
            }
            path.append(escapeName(segments[i]));
        }
        return new Iri(baseIri + "file/" + path);
    }

    public static Iri forSourceLocation(Iri fileIri, int startLine, int endLine) {
        return fileIri.resolve("/L" + startLine + "-" + endLine);
    }

    /**
     * Generates the IRI of a repository from its URL.
     *
     * @param baseIri base namespace
     * @param repositoryUrl clone or browse URL
     * @return repository IRI ({@code repo/} + first 8 hex chars of the URL's SHA-256)
     */
    public static Iri forRepository(String baseIri, String repositoryUrl) {
        requireBase(baseIri);
        return new Iri(baseIri + "repo/" + ContentHash.shortHash(repositoryUrl, REPOSITORY_HASH_LENGTH));
    }

    public static Iri forCommit(Iri repositoryIri, String sha) {
        Objects.requireNonNull(sha, "sha must not be null");
        return repositoryIri.resolve("/commit/" + sha);
    }

    // ==================== Internals ====================

    private static String functionPath(String module, String function, int arity) {
        requireNonNegative(arity, "arity");
        return escapeName(moduleString(module)) + "/" + escapeName(function) + "/" + arity;
    }

    static String moduleString(String module) {
        Objects.requireNonNull(module, "module must not be null");
        return module.startsWith("Elixir.") ? module.substring("Elixir.".length()) : module;
    }

    private static void requireBase(String baseIri) {
        if (baseIri == null || baseIri.isBlank()) {
            throw new IllegalArgumentException("baseIri must not be null or blank");
        }
    }

    private static void requireNonNegative(int value, String what) {
        if (value < 0) {
            throw new IllegalArgumentException(what + " must be >= 0, got " + value);
        }
    }
}
