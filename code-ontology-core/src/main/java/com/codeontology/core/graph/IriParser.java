package com.codeontology.core.graph;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers entity components from IRIs produced by {@link IriGenerator}.
 *
 * <p>Patterns are tried from most to least specific, so a parameter IRI is never mistaken
 * for a function IRI.
 */
public final class IriParser {

    private static final String MODULE_SEGMENT = "([A-Z][A-Za-z0-9_.%]*)";

    private static final Pattern PARAMETER = Pattern.compile("^(.+)/clause/(\\d+)/param/(\\d+)$");
    private static final Pattern CLAUSE = Pattern.compile("^(.+)/(\\d+)/clause/(\\d+)$");
    private static final Pattern LOCATION = Pattern.compile("^(.+)/L(\\d+)-(\\d+)$");
    private static final Pattern COMMIT = Pattern.compile("^(.+#repo/[a-f0-9]+)/commit/([a-f0-9]+)$");
    private static final Pattern REPOSITORY = Pattern.compile("^(.+#)repo/([a-f0-9]+)$");
    private static final Pattern FILE = Pattern.compile("^(.+#)file/(.+)$");
    private static final Pattern FUNCTION = Pattern.compile("^(.+#)" + MODULE_SEGMENT + "/([^/]+)/(\\d+)$");
    private static final Pattern FUNCTION_WITHOUT_ARITY = Pattern.compile("^(.+#)" + MODULE_SEGMENT + "/([^/]+)$");
    private static final Pattern MODULE = Pattern.compile("^(.+#)" + MODULE_SEGMENT + "$");

    private IriParser() {
        // Utility class - no instantiation
    }

    public static Optional<ParsedIri> parse(Iri iri) {
        return parse(iri.value());
    }

    /**
     * Parses an IRI into its components.
     *
     * @param iri IRI text
     * @return components, or empty when the IRI matches no known pattern
     */
    public static Optional<ParsedIri> parse(String iri) {
        if (iri == null) {
            return Optional.empty();
        }
        Matcher m = PARAMETER.matcher(iri);
        if (m.matches()) {
            return Optional.of(parameter(m.group(1), toInt(m.group(2)), toInt(m.group(3))));
        }
        m = CLAUSE.matcher(iri);
        if (m.matches()) {
            return Optional.of(clause(m.group(1), toInt(m.group(2)), toInt(m.group(3))));
        }
        m = LOCATION.matcher(iri);
        if (m.matches()) {
            return Optional.of(location(m.group(1), toInt(m.group(2)), toInt(m.group(3))));
        }
        m = COMMIT.matcher(iri);
        if (m.matches()) {
            Matcher repo = REPOSITORY.matcher(m.group(1));
            return Optional.of(repo.matches()
                ? ParsedIri.commit(repo.group(1), repo.group(2), m.group(2))
                : ParsedIri.commit(null, null, m.group(2)));
        }
        m = REPOSITORY.matcher(iri);
        if (m.matches()) {
            return Optional.of(ParsedIri.repository(m.group(1), m.group(2)));
        }
        m = FILE.matcher(iri);
        if (m.matches()) {
            return Optional.of(ParsedIri.file(m.group(1), IriGenerator.unescapeName(m.group(2))));
        }
        m = FUNCTION.matcher(iri);
        if (m.matches()) {
            return Optional.of(ParsedIri.function(m.group(1), IriGenerator.unescapeName(m.group(2)),
                IriGenerator.unescapeName(m.group(3)), toInt(m.group(4))));
        }
        m = MODULE.matcher(iri);
        if (m.matches()) {
            return Optional.of(ParsedIri.module(m.group(1), IriGenerator.unescapeName(m.group(2))));
        }
        return Optional.empty();
    }

    /**
     * Extracts the module name from a module, function, clause or parameter IRI.
     *
     * @param iri IRI text
     * @return module name, if the IRI carries one
     */
    public static Optional<String> moduleOf(String iri) {
        return parse(iri)
            .filter(p -> p.kind() == IriKind.MODULE || p.kind() == IriKind.FUNCTION
                || p.kind() == IriKind.CLAUSE || p.kind() == IriKind.PARAMETER)
            .map(ParsedIri::module);
    }

    /**
     * Extracts {@code Module/name/arity} from a function, clause or parameter IRI.
     *
     * @param iri IRI text
     * @return the function components, if the IRI carries them
     */
    public static Optional<ParsedIri> functionOf(String iri) {
        return parse(iri)
            .filter(p -> p.kind() == IriKind.FUNCTION || p.kind() == IriKind.CLAUSE
                || p.kind() == IriKind.PARAMETER)
            .filter(p -> p.function() != null)
            .map(p -> ParsedIri.function(p.baseIri(), p.module(), p.function(), p.arity()));
    }

    private static ParsedIri parameter(String clauseParent, int clause, int parameter) {
        Matcher f = FUNCTION.matcher(clauseParent);
        if (f.matches()) {
            return ParsedIri.parameter(f.group(1), IriGenerator.unescapeName(f.group(2)),
                IriGenerator.unescapeName(f.group(3)), toInt(f.group(4)), clause, parameter);
        }
        return ParsedIri.parameter(null, null, null, null, clause, parameter);
    }

    private static ParsedIri clause(String functionPrefix, int arity, int clause) {
        Matcher f = FUNCTION_WITHOUT_ARITY.matcher(functionPrefix);
        if (f.matches()) {
            return ParsedIri.clause(f.group(1), IriGenerator.unescapeName(f.group(2)),
                IriGenerator.unescapeName(f.group(3)), arity, clause);
        }
        return ParsedIri.clause(null, null, null, arity, clause);
    }

    private static ParsedIri location(String fileIri, int startLine, int endLine) {
        Matcher f = FILE.matcher(fileIri);
        if (f.matches()) {
            return ParsedIri.location(f.group(1), IriGenerator.unescapeName(f.group(2)), startLine, endLine);
        }
        return ParsedIri.location(null, null, startLine, endLine);
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
