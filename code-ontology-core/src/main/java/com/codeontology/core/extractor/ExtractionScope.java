package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.directive.AliasResolver;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.directive.DirectiveKind;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Module-wide facts the entity extractors share: the module name and its directives.
 *
 * @param module fully qualified module name
 * @param directives scope-tagged directives of the module body
 * @param aliases alias resolver built from {@code directives}
 */
public record ExtractionScope(String module, List<Directive> directives, AliasResolver aliases) {

    public ExtractionScope {
        Objects.requireNonNull(module, "module must not be null");
        directives = directives != null ? List.copyOf(directives) : List.of();
        if (aliases == null) {
            aliases = AliasResolver.from(directives);
        }
    }

    public static ExtractionScope of(String module, List<Directive> directives) {
        return new ExtractionScope(module, directives, null);
    }

    public static ExtractionScope of(String module) {
        return new ExtractionScope(module, List.of(), AliasResolver.empty());
    }

    /**
     * Resolves a module reference to a fully qualified name.
     *
     * <p>Aliases are expanded, {@code __MODULE__} is the current module and Erlang modules
     * keep their leading colon.
     *
     * @param reference module reference node
     * @return module name, or empty when the node is not a static module reference
     */
    public Optional<String> resolveModule(SyntaxNode reference) {
        if (reference == null) {
            return Optional.empty();
        }
        if (reference.is(NodeTag.VARIABLE) && "__MODULE__".equals(reference.name())) {
            return Optional.of(module);
        }
        if (reference.is(NodeTag.MODULE_NAME)) {
            String name = reference.name();
            if (name != null && name.startsWith("__MODULE__.")) {
                return Optional.of(module + name.substring("__MODULE__".length()));
            }
            return Optional.ofNullable(name).map(aliases::resolve);
        }
        return SyntaxNodes.moduleNameOf(reference);
    }

    /**
     * Returns the modules named by directives of one kind.
     *
     * @param kind directive kind
     * @return dotted module names in first-occurrence order
     */
    public Set<String> modulesOf(DirectiveKind kind) {
        return directives.stream()
            .filter(directive -> directive.kind() == kind)
            .map(Directive::sourceName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean uses(String moduleName) {
        return modulesOf(DirectiveKind.USE).contains(moduleName);
    }
}
