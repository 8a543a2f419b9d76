package com.codeontology.core.directive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves short module names through the aliases in effect.
 *
 * <p>Built from directives in traversal order; when two directives bind the same short name,
 * the first one wins. {@code require ..., as:} also defines an alias.
 */
public final class AliasResolver {

    private final Map<String, List<String>> aliases;

    private AliasResolver(Map<String, List<String>> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static AliasResolver empty() {
        return new AliasResolver(new LinkedHashMap<>());
    }

    /**
     * Creates a resolver from directives in traversal order.
     *
     * @param directives directives, typically from {@link ScopeTracker}
     * @return resolver
     */
    public static AliasResolver from(List<? extends Directive> directives) {
        Objects.requireNonNull(directives, "directives must not be null");
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        for (Directive directive : directives) {
            if (directive instanceof AliasDirective alias) {
                aliases.putIfAbsent(alias.as(), alias.source());
            } else if (directive instanceof RequireDirective require && require.as() != null) {
                aliases.putIfAbsent(require.as(), require.source());
            }
        }
        return new AliasResolver(aliases);
    }

    public Map<String, List<String>> aliases() {
        return aliases;
    }

    public Optional<List<String>> lookup(String shortName) {
        return Optional.ofNullable(aliases.get(shortName));
    }

    /**
     * Expands a leading alias.
     *
     * @param segments module reference as written
     * @return full segments; unchanged when the first segment is not an alias
     */
    public List<String> resolve(List<String> segments) {
        if (segments.isEmpty()) {
            return segments;
        }
        List<String> target = aliases.get(segments.get(0));
        if (target == null) {
            return segments;
        }
        List<String> resolved = new ArrayList<>(target);
        resolved.addAll(segments.subList(1, segments.size()));
        return List.copyOf(resolved);
    }

    public String resolve(String dotted) {
        if (dotted == null || dotted.isEmpty() || dotted.startsWith(":")) {
            return dotted;
        }
        return String.join(".", resolve(List.of(dotted.split("\\."))));
    }
}
