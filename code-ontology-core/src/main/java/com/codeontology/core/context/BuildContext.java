package com.codeontology.core.context;

import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration shared by all builders of one extraction run.
 *
 * <p>Every {@code with*} method returns a modified copy; the original is never changed, so a
 * context can be handed to concurrently running builders without locking.
 *
 * <p>The expression counter is state passed explicitly: {@link #nextCounter()} returns the
 * current value together with a context whose counter is advanced, and a builder that consumes
 * counter values returns that advanced context to its caller. No counter is shared between
 * threads.
 *
 * <pre>{@code
 * BuildContext context = BuildContext.of("https://example.org/code#")
 *     .withFilePath("lib/my_app/users.ex")
 *     .withMetadata("module", "MyApp.Users")
 *     .withConfig(Map.of(BuildContext.INCLUDE_EXPRESSIONS, true));
 *
 * BuildContext.Counted step = context.nextCounter();
 * Iri expr = IriGenerator.forExpression(context.baseIri(), "MyApp.Users", step.value());
 * context = step.context();
 * }</pre>
 *
 * @param baseIri base namespace for generated IRIs, ending in {@code #} or {@code /}
 * @param filePath source file path relative to the project root, or null
 * @param parentModule enclosing module for nested modules, or null
 * @param config feature flags and builder settings
 * @param metadata per-call values such as the current {@code module}
 * @param knownModules modules belonging to the analysed project, or null when not configured
 * @param counter next expression counter value
 * @since 1.0.0
 */
public record BuildContext(
    String baseIri,
    String filePath,
    String parentModule,
    Map<String, Object> config,
    Map<String, Object> metadata,
    Set<String> knownModules,
    int counter
) {
    /** Config flag enabling expression-level extraction. */
    public static final String INCLUDE_EXPRESSIONS = "include_expressions";
    /** Metadata key holding the module currently being built. */
    public static final String MODULE = "module";

    /**
     * Compact constructor with validation.
     */
    public BuildContext {
        if (baseIri == null || baseIri.isBlank()) {
            throw new IllegalArgumentException("baseIri must not be null or blank");
        }
        if (counter < 0) {
            throw new IllegalArgumentException("counter must be >= 0, got " + counter);
        }
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        knownModules = knownModules != null ? Collections.unmodifiableSet(new LinkedHashSet<>(knownModules)) : null;
    }

    public static BuildContext of(String baseIri) {
        return new BuildContext(baseIri, null, null, Map.of(), Map.of(), null, 0);
    }

    // ==================== Copy-on-write ====================

    public BuildContext withFilePath(String newFilePath) {
        return new BuildContext(baseIri, newFilePath, parentModule, config, metadata, knownModules, counter);
    }

    public BuildContext withParentModule(String newParentModule) {
        return new BuildContext(baseIri, filePath, newParentModule, config, metadata, knownModules, counter);
    }

    /**
     * Returns a copy with additional configuration merged over the existing entries.
     *
     * @param extra entries to add or replace
     * @return updated context
     */
    public BuildContext withConfig(Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(config);
        merged.putAll(extra);
        return new BuildContext(baseIri, filePath, parentModule, merged, metadata, knownModules, counter);
    }

    /**
     * Returns a copy with additional metadata merged over the existing entries.
     *
     * @param extra entries to add or replace
     * @return updated context
     */
    public BuildContext withMetadata(Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new BuildContext(baseIri, filePath, parentModule, config, merged, knownModules, counter);
    }

    public BuildContext withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new BuildContext(baseIri, filePath, parentModule, config, merged, knownModules, counter);
    }

    public BuildContext withModule(String moduleName) {
        return withMetadata(MODULE, moduleName);
    }

    public BuildContext withKnownModules(Collection<String> modules) {
        Set<String> known = modules == null ? null : new LinkedHashSet<>(modules);
        return new BuildContext(baseIri, filePath, parentModule, config, metadata, known, counter);
    }

    // ==================== Counter ====================

    /**
     * Returns a copy whose counter starts from zero.
     *
     * <p>Called once at the start of every independent extraction run.
     *
     * @return context with counter 0
     */
    public BuildContext withCounterReset() {
        return new BuildContext(baseIri, filePath, parentModule, config, metadata, knownModules, 0);
    }

    /**
     * Takes the current counter value.
     *
     * @return the value and a context whose counter is one higher
     */
    public Counted nextCounter() {
        BuildContext advanced = new BuildContext(baseIri, filePath, parentModule, config, metadata,
            knownModules, counter + 1);
        return new Counted(counter, advanced);
    }

    /**
     * Counter value paired with the context to continue with.
     *
     * @param value counter value to use
     * @param context context to use for subsequent calls
     */
    public record Counted(int value, BuildContext context) {
        public Counted {
            Objects.requireNonNull(context, "context must not be null");
        }
    }

    // ==================== Queries ====================

    public boolean includeExpressions() {
        return isEnabled(INCLUDE_EXPRESSIONS);
    }

    /**
     * Returns whether a boolean config flag is set.
     *
     * @param flag flag name
     * @return true only when the flag is present and true
     */
    public boolean isEnabled(String flag) {
        return Boolean.TRUE.equals(config.get(flag));
    }

    /**
     * Returns a config value or a default.
     *
     * @param key config key
     * @param defaultValue value returned when the key is absent or has another type
     * @param <T> value type
     * @return config value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T configOrDefault(String key, T defaultValue) {
        Object value = config.get(key);
        if (value == null || (defaultValue != null && !defaultValue.getClass().isInstance(value))) {
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * Returns the module being built: the {@code module} metadata entry, else the parent module.
     *
     * @return module name, if any
     */
    public Optional<String> currentModule() {
        Object module = metadata.get(MODULE);
        if (module instanceof String name && !name.isBlank()) {
            return Optional.of(name);
        }
        return Optional.ofNullable(parentModule);
    }

    /**
     * Returns the module being built or fails loudly.
     *
     * @param operation what needs the module, for the error message
     * @return module name
     * @throws IllegalStateException if no module context is available
     */
    public String requireModule(String operation) {
        return currentModule().orElseThrow(() -> new IllegalStateException(
            operation + " requires module context: set the '" + MODULE + "' metadata or a parent module"));
    }

    public boolean hasKnownModules() {
        return knownModules != null;
    }

    /**
     * Returns whether a module belongs to the analysed project.
     *
     * @param moduleName dotted module name
     * @return true if known; always false when no known-module set is configured
     */
    public boolean isModuleKnown(String moduleName) {
        return knownModules != null && knownModules.contains(moduleName);
    }

    public Iri moduleIri(String moduleName) {
        return IriGenerator.forModule(baseIri, moduleName);
    }

    public Optional<Iri> fileIri() {
        return Optional.ofNullable(filePath).map(path -> IriGenerator.forSourceFile(baseIri, path));
    }

    /**
     * Returns the IRI anonymous entities hang off: the current module, else the file, else
     * {@code base + fallback}.
     *
     * @param fallback suffix used when neither module nor file is known
     * @return context IRI
     */
    public Iri contextIri(String fallback) {
        Optional<String> module = currentModule();
        if (module.isPresent()) {
            return moduleIri(module.get());
        }
        return fileIri().orElseGet(() -> new Iri(baseIri + fallback));
    }
}
