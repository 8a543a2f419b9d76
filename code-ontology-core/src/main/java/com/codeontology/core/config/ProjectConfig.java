package com.codeontology.core.config;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.directive.DirectiveExtractor;
import com.codeontology.core.directive.ScopeTracker;
import com.codeontology.core.extractor.ModuleExtractor;
import com.codeontology.core.extractor.SourceUnitExtractor;
import com.codeontology.core.orchestrator.BuilderKind;
import com.codeontology.core.orchestrator.Orchestrator;
import com.codeontology.core.orchestrator.OrchestratorOptions;
import com.codeontology.core.orchestrator.Pipeline;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration for code-ontology runs.
 *
 * <p>Loaded from {@code code-ontology.yaml}. Every section is optional; missing values fall
 * back to the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my_app"
 *
 * graph:
 *   baseIri: "https://example.org/my_app#"
 *   includeExpressions: true
 *   knownModules:
 *     - MyApp.Users
 *     - MyApp.Repo
 *
 * orchestrator:
 *   parallel: true
 *   timeoutMillis: 5000
 *   exclude:
 *     - macro_invocations
 *
 * directives:
 *   maxNestingDepth: 10
 * }</pre>
 *
 * @param project project metadata
 * @param graph graph identity and extraction depth
 * @param orchestrator builder selection and scheduling
 * @param directives directive resolution limits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("graph") GraphConfig graph,
    @JsonProperty("orchestrator") OrchestratorConfig orchestrator,
    @JsonProperty("directives") DirectiveConfig directives
) {
    public static final String DEFAULT_BASE_IRI = "https://example.org/code#";

    /**
     * Compact constructor filling absent sections.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("project", null);
        }
        if (graph == null) {
            graph = new GraphConfig(DEFAULT_BASE_IRI, false, null);
        }
        if (orchestrator == null) {
            orchestrator = new OrchestratorConfig(true, OrchestratorOptions.DEFAULT_TIMEOUT.toMillis(), List.of(), List.of());
        }
        if (directives == null) {
            directives = new DirectiveConfig(DirectiveExtractor.DEFAULT_MAX_NESTING_DEPTH);
        }
    }

    /**
     * Creates the default configuration: example base IRI, no expressions, all builders in
     * parallel with a 5 second timeout.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Creates the base build context described by this configuration.
     *
     * @return context with base IRI, expression flag and known modules
     */
    public BuildContext toBuildContext() {
        BuildContext context = BuildContext.of(graph.effectiveBaseIri())
            .withConfig(Map.of(BuildContext.INCLUDE_EXPRESSIONS, graph.effectiveIncludeExpressions()));
        if (graph.knownModules() != null && !graph.knownModules().isEmpty()) {
            context = context.withKnownModules(graph.knownModules());
        }
        return context;
    }

    /**
     * Creates the orchestrator options described by this configuration.
     *
     * @return options; unknown builder ids are logged and ignored
     */
    public OrchestratorOptions toOrchestratorOptions() {
        return new OrchestratorOptions(
            OrchestratorConfig.kinds(orchestrator.include()),
            OrchestratorConfig.kinds(orchestrator.exclude()),
            orchestrator.parallel() == null || orchestrator.parallel(),
            orchestrator.timeoutMillis() == null || orchestrator.timeoutMillis() <= 0
                ? OrchestratorOptions.DEFAULT_TIMEOUT
                : Duration.ofMillis(orchestrator.timeoutMillis()));
    }

    /**
     * Creates a pipeline whose directive resolution and orchestration follow this configuration.
     *
     * @return configured pipeline
     */
    public Pipeline toPipeline() {
        return new Pipeline(toExtractor(), new Orchestrator(), toOrchestratorOptions());
    }

    /**
     * Creates a source unit extractor honouring the configured directive nesting limit.
     *
     * @return configured extractor
     */
    public SourceUnitExtractor toExtractor() {
        DirectiveExtractor directiveExtractor = new DirectiveExtractor(directives.effectiveMaxNestingDepth());
        return new SourceUnitExtractor(new ModuleExtractor(new ScopeTracker(directiveExtractor)));
    }

    /**
     * Returns a copy using another base IRI.
     *
     * @param newBaseIri namespace of generated IRIs
     * @return updated configuration
     */
    public ProjectConfig withBaseIri(String newBaseIri) {
        return new ProjectConfig(project,
            new GraphConfig(newBaseIri, graph.includeExpressions(), graph.knownModules()),
            orchestrator, directives);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param description optional description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * Graph identity settings.
     *
     * @param baseIri namespace of every generated IRI
     * @param includeExpressions build guard and body expression trees
     * @param knownModules modules of the analysed project; enables {@code isExternalModule}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphConfig(
        @JsonProperty("baseIri") String baseIri,
        @JsonProperty("includeExpressions") Boolean includeExpressions,
        @JsonProperty("knownModules") List<String> knownModules
    ) {
        public String effectiveBaseIri() {
            return baseIri == null || baseIri.isBlank() ? DEFAULT_BASE_IRI : baseIri;
        }

        public boolean effectiveIncludeExpressions() {
            return includeExpressions != null && includeExpressions;
        }
    }

    /**
     * Orchestrator settings.
     *
     * @param parallel run entity builders concurrently (default true)
     * @param timeoutMillis per-builder timeout (default 5000)
     * @param include builder ids to run; empty means all
     * @param exclude builder ids never to run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrchestratorConfig(
        @JsonProperty("parallel") Boolean parallel,
        @JsonProperty("timeoutMillis") Long timeoutMillis,
        @JsonProperty("include") List<String> include,
        @JsonProperty("exclude") List<String> exclude
    ) {
        private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

        static Set<BuilderKind> kinds(List<String> ids) {
            Set<BuilderKind> kinds = EnumSet.noneOf(BuilderKind.class);
            if (ids == null) {
                return kinds;
            }
            for (String id : ids) {
                BuilderKind.fromId(id).ifPresentOrElse(kinds::add,
                    () -> log.warn("Unknown builder id in configuration: {}", id));
            }
            return kinds;
        }
    }

    /**
     * Directive resolution settings.
     *
     * @param maxNestingDepth deepest allowed nesting of multi-alias groups
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DirectiveConfig(
        @JsonProperty("maxNestingDepth") Integer maxNestingDepth
    ) {
        public int effectiveMaxNestingDepth() {
            return maxNestingDepth == null || maxNestingDepth < 1
                ? DirectiveExtractor.DEFAULT_MAX_NESTING_DEPTH
                : maxNestingDepth;
        }
    }
}
