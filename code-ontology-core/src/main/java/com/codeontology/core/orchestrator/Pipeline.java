package com.codeontology.core.orchestrator;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.extractor.SourceUnitExtractor;
import com.codeontology.core.model.ModuleAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs extraction and graph building for a whole source unit.
 *
 * <pre>{@code
 * GraphBuildResult result = new Pipeline().run(fileRoot, BuildContext.of(base).withFilePath("lib/my_app.ex"));
 * }</pre>
 */
public class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final SourceUnitExtractor extractor;
    private final Orchestrator orchestrator;
    private final OrchestratorOptions options;

    public Pipeline() {
        this(new SourceUnitExtractor(), new Orchestrator(), OrchestratorOptions.defaults());
    }

    public Pipeline(SourceUnitExtractor extractor, Orchestrator orchestrator, OrchestratorOptions options) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Extracts every module below {@code root} and builds them into one graph.
     *
     * @param root source unit root
     * @param context base context
     * @return merged graph and report; an empty graph when the unit defines no module
     */
    public GraphBuildResult run(SyntaxNode root, BuildContext context) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(context, "context must not be null");
        List<ModuleAnalysis> modules = extractor.extract(root);
        if (modules.isEmpty()) {
            log.info("No modules found in {}", context.filePath() != null ? context.filePath() : "source unit");
        }
        return orchestrator.buildAll(modules, context, options);
    }

    /**
     * Extracts the modules below {@code root} without building them.
     *
     * @param root source unit root
     * @return module analyses in pre-order
     */
    public List<ModuleAnalysis> extract(SyntaxNode root) {
        return extractor.extract(Objects.requireNonNull(root, "root must not be null"));
    }
}
