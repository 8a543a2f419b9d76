package com.codeontology.cli;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.config.ConfigLoader;
import com.codeontology.core.config.ProjectConfig;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.orchestrator.BuildFailure;
import com.codeontology.core.orchestrator.BuilderKind;
import com.codeontology.core.orchestrator.GraphBuildResult;
import com.codeontology.core.orchestrator.Orchestrator;
import com.codeontology.core.orchestrator.OrchestratorOptions;
import com.codeontology.core.orchestrator.Pipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to build the knowledge graph of a syntax tree.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Read the JSON syntax tree</li>
 *   <li>Extract every module and resolve its directives</li>
 *   <li>Run the module and entity builders</li>
 *   <li>Write the merged graph as N-Triples</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Build to stdout
 * code-ontology build lib/my_app.ast.json
 *
 * # Build with expressions, sequentially, without macro invocations
 * code-ontology build lib/my_app.ast.json --expressions --sequential --exclude macro_invocations -o out.nt
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build the knowledge graph of a syntax tree and write N-Triples",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Parameters(index = "0", description = "Syntax tree JSON file")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: code-ontology.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "N-Triples output file (default: stdout)")
    private Path output;

    @Option(names = {"--base-iri"}, description = "Namespace of generated IRIs (overrides config)")
    private String baseIri;

    @Option(names = {"--source"}, description = "Source file path recorded for locations")
    private String sourcePath;

    @Option(names = {"--expressions"}, description = "Build guard and body expression trees")
    private boolean includeExpressions;

    @Option(names = {"--sequential"}, description = "Run entity builders one after another")
    private boolean sequential;

    @Option(names = {"--timeout"}, description = "Per-builder timeout in milliseconds (overrides config)")
    private Long timeoutMillis;

    @Option(names = {"--include"}, split = ",", description = "Builders to run (see 'list builders')")
    private List<String> include = new ArrayList<>();

    @Option(names = {"--exclude"}, split = ",", description = "Builders to skip")
    private List<String> exclude = new ArrayList<>();

    @Option(names = {"--strict"}, description = "Exit with 1 when any builder failed")
    private boolean strict;

    @Override
    public Integer call() {
        try {
            log.info("Building graph for: {}", input.toAbsolutePath());

            ProjectConfig config = ConfigLoader.loadFor(input, configPath);
            BuildContext context = createContext(config);
            OrchestratorOptions options = createOptions(config);
            Pipeline pipeline = new Pipeline(config.toExtractor(), new Orchestrator(), options);

            SyntaxNode root = SyntaxTreeReader.read(input);
            GraphBuildResult result = pipeline.run(root, context);

            writeGraph(result);
            printSummary(result);

            if (strict && result.report().hasFailures()) {
                return 1;
            }
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Build failed", e);
            System.err.println("✗ Build failed: " + e.getMessage());
            return 1;
        }
    }

    BuildContext createContext(ProjectConfig config) {
        ProjectConfig effective = baseIri != null && !baseIri.isBlank() ? config.withBaseIri(baseIri) : config;
        BuildContext context = effective.toBuildContext();
        if (includeExpressions) {
            context = context.withConfig(Map.of(BuildContext.INCLUDE_EXPRESSIONS, true));
        }
        if (sourcePath != null && !sourcePath.isBlank()) {
            context = context.withFilePath(sourcePath);
        }
        return context;
    }

    OrchestratorOptions createOptions(ProjectConfig config) {
        OrchestratorOptions options = config.toOrchestratorOptions();
        if (!include.isEmpty()) {
            options = options.withInclude(kinds(include));
        }
        if (!exclude.isEmpty()) {
            options = options.withExclude(kinds(exclude));
        }
        if (sequential) {
            options = options.withParallel(false);
        }
        if (timeoutMillis != null) {
            options = options.withTimeout(Duration.ofMillis(timeoutMillis));
        }
        return options;
    }

    private static List<BuilderKind> kinds(List<String> ids) {
        List<BuilderKind> kinds = new ArrayList<>();
        for (String id : ids) {
            kinds.add(BuilderKind.fromId(id).orElseThrow(
                () -> new IllegalArgumentException("Unknown builder: " + id)));
        }
        return kinds;
    }

    private void writeGraph(GraphBuildResult result) throws IOException {
        String nTriples = result.graph().toNTriples();
        if (output == null) {
            System.out.print(nTriples);
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, nTriples, StandardCharsets.UTF_8);
        log.info("Wrote {} triples to {}", result.graph().size(), output);
    }

    private void printSummary(GraphBuildResult result) {
        if (output == null) {
            return;
        }
        System.out.println("✓ Built " + result.modules().size() + " modules, "
            + result.graph().size() + " triples");
        for (BuildFailure failure : result.report().failures()) {
            System.out.println("  ! " + failure.module() + " / " + failure.kind().id() + ": " + failure.reason());
        }
    }
}
