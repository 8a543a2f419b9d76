package com.codeontology.cli;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.config.ConfigLoader;
import com.codeontology.core.config.ProjectConfig;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.model.ModuleAnalysis;
import com.codeontology.core.model.ModuleInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show what extraction finds in a syntax tree without building a graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * code-ontology inspect lib/my_app.ast.json
 * code-ontology inspect lib/my_app.ast.json --directives
 * }</pre>
 */
@Command(
    name = "inspect",
    description = "Show modules, entities and directives extracted from a syntax tree",
    mixinStandardHelpOptions = true
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Parameters(index = "0", description = "Syntax tree JSON file")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: code-ontology.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--directives"}, description = "Also list the resolved directives of each module")
    private boolean showDirectives;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.loadFor(input, configPath);
            SyntaxNode root = SyntaxTreeReader.read(input);
            List<ModuleAnalysis> analyses = config.toPipeline().extract(root);

            if (analyses.isEmpty()) {
                System.out.println("No modules found.");
                return 0;
            }
            System.out.println("Modules (" + analyses.size() + "):");
            System.out.println();
            analyses.forEach(this::printAnalysis);
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Inspect failed", e);
            System.err.println("✗ Inspect failed: " + e.getMessage());
            return 1;
        }
    }

    private void printAnalysis(ModuleAnalysis analysis) {
        ModuleInfo module = analysis.module();
        System.out.printf("  • %s%s%n", module.name(),
            module.isNested() ? " (nested in " + module.parentModule() + ")" : "");
        System.out.printf("    Functions: %d, Macros: %d, Types: %d, Specs: %d%n",
            module.functions().size(), module.macros().size(), analysis.types().size(), analysis.specs().size());
        System.out.printf("    Calls: %d, Control flow: %d, Anonymous functions: %d, Captures: %d%n",
            analysis.calls().size(), analysis.controlFlows().size(), analysis.anonymousFunctions().size(),
            analysis.captures().size());
        if (analysis.struct() != null) {
            System.out.printf("    Struct fields: %d%n", analysis.struct().fields().size());
        }
        if (analysis.genServer() != null) {
            System.out.println("    GenServer");
        }
        if (analysis.supervisor() != null) {
            System.out.println("    Supervisor");
        }
        if (analysis.protocol() != null) {
            System.out.println("    Protocol");
        }
        if (showDirectives) {
            for (Directive directive : module.directives()) {
                System.out.printf("    %s %s (%s)%n",
                    directive.kind().name().toLowerCase(), directive.sourceName(), directive.scope());
            }
        }
        System.out.println();
    }
}
