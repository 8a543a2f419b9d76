package com.codeontology;

import com.codeontology.cli.BuildCommand;
import com.codeontology.cli.InspectCommand;
import com.codeontology.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Code Ontology.
 *
 * <p>Code Ontology reads parsed Elixir syntax trees (JSON) and emits an RDF knowledge graph of
 * modules, functions, types, OTP patterns, calls and macros.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build the graph for a syntax tree and write N-Triples</li>
 *   <li>{@code inspect} - Show the modules and directives extracted from a syntax tree</li>
 *   <li>{@code list} - List entity builders</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * code-ontology build lib/my_app.ast.json -o my_app.nt
 * code-ontology inspect lib/my_app.ast.json
 * code-ontology list builders
 * }</pre>
 */
@Command(
    name = "code-ontology",
    mixinStandardHelpOptions = true,
    version = "Code Ontology 1.0.0-SNAPSHOT",
    description = "Builds an RDF knowledge graph from Elixir syntax trees",
    subcommands = {
        BuildCommand.class,
        InspectCommand.class,
        ListCommand.class
    }
)
public class CodeOntologyCLI implements Runnable {

    static final String APP_LOGGER_NAME = "com.codeontology";

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("Code Ontology - Elixir knowledge graph builder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'code-ontology --help' to see available commands");
        System.out.println("Use 'code-ontology <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        Level level = quiet ? Level.ERROR : verbose ? Level.DEBUG : Level.INFO;
        appLogger().setLevel(level);
        if (quiet || verbose) {
            rootLogger().setLevel(level);
        }
    }

    static ch.qos.logback.classic.Logger appLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(APP_LOGGER_NAME);
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeOntologyCLI cli = new CodeOntologyCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
