package com.codeontology;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CodeOntologyCLI}.
 */
class CodeOntologyCLITest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        CodeOntologyCLI.appLogger().setLevel(Level.INFO);
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.WARN);
    }

    @Test
    void run_noCommand_printsUsageHint() {
        int exitCode = CodeOntologyCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("code-ontology --help");
    }

    @Test
    void run_quiet_printsNothingAndRaisesLogLevel() {
        int exitCode = CodeOntologyCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(CodeOntologyCLI.appLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void verboseOption_beforeSubcommand_enablesDebugLogging() {
        CommandLine commandLine = CodeOntologyCLI.commandLine();

        int exitCode = commandLine.execute("--verbose", "list", "builders");

        assertThat(exitCode).isZero();
        assertThat(((CodeOntologyCLI) commandLine.getCommand()).isVerbose()).isTrue();
        assertThat(CodeOntologyCLI.appLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void version_printsProductVersion() {
        int exitCode = CodeOntologyCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Code Ontology 1.0.0-SNAPSHOT");
    }
}
