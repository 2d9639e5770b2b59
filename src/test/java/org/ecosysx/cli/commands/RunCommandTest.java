package org.ecosysx.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.ecosysx.cli.CommandLineInterface;
import org.ecosysx.cli.config.LoggingConfigurator;
import org.ecosysx.junit.extensions.logging.ExpectLog;
import org.ecosysx.junit.extensions.logging.LogLevel;
import org.ecosysx.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RunCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        // keeps the CLI from reloading logback.xml, which would drop the log watch filter
        System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
        configFile = tempDir.resolve("ecosysx.conf");
        Files.writeString(configFile, "ecosysx { analytics.windowSize = 10, analytics.checkpointInterval = 20 }",
                StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void runsAndExportsAnalytics() throws IOException {
        Path export = tempDir.resolve("out").resolve("analytics.json");

        int exit = execute("--config", configFile.toString(), "run", "--steps", "40",
                "--basic", "3", "--rl", "3", "--causal", "3", "--export", export.toString());

        assertThat(exit).isEqualTo(RunCommand.EXIT_OK);
        assertThat(out.toString())
                .containsPattern("Finished at step \\d+: population \\d+ \\(S=\\d+ I=\\d+ R=\\d+\\)")
                .contains("Analytics written to " + export.toAbsolutePath());
        JsonObject json = JsonParser.parseString(Files.readString(export, StandardCharsets.UTF_8)).getAsJsonObject();
        assertThat(json.getAsJsonObject("metadata").get("window_size").getAsInt()).isEqualTo(10);
        assertThat(json.getAsJsonArray("recent_windows")).hasSize(3);
        assertThat(json.getAsJsonArray("checkpoints")).hasSize(1);
    }

    @Test
    void sameSeedPrintsSameSummary() {
        String[] args = {"--config", configFile.toString(), "run", "--steps", "30", "--seed", "5"};

        assertThat(execute(args)).isZero();
        String first = out.toString();
        out.getBuffer().setLength(0);
        assertThat(execute(args)).isZero();

        assertThat(out.toString()).isEqualTo(first);
    }

    @Test
    void pacedRunStopsAfterTheRequestedSteps() {
        int exit = execute("--config", configFile.toString(), "run", "--steps", "5", "--speed", "50");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Finished at step");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Invalid configuration: Configuration file not found: .*")
    void missingConfigFileFails() {
        int exit = execute("--config", tempDir.resolve("missing.conf").toString(), "run");

        assertThat(exit).isEqualTo(RunCommand.EXIT_CONFIG_ERROR);
        assertThat(err.toString()).contains("Error: Configuration file not found");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Invalid configuration: --steps must not be negative, got -5")
    void negativeStepsAreRejected() {
        int exit = execute("--config", configFile.toString(), "run", "--steps=-5");

        assertThat(exit).isEqualTo(RunCommand.EXIT_CONFIG_ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Invalid configuration: infectedFraction must be in \\[0, 1\\], got 1.5")
    void invalidInfectedFractionIsRejected() {
        int exit = execute("--config", configFile.toString(), "run", "--steps", "1", "--infected-fraction", "1.5");

        assertThat(exit).isEqualTo(RunCommand.EXIT_CONFIG_ERROR);
        assertThat(err.toString()).contains("infectedFraction");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to write export to .*")
    void unwritableExportFails() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x", StandardCharsets.UTF_8);

        int exit = execute("--config", configFile.toString(), "run", "--steps", "2",
                "--export", blocker.resolve("analytics.json").toString());

        assertThat(exit).isEqualTo(RunCommand.EXIT_IO_ERROR);
    }
}
