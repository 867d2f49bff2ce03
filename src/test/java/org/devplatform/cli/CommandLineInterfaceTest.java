package org.devplatform.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    @Test
    void cliInitialization() {
        final CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("devplatform");
        assertThat(cmd.getSubcommands()).containsKeys("up", "logs", "health");
    }

    @Test
    void workspaceRootFollowsConfigFile() {
        final CommandLineInterface cli = new CommandLineInterface();
        final Path file = tempDir.resolve("devplatform.conf");
        new CommandLine(cli).parseArgs("-c", file.toString());

        assertThat(cli.getWorkspaceRoot()).isEqualTo(tempDir.toAbsolutePath());
    }

    @Test
    void healthWithoutChecksSucceeds() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, "services.api.command = \"sleep\"\n");

        assertThat(new CommandLine(new CommandLineInterface()).execute("-c", file.toString(), "health")).isZero();
    }

    @Test
    void healthReportsFailingCheck() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, """
            services {
              ok { command = "sleep", health-check = "exit 0" }
              bad { command = "sleep", health-check = "exit 1" }
            }
            """);

        assertThat(new CommandLine(new CommandLineInterface()).execute("-c", file.toString(), "health")).isEqualTo(1);
    }

    @Test
    void logsPrintsWorkspaceLogFiles() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, "services.api { command = \"sleep\", log-file = \"api.log\" }\n");
        Files.writeString(tempDir.resolve("api.log"), "2024-01-01 00:00:00 ERROR boom\n2024-01-01 00:00:01 INFO fine\n");
        final StringWriter err = new StringWriter();

        final int exitCode = new CommandLine(new CommandLineInterface())
            .setErr(new PrintWriter(err))
            .execute("-c", file.toString(), "logs", "api", "--level", "error", "--format", "RAW");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void logsRejectsUnknownService() throws IOException {
        final Path file = tempDir.resolve("devplatform.conf");
        Files.writeString(file, "services.api.command = \"sleep\"\n");

        assertThat(new CommandLine(new CommandLineInterface()).execute("-c", file.toString(), "logs", "nope")).isEqualTo(2);
    }

    @Test
    void missingConfigFileIsAUsageError() {
        final int exitCode = new CommandLine(new CommandLineInterface())
            .setErr(new PrintWriter(new StringWriter()))
            .execute("-c", tempDir.resolve("absent.conf").toString(), "health");

        assertThat(exitCode).isEqualTo(2);
    }
}
