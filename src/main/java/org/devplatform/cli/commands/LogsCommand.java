package org.devplatform.cli.commands;

import com.typesafe.config.Config;
import org.devplatform.cli.CommandLineInterface;
import org.devplatform.config.ManifestLoader;
import org.devplatform.logs.LogFormat;
import org.devplatform.logs.LogLevel;
import org.devplatform.logs.LogStreamConfig;
import org.devplatform.logs.LogStreamer;
import org.devplatform.supervisor.ServiceConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
    name = "logs",
    description = "Shows the logs of the workspace services."
)
public class LogsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", arity = "0..1", description = "Only show this service.")
    private String service;

    @Option(names = {"-f", "--follow"}, description = "Keep printing new entries.")
    private boolean follow;

    @Option(names = {"-n", "--lines"}, description = "Number of recent entries to show (default: logs.default-lines).")
    private Integer lines;

    @Option(names = "--level", description = "Minimum level: TRACE, DEBUG, INFO, WARN, ERROR.")
    private String level;

    @Option(names = "--grep", description = "Only entries whose message matches this regex.")
    private String grep;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: PRETTY).")
    private LogFormat format = LogFormat.PRETTY;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final List<ServiceConfig> services = new ManifestLoader(config, parent.getWorkspaceRoot()).services();
        if (service != null && services.stream().noneMatch(s -> s.name().equals(service))) {
            System.err.println("Unknown service '" + service + "'.");
            return 2;
        }

        final LogStreamConfig streamConfig = LogStreamConfig.builder()
            .follow(follow)
            .lines(lines != null ? lines : defaultLines(config))
            .minLevel(level != null ? LogLevel.parse(level) : null)
            .serviceFilter(service)
            .pattern(grep)
            .format(format)
            .build();

        try (LogStreamer logStreamer = new LogStreamer(config.getConfig("logs"))) {
            int watched = 0;
            for (final ServiceConfig candidate : services) {
                if (service != null && !candidate.name().equals(service)) {
                    continue;
                }
                final Path logFile = candidate.logFile();
                if (logFile == null || (!follow && !Files.exists(logFile))) {
                    continue;
                }
                logStreamer.addLogFile(candidate.name(), logFile, follow);
                watched++;
            }
            if (watched == 0) {
                System.out.println("No log files found.");
                return 0;
            }

            if (follow) {
                final CountDownLatch interrupted = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(interrupted::countDown, "devplatform-logs-shutdown"));
                logStreamer.stream(streamConfig, System.out, () -> interrupted.getCount() == 0);
            } else {
                logStreamer.stream(streamConfig, System.out);
            }
        }
        return 0;
    }

    private static int defaultLines(final Config config) {
        return config.hasPath("logs.default-lines") ? config.getInt("logs.default-lines") : LogStreamConfig.DEFAULT_LINES;
    }
}
