package org.devplatform.cli.commands;

import com.typesafe.config.Config;
import org.devplatform.cli.CommandLineInterface;
import org.devplatform.config.ManifestLoader;
import org.devplatform.logs.LogStreamConfig;
import org.devplatform.logs.LogStreamer;
import org.devplatform.supervisor.ProcessSupervisor;
import org.devplatform.supervisor.ServiceConfig;
import org.devplatform.supervisor.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

@Command(
    name = "up",
    description = "Starts the workspace services and follows their logs until interrupted."
)
public class UpCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-s", "--service"}, description = "Start only this service (repeatable).")
    private List<String> selected;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final List<ServiceConfig> services = selectServices(new ManifestLoader(config, parent.getWorkspaceRoot()));
        if (services == null) {
            return 2;
        }
        if (services.isEmpty()) {
            System.out.println("No services configured.");
            return 0;
        }

        final LogStreamer logStreamer = new LogStreamer(config.getConfig("logs"));
        final ProcessSupervisor supervisor = new ProcessSupervisor(config.getConfig("supervisor"), logStreamer);
        final CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down services...");
            shutdown.countDown();
            supervisor.close();
            logStreamer.close();
        }, "devplatform-shutdown"));

        int failed = 0;
        for (final ServiceConfig service : services) {
            try {
                supervisor.start(service);
            } catch (final SpawnException e) {
                failed++;
            }
        }
        if (failed == services.size()) {
            LOGGER.error("No service could be started.");
            return 1;
        }

        final LogStreamConfig streamConfig = LogStreamConfig.builder().follow(true).build();
        logStreamer.stream(streamConfig, System.out, () -> shutdown.getCount() == 0);
        return 0;
    }

    /**
     * @return the services to start, or null if an unknown name was selected.
     */
    private List<ServiceConfig> selectServices(final ManifestLoader manifest) {
        final List<ServiceConfig> all = manifest.services();
        if (selected == null || selected.isEmpty()) {
            return all;
        }
        final List<String> known = all.stream().map(ServiceConfig::name).collect(Collectors.toList());
        for (final String name : selected) {
            if (!known.contains(name)) {
                System.err.println("Unknown service '" + name + "'. Known services: " + known);
                return null;
            }
        }
        return all.stream().filter(s -> selected.contains(s.name())).collect(Collectors.toList());
    }
}
