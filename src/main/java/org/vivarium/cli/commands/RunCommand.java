package org.vivarium.cli.commands;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

import org.vivarium.cli.CommandLineInterface;
import org.vivarium.cli.config.ConfigLoader;
import org.vivarium.datapipeline.LifeAssembly;
import org.vivarium.datapipeline.api.services.IService.State;
import org.vivarium.datapipeline.resume.ResumeException;
import org.vivarium.datapipeline.services.LifeEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "run",
    description = "Run the organism until stopped, until it is no longer active, or for a fixed number of ticks"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"-n", "--ticks"},
        description = "Number of ticks to run (default: vivarium.service.maxTicks, 0 = unbounded)"
    )
    private Long ticks;

    @Option(
        names = {"--tick-interval-ms"},
        description = "Wall-clock milliseconds per tick, 0 runs as fast as possible (default: vivarium.service.tickIntervalMs)"
    )
    private Long tickIntervalMs;

    @Option(
        names = {"--resume"},
        description = "Resume from the latest snapshot"
    )
    private boolean resume;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        Config vivarium = applyOverrides(parent.getConfig().getConfig(ConfigLoader.ROOT));

        LifeAssembly assembly;
        try {
            assembly = LifeAssembly.build(vivarium, resume, Clock.systemUTC());
        } catch (ResumeException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Cannot start: " + e.getMessage());
            return 1;
        }
        LifeEngine service = assembly.service();

        Thread shutdownHook = new Thread(() -> stopQuietly(service), "vivarium-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            service.start();
            while (service.getCurrentState() == State.RUNNING || service.getCurrentState() == State.PAUSED) {
                Thread.sleep(200);
            }
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOG.debug("JVM is already shutting down");
            }
            stopQuietly(service);
            if (assembly.snapshots() != null) {
                service.snapshotNow();
            }
            if (assembly.structuredLogger() != null) {
                assembly.structuredLogger().close();
            }
        }

        Map<String, Number> metrics = service.getMetrics();
        spec.commandLine().getOut().printf("Finished after %s ticks: energy=%.2f stability=%.3f integrity=%.3f%n",
            metrics.get("ticks_run"), metrics.get("energy").doubleValue(),
            metrics.get("stability").doubleValue(), metrics.get("integrity").doubleValue());
        return service.getCurrentState() == State.ERROR ? 1 : 0;
    }

    private Config applyOverrides(Config vivarium) {
        Config result = vivarium;
        if (ticks != null) {
            if (ticks < 0) {
                throw new picocli.CommandLine.ParameterException(spec.commandLine(), "--ticks must be >= 0");
            }
            result = result.withValue("service.maxTicks", ConfigValueFactory.fromAnyRef(ticks));
        }
        if (tickIntervalMs != null) {
            if (tickIntervalMs < 0) {
                throw new picocli.CommandLine.ParameterException(spec.commandLine(), "--tick-interval-ms must be >= 0");
            }
            result = result.withValue("service.tickIntervalMs", ConfigValueFactory.fromAnyRef(tickIntervalMs));
        }
        return result;
    }

    private static void stopQuietly(LifeEngine service) {
        State state = service.getCurrentState();
        if (state == State.RUNNING || state == State.PAUSED) {
            try {
                service.stop();
            } catch (IllegalStateException e) {
                LOG.debug("Service already stopped: {}", e.getMessage());
            }
        }
    }
}
