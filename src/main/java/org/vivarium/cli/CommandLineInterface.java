package org.vivarium.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.vivarium.cli.commands.InspectCommand;
import org.vivarium.cli.commands.RunCommand;
import org.vivarium.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "vivarium",
    mixinStandardHelpOptions = true,
    version = "Vivarium 1.0",
    description = "Vivarium - a single simulated organism with delayed feedback and layered memory",
    subcommands = {
        RunCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/vivarium.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line used by {@link #main(String[])}. Tests use it to get the same setup.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("vivarium");
        return commandLine;
    }

    /**
     * @return the resolved configuration, loaded on first access.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            try {
                config = ConfigLoader.resolve(configFile, (level, message) -> {
                    switch (level) {
                        case INFO -> logger.info(message);
                        case WARN -> logger.warn(message);
                    }
                });
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            } catch (ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
            }
        }
        return config;
    }
}
