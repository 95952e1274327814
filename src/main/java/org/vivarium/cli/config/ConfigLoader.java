package org.vivarium.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the Vivarium configuration for the CLI.
 * <p>
 * Precedence, highest first: Java system properties, environment variables, the selected
 * configuration file, {@code reference.conf} on the classpath. Substitutions are resolved after
 * all layers are merged, so overriding a referenced value propagates to every reference.
 */
public final class ConfigLoader {

    /** Root path of all Vivarium settings. */
    public static final String ROOT = "vivarium";

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "vivarium.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is selected.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Selects the configuration file, first match wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/vivarium.conf} in the working directory</li>
     *   <li>{@code config/vivarium.conf} in the installation directory</li>
     *   <li>none, classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile File from {@code --config}, or {@code null}.
     * @param handler            Receives progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, new File("."), handler);
    }

    static Config resolve(final File explicitConfigFile, final File workingDirectory, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file from -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(new File(workingDirectory, CONFIG_DIR), CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file in working directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using the defaults from the classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/vivarium.conf}, where {@code APP_HOME} is the parent of the
     * {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} if it cannot be determined or does not exist.
     */
    private static File detectInstallationConfigFile() {
        try {
            final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
            final CodeSource codeSource = protectionDomain == null ? null : protectionDomain.getCodeSource();
            if (codeSource == null) {
                return null;
            }
            final URL location = codeSource.getLocation();
            final File jarOrClasses = new File(location.toURI());
            if (!jarOrClasses.isFile()) {
                // Classes directory during development; the working-directory lookup covers it
                return null;
            }
            final File libDir = jarOrClasses.getParentFile();
            final File appHome = libDir == null ? null : libDir.getParentFile();
            if (appHome == null) {
                return null;
            }
            final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
            return configFile.exists() ? configFile : null;
        } catch (Exception e) {
            // Best effort; the classpath defaults still apply
            return null;
        }
    }
}
