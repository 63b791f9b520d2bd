package org.retroscript.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

/**
 * Loads the RetroScript configuration for the command line tools.
 * <p>
 * Layers, highest priority first: Java system properties, environment variables, the user
 * configuration file, and {@code reference.conf} from the classpath. Substitutions are resolved
 * after all layers are composed, so user overrides reach values that {@code reference.conf}
 * derives from them.
 *
 * @see #resolve(File, ConfigMessageHandler) for how the user configuration file is found
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "retroscript.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        /** Progress, such as the configuration file that was picked. */
        INFO,
        /** A fallback the user may want to know about. */
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     * <p>
     * The command line forwards them to SLF4J; tests usually collect them in a list.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * Called once per resolution step that produced a message.
         *
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration. The user configuration file is the first that exists of:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by the {@code config.file} system property</li>
     *   <li>{@code config/retroscript.conf} in the working directory</li>
     *   <li>{@code config/retroscript.conf} in the installation directory, next to {@code lib/}</li>
     * </ol>
     * Without any, only the classpath defaults are used.
     *
     * @param explicitConfigFile file from the command line, or {@code null}
     * @param handler            receives resolution messages
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        // 1) --config
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        // 2) -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file given by -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                    + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        // 3) working directory
        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        // 4) installation directory
        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file "
                    + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        // 5) classpath defaults only
        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using defaults");
        return loadDefaults();
    }

    /**
     * Loads a user configuration file layered over the classpath defaults.
     *
     * @param configFile the HOCON file to load.
     * @return the fully resolved configuration.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Loads the classpath defaults without a user configuration file. System properties and
     * environment variables still apply.
     *
     * @return the fully resolved configuration.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Finds {@code APP_HOME/config/retroscript.conf} for a jar running from {@code APP_HOME/lib}.
     * <p>
     * The expected installation layout is:
     * <pre>
     *   APP_HOME/
     *     lib/retroscript-*.jar
     *     config/retroscript.conf
     * </pre>
     * When running from a classes directory (tests, IDE) there is no installation and the
     * working directory lookup applies instead.
     *
     * @return the file, or {@code null} when not running from an installation or the file is missing
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            return null;
        }
        final File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
