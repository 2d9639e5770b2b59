package org.ecosysx.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the application {@link Config} from layered HOCON sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Decosysx.seed=7})</li>
 *   <li>Environment variables</li>
 *   <li>One user configuration file, picked by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference layer is parsed unresolved so that substitutions in it see user overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "ecosysx.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads it on top of the defaults. Candidates, in order:
     * the explicit file, {@code -Dconfig.file}, {@code config/ecosysx.conf} in the working directory,
     * then {@code config/ecosysx.conf} next to the installation. Without any, only defaults apply.
     *
     * @param explicitConfigFile file given on the command line, or {@code null}.
     * @param handler            receives which source was used.
     * @return the resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            File file = new File(property).getAbsoluteFile();
            requireExists(file, "Configuration file given by -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + file.getAbsolutePath());
            return loadFromFile(file);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file in working directory: " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        File installedFile = findInstallationConfigFile();
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file in installation directory: " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static void requireExists(File file, String messagePrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(messagePrefix + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code config/ecosysx.conf} beside the directory holding the application jar.
     *
     * @return the file, or {@code null} if the location is unknown or the file is absent.
     */
    private static File findInstallationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        // A jar lives in APP_HOME/lib, a classes directory is its own root.
        File appHome = location.isFile() && location.getParentFile() != null
                ? location.getParentFile().getParentFile()
                : location;
        if (appHome == null) {
            return null;
        }
        File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
