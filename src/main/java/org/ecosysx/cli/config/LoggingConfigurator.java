package org.ecosysx.cli.config;

import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or COLOR
 *   default-level = "INFO"
 *   levels {
 *     "org.ecosysx.runtime.social" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FORMAT_PROPERTY = "ecosysx.logging.format";

    private static boolean configured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies levels from {@code config}. Only the first call has an effect until {@link #reset()}.
     */
    public static synchronized void configure(Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            LOG.debug("No logging section, keeping Logback defaults");
            return;
        }
        Config logging = config.getConfig("logging");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        context.putProperty(FORMAT_PROPERTY, appenderFor(logging));

        if (logging.hasPath("default-level")) {
            Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                String levelName = String.valueOf(entry.getValue().unwrapped());
                Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOG.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
    }

    /**
     * Maps {@code logging.format} to the appender name used in {@code logback.xml}.
     */
    public static String appenderFor(Config logging) {
        String format = logging.hasPath("format") ? logging.getString("format") : "PLAIN";
        return "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
    }

    static synchronized void reset() {
        configured = false;
    }
}
