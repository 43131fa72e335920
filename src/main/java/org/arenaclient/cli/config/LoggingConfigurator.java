package org.arenaclient.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the {@code logging} block of the application configuration to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.arenaclient.match.session" = "DEBUG"
 *     "org.eclipse.jetty" = "WARN"
 *   }
 * }
 * </pre>
 * Unknown level names fall back to {@code INFO} (Logback's own parsing rule).
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }
}
