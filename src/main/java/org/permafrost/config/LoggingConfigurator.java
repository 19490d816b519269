package org.permafrost.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"          # "PLAIN" or "JSON", defaults to PLAIN
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.permafrost.decay" = "DEBUG"
 *   }
 * }
 * </pre>
 * The console appender on the root logger is swapped in place when the requested format differs
 * from the one {@code logback.xml} started with. Other root appenders are left attached.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** Context and system property read by {@code logback.xml} to pick the appender. */
    public static final String FORMAT_PROPERTY = "permafrost.logging.format";

    static final String PLAIN_APPENDER = "STDOUT";
    static final String JSON_APPENDER = "STDOUT_JSON";
    static final String PLAIN_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private static boolean applied = false;

    private LoggingConfigurator() {
    }

    /**
     * Parsed form of the {@code logging} block.
     *
     * @param appender console appender name
     * @param rootLevel root level, or null to keep the current one
     * @param levels per-logger levels in declaration order
     */
    record LoggingSettings(String appender, Level rootLevel, Map<String, String> levels) {

        static LoggingSettings from(final Config logging) {
            final String appender = appenderFor(logging.hasPath("format") ? logging.getString("format") : "PLAIN");
            final Level root = logging.hasPath("default-level")
                ? Level.toLevel(logging.getString("default-level"), Level.INFO)
                : null;
            final Map<String, String> levels = new LinkedHashMap<>();
            if (logging.hasPath("levels")) {
                for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                    levels.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
                }
            }
            return new LoggingSettings(appender, root, levels);
        }
    }

    /**
     * Configures logging from the application configuration. Later calls are ignored until
     * {@link #reset()}.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging block in configuration, keeping Logback defaults.");
            return;
        }

        final LoggingSettings settings;
        try {
            settings = LoggingSettings.from(config.getConfig("logging"));
        } catch (final RuntimeException e) {
            LOGGER.error("Invalid logging block, keeping Logback defaults.", e);
            return;
        }
        apply(settings, (LoggerContext) LoggerFactory.getILoggerFactory());
    }

    /**
     * @param format Configured format name.
     * @return appender name used by {@code logback.xml}
     */
    static String appenderFor(final String format) {
        return "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;
    }

    private static void apply(final LoggingSettings settings, final LoggerContext context) {
        context.putProperty(FORMAT_PROPERTY, settings.appender());
        System.setProperty(FORMAT_PROPERTY, settings.appender());
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        swapConsoleAppender(root, settings.appender(), context);

        if (settings.rootLevel() != null) {
            root.setLevel(settings.rootLevel());
        }
        int levelCount = 0;
        for (final Map.Entry<String, String> entry : settings.levels().entrySet()) {
            final Level level = Level.toLevel(entry.getValue(), null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", entry.getValue(), entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
            levelCount++;
        }
        LOGGER.debug("Logging configured: appender={}, root={}, {} logger levels",
            settings.appender(), root.getLevel(), levelCount);
    }

    private static void swapConsoleAppender(final Logger root, final String wanted, final LoggerContext context) {
        if (root.getAppender(wanted) != null) {
            return;
        }
        final Appender<ILoggingEvent> current =
            root.getAppender(PLAIN_APPENDER.equals(wanted) ? JSON_APPENDER : PLAIN_APPENDER);
        if (current == null) {
            // host-supplied logback configuration without our console appenders
            return;
        }

        final Encoder<ILoggingEvent> encoder;
        if (JSON_APPENDER.equals(wanted)) {
            final JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            encoder = json;
        } else {
            final PatternLayoutEncoder pattern = new PatternLayoutEncoder();
            pattern.setContext(context);
            pattern.setPattern(PLAIN_PATTERN);
            pattern.start();
            encoder = pattern;
        }
        final ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(wanted);
        console.setContext(context);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
        root.detachAppender(current);
        current.stop();
    }

    /**
     * Allows {@link #configure(Config)} to run again. Intended for tests.
     */
    public static synchronized void reset() {
        applied = false;
    }
}
