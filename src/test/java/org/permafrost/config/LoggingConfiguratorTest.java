package org.permafrost.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PROBE_LOGGER = "org.permafrost.test.probe";

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        if (root().getAppender("STDOUT_JSON") != null) {
            LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = PLAIN"));
            LoggingConfigurator.reset();
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(PROBE_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "WARN"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "json"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_JSON", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_JSON", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(root().getAppender("STDOUT_JSON"));
        assertNull(root().getAppender("STDOUT"));
    }

    @Test
    void configure_withUnknownLoggerLevel_shouldSkipItAndApplyTheRest() {
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.permafrost.test.probe" = "LOUD"
                "org.permafrost.test.other" = "ERROR"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertNull(context.getLogger(PROBE_LOGGER).getLevel());
        assertEquals(Level.ERROR, context.getLogger("org.permafrost.test.other").getLevel());
        context.getLogger("org.permafrost.test.other").setLevel(null);
    }

    private ch.qos.logback.classic.Logger root() {
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void configure_withSpecificLoggerLevels_shouldSetLoggerLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.permafrost.test.probe" = "TRACE"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.TRACE, context.getLogger(PROBE_LOGGER).getLevel());
    }

    @Test
    void configure_calledMultipleTimes_shouldApplyOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = WARN"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));

        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingConfig_shouldKeepDefaults() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other.some-value = test"));

        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withInvalidLevel_shouldFallBackToInfo() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "INVALID_LEVEL"
            }
            """);

        assertDoesNotThrow(() -> LoggingConfigurator.configure(config));
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void appenderFor_isCaseInsensitive() {
        assertEquals("STDOUT_JSON", LoggingConfigurator.appenderFor("Json"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("anything"));
    }
}
