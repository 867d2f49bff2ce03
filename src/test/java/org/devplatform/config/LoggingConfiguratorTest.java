package org.devplatform.config;

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

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class LoggingConfiguratorTest {

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
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("devplatform.output.api").setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_PLAIN", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = json"));

        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withSpecificLevels_shouldSetLoggerLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "devplatform.output.api" = "ERROR"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger("devplatform.output.api").getLevel());
    }

    @Test
    void configure_isAppliedOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
