package org.corvid.config;

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

    private static final String TEST_LOGGER = "org.corvid.test.logging";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.corvid.test.logging" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_ignoresUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.corvid.test.logging" = "LOUD" }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotent() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.corvid.test.logging\" = \"INFO\" }"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.corvid.test.logging\" = \"TRACE\" }"));

        // Then
        assertEquals(Level.INFO, context.getLogger(TEST_LOGGER).getLevel());
    }
}
