package org.minipy.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LoggingConfigurator}.
 */
@Tag("unit")
public class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void rememberRootLevel() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void restoreLevels() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.minipy.test.alpha").setLevel(null);
        context.getLogger("org.minipy.test.beta").setLevel(null);
    }

    /**
     * Verifies that the default level and per-logger levels are applied to Logback.
     */
    @Test
    void testLevelsAreApplied() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.minipy.test.alpha" = "DEBUG"
              }
            }
            """);

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.minipy.test.alpha").getLevel()).isEqualTo(Level.DEBUG);
    }

    /**
     * Verifies that an unknown level name leaves the logger untouched.
     */
    @Test
    void testUnknownLevelIsIgnored() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            logging.levels {
              "org.minipy.test.beta" = "LOUD"
            }
            """);

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger("org.minipy.test.beta").getLevel()).isNull();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }

    /**
     * Verifies that a configuration without a logging block keeps the current levels.
     */
    @Test
    void testMissingLoggingBlockChangesNothing() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }
}
