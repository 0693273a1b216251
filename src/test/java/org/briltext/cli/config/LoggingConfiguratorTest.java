package org.briltext.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.briltext.test";

    private LoggerContext context;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
        context.getLogger(TEST_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() throws Exception {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        reconfigureLogback();

        // Then
        final ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        final Appender<?> plain = root.getAppender("STDOUT_PLAIN");
        assertThat(plain).isInstanceOf(ConsoleAppender.class);
        assertThat(((ConsoleAppender<?>) plain).getTarget()).isEqualTo("System.err");
        assertThat(root.getAppender("STDOUT")).isNull();
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        final Config config = ConfigFactory.parseString("logging { format = \"JSON\" }");

        LoggingConfigurator.configure(config);

        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.briltext.test" = "DEBUG"
                "org.briltext.other" = "NOT_A_LEVEL"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.briltext.other").getLevel()).isNull();
    }

    @Test
    void configure_calledMultipleTimes_shouldBeIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"INFO\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void configure_withoutLoggingConfig_shouldLeaveLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other { some-value = \"test\" }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    private void reconfigureLogback() throws Exception {
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        final URL configUrl = getClass().getClassLoader().getResource("logback.xml");
        assertThat(configUrl).isNotNull();
        configurator.doConfigure(configUrl);
    }
}
