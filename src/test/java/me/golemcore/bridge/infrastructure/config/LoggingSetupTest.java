package me.golemcore.bridge.infrastructure.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.FileAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LogFile;
import org.springframework.boot.logging.LoggingInitializationContext;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.env.SimpleCommandLinePropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LoggingSetupTest {

    @TempDir
    Path tempDir;

    private LoggingSystem loggingSystem;

    @BeforeEach
    void setUp() {
        loggingSystem = LoggingSystem.get(getClass().getClassLoader());
        loggingSystem.cleanUp();
    }

    @AfterEach
    void tearDown() {
        loggingSystem.cleanUp();
        initialize();
        loggingSystem.cleanUp();
        System.clearProperty("LOG_FILE");
    }

    @Test
    void shouldLogToConsoleOnlyWithoutLogFileOption() {
        initialize("--config", "bridge.json");

        Logger root = rootLogger();
        assertNotNull(root.getAppender("CONSOLE"));
        assertNull(root.getAppender("FILE"));
    }

    @Test
    void shouldAttachFileAppenderForLogFileOption() {
        String logFile = tempDir.resolve("bridge.log").toString();

        initialize("--log-file", logFile);

        FileAppender<?> appender = assertInstanceOf(FileAppender.class, rootLogger().getAppender("FILE"));
        assertEquals(logFile, appender.getFile());
    }

    private void initialize(String... args) {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources()
                .addFirst(new SimpleCommandLinePropertySource(CommandLineTranslator.translate(args)));
        loggingSystem.beforeInitialize();
        loggingSystem.initialize(new LoggingInitializationContext(environment), null, LogFile.get(environment));
    }

    private static Logger rootLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
