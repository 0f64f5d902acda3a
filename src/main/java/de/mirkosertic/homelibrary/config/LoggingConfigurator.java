package de.mirkosertic.homelibrary.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Moves logging off the console while the interactive shell owns stdout.
 * <p>
 * Default mode keeps logback.xml, which logback loads on its own. Interactive mode replaces it
 * with logback-interactive.xml, a rolling file below {@link ApplicationConfig#getLogDirectory()}.
 * The directory reaches the logback file as the {@value #LOG_DIR_PROPERTY} context property.
 * <p>
 * Runs before any logger is available, so problems are reported on stderr.
 */
public final class LoggingConfigurator {

    static final String FILE_LOGGING_CONFIG = "logback-interactive.xml";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";

    private LoggingConfigurator() {
    }

    /**
     * Must be called early in application startup, before logging is used.
     *
     * @param interactiveMode true if the interactive shell is going to run
     */
    public static void configure(final boolean interactiveMode) {
        if (interactiveMode) {
            logToFiles(ApplicationConfig.getLogDirectory());
        }
    }

    /**
     * Replaces the active logback configuration with rolling log files in {@code logDirectory}.
     *
     * @return false if file logging could not be set up
     */
    static boolean logToFiles(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
            return false;
        }

        final URL fileLogging = LoggingConfigurator.class.getClassLoader().getResource(FILE_LOGGING_CONFIG);
        if (fileLogging == null) {
            System.err.println("Warning: Could not find " + FILE_LOGGING_CONFIG + " on classpath");
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        // reset() drops context properties as well
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(fileLogging);
            return true;
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading " + FILE_LOGGING_CONFIG + ": " + e.getMessage());
            return false;
        }
    }
}
