package de.mirkosertic.contactbench.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging to file-only output in quiet mode ({@code -Dprofile=quiet}). Otherwise the
 * console configuration in logback.xml stays active.
 */
public final class LoggingConfigurator {

    private static final String QUIET_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * Call from {@code main} before the first logger is obtained.
     */
    public static void configure(final boolean quietMode) {
        if (quietMode) {
            ensureLogDirectoryExists(ApplicationConfig.getConfigDirectory().resolve("log"));
            loadConfiguration(QUIET_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Logging: cannot create " + logDir + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream != null) {
                configurator.doConfigure(configStream);
            } else {
                System.err.println("Logging: " + configFile + " is missing from the classpath");
            }
        } catch (final JoranException | IOException e) {
            System.err.println("Logging: " + configFile + " could not be applied: " + e.getMessage());
        }
    }
}
