package de.mirkosertic.contactbench.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp from the Maven-filtered build-info.properties. Reports
 * "dev"/"unknown" when the file is missing or unfiltered.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties properties = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                properties.load(input);
            } else {
                logger.debug("No {} on the classpath", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Unreadable {}, reporting development build", BUILD_INFO_FILE, e);
        }
        version = filtered(properties.getProperty("build.version"), "dev");
        buildTimestamp = filtered(properties.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    private static String filtered(final String value, final String fallback) {
        // An unfiltered placeholder means the resource was copied without Maven filtering
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }
}
