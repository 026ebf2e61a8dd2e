package de.mirkosertic.contactbench.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BuildInfoTest {

    @Test
    void testVersionIsMavenVersionOrDev() {
        assertThat(BuildInfo.getVersion())
                .as("Filtered builds carry the project version, IDE runs report 'dev'")
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
    }

    @Test
    void testTimestampIsIsoOrUnknown() {
        assertThat(BuildInfo.getBuildTimestamp())
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }
}
