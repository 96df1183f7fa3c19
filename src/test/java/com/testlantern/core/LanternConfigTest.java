package com.testlantern.core;

import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class LanternConfigTest {

    @Test
    public void builder_defaults() {
        LanternConfig config = LanternConfig.builder().build();

        assertThat(config.getScreenTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(config.getTransientSoftTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(config.getTransientHardTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.getMessageSeparator()).isEqualTo("; ");
        assertThat(config.getAppName()).isEqualTo("app");
        assertThat(config.getAccessorReportPath()).isEqualTo(Paths.get("target/accessor-report.json"));
        assertThat(config.isAccessorReportEnabled()).isTrue();
    }

    @Test
    public void builder_normalizesUnusableValues() {
        LanternConfig config = LanternConfig.builder()
            .messageSeparator(null)
            .appName("  ")
            .pollInterval(Duration.ZERO)
            .build();

        assertThat(config.getMessageSeparator()).isEqualTo("; ");
        assertThat(config.getAppName()).isEqualTo("app");
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    public void builder_blankReportPath_disablesReport() {
        LanternConfig config = LanternConfig.builder().accessorReportPath("").build();

        assertThat(config.isAccessorReportEnabled()).isFalse();
    }

    @Test
    public void fromEnvironment_alwaysProducesUsableConfig() {
        LanternConfig config = LanternConfig.fromEnvironment();

        assertThat(config.getPollInterval()).isPositive();
        assertThat(config.getAppName()).isNotBlank();
        assertThat(config.getMessageSeparator()).isNotNull();
    }
}
