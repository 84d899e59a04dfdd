package com.waypoint.endpoints.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolverConfigTest {

    @Test
    @DisplayName("Should use documented defaults")
    void shouldUseDefaults() {
        ResolverConfig config = ResolverConfig.defaults();

        assertThat(config.getMaxTraversalSteps()).isZero();
        assertThat(config.isTraceOnSuccess()).isFalse();
        assertThat(config.getPartitionsPath()).isNull();
        assertThat(config.getPartitionCacheSize()).isEqualTo(1024);
        assertThat(config.getReloadIntervalSeconds()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should derive the step budget from the node count when unset")
    void shouldDeriveStepBudget() {
        assertThat(ResolverConfig.defaults().effectiveStepBudget(7)).isEqualTo(8);
        assertThat(ResolverConfig.defaults().toBuilder().maxTraversalSteps(3).build().effectiveStepBudget(7)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should apply environment overrides")
    void shouldApplyEnvironment() {
        ResolverConfig config = ResolverConfig.fromEnvironment(Map.of(
                ResolverConfig.ENV_MAX_TRAVERSAL_STEPS, "500",
                ResolverConfig.ENV_TRACE_ON_SUCCESS, "true",
                ResolverConfig.ENV_PARTITIONS_PATH, " /etc/waypoint/partitions.json ",
                ResolverConfig.ENV_PARTITION_CACHE_SIZE, "64",
                ResolverConfig.ENV_RELOAD_INTERVAL_SECONDS, "30"));

        assertThat(config.getMaxTraversalSteps()).isEqualTo(500);
        assertThat(config.isTraceOnSuccess()).isTrue();
        assertThat(config.getPartitionsPath()).isEqualTo("/etc/waypoint/partitions.json");
        assertThat(config.getPartitionCacheSize()).isEqualTo(64);
        assertThat(config.getReloadIntervalSeconds()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should ignore unparseable numbers")
    void shouldIgnoreInvalidNumbers() {
        ResolverConfig config = ResolverConfig.fromEnvironment(Map.of(ResolverConfig.ENV_MAX_TRAVERSAL_STEPS, "lots"));

        assertThat(config.getMaxTraversalSteps()).isZero();
    }

    @Test
    @DisplayName("Should reject out of range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ResolverConfig.defaults().toBuilder().maxTraversalSteps(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTraversalSteps");
        assertThatThrownBy(() -> ResolverConfig.defaults().toBuilder().partitionCacheSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResolverConfig.defaults().toBuilder().reloadIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should read a properties file from the file system")
    void shouldLoadPropertiesFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("resolver.properties");
        Files.writeString(file, "waypoint.max.traversal.steps=42\nwaypoint.partition.cache.size=8\n");

        ResolverConfig config = ResolverConfig.loadFromProperties(file.toString());

        if (System.getenv(ResolverConfig.ENV_MAX_TRAVERSAL_STEPS) == null) {
            assertThat(config.getMaxTraversalSteps()).isEqualTo(42);
        }
        if (System.getenv(ResolverConfig.ENV_PARTITION_CACHE_SIZE) == null) {
            assertThat(config.getPartitionCacheSize()).isEqualTo(8);
        }
    }

    @Test
    @DisplayName("Should keep defaults when the properties file is missing")
    void shouldTolerateMissingPropertiesFile() {
        ResolverConfig config = ResolverConfig.loadFromProperties("does-not-exist.properties");

        assertThat(config).isNotNull();
    }
}
