package com.waypoint.endpoints.infra.metrics.internal;

import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.metrics.api.MetricsRegistryProvider;
import com.waypoint.endpoints.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.waypoint.endpoints.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import com.waypoint.endpoints.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.waypoint.endpoints.infra.metrics.impl.prometheus.PrometheusMetricsRegistryProvider;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsRegistryHolderTest {

    @Test
    @DisplayName("Should pick the provider with the highest priority")
    void shouldPickHighestPriority() {
        MetricsRegistryProvider prometheus = () -> new PrometheusMetricsRegistry(new CollectorRegistry());

        MetricsRegistry selected = MetricsRegistryHolder.select(List.of(prometheus, new InMemoryMetricsRegistryProvider()));

        assertThat(selected).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    @DisplayName("Should fall back to a no-op registry without providers")
    void shouldFallBackToNoOp() throws Exception {
        MetricsRegistry selected = MetricsRegistryHolder.select(List.of());

        selected.counter("hits").increment(5);
        selected.gauge("g").set(3);
        assertThat(selected).isInstanceOf(NoOpMetricsRegistry.class);
        assertThat(selected.counter("hits").count()).isZero();
        assertThat(selected.gauge("g").value()).isZero();
        assertThat(selected.timer("t").record(() -> "ran")).isEqualTo("ran");
        assertThat(selected.timer("t").percentile(0.5)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should discover the bundled Prometheus provider")
    void shouldDiscoverPrometheusProvider() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(PrometheusMetricsRegistry.class);
        assertThat(new PrometheusMetricsRegistryProvider().priority()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should build keys and split tags")
    void shouldHandleTags() {
        assertThat(Tags.meterKey("n")).isEqualTo("n");
        assertThat(Tags.meterKey("n", "a", "1", "b", "2")).isEqualTo("n{a=1,b=2}");
        assertThat(Tags.names("a", "1", "b", "2")).containsExactly("a", "b");
        assertThat(Tags.values("a", "1", "b", "2")).containsExactly("1", "2");
        assertThatThrownBy(() -> Tags.names("a")).isInstanceOf(IllegalArgumentException.class);
    }
}
