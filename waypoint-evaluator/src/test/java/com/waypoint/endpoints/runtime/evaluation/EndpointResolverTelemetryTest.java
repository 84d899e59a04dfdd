package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.FailureKind;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.Condition;
import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.ParameterType;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.waypoint.endpoints.runtime.model.Expression.literal;
import static com.waypoint.endpoints.runtime.model.Expression.param;
import static com.waypoint.endpoints.runtime.model.Expression.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointResolverTelemetryTest {

    private InMemorySpanExporter exporter;
    private SdkTracerProvider tracerProvider;
    private EndpointResolver resolver;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();

        RuleModel model = RuleModel.builder()
                .version("2.3")
                .parameter(Parameter.optional("Region", ParameterType.STRING))
                .parameter(Parameter.optional("Endpoint", ParameterType.STRING))
                .condition(Condition.of(0, "isSet", param("Region")))
                .condition(Condition.of(1, "isSet", param("Endpoint")))
                .result(RuleResult.endpoint(template(literal("https://svc."), param("Region"), literal(".example.com"))))
                .result(RuleResult.endpoint(param("Endpoint")))
                .node(0, NodeRef.forResult(0), 1)
                .node(1, NodeRef.forResult(1), NodeRef.NO_MATCH)
                .root(0)
                .build();
        resolver = new EndpointResolver(model, FunctionRegistry.standard(), ResolverConfig.defaults(),
                tracerProvider.get("waypoint-test"));
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    @Test
    @DisplayName("Should emit one span per resolution with outcome attributes")
    void shouldEmitResolutionSpan() {
        resolver.resolve(EndpointParameters.builder().set("Region", "eu-west-1").build());

        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo("resolve-endpoint");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("model.version"))).isEqualTo("2.3");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("outcome"))).isEqualTo("SUCCESS");
        assertThat(span.getAttributes().get(AttributeKey.longKey("conditionsEvaluated"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should mark the span as failed when the model misbehaves")
    void shouldRecordModelErrorsOnSpan() {
        // reaching node 1 takes two steps
        EndpointResolver strict = new EndpointResolver(resolver.getModel(), FunctionRegistry.standard(),
                ResolverConfig.defaults().toBuilder().maxTraversalSteps(1).build(), tracerProvider.get("waypoint-test"));

        assertThatThrownBy(() -> strict.resolve(EndpointParameters.builder().set("Endpoint", "https://e.example.com").build()))
                .isInstanceOf(MalformedModelException.class);

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
        assertThat(strict.getMetrics().getModelErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count outcomes by kind")
    void shouldCountOutcomes() {
        resolver.resolve(EndpointParameters.builder().set("Region", "us-east-1").build());
        resolver.resolve(EndpointParameters.empty());
        resolver.resolve(Map.of("Region", Value.of(true)));

        ResolverMetrics metrics = resolver.getMetrics();
        assertThat(metrics.getTotalResolutions()).isEqualTo(3);
        assertThat(metrics.getSuccesses()).isEqualTo(1);
        assertThat(metrics.getFailures(FailureKind.NO_RULE_MATCHED)).isEqualTo(1);
        assertThat(metrics.getFailures(FailureKind.INVALID_PARAMETERS)).isEqualTo(1);

        Map<String, Object> detailed = resolver.getDetailedMetrics();
        assertThat(detailed).containsEntry("modelVersion", "2.3")
                .containsEntry("nodeCount", 2)
                .containsEntry("failures.NO_RULE_MATCHED", 1L)
                .containsKey("p99LatencyNanos");
    }

    @Test
    @DisplayName("Should resolve concurrently without interference")
    void shouldResolveConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ResolutionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String region = "region-" + (i % 10);
                futures.add(pool.submit(() -> resolver.resolve(EndpointParameters.builder().set("Region", region).build())));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertThat(futures.get(i).get().orElseThrow().url()).isEqualTo("https://svc.region-" + (i % 10) + ".example.com");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(resolver.getMetrics().getSuccesses()).isEqualTo(200);
    }
}
