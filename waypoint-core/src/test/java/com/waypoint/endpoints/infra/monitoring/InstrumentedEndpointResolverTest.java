package com.waypoint.endpoints.infra.monitoring;

import com.waypoint.endpoints.api.IEndpointResolver;
import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.DiagnosticTrace;
import com.waypoint.endpoints.api.model.Endpoint;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.FailureKind;
import com.waypoint.endpoints.api.model.ResolutionFailure;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InstrumentedEndpointResolverTest {

    @Mock
    private IEndpointResolver delegate;

    private InMemoryMetricsRegistry metrics;
    private InstrumentedEndpointResolver resolver;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        resolver = new InstrumentedEndpointResolver(delegate, metrics);
    }

    private long count(String outcome) {
        return metrics.getCounterValue(InstrumentedEndpointResolver.RESOLUTIONS, "outcome", outcome);
    }

    @Test
    @DisplayName("Should count successes and time them")
    void shouldRecordSuccess() {
        ResolutionResult ok = ResolutionResult.success(Endpoint.of("https://svc.example.com"));
        when(delegate.resolve(any(EndpointParameters.class))).thenReturn(ok);

        assertThat(resolver.resolve(EndpointParameters.empty())).isSameAs(ok);
        assertThat(resolver.resolve(EndpointParameters.empty())).isSameAs(ok);

        assertThat(count("SUCCESS")).isEqualTo(2);
        assertThat(metrics.getTimerRecordings(InstrumentedEndpointResolver.LATENCY, "outcome", "SUCCESS"))
                .hasSize(2);
    }

    @Test
    @DisplayName("Should count failures by kind")
    void shouldRecordFailuresByKind() {
        when(delegate.resolve(any(EndpointParameters.class)))
                .thenReturn(ResolutionResult.failure(ResolutionFailure.noRuleMatched(DiagnosticTrace.EMPTY)))
                .thenReturn(ResolutionResult.failure(ResolutionFailure.invalidParameters("Missing required parameter 'Region'")));

        resolver.resolve(EndpointParameters.empty());
        resolver.resolve(EndpointParameters.empty());

        assertThat(count(FailureKind.NO_RULE_MATCHED.name())).isEqualTo(1);
        assertThat(count(FailureKind.INVALID_PARAMETERS.name())).isEqualTo(1);
        assertThat(count(FailureKind.RULE_DEFINED_ERROR.name())).isZero();
        assertThat(count("SUCCESS")).isZero();
    }

    @Test
    @DisplayName("Should count model errors and rethrow them")
    void shouldRecordModelErrors() {
        when(delegate.resolve(any(EndpointParameters.class))).thenThrow(new MalformedModelException("bad ref"));

        assertThatThrownBy(() -> resolver.resolve(EndpointParameters.empty()))
                .isInstanceOf(MalformedModelException.class);

        assertThat(count("MODEL_ERROR")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should forward traced resolutions to the delegate's traced call")
    void shouldForwardTracedCalls() {
        ResolutionResult ok = ResolutionResult.success(Endpoint.of("https://svc.example.com"), DiagnosticTrace.EMPTY);
        when(delegate.resolveWithTrace(any(EndpointParameters.class))).thenReturn(ok);

        assertThat(resolver.resolveWithTrace(EndpointParameters.empty())).isSameAs(ok);

        verify(delegate).resolveWithTrace(EndpointParameters.empty());
        assertThat(count("SUCCESS")).isEqualTo(1);
        assertThat(resolver.getDelegate()).isSameAs(delegate);
    }
}
