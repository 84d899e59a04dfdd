package com.waypoint.endpoints.runtime.diagnostics;

import com.waypoint.endpoints.api.model.DiagnosticTrace;
import com.waypoint.endpoints.api.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticsCollectorTest {

    @Test
    @DisplayName("Should record outcomes in evaluation order")
    void shouldRecordOutcomes() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.record(3, "isSet", Value.of(true), true);
        collector.record(0, "parseURL", null, false);
        collector.reportError("parseURL: unsupported scheme in 'ftp://x'");

        DiagnosticTrace trace = collector.toTrace();

        assertThat(collector.size()).isEqualTo(2);
        assertThat(trace.conditionOutcomes()).extracting(DiagnosticTrace.ConditionOutcome::conditionIndex)
                .containsExactly(3, 0);
        assertThat(trace.conditionOutcomes().get(0).value()).isEqualTo("true");
        assertThat(trace.conditionOutcomes().get(1).value()).isNull();
        assertThat(trace.lastError()).contains("unsupported scheme");
    }

    @Test
    @DisplayName("Should produce an empty trace when nothing was recorded")
    void shouldProduceEmptyTrace() {
        assertThat(new DiagnosticsCollector().toTrace().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should describe absent values")
    void shouldDescribeAbsentValues() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.record(1, "aws.parseArn", null, false);

        assertThat(collector.toTrace().conditionOutcomes().get(0).describe()).contains("#1", "aws.parseArn", "<absent>");
    }
}
