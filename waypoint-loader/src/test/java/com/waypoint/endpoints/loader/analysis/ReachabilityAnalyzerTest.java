package com.waypoint.endpoints.loader.analysis;

import com.waypoint.endpoints.runtime.model.Condition;
import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.ParameterType;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.waypoint.endpoints.runtime.model.Expression.param;
import static org.assertj.core.api.Assertions.assertThat;

class ReachabilityAnalyzerTest {

    private final ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer();

    @Test
    @DisplayName("Should report results, conditions and nodes the root cannot reach")
    void shouldReportUnreachableElements() {
        // node 1 and result 2 hang off nothing
        RuleModel model = RuleModel.builder()
                .parameter(Parameter.optional("Region", ParameterType.STRING))
                .condition(Condition.of(0, "isSet", param("Region")))
                .condition(Condition.of(1, "isSet", param("Region")))
                .result(RuleResult.endpoint("https://a.example.com"))
                .result(RuleResult.error("no region"))
                .result(RuleResult.endpoint("https://orphan.example.com"))
                .node(0, NodeRef.forResult(0), NodeRef.forResult(1))
                .node(1, NodeRef.forResult(2), NodeRef.NO_MATCH)
                .root(0)
                .build();

        ReachabilityAnalyzer.ReachabilityReport report = analyzer.analyze(model);

        assertThat(report.reachableResults().toArray()).containsExactly(0, 1);
        assertThat(report.unreachableResults().toArray()).containsExactly(2);
        assertThat(report.unreachableConditions().toArray()).containsExactly(1);
        assertThat(report.unreachableNodes().toArray()).containsExactly(1);
        assertThat(report.noMatchReachable()).isFalse();
        assertThat(report.toMetrics()).containsEntry("unreachableResults", 1);
    }

    @Test
    @DisplayName("Should handle a root that is already terminal")
    void shouldHandleTerminalRoot() {
        RuleModel model = RuleModel.builder()
                .result(RuleResult.endpoint("https://only.example.com"))
                .root(NodeRef.forResult(0))
                .build();

        ReachabilityAnalyzer.ReachabilityReport report = analyzer.analyze(model);

        assertThat(report.reachableNodes().isEmpty()).isTrue();
        assertThat(report.hasUnreachableResults()).isFalse();
        assertThat(report.hasUnreachableConditions()).isFalse();
    }
}
