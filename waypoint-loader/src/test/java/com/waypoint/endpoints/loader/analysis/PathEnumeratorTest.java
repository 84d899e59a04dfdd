package com.waypoint.endpoints.loader.analysis;

import com.waypoint.endpoints.loader.RuleModelLoader;
import com.waypoint.endpoints.runtime.model.Condition;
import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.ParameterType;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static com.waypoint.endpoints.runtime.model.Expression.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathEnumeratorTest {

    @Test
    @DisplayName("Should find a feasible path to every result of the regional model")
    void shouldWitnessEveryResult() throws Exception {
        RuleModel model;
        try (InputStream in = getClass().getResourceAsStream("/models/regional-service.json")) {
            model = new RuleModelLoader().load(in);
        }

        PathEnumerator.PathReport report = new PathEnumerator().enumerate(model);

        assertThat(report.truncated()).isFalse();
        assertThat(report.resultsWithoutWitness(model.getResultCount()).isEmpty()).isTrue();
        assertThat(report.paths()).hasSize(12);
    }

    @Test
    @DisplayName("Should drop paths that need two outcomes for one condition")
    void shouldPruneContradictoryPaths() {
        // c0 tested at node 0 and again at node 1 on the true branch; its false branch there is dead
        RuleModel model = RuleModel.builder()
                .parameter(Parameter.optional("Region", ParameterType.STRING))
                .condition(Condition.of(0, "isSet", param("Region")))
                .result(RuleResult.endpoint("https://live.example.com"))
                .result(RuleResult.endpoint("https://dead.example.com"))
                .result(RuleResult.error("no region"))
                .node(0, 1, NodeRef.forResult(2))
                .node(0, NodeRef.forResult(0), NodeRef.forResult(1))
                .root(0)
                .build();

        PathEnumerator.PathReport report = new PathEnumerator().enumerate(model);

        assertThat(report.paths()).hasSize(2);
        assertThat(report.paths().get(0).steps()).hasSize(1);
        assertThat(report.paths().get(0).describe()).isEqualTo("c0 -> result 0");
        assertThat(report.resultsWithoutWitness(3).toArray()).containsExactly(1);
    }

    @Test
    @DisplayName("Should stop at the path limit")
    void shouldTruncate() {
        RuleModel model = RuleModel.builder()
                .parameter(Parameter.optional("A", ParameterType.STRING))
                .parameter(Parameter.optional("B", ParameterType.STRING))
                .condition(Condition.of(0, "isSet", param("A")))
                .condition(Condition.of(1, "isSet", param("B")))
                .result(RuleResult.endpoint("https://x.example.com"))
                .node(0, 1, 1)
                .node(1, NodeRef.forResult(0), NodeRef.NO_MATCH)
                .root(0)
                .build();

        PathEnumerator.PathReport report = new PathEnumerator(3).enumerate(model);

        assertThat(report.truncated()).isTrue();
        assertThat(report.paths()).hasSize(3);
        assertThatThrownBy(() -> new PathEnumerator(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
