package com.waypoint.endpoints.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRefTest {

    @Test
    @DisplayName("Should encode result k as -(k + 2)")
    void shouldEncodeResults() {
        assertThat(NodeRef.forResult(0)).isEqualTo(-2);
        assertThat(NodeRef.forResult(5)).isEqualTo(-7);
        assertThat(NodeRef.resultIndex(-7)).isEqualTo(5);
    }

    @Test
    @DisplayName("Should classify node, no-match and result refs")
    void shouldClassifyRefs() {
        assertThat(NodeRef.isNode(0)).isTrue();
        assertThat(NodeRef.isNoMatch(-1)).isTrue();
        assertThat(NodeRef.isResult(-1)).isFalse();
        assertThat(NodeRef.isResult(-2)).isTrue();
        assertThat(NodeRef.describe(3)).isEqualTo("node 3");
        assertThat(NodeRef.describe(-1)).isEqualTo("no-match");
        assertThat(NodeRef.describe(-4)).isEqualTo("result 2");
    }

    @Test
    @DisplayName("Should refuse to decode a non-result ref as a result")
    void shouldRejectNonResultDecode() {
        assertThatThrownBy(() -> NodeRef.resultIndex(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
