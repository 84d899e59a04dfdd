package com.waypoint.endpoints.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

    @Test
    @DisplayName("Should convert plain Java objects into values")
    void shouldConvertPlainObjects() {
        assertThat(Value.fromObject("us-east-1")).isEqualTo(new StringValue("us-east-1"));
        assertThat(Value.fromObject(true)).isEqualTo(BooleanValue.TRUE);
        assertThat(Value.fromObject(7L)).isEqualTo(new IntegerValue(7));
        assertThat(Value.fromObject(null)).isNull();

        Value array = Value.fromObject(List.of("a", "b"));
        assertThat(array).isInstanceOf(ArrayValue.class);
        assertThat(((ArrayValue) array).isStringArray()).isTrue();
        assertThat(((ArrayValue) array).asStrings()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should compare structured values by content")
    void shouldCompareRecordsByValue() {
        Value first = Value.fromObject(Map.of("name", "aws", "supportsFIPS", true));
        Value second = new RecordValue(Map.of("supportsFIPS", BooleanValue.TRUE, "name", Value.of("aws")));

        assertThat(first).isEqualTo(second);
        assertThat(((StructuredValue) first).attribute("name")).isEqualTo(Value.of("aws"));
    }

    @Test
    @DisplayName("Should reject integers outside the 32-bit range")
    void shouldRejectOutOfRangeInteger() {
        assertThatThrownBy(() -> Value.fromObject(1L << 40))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should raise when reading the wrong payload type")
    void shouldRaiseOnWrongAccessor() {
        assertThatThrownBy(() -> Value.of(true).asString())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Expected STRING");
    }

    @Test
    @DisplayName("Should return null for array index out of bounds")
    void shouldReturnNullOutOfBounds() {
        ArrayValue array = Value.ofStrings(List.of("x"));
        assertThat(array.get(0)).isEqualTo(Value.of("x"));
        assertThat(array.get(1)).isNull();
        assertThat(array.get(-1)).isNull();
    }
}
