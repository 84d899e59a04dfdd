package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.RecordValue;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoreFunctionsTest {

    private DiagnosticsCollector diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsCollector();
    }

    private static Value[] args(Value... values) {
        return values;
    }

    @Nested
    @DisplayName("Boolean predicates")
    class Predicates {

        @Test
        @DisplayName("Should report presence of a value")
        void shouldReportPresence() {
            assertThat(CoreFunctions.isSet(args(Value.of("")), diagnostics)).contains(Value.of(true));
            assertThat(CoreFunctions.isSet(args((Value) null), diagnostics)).contains(Value.of(false));
        }

        @Test
        @DisplayName("Should negate booleans and reject other types")
        void shouldNegate() {
            assertThat(CoreFunctions.not(args(Value.of(false)), diagnostics)).contains(Value.of(true));
            assertThatThrownBy(() -> CoreFunctions.not(args(Value.of("true")), diagnostics))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("not");
        }

        @Test
        @DisplayName("Should never consider an absent value equal to anything")
        void shouldTreatAbsentAsUnequal() {
            assertThat(CoreFunctions.booleanEquals(args(null, Value.of(false)), diagnostics)).contains(Value.of(false));
            assertThat(CoreFunctions.stringEquals(args(null, null), diagnostics)).contains(Value.of(false));
            assertThat(CoreFunctions.stringEquals(args(Value.of("a"), Value.of("a")), diagnostics)).contains(Value.of(true));
            assertThat(CoreFunctions.booleanEquals(args(Value.of(true), Value.of(true)), diagnostics)).contains(Value.of(true));
        }

        @Test
        @DisplayName("Should reject a call with the wrong number of arguments")
        void shouldCheckArity() {
            assertThatThrownBy(() -> CoreFunctions.stringEquals(args(Value.of("a")), diagnostics))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("stringEquals");
        }
    }

    @Nested
    @DisplayName("getAttr")
    class GetAttr {

        private final Value record = new RecordValue(Map.of(
                "name", Value.of("bucket"),
                "parts", Value.ofStrings(List.of("a", "b", "c")),
                "nested", new RecordValue(Map.of("leaf", Value.of("deep")))));

        @Test
        @DisplayName("Should follow dotted and indexed paths")
        void shouldFollowPaths() {
            assertThat(CoreFunctions.getAttr(args(record, Value.of("name")), diagnostics)).contains(Value.of("bucket"));
            assertThat(CoreFunctions.getAttr(args(record, Value.of("parts[2]")), diagnostics)).contains(Value.of("c"));
            assertThat(CoreFunctions.getAttr(args(record, Value.of("nested.leaf")), diagnostics)).contains(Value.of("deep"));
            assertThat(CoreFunctions.getAttr(args(Value.ofStrings(List.of("x")), Value.of("[0]")), diagnostics))
                    .contains(Value.of("x"));
        }

        @Test
        @DisplayName("Should yield absent for missing members and out of range indexes")
        void shouldYieldAbsentForMissing() {
            assertThat(CoreFunctions.getAttr(args(record, Value.of("missing")), diagnostics)).isEmpty();
            assertThat(CoreFunctions.getAttr(args(record, Value.of("parts[3]")), diagnostics)).isEmpty();
            assertThat(diagnostics.getErrors()).isEmpty();
        }

        @Test
        @DisplayName("Should report reading a member of a non-structured value")
        void shouldReportWrongTarget() {
            Optional<Value> result = CoreFunctions.getAttr(args(Value.of("text"), Value.of("name")), diagnostics);

            assertThat(result).isEmpty();
            assertThat(diagnostics.getErrors()).singleElement().asString().contains("name");
        }

        @Test
        @DisplayName("Should reject malformed paths")
        void shouldRejectMalformedPaths() {
            assertThatThrownBy(() -> CoreFunctions.getAttr(args(record, Value.of("parts[1")), diagnostics))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("unclosed");
            assertThatThrownBy(() -> CoreFunctions.getAttr(args(record, Value.of("parts[x]")), diagnostics))
                    .isInstanceOf(MalformedModelException.class);
            assertThatThrownBy(() -> CoreFunctions.getAttr(args(record, Value.of("a..b")), diagnostics))
                    .isInstanceOf(MalformedModelException.class);
        }
    }

    @Nested
    @DisplayName("substring")
    class Substring {

        private Optional<Value> substring(String input, int start, int stop, boolean reverse) {
            return CoreFunctions.substring(args(Value.of(input), Value.of(start), Value.of(stop), Value.of(reverse)), diagnostics);
        }

        @Test
        @DisplayName("Should slice from the start or from the end")
        void shouldSlice() {
            assertThat(substring("abcdefg", 0, 4, false)).contains(Value.of("abcd"));
            assertThat(substring("abcdefg", 0, 4, true)).contains(Value.of("defg"));
            assertThat(substring("abcdefg", 1, 3, true)).contains(Value.of("ef"));
        }

        @Test
        @DisplayName("Should yield absent for ranges outside the input")
        void shouldRejectBadRanges() {
            assertThat(substring("abc", 0, 4, false)).isEmpty();
            assertThat(substring("abc", 2, 2, false)).isEmpty();
            assertThat(substring("abc", -1, 2, false)).isEmpty();
        }

        @Test
        @DisplayName("Should refuse non-ASCII input")
        void shouldRefuseNonAscii() {
            assertThat(substring("cafés", 0, 2, false)).isEmpty();
            assertThat(diagnostics.getErrors()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("split")
    class Split {

        private Optional<Value> split(String input, String delimiter, int limit) {
            return CoreFunctions.split(args(Value.of(input), Value.of(delimiter), Value.of(limit)), diagnostics);
        }

        @Test
        @DisplayName("Should keep empty parts and honor the limit")
        void shouldSplit() {
            assertThat(split("a--b", "-", 0)).contains(Value.ofStrings(List.of("a", "", "b")));
            assertThat(split("a-b-c", "-", 2)).contains(Value.ofStrings(List.of("a", "b-c")));
            assertThat(split("a-b-c", "-", 1)).contains(Value.ofStrings(List.of("a-b-c")));
            assertThat(split("", "-", 0)).contains(Value.ofStrings(List.of("")));
        }

        @Test
        @DisplayName("Should reject an empty delimiter or a negative limit")
        void shouldRejectBadArguments() {
            assertThatThrownBy(() -> split("abc", "", 0)).isInstanceOf(MalformedModelException.class);
            assertThatThrownBy(() -> split("abc", "-", -1)).isInstanceOf(MalformedModelException.class);
        }
    }
}
