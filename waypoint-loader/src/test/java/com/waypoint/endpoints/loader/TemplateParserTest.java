package com.waypoint.endpoints.loader;

import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.runtime.model.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.waypoint.endpoints.runtime.model.Expression.call;
import static com.waypoint.endpoints.runtime.model.Expression.literal;
import static com.waypoint.endpoints.runtime.model.Expression.param;
import static com.waypoint.endpoints.runtime.model.Expression.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateParserTest {

    private static final Set<String> PARAMETERS = Set.of("Region", "Bucket");

    private static final TemplateParser.ReferenceResolver REFERENCES = name -> {
        if (PARAMETERS.contains(name)) {
            return param(name);
        }
        if (name.equals("arn")) {
            return variable(name);
        }
        throw new ModelLoadException("unknown " + name);
    };

    private static Expression parse(String text) throws ModelLoadException {
        return TemplateParser.parse(text, REFERENCES);
    }

    @Test
    @DisplayName("Should keep plain strings as literals")
    void shouldKeepPlainStrings() throws Exception {
        assertThat(parse("https://example.com")).isEqualTo(literal("https://example.com"));
        assertThat(parse("")).isEqualTo(literal(""));
    }

    @Test
    @DisplayName("Should split placeholders from literal text")
    void shouldParsePlaceholders() throws Exception {
        assertThat(parse("https://{Bucket}.s3.{Region}.amazonaws.com")).isEqualTo(new Expression.Template(List.of(
                literal("https://"), param("Bucket"), literal(".s3."), param("Region"), literal(".amazonaws.com"))));
        assertThat(parse("{Region}")).isEqualTo(new Expression.Template(List.of(param("Region"))));
    }

    @Test
    @DisplayName("Should read attributes through getAttr")
    void shouldParseAttributePaths() throws Exception {
        assertThat(parse("{arn#resourceId[1]}")).isEqualTo(new Expression.Template(List.of(
                call("getAttr", variable("arn"), literal("resourceId[1]")))));
    }

    @Test
    @DisplayName("Should unescape doubled braces")
    void shouldUnescapeBraces() throws Exception {
        assertThat(parse("{{literal}}")).isEqualTo(literal("{literal}"));
        assertThat(parse("{{{Region}}}")).isEqualTo(new Expression.Template(List.of(
                literal("{"), param("Region"), literal("}"))));
    }

    @Test
    @DisplayName("Should reject malformed placeholders")
    void shouldRejectMalformedPlaceholders() {
        assertThatThrownBy(() -> parse("https://{Region")).isInstanceOf(ModelLoadException.class).hasMessageContaining("Unclosed");
        assertThatThrownBy(() -> parse("a}b")).isInstanceOf(ModelLoadException.class).hasMessageContaining("Unmatched");
        assertThatThrownBy(() -> parse("{}")).isInstanceOf(ModelLoadException.class).hasMessageContaining("Empty placeholder");
        assertThatThrownBy(() -> parse("{arn#}")).isInstanceOf(ModelLoadException.class).hasMessageContaining("Empty attribute path");
        assertThatThrownBy(() -> parse("{Nope}")).isInstanceOf(ModelLoadException.class).hasMessageContaining("unknown Nope");
    }
}
