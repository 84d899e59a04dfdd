package com.waypoint.endpoints.loader;

import com.waypoint.endpoints.api.ModelLoadListener;
import com.waypoint.endpoints.api.exceptions.FunctionNotFoundException;
import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.api.model.Endpoint;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.runtime.evaluation.EndpointResolver;
import com.waypoint.endpoints.runtime.model.Expression;
import com.waypoint.endpoints.runtime.model.ParameterType;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleModelLoaderTest {

    private static RuleModel regionalModel;
    private static EndpointResolver resolver;

    private RuleModelLoader loader;
    private Path tempDir;

    @BeforeAll
    static void loadFixture() throws Exception {
        try (InputStream in = RuleModelLoaderTest.class.getResourceAsStream("/models/regional-service.json")) {
            regionalModel = new RuleModelLoader().load(in);
        }
        resolver = new EndpointResolver(regionalModel);
    }

    @BeforeEach
    void setUp() throws IOException {
        loader = new RuleModelLoader();
        tempDir = Files.createTempDirectory("rule-model-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        if (tempDir != null) {
            try (var files = Files.walk(tempDir)) {
                files.sorted((a, b) -> b.compareTo(a)).forEach(path -> path.toFile().delete());
            }
        }
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("model.json");
        Files.writeString(file, json);
        return file;
    }

    private static RuleModel loadString(String json) throws ModelLoadException {
        return new RuleModelLoader().load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private static Endpoint resolve(EndpointParameters.Builder params) {
        return resolver.resolve(params.build()).orElseThrow();
    }

    @Test
    @DisplayName("Should load parameters, conditions, results and nodes")
    void shouldLoadModelStructure() {
        assertThat(regionalModel.getVersion()).isEqualTo("1.3");
        assertThat(regionalModel.getParameterCount()).isEqualTo(4);
        assertThat(regionalModel.getConditionCount()).isEqualTo(8);
        assertThat(regionalModel.getResultCount()).isEqualTo(10);
        assertThat(regionalModel.getNodeCount()).isEqualTo(11);

        var useFips = regionalModel.getParameter(regionalModel.parameterSlot("UseFIPS"));
        assertThat(useFips.type()).isEqualTo(ParameterType.BOOLEAN);
        assertThat(useFips.required()).isTrue();
        assertThat(useFips.builtIn()).isEqualTo("AWS::UseFIPS");
        assertThat(regionalModel.getCondition(3).binding().type()).isEqualTo(ValueType.RECORD);
    }

    @Test
    @DisplayName("Should resolve the standard regional endpoint with headers and properties")
    void shouldResolveRegionalEndpoint() {
        Endpoint endpoint = resolve(EndpointParameters.builder().set("Region", "us-west-2"));

        assertThat(endpoint.url()).isEqualTo("https://svc.us-west-2.amazonaws.com");
        assertThat(endpoint.header("x-amz-region")).containsExactly("us-west-2");
        assertThat(endpoint.property("authSchemes").render()).contains("sigv4", "us-west-2");
    }

    @Test
    @DisplayName("Should pick FIPS and dual-stack variants from the partition")
    void shouldResolveVariants() {
        assertThat(resolve(EndpointParameters.builder().set("Region", "us-east-1")
                .set("UseFIPS", true).set("UseDualStack", true)).url())
                .isEqualTo("https://svc-fips.us-east-1.api.aws");
        assertThat(resolve(EndpointParameters.builder().set("Region", "cn-north-1").set("UseDualStack", true)).url())
                .isEqualTo("https://svc.cn-north-1.api.amazonwebservices.com.cn");
        assertThat(resolve(EndpointParameters.builder().set("Region", "us-gov-west-1").set("UseFIPS", true)).url())
                .isEqualTo("https://svc-fips.us-gov-west-1.amazonaws.com");
    }

    @Test
    @DisplayName("Should surface rule-defined errors")
    void shouldSurfaceRuleErrors() {
        ResolutionResult noRegion = resolver.resolve(EndpointParameters.empty());
        ResolutionResult isoDualStack = resolver.resolve(EndpointParameters.builder()
                .set("Region", "us-iso-east-1").set("UseDualStack", true).build());

        assertThat(noRegion.failure().message()).isEqualTo("Invalid Configuration: Missing Region");
        assertThat(isoDualStack.failure().message()).contains("does not support DualStack");
    }

    @Test
    @DisplayName("Should honor a custom endpoint and reject an unusable one")
    void shouldHandleCustomEndpoint() {
        assertThat(resolve(EndpointParameters.builder().set("Endpoint", "https://custom.example.com/base")).url())
                .isEqualTo("https://custom.example.com/base");

        ResolutionResult invalid = resolver.resolve(EndpointParameters.builder().set("Endpoint", "ftp://files").build());
        assertThat(invalid.failure().message()).startsWith("Invalid Configuration: Custom endpoint");
        assertThat(invalid.failure().trace().lastError()).contains("unsupported scheme");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromPath() throws Exception {
        Path file = write("""
                {
                  "parameters": {"Region": {"type": "String"}},
                  "conditions": [{"fn": "isSet", "argv": [{"ref": "Region"}]}],
                  "results": [{"type": "endpoint", "endpoint": {"url": "https://{Region}.example.com"}}],
                  "nodes": [[0, -2, -1]],
                  "root": 0
                }
                """);

        RuleModel model = loader.load(file);

        assertThat(model.getVersion()).isEqualTo("1.0");
        RuleResult.EndpointResult result = (RuleResult.EndpointResult) model.getResult(0);
        assertThat(result.url()).isEqualTo(new Expression.Template(List.of(
                Expression.literal("https://"), Expression.param("Region"), Expression.literal(".example.com"))));
    }

    @Test
    @DisplayName("Should take binding types from assignType or the function's return type")
    void shouldTypeBindings() throws Exception {
        RuleModel model = loadString("""
                {
                  "parameters": {"Bucket": {"type": "String"}},
                  "conditions": [
                    {"fn": "uriEncode", "argv": [{"ref": "Bucket"}], "assign": "encoded"},
                    {"fn": "getAttr", "argv": [{"ref": "Bucket"}, "x"], "assign": "anything"},
                    {"fn": "getAttr", "argv": [{"ref": "Bucket"}, "y"], "assign": "typed", "assignType": "string"}
                  ],
                  "results": [{"type": "error", "error": "unused"}],
                  "nodes": [[0, 1, -1], [1, 2, -1], [2, -2, -1]],
                  "root": 0
                }
                """);

        assertThat(model.getCondition(0).binding().type()).isEqualTo(ValueType.STRING);
        assertThat(model.getCondition(1).binding().type()).isEqualTo(ValueType.ANY);
        assertThat(model.getCondition(2).binding().type()).isEqualTo(ValueType.STRING);
    }

    @Test
    @DisplayName("Should parse coalesce, nested calls and literals")
    void shouldParseExpressions() throws Exception {
        RuleModel model = loadString("""
                {
                  "parameters": {"A": {"type": "String"}, "B": {"type": "String"}},
                  "results": [{"type": "endpoint", "endpoint": {
                    "url": {"fn": "coalesce", "argv": [{"ref": "A"}, {"fn": "uriEncode", "argv": ["{B}"]}, "https://fallback"]},
                    "properties": {"flags": [true, 3, "x"]}
                  }}],
                  "root": -2
                }
                """);

        RuleResult.EndpointResult result = (RuleResult.EndpointResult) model.getResult(0);
        assertThat(result.url()).isInstanceOf(Expression.Coalesce.class);
        Expression.Coalesce coalesce = (Expression.Coalesce) result.url();
        assertThat(coalesce.options()).hasSize(3);
        assertThat(coalesce.options().get(1)).isInstanceOf(Expression.FunctionCall.class);
        assertThat(result.properties().get("flags")).isInstanceOf(Expression.ArrayLiteral.class);
    }

    @Test
    @DisplayName("Should reject references to unknown names")
    void shouldRejectUnknownReferences() {
        assertThatThrownBy(() -> loadString("""
                {"results": [{"type": "endpoint", "endpoint": {"url": "https://{Missing}.example.com"}}], "root": -2}
                """))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    @DisplayName("Should reject invalid JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> loadString("{ not json"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Invalid rule model JSON");
    }

    @Test
    @DisplayName("Should reject node references that do not fit in 32 bits")
    void shouldRejectOversizedReferences() {
        assertThatThrownBy(() -> loadString("""
                {"results": [{"type": "error", "error": "x"}], "nodes": [], "root": 4294967296}
                """))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("root");
    }

    @Test
    @DisplayName("Should reject unregistered functions at load time")
    void shouldRejectUnknownFunctions() {
        assertThatThrownBy(() -> loadString("""
                {"conditions": [{"fn": "aws.noSuchThing"}], "results": [{"type": "error", "error": "x"}],
                 "nodes": [[0, -2, -1]], "root": 0}
                """))
                .isInstanceOf(FunctionNotFoundException.class)
                .hasMessageContaining("aws.noSuchThing");
    }

    @Test
    @DisplayName("Should reject a diagram with a cycle")
    void shouldRejectCycles() {
        assertThatThrownBy(() -> loadString("""
                {"parameters": {"R": {"type": "String"}},
                 "conditions": [{"fn": "isSet", "argv": [{"ref": "R"}]}],
                 "nodes": [[0, 1, -1], [0, 0, -1]], "root": 0}
                """))
                .isInstanceOf(MalformedModelException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    @DisplayName("Should report every stage to the load listener")
    void shouldNotifyListener() throws Exception {
        List<String> events = new ArrayList<>();
        loader.setLoadListener(new ModelLoadListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
                events.add("start:" + stageName + ":" + stageNumber + "/" + totalStages);
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
                events.add("done:" + stageName);
            }

            @Override
            public void onError(String stageName, Exception error) {
                events.add("error:" + stageName);
            }
        });

        try (InputStream in = getClass().getResourceAsStream("/models/regional-service.json")) {
            loader.load(in);
        }

        assertThat(events).containsExactly(
                "start:PARSING:1/3", "done:PARSING",
                "start:VALIDATION:2/3", "done:VALIDATION",
                "start:ANALYSIS:3/3", "done:ANALYSIS");
    }

    @Test
    @DisplayName("Should report the failing stage to the load listener")
    void shouldNotifyListenerOfErrors() {
        List<String> errors = new ArrayList<>();
        loader.setLoadListener(new ModelLoadListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
            }

            @Override
            public void onError(String stageName, Exception error) {
                errors.add(stageName);
            }
        });

        assertThatThrownBy(() -> loader.load(new ByteArrayInputStream(
                "{\"results\": [], \"root\": -2}".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(MalformedModelException.class);
        assertThat(errors).containsExactly("VALIDATION");
    }

    @Test
    @DisplayName("Should wrap a missing file in a load exception")
    void shouldWrapMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(ModelLoadException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
