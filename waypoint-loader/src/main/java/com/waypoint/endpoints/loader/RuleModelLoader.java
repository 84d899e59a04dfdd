/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.waypoint.endpoints.api.IRuleModelLoader;
import com.waypoint.endpoints.api.ModelLoadListener;
import com.waypoint.endpoints.api.exceptions.FunctionNotFoundException;
import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.api.exceptions.RuleModelException;
import com.waypoint.endpoints.api.model.ArrayValue;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.loader.analysis.ReachabilityAnalyzer;
import com.waypoint.endpoints.loader.analysis.ReachabilityAnalyzer.ReachabilityReport;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.Binding;
import com.waypoint.endpoints.runtime.model.Condition;
import com.waypoint.endpoints.runtime.model.Expression;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.ParameterType;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the JSON table format into a validated {@link RuleModel}.
 *
 * <h2>Format</h2>
 * <pre>{@code
 * {
 *   "version": "1.1",
 *   "parameters": { "Region": {"type": "String", "builtIn": "AWS::Region"} },
 *   "conditions": [ {"fn": "isSet", "argv": [{"ref": "Region"}]},
 *                   {"fn": "aws.partition", "argv": [{"ref": "Region"}], "assign": "PartitionResult"} ],
 *   "results": [ {"type": "endpoint", "endpoint": {"url": "https://svc.{Region}.{PartitionResult#dnsSuffix}"}},
 *                {"type": "error", "error": "Region must be set"} ],
 *   "nodes": [[0, 1, -3], [1, -2, -1]],
 *   "root": 0
 * }
 * }</pre>
 *
 * <p>Loading runs in three stages reported to the {@link ModelLoadListener}:
 * PARSING converts JSON to model parts, VALIDATION builds the model and checks
 * that every function is registered, ANALYSIS reports unreachable results and
 * conditions.
 */
public class RuleModelLoader implements IRuleModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(RuleModelLoader.class);

    private static final int TOTAL_STAGES = 3;
    private static final String STAGE_PARSING = "PARSING";
    private static final String STAGE_VALIDATION = "VALIDATION";
    private static final String STAGE_ANALYSIS = "ANALYSIS";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FunctionRegistry registry;
    private final ReachabilityAnalyzer reachabilityAnalyzer = new ReachabilityAnalyzer();
    private Tracer tracer;
    private ModelLoadListener listener;

    /**
     * @param registry used for function return types and to reject unknown functions
     */
    public RuleModelLoader(FunctionRegistry registry, Tracer tracer) {
        this.registry = registry;
        this.tracer = tracer;
    }

    public RuleModelLoader(FunctionRegistry registry) {
        this(registry, OpenTelemetry.noop().getTracer("waypoint-loader"));
    }

    public RuleModelLoader() {
        this(FunctionRegistry.standard());
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setLoadListener(ModelLoadListener listener) {
        this.listener = listener;
    }

    @Override
    public RuleModel load(Path modelPath) throws ModelLoadException {
        try (InputStream in = Files.newInputStream(modelPath)) {
            return load(in, modelPath.toString());
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read rule model " + modelPath, e);
        }
    }

    @Override
    public RuleModel load(InputStream json) throws ModelLoadException {
        return load(json, "<stream>");
    }

    private RuleModel load(InputStream json, String source) throws ModelLoadException {
        Span span = tracer.spanBuilder("load-rule-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", source);
            long start = System.nanoTime();

            // Stage 1: parse
            stageStart(STAGE_PARSING, 1);
            long stageStart = System.nanoTime();
            RuleModel.Builder builder;
            try {
                builder = parse(readTree(json));
            } catch (ModelLoadException e) {
                stageError(STAGE_PARSING, e);
                throw e;
            }
            stageComplete(STAGE_PARSING, stageStart, Map.of(
                    "conditionCount", builder.conditionCount(),
                    "resultCount", builder.resultCount(),
                    "nodeCount", builder.nodeCount()));

            // Stage 2: validate
            stageStart(STAGE_VALIDATION, 2);
            stageStart = System.nanoTime();
            RuleModel model;
            try {
                model = builder.build();
                for (String functionId : model.referencedFunctions()) {
                    if (!registry.contains(functionId)) {
                        throw new FunctionNotFoundException(functionId);
                    }
                }
            } catch (RuleModelException e) {
                stageError(STAGE_VALIDATION, e);
                throw e;
            }
            stageComplete(STAGE_VALIDATION, stageStart, Map.of("functionCount", model.referencedFunctions().size()));

            // Stage 3: analyze
            stageStart(STAGE_ANALYSIS, 3);
            stageStart = System.nanoTime();
            ReachabilityReport reachability = reachabilityAnalyzer.analyze(model);
            if (reachability.hasUnreachableResults()) {
                logger.warn("Rule model {} has unreachable results: {}", model.getVersion(), reachability.unreachableResults());
            }
            if (reachability.hasUnreachableConditions()) {
                logger.warn("Rule model {} has unreachable conditions: {}", model.getVersion(), reachability.unreachableConditions());
            }
            stageComplete(STAGE_ANALYSIS, stageStart, reachability.toMetrics());

            span.setAttribute("model.version", model.getVersion());
            span.setAttribute("nodeCount", model.getNodeCount());
            span.setAttribute("conditionCount", model.getConditionCount());
            span.setAttribute("resultCount", model.getResultCount());
            logger.info("Loaded rule model {} from {}: {} parameters, {} conditions, {} results, {} nodes in {} ms",
                    model.getVersion(), source, model.getParameterCount(), model.getConditionCount(),
                    model.getResultCount(), model.getNodeCount(), (System.nanoTime() - start) / 1_000_000);
            return model;
        } catch (ModelLoadException | RuleModelException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private JsonNode readTree(InputStream json) throws ModelLoadException {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new ModelLoadException("Rule model must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ModelLoadException("Invalid rule model JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read rule model", e);
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PARSING
    // ════════════════════════════════════════════════════════════════════════════════

    private RuleModel.Builder parse(JsonNode root) throws ModelLoadException {
        RuleModel.Builder builder = RuleModel.builder();
        if (root.hasNonNull("version")) {
            builder.version(root.get("version").asText());
        }

        Set<String> parameterNames = new HashSet<>();
        JsonNode parameters = root.path("parameters");
        if (!parameters.isMissingNode() && !parameters.isObject()) {
            throw new ModelLoadException("'parameters' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.parameter(parseParameter(field.getKey(), field.getValue()));
            parameterNames.add(field.getKey());
        }

        JsonNode conditions = array(root, "conditions");
        Set<String> bindingNames = new HashSet<>();
        for (JsonNode condition : conditions) {
            if (condition.hasNonNull("assign")) {
                bindingNames.add(condition.get("assign").asText());
            }
        }
        TemplateParser.ReferenceResolver references = name -> {
            if (parameterNames.contains(name)) {
                return Expression.param(name);
            }
            if (bindingNames.contains(name)) {
                return Expression.variable(name);
            }
            throw new ModelLoadException("Reference to unknown parameter or binding '" + name + "'");
        };

        for (int i = 0; i < conditions.size(); i++) {
            builder.condition(parseCondition(i, conditions.get(i), references));
        }

        JsonNode results = array(root, "results");
        for (int i = 0; i < results.size(); i++) {
            builder.result(parseResult(i, results.get(i), references));
        }

        JsonNode nodes = array(root, "nodes");
        for (int i = 0; i < nodes.size(); i++) {
            JsonNode node = nodes.get(i);
            if (!node.isArray() || node.size() != 3) {
                throw new ModelLoadException("Node " + i + " must be an array of [condition, high, low]");
            }
            builder.node(intValue(node.get(0), "node " + i + " condition"),
                    intValue(node.get(1), "node " + i + " high"),
                    intValue(node.get(2), "node " + i + " low"));
        }

        if (!root.has("root")) {
            throw new ModelLoadException("Rule model has no 'root'");
        }
        builder.root(intValue(root.get("root"), "root"));
        return builder;
    }

    private Parameter parseParameter(String name, JsonNode node) throws ModelLoadException {
        if (!node.isObject()) {
            throw new ModelLoadException("Parameter '" + name + "' must be an object");
        }
        ParameterType type = ParameterType.fromString(node.path("type").asText(null));
        if (type == null) {
            throw new ModelLoadException("Parameter '" + name + "' has unknown type '" + node.path("type").asText() + "'");
        }
        Value defaultValue = node.hasNonNull("default") ? literalValue(node.get("default"), "default of " + name) : null;
        return new Parameter(
                name,
                type,
                node.path("required").asBoolean(false),
                defaultValue,
                node.path("builtIn").asText(null),
                node.path("documentation").asText(null),
                deprecation(node.path("deprecated")));
    }

    private static String deprecation(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.path("message").asText(node.toString());
    }

    private Condition parseCondition(int index, JsonNode node, TemplateParser.ReferenceResolver references)
            throws ModelLoadException {
        String context = "condition #" + index;
        if (!node.hasNonNull("fn")) {
            throw new ModelLoadException(context + " has no 'fn'");
        }
        String functionId = node.get("fn").asText();
        List<Expression> arguments = parseArguments(node.path("argv"), references, context);

        Binding binding = null;
        if (node.hasNonNull("assign")) {
            String name = node.get("assign").asText();
            ValueType type;
            if (node.hasNonNull("assignType")) {
                type = ValueType.fromString(node.get("assignType").asText());
                if (type == null) {
                    throw new ModelLoadException(context + " has unknown assignType '" + node.get("assignType").asText() + "'");
                }
            } else {
                type = registry.returnType(functionId);
            }
            binding = new Binding(name, type);
        }
        return new Condition(index, functionId, arguments, binding);
    }

    private RuleResult parseResult(int index, JsonNode node, TemplateParser.ReferenceResolver references)
            throws ModelLoadException {
        String context = "result " + index;
        String type = node.path("type").asText("");
        switch (type) {
            case "error":
                if (!node.has("error")) {
                    throw new ModelLoadException(context + " has no 'error'");
                }
                return new RuleResult.ErrorResult(parseExpression(node.get("error"), references, context));
            case "endpoint":
                JsonNode endpoint = node.path("endpoint");
                if (!endpoint.has("url")) {
                    throw new ModelLoadException(context + " has no endpoint 'url'");
                }
                Expression url = parseExpression(endpoint.get("url"), references, context);

                Map<String, List<Expression>> headers = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> headerFields = endpoint.path("headers").fields();
                while (headerFields.hasNext()) {
                    Map.Entry<String, JsonNode> header = headerFields.next();
                    if (!header.getValue().isArray()) {
                        throw new ModelLoadException(context + " header '" + header.getKey() + "' must be an array");
                    }
                    headers.put(header.getKey(), parseArguments(header.getValue(), references, context));
                }

                Map<String, Expression> properties = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> propertyFields = endpoint.path("properties").fields();
                while (propertyFields.hasNext()) {
                    Map.Entry<String, JsonNode> property = propertyFields.next();
                    properties.put(property.getKey(), parseExpression(property.getValue(), references, context));
                }
                return new RuleResult.EndpointResult(url, headers, properties);
            default:
                throw new ModelLoadException(context + " has unknown type '" + type + "'");
        }
    }

    private List<Expression> parseArguments(JsonNode argv, TemplateParser.ReferenceResolver references, String context)
            throws ModelLoadException {
        if (argv.isMissingNode()) {
            return List.of();
        }
        if (!argv.isArray()) {
            throw new ModelLoadException(context + ": 'argv' must be an array");
        }
        List<Expression> arguments = new ArrayList<>(argv.size());
        for (JsonNode argument : argv) {
            arguments.add(parseExpression(argument, references, context));
        }
        return arguments;
    }

    private Expression parseExpression(JsonNode node, TemplateParser.ReferenceResolver references, String context)
            throws ModelLoadException {
        if (node.isTextual()) {
            return TemplateParser.parse(node.asText(), references);
        }
        if (node.isBoolean()) {
            return Expression.literal(node.booleanValue());
        }
        if (node.isInt()) {
            return Expression.literal(node.intValue());
        }
        if (node.isArray()) {
            List<Expression> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(parseExpression(element, references, context));
            }
            return new Expression.ArrayLiteral(elements);
        }
        if (node.isObject()) {
            if (node.has("ref")) {
                return references.resolve(node.get("ref").asText());
            }
            if (node.has("fn")) {
                String functionId = node.get("fn").asText();
                List<Expression> arguments = parseArguments(node.path("argv"), references, context);
                if ("coalesce".equals(functionId)) {
                    if (arguments.isEmpty()) {
                        throw new ModelLoadException(context + ": coalesce needs at least one option");
                    }
                    return new Expression.Coalesce(arguments);
                }
                return new Expression.FunctionCall(functionId, arguments);
            }
            Map<String, Expression> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                members.put(field.getKey(), parseExpression(field.getValue(), references, context));
            }
            return new Expression.RecordLiteral(members);
        }
        throw new ModelLoadException(context + ": unsupported expression " + node);
    }

    private static Value literalValue(JsonNode node, String context) throws ModelLoadException {
        if (node.isTextual()) {
            return Value.of(node.asText());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isArray()) {
            List<Value> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(literalValue(element, context));
            }
            return new ArrayValue(elements);
        }
        throw new ModelLoadException("Unsupported literal for " + context + ": " + node);
    }

    private static JsonNode array(JsonNode root, String field) throws ModelLoadException {
        JsonNode node = root.path(field);
        if (node.isMissingNode()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!node.isArray()) {
            throw new ModelLoadException("'" + field + "' must be an array");
        }
        return node;
    }

    private static int intValue(JsonNode node, String context) throws ModelLoadException {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ModelLoadException(context + " must be a 32-bit integer, got " + node);
        }
        return node.intValue();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LISTENER NOTIFICATIONS
    // ════════════════════════════════════════════════════════════════════════════════

    private void stageStart(String stage, int number) {
        if (listener != null) {
            listener.onStageStart(stage, number, TOTAL_STAGES);
        }
    }

    private void stageComplete(String stage, long startNanos, Map<String, Object> metrics) {
        if (listener != null) {
            listener.onStageComplete(stage, new ModelLoadListener.StageResult(
                    stage, System.nanoTime() - startNanos, new HashMap<>(metrics)));
        }
    }

    private void stageError(String stage, Exception error) {
        if (listener != null) {
            listener.onError(stage, error);
        }
    }
}
