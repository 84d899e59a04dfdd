/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The compiled, executable form of an endpoint rule set.
 *
 * <p>A flat arena of decision nodes, conditions and results, addressed by
 * integer index. Node branches are stored as a Structure-of-Arrays
 * ({@link #nodeConditions}, {@link #highRefs}, {@link #lowRefs}) so the walker
 * touches three primitive arrays per step.
 *
 * <p>Instances are immutable once {@link Builder#build()} returns and may be
 * shared across threads without synchronization. A built model has already
 * passed {@link RuleModelValidator}: all indices are in range, the diagram is
 * acyclic, every reference resolves and every variable a condition reads is
 * bound on every path reaching it.
 */
public final class RuleModel implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String version;

    // --- Declarations ---
    private final Parameter[] parameters;
    private final Condition[] conditions;
    private final RuleResult[] results;

    // --- Decision diagram (Structure-of-Arrays) ---
    private final int[] nodeConditions; // Map[node -> condition index]
    private final int[] highRefs;       // Map[node -> ref when true]
    private final int[] lowRefs;        // Map[node -> ref when false]
    private final int root;

    // --- Slot lookups ---
    private final Object2IntMap<String> parameterSlots; // Map[parameter name -> slot]
    private final Object2IntMap<String> variableSlots;  // Map[binding name -> slot]
    private final int[] bindingSlots;                   // Map[condition -> variable slot or -1]
    private final Binding[] variables;                  // Map[variable slot -> binding]

    private RuleModel(Builder builder) {
        this.version = builder.version;
        this.parameters = builder.parameters.toArray(new Parameter[0]);
        this.conditions = builder.conditions.toArray(new Condition[0]);
        this.results = builder.results.toArray(new RuleResult[0]);
        this.root = builder.root;

        int nodeCount = builder.nodes.size();
        this.nodeConditions = new int[nodeCount];
        this.highRefs = new int[nodeCount];
        this.lowRefs = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            DecisionNode node = builder.nodes.get(i);
            nodeConditions[i] = node.conditionIndex();
            highRefs[i] = node.highRef();
            lowRefs[i] = node.lowRef();
        }

        this.parameterSlots = new Object2IntOpenHashMap<>();
        this.parameterSlots.defaultReturnValue(-1);
        for (int i = 0; i < parameters.length; i++) {
            parameterSlots.put(parameters[i].name(), i);
        }

        this.variableSlots = new Object2IntOpenHashMap<>();
        this.variableSlots.defaultReturnValue(-1);
        this.bindingSlots = new int[conditions.length];
        List<Binding> bound = new ArrayList<>();
        for (int i = 0; i < conditions.length; i++) {
            Binding binding = conditions[i].binding();
            if (binding == null) {
                bindingSlots[i] = -1;
            } else {
                bindingSlots[i] = bound.size();
                variableSlots.put(binding.name(), bound.size());
                bound.add(binding);
            }
        }
        this.variables = bound.toArray(new Binding[0]);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public String getVersion() {
        return version;
    }

    public int getRoot() {
        return root;
    }

    public int getNodeCount() {
        return nodeConditions.length;
    }

    public int getConditionCount() {
        return conditions.length;
    }

    public int getResultCount() {
        return results.length;
    }

    public int getParameterCount() {
        return parameters.length;
    }

    public int getVariableCount() {
        return variables.length;
    }

    public int nodeCondition(int node) {
        return nodeConditions[node];
    }

    public int highRef(int node) {
        return highRefs[node];
    }

    public int lowRef(int node) {
        return lowRefs[node];
    }

    public DecisionNode getNode(int node) {
        return new DecisionNode(nodeConditions[node], highRefs[node], lowRefs[node]);
    }

    public Condition getCondition(int index) {
        return conditions[index];
    }

    public RuleResult getResult(int index) {
        return results[index];
    }

    public Parameter getParameter(int slot) {
        return parameters[slot];
    }

    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(Arrays.asList(parameters));
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(Arrays.asList(conditions));
    }

    public List<RuleResult> getResults() {
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    /**
     * @return the parameter slot for {@code name}, or -1 if undeclared
     */
    public int parameterSlot(String name) {
        return parameterSlots.getInt(name);
    }

    /**
     * @return the variable slot for binding {@code name}, or -1 if nothing binds it
     */
    public int variableSlot(String name) {
        return variableSlots.getInt(name);
    }

    /**
     * @return the variable slot the condition binds into, or -1
     */
    public int bindingSlot(int conditionIndex) {
        return bindingSlots[conditionIndex];
    }

    public Binding getVariable(int slot) {
        return variables[slot];
    }

    /**
     * @return every function id referenced by conditions and results, sorted
     */
    public Set<String> referencedFunctions() {
        Set<String> ids = new TreeSet<>();
        for (Condition condition : conditions) {
            ids.add(condition.functionId());
            condition.arguments().forEach(arg -> collectFunctions(arg, ids));
        }
        for (RuleResult result : results) {
            result.expressions().forEach(expr -> collectFunctions(expr, ids));
        }
        return ids;
    }

    private static void collectFunctions(Expression expression, Set<String> sink) {
        expression.walk(e -> {
            if (e instanceof Expression.FunctionCall call) {
                sink.add(call.functionId());
            }
        });
    }

    @Override
    public String toString() {
        return String.format("RuleModel[version=%s, parameters=%d, conditions=%d, results=%d, nodes=%d, root=%s]",
                version, parameters.length, conditions.length, results.length,
                nodeConditions.length, NodeRef.describe(root));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static final class Builder {
        private String version = "1.0";
        private final List<Parameter> parameters = new ArrayList<>();
        private final List<Condition> conditions = new ArrayList<>();
        private final List<RuleResult> results = new ArrayList<>();
        private final List<DecisionNode> nodes = new ArrayList<>();
        private int root = NodeRef.NO_MATCH;

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            parameters.add(parameter);
            return this;
        }

        /**
         * Appends a condition. Its declared index must equal its position.
         */
        public Builder condition(Condition condition) {
            conditions.add(condition);
            return this;
        }

        /**
         * Appends a result.
         *
         * @return this builder; the result's ref is {@code NodeRef.forResult(resultCount - 1)}
         */
        public Builder result(RuleResult result) {
            results.add(result);
            return this;
        }

        public Builder node(int conditionIndex, int highRef, int lowRef) {
            nodes.add(new DecisionNode(conditionIndex, highRef, lowRef));
            return this;
        }

        public Builder node(DecisionNode node) {
            nodes.add(node);
            return this;
        }

        public Builder root(int root) {
            this.root = root;
            return this;
        }

        public int conditionCount() {
            return conditions.size();
        }

        public int resultCount() {
            return results.size();
        }

        public int nodeCount() {
            return nodes.size();
        }

        /**
         * Validates and freezes the model.
         *
         * @throws MalformedModelException if the model violates any structural rule
         */
        public RuleModel build() {
            RuleModelValidator.validate(version, parameters, conditions, results, nodes, root);
            return new RuleModel(this);
        }
    }
}
