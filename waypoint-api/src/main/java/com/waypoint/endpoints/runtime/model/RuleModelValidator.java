/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.Value;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.roaringbitmap.RoaringBitmap;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run once when a {@link RuleModel} is built.
 *
 * <p>The variable check is a "must" dataflow analysis over the diagram: for
 * every reachable node, the set of conditions evaluated on <em>every</em> path
 * from the root is the intersection of its predecessors' sets. A condition may
 * only read a variable whose binding condition is in that set.
 */
final class RuleModelValidator {

    private static final byte WHITE = 0;
    private static final byte GREY = 1;
    private static final byte BLACK = 2;

    private RuleModelValidator() {
    }

    static void validate(String version,
                         List<Parameter> parameters,
                         List<Condition> conditions,
                         List<RuleResult> results,
                         List<DecisionNode> nodes,
                         int root) {
        if (version == null || version.isBlank()) {
            throw new MalformedModelException("Model version must not be empty");
        }

        Object2IntMap<String> parameterSlots = checkParameters(parameters);
        Object2IntMap<String> binders = checkBindings(conditions, parameterSlots);

        for (Condition condition : conditions) {
            for (Expression argument : condition.arguments()) {
                checkReferences(argument, parameterSlots, binders, "condition #" + condition.index());
            }
        }
        for (int i = 0; i < results.size(); i++) {
            for (Expression expression : results.get(i).expressions()) {
                checkReferences(expression, parameterSlots, binders, "result " + i);
            }
        }

        checkRefs(conditions.size(), results.size(), nodes, root);
        IntArrayList order = topologicalOrder(nodes, root);
        checkBoundBeforeRead(conditions, nodes, root, order, binders);
    }

    private static Object2IntMap<String> checkParameters(List<Parameter> parameters) {
        Object2IntMap<String> slots = new Object2IntOpenHashMap<>();
        slots.defaultReturnValue(-1);
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (parameter.name().isEmpty()) {
                throw new MalformedModelException("Parameter name must not be empty");
            }
            if (slots.containsKey(parameter.name())) {
                throw new MalformedModelException("Duplicate parameter: " + parameter.name());
            }
            Value defaultValue = parameter.defaultValue();
            if (defaultValue != null && !parameter.type().matches(defaultValue)) {
                throw new MalformedModelException(String.format(
                        "Default for parameter '%s' is not a %s: %s",
                        parameter.name(), parameter.type().getSerializedName(), defaultValue));
            }
            slots.put(parameter.name(), i);
        }
        return slots;
    }

    /**
     * @return binding name to the index of the condition that binds it
     */
    private static Object2IntMap<String> checkBindings(List<Condition> conditions,
                                                       Object2IntMap<String> parameterSlots) {
        Object2IntMap<String> binders = new Object2IntOpenHashMap<>();
        binders.defaultReturnValue(-1);
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            if (condition.index() != i) {
                throw new MalformedModelException(String.format(
                        "Condition at position %d declares index %d", i, condition.index()));
            }
            if (!condition.hasBinding()) {
                continue;
            }
            String name = condition.binding().name();
            if (name.isEmpty()) {
                throw new MalformedModelException("Condition #" + i + " has an empty binding name");
            }
            if (parameterSlots.containsKey(name)) {
                throw new MalformedModelException(String.format(
                        "Condition #%d binds '%s', which is already a parameter", i, name));
            }
            if (binders.containsKey(name)) {
                throw new MalformedModelException(String.format(
                        "Variable '%s' is bound by both condition #%d and #%d",
                        name, binders.getInt(name), i));
            }
            binders.put(name, i);
        }
        return binders;
    }

    private static void checkReferences(Expression expression,
                                        Object2IntMap<String> parameterSlots,
                                        Object2IntMap<String> binders,
                                        String owner) {
        expression.walk(e -> {
            if (e instanceof Expression.ParameterRef ref && !parameterSlots.containsKey(ref.name())) {
                throw new MalformedModelException(owner + " references undeclared parameter '" + ref.name() + "'");
            }
            if (e instanceof Expression.VariableRef ref && !binders.containsKey(ref.name())) {
                throw new MalformedModelException(owner + " references unbound variable '" + ref.name() + "'");
            }
        });
    }

    private static void checkRefs(int conditionCount, int resultCount, List<DecisionNode> nodes, int root) {
        checkRef(root, nodes.size(), resultCount, "root");
        for (int i = 0; i < nodes.size(); i++) {
            DecisionNode node = nodes.get(i);
            if (node.conditionIndex() < 0 || node.conditionIndex() >= conditionCount) {
                throw new MalformedModelException(String.format(
                        "Node %d references condition %d, but only %d exist",
                        i, node.conditionIndex(), conditionCount));
            }
            checkRef(node.highRef(), nodes.size(), resultCount, "node " + i + " high");
            checkRef(node.lowRef(), nodes.size(), resultCount, "node " + i + " low");
        }
    }

    private static void checkRef(int ref, int nodeCount, int resultCount, String owner) {
        if (NodeRef.isNode(ref) && ref >= nodeCount) {
            throw new MalformedModelException(String.format(
                    "%s points to node %d, but only %d exist", owner, ref, nodeCount));
        }
        if (NodeRef.isResult(ref) && NodeRef.resultIndex(ref) >= resultCount) {
            throw new MalformedModelException(String.format(
                    "%s points to result %d, but only %d exist", owner, NodeRef.resultIndex(ref), resultCount));
        }
    }

    /**
     * Iterative DFS over every node. Fails on a back edge.
     *
     * @return nodes reachable from {@code root}, parents before children
     */
    private static IntArrayList topologicalOrder(List<DecisionNode> nodes, int root) {
        byte[] color = new byte[nodes.size()];
        IntArrayList postOrder = new IntArrayList(nodes.size());
        IntArrayList rootPostOrder = new IntArrayList();

        if (NodeRef.isNode(root)) {
            visit(root, nodes, color, rootPostOrder);
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (color[i] == WHITE) {
                visit(i, nodes, color, postOrder);
            }
        }

        IntArrayList order = new IntArrayList(rootPostOrder.size());
        for (int i = rootPostOrder.size() - 1; i >= 0; i--) {
            order.add(rootPostOrder.getInt(i));
        }
        return order;
    }

    private static void visit(int start, List<DecisionNode> nodes, byte[] color, IntArrayList postOrder) {
        // stack entries: node index, and how many children have been pushed (0..2)
        IntArrayList stack = new IntArrayList();
        IntArrayList progress = new IntArrayList();
        stack.add(start);
        progress.add(0);
        color[start] = GREY;

        while (!stack.isEmpty()) {
            int top = stack.size() - 1;
            int node = stack.getInt(top);
            int step = progress.getInt(top);
            if (step == 2) {
                stack.removeInt(top);
                progress.removeInt(top);
                color[node] = BLACK;
                postOrder.add(node);
                continue;
            }
            progress.set(top, step + 1);
            DecisionNode decision = nodes.get(node);
            int child = step == 0 ? decision.highRef() : decision.lowRef();
            if (!NodeRef.isNode(child)) {
                continue;
            }
            if (color[child] == GREY) {
                throw new MalformedModelException("Decision diagram contains a cycle through node " + child);
            }
            if (color[child] == WHITE) {
                color[child] = GREY;
                stack.add(child);
                progress.add(0);
            }
        }
    }

    private static void checkBoundBeforeRead(List<Condition> conditions,
                                             List<DecisionNode> nodes,
                                             int root,
                                             IntArrayList order,
                                             Object2IntMap<String> binders) {
        if (!NodeRef.isNode(root) || binders.isEmpty()) {
            return;
        }
        RoaringBitmap[] evaluatedBefore = new RoaringBitmap[nodes.size()];
        evaluatedBefore[root] = new RoaringBitmap();

        for (int i = 0; i < order.size(); i++) {
            int node = order.getInt(i);
            RoaringBitmap before = evaluatedBefore[node];
            int conditionIndex = nodes.get(node).conditionIndex();

            for (String variable : readVariables(conditions.get(conditionIndex))) {
                int binder = binders.getInt(variable);
                if (!before.contains(binder)) {
                    throw new MalformedModelException(String.format(
                            "Condition #%d at node %d reads '%s', which condition #%d does not bind on every path",
                            conditionIndex, node, variable, binder));
                }
            }

            RoaringBitmap after = before.clone();
            after.add(conditionIndex);
            propagate(nodes.get(node).highRef(), after, evaluatedBefore);
            propagate(nodes.get(node).lowRef(), after, evaluatedBefore);
        }
    }

    private static void propagate(int child, RoaringBitmap after, RoaringBitmap[] evaluatedBefore) {
        if (!NodeRef.isNode(child)) {
            return;
        }
        if (evaluatedBefore[child] == null) {
            evaluatedBefore[child] = after.clone();
        } else {
            evaluatedBefore[child].and(after);
        }
    }

    private static Set<String> readVariables(Condition condition) {
        Set<String> names = new HashSet<>();
        for (Expression argument : condition.arguments()) {
            argument.walk(e -> {
                if (e instanceof Expression.VariableRef ref) {
                    names.add(ref.name());
                }
            });
        }
        return names;
    }
}
