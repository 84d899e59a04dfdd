/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.loader;

import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.runtime.functions.CoreFunctions;
import com.waypoint.endpoints.runtime.model.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns serialized strings into expressions.
 *
 * <p>{@code {Name}} reads a parameter or binding, {@code {Name#path}} reads an
 * attribute of it through {@code getAttr}, and {@code {{} / {@code }}} stand for
 * literal braces. A string without placeholders becomes a plain literal.
 */
final class TemplateParser {

    /**
     * Resolves a placeholder name to a parameter or variable reference.
     */
    @FunctionalInterface
    interface ReferenceResolver {
        Expression resolve(String name) throws ModelLoadException;
    }

    private TemplateParser() {
    }

    static Expression parse(String text, ReferenceResolver references) throws ModelLoadException {
        List<Expression> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '{') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = text.indexOf('}', i + 1);
                if (close < 0) {
                    throw new ModelLoadException("Unclosed '{' at offset " + i + " in template \"" + text + "\"");
                }
                if (literal.length() > 0) {
                    parts.add(Expression.literal(literal.toString()));
                    literal.setLength(0);
                }
                parts.add(placeholder(text.substring(i + 1, close), text, references));
                i = close + 1;
            } else if (ch == '}') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new ModelLoadException("Unmatched '}' at offset " + i + " in template \"" + text + "\"");
            } else {
                literal.append(ch);
                i++;
            }
        }

        if (parts.isEmpty()) {
            return Expression.literal(literal.toString());
        }
        if (literal.length() > 0) {
            parts.add(Expression.literal(literal.toString()));
        }
        return new Expression.Template(parts);
    }

    private static Expression placeholder(String body, String text, ReferenceResolver references)
            throws ModelLoadException {
        int hash = body.indexOf('#');
        String name = (hash < 0 ? body : body.substring(0, hash)).trim();
        if (name.isEmpty()) {
            throw new ModelLoadException("Empty placeholder in template \"" + text + "\"");
        }
        Expression target = references.resolve(name);
        if (hash < 0) {
            return target;
        }
        String path = body.substring(hash + 1).trim();
        if (path.isEmpty()) {
            throw new ModelLoadException("Empty attribute path in placeholder {" + body + "} of \"" + text + "\"");
        }
        return Expression.call(CoreFunctions.GET_ATTR, target, Expression.literal(path));
    }
}
