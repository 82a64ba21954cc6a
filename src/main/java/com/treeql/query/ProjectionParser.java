package com.treeql.query;

import com.treeql.statement.StatementException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * Parses projection paths such as {@code .groups.coffee.items} or
 * {@code items.{name, price, group: category}}.
 */
public class ProjectionParser {
    public ProjectionNode parse(String path) {
        if (path == null || path.isBlank()) {
            return new ProjectionNode.Chain(Lists.immutable.empty());
        }

        String trimmed = path.trim();
        if (trimmed.equals(".")) {
            return new ProjectionNode.Chain(Lists.immutable.empty());
        }

        MutableList<ProjectionNode> steps = Lists.mutable.empty();
        for (String segment : splitTopLevel(trimmed, '.')) {
            String step = segment.trim();
            if (step.isEmpty()) {
                continue;
            }
            steps.add(step.startsWith("{") ? parseShape(step) : new ProjectionNode.Access(step));
        }
        return steps.size() == 1 ? steps.getFirst() : new ProjectionNode.Chain(steps.toImmutable());
    }

    private ProjectionNode parseShape(String text) {
        if (!text.endsWith("}")) {
            throw new StatementException("Unterminated shape: " + text);
        }
        MutableMap<String, ProjectionNode> fields = MapAdapter.adapt(new LinkedHashMap<>());
        String inner = text.substring(1, text.length() - 1);
        if (inner.isBlank()) {
            return new ProjectionNode.Shape(fields);
        }
        for (String entry : splitTopLevel(inner, ',')) {
            int colon = findTopLevel(entry, ':');
            if (colon == -1) {
                fields.put(entry.trim(), new ProjectionNode.Keep(true));
                continue;
            }
            String name = entry.substring(0, colon).trim();
            String value = entry.substring(colon + 1).trim();
            if (name.isEmpty()) {
                throw new StatementException("Missing field name in shape: " + text);
            }
            switch (value) {
                case "true" -> fields.put(name, new ProjectionNode.Keep(true));
                case "false" -> fields.put(name, new ProjectionNode.Keep(false));
                default -> fields.put(name, parse(value));
            }
        }
        return new ProjectionNode.Shape(fields);
    }

    /**
     * Splits on a separator that's not inside braces
     */
    private MutableList<String> splitTopLevel(String text, char separator) {
        MutableList<String> parts = Lists.mutable.empty();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new StatementException("Unbalanced braces in projection: " + text);
        }
        parts.add(text.substring(start));
        return parts;
    }

    private int findTopLevel(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
