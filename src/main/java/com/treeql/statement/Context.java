package com.treeql.statement;

import com.treeql.json.JsonNode;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Variables visible to transforms and WHERE functions during an update. A level's CONTEXT
 * entries shadow the inherited ones for that level and everything below it.
 */
public final class Context {
    private static final Context EMPTY = new Context(Maps.immutable.empty());

    private final ImmutableMap<String, JsonNode> variables;

    private Context(ImmutableMap<String, JsonNode> variables) {
        this.variables = variables;
    }

    public static Context empty() {
        return EMPTY;
    }

    public static Context of(MapIterable<String, JsonNode> variables) {
        return EMPTY.merge(variables);
    }

    /** A new context holding these variables on top of this one. */
    public Context merge(MapIterable<String, JsonNode> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        MutableMap<String, JsonNode> merged = Maps.mutable.ofMap(variables.castToMap());
        overrides.forEachKeyValue(merged::put);
        return new Context(merged.toImmutable());
    }

    /** The variable, or {@link JsonNode#MISSING} when it is not defined. */
    public JsonNode get(String name) {
        JsonNode value = variables.get(name);
        return value != null ? value : JsonNode.MISSING;
    }

    public double number(String name) {
        JsonNode value = get(name);
        if (value instanceof JsonNode.JsonNumber n) {
            return n.numberValue().doubleValue();
        }
        throw new StatementException("Context variable '" + name + "' is not a number: " + value);
    }

    @Override
    public String toString() {
        return "Context" + variables;
    }
}
