package com.treeql.query;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Runs a {@link ProjectionNode} against a value. Null or absent input, and anything that
 * cannot be reached, yields {@link JsonNode#MISSING}. Results share structure with the input.
 */
public class ProjectionExecutor {
    public JsonNode execute(ProjectionNode projection, JsonNode input) {
        if (Nodes.isNullish(input)) {
            return JsonNode.MISSING;
        }
        if (projection instanceof ProjectionNode.Chain chain) {
            JsonNode current = input;
            for (ProjectionNode step : chain.steps()) {
                current = execute(step, current);
            }
            return current;
        }
        if (projection instanceof ProjectionNode.Access access) {
            return access(access.key(), input);
        }
        if (projection instanceof ProjectionNode.Shape shape) {
            return shape(shape, input);
        }
        ProjectionNode.Keep keep = (ProjectionNode.Keep) projection;
        return keep.keep() ? input : JsonNode.MISSING;
    }

    private JsonNode access(String key, JsonNode input) {
        if (input instanceof JsonNode.JsonArray arr && !Nodes.isIndex(key)) {
            return distribute(arr, new ProjectionNode.Access(key));
        }
        return Nodes.child(input, key);
    }

    private JsonNode distribute(JsonNode.JsonArray arr, ProjectionNode projection) {
        MutableList<JsonNode> results = Lists.mutable.empty();
        for (JsonNode element : arr.elements()) {
            results.add(execute(projection, element));
        }
        return new JsonNode.JsonArray(results);
    }

    private JsonNode shape(ProjectionNode.Shape shape, JsonNode input) {
        if (input instanceof JsonNode.JsonArray arr) {
            return distribute(arr, shape);
        }
        JsonNode.JsonObject result = JsonNode.JsonObject.empty();
        shape.fields().forEachKeyValue((key, entry) -> {
            if (entry instanceof ProjectionNode.Keep keep) {
                JsonNode value = Nodes.child(input, key);
                if (keep.keep() && !Nodes.isAbsent(value)) {
                    result.fields().put(key, value);
                }
            } else if (entry instanceof ProjectionNode.Shape nested) {
                JsonNode source = Nodes.child(input, key);
                JsonNode value = Nodes.isNullish(source) ? buildFrom(input, nested) : shape(nested, source);
                if (!isEmptyResult(value)) {
                    result.fields().put(key, value);
                }
            } else {
                JsonNode value = execute(entry, input);
                if (!Nodes.isAbsent(value)) {
                    result.fields().put(key, value);
                }
            }
        });
        return result;
    }

    /**
     * A nested shape whose key is not present is built from the enclosing value instead; its
     * kept keys have nothing to take and are dropped.
     */
    private JsonNode buildFrom(JsonNode input, ProjectionNode.Shape nested) {
        JsonNode.JsonObject result = JsonNode.JsonObject.empty();
        nested.fields().forEachKeyValue((key, entry) -> {
            if (entry instanceof ProjectionNode.Keep) {
                return;
            }
            JsonNode value = execute(entry, input);
            if (!Nodes.isAbsent(value)) {
                result.fields().put(key, value);
            }
        });
        return result;
    }

    private static boolean isEmptyResult(JsonNode value) {
        if (value instanceof JsonNode.JsonObject obj) {
            return obj.fields().isEmpty();
        }
        if (value instanceof JsonNode.JsonArray arr) {
            return arr.elements().isEmpty();
        }
        return Nodes.isAbsent(value);
    }
}
