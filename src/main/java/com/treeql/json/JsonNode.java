package com.treeql.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * A node of the tree being queried or mutated. Objects and arrays hold mutable collections,
 * so the update engine can change a tree in place.
 */
public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        /** An empty object that keeps insertion order. */
        public static JsonObject empty() {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public JsonObject with(String key, JsonNode value) {
            fields.put(key, value);
            return this;
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }

        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.mutable.with(elements));
        }
    }

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        String toJsonString();
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public String toJsonString() {
                // Fast path for whole numbers (common case)
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return Long.toString((long) value);
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}
    record JsonNull() implements JsonNode {}

    /**
     * Absence: a key that is not there, a hole in a sparse array, or "no result".
     */
    record JsonMissing() implements JsonNode {}

    JsonNull NULL = new JsonNull();
    JsonMissing MISSING = new JsonMissing();

    static JsonString of(String value) {
        return new JsonString(value);
    }

    static JsonBoolean of(boolean value) {
        return new JsonBoolean(value);
    }

    static JsonNumber of(long value) {
        return JsonNumber.of(value);
    }

    static JsonNumber of(double value) {
        return JsonNumber.of(value);
    }
}
