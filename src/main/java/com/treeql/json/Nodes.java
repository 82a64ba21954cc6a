package com.treeql.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

/**
 * Static helpers over {@link JsonNode} trees: copying, child access, and the two equality
 * flavours used by predicates (strict and loose).
 */
public final class Nodes {
    private static final Pattern INDEX = Pattern.compile("0|[1-9][0-9]*");

    private Nodes() {}

    public static boolean isContainer(JsonNode node) {
        return node instanceof JsonNode.JsonObject || node instanceof JsonNode.JsonArray;
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node instanceof JsonNode.JsonMissing;
    }

    public static boolean isNullish(JsonNode node) {
        return isAbsent(node) || node instanceof JsonNode.JsonNull;
    }

    /** True for a canonical non-negative decimal index such as {@code "0"} or {@code "12"}. */
    public static boolean isIndex(String key) {
        return INDEX.matcher(key).matches() && key.length() < 10;
    }

    /**
     * Deep copy of a tree. Scalars are immutable records and are returned as is.
     */
    public static JsonNode deepCopy(JsonNode node) {
        if (node instanceof JsonNode.JsonObject obj) {
            JsonNode.JsonObject copy = JsonNode.JsonObject.empty();
            obj.fields().forEachKeyValue((key, value) -> copy.fields().put(key, deepCopy(value)));
            return copy;
        }
        if (node instanceof JsonNode.JsonArray arr) {
            MutableList<JsonNode> elements = Lists.mutable.empty();
            for (JsonNode element : arr.elements()) {
                elements.add(deepCopy(element));
            }
            return new JsonNode.JsonArray(elements);
        }
        return node;
    }

    /**
     * Child of a container by key; array keys must be canonical indices. Anything that cannot
     * be reached yields {@link JsonNode#MISSING}.
     */
    public static JsonNode child(JsonNode node, String key) {
        if (node instanceof JsonNode.JsonObject obj) {
            JsonNode value = obj.fields().get(key);
            return value != null ? value : JsonNode.MISSING;
        }
        if (node instanceof JsonNode.JsonArray arr && isIndex(key)) {
            int index = Integer.parseInt(key);
            return index < arr.elements().size() ? arr.elements().get(index) : JsonNode.MISSING;
        }
        return JsonNode.MISSING;
    }

    /** True when the container actually holds a value (not a hole) under the key. */
    public static boolean has(JsonNode node, String key) {
        return !isAbsent(child(node, key));
    }

    /** Keys of a container in iteration order, skipping array holes. Scalars have none. */
    public static MutableList<String> keys(JsonNode node) {
        if (node instanceof JsonNode.JsonObject obj) {
            return obj.fields().keysView().toList();
        }
        MutableList<String> keys = Lists.mutable.empty();
        if (node instanceof JsonNode.JsonArray arr) {
            for (int i = 0; i < arr.elements().size(); i++) {
                if (!isAbsent(arr.elements().get(i))) {
                    keys.add(Integer.toString(i));
                }
            }
        }
        return keys;
    }

    /**
     * The type name a value reports for type-change detection: {@code object} for objects and
     * arrays, {@code null} and {@code undefined} each as their own type.
     */
    public static String typeOf(JsonNode node) {
        if (isAbsent(node)) {
            return "undefined";
        }
        if (node instanceof JsonNode.JsonNull) {
            return "null";
        }
        if (node instanceof JsonNode.JsonBoolean) {
            return "boolean";
        }
        if (node instanceof JsonNode.JsonNumber) {
            return "number";
        }
        if (node instanceof JsonNode.JsonString) {
            return "string";
        }
        return "object";
    }

    /**
     * Strict equality: same kind and value. Numbers compare numerically, so {@code 3} equals
     * {@code 3.0}; containers compare structurally.
     */
    public static boolean strictEquals(JsonNode a, JsonNode b) {
        if (a == b) {
            return true;
        }
        if (isAbsent(a) || isAbsent(b)) {
            return isAbsent(a) && isAbsent(b);
        }
        if (a instanceof JsonNode.JsonNumber x && b instanceof JsonNode.JsonNumber y) {
            return Double.compare(x.numberValue().doubleValue(), y.numberValue().doubleValue()) == 0;
        }
        if (a instanceof JsonNode.JsonObject x && b instanceof JsonNode.JsonObject y) {
            if (x.fields().size() != y.fields().size()) {
                return false;
            }
            return x.fields().keyValuesView().allSatisfy(
                    pair -> y.fields().containsKey(pair.getOne())
                            && strictEquals(pair.getTwo(), y.fields().get(pair.getOne())));
        }
        if (a instanceof JsonNode.JsonArray x && b instanceof JsonNode.JsonArray y) {
            if (x.elements().size() != y.elements().size()) {
                return false;
            }
            for (int i = 0; i < x.elements().size(); i++) {
                if (!strictEquals(x.elements().get(i), y.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Loose equality: null and absent are equal to each other and nothing else; numbers,
     * numeric strings and booleans are coerced to numbers before comparing.
     */
    public static boolean looseEquals(JsonNode a, JsonNode b) {
        if (isNullish(a) || isNullish(b)) {
            return isNullish(a) && isNullish(b);
        }
        if (isContainer(a) || isContainer(b)) {
            return a == b;
        }
        if (a instanceof JsonNode.JsonString x && b instanceof JsonNode.JsonString y) {
            return x.value().equals(y.value());
        }
        if (a instanceof JsonNode.JsonBoolean x && b instanceof JsonNode.JsonBoolean y) {
            return x.value() == y.value();
        }
        Double left = toNumber(a);
        Double right = toNumber(b);
        return left != null && right != null && left.doubleValue() == right.doubleValue();
    }

    private static Double toNumber(JsonNode node) {
        if (node instanceof JsonNode.JsonNumber n) {
            return n.numberValue().doubleValue();
        }
        if (node instanceof JsonNode.JsonBoolean b) {
            return b.value() ? 1.0 : 0.0;
        }
        if (node instanceof JsonNode.JsonString s) {
            String text = s.value().trim();
            if (text.isEmpty()) {
                return 0.0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
