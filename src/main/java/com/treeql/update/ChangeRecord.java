package com.treeql.update;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import com.treeql.output.OutputFormatter;
import com.treeql.statement.Operator;
import com.treeql.statement.SerializationException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * The changes one or more updates made to a container, shaped like the data. Each changed key
 * holds either its new value together with the value it had before the first change, or a
 * nested record for changes further down.
 *
 * <p>In JSON the originals sit under the {@code "#"} key:
 * <pre>{"user": {"age": 31, "#": {"age": {"original": 30}}}}</pre>
 * A deleted key is absent from the body and an absent original is written as {@code {}}.
 */
public final class ChangeRecord {
    private static final String ORIGINAL = "original";

    private final MutableMap<String, Change> changes = MapAdapter.adapt(new LinkedHashMap<>());
    private final MutableMap<String, JsonNode> originals = MapAdapter.adapt(new LinkedHashMap<>());

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /** Changed keys in the order they were first recorded. */
    public MutableList<String> keys() {
        return changes.keysView().toList();
    }

    public boolean contains(String key) {
        return changes.containsKey(key);
    }

    public Change get(String key) {
        return changes.get(key);
    }

    /** The value written to {@code key}, or null if the key was not assigned directly. */
    public JsonNode value(String key) {
        return changes.get(key) instanceof Change.Value v ? v.value() : null;
    }

    /** The nested record under {@code key}, or null if there is none. */
    public ChangeRecord nested(String key) {
        return changes.get(key) instanceof Change.Nested n ? n.record() : null;
    }

    public boolean hasOriginal(String key) {
        return originals.containsKey(key);
    }

    /** The value {@code key} had before its first change; {@link JsonNode#MISSING} if it had none. */
    public JsonNode original(String key) {
        JsonNode original = originals.get(key);
        return original != null ? original : JsonNode.MISSING;
    }

    void putValue(String key, JsonNode value) {
        changes.put(key, new Change.Value(value));
    }

    void putNested(String key, ChangeRecord record) {
        changes.put(key, new Change.Nested(record));
    }

    /** Keeps the first original seen for a key. */
    void recordOriginal(String key, JsonNode original) {
        if (!originals.containsKey(key)) {
            originals.put(key, original);
        }
    }

    void remove(String key) {
        changes.remove(key);
        originals.remove(key);
    }

    /**
     * Views a container that was written whole as if each of its keys had been assigned, with no
     * originals. Change detectors use this to look inside replaced values.
     */
    public static ChangeRecord ofReplacement(JsonNode container) {
        ChangeRecord record = new ChangeRecord();
        for (String key : Nodes.keys(container)) {
            record.putValue(key, Nodes.child(container, key));
        }
        return record;
    }

    public JsonNode toJson() {
        JsonNode.JsonObject json = JsonNode.JsonObject.empty();
        changes.forEachKeyValue((key, change) -> {
            if (change instanceof Change.Nested nested) {
                json.fields().put(key, nested.record().toJson());
            } else {
                JsonNode value = ((Change.Value) change).value();
                if (!Nodes.isAbsent(value)) {
                    json.fields().put(key, Nodes.deepCopy(value));
                }
            }
        });
        if (!originals.isEmpty()) {
            JsonNode.JsonObject meta = JsonNode.JsonObject.empty();
            originals.forEachKeyValue((key, original) -> {
                JsonNode.JsonObject entry = JsonNode.JsonObject.empty();
                if (!Nodes.isAbsent(original)) {
                    entry.fields().put(ORIGINAL, Nodes.deepCopy(original));
                }
                meta.fields().put(key, entry);
            });
            json.fields().put(Operator.META.marker(), meta);
        }
        return json;
    }

    public static ChangeRecord fromJson(JsonNode json) {
        return fromJson(json, Lists.immutable.empty());
    }

    private static ChangeRecord fromJson(JsonNode json, ImmutableList<String> path) {
        if (!(json instanceof JsonNode.JsonObject obj)) {
            throw new SerializationException("A change record must be an object", path);
        }
        ChangeRecord record = new ChangeRecord();
        JsonNode meta = obj.fields().get(Operator.META.marker());
        if (meta != null) {
            if (!(meta instanceof JsonNode.JsonObject metaObj)) {
                throw new SerializationException("Originals must be an object", path.newWith(Operator.META.marker()));
            }
            metaObj.fields().forEachKeyValue((key, entry) -> {
                if (!(entry instanceof JsonNode.JsonObject entryObj)) {
                    throw new SerializationException("Original entry must be an object",
                            path.newWith(Operator.META.marker()).newWith(key));
                }
                JsonNode original = entryObj.fields().get(ORIGINAL);
                record.originals.put(key, original != null ? Nodes.deepCopy(original) : JsonNode.MISSING);
            });
        }
        obj.fields().forEachKeyValue((key, value) -> {
            if (key.equals(Operator.META.marker())) {
                return;
            }
            if (record.hasOriginal(key)) {
                record.putValue(key, Nodes.deepCopy(value));
            } else {
                record.putNested(key, fromJson(value, path.newWith(key)));
            }
        });
        record.originals.forEachKey(key -> {
            if (!record.contains(key)) {
                record.putValue(key, JsonNode.MISSING);
            }
        });
        return record;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChangeRecord other && Nodes.strictEquals(toJson(), other.toJson());
    }

    @Override
    public int hashCode() {
        return changes.keySet().hashCode();
    }

    @Override
    public String toString() {
        return new OutputFormatter(false).format(toJson());
    }
}
