package com.treeql.statement;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * An instruction for one key of the data being updated.
 *
 * <p>{@link Assign} writes a scalar. {@link Replace} writes a whole value, objects and arrays
 * included, without merging. {@link Delete} removes the key. {@link Transform} computes the
 * instruction from the current value. {@link FieldMap} updates an object or array key by key.
 */
public sealed interface UpdateStatement {

    record Assign(JsonNode value) implements UpdateStatement {
        public Assign {
            Objects.requireNonNull(value, "value");
            if (Nodes.isContainer(value)) {
                throw new StatementException("Objects and arrays must be wrapped for full replacement: " + value);
            }
        }
    }

    record Replace(JsonNode value) implements UpdateStatement {}

    record Delete() implements UpdateStatement {}

    record Transform(Function function) implements UpdateStatement {}

    /**
     * @param fields  per-key instructions; array keys are indices, negative ones count from the end
     * @param all     instruction for every key not listed in {@code fields}, may be null
     * @param where   guard evaluated against the current value, may be null
     * @param defaultValue value written first when the current value is not an object or array, may be null
     * @param context variables added to the context for this level and below
     */
    record FieldMap(MutableMap<String, UpdateStatement> fields,
                    UpdateStatement all,
                    Predicate where,
                    JsonNode defaultValue,
                    MutableMap<String, JsonNode> context) implements UpdateStatement {}

    /**
     * Computes an instruction from the value being updated.
     */
    @FunctionalInterface
    interface Function {
        UpdateStatement apply(JsonNode current, JsonNode parent, String key, Context context);
    }

    Delete DELETE = new Delete();

    static Assign set(JsonNode value) {
        return new Assign(value);
    }

    static Assign set(long value) {
        return new Assign(JsonNode.of(value));
    }

    static Assign set(double value) {
        return new Assign(JsonNode.of(value));
    }

    static Assign set(String value) {
        return new Assign(JsonNode.of(value));
    }

    static Assign set(boolean value) {
        return new Assign(JsonNode.of(value));
    }

    static Replace replace(JsonNode value) {
        return new Replace(value);
    }

    static Transform transform(Function function) {
        return new Transform(function);
    }

    /** A transform that only looks at the current value. */
    static Transform map(java.util.function.Function<JsonNode, UpdateStatement> function) {
        return new Transform((current, parent, key, context) -> function.apply(current));
    }

    /**
     * The instruction that writes {@code value}: scalars are assigned, objects and arrays replaced.
     */
    static UpdateStatement of(JsonNode value) {
        return Nodes.isContainer(value) ? new Replace(value) : new Assign(value);
    }

    static Builder fields() {
        return new Builder();
    }

    final class Builder {
        private final LinkedHashMap<String, UpdateStatement> fields = new LinkedHashMap<>();
        private final LinkedHashMap<String, JsonNode> context = new LinkedHashMap<>();
        private UpdateStatement all;
        private Predicate where;
        private JsonNode defaultValue;

        private Builder() {}

        public Builder field(String name, UpdateStatement statement) {
            fields.put(name, statement);
            return this;
        }

        public Builder all(UpdateStatement statement) {
            this.all = statement;
            return this;
        }

        public Builder where(Predicate predicate) {
            this.where = predicate;
            return this;
        }

        public Builder defaultValue(JsonNode value) {
            this.defaultValue = value;
            return this;
        }

        public Builder context(String name, JsonNode value) {
            context.put(name, value);
            return this;
        }

        public FieldMap build() {
            return new FieldMap(MapAdapter.adapt(new LinkedHashMap<>(fields)), all, where, defaultValue,
                    MapAdapter.adapt(new LinkedHashMap<>(context)));
        }
    }
}
