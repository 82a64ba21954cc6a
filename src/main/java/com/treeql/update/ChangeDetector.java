package com.treeql.update;

import com.treeql.json.Nodes;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.function.BiPredicate;

/**
 * Describes which changes in a {@link ChangeRecord} are of interest. A {@link Fn} decides for
 * one key; a {@link Nested} detector follows the shape of the data.
 */
public sealed interface ChangeDetector {

    record Fn(BiPredicate<String, ChangeRecord> test) implements ChangeDetector {}

    /**
     * @param fields detectors per key
     * @param all    detector for every changed key not in {@code fields}, may be null
     */
    record Nested(MutableMap<String, ChangeDetector> fields, ChangeDetector all) implements ChangeDetector {}

    /** True when the key changed in any way. */
    static Fn anyChange() {
        return new Fn((key, record) -> record != null && record.contains(key));
    }

    /** True when the key now holds a different type than it originally did. */
    static Fn typeChange() {
        return new Fn((key, record) -> {
            if (record == null || !record.contains(key) || !record.hasOriginal(key)) {
                return false;
            }
            return !Nodes.typeOf(record.value(key)).equals(Nodes.typeOf(record.original(key)));
        });
    }

    static Builder fields() {
        return new Builder();
    }

    final class Builder {
        private final LinkedHashMap<String, ChangeDetector> fields = new LinkedHashMap<>();
        private ChangeDetector all;

        private Builder() {}

        public Builder field(String name, ChangeDetector detector) {
            fields.put(name, detector);
            return this;
        }

        public Builder all(ChangeDetector detector) {
            this.all = detector;
            return this;
        }

        public Nested build() {
            return new Nested(MapAdapter.adapt(new LinkedHashMap<>(fields)), all);
        }
    }
}
