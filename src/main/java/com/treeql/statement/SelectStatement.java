package com.treeql.statement;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * What to take from a value. {@link Flag} takes all or nothing; {@link Shape} addresses fields,
 * every key ({@code all}), every depth ({@code deepAll}), and may be guarded by {@code where}.
 */
public sealed interface SelectStatement {

    Flag INCLUDE = new Flag(true);
    Flag EXCLUDE = new Flag(false);

    record Flag(boolean selected) implements SelectStatement {}

    /**
     * @param fields  field or index selections
     * @param all     applied to every key, may be null
     * @param where   guard on the value itself, may be null
     * @param deepAll pattern searched for at every depth, may be null
     */
    record Shape(MutableMap<String, SelectStatement> fields,
                 SelectStatement all,
                 Predicate where,
                 Shape deepAll) implements SelectStatement {

        /** True when nothing below this level is addressed, so the whole value is taken. */
        public boolean takesWholeValue() {
            return fields.isEmpty() && all == null && deepAll == null;
        }
    }

    static Builder shape() {
        return new Builder();
    }

    final class Builder {
        private final LinkedHashMap<String, SelectStatement> fields = new LinkedHashMap<>();
        private SelectStatement all;
        private Predicate where;
        private Shape deepAll;

        private Builder() {}

        public Builder field(String name) {
            return field(name, INCLUDE);
        }

        public Builder field(String name, SelectStatement statement) {
            fields.put(name, statement);
            return this;
        }

        public Builder all(SelectStatement statement) {
            this.all = statement;
            return this;
        }

        public Builder where(Predicate predicate) {
            this.where = predicate;
            return this;
        }

        public Builder deepAll(Shape pattern) {
            this.deepAll = pattern;
            return this;
        }

        public Shape build() {
            return new Shape(MapAdapter.adapt(new LinkedHashMap<>(fields)), all, where, deepAll);
        }
    }
}
