package com.treeql.update;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import com.treeql.query.PredicateEvaluator;
import com.treeql.statement.Context;
import com.treeql.statement.StatementException;
import com.treeql.statement.UpdateStatement;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies an {@link UpdateStatement.FieldMap} to a tree in place and records what changed.
 *
 * <p>Statement constants are copied before they are written, so the tree never aliases a
 * statement. Recording a change snapshots the new value and, the first time a key changes,
 * its original. A key written back to its original value drops out of the record.
 */
public class UpdateEngine {
    private static final Logger LOG = Logger.getLogger(UpdateEngine.class.getName());

    private final PredicateEvaluator predicates;
    private final Undo undo;

    public UpdateEngine() {
        this(new PredicateEvaluator(), new Undo());
    }

    public UpdateEngine(PredicateEvaluator predicates, Undo undo) {
        this.predicates = predicates;
        this.undo = undo;
    }

    public Optional<ChangeRecord> update(JsonNode data, UpdateStatement.FieldMap statement) {
        return update(data, statement, null, Context.empty());
    }

    /**
     * @param existing changes from earlier updates of the same tree, extended in place; may be null
     * @return the accumulated changes, empty when nothing has changed
     */
    public Optional<ChangeRecord> update(JsonNode data, UpdateStatement.FieldMap statement,
                                         ChangeRecord existing, Context context) {
        if (!Nodes.isContainer(data)) {
            throw new StatementException("Only objects and arrays can be updated, got " + Nodes.typeOf(data));
        }
        ChangeRecord changes = apply(data, statement, existing, context != null ? context : Context.empty());
        return changes == null || changes.isEmpty() ? Optional.empty() : Optional.of(changes);
    }

    private ChangeRecord apply(JsonNode data, UpdateStatement.FieldMap statement,
                               ChangeRecord changes, Context inherited) {
        Context context = inherited.merge(statement.context());
        if (statement.where() != null && !predicates.evaluate(data, statement.where(), context)) {
            LOG.fine(() -> "Guard failed, skipping update of " + Nodes.typeOf(data));
            return changes;
        }

        MutableMap<String, UpdateStatement> directives = MapAdapter.adapt(new LinkedHashMap<>());
        directives.putAll(statement.fields());
        if (statement.all() != null) {
            // Explicit keys win over ALL once resolved, so "-1" covers the last index.
            MutableSet<String> explicit = statement.fields().keysView()
                    .collect(key -> resolveKey(data, key))
                    .reject(Objects::isNull)
                    .toSet();
            for (String key : Nodes.keys(data)) {
                if (!explicit.contains(key)) {
                    directives.put(key, statement.all());
                }
            }
        }

        Level level = new Level(data, changes, context);
        directives.forEachKeyValue(level::apply);
        return level.changes;
    }

    /**
     * Maps a directive key onto {@code data}. Array keys may count back from the end with a
     * leading minus; the index one past the end appends. Returns null for keys that address
     * nothing.
     */
    static String resolveKey(JsonNode data, String key) {
        if (!(data instanceof JsonNode.JsonArray arr)) {
            return key;
        }
        int size = arr.elements().size();
        int index;
        if (Nodes.isIndex(key)) {
            index = Integer.parseInt(key);
        } else if (key.startsWith("-") && Nodes.isIndex(key.substring(1))) {
            index = size - Integer.parseInt(key.substring(1));
        } else {
            return null;
        }
        return index >= 0 && index <= size ? Integer.toString(index) : null;
    }

    /** One container being updated, with the record its changes go into. */
    private final class Level {
        private final JsonNode data;
        private final Context context;
        private ChangeRecord changes;

        Level(JsonNode data, ChangeRecord changes, Context context) {
            this.data = data;
            this.changes = changes;
            this.context = context;
        }

        void apply(String key, UpdateStatement operand) {
            String resolved = resolveKey(data, key);
            if (resolved == null) {
                LOG.fine(() -> "Ignoring key '" + key + "': out of range or not an index");
                return;
            }
            JsonNode current = Nodes.child(data, resolved);

            UpdateStatement effective = operand;
            if (operand instanceof UpdateStatement.Transform transform) {
                effective = transform.function().apply(current, data, resolved, context);
                if (effective == null) {
                    LOG.fine(() -> "Transform for '" + resolved + "' returned nothing, skipping");
                    return;
                }
                if (effective instanceof UpdateStatement.Transform) {
                    throw new StatementException("A transform must not return another transform: " + resolved);
                }
            }

            boolean deletes = effective instanceof UpdateStatement.Delete
                    || effective instanceof UpdateStatement.Assign unset && Nodes.isAbsent(unset.value());
            if (deletes) {
                if (Nodes.isAbsent(current)) {
                    return;
                }
                remove(resolved);
                recordChange(resolved, current);
            } else if (effective instanceof UpdateStatement.Replace replace) {
                put(resolved, Nodes.deepCopy(replace.value()));
                recordChange(resolved, current);
            } else if (effective instanceof UpdateStatement.Assign assign) {
                if (!Nodes.isContainer(current) && Nodes.strictEquals(current, assign.value())) {
                    return;
                }
                put(resolved, assign.value());
                recordChange(resolved, current);
            } else {
                applyFields(resolved, current, (UpdateStatement.FieldMap) effective);
            }
        }

        private void applyFields(String key, JsonNode current, UpdateStatement.FieldMap statement) {
            if (Nodes.isContainer(current)) {
                if (changes != null && changes.hasOriginal(key)) {
                    // Already replaced wholesale: the snapshot is refreshed, the original stays.
                    UpdateEngine.this.apply(current, statement, null, context);
                    refresh(key);
                    return;
                }
                ChangeRecord nested = UpdateEngine.this.apply(
                        current, statement, changes != null ? changes.nested(key) : null, context);
                if (nested != null && !nested.isEmpty()) {
                    record().putNested(key, nested);
                } else if (changes != null && changes.contains(key)) {
                    changes.remove(key);
                }
                return;
            }

            if (statement.where() != null
                    && !predicates.evaluate(current, statement.where(), context.merge(statement.context()))) {
                LOG.fine(() -> "Guard failed, skipping update of '" + key + "'");
                return;
            }
            if (statement.defaultValue() == null) {
                throw new StatementException("Can't partially update a non-object: " + key);
            }
            JsonNode value = Nodes.deepCopy(statement.defaultValue());
            put(key, value);
            if (Nodes.isContainer(value)) {
                UpdateStatement.FieldMap rest = new UpdateStatement.FieldMap(
                        statement.fields(), statement.all(), null, null, statement.context());
                UpdateEngine.this.apply(value, rest, null, context);
            }
            recordChange(key, current);
        }

        private void recordChange(String key, JsonNode old) {
            ChangeRecord record = record();
            if (Nodes.isContainer(old)) {
                ChangeRecord prior = record.nested(key);
                if (prior != null) {
                    undo.undo(old, prior);
                }
            }
            record.recordOriginal(key, old);
            refresh(key);
        }

        private void refresh(String key) {
            JsonNode now = Nodes.child(data, key);
            if (Nodes.strictEquals(now, changes.original(key))) {
                LOG.fine(() -> "'" + key + "' is back to its original value");
                changes.remove(key);
            } else {
                changes.putValue(key, Nodes.deepCopy(now));
            }
        }

        private ChangeRecord record() {
            if (changes == null) {
                changes = new ChangeRecord();
            }
            return changes;
        }

        private void put(String key, JsonNode value) {
            if (data instanceof JsonNode.JsonObject obj) {
                obj.fields().put(key, value);
                return;
            }
            var elements = ((JsonNode.JsonArray) data).elements();
            int index = Integer.parseInt(key);
            if (index == elements.size()) {
                elements.add(value);
            } else {
                elements.set(index, value);
            }
        }

        private void remove(String key) {
            if (data instanceof JsonNode.JsonObject obj) {
                obj.fields().remove(key);
            } else {
                ((JsonNode.JsonArray) data).elements().set(Integer.parseInt(key), JsonNode.MISSING);
            }
        }
    }
}
