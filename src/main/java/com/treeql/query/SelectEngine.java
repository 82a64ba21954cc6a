package com.treeql.query;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import com.treeql.statement.SelectStatement;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.sorted.MutableSortedMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;
import org.eclipse.collections.impl.map.sorted.mutable.TreeSortedMap;

import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies a {@link SelectStatement} to a value and builds a filtered copy. The input is never
 * modified. An empty {@link Optional} means "no result", which is different from a result that
 * is itself {@link JsonNode#MISSING} (a requested key that is not there).
 */
public class SelectEngine {
    private static final Logger LOG = Logger.getLogger(SelectEngine.class.getName());

    private final PredicateEvaluator predicates;

    public SelectEngine() {
        this(new PredicateEvaluator());
    }

    public SelectEngine(PredicateEvaluator predicates) {
        this.predicates = predicates;
    }

    public Optional<JsonNode> select(JsonNode value, SelectStatement statement) {
        if (statement instanceof SelectStatement.Flag flag) {
            return flag.selected() ? Optional.of(Nodes.deepCopy(value)) : Optional.empty();
        }
        SelectStatement.Shape shape = (SelectStatement.Shape) statement;
        if (shape.where() != null && !predicates.evaluate(value, shape.where())) {
            return Optional.empty();
        }
        if (shape.takesWholeValue()) {
            return Optional.of(Nodes.deepCopy(value));
        }
        if (!Nodes.isContainer(value)) {
            LOG.fine(() -> "Cannot select fields from " + Nodes.typeOf(value));
            return Optional.empty();
        }

        Result result = new Result(value instanceof JsonNode.JsonArray);
        if (shape.deepAll() != null) {
            searchDeep(value, shape.deepAll(), false).ifPresent(result::mergeAll);
        }
        if (shape.all() != null) {
            for (String key : Nodes.keys(value)) {
                select(Nodes.child(value, key), shape.all()).ifPresent(selected -> result.put(key, selected));
            }
        }
        // Explicit indices merge by source position, before filtered elements are closed up.
        shape.fields().forEachKeyValue((key, fieldStatement) -> {
            if (result.array && !Nodes.isIndex(key)) {
                LOG.fine(() -> "Ignoring non-index key '" + key + "' on an array");
                return;
            }
            select(Nodes.child(value, key), fieldStatement).ifPresent(selected -> result.put(key, selected));
        });
        if (shape.all() != null || shape.deepAll() != null) {
            result.compact();
        }
        return result.build();
    }

    /**
     * Searches the children of {@code node} for the deep pattern. With a WHERE, a child that
     * satisfies it is taken whole, other containers are searched further, and once anything
     * matched under this node the pattern's listed fields are projected from it too. Without a
     * WHERE, the listed fields are projected wherever they occur. Arrays found below the
     * starting node come back dense; the starting node's own result is left sparse for the caller.
     */
    private Optional<JsonNode> searchDeep(JsonNode node, SelectStatement.Shape pattern, boolean dense) {
        if (!Nodes.isContainer(node)) {
            return Optional.empty();
        }
        Result result = new Result(node instanceof JsonNode.JsonArray);
        if (pattern.where() != null) {
            for (String key : Nodes.keys(node)) {
                JsonNode child = Nodes.child(node, key);
                if (predicates.evaluate(child, pattern.where())) {
                    result.put(key, Nodes.deepCopy(child));
                } else if (Nodes.isContainer(child)) {
                    searchDeep(child, pattern, true).ifPresent(found -> result.put(key, found));
                }
            }
            if (!result.isEmpty()) {
                projectFields(node, pattern, result);
            }
        } else {
            projectFields(node, pattern, result);
            for (String key : Nodes.keys(node)) {
                JsonNode child = Nodes.child(node, key);
                if (Nodes.isContainer(child)) {
                    searchDeep(child, pattern, true).ifPresent(found -> result.put(key, found));
                }
            }
        }
        if (dense) {
            result.compact();
        }
        return result.build();
    }

    private void projectFields(JsonNode node, SelectStatement.Shape pattern, Result result) {
        pattern.fields().forEachKeyValue((key, fieldStatement) -> {
            if (Nodes.has(node, key)) {
                select(Nodes.child(node, key), fieldStatement).ifPresent(selected -> result.put(key, selected));
            }
        });
    }

    /**
     * Merges {@code incoming} into {@code existing}: objects key by key, arrays position by
     * position, anything else is replaced.
     */
    static JsonNode merge(JsonNode existing, JsonNode incoming) {
        if (existing instanceof JsonNode.JsonObject target && incoming instanceof JsonNode.JsonObject source) {
            source.fields().forEachKeyValue((key, value) -> {
                JsonNode current = target.fields().get(key);
                target.fields().put(key, current == null ? value : merge(current, value));
            });
            return target;
        }
        if (existing instanceof JsonNode.JsonArray target && incoming instanceof JsonNode.JsonArray source) {
            MutableList<JsonNode> elements = target.elements();
            for (int i = 0; i < source.elements().size(); i++) {
                JsonNode value = source.elements().get(i);
                if (Nodes.isAbsent(value)) {
                    continue;
                }
                while (elements.size() <= i) {
                    elements.add(JsonNode.MISSING);
                }
                elements.set(i, Nodes.isAbsent(elements.get(i)) ? value : merge(elements.get(i), value));
            }
            return target;
        }
        return incoming;
    }

    /**
     * Accumulates selected children in the shape of the value they were taken from. Arrays are
     * kept sparse by index until built, so unselected positions become holes.
     */
    private static final class Result {
        private final boolean array;
        private final MutableMap<String, JsonNode> fields = MapAdapter.adapt(new LinkedHashMap<>());
        private MutableSortedMap<Integer, JsonNode> elements = new TreeSortedMap<>();

        Result(boolean array) {
            this.array = array;
        }

        void put(String key, JsonNode value) {
            if (array) {
                int index = Integer.parseInt(key);
                JsonNode current = elements.get(index);
                elements.put(index, current == null ? value : merge(current, value));
            } else {
                JsonNode current = fields.get(key);
                fields.put(key, current == null ? value : merge(current, value));
            }
        }

        void mergeAll(JsonNode found) {
            if (found instanceof JsonNode.JsonObject obj) {
                obj.fields().forEachKeyValue(this::put);
            } else if (found instanceof JsonNode.JsonArray arr) {
                for (int i = 0; i < arr.elements().size(); i++) {
                    if (!Nodes.isAbsent(arr.elements().get(i))) {
                        put(Integer.toString(i), arr.elements().get(i));
                    }
                }
            }
        }

        /** Closes the gaps left by filtered array elements. */
        void compact() {
            if (!array) {
                return;
            }
            MutableSortedMap<Integer, JsonNode> dense = new TreeSortedMap<>();
            elements.valuesView().forEach(value -> dense.put(dense.size(), value));
            elements = dense;
        }

        boolean isEmpty() {
            return array ? elements.isEmpty() : fields.isEmpty();
        }

        Optional<JsonNode> build() {
            if (isEmpty()) {
                return Optional.empty();
            }
            if (!array) {
                return Optional.of(new JsonNode.JsonObject(fields));
            }
            MutableList<JsonNode> list = Lists.mutable.empty();
            elements.forEachKeyValue((index, value) -> {
                while (list.size() < index) {
                    list.add(JsonNode.MISSING);
                }
                list.add(value);
            });
            return Optional.of(new JsonNode.JsonArray(list));
        }
    }
}
