package com.treeql.statement;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Converts statements to and from JSON. Reserved operators are written as their
 * {@link Operator#marker() markers}, so {@code {"*": {"price": 0}}} is an update that sets
 * {@code price} on every element. Functions have no JSON form: encoding one fails with a
 * {@link SerializationException} naming its path, and decoding never produces one.
 */
public class StatementCodec {
    private static final String CANNOT_SERIALIZE = "Cannot serialize functions";
    private static final String NOT_ALLOWED = "Functions are not allowed";

    // ---- update -----------------------------------------------------------------------------

    public UpdateStatement.FieldMap decodeUpdate(JsonNode json) {
        if (!(json instanceof JsonNode.JsonObject)) {
            throw new SerializationException("An update statement must be an object, got " + Nodes.typeOf(json));
        }
        return (UpdateStatement.FieldMap) decodeUpdate(json, Lists.immutable.empty());
    }

    private UpdateStatement decodeUpdate(JsonNode json, ImmutableList<String> path) {
        if (json instanceof JsonNode.JsonArray arr) {
            int size = arr.elements().size();
            if (size == 0) {
                return UpdateStatement.DELETE;
            }
            if (size == 1) {
                return new UpdateStatement.Replace(arr.elements().getFirst());
            }
            throw new StatementException("Multiple element arrays not allowed at path: " + path.makeString("."));
        }
        if (json instanceof JsonNode.JsonObject obj) {
            UpdateStatement.Builder builder = UpdateStatement.fields();
            obj.fields().forEachKeyValue((key, value) -> {
                ImmutableList<String> at = path.newWith(key);
                Optional<Operator> op = Operator.fromMarker(key, Operator.Kind.UPDATE);
                if (op.isEmpty()) {
                    builder.field(key, decodeUpdate(value, at));
                    return;
                }
                switch (op.get()) {
                    case ALL -> builder.all(decodeUpdate(value, at));
                    case WHERE -> builder.where(decodePredicate(value, at));
                    case DEFAULT -> builder.defaultValue(Nodes.deepCopy(value));
                    case CONTEXT -> {
                        if (!(value instanceof JsonNode.JsonObject vars)) {
                            throw new SerializationException("Context must be an object", at);
                        }
                        vars.fields().forEachKeyValue(builder::context);
                    }
                    default -> throw new SerializationException("Unexpected operator " + op.get(), at);
                }
            });
            return builder.build();
        }
        return new UpdateStatement.Assign(json);
    }

    public JsonNode encode(UpdateStatement statement) {
        return encodeUpdate(statement, Lists.immutable.empty(), CANNOT_SERIALIZE);
    }

    private JsonNode encodeUpdate(UpdateStatement statement, ImmutableList<String> path, String functionMessage) {
        if (statement instanceof UpdateStatement.Assign assign) {
            return assign.value();
        }
        if (statement instanceof UpdateStatement.Replace replace) {
            return JsonNode.JsonArray.of(Nodes.deepCopy(replace.value()));
        }
        if (statement instanceof UpdateStatement.Delete) {
            return JsonNode.JsonArray.empty();
        }
        if (statement instanceof UpdateStatement.Transform) {
            throw new SerializationException(functionMessage, path);
        }
        UpdateStatement.FieldMap map = (UpdateStatement.FieldMap) statement;
        JsonNode.JsonObject obj = JsonNode.JsonObject.empty();
        map.fields().forEachKeyValue((key, value) ->
                obj.fields().put(key, encodeUpdate(value, path.newWith(key), functionMessage)));
        if (map.all() != null) {
            String marker = Operator.ALL.marker();
            obj.fields().put(marker, encodeUpdate(map.all(), path.newWith(marker), functionMessage));
        }
        if (map.where() != null) {
            String marker = Operator.WHERE.marker();
            obj.fields().put(marker, encodePredicate(map.where(), path.newWith(marker), functionMessage));
        }
        if (map.defaultValue() != null) {
            obj.fields().put(Operator.DEFAULT.marker(), Nodes.deepCopy(map.defaultValue()));
        }
        if (!map.context().isEmpty()) {
            JsonNode.JsonObject vars = JsonNode.JsonObject.empty();
            map.context().forEachKeyValue((key, value) -> vars.fields().put(key, Nodes.deepCopy(value)));
            obj.fields().put(Operator.CONTEXT.marker(), vars);
        }
        return obj;
    }

    // ---- select -----------------------------------------------------------------------------

    public SelectStatement decodeSelect(JsonNode json) {
        return decodeSelect(json, Lists.immutable.empty());
    }

    private SelectStatement decodeSelect(JsonNode json, ImmutableList<String> path) {
        if (json instanceof JsonNode.JsonBoolean flag) {
            return flag.value() ? SelectStatement.INCLUDE : SelectStatement.EXCLUDE;
        }
        if (!(json instanceof JsonNode.JsonObject obj)) {
            throw new SerializationException("Select entries must be booleans or objects", path);
        }
        SelectStatement.Builder builder = SelectStatement.shape();
        obj.fields().forEachKeyValue((key, value) -> {
            ImmutableList<String> at = path.newWith(key);
            Optional<Operator> op = Operator.fromMarker(key, Operator.Kind.SELECT);
            if (op.isEmpty()) {
                builder.field(key, decodeSelect(value, at));
                return;
            }
            switch (op.get()) {
                case ALL -> builder.all(decodeSelect(value, at));
                case WHERE -> builder.where(decodePredicate(value, at));
                case DEEP_ALL -> {
                    if (!(decodeSelect(value, at) instanceof SelectStatement.Shape pattern)) {
                        throw new SerializationException("Deep selection needs an object pattern", at);
                    }
                    builder.deepAll(pattern);
                }
                default -> throw new SerializationException("Unexpected operator " + op.get(), at);
            }
        });
        return builder.build();
    }

    public JsonNode encode(SelectStatement statement) {
        return encodeSelect(statement, Lists.immutable.empty(), CANNOT_SERIALIZE);
    }

    private JsonNode encodeSelect(SelectStatement statement, ImmutableList<String> path, String functionMessage) {
        if (statement instanceof SelectStatement.Flag flag) {
            return JsonNode.of(flag.selected());
        }
        SelectStatement.Shape shape = (SelectStatement.Shape) statement;
        JsonNode.JsonObject obj = JsonNode.JsonObject.empty();
        shape.fields().forEachKeyValue((key, value) ->
                obj.fields().put(key, encodeSelect(value, path.newWith(key), functionMessage)));
        if (shape.all() != null) {
            String marker = Operator.ALL.marker();
            obj.fields().put(marker, encodeSelect(shape.all(), path.newWith(marker), functionMessage));
        }
        if (shape.where() != null) {
            String marker = Operator.WHERE.marker();
            obj.fields().put(marker, encodePredicate(shape.where(), path.newWith(marker), functionMessage));
        }
        if (shape.deepAll() != null) {
            String marker = Operator.DEEP_ALL.marker();
            obj.fields().put(marker, encodeSelect(shape.deepAll(), path.newWith(marker), functionMessage));
        }
        return obj;
    }

    // ---- predicate --------------------------------------------------------------------------

    public Predicate decodePredicate(JsonNode json) {
        return decodePredicate(json, Lists.immutable.empty());
    }

    private Predicate decodePredicate(JsonNode json, ImmutableList<String> path) {
        if (json instanceof JsonNode.JsonArray arr) {
            MutableList<Predicate> alternatives = Lists.mutable.empty();
            for (int i = 0; i < arr.elements().size(); i++) {
                alternatives.add(decodePredicate(arr.elements().get(i), path.newWith(Integer.toString(i))));
            }
            return new Predicate.AnyOf(alternatives.toImmutable());
        }
        if (json instanceof JsonNode.JsonObject obj) {
            Predicate.Builder builder = Predicate.builder();
            obj.fields().forEachKeyValue((key, value) -> {
                Predicate operand = decodePredicate(value, path.newWith(key));
                Operator.fromMarker(key, Operator.Kind.PREDICATE).ifPresentOrElse(
                        op -> builder.op(op, operand),
                        () -> builder.field(key, operand));
            });
            return builder.build();
        }
        return new Predicate.Literal(json);
    }

    public JsonNode encode(Predicate predicate) {
        return encodePredicate(predicate, Lists.immutable.empty(), CANNOT_SERIALIZE);
    }

    private JsonNode encodePredicate(Predicate predicate, ImmutableList<String> path, String functionMessage) {
        if (predicate instanceof Predicate.Literal literal) {
            return Nodes.deepCopy(literal.value());
        }
        if (predicate instanceof Predicate.AnyOf anyOf) {
            JsonNode.JsonArray arr = JsonNode.JsonArray.empty();
            anyOf.alternatives().forEachWithIndex((alternative, i) ->
                    arr.elements().add(encodePredicate(alternative, path.newWith(Integer.toString(i)), functionMessage)));
            return arr;
        }
        if (predicate instanceof Predicate.Test) {
            throw new SerializationException(functionMessage, path);
        }
        Predicate.Conjunction conjunction = (Predicate.Conjunction) predicate;
        JsonNode.JsonObject obj = JsonNode.JsonObject.empty();
        conjunction.fields().forEachKeyValue((key, value) ->
                obj.fields().put(key, encodePredicate(value, path.newWith(key), functionMessage)));
        conjunction.operators().forEachKeyValue((op, value) ->
                obj.fields().put(op.marker(), encodePredicate(value, path.newWith(op.marker()), functionMessage)));
        return obj;
    }

    // ---- validation -------------------------------------------------------------------------

    /** Fails with a {@link SerializationException} if the statement holds a function anywhere. */
    public void validateNoFunctions(UpdateStatement statement) {
        encodeUpdate(statement, Lists.immutable.empty(), NOT_ALLOWED);
    }

    public void validateNoFunctions(SelectStatement statement) {
        encodeSelect(statement, Lists.immutable.empty(), NOT_ALLOWED);
    }

    public void validateNoFunctions(Predicate predicate) {
        encodePredicate(predicate, Lists.immutable.empty(), NOT_ALLOWED);
    }
}
