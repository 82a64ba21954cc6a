package com.treeql.statement;

import com.treeql.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.EnumMap;
import java.util.LinkedHashMap;

/**
 * A boolean test over a value, used by WHERE clauses.
 *
 * <ul>
 *   <li>{@link Literal}: equal to a value</li>
 *   <li>{@link AnyOf}: any alternative holds (empty is false)</li>
 *   <li>{@link Conjunction}: every operator and every field predicate holds (empty is true)</li>
 *   <li>{@link Test}: a caller supplied function</li>
 * </ul>
 */
public sealed interface Predicate {

    record Literal(JsonNode value) implements Predicate {}

    record AnyOf(ImmutableList<Predicate> alternatives) implements Predicate {}

    record Conjunction(MutableMap<Operator, Predicate> operators,
                       MutableMap<String, Predicate> fields) implements Predicate {
        public Conjunction {
            for (Operator op : operators.keysView()) {
                if (!op.appliesTo(Operator.Kind.PREDICATE)) {
                    throw new StatementException(op + " is not a predicate operator");
                }
            }
        }
    }

    record Test(Condition condition) implements Predicate {}

    @FunctionalInterface
    interface Condition {
        boolean test(JsonNode value, Context context);
    }

    static Literal literal(JsonNode value) {
        return new Literal(value);
    }

    static AnyOf anyOf(Predicate... alternatives) {
        return new AnyOf(Lists.immutable.with(alternatives));
    }

    static Test test(Condition condition) {
        return new Test(condition);
    }

    static Test test(java.util.function.Predicate<JsonNode> condition) {
        return new Test((value, context) -> condition.test(value));
    }

    static Conjunction op(Operator op, Predicate operand) {
        return builder().op(op, operand).build();
    }

    static Conjunction field(String name, Predicate predicate) {
        return builder().field(name, predicate).build();
    }

    static Conjunction eq(JsonNode value) {
        return op(Operator.EQ, literal(value));
    }

    static Conjunction neq(JsonNode value) {
        return op(Operator.NEQ, literal(value));
    }

    static Conjunction lt(long value) {
        return op(Operator.LT, literal(JsonNode.of(value)));
    }

    static Conjunction lte(long value) {
        return op(Operator.LTE, literal(JsonNode.of(value)));
    }

    static Conjunction gt(long value) {
        return op(Operator.GT, literal(JsonNode.of(value)));
    }

    static Conjunction gte(long value) {
        return op(Operator.GTE, literal(JsonNode.of(value)));
    }

    static Conjunction not(Predicate operand) {
        return op(Operator.NOT, operand);
    }

    static Conjunction match(String pattern) {
        return op(Operator.MATCH, literal(JsonNode.of(pattern)));
    }

    static Conjunction all(Predicate element) {
        return op(Operator.ALL, element);
    }

    static Conjunction some(Predicate element) {
        return op(Operator.SOME, element);
    }

    static Builder builder() {
        return new Builder();
    }

    final class Builder {
        private final EnumMap<Operator, Predicate> operators = new EnumMap<>(Operator.class);
        private final LinkedHashMap<String, Predicate> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder op(Operator op, Predicate operand) {
            operators.put(op, operand);
            return this;
        }

        public Builder field(String name, Predicate predicate) {
            fields.put(name, predicate);
            return this;
        }

        public Conjunction build() {
            return new Conjunction(MapAdapter.adapt(new EnumMap<>(operators)),
                    MapAdapter.adapt(new LinkedHashMap<>(fields)));
        }
    }
}
