package com.treeql.query;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import com.treeql.statement.Context;
import com.treeql.statement.Operator;
import com.treeql.statement.Predicate;
import com.treeql.statement.StatementException;

import java.util.function.IntPredicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates {@link Predicate}s against values. Shared by the select and update engines for
 * their WHERE clauses.
 */
public class PredicateEvaluator {
    private static final Logger LOG = Logger.getLogger(PredicateEvaluator.class.getName());

    public boolean evaluate(JsonNode value, Predicate predicate) {
        return evaluate(value, predicate, Context.empty());
    }

    public boolean evaluate(JsonNode value, Predicate predicate, Context context) {
        if (predicate instanceof Predicate.Literal literal) {
            return Nodes.strictEquals(value, literal.value());
        }
        if (predicate instanceof Predicate.AnyOf anyOf) {
            return anyOf.alternatives().anySatisfy(alternative -> evaluate(value, alternative, context));
        }
        if (predicate instanceof Predicate.Test test) {
            return test.condition().test(value, context);
        }
        Predicate.Conjunction conjunction = (Predicate.Conjunction) predicate;
        boolean operatorsHold = conjunction.operators().keyValuesView().allSatisfy(
                pair -> testOperator(value, pair.getOne(), pair.getTwo(), context));
        if (!operatorsHold) {
            return false;
        }
        if (conjunction.fields().isEmpty()) {
            return true;
        }
        if (!Nodes.isContainer(value)) {
            return false;
        }
        return conjunction.fields().keyValuesView().allSatisfy(
                pair -> evaluate(Nodes.child(value, pair.getOne()), pair.getTwo(), context));
    }

    private boolean testOperator(JsonNode value, Operator op, Predicate operand, Context context) {
        switch (op) {
            case NOT:
                return !evaluate(value, operand, context);
            case ALL:
                return Nodes.isContainer(value)
                        && Nodes.keys(value).allSatisfy(key -> evaluate(Nodes.child(value, key), operand, context));
            case SOME:
                return Nodes.isContainer(value)
                        && Nodes.keys(value).anySatisfy(key -> evaluate(Nodes.child(value, key), operand, context));
            default:
                break;
        }
        if (!(operand instanceof Predicate.Literal literal)) {
            // A value operator against a predicate operand compares unequal to everything.
            LOG.fine(() -> "Operator " + op.marker() + " has no value operand: " + operand);
            return op == Operator.NEQ;
        }
        JsonNode bound = literal.value();
        return switch (op) {
            case EQ -> Nodes.looseEquals(value, bound);
            case NEQ -> !Nodes.looseEquals(value, bound);
            case LT -> ordered(value, bound, order -> order < 0);
            case GT -> ordered(value, bound, order -> order > 0);
            case LTE -> ordered(value, bound, order -> order <= 0);
            case GTE -> ordered(value, bound, order -> order >= 0);
            case MATCH -> matches(value, bound);
            default -> throw new StatementException(op + " is not a predicate operator");
        };
    }

    /** Only numbers against numbers and strings against strings are ordered; anything else fails. */
    private static boolean ordered(JsonNode value, JsonNode bound, IntPredicate test) {
        if (value instanceof JsonNode.JsonNumber x && bound instanceof JsonNode.JsonNumber y) {
            double left = x.numberValue().doubleValue();
            double right = y.numberValue().doubleValue();
            return !Double.isNaN(left) && !Double.isNaN(right) && test.test(Double.compare(left, right));
        }
        if (value instanceof JsonNode.JsonString x && bound instanceof JsonNode.JsonString y) {
            return test.test(x.value().compareTo(y.value()));
        }
        return false;
    }

    private static boolean matches(JsonNode value, JsonNode pattern) {
        if (!(value instanceof JsonNode.JsonString text) || !(pattern instanceof JsonNode.JsonString source)) {
            return false;
        }
        try {
            return compile(source.value()).matcher(text.value()).find();
        } catch (PatternSyntaxException e) {
            LOG.warning(() -> "Invalid regex pattern: " + source.value() + " (" + e.getDescription() + ")");
            return false;
        }
    }

    /**
     * Compiles either a bare pattern or the {@code /pattern/flags} form. Flags {@code i}, {@code m},
     * {@code s} and {@code u} map to their {@link Pattern} counterparts; {@code g} and {@code y}
     * have no meaning for a single test and are ignored.
     */
    static Pattern compile(String source) {
        int lastSlash = source.lastIndexOf('/');
        if (!source.startsWith("/") || lastSlash <= 0) {
            return Pattern.compile(source);
        }
        String body = source.substring(1, lastSlash);
        int flags = 0;
        for (char flag : source.substring(lastSlash + 1).toCharArray()) {
            switch (flag) {
                case 'i' -> flags |= Pattern.CASE_INSENSITIVE;
                case 'm' -> flags |= Pattern.MULTILINE;
                case 's' -> flags |= Pattern.DOTALL;
                case 'u' -> flags |= Pattern.UNICODE_CASE;
                case 'g', 'y' -> { }
                default -> throw new PatternSyntaxException("Unknown flag '" + flag + "'", source, lastSlash + 1);
            }
        }
        return Pattern.compile(body, flags);
    }
}
