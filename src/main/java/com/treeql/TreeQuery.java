package com.treeql;

import com.treeql.json.JsonNode;
import com.treeql.query.PredicateEvaluator;
import com.treeql.query.ProjectionExecutor;
import com.treeql.query.ProjectionParser;
import com.treeql.query.SelectEngine;
import com.treeql.statement.Context;
import com.treeql.statement.Predicate;
import com.treeql.statement.SelectStatement;
import com.treeql.statement.UpdateStatement;
import com.treeql.update.ChangeDetection;
import com.treeql.update.ChangeDetector;
import com.treeql.update.ChangeRecord;
import com.treeql.update.Transaction;
import com.treeql.update.Undo;
import com.treeql.update.UpdateEngine;

import java.util.Optional;

/**
 * Entry points for selecting from, updating and testing {@link JsonNode} trees.
 */
public final class TreeQuery {
    private static final PredicateEvaluator PREDICATES = new PredicateEvaluator();
    private static final SelectEngine SELECT = new SelectEngine(PREDICATES);
    private static final Undo UNDO = new Undo();
    private static final UpdateEngine UPDATE = new UpdateEngine(PREDICATES, UNDO);
    private static final ChangeDetection CHANGES = new ChangeDetection();
    private static final ProjectionParser PROJECTION_PARSER = new ProjectionParser();
    private static final ProjectionExecutor PROJECTION = new ProjectionExecutor();

    private TreeQuery() {}

    /** A filtered copy of {@code data}; {@link JsonNode#MISSING} when nothing is selected. */
    public static JsonNode select(JsonNode data, SelectStatement statement) {
        return SELECT.select(data, statement).orElse(JsonNode.MISSING);
    }

    public static Optional<ChangeRecord> update(JsonNode data, UpdateStatement.FieldMap statement) {
        return UPDATE.update(data, statement);
    }

    public static Optional<ChangeRecord> update(JsonNode data, UpdateStatement.FieldMap statement,
                                                ChangeRecord existing) {
        return UPDATE.update(data, statement, existing, Context.empty());
    }

    public static Optional<ChangeRecord> update(JsonNode data, UpdateStatement.FieldMap statement,
                                                ChangeRecord existing, Context context) {
        return UPDATE.update(data, statement, existing, context);
    }

    public static void undo(JsonNode data, ChangeRecord changes) {
        UNDO.undo(data, changes);
    }

    public static Transaction transaction(JsonNode data) {
        return new Transaction(data, UPDATE, UNDO);
    }

    public static boolean evaluatePredicate(JsonNode value, Predicate predicate) {
        return PREDICATES.evaluate(value, predicate);
    }

    public static boolean hasChanges(ChangeRecord changes, ChangeDetector detector) {
        return CHANGES.hasChanges(changes, detector);
    }

    /** Follows a dotted projection path such as {@code items.name}. */
    public static JsonNode selectByPath(JsonNode data, String path) {
        return PROJECTION.execute(PROJECTION_PARSER.parse(path), data);
    }
}
