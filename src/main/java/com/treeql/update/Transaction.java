package com.treeql.update;

import com.treeql.json.JsonNode;
import com.treeql.statement.Context;
import com.treeql.statement.UpdateStatement;

import java.util.Optional;

/**
 * Runs several updates against one tree and keeps their changes in a single record, which can
 * then be committed or reverted. Not nestable; after commit or revert the next apply starts a
 * new record.
 */
public class Transaction {
    private final JsonNode data;
    private final UpdateEngine engine;
    private final Undo undo;
    private ChangeRecord changes;

    public Transaction(JsonNode data, UpdateEngine engine, Undo undo) {
        this.data = data;
        this.engine = engine;
        this.undo = undo;
    }

    public Transaction apply(UpdateStatement.FieldMap statement) {
        return apply(statement, Context.empty());
    }

    public Transaction apply(UpdateStatement.FieldMap statement, Context context) {
        changes = engine.update(data, statement, changes, context).orElse(null);
        return this;
    }

    /** The changes so far, without ending the transaction. */
    public Optional<ChangeRecord> pending() {
        return Optional.ofNullable(changes);
    }

    public Optional<ChangeRecord> commit() {
        Optional<ChangeRecord> committed = Optional.ofNullable(changes);
        changes = null;
        return committed;
    }

    public void revert() {
        undo.undo(data, changes);
        changes = null;
    }
}
