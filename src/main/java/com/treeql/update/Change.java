package com.treeql.update;

import com.treeql.json.JsonNode;

/**
 * What happened to one key: it was given a new {@link Value}, or something beneath it changed
 * and is described by a {@link Nested} record.
 */
public sealed interface Change {
    /** Snapshot of the value written; {@link JsonNode#MISSING} for a deletion. */
    record Value(JsonNode value) implements Change {}

    record Nested(ChangeRecord record) implements Change {}
}
