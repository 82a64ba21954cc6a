package com.treeql.update;

import com.treeql.TreeQLLoggingConfig;
import com.treeql.TreeQuery;
import com.treeql.json.JsonNode;
import com.treeql.statement.SerializationException;
import com.treeql.statement.UpdateStatement;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class UndoTransactionTest extends TreeQLLoggingConfig {

    private static final String ORDER = """
            {"id": 7, "status": "open",
             "lines": [{"sku": "a", "qty": 1}, {"sku": "b", "qty": 2}],
             "customer": {"name": "Ann", "tier": "silver"}}""";

    @Test
    public void testTransactionMatchesSequentialUpdates() {
        UpdateStatement.FieldMap first = updateOf("{\"status\": \"paid\", \"lines\": {\"*\": {\"qty\": 0}}}");
        UpdateStatement.FieldMap second = updateOf("{\"customer\": {\"tier\": \"gold\"}, \"lines\": {\"2\": [{\"sku\": \"c\"}]}}");

        JsonNode sequential = json(ORDER);
        ChangeRecord changes = TreeQuery.update(sequential, first).orElse(null);
        changes = TreeQuery.update(sequential, second, changes).orElse(null);

        JsonNode transactional = json(ORDER);
        Optional<ChangeRecord> committed = TreeQuery.transaction(transactional)
                .apply(first)
                .apply(second)
                .commit();

        assertJson(compact(sequential), transactional);
        assertEquals(Optional.ofNullable(changes), committed);
    }

    @Test
    public void testCommitClearsPendingChanges() {
        JsonNode data = json(ORDER);
        Transaction transaction = TreeQuery.transaction(data).apply(updateOf("{\"status\": \"paid\"}"));

        assertTrue(transaction.pending().isPresent());
        assertTrue(transaction.commit().isPresent());
        assertEquals(Optional.empty(), transaction.pending());
        assertEquals(Optional.empty(), transaction.commit());

        transaction.revert();
        assertEquals(JsonNode.of("paid"), ((JsonNode.JsonObject) data).fields().get("status"));
    }

    @Test
    public void testRevertRestoresData() {
        JsonNode data = json(ORDER);
        Transaction transaction = TreeQuery.transaction(data)
                .apply(updateOf("{\"status\": \"paid\", \"lines\": {\"0\": []}}"))
                .apply(updateOf("{\"customer\": [{\"name\": \"Bob\"}], \"status\": \"shipped\"}"))
                .apply(updateOf("{\"lines\": {\"2\": [{\"sku\": \"c\"}], \"3\": [{\"sku\": \"d\"}]}}"));

        transaction.revert();

        assertJson(ORDER, data);
        assertEquals(Optional.empty(), transaction.pending());
    }

    @Test
    public void testChangesAfterCommitStartNewRecord() {
        JsonNode data = json("{\"a\": 1}");
        Transaction transaction = TreeQuery.transaction(data);

        transaction.apply(updateOf("{\"a\": 2}")).commit();
        transaction.apply(updateOf("{\"a\": 3}"));
        transaction.revert();

        assertJson("{\"a\": 2}", data);
    }

    @Test
    public void testUndoOfNothing() {
        JsonNode data = json("{\"a\": 1}");

        TreeQuery.undo(data, null);
        assertJson("{\"a\": 1}", data);

        JsonNode scalar = JsonNode.of(5);
        TreeQuery.undo(scalar, ChangeRecord.fromJson(json("{\"#\": {\"a\": {\"original\": 1}}}")));
        assertEquals(JsonNode.of(5), scalar);
    }

    @Test
    public void testUndoRemovesAppendedElementsInReverse() {
        JsonNode data = json("[1]");

        ChangeRecord changes = TreeQuery.update(data, updateOf("{\"1\": 2}")).orElseThrow();
        changes = TreeQuery.update(data, updateOf("{\"2\": 3}"), changes).orElseThrow();
        assertJson("[1, 2, 3]", data);

        TreeQuery.undo(data, changes);
        assertJson("[1]", data);
    }

    @Test
    public void testRecordDecodedFromJson() {
        ChangeRecord deletion = ChangeRecord.fromJson(json("{\"#\": {\"a\": {\"original\": 1}}}"));
        JsonNode data = json("{\"b\": 2}");

        assertTrue(deletion.contains("a"));
        assertEquals(JsonNode.MISSING, deletion.value("a"));
        TreeQuery.undo(data, deletion);
        assertJson("{\"a\": 1, \"b\": 2}", data);

        ChangeRecord creation = ChangeRecord.fromJson(json("{\"a\": {\"b\": 1, \"#\": {\"b\": {}}}}"));
        JsonNode created = json("{\"a\": {\"b\": 1}}");
        TreeQuery.undo(created, creation);
        assertJson("{\"a\": {}}", created);
    }

    @Test
    public void testRecordJsonRoundTrip() {
        JsonNode data = json(ORDER);
        ChangeRecord changes = TreeQuery.update(data,
                updateOf("{\"status\": [], \"lines\": {\"1\": {\"qty\": 5}, \"2\": 9}, \"note\": \"x\"}")).orElseThrow();

        JsonNode encoded = changes.toJson();
        ChangeRecord decoded = ChangeRecord.fromJson(encoded);

        assertEquals(changes, decoded);
        assertJson(compact(encoded), decoded.toJson());
        TreeQuery.undo(data, decoded);
        assertJson(ORDER, data);
    }

    @Test
    public void testMalformedRecordJson() {
        SerializationException e = assertThrows(SerializationException.class,
                () -> ChangeRecord.fromJson(json("{\"a\": 1}")));
        assertEquals("A change record must be an object at path: a", e.getMessage());
        assertThrows(SerializationException.class, () -> ChangeRecord.fromJson(json("{\"#\": []}")));
    }
}
