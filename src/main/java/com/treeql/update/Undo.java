package com.treeql.update;

import com.treeql.json.JsonNode;
import com.treeql.json.Nodes;
import org.eclipse.collections.api.list.MutableList;

import java.util.logging.Logger;

/**
 * Reverts the changes described by a {@link ChangeRecord}, restoring every recorded original.
 */
public class Undo {
    private static final Logger LOG = Logger.getLogger(Undo.class.getName());

    public void undo(JsonNode data, ChangeRecord changes) {
        if (changes == null || !Nodes.isContainer(data)) {
            return;
        }
        // Latest first, so an appended array element is the tail when it is removed.
        for (String key : changes.keys().asReversed()) {
            if (changes.hasOriginal(key)) {
                restore(data, key, changes.original(key));
            } else {
                ChangeRecord nested = changes.nested(key);
                if (nested != null) {
                    undo(Nodes.child(data, key), nested);
                }
            }
        }
    }

    private void restore(JsonNode data, String key, JsonNode original) {
        if (data instanceof JsonNode.JsonObject obj) {
            if (Nodes.isAbsent(original)) {
                obj.fields().remove(key);
            } else {
                obj.fields().put(key, Nodes.deepCopy(original));
            }
            return;
        }
        JsonNode.JsonArray arr = (JsonNode.JsonArray) data;
        MutableList<JsonNode> elements = arr.elements();
        if (!Nodes.isIndex(key)) {
            LOG.fine(() -> "Cannot restore non-index key '" + key + "' on an array");
            return;
        }
        int index = Integer.parseInt(key);
        if (Nodes.isAbsent(original)) {
            if (index == elements.size() - 1) {
                elements.remove(index);
            } else if (index < elements.size()) {
                elements.set(index, JsonNode.MISSING);
            }
            return;
        }
        while (elements.size() <= index) {
            elements.add(JsonNode.MISSING);
        }
        elements.set(index, Nodes.deepCopy(original));
    }
}
