package com.treeql.update;

import com.treeql.json.Nodes;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * Checks a {@link ChangeRecord} against a {@link ChangeDetector}.
 */
public class ChangeDetection {

    public boolean hasChanges(ChangeRecord changes, ChangeDetector detector) {
        if (changes == null) {
            return false;
        }
        if (detector instanceof ChangeDetector.Fn fn) {
            return changes.keys().anySatisfy(key -> fn.test().test(key, changes));
        }
        ChangeDetector.Nested nested = (ChangeDetector.Nested) detector;
        MutableMap<String, ChangeDetector> detectors = MapAdapter.adapt(new LinkedHashMap<>());
        detectors.putAll(nested.fields());
        if (nested.all() != null) {
            for (String key : changes.keys()) {
                if (!detectors.containsKey(key)) {
                    detectors.put(key, nested.all());
                }
            }
        }
        return detectors.keyValuesView().anySatisfy(pair -> {
            String key = pair.getOne();
            ChangeDetector keyDetector = pair.getTwo();
            if (keyDetector instanceof ChangeDetector.Fn fn) {
                return fn.test().test(key, changes);
            }
            return hasChanges(below(changes, key), keyDetector);
        });
    }

    /** The record for the changes under {@code key}, if it has any. */
    private static ChangeRecord below(ChangeRecord changes, String key) {
        ChangeRecord nested = changes.nested(key);
        if (nested != null) {
            return nested;
        }
        var value = changes.value(key);
        return Nodes.isContainer(value) ? ChangeRecord.ofReplacement(value) : null;
    }
}
