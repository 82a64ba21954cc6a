package com.treeql.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;

/**
 * A path projection: reach into a value by key, chain steps, or build a new object out of
 * several projections.
 */
public sealed interface ProjectionNode {
    /** A key, or an index when applied to an array. Other keys are mapped over array elements. */
    record Access(String key) implements ProjectionNode {}

    /** Steps applied one after another; empty means the value itself. */
    record Chain(ImmutableList<ProjectionNode> steps) implements ProjectionNode {}

    /** A new object whose entries are either kept keys or projections of the current value. */
    record Shape(MutableMap<String, ProjectionNode> fields) implements ProjectionNode {}

    /** Shape entry that takes ({@code true}) or skips ({@code false}) the key of the same name. */
    record Keep(boolean keep) implements ProjectionNode {}
}
