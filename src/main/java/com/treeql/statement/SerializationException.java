package com.treeql.statement;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Thrown when a statement cannot be converted to or from JSON. Carries the path of the
 * offending entry.
 */
public class SerializationException extends RuntimeException {
    private final ImmutableList<String> path;

    public SerializationException(String message, ImmutableList<String> path) {
        super(path.isEmpty() ? message : message + " at path: " + path.makeString("."));
        this.path = path;
    }

    public SerializationException(String message) {
        this(message, Lists.immutable.empty());
    }

    public ImmutableList<String> path() {
        return path;
    }
}
