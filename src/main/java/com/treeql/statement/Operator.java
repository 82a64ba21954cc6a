package com.treeql.statement;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

/**
 * Reserved statement tokens. The same token can mean different things depending on the kind of
 * statement it appears in, see {@link Kind}.
 */
public enum Operator {
    ALL("*", Kind.UPDATE, Kind.SELECT, Kind.PREDICATE),
    DEEP_ALL("**", Kind.SELECT),
    WHERE("?", Kind.UPDATE, Kind.SELECT),
    DEFAULT("{}", Kind.UPDATE),
    CONTEXT("$", Kind.UPDATE),
    META("#", Kind.CHANGES),
    LT("<", Kind.PREDICATE),
    GT(">", Kind.PREDICATE),
    LTE("<=", Kind.PREDICATE),
    GTE(">=", Kind.PREDICATE),
    EQ("==", Kind.PREDICATE),
    NEQ("!=", Kind.PREDICATE),
    NOT("!", Kind.PREDICATE),
    MATCH("~", Kind.PREDICATE),
    SOME("|", Kind.PREDICATE);

    public enum Kind { UPDATE, SELECT, PREDICATE, CHANGES }

    private static final ImmutableMap<String, Operator> BY_MARKER;

    static {
        MutableMap<String, Operator> byMarker = Maps.mutable.empty();
        for (Operator op : values()) {
            byMarker.put(op.marker, op);
        }
        BY_MARKER = byMarker.toImmutable();
    }

    private final String marker;
    private final ImmutableSet<Kind> kinds;

    Operator(String marker, Kind... kinds) {
        this.marker = marker;
        this.kinds = Sets.immutable.with(kinds);
    }

    /** The string this operator is written as in serialized statements. */
    public String marker() {
        return marker;
    }

    public boolean appliesTo(Kind kind) {
        return kinds.contains(kind);
    }

    /** Looks up the operator written as {@code marker} if it is reserved for {@code kind}. */
    public static Optional<Operator> fromMarker(String marker, Kind kind) {
        Operator op = BY_MARKER.get(marker);
        return op != null && op.appliesTo(kind) ? Optional.of(op) : Optional.empty();
    }
}
