package io.flowdoc.core.diff;

import java.util.Objects;

/// Difference in one field of a block present in both documents.
///
/// @param field field name, not null
/// @param kind whether the field was added, removed or changed, not null
/// @param oldValue value in the original block, null for {@link Kind#ADDED}
/// @param newValue value in the modified block, null for {@link Kind#REMOVED}
public record FieldDiff(String field, Kind kind, Object oldValue, Object newValue) {

    public FieldDiff {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public enum Kind {
        ADDED("added"),
        REMOVED("removed"),
        MODIFIED("modified");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    static FieldDiff added(String field, Object newValue) {
        return new FieldDiff(field, Kind.ADDED, null, newValue);
    }

    static FieldDiff removed(String field, Object oldValue) {
        return new FieldDiff(field, Kind.REMOVED, oldValue, null);
    }

    static FieldDiff modified(String field, Object oldValue, Object newValue) {
        return new FieldDiff(field, Kind.MODIFIED, oldValue, newValue);
    }
}
