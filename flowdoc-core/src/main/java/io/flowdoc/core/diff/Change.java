package io.flowdoc.core.diff;

import java.util.List;
import java.util.Objects;

/// One semantic change between two versions of a workflow document.
///
/// - {@link FieldChange}: a top-level scalar (`name`, `description`, `version`) differs
/// - {@link BlockAdded}: a block id exists only in the modified document
/// - {@link BlockRemoved}: a block id exists only in the original document
/// - {@link BlockModified}: a block id exists in both with different content
///
/// @see StructuralDiffer
public sealed interface Change
        permits Change.FieldChange, Change.BlockAdded, Change.BlockRemoved, Change.BlockModified {

    String FIELD_CHANGE = "field_change";
    String BLOCK_ADDED = "block_added";
    String BLOCK_REMOVED = "block_removed";
    String BLOCK_MODIFIED = "block_modified";

    /// Returns the change tag, one of the constants declared on this interface.
    String type();

    /// @param field top-level field name, not null
    /// @param oldValue original value, may be null
    /// @param newValue modified value, may be null
    record FieldChange(String field, String oldValue, String newValue) implements Change {

        public FieldChange {
            Objects.requireNonNull(field, "field must not be null");
        }

        @Override
        public String type() {
            return FIELD_CHANGE;
        }
    }

    /// @param blockId id of the new block, not null
    /// @param blockType type of the new block, may be null
    /// @param blockName name of the new block, may be null
    record BlockAdded(String blockId, String blockType, String blockName) implements Change {

        public BlockAdded {
            Objects.requireNonNull(blockId, "blockId must not be null");
        }

        @Override
        public String type() {
            return BLOCK_ADDED;
        }
    }

    /// @param blockId id of the removed block, not null
    /// @param blockType type of the removed block, may be null
    /// @param blockName name of the removed block, may be null
    record BlockRemoved(String blockId, String blockType, String blockName) implements Change {

        public BlockRemoved {
            Objects.requireNonNull(blockId, "blockId must not be null");
        }

        @Override
        public String type() {
            return BLOCK_REMOVED;
        }
    }

    /// @param blockId id of the changed block, not null
    /// @param fieldDiffs per-field differences, never empty
    record BlockModified(String blockId, List<FieldDiff> fieldDiffs) implements Change {

        public BlockModified {
            Objects.requireNonNull(blockId, "blockId must not be null");
            fieldDiffs = List.copyOf(fieldDiffs);
        }

        @Override
        public String type() {
            return BLOCK_MODIFIED;
        }
    }
}
