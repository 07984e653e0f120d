package io.flowdoc.core.document;

import io.flowdoc.core.util.OpaqueValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/// Immutable in-memory form of a workflow document.
///
/// A document is what the parser produces from text and what every other engine
/// component consumes. It models the text as written rather than as it should be:
/// required fields may be absent (null) so the validator can report them, and
/// `malformedFields` records top-level fields that were present with the wrong shape
/// (for example `blocks` given as a scalar). Entries of `blocks` or `connections` that
/// are not mappings are kept by position as malformed entries, and fields written with
/// an explicit null are listed in `nullFields`.
///
/// ### Structure
/// - **name**, **description**, **version**: top-level scalars
/// - **blocks**: ordered block list, null when the field is absent
/// - **connections**: ordered edge list, null when the field is absent
/// - **triggers**, **metadata**: opaque values, kept verbatim
/// - **extensions**: unrecognized top-level fields, kept verbatim
///
/// Documents are never modified in place. Operations that change a document, such as
/// applying a layout, return a new instance.
///
/// @implNote Immutable and thread-safe after construction. All collections are
/// wrapped in unmodifiable views and opaque values are deep-copied.
///
/// @see Block
/// @see Connection
/// @see DocumentParser
public final class WorkflowDocument {

    /// Version assumed when a document does not declare one.
    public static final String DEFAULT_VERSION = "1.0.0";

    private final String name;
    private final String description;
    private final String version;
    private final List<Block> blocks;
    private final List<Connection> connections;
    private final List<Object> triggers;
    private final Map<String, Object> metadata;
    private final Map<String, Object> extensions;
    private final Set<String> malformedFields;
    private final SortedMap<Integer, Object> malformedBlockEntries;
    private final SortedMap<Integer, Object> malformedConnectionEntries;
    private final Set<String> nullFields;

    private WorkflowDocument(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.version = builder.version;
        this.blocks = builder.blocks != null ? List.copyOf(builder.blocks) : null;
        this.connections = builder.connections != null ? List.copyOf(builder.connections) : null;
        this.triggers = OpaqueValues.freezeList(builder.triggers);
        this.metadata = OpaqueValues.freezeMap(builder.metadata);
        this.extensions =
                builder.extensions != null ? OpaqueValues.freezeMap(builder.extensions) : Map.of();
        this.malformedFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.malformed));
        this.malformedBlockEntries = freezeEntries(builder.malformedBlocks);
        this.malformedConnectionEntries = freezeEntries(builder.malformedConnections);
        this.nullFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.nullFields));
    }

    private static SortedMap<Integer, Object> freezeEntries(Map<Integer, Object> entries) {
        SortedMap<Integer, Object> copy = new TreeMap<>();
        entries.forEach((index, value) -> copy.put(index, OpaqueValues.freeze(value)));
        return Collections.unmodifiableSortedMap(copy);
    }

    /// Returns the workflow name.
    ///
    /// @return name, or null if the document has none
    public String getName() {
        return name;
    }

    /// Returns the workflow description.
    ///
    /// @return description, or null if absent
    public String getDescription() {
        return description;
    }

    /// Returns the declared version.
    ///
    /// @return version as written, or null if the document does not declare one
    /// @see #getEffectiveVersion()
    public String getVersion() {
        return version;
    }

    /// Returns the declared version, or {@link #DEFAULT_VERSION} when none is declared.
    ///
    /// @return version, never null
    public String getEffectiveVersion() {
        return version != null ? version : DEFAULT_VERSION;
    }

    /// Returns the blocks in declaration order.
    ///
    /// @return unmodifiable block list, or null when the `blocks` field is absent or malformed
    public List<Block> getBlocks() {
        return blocks;
    }

    /// Returns the blocks in declaration order, treating an absent field as empty.
    ///
    /// @return unmodifiable block list, never null
    public List<Block> blocksOrEmpty() {
        return blocks != null ? blocks : List.of();
    }

    /// Returns the connections in declaration order.
    ///
    /// @return unmodifiable connection list, or null when the field is absent or malformed
    public List<Connection> getConnections() {
        return connections;
    }

    /// Returns the connections in declaration order, treating an absent field as empty.
    ///
    /// @return unmodifiable connection list, never null
    public List<Connection> connectionsOrEmpty() {
        return connections != null ? connections : List.of();
    }

    /// Returns the opaque trigger descriptors.
    ///
    /// @return unmodifiable list, or null when absent
    public List<Object> getTriggers() {
        return triggers;
    }

    /// Returns the opaque metadata map.
    ///
    /// @return unmodifiable ordered map, or null when absent
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns top-level fields the schema does not name, in document order.
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    /// Returns the names of top-level fields that were present with the wrong shape.
    ///
    /// Only `blocks` and `connections` can be malformed; a malformed field reads as
    /// null from its getter.
    ///
    /// @return unmodifiable set of field names, never null
    public Set<String> getMalformedFields() {
        return malformedFields;
    }

    /// Returns whether the given top-level field was present with the wrong shape.
    public boolean isMalformed(String field) {
        return malformedFields.contains(field);
    }

    /// Returns the entries of `blocks` that are not mappings, keyed by their position in
    /// the sequence.
    ///
    /// @return unmodifiable map ordered by position, never null
    public SortedMap<Integer, Object> getMalformedBlockEntries() {
        return malformedBlockEntries;
    }

    /// Returns the entries of `connections` that are not mappings, keyed by position.
    ///
    /// @return unmodifiable map ordered by position, never null
    public SortedMap<Integer, Object> getMalformedConnectionEntries() {
        return malformedConnectionEntries;
    }

    /// Returns every entry of `blocks` in sequence order.
    ///
    /// Well-formed entries are {@link Block} instances; malformed ones are their raw
    /// values.
    ///
    /// @return unmodifiable entry list, or null when the field is absent or malformed
    public List<Object> blockEntries() {
        return blocks != null ? merge(blocks, malformedBlockEntries) : null;
    }

    /// Returns every entry of `connections` in sequence order.
    ///
    /// @return unmodifiable entry list, or null when the field is absent or malformed
    /// @see #blockEntries()
    public List<Object> connectionEntries() {
        return connections != null ? merge(connections, malformedConnectionEntries) : null;
    }

    private static List<Object> merge(List<?> valid, SortedMap<Integer, Object> malformed) {
        List<Object> entries = new ArrayList<>(valid.size() + malformed.size());
        Iterator<?> next = valid.iterator();
        int total = valid.size() + malformed.size();
        for (int i = 0; i < total; i++) {
            if (malformed.containsKey(i)) {
                entries.add(malformed.get(i));
            } else if (next.hasNext()) {
                entries.add(next.next());
            }
        }
        // positions past the end once valid entries were removed
        malformed.tailMap(total).values().forEach(entries::add);
        return Collections.unmodifiableList(entries);
    }

    /// Returns the top-level fields written with an explicit null.
    ///
    /// Only `name`, `description`, `version`, `triggers` and `metadata` are tracked; a
    /// null `blocks` or `connections` is malformed instead.
    ///
    /// @return unmodifiable set of field names, never null
    public Set<String> getNullFields() {
        return nullFields;
    }

    /// Returns whether a top-level field was written, with a value or an explicit null.
    ///
    /// @param field top-level field name
    public boolean declares(String field) {
        if (nullFields.contains(field) || malformedFields.contains(field)) {
            return true;
        }
        return switch (field) {
            case "name" -> name != null;
            case "description" -> description != null;
            case "version" -> version != null;
            case "blocks" -> blocks != null;
            case "connections" -> connections != null;
            case "triggers" -> triggers != null;
            case "metadata" -> metadata != null;
            default -> extensions.containsKey(field);
        };
    }

    /// Returns a copy of this document with the given blocks.
    ///
    /// Malformed block entries are kept at their positions.
    ///
    /// @param newBlocks replacement block list, not null
    /// @return new document, never null
    public WorkflowDocument withBlocks(List<Block> newBlocks) {
        Objects.requireNonNull(newBlocks, "newBlocks must not be null");
        Builder builder = toBuilder();
        builder.blocks = new ArrayList<>(newBlocks);
        builder.malformed.remove("blocks");
        return builder.build();
    }

    /// Returns a builder pre-populated with this document's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.name = name;
        builder.description = description;
        builder.version = version;
        builder.blocks = blocks;
        builder.connections = connections;
        builder.triggers = triggers;
        builder.metadata = metadata;
        builder.extensions = extensions;
        builder.malformed.addAll(malformedFields);
        builder.malformedBlocks.putAll(malformedBlockEntries);
        builder.malformedConnections.putAll(malformedConnectionEntries);
        builder.nullFields.addAll(nullFields);
        return builder;
    }

    /// Creates a new document builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable {@link WorkflowDocument} instances.
    ///
    /// No field is required: the builder accepts whatever the text contained and
    /// leaves judging it to the validator.
    public static final class Builder {
        private String name;
        private String description;
        private String version;
        private List<Block> blocks;
        private List<Connection> connections;
        private List<?> triggers;
        private Map<String, ?> metadata;
        private Map<String, ?> extensions;
        private final Set<String> malformed = new LinkedHashSet<>();
        private final Map<Integer, Object> malformedBlocks = new TreeMap<>();
        private final Map<Integer, Object> malformedConnections = new TreeMap<>();
        private final Set<String> nullFields = new LinkedHashSet<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /// Sets the block list.
        ///
        /// @param blocks ordered blocks, null to mark the field absent
        /// @return this builder for chaining
        public Builder blocks(List<Block> blocks) {
            this.blocks = blocks;
            return this;
        }

        /// Sets the connection list.
        ///
        /// @param connections ordered connections, null to mark the field absent
        /// @return this builder for chaining
        public Builder connections(List<Connection> connections) {
            this.connections = connections;
            return this;
        }

        public Builder triggers(List<?> triggers) {
            this.triggers = triggers;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder extensions(Map<String, ?> extensions) {
            this.extensions = extensions;
            return this;
        }

        /// Records that a top-level field was present but had the wrong shape.
        ///
        /// @param field field name, `blocks` or `connections`
        /// @return this builder for chaining
        public Builder malformed(String field) {
            this.malformed.add(field);
            return this;
        }

        /// Records a `blocks` entry that is not a mapping.
        ///
        /// @param index position of the entry in the sequence
        /// @param value the raw entry, may be null
        /// @return this builder for chaining
        public Builder malformedBlock(int index, Object value) {
            this.malformedBlocks.put(index, value);
            return this;
        }

        /// Records a `connections` entry that is not a mapping.
        ///
        /// @param index position of the entry in the sequence
        /// @param value the raw entry, may be null
        /// @return this builder for chaining
        public Builder malformedConnection(int index, Object value) {
            this.malformedConnections.put(index, value);
            return this;
        }

        /// Records that a top-level field was written with an explicit null.
        ///
        /// @param field field name
        /// @return this builder for chaining
        public Builder nullField(String field) {
            this.nullFields.add(field);
            return this;
        }

        /// Builds the immutable document.
        ///
        /// @return new document, never null
        public WorkflowDocument build() {
            return new WorkflowDocument(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDocument that)) return false;
        return Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(version, that.version)
                && Objects.equals(blocks, that.blocks)
                && Objects.equals(connections, that.connections)
                && Objects.equals(triggers, that.triggers)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(extensions, that.extensions)
                && Objects.equals(malformedFields, that.malformedFields)
                && Objects.equals(malformedBlockEntries, that.malformedBlockEntries)
                && Objects.equals(malformedConnectionEntries, that.malformedConnectionEntries)
                && Objects.equals(nullFields, that.nullFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, version, blocks, connections, triggers, metadata);
    }

    @Override
    public String toString() {
        return "WorkflowDocument{name='"
                + name
                + "', version='"
                + getEffectiveVersion()
                + "', blocks="
                + blocksOrEmpty().size()
                + ", connections="
                + connectionsOrEmpty().size()
                + "}";
    }
}
