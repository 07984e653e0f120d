package io.flowdoc.core.layout;

import java.util.Arrays;
import java.util.Optional;

/// Selectable auto-layout algorithms.
public enum LayoutAlgorithm {
    HIERARCHICAL("hierarchical"),
    FORCE_DIRECTED("force_directed"),
    GRID("grid");

    private final String value;

    LayoutAlgorithm(String value) {
        this.value = value;
    }

    /// @return the wire name of the algorithm
    public String value() {
        return value;
    }

    /// Looks up an algorithm by wire name.
    ///
    /// @param value wire name, may be null
    /// @return the algorithm, or empty if the name is not recognized
    public static Optional<LayoutAlgorithm> fromValue(String value) {
        return Arrays.stream(values()).filter(a -> a.value.equals(value)).findFirst();
    }
}
