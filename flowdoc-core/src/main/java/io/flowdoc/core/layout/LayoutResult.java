package io.flowdoc.core.layout;

import io.flowdoc.core.document.Position;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Outcome of one layout call.
///
/// @param positions position per block id, in declaration order, never null
/// @param requestedAlgorithm algorithm name the caller asked for, may be unrecognized
/// @param algorithmUsed algorithm that actually produced the positions, not null
/// @param totalBlocks number of positioned blocks
/// @param elapsedMillis wall-clock time of the call
public record LayoutResult(
        Map<String, Position> positions,
        String requestedAlgorithm,
        LayoutAlgorithm algorithmUsed,
        int totalBlocks,
        long elapsedMillis) {

    public LayoutResult {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        Objects.requireNonNull(algorithmUsed, "algorithmUsed must not be null");
    }

    /// Returns whether the engine had to fall back from the requested algorithm.
    public boolean fellBack() {
        return !algorithmUsed.value().equals(requestedAlgorithm);
    }
}
