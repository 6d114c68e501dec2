package io.arbor.core.workflow;

/// Inclusive numeric bounds for a variable. Either bound may be absent.
///
/// @param min lower bound, null if unbounded
/// @param max upper bound, null if unbounded
public record ValueRange(Double min, Double max) {

    /// Returns whether the value lies within both bounds.
    ///
    /// @param value the value to check
    /// @return `true` when no present bound is violated
    public boolean contains(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
