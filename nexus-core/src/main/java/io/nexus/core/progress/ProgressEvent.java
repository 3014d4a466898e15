package io.nexus.core.progress;

/// A single progress notification.
///
/// `total` defaults to `1.0` when absent, so `progress` alone may be a
/// fraction. {@link #fraction()} normalizes any event to `[0, 1]`.
///
/// @param progress amount of work done
/// @param total total amount of work, may be null
/// @param message human-readable status, may be null
public record ProgressEvent(double progress, Double total, String message) {

    /// Creates an event already expressed as a fraction of `1.0`.
    ///
    /// @param fraction completed fraction
    /// @param message status message, may be null
    /// @return new event, never null
    public static ProgressEvent of(double fraction, String message) {
        return new ProgressEvent(fraction, 1.0, message);
    }

    /// Returns `progress / total` clamped to `[0, 1]`.
    ///
    /// A missing or non-positive total counts as `1.0`; a non-finite ratio
    /// counts as zero.
    ///
    /// @return normalized fraction
    public double fraction() {
        double denominator = total == null || total <= 0 ? 1.0 : total;
        double ratio = progress / denominator;
        if (Double.isNaN(ratio)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
