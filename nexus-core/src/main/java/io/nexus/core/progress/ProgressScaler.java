package io.nexus.core.progress;

/// Maps a call's own progress fraction into a sub-range of the overall progress.
///
/// A planned call `i` of `n` owns the slice `[lo, hi]` of the orchestration's
/// progress. Inner progress `p` becomes `lo + (hi - lo) * p`.
///
/// @param lo lower bound of the slice, in `[0, 1]`
/// @param hi upper bound of the slice, in `[lo, 1]`
public record ProgressScaler(double lo, double hi) {

    private static final String DEFAULT_MESSAGE = "Working...";

    public ProgressScaler {
        if (lo < 0.0 || hi > 1.0 || lo > hi) {
            throw new IllegalArgumentException(
                    "Invalid progress range [" + lo + ", " + hi + "]");
        }
    }

    /// Returns the slice owned by call `index` out of `count` calls within
    /// the execution band `[start, start + width]`.
    ///
    /// @param index zero-based call index
    /// @param count number of calls, positive
    /// @param start start of the execution band
    /// @param width width of the execution band
    /// @return the call's slice, never null
    public static ProgressScaler slice(int index, int count, double start, double width) {
        if (count <= 0 || index < 0 || index >= count) {
            throw new IllegalArgumentException("Invalid slice " + index + " of " + count);
        }
        double lo = start + width * index / count;
        double hi = Math.min(1.0, lo + width / count);
        return new ProgressScaler(lo, hi);
    }

    /// Scales an inner fraction into this slice.
    ///
    /// @param fraction inner fraction, clamped to `[0, 1]`
    /// @return scaled fraction in `[lo, hi]`
    public double scale(double fraction) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return lo + (hi - lo) * clamped;
    }

    /// Wraps an upstream sink so that a tool's events arrive scaled and labelled.
    ///
    /// Messages are prefixed with `[toolName] `; events without a message
    /// read `Working...`.
    ///
    /// @param toolName the tool producing the events, not null
    /// @param upstream the overall sink, not null
    /// @return scaling sink, never null
    public ProgressSink wrap(String toolName, ProgressSink upstream) {
        return event -> {
            String message = event.message() != null ? event.message() : DEFAULT_MESSAGE;
            upstream.report(scale(event.fraction()), "[" + toolName + "] " + message);
        };
    }
}
