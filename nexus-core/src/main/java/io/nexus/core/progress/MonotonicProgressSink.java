package io.nexus.core.progress;

import java.util.Objects;

/// Forwards events so that the reported fraction never decreases.
///
/// An event below the highest fraction seen so far is forwarded at that
/// highest fraction, keeping its message. After {@link #close()} every event is
/// dropped, which discards notifications that arrive after a call's terminal
/// result.
///
/// @implNote Thread-safe. Delivery happens under the instance lock so that
/// concurrent callers cannot reorder forwarded fractions.
public final class MonotonicProgressSink implements ProgressSink, AutoCloseable {

    private final ProgressSink delegate;
    private double highest;
    private boolean closed;

    /// Creates a sink forwarding to `delegate`.
    ///
    /// @param delegate receives the filtered events, not null
    public MonotonicProgressSink(ProgressSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public synchronized void report(ProgressEvent event) {
        if (closed) {
            return;
        }
        highest = Math.max(highest, event.fraction());
        delegate.report(ProgressEvent.of(highest, event.message()));
    }

    /// Returns the highest fraction forwarded so far.
    ///
    /// @return highest fraction in `[0, 1]`
    public synchronized double highest() {
        return highest;
    }

    /// Stops forwarding. Later events are dropped.
    @Override
    public synchronized void close() {
        closed = true;
    }
}
