package io.nexus.core.progress;

/// Receives progress notifications.
///
/// Sinks are called from worker threads. Implementations that forward events
/// to a single consumer must tolerate concurrent callers.
@FunctionalInterface
public interface ProgressSink {

    /// Discards every event.
    ProgressSink NOOP = event -> {};

    /// Delivers one event.
    ///
    /// @param event the event, not null
    void report(ProgressEvent event);

    /// Delivers a fractional progress with a message.
    ///
    /// @param fraction completed fraction in `[0, 1]`
    /// @param message status message, may be null
    default void report(double fraction, String message) {
        report(ProgressEvent.of(fraction, message));
    }
}
