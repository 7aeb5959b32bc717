package com.randomtable.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global diagnostics hub for the table engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 *
 * Recoverable evaluation problems (unknown table, missing capture, bad index)
 * never throw; they are reported here at WARN so tooling can surface them.
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE; the constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Sink writing to stderr, dropping anything below {@code minLevel}. */
    public static DebugSink stderrSink(DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.atLeast(minLevel)) return;
            System.err.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(System.err);
        };
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
