package com.randomtable.debug;

/** Pluggable diagnostics target (stderr, test collector, host logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
