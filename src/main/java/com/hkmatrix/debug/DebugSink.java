package com.hkmatrix.debug;

/** Pluggable debug output target (stdout, a test collector, a UI console). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
