package com.hkmatrix.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the HkMatrix engines and tools.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No-op until a sink is installed, so engine calls stay silent by default
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // nothing installed
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Sink writing every level to {@code out} as "[LEVEL][tag] message". */
    public static DebugSink printTo(PrintStream out) {
        return (level, tag, message, error) -> {
            synchronized (out) {
                out.println("[" + level + "][" + tag + "] " + message);
                if (error != null) error.printStackTrace(out);
            }
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
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
