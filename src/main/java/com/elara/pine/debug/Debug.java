package com.elara.pine.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global diagnostic hub for the transpiler pipeline.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No output until a sink is installed
 */
public final class Debug {

    // must precede INSTANCE, whose field initializer reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // discard
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Routes everything at {@code minLevel} or above to stderr. */
    public static void useStdErr(DebugLevel minLevel) {
        INSTANCE.setSink(printSink(System.err, minLevel));
    }

    /** Routes INFO and above to stdout. */
    public static void useSysOut() {
        INSTANCE.setSink(printSink(System.out, DebugLevel.INFO));
    }

    static DebugSink printSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.isAtLeast(minLevel)) return;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
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
