package com.elara.pine.debug;

/** Pluggable diagnostic output target (stderr, file, test capture, ...). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
