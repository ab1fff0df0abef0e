package com.elara.pine.metadata;

import java.util.Locale;

/** Feature-support diagnostic. Never fatal to a transpile. */
public final class Warning {

    public enum Severity {
        UNSUPPORTED, PARTIAL, DEPRECATED;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public final Severity severity;
    public final String feature;
    public final String message;

    public Warning(Severity severity, String feature, String message) {
        this.severity = severity;
        this.feature = feature;
        this.message = message;
    }

    @Override
    public String toString() {
        return "[" + severity.id() + "] " + message;
    }
}
