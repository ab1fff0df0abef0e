package com.elara.pine.metadata;

import java.util.Locale;

public enum InputType {
    INTEGER, FLOAT, BOOL, STRING, SOURCE, SESSION, COLOR;

    /** Lower-case name used in host-side metadata ({@code integer}, {@code float}, ...). */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
