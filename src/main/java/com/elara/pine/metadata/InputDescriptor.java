package com.elara.pine.metadata;

import java.util.Collections;
import java.util.List;

/** One {@code input*()} declaration, in source order. {@code defval} is a Double, Boolean or String. */
public final class InputDescriptor {
    public final String id;
    public final String title;
    public final InputType type;
    public final Object defval;
    public final Double min;   // may be null
    public final Double max;   // may be null
    public final List<Object> options;

    public InputDescriptor(String id, String title, InputType type, Object defval,
                           Double min, Double max, List<Object> options) {
        this.id = id;
        this.title = title;
        this.type = type;
        this.defval = defval;
        this.min = min;
        this.max = max;
        this.options = (options == null) ? Collections.emptyList() : Collections.unmodifiableList(options);
    }
}
