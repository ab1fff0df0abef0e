package com.elara.pine.metadata;

/** A {@code bgcolor()} call: the statically resolved color and whether it is applied conditionally. */
public final class BackgroundDescriptor {
    public final int index;
    public final String color;
    public final int transparency;
    public final boolean conditional;

    public BackgroundDescriptor(int index, String color, int transparency, boolean conditional) {
        this.index = index;
        this.color = color;
        this.transparency = transparency;
        this.conditional = conditional;
    }
}
