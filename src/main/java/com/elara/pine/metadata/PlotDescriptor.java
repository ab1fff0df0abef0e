package com.elara.pine.metadata;

/**
 * Display descriptor for {@code plot}, {@code plotshape}, {@code plotchar} and {@code hline}.
 * {@code shape}/{@code location} are set for plotshape only, {@code price} for hline only.
 */
public final class PlotDescriptor {
    public final String id;
    public final String title;
    public final PlotType type;
    public final String color;
    public final int linewidth;
    public final String shape;
    public final String location;
    public final Double price;

    public PlotDescriptor(String id, String title, PlotType type, String color, int linewidth,
                          String shape, String location, Double price) {
        this.id = id;
        this.title = title;
        this.type = type;
        this.color = color;
        this.linewidth = linewidth;
        this.shape = shape;
        this.location = location;
        this.price = price;
    }
}
