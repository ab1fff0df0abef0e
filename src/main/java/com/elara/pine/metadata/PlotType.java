package com.elara.pine.metadata;

import java.util.Locale;

public enum PlotType {
    LINE, HISTOGRAM, AREA, CIRCLES, CROSS, STEPLINE, SHAPE, HLINE;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
