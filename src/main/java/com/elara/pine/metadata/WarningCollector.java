package com.elara.pine.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Per-run warning list, deduplicated by function name. */
public final class WarningCollector {
    private final List<Warning> warnings = new ArrayList<>();
    private final Set<String> warnedFeatures = new HashSet<>();

    /** Records a warning unless one was already recorded for {@code feature}; returns whether it was added. */
    public boolean warn(Warning.Severity severity, String feature, String message) {
        if (!warnedFeatures.add(feature)) return false;
        warnings.add(new Warning(severity, feature, message));
        return true;
    }

    public List<Warning> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public void reset() {
        warnings.clear();
        warnedFeatures.clear();
    }
}
