package com.elara.pine.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Indicator-level facts extracted from one program. Immutable once built.
 *
 * {@code historicalAccess} lists every identifier read with {@code x[n]} syntax; the generator
 * creates one value-history binding for each of them.
 */
public final class IndicatorMetadata {
    public static final String DEFAULT_NAME = "Untitled Script";
    public static final String DEFAULT_SHORT_NAME = "Untitled";

    private final String name;
    private final String shortName;
    private final boolean overlay;
    private final int version;
    private final List<InputDescriptor> inputs;
    private final List<PlotDescriptor> plots;
    private final List<BackgroundDescriptor> backgrounds;
    private final Set<String> usedSources;
    private final Set<String> historicalAccess;
    private final List<Warning> warnings;

    IndicatorMetadata(String name, String shortName, boolean overlay, int version,
                      List<InputDescriptor> inputs, List<PlotDescriptor> plots,
                      List<BackgroundDescriptor> backgrounds, Set<String> usedSources,
                      Set<String> historicalAccess, List<Warning> warnings) {
        this.name = name;
        this.shortName = shortName;
        this.overlay = overlay;
        this.version = version;
        this.inputs = Collections.unmodifiableList(inputs);
        this.plots = Collections.unmodifiableList(plots);
        this.backgrounds = Collections.unmodifiableList(backgrounds);
        this.usedSources = Collections.unmodifiableSet(new LinkedHashSet<>(usedSources));
        this.historicalAccess = Collections.unmodifiableSet(new LinkedHashSet<>(historicalAccess));
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public String name() { return name; }
    public String shortName() { return shortName; }
    public boolean overlay() { return overlay; }
    public int version() { return version; }
    public List<InputDescriptor> inputs() { return inputs; }
    public List<PlotDescriptor> plots() { return plots; }
    public List<BackgroundDescriptor> backgrounds() { return backgrounds; }
    public Set<String> usedSources() { return usedSources; }
    public Set<String> historicalAccess() { return historicalAccess; }
    public List<Warning> warnings() { return warnings; }

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode root = om.createObjectNode();
        root.put("name", name);
        root.put("shortName", shortName);
        root.put("overlay", overlay);
        root.put("version", version);

        ArrayNode inputArray = root.putArray("inputs");
        for (InputDescriptor in : inputs) {
            ObjectNode n = inputArray.addObject();
            n.put("id", in.id);
            n.put("name", in.title);
            n.put("type", in.type.id());
            n.set("defval", om.valueToTree(in.defval));
            if (in.min != null) n.put("min", in.min);
            if (in.max != null) n.put("max", in.max);
            if (!in.options.isEmpty()) n.set("options", om.valueToTree(in.options));
        }

        ArrayNode plotArray = root.putArray("plots");
        for (PlotDescriptor p : plots) {
            ObjectNode n = plotArray.addObject();
            n.put("id", p.id);
            n.put("title", p.title);
            n.put("type", p.type.id());
            n.put("color", p.color);
            n.put("linewidth", p.linewidth);
            if (p.shape != null) n.put("shape", p.shape);
            if (p.location != null) n.put("location", p.location);
            if (p.price != null) n.put("price", p.price);
        }

        ArrayNode bgArray = root.putArray("bgcolors");
        for (BackgroundDescriptor bg : backgrounds) {
            ObjectNode n = bgArray.addObject();
            n.put("index", bg.index);
            n.put("color", bg.color);
            n.put("transparency", bg.transparency);
            n.put("conditional", bg.conditional);
        }

        ArrayNode sources = root.putArray("usedSources");
        usedSources.forEach(sources::add);
        ArrayNode historical = root.putArray("historicalAccess");
        historicalAccess.forEach(historical::add);

        ArrayNode warningArray = root.putArray("warnings");
        for (Warning w : warnings) {
            ObjectNode n = warningArray.addObject();
            n.put("severity", w.severity.id());
            n.put("feature", w.feature);
            n.put("message", w.message);
        }
        return root;
    }
}
