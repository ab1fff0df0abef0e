package com.elara.pine;

import com.elara.pine.debug.Debug;
import com.elara.pine.generator.CodeGenerator;
import com.elara.pine.parser.Parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Startup defaults for {@link PineTranspiler}, read from the optional classpath resource
 * {@code pine-transpiler.properties}. Missing keys keep the built-in values.
 *
 * <pre>
 * pine.mode=STRICT
 * pine.maxTokenCount=100000
 * pine.maxRecursionDepth=500
 * pine.maxLoopIterations=10000
 * pine.indentWidth=2
 * </pre>
 */
public final class TranspilerConfig {
    static final String RESOURCE = "/pine-transpiler.properties";

    public final PineTranspiler.Mode mode;
    public final int maxTokenCount;
    public final int maxRecursionDepth;
    public final int maxLoopIterations;
    public final String indentUnit;

    TranspilerConfig(PineTranspiler.Mode mode, int maxTokenCount, int maxRecursionDepth,
                     int maxLoopIterations, String indentUnit) {
        this.mode = mode;
        this.maxTokenCount = maxTokenCount;
        this.maxRecursionDepth = maxRecursionDepth;
        this.maxLoopIterations = maxLoopIterations;
        this.indentUnit = indentUnit;
    }

    static TranspilerConfig builtIn() {
        return new TranspilerConfig(PineTranspiler.Mode.STRICT,
                Parser.DEFAULT_MAX_TOKEN_COUNT,
                Parser.DEFAULT_MAX_RECURSION_DEPTH,
                CodeGenerator.DEFAULT_MAX_LOOP_ITERATIONS,
                CodeGenerator.DEFAULT_INDENT_UNIT);
    }

    public static TranspilerConfig defaults() {
        try (InputStream in = TranspilerConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) return builtIn();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    /**
     * @throws IllegalArgumentException on a malformed value
     */
    public static TranspilerConfig fromProperties(Properties props) {
        TranspilerConfig base = builtIn();
        String modeText = props.getProperty("pine.mode");
        PineTranspiler.Mode mode = (modeText == null)
                ? base.mode
                : PineTranspiler.Mode.valueOf(modeText.trim().toUpperCase(Locale.ROOT));
        int indentWidth = intValue(props, "pine.indentWidth", base.indentUnit.length());
        if (indentWidth < 0) throw new IllegalArgumentException("pine.indentWidth must be >= 0");

        TranspilerConfig config = new TranspilerConfig(mode,
                positive(props, "pine.maxTokenCount", base.maxTokenCount),
                positive(props, "pine.maxRecursionDepth", base.maxRecursionDepth),
                positive(props, "pine.maxLoopIterations", base.maxLoopIterations),
                " ".repeat(indentWidth));
        Debug.get().d("Transpiler", "config: mode=" + config.mode + ", maxTokenCount=" + config.maxTokenCount
                + ", maxRecursionDepth=" + config.maxRecursionDepth + ", maxLoopIterations=" + config.maxLoopIterations);
        return config;
    }

    private static int positive(Properties props, String key, int fallback) {
        int v = intValue(props, key, fallback);
        if (v <= 0) throw new IllegalArgumentException(key + " must be > 0, got " + v);
        return v;
    }

    private static int intValue(Properties props, String key, int fallback) {
        String text = props.getProperty(key);
        if (text == null || text.trim().isEmpty()) return fallback;
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + text, e);
        }
    }
}
