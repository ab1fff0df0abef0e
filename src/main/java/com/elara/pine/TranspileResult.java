package com.elara.pine;

import com.elara.pine.metadata.IndicatorMetadata;
import com.elara.pine.parser.ParseError;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link PineTranspiler#transpile(String)}. On failure {@code output} is null and
 * {@code error} carries the message; {@code errorLine}/{@code errorColumn} are set when the
 * failure has a source position.
 */
public final class TranspileResult {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public final boolean success;
    public final String output;
    public final String error;
    public final Integer errorLine;
    public final Integer errorColumn;
    public final IndicatorMetadata metadata; // null when parsing did not get that far
    public final List<ParseError> parseErrors;

    private TranspileResult(boolean success, String output, String error, Integer errorLine, Integer errorColumn,
                            IndicatorMetadata metadata, List<ParseError> parseErrors) {
        this.success = success;
        this.output = output;
        this.error = error;
        this.errorLine = errorLine;
        this.errorColumn = errorColumn;
        this.metadata = metadata;
        this.parseErrors = (parseErrors == null)
                ? Collections.<ParseError>emptyList()
                : Collections.unmodifiableList(parseErrors);
    }

    static TranspileResult ok(String output, IndicatorMetadata metadata, List<ParseError> parseErrors) {
        return new TranspileResult(true, output, null, null, null, metadata, parseErrors);
    }

    static TranspileResult failure(String error, Integer line, Integer column,
                                   IndicatorMetadata metadata, List<ParseError> parseErrors) {
        return new TranspileResult(false, null, error, line, column, metadata, parseErrors);
    }

    public ObjectNode toJson() {
        return toJson(MAPPER);
    }

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode root = om.createObjectNode();
        root.put("success", success);
        if (output != null) root.put("output", output);
        if (error != null) root.put("error", error);
        if (errorLine != null) root.put("errorLine", errorLine);
        if (errorColumn != null) root.put("errorColumn", errorColumn);
        if (metadata != null) root.set("metadata", metadata.toJson(om));
        if (!parseErrors.isEmpty()) {
            ArrayNode errors = root.putArray("parseErrors");
            for (ParseError pe : parseErrors) {
                ObjectNode n = errors.addObject();
                n.put("line", pe.getLine());
                n.put("column", pe.getColumn());
                n.put("message", pe.getMessage());
            }
        }
        return root;
    }

    @Override
    public String toString() {
        return success ? "TranspileResult{success}" : "TranspileResult{error=" + error + "}";
    }
}
