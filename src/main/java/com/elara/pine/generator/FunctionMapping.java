package com.elara.pine.generator;

/** How one source-level call is rewritten in the output. */
public final class FunctionMapping {

    /** Where the implicit execution-context argument goes, if anywhere. */
    public enum ContextArg { NONE, PREPEND, APPEND }

    public static final int ANY_ARITY = -1;

    public final String targetName;
    public final boolean needsSeries;
    public final ContextArg contextArg;
    public final int arity;
    public final String description;

    public FunctionMapping(String targetName, boolean needsSeries, ContextArg contextArg, int arity, String description) {
        if (targetName == null || targetName.isEmpty()) {
            throw new IllegalArgumentException("Function mapping needs a target name.");
        }
        this.targetName = targetName;
        this.needsSeries = needsSeries;
        this.contextArg = (contextArg == null) ? ContextArg.NONE : contextArg;
        this.arity = arity;
        this.description = (description == null) ? "" : description;
    }
}
