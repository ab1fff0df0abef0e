package com.elara.pine.generator;

import com.elara.pine.debug.Debug;
import com.elara.pine.metadata.IndicatorMetadata;
import com.elara.pine.parser.Program;
import com.elara.pine.parser.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a parsed {@link Program} into JavaScript source.
 *
 * Each call builds a fresh pair of statement and expression generators, so one instance
 * can serve any number of programs, including concurrently.
 */
public final class CodeGenerator {
    private static final String TAG = "Generator";

    public static final String DEFAULT_INDENT_UNIT = "  ";
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 10_000;

    private final FunctionRegistry registry;
    private final String indentUnit;
    private final int maxLoopIterations;

    public CodeGenerator(FunctionRegistry registry) {
        this(registry, DEFAULT_INDENT_UNIT, DEFAULT_MAX_LOOP_ITERATIONS);
    }

    public CodeGenerator(FunctionRegistry registry, String indentUnit, int maxLoopIterations) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        if (indentUnit == null) throw new IllegalArgumentException("indentUnit must not be null");
        if (maxLoopIterations <= 0) throw new IllegalArgumentException("maxLoopIterations must be > 0");
        this.registry = registry;
        this.indentUnit = indentUnit;
        this.maxLoopIterations = maxLoopIterations;
    }

    public String generate(Program program, IndicatorMetadata metadata) {
        return generate(program, metadata.historicalAccess());
    }

    /**
     * @param historical every identifier read with {@code x[n]}; each gets exactly one series binding
     * @throws IllegalStateException on an AST node with no generation rule
     */
    public String generate(Program program, Set<String> historical) {
        SeriesBindings series = new SeriesBindings(historical);
        ExpressionGenerator expressions = new ExpressionGenerator(registry, series);
        StatementGenerator statements = new StatementGenerator(expressions, series, indentUnit, maxLoopIterations);
        expressions.setStatementRenderer(statements);

        Set<String> declared = DeclaredNames.of(program);
        List<String> hostNames = new ArrayList<>();
        for (String name : series.historical()) {
            if (!declared.contains(name)) hostNames.add(name);
        }
        statements.emitPreamble(hostNames);

        for (Statement.Stmt stmt : program.body) {
            statements.emit(stmt);
        }

        String js = statements.output();
        Debug.get().d(TAG, "Generated " + program.body.size() + " statements, "
                + series.historical().size() + " series bindings (" + hostNames.size() + " in preamble)");
        return js;
    }
}
