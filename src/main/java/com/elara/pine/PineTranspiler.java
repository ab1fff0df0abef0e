package com.elara.pine;

import com.elara.pine.debug.Debug;
import com.elara.pine.generator.CodeGenerator;
import com.elara.pine.generator.FunctionRegistry;
import com.elara.pine.metadata.IndicatorMetadata;
import com.elara.pine.metadata.MetadataVisitor;
import com.elara.pine.parser.LexError;
import com.elara.pine.parser.Lexer;
import com.elara.pine.parser.ParseError;
import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import com.elara.pine.parser.Program;
import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Token;

import java.util.Collections;
import java.util.List;

/**
 * Source-to-JavaScript pipeline: lex, parse, extract metadata, generate.
 *
 * Every failure (lexical, size limit, syntax, internal) comes back as a result value;
 * {@link #transpile(String)} and {@link #validate(String)} never throw.
 * An instance is cheap and holds only settings; each call works on fresh state.
 */
public class PineTranspiler {
    private static final String TAG = "Transpiler";
    static final String NESTING_TOO_DEEP = "Input is too deeply nested to transpile.";

    /** STRICT fails on any syntax error; LENIENT generates from whatever parsed. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    private Mode mode;
    private int maxTokenCount;
    private int maxRecursionDepth;
    private int maxLoopIterations;
    private String indentUnit;
    private FunctionRegistry functionRegistry = FunctionRegistry.defaults();

    public PineTranspiler() {
        this(TranspilerConfig.defaults());
    }

    public PineTranspiler(TranspilerConfig config) {
        this.mode = config.mode;
        this.maxTokenCount = config.maxTokenCount;
        this.maxRecursionDepth = config.maxRecursionDepth;
        this.maxLoopIterations = config.maxLoopIterations;
        this.indentUnit = config.indentUnit;
    }

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }

    public Mode getMode() { return mode; }

    public void setMaxTokenCount(int max) { this.maxTokenCount = requirePositive("maxTokenCount", max); }

    public void setMaxRecursionDepth(int max) { this.maxRecursionDepth = requirePositive("maxRecursionDepth", max); }

    public void setMaxLoopIterations(int max) { this.maxLoopIterations = requirePositive("maxLoopIterations", max); }

    public void setIndentUnit(String unit) { this.indentUnit = (unit == null) ? CodeGenerator.DEFAULT_INDENT_UNIT : unit; }

    public void setFunctionRegistry(FunctionRegistry registry) {
        this.functionRegistry = (registry == null) ? FunctionRegistry.empty() : registry;
    }

    public FunctionRegistry getFunctionRegistry() { return functionRegistry; }

    private static int requirePositive(String name, int value) {
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0, got " + value);
        return value;
    }

    // ===================== PIPELINE =====================

    public TranspileResult transpile(String source) {
        long started = System.nanoTime();
        if (source == null || source.trim().isEmpty()) {
            IndicatorMetadata empty = new MetadataVisitor().visit(
                    new Program(Collections.<Statement.Stmt>emptyList(), Program.DEFAULT_VERSION));
            return TranspileResult.ok("", empty, null);
        }

        ParseResult parsed;
        try {
            parsed = parse(source);
        } catch (LexError e) {
            Debug.get().w(TAG, "Lexing failed: " + e.getMessage());
            return TranspileResult.failure(e.getMessage(), e.getLine(), e.getColumn(), null, null);
        } catch (IllegalArgumentException e) {
            Debug.get().w(TAG, e.getMessage());
            return TranspileResult.failure(e.getMessage(), null, null, null, null);
        } catch (StackOverflowError e) {
            Debug.get().w(TAG, "Parsing overflowed the stack");
            return TranspileResult.failure(NESTING_TOO_DEEP, null, null, null, null);
        }

        List<ParseError> errors = parsed.errors();
        if (!errors.isEmpty() && mode == Mode.STRICT) {
            ParseError first = errors.get(0);
            Debug.get().w(TAG, "Parsing failed with " + errors.size() + " error(s): " + first.getMessage());
            return TranspileResult.failure(first.getMessage(), first.getLine(), first.getColumn(), null, errors);
        }

        IndicatorMetadata metadata = null;
        try {
            metadata = new MetadataVisitor().visit(parsed.program());
            String js = new CodeGenerator(functionRegistry, indentUnit, maxLoopIterations)
                    .generate(parsed.program(), metadata);
            Debug.get().d(TAG, "Transpiled in " + ((System.nanoTime() - started) / 1_000_000) + " ms, "
                    + errors.size() + " recovered parse error(s)");
            return TranspileResult.ok(js, metadata, errors);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Internal error during generation", e);
            String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
            return TranspileResult.failure("Internal error: " + message, null, null, metadata, errors);
        } catch (StackOverflowError e) {
            Debug.get().e(TAG, "Generation overflowed the stack");
            return TranspileResult.failure(NESTING_TOO_DEEP, null, null, metadata, errors);
        }
    }

    /** Lexer and parser only; no metadata or code. */
    public ValidationResult validate(String source) {
        if (source == null || source.trim().isEmpty()) return ValidationResult.ok();
        try {
            ParseResult parsed = parse(source);
            if (parsed.hasErrors()) return ValidationResult.invalid(parsed.errors().get(0).getMessage());
            return ValidationResult.ok();
        } catch (LexError | IllegalArgumentException e) {
            Debug.get().d(TAG, "Validation rejected input: " + e.getMessage());
            return ValidationResult.invalid(e.getMessage());
        } catch (StackOverflowError e) {
            Debug.get().d(TAG, "Validation overflowed the stack");
            return ValidationResult.invalid(NESTING_TOO_DEEP);
        }
    }

    /**
     * @throws LexError on malformed tokens
     * @throws IllegalArgumentException when the token limit is exceeded
     */
    private ParseResult parse(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens, maxTokenCount, maxRecursionDepth);
        parser.setVersion(lexer.version());
        return parser.parse();
    }
}
