package com.elara.pine.metadata;

import com.elara.pine.debug.Debug;
import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.CallArg;
import com.elara.pine.parser.Program;
import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Statement.Stmt;
import com.elara.pine.parser.Statement.SwitchCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single read-only pass over a {@link Program} that collects {@link IndicatorMetadata}:
 * the indicator header, inputs, plots, background colors, price sources in use,
 * identifiers read historically and feature-support warnings.
 */
public final class MetadataVisitor implements Expr.ExprVisitor<Void>, Statement.StmtVisitor {

    private static final String TAG = "Metadata";

    public static final Set<String> PRICE_SOURCES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "open", "close", "high", "low", "volume", "hl2", "hlc3", "ohlc4")));

    static final Set<String> UNSUPPORTED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "request.security", "request.financial", "request.quandl", "request.seed",
            "request.economic", "request.dividends", "request.earnings", "request.splits",
            "ticker.new", "ticker.modify", "alert", "alertcondition",
            "runtime.error", "log.info", "log.warning", "log.error")));

    static final Set<String> PARTIAL = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "plotshape", "plotchar", "plotarrow", "bgcolor", "fill", "barcolor",
            "box.new", "line.new", "label.new", "table.new", "table.cell")));

    static final Set<String> DEPRECATED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "study", "security")));

    private static final String DEFAULT_BACKGROUND = "#808080";
    private static final int DEFAULT_BACKGROUND_TRANSPARENCY = 80;

    private final WarningCollector warnings;
    private final boolean ownsCollector;

    private String name;
    private String shortName;
    private boolean overlay;
    private final List<InputDescriptor> inputs = new ArrayList<>();
    private final List<PlotDescriptor> plots = new ArrayList<>();
    private final List<BackgroundDescriptor> backgrounds = new ArrayList<>();
    private final Set<String> usedSources = new LinkedHashSet<>();
    private final Set<String> historicalAccess = new LinkedHashSet<>();
    private final Map<String, ColorInfo> colorVariables = new HashMap<>();

    public MetadataVisitor() {
        this(new WarningCollector(), true);
    }

    /** Uses a caller-owned collector; it is not reset between visits, so deduplication spans runs until the caller resets it. */
    public MetadataVisitor(WarningCollector warnings) {
        this(warnings, false);
    }

    private MetadataVisitor(WarningCollector warnings, boolean ownsCollector) {
        this.warnings = warnings;
        this.ownsCollector = ownsCollector;
    }

    public IndicatorMetadata visit(Program program) {
        reset();
        for (Stmt stmt : program.body) {
            stmt.accept(this);
        }
        Debug.get().d(TAG, "indicator '" + name + "': " + inputs.size() + " inputs, " + plots.size()
                + " plots, historical=" + historicalAccess + ", sources=" + usedSources);
        return new IndicatorMetadata(name, shortName, overlay, program.version,
                new ArrayList<>(inputs), new ArrayList<>(plots), new ArrayList<>(backgrounds),
                usedSources, historicalAccess, warnings.warnings());
    }

    private void reset() {
        name = IndicatorMetadata.DEFAULT_NAME;
        shortName = IndicatorMetadata.DEFAULT_SHORT_NAME;
        overlay = false;
        inputs.clear();
        plots.clear();
        backgrounds.clear();
        usedSources.clear();
        historicalAccess.clear();
        colorVariables.clear();
        if (ownsCollector) warnings.reset();
    }

    // -------------------------
    // Calls
    // -------------------------

    @Override
    public Void visitCallExpr(Expr.Call expr) {
        String fnName = CallArgs.dottedName(expr.callee);
        if (fnName != null) {
            checkSupport(fnName);
            collect(fnName, expr);
        } else {
            expr.callee.accept(this);
        }
        for (CallArg arg : expr.arguments) {
            arg.value.accept(this);
        }
        return null;
    }

    private void collect(String fnName, Expr.Call call) {
        switch (fnName) {
            case "indicator":
            case "study":
            case "strategy":
                header(call);
                return;
            case "plot":
                plots.add(PlotExtractor.plot(call, plots.size()));
                return;
            case "plotshape":
                plots.add(PlotExtractor.plotShape(call, plots.size()));
                return;
            case "plotchar":
                plots.add(PlotExtractor.plotChar(call, plots.size()));
                return;
            case "hline": {
                PlotDescriptor line = PlotExtractor.hline(call, plots.size());
                if (line != null) plots.add(line);
                return;
            }
            case "bgcolor":
                background(call);
                return;
            default:
                if (fnName.equals("input") || fnName.startsWith("input.")) {
                    inputs.add(InputExtractor.extract(call, fnName, inputs.size()));
                }
        }
    }

    private void header(Expr.Call call) {
        String title = CallArgs.stringValue(CallArgs.get(call.arguments, 0, "title"));
        if (title != null) name = title;

        String shortTitle = CallArgs.stringValue(CallArgs.get(call.arguments, 1, "shorttitle"));
        if (shortTitle != null) shortName = shortTitle;
        else if (title != null) shortName = title;

        Boolean overlayFlag = CallArgs.booleanValue(CallArgs.get(call.arguments, 2, "overlay"));
        if (overlayFlag != null) overlay = overlayFlag;
    }

    private void background(Expr.Call call) {
        Expr.ExprInterface colorArg = CallArgs.get(call.arguments, 0, "color");
        if (colorArg == null) return;
        ColorInfo info = colorInfo(colorArg);
        String color = (info != null) ? info.hex : DEFAULT_BACKGROUND;
        int transparency = (info != null) ? info.transparency : DEFAULT_BACKGROUND_TRANSPARENCY;
        backgrounds.add(new BackgroundDescriptor(backgrounds.size(), color, transparency,
                colorArg instanceof Expr.Conditional));
    }

    private void checkSupport(String fnName) {
        if (UNSUPPORTED.contains(fnName)) {
            warn(Warning.Severity.UNSUPPORTED, fnName,
                    "Function '" + fnName + "' is not supported and will be ignored at runtime");
        } else if (PARTIAL.contains(fnName)) {
            warn(Warning.Severity.PARTIAL, fnName,
                    "Function '" + fnName + "' has limited support - some features may not work as expected");
        } else if (DEPRECATED.contains(fnName)) {
            warn(Warning.Severity.DEPRECATED, fnName,
                    "Function '" + fnName + "' is deprecated - consider using the recommended alternative");
        }
    }

    private void warn(Warning.Severity severity, String fnName, String message) {
        if (warnings.warn(severity, fnName, message)) {
            Debug.get().i(TAG, message);
        }
    }

    // -------------------------
    // Colors
    // -------------------------

    private static final class ColorInfo {
        final String hex;
        final int transparency;

        ColorInfo(String hex, int transparency) {
            this.hex = hex;
            this.transparency = transparency;
        }
    }

    // color.red | #FF0000 | color.new(color.red, 80) | tracked color variable | cond ? a : b
    private ColorInfo colorInfo(Expr.ExprInterface expr) {
        String hex = Colors.resolve(expr);
        if (hex != null) return new ColorInfo(hex, 0);

        if (expr instanceof Expr.Variable) {
            return colorVariables.get(((Expr.Variable) expr).name);
        }
        if (expr instanceof Expr.Conditional) {
            Expr.Conditional conditional = (Expr.Conditional) expr;
            ColorInfo chosen = colorInfo(conditional.thenValue);
            return (chosen != null) ? chosen : colorInfo(conditional.elseValue);
        }
        if (expr instanceof Expr.Call && "color.new".equals(CallArgs.dottedName(((Expr.Call) expr).callee))) {
            List<CallArg> args = ((Expr.Call) expr).arguments;
            Expr.ExprInterface baseExpr = CallArgs.get(args, 0, "color");
            ColorInfo base = (baseExpr == null) ? null : colorInfo(baseExpr);
            if (base == null) return null;
            Double transp = CallArgs.numberValue(CallArgs.get(args, 1, "transp"));
            return new ColorInfo(base.hex, (transp == null) ? base.transparency : transp.intValue());
        }
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitVariableExpr(Expr.Variable expr) {
        if (PRICE_SOURCES.contains(expr.name)) usedSources.add(expr.name);
        return null;
    }

    @Override
    public Void visitIndexExpr(Expr.IndexExpr expr) {
        if (expr.target instanceof Expr.Variable) {
            historicalAccess.add(((Expr.Variable) expr.target).name);
        }
        expr.target.accept(this);
        expr.index.accept(this);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Expr.Binary expr) {
        expr.left.accept(this);
        expr.right.accept(this);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Expr.Unary expr) {
        expr.right.accept(this);
        return null;
    }

    @Override
    public Void visitLiteralExpr(Expr.Literal expr) {
        return null;
    }

    @Override
    public Void visitAssignExpr(Expr.Assign expr) {
        expr.target.accept(this);
        expr.value.accept(this);
        return null;
    }

    @Override
    public Void visitGetExpr(Expr.GetExpr expr) {
        expr.receiver.accept(this);
        return null;
    }

    @Override
    public Void visitConditionalExpr(Expr.Conditional expr) {
        expr.condition.accept(this);
        expr.thenValue.accept(this);
        expr.elseValue.accept(this);
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(Expr.ArrayLiteral expr) {
        for (Expr.ExprInterface element : expr.elements) element.accept(this);
        return null;
    }

    @Override
    public Void visitSwitchExpr(Expr.SwitchExpr expr) {
        visitSwitch(expr.discriminant, expr.cases);
        return null;
    }

    private void visitSwitch(Expr.ExprInterface discriminant, List<SwitchCase> cases) {
        if (discriminant != null) discriminant.accept(this);
        for (SwitchCase c : cases) {
            if (c.test != null) c.test.accept(this);
            c.body.accept(this);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        stmt.expression.accept(this);
    }

    @Override
    public void visitVarStmt(Statement.VarStmt stmt) {
        if (stmt.initializer == null) return;
        stmt.initializer.accept(this);
        if (!stmt.tuple) {
            ColorInfo info = colorInfo(stmt.initializer);
            if (info != null) colorVariables.put(stmt.name(), info);
        }
    }

    @Override
    public void visitBlockStmt(Statement.Block stmt) {
        for (Stmt s : stmt.statements) s.accept(this);
    }

    @Override
    public void visitIfStmt(Statement.If stmt) {
        stmt.condition.accept(this);
        stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    @Override
    public void visitWhileStmt(Statement.While stmt) {
        stmt.condition.accept(this);
        stmt.body.accept(this);
    }

    @Override
    public void visitForStmt(Statement.ForStmt stmt) {
        stmt.init.accept(this);
        stmt.test.accept(this);
        if (stmt.step != null) stmt.step.accept(this);
        stmt.body.accept(this);
    }

    @Override
    public void visitForInStmt(Statement.ForInStmt stmt) {
        stmt.iterable.accept(this);
        stmt.body.accept(this);
    }

    @Override
    public void visitFunctionStmt(Statement.FunctionStmt stmt) {
        stmt.body.accept(this);
    }

    @Override
    public void visitReturnStmt(Statement.ReturnStmt stmt) {
        if (stmt.value != null) stmt.value.accept(this);
    }

    @Override
    public void visitBreakStmt(Statement.BreakStmt stmt) {}

    @Override
    public void visitContinueStmt(Statement.ContinueStmt stmt) {}

    @Override
    public void visitSwitchStmt(Statement.SwitchStmt stmt) {
        visitSwitch(stmt.discriminant, stmt.cases);
    }

    @Override
    public void visitTypeStmt(Statement.TypeStmt stmt) {
        for (Statement.VarStmt field : stmt.fields) {
            if (field.initializer != null) field.initializer.accept(this);
        }
    }

    @Override
    public void visitImportStmt(Statement.ImportStmt stmt) {}
}
