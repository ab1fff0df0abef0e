package com.elara.pine.generator;

import com.elara.pine.metadata.CallArgs;
import com.elara.pine.parser.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders one expression as JavaScript source.
 *
 * Binaries are always parenthesized so source precedence survives whatever the output
 * is embedded in. Switch expressions are handed back to the statement side.
 */
final class ExpressionGenerator implements Expr.ExprVisitor<String>, ExpressionRenderer {
    private final FunctionRegistry registry;
    private final SeriesBindings series;
    private StatementRenderer statements;

    ExpressionGenerator(FunctionRegistry registry, SeriesBindings series) {
        this.registry = registry;
        this.series = series;
    }

    void setStatementRenderer(StatementRenderer statements) {
        this.statements = statements;
    }

    @Override
    public String render(Expr.ExprInterface expr) {
        if (expr == null) throw new IllegalStateException("Missing expression node.");
        return expr.accept(this);
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return "(" + render(expr.left) + " " + binaryOperator(expr.operator) + " " + render(expr.right) + ")";
    }

    static String binaryOperator(String op) {
        switch (op) {
            case "and": return "&&";
            case "or":  return "||";
            case "==":  return "===";
            case "!=":  return "!==";
            default:    return op;
        }
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        String op = "not".equals(expr.operator) ? "!" : expr.operator;
        String operand = render(expr.right);
        // keeps "- -x" from collapsing into a decrement
        if (expr.right instanceof Expr.Unary) operand = "(" + operand + ")";
        return op + operand;
    }

    @Override
    public String visitConditionalExpr(Expr.Conditional expr) {
        return "(" + render(expr.condition) + " ? " + render(expr.thenValue) + " : " + render(expr.elseValue) + ")";
    }

    @Override
    public String visitAssignExpr(Expr.Assign expr) {
        String op = ":=".equals(expr.operator) ? "=" : expr.operator;
        return assignTarget(expr.target) + " " + op + " " + render(expr.value);
    }

    private String assignTarget(Expr.ExprInterface target) {
        if (target instanceof Expr.Variable) {
            return Identifiers.sanitize(((Expr.Variable) target).name);
        }
        if (target instanceof Expr.GetExpr) {
            return render(target);
        }
        if (target instanceof Expr.IndexExpr) {
            Expr.IndexExpr idx = (Expr.IndexExpr) target;
            return render(idx.target) + "[" + render(idx.index) + "]";
        }
        if (target instanceof Expr.ArrayLiteral) {
            List<String> names = new ArrayList<>();
            for (Expr.ExprInterface e : ((Expr.ArrayLiteral) target).elements) names.add(assignTarget(e));
            return "[" + String.join(", ", names) + "]";
        }
        throw new IllegalStateException("No generation rule for assignment target " + target.getClass().getSimpleName());
    }

    // -------------------------
    // Atoms
    // -------------------------

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        switch (expr.kind) {
            case NUMBER:
                return expr.raw;
            case STRING:
                return StringLiterals.quote(String.valueOf(expr.value));
            case COLOR:
                return StringLiterals.quote(expr.value == null ? expr.raw : String.valueOf(expr.value));
            case BOOLEAN:
                return String.valueOf(expr.value);
            case NA:
                return "NaN";
            default:
                throw new IllegalStateException("No generation rule for literal kind " + expr.kind);
        }
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return Identifiers.sanitize(expr.name);
    }

    @Override
    public String visitArrayLiteralExpr(Expr.ArrayLiteral expr) {
        List<String> parts = new ArrayList<>();
        for (Expr.ExprInterface e : expr.elements) parts.add(render(e));
        return "[" + String.join(", ", parts) + "]";
    }

    // -------------------------
    // Calls and access
    // -------------------------

    @Override
    public String visitCallExpr(Expr.Call expr) {
        String name = CallArgs.dottedName(expr.callee);
        Optional<FunctionMapping> mapping = registry.lookup(name);

        List<String> args = new ArrayList<>();
        for (int i = 0; i < expr.arguments.size(); i++) {
            Expr.ExprInterface value = expr.arguments.get(i).value;
            if (i == 0 && mapping.isPresent() && mapping.get().needsSeries) {
                args.add(seriesArgument(value));
            } else {
                args.add(render(value));
            }
        }

        if (!mapping.isPresent()) {
            return render(expr.callee) + "(" + String.join(", ", args) + ")";
        }

        FunctionMapping fn = mapping.get();
        if (fn.contextArg == FunctionMapping.ContextArg.PREPEND) args.add(0, "context");
        if (fn.contextArg == FunctionMapping.ContextArg.APPEND) args.add("context");
        return fn.targetName + "(" + String.join(", ", args) + ")";
    }

    /** A bound identifier is passed as its value history; anything else as a plain value. */
    private String seriesArgument(Expr.ExprInterface value) {
        if (value instanceof Expr.Variable) {
            String name = ((Expr.Variable) value).name;
            if (series.isBound(name)) return Identifiers.seriesName(name);
        }
        return render(value);
    }

    @Override
    public String visitGetExpr(Expr.GetExpr expr) {
        return render(expr.receiver) + "." + Identifiers.sanitize(expr.name);
    }

    @Override
    public String visitIndexExpr(Expr.IndexExpr expr) {
        if (expr.target instanceof Expr.Variable) {
            return Identifiers.accessorName(((Expr.Variable) expr.target).name) + "(" + render(expr.index) + ")";
        }
        return render(expr.target) + "[" + render(expr.index) + "]";
    }

    @Override
    public String visitSwitchExpr(Expr.SwitchExpr expr) {
        if (statements == null) throw new IllegalStateException("Statement renderer not wired.");
        return statements.renderSwitchValue(expr);
    }
}
