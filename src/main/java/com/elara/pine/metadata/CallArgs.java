package com.elara.pine.metadata;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.CallArg;
import com.elara.pine.parser.Expr.LiteralKind;

import java.util.List;

/**
 * Argument lookup for calls such as {@code plot(close, "Close", color = color.red)}.
 * A named argument always wins over the positional one.
 */
public final class CallArgs {

    private CallArgs() {}

    /** Named argument {@code name}, else the positional argument at {@code index} (if it is not itself named). */
    public static Expr.ExprInterface get(List<CallArg> args, int index, String name) {
        for (CallArg arg : args) {
            if (arg.isNamed() && arg.name.equals(name)) return arg.value;
        }
        if (index >= 0 && index < args.size() && !args.get(index).isNamed()) {
            return args.get(index).value;
        }
        return null;
    }

    public static String stringValue(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Literal && ((Expr.Literal) expr).kind == LiteralKind.STRING) {
            return (String) ((Expr.Literal) expr).value;
        }
        return null;
    }

    /** Numeric literal value; a leading unary minus is folded in. */
    public static Double numberValue(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Literal && ((Expr.Literal) expr).kind == LiteralKind.NUMBER) {
            return (Double) ((Expr.Literal) expr).value;
        }
        if (expr instanceof Expr.Unary) {
            Expr.Unary unary = (Expr.Unary) expr;
            Double inner = numberValue(unary.right);
            if (inner == null) return null;
            if (unary.operator.equals("-")) return -inner;
            if (unary.operator.equals("+")) return inner;
        }
        return null;
    }

    public static Boolean booleanValue(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Literal && ((Expr.Literal) expr).kind == LiteralKind.BOOLEAN) {
            return (Boolean) ((Expr.Literal) expr).value;
        }
        return null;
    }

    /**
     * Dotted name of a callee: {@code ta.sma}, {@code input.int}, {@code plot}.
     * Returns null for anything that is not a plain identifier chain.
     */
    public static String dottedName(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Variable) return ((Expr.Variable) expr).name;
        if (expr instanceof Expr.GetExpr) {
            Expr.GetExpr get = (Expr.GetExpr) expr;
            String receiver = dottedName(get.receiver);
            return (receiver == null) ? null : receiver + "." + get.name;
        }
        return null;
    }
}
