package com.elara.pine.metadata;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.CallArg;
import com.elara.pine.parser.Expr.LiteralKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link InputDescriptor}s from {@code input(...)} / {@code input.<type>(...)} calls.
 *
 * Argument positions: defval 0, title 1, minval 2, maxval 3, options 4.
 */
final class InputExtractor {

    private InputExtractor() {}

    static InputDescriptor extract(Expr.Call call, String fnName, int index) {
        List<CallArg> args = call.arguments;
        Expr.ExprInterface defvalExpr = CallArgs.get(args, 0, "defval");

        InputType type;
        Object defval;
        switch (fnName) {
            case "input.int":
                type = InputType.INTEGER;
                defval = orElse(CallArgs.numberValue(defvalExpr), 0.0);
                break;
            case "input.float":
                type = InputType.FLOAT;
                defval = orElse(CallArgs.numberValue(defvalExpr), 0.0);
                break;
            case "input.bool":
                type = InputType.BOOL;
                defval = orElse(CallArgs.booleanValue(defvalExpr), Boolean.FALSE);
                break;
            case "input.string":
            case "input.symbol":
            case "input.timeframe":
                type = InputType.STRING;
                defval = orElse(CallArgs.stringValue(defvalExpr), "");
                break;
            case "input.session":
                type = InputType.SESSION;
                defval = orElse(CallArgs.stringValue(defvalExpr), "");
                break;
            case "input.source":
                type = InputType.SOURCE;
                defval = (defvalExpr instanceof Expr.Variable) ? ((Expr.Variable) defvalExpr).name : "close";
                break;
            case "input.time":
                type = InputType.INTEGER;
                defval = orElse(CallArgs.numberValue(defvalExpr), 0.0);
                break;
            case "input.color":
                type = InputType.COLOR;
                defval = orElse(Colors.resolve(defvalExpr), "#2962FF");
                break;
            default:
                return inferred(args, defvalExpr, index);
        }
        return describe(args, index, type, defval);
    }

    // legacy input(defval, title): the type follows the default value
    private static InputDescriptor inferred(List<CallArg> args, Expr.ExprInterface defvalExpr, int index) {
        InputType type = InputType.FLOAT;
        Object defval = 0.0;
        if (defvalExpr instanceof Expr.Literal) {
            Expr.Literal literal = (Expr.Literal) defvalExpr;
            switch (literal.kind) {
                case BOOLEAN: type = InputType.BOOL; defval = literal.value; break;
                case STRING: type = InputType.STRING; defval = literal.value; break;
                case COLOR: type = InputType.COLOR; defval = literal.value; break;
                case NUMBER:
                    type = isWholeNumber(literal.raw) ? InputType.INTEGER : InputType.FLOAT;
                    defval = literal.value;
                    break;
                default:
                    break;
            }
        } else if (defvalExpr instanceof Expr.Variable
                && MetadataVisitor.PRICE_SOURCES.contains(((Expr.Variable) defvalExpr).name)) {
            type = InputType.SOURCE;
            defval = ((Expr.Variable) defvalExpr).name;
        } else if (CallArgs.numberValue(defvalExpr) != null) {
            defval = CallArgs.numberValue(defvalExpr);
        }
        return describe(args, index, type, defval);
    }

    private static InputDescriptor describe(List<CallArg> args, int index, InputType type, Object defval) {
        String title = orElse(CallArgs.stringValue(CallArgs.get(args, 1, "title")), "Input " + (index + 1));
        Double min = CallArgs.numberValue(CallArgs.get(args, 2, "minval"));
        Double max = CallArgs.numberValue(CallArgs.get(args, 3, "maxval"));

        List<Object> options = new ArrayList<>();
        Expr.ExprInterface optionsExpr = CallArgs.get(args, 4, "options");
        if (optionsExpr instanceof Expr.ArrayLiteral) {
            for (Expr.ExprInterface element : ((Expr.ArrayLiteral) optionsExpr).elements) {
                if (element instanceof Expr.Literal && ((Expr.Literal) element).value != null) {
                    options.add(((Expr.Literal) element).value);
                }
            }
        }
        return new InputDescriptor("in_" + index, title, type, defval, min, max, options);
    }

    private static boolean isWholeNumber(String raw) {
        return raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0;
    }

    private static <T> T orElse(T value, T fallback) {
        return (value != null) ? value : fallback;
    }
}
