package com.elara.pine.metadata;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.LiteralKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Built-in {@code color.*} constants and static color resolution for display metadata. */
public final class Colors {

    public static final Map<String, String> NAMED;
    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("blue", "#2962FF");
        map.put("red", "#FF5252");
        map.put("green", "#4CAF50");
        map.put("yellow", "#FFEB3B");
        map.put("orange", "#FF9800");
        map.put("purple", "#9C27B0");
        map.put("white", "#FFFFFF");
        map.put("black", "#000000");
        map.put("gray", "#9E9E9E");
        map.put("grey", "#9E9E9E");
        map.put("teal", "#009688");
        map.put("aqua", "#00BCD4");
        map.put("lime", "#CDDC39");
        map.put("pink", "#E91E63");
        map.put("navy", "#1A237E");
        map.put("maroon", "#B71C1C");
        map.put("olive", "#827717");
        map.put("fuchsia", "#F50057");
        map.put("silver", "#BDBDBD");
        NAMED = Collections.unmodifiableMap(map);
    }

    private Colors() {}

    /**
     * Hex value of a color literal, {@code color.<name>} or bare {@code <name>}; null when the
     * expression is not a statically known color.
     */
    public static String resolve(Expr.ExprInterface expr) {
        if (expr instanceof Expr.Literal) {
            Expr.Literal literal = (Expr.Literal) expr;
            return (literal.kind == LiteralKind.COLOR) ? (String) literal.value : null;
        }
        if (expr instanceof Expr.GetExpr) {
            Expr.GetExpr get = (Expr.GetExpr) expr;
            if (get.receiver instanceof Expr.Variable && ((Expr.Variable) get.receiver).name.equals("color")) {
                return NAMED.get(get.name);
            }
            return null;
        }
        if (expr instanceof Expr.Variable) {
            return NAMED.get(((Expr.Variable) expr).name);
        }
        return null;
    }
}
