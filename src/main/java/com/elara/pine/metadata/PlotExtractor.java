package com.elara.pine.metadata;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.CallArg;

import java.util.List;

/** Display descriptors for the plotting calls. {@code index} is the plot's position among all plots. */
final class PlotExtractor {
    static final String DEFAULT_PLOT_COLOR = "#2962FF";
    static final String DEFAULT_SHAPE_COLOR = "#000000";
    static final String DEFAULT_HLINE_COLOR = "#787B86";

    private PlotExtractor() {}

    // plot(series, title, color, linewidth, style)
    static PlotDescriptor plot(Expr.Call call, int index) {
        List<CallArg> args = call.arguments;
        String title = titleOr(args, "Plot", index);
        String color = colorOr(CallArgs.get(args, 2, "color"), DEFAULT_PLOT_COLOR);
        Double width = CallArgs.numberValue(CallArgs.get(args, 3, "linewidth"));
        int linewidth = (width == null || width <= 0) ? 1 : width.intValue();
        PlotType type = styleOf(CallArgs.get(args, 4, "style"));
        return new PlotDescriptor(id(index), title, type, color, linewidth, null, null, null);
    }

    static PlotDescriptor plotShape(Expr.Call call, int index) {
        List<CallArg> args = call.arguments;
        String title = titleOr(args, "Shape", index);
        String color = colorOr(CallArgs.get(args, -1, "color"), DEFAULT_SHAPE_COLOR);
        String shape = shapeName(CallArgs.get(args, -1, "style"), "circle");
        String location = shapeName(CallArgs.get(args, -1, "location"), "abovebar");
        return new PlotDescriptor(id(index), title, PlotType.SHAPE, color, 1, shape, location, null);
    }

    static PlotDescriptor plotChar(Expr.Call call, int index) {
        List<CallArg> args = call.arguments;
        String title = titleOr(args, "Char", index);
        String color = colorOr(CallArgs.get(args, -1, "color"), DEFAULT_SHAPE_COLOR);
        return new PlotDescriptor(id(index), title, PlotType.SHAPE, color, 1, null, null, null);
    }

    /** hline(price, title, color); null when the price is not a numeric literal. */
    static PlotDescriptor hline(Expr.Call call, int index) {
        List<CallArg> args = call.arguments;
        Double price = CallArgs.numberValue(CallArgs.get(args, 0, "price"));
        if (price == null) return null;
        String title = titleOr(args, "HLine", index);
        String color = colorOr(CallArgs.get(args, 2, "color"), DEFAULT_HLINE_COLOR);
        return new PlotDescriptor(id(index), title, PlotType.HLINE, color, 1, null, null, price);
    }

    private static PlotType styleOf(Expr.ExprInterface styleExpr) {
        String name = CallArgs.dottedName(styleExpr);
        if (name == null) return PlotType.LINE;
        if (name.contains("histogram") || name.contains("columns")) return PlotType.HISTOGRAM;
        if (name.contains("circles")) return PlotType.CIRCLES;
        if (name.contains("area")) return PlotType.AREA;
        if (name.contains("cross")) return PlotType.CROSS;
        if (name.contains("stepline")) return PlotType.STEPLINE;
        return PlotType.LINE;
    }

    // shape.triangleup -> triangleup, location.belowbar -> belowbar
    private static String shapeName(Expr.ExprInterface expr, String fallback) {
        if (expr instanceof Expr.GetExpr) return ((Expr.GetExpr) expr).name;
        return fallback;
    }

    private static String titleOr(List<CallArg> args, String kind, int index) {
        String title = CallArgs.stringValue(CallArgs.get(args, 1, "title"));
        return (title != null && !title.isEmpty()) ? title : kind + " " + (index + 1);
    }

    private static String colorOr(Expr.ExprInterface expr, String fallback) {
        if (expr == null) return fallback;
        String resolved = Colors.resolve(expr);
        return (resolved != null) ? resolved : DEFAULT_PLOT_COLOR;
    }

    private static String id(int index) {
        return "plot_" + index;
    }
}
