package com.elara.pine.generator;

import com.elara.pine.parser.Expr;

/** What the expression side needs from the statement side: switch bodies used as values. */
interface StatementRenderer {
    String renderSwitchValue(Expr.SwitchExpr expr);
}
