package com.elara.pine.generator;

import com.elara.pine.parser.Expr;

/** What the statement side needs from the expression side. */
interface ExpressionRenderer {
    String render(Expr.ExprInterface expr);
}
