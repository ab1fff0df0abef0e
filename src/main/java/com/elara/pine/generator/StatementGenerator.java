package com.elara.pine.generator;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Statement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Emits statements line by line into a buffer, tracking indentation explicitly.
 *
 * Loops get a hidden counter and a guard as their first body line. Historically indexed
 * names get their series binding right after they are introduced (declaration, parameter
 * or loop binder), once per JavaScript block scope.
 */
final class StatementGenerator implements Statement.StmtVisitor, StatementRenderer {
    private final ExpressionRenderer expressions;
    private final SeriesBindings series;
    private final String indentUnit;
    private final int maxLoopIterations;

    private StringBuilder out = new StringBuilder();
    private int indentLevel = 0;
    private int loopCounter = 0;

    StatementGenerator(ExpressionRenderer expressions, SeriesBindings series, String indentUnit, int maxLoopIterations) {
        this.expressions = expressions;
        this.series = series;
        this.indentUnit = indentUnit;
        this.maxLoopIterations = maxLoopIterations;
    }

    void emit(Statement.Stmt stmt) {
        stmt.accept(this);
    }

    /** Bindings for indexed names the program reads but never declares (price sources, host values). */
    void emitPreamble(Collection<String> hostNames) {
        for (String name : hostNames) bind(name);
    }

    String output() {
        return out.toString();
    }

    // -------------------------
    // Output helpers
    // -------------------------

    private String indent() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) sb.append(indentUnit);
        return sb.toString();
    }

    private void line(String text) {
        out.append(indent()).append(text).append('\n');
    }

    private String expr(Expr.ExprInterface e) {
        return expressions.render(e);
    }

    private void bind(String name) {
        if (!series.needsBinding(name)) return;
        for (String l : SeriesBindings.bindingLines(name)) line(l);
        series.markBound(name);
    }

    private void bindAll(Collection<String> names) {
        for (String name : names) bind(name);
    }

    private void statements(Statement.Block block) {
        if (block == null) return;
        for (Statement.Stmt s : block.statements) s.accept(this);
    }

    private void nested(Statement.Stmt stmt) {
        indentLevel++;
        series.enterScope();
        if (stmt instanceof Statement.Block) statements((Statement.Block) stmt);
        else stmt.accept(this);
        series.exitScope();
        indentLevel--;
    }

    private String nextLoopCounter() {
        return "_loop_" + (loopCounter++);
    }

    private void guard(String counter) {
        line("if (++" + counter + " > " + maxLoopIterations + ") throw new Error(\"Loop limit exceeded (max "
                + maxLoopIterations + " iterations)\");");
    }

    private static String joinNames(List<String> names) {
        List<String> safe = new ArrayList<>();
        for (String n : names) safe.add(Identifiers.sanitize(n));
        return String.join(", ", safe);
    }

    // -------------------------
    // Simple statements
    // -------------------------

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        line(expr(stmt.expression) + ";");
        if (stmt.expression instanceof Expr.Assign) {
            pushSeries(((Expr.Assign) stmt.expression).target);
        }
    }

    /** After {@code x := v}, a program-scope series for x records the new value. */
    private void pushSeries(Expr.ExprInterface target) {
        if (target instanceof Expr.Variable) {
            String name = ((Expr.Variable) target).name;
            if (series.isTopLevel(name)) {
                line(Identifiers.seriesName(name) + ".set(" + Identifiers.sanitize(name) + ");");
            }
        } else if (target instanceof Expr.ArrayLiteral) {
            for (Expr.ExprInterface e : ((Expr.ArrayLiteral) target).elements) pushSeries(e);
        }
    }

    @Override
    public void visitVarStmt(Statement.VarStmt stmt) {
        String keyword = (stmt.kind == Statement.DeclKind.CONST) ? "const" : "let";
        String prefix = stmt.exported ? "export " : "";
        String target = stmt.tuple ? "[" + joinNames(stmt.names) + "]" : Identifiers.sanitize(stmt.name());
        String init = (stmt.initializer == null) ? "" : " = " + expr(stmt.initializer);
        line(prefix + keyword + " " + target + init + ";");
        bindAll(stmt.names);
    }

    @Override
    public void visitBlockStmt(Statement.Block stmt) {
        line("{");
        nested(stmt);
        line("}");
    }

    @Override
    public void visitReturnStmt(Statement.ReturnStmt stmt) {
        line(stmt.value == null ? "return;" : "return " + expr(stmt.value) + ";");
    }

    @Override
    public void visitBreakStmt(Statement.BreakStmt stmt) {
        line("break;");
    }

    @Override
    public void visitContinueStmt(Statement.ContinueStmt stmt) {
        line("continue;");
    }

    @Override
    public void visitImportStmt(Statement.ImportStmt stmt) {
        String path = StringLiterals.quote(stmt.path);
        if (stmt.alias != null) line("import * as " + Identifiers.sanitize(stmt.alias) + " from " + path + ";");
        else line("import " + path + ";");
    }

    // -------------------------
    // Control flow
    // -------------------------

    @Override
    public void visitIfStmt(Statement.If stmt) {
        emitIf(stmt, false);
    }

    private void emitIf(Statement.If stmt, boolean yieldValue) {
        line("if (" + expr(stmt.condition) + ") {");
        body(stmt.thenBranch, yieldValue);
        Statement.Stmt alt = stmt.elseBranch;
        while (alt instanceof Statement.If) {
            Statement.If elseIf = (Statement.If) alt;
            line("} else if (" + expr(elseIf.condition) + ") {");
            body(elseIf.thenBranch, yieldValue);
            alt = elseIf.elseBranch;
        }
        if (alt != null) {
            line("} else {");
            if (alt instanceof Statement.Block) body((Statement.Block) alt, yieldValue);
            else nested(alt);
        }
        line("}");
    }

    @Override
    public void visitWhileStmt(Statement.While stmt) {
        String counter = nextLoopCounter();
        line("let " + counter + " = 0;");
        line("while (" + expr(stmt.condition) + ") {");
        indentLevel++;
        series.enterScope();
        guard(counter);
        statements(stmt.body);
        series.exitScope();
        indentLevel--;
        line("}");
    }

    @Override
    public void visitForStmt(Statement.ForStmt stmt) {
        String counter = nextLoopCounter();
        String var = Identifiers.sanitize(stmt.variable());
        String update = (stmt.step == null) ? var + "++" : var + " += " + expr(stmt.step);
        line("let " + counter + " = 0;");
        line("for (let " + var + " = " + expr(stmt.init.value) + "; " + expr(stmt.test) + "; " + update + ") {");
        indentLevel++;
        series.enterScope();
        guard(counter);
        bind(stmt.variable());
        statements(stmt.body);
        series.exitScope();
        indentLevel--;
        line("}");
    }

    @Override
    public void visitForInStmt(Statement.ForInStmt stmt) {
        String counter = nextLoopCounter();
        String iterable = expr(stmt.iterable);
        line("let " + counter + " = 0;");
        if (stmt.tuple) line("for (const [" + joinNames(stmt.names) + "] of " + iterable + ".entries()) {");
        else line("for (const " + Identifiers.sanitize(stmt.names.get(0)) + " of " + iterable + ") {");
        indentLevel++;
        series.enterScope();
        guard(counter);
        bindAll(stmt.names);
        statements(stmt.body);
        series.exitScope();
        indentLevel--;
        line("}");
    }

    // -------------------------
    // Switch
    // -------------------------

    @Override
    public void visitSwitchStmt(Statement.SwitchStmt stmt) {
        if (stmt.discriminant != null) emitSwitch(stmt.discriminant, stmt.cases, false);
        else emitChain(stmt.cases, false);
    }

    @Override
    public String renderSwitchValue(Expr.SwitchExpr expr) {
        StringBuilder saved = out;
        out = new StringBuilder();
        indentLevel++;
        series.enterScope();
        String body;
        try {
            if (expr.discriminant != null) emitSwitch(expr.discriminant, expr.cases, true);
            else emitChain(expr.cases, true);
            body = out.toString();
        } finally {
            out = saved;
            series.exitScope();
            indentLevel--;
        }
        return "(() => {\n" + body + indent() + "})()";
    }

    private void emitSwitch(Expr.ExprInterface discriminant, List<Statement.SwitchCase> cases, boolean yieldValue) {
        line("switch (" + expr(discriminant) + ") {");
        indentLevel++;
        for (Statement.SwitchCase c : cases) {
            line(c.isDefault() ? "default: {" : "case " + expr(c.test) + ": {");
            body(c.body, yieldValue);
            if (!yieldValue || !alwaysReturns(c.body)) {
                indentLevel++;
                line("break;");
                indentLevel--;
            }
            line("}");
        }
        indentLevel--;
        line("}");
    }

    /** Switch without a discriminant: arms in source order, the default arm last as the final else. */
    private void emitChain(List<Statement.SwitchCase> cases, boolean yieldValue) {
        Statement.SwitchCase fallback = null;
        boolean opened = false;
        for (Statement.SwitchCase c : cases) {
            if (c.isDefault()) {
                if (fallback == null) fallback = c;
                continue;
            }
            line((opened ? "} else if (" : "if (") + expr(c.test) + ") {");
            body(c.body, yieldValue);
            opened = true;
        }
        if (fallback == null) {
            if (opened) line("}");
            return;
        }
        if (opened) {
            line("} else {");
            body(fallback.body, yieldValue);
            line("}");
        } else if (yieldValue) {
            indentLevel--;
            body(fallback.body, true);
            indentLevel++;
        } else {
            line("{");
            body(fallback.body, false);
            line("}");
        }
    }

    // -------------------------
    // Implicit return
    // -------------------------

    /** One indented block; with {@code yieldValue} its trailing statement becomes the block's value. */
    private void body(Statement.Block block, boolean yieldValue) {
        indentLevel++;
        series.enterScope();
        if (yieldValue) yieldingStatements(block);
        else statements(block);
        series.exitScope();
        indentLevel--;
    }

    private void yieldingStatements(Statement.Block block) {
        if (block == null || block.statements.isEmpty()) {
            line("return undefined;");
            return;
        }
        List<Statement.Stmt> list = block.statements;
        for (int i = 0; i < list.size() - 1; i++) list.get(i).accept(this);
        emitReturning(list.get(list.size() - 1));
    }

    private void emitReturning(Statement.Stmt last) {
        if (last instanceof Statement.ExprStmt && ((Statement.ExprStmt) last).expression instanceof Expr.Assign) {
            // the assignment keeps its series push; its target is the value
            last.accept(this);
            Expr.ExprInterface target = ((Expr.Assign) ((Statement.ExprStmt) last).expression).target;
            if (target instanceof Expr.Variable || target instanceof Expr.ArrayLiteral) {
                line("return " + expr(target) + ";");
            }
        } else if (last instanceof Statement.ExprStmt) {
            line("return " + expr(((Statement.ExprStmt) last).expression) + ";");
        } else if (last instanceof Statement.VarStmt) {
            Statement.VarStmt decl = (Statement.VarStmt) last;
            decl.accept(this);
            String value = decl.tuple ? "[" + joinNames(decl.names) + "]" : Identifiers.sanitize(decl.name());
            line("return " + value + ";");
        } else if (last instanceof Statement.If) {
            emitIf((Statement.If) last, true);
        } else {
            last.accept(this);
        }
    }

    private static boolean alwaysReturns(Statement.Stmt stmt) {
        if (stmt == null) return false;
        if (stmt instanceof Statement.Block) {
            List<Statement.Stmt> list = ((Statement.Block) stmt).statements;
            return list.isEmpty() || alwaysReturns(list.get(list.size() - 1));
        }
        if (stmt instanceof Statement.If) {
            Statement.If s = (Statement.If) stmt;
            return alwaysReturns(s.thenBranch) && alwaysReturns(s.elseBranch);
        }
        return stmt instanceof Statement.ExprStmt
                || stmt instanceof Statement.VarStmt
                || stmt instanceof Statement.ReturnStmt;
    }

    // -------------------------
    // Declarations
    // -------------------------

    @Override
    public void visitFunctionStmt(Statement.FunctionStmt stmt) {
        List<String> params = new ArrayList<>();
        for (Statement.Param p : stmt.params) params.add(p.name);
        String prefix = stmt.exported ? "export " : "";
        line(prefix + "function " + Identifiers.sanitize(stmt.name) + "(" + joinNames(params) + ") {");
        indentLevel++;
        series.enterScope();
        bindAll(params);
        // a function yields its last expression
        yieldingStatements(stmt.body);
        series.exitScope();
        indentLevel--;
        line("}");
    }

    @Override
    public void visitTypeStmt(Statement.TypeStmt stmt) {
        List<String> params = new ArrayList<>();
        for (Statement.VarStmt field : stmt.fields) {
            String name = Identifiers.sanitize(field.name());
            params.add(field.initializer == null ? name : name + " = " + expr(field.initializer));
        }
        String prefix = stmt.exported ? "export " : "";
        line(prefix + "class " + Identifiers.sanitize(stmt.name) + " {");
        indentLevel++;
        line("constructor(" + String.join(", ", params) + ") {");
        indentLevel++;
        for (Statement.VarStmt field : stmt.fields) {
            String name = Identifiers.sanitize(field.name());
            line("this." + name + " = " + name + ";");
        }
        indentLevel--;
        line("}");
        indentLevel--;
        line("}");
    }
}
