package com.elara.pine.generator;

import com.elara.pine.parser.Program;
import com.elara.pine.parser.Statement;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects every name the program itself introduces: declarations, function parameters and loop
 * binders. Indexed names outside this set are host-provided and get their series binding up front.
 */
final class DeclaredNames implements Statement.StmtVisitor {
    private final Set<String> names = new LinkedHashSet<>();

    static Set<String> of(Program program) {
        DeclaredNames visitor = new DeclaredNames();
        for (Statement.Stmt stmt : program.body) stmt.accept(visitor);
        return visitor.names;
    }

    private void block(Statement.Block block) {
        if (block == null) return;
        for (Statement.Stmt stmt : block.statements) stmt.accept(this);
    }

    @Override public void visitExprStmt(Statement.ExprStmt stmt) {}

    @Override
    public void visitVarStmt(Statement.VarStmt stmt) {
        names.addAll(stmt.names);
    }

    @Override public void visitBlockStmt(Statement.Block stmt) { block(stmt); }

    @Override
    public void visitIfStmt(Statement.If stmt) {
        block(stmt.thenBranch);
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    @Override public void visitWhileStmt(Statement.While stmt) { block(stmt.body); }

    @Override
    public void visitForStmt(Statement.ForStmt stmt) {
        names.add(stmt.variable());
        block(stmt.body);
    }

    @Override
    public void visitForInStmt(Statement.ForInStmt stmt) {
        names.addAll(stmt.names);
        block(stmt.body);
    }

    @Override
    public void visitFunctionStmt(Statement.FunctionStmt stmt) {
        for (Statement.Param p : stmt.params) names.add(p.name);
        block(stmt.body);
    }

    @Override public void visitReturnStmt(Statement.ReturnStmt stmt) {}
    @Override public void visitBreakStmt(Statement.BreakStmt stmt) {}
    @Override public void visitContinueStmt(Statement.ContinueStmt stmt) {}

    @Override
    public void visitSwitchStmt(Statement.SwitchStmt stmt) {
        for (Statement.SwitchCase c : stmt.cases) block(c.body);
    }

    @Override public void visitTypeStmt(Statement.TypeStmt stmt) {}
    @Override public void visitImportStmt(Statement.ImportStmt stmt) {}
}
