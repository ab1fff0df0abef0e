package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForStmt(ForStmt stmt);
        void visitForInStmt(ForInStmt stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
        void visitSwitchStmt(SwitchStmt stmt);
        void visitTypeStmt(TypeStmt stmt);
        void visitImportStmt(ImportStmt stmt);
    }

    /** Declaration keyword. Plain {@code x = 1} declares with LET. */
    public enum DeclKind { LET, VAR, VARIP, CONST }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /**
     * Declaration of one name or a destructured tuple ({@code [a, b] = f()}).
     * {@code names} always holds at least one entry.
     */
    public static final class VarStmt implements Stmt {
        public final List<String> names;
        public final boolean tuple;
        public final Expr.ExprInterface initializer; // may be null for type fields
        public final DeclKind kind;
        public final TypeAnnotation type;            // may be null
        public final boolean exported;
        public final SourceLocation location;

        VarStmt(List<String> names, boolean tuple, Expr.ExprInterface initializer, DeclKind kind,
                TypeAnnotation type, boolean exported, SourceLocation location) {
            this.names = Collections.unmodifiableList(names);
            this.tuple = tuple;
            this.initializer = initializer;
            this.kind = kind;
            this.type = type;
            this.exported = exported;
            this.location = location;
        }

        VarStmt exportedCopy() {
            return new VarStmt(names, tuple, initializer, kind, type, true, location);
        }

        public String name() { return names.get(0); }

        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = Collections.unmodifiableList(statements); }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Stmt elseBranch; // Block, If (else-if chain) or null
        If(Expr.ExprInterface condition, Block thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;
        While(Expr.ExprInterface condition, Block body) {
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    /**
     * Counting loop {@code for i = a to b [by s]}, desugared to
     * init {@code i = a}, test {@code i <= b} and an optional step.
     */
    public static final class ForStmt implements Stmt {
        public final Expr.Assign init;
        public final Expr.ExprInterface test;
        public final Expr.ExprInterface step; // null means +1
        public final Block body;
        ForStmt(Expr.Assign init, Expr.ExprInterface test, Expr.ExprInterface step, Block body) {
            this.init = init;
            this.test = test;
            this.step = step;
            this.body = body;
        }

        public String variable() { return ((Expr.Variable) init.target).name; }

        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    /** {@code for x in xs} or, with {@code tuple}, {@code for [i, x] in xs}. */
    public static final class ForInStmt implements Stmt {
        public final List<String> names;
        public final boolean tuple;
        public final Expr.ExprInterface iterable;
        public final Block body;
        ForInStmt(List<String> names, boolean tuple, Expr.ExprInterface iterable, Block body) {
            this.names = Collections.unmodifiableList(names);
            this.tuple = tuple;
            this.iterable = iterable;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForInStmt(this); }
    }

    public static final class Param {
        public final String name;
        public final TypeAnnotation type; // may be null
        Param(String name, TypeAnnotation type) {
            this.name = name;
            this.type = type;
        }
    }

    /** Function or method. A single-expression body is stored as a block holding one return. */
    public static final class FunctionStmt implements Stmt {
        public final String name;
        public final List<Param> params;
        public final Block body;
        public final boolean exported;
        public final boolean method;

        FunctionStmt(String name, List<Param> params, Block body, boolean exported, boolean method) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
            this.exported = exported;
            this.method = method;
        }

        FunctionStmt withFlags(boolean exported, boolean method) {
            return new FunctionStmt(name, params, body, exported, method);
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Expr.ExprInterface value; // may be null
        ReturnStmt(Expr.ExprInterface value) { this.value = value; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        BreakStmt() {}
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        ContinueStmt() {}
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
    }

    /** One switch arm. A null test is the default arm; expression arms are wrapped in a one-statement block. */
    public static final class SwitchCase {
        public final Expr.ExprInterface test;
        public final Block body;
        SwitchCase(Expr.ExprInterface test, Block body) {
            this.test = test;
            this.body = body;
        }

        public boolean isDefault() { return test == null; }
    }

    public static final class SwitchStmt implements Stmt {
        public final Expr.ExprInterface discriminant; // may be null
        public final List<SwitchCase> cases;
        SwitchStmt(Expr.ExprInterface discriminant, List<SwitchCase> cases) {
            this.discriminant = discriminant;
            this.cases = Collections.unmodifiableList(cases);
        }
        public void accept(StmtVisitor visitor) { visitor.visitSwitchStmt(this); }
    }

    /** User-defined type; each field is a {@link VarStmt} whose initializer is the default (or null). */
    public static final class TypeStmt implements Stmt {
        public final String name;
        public final List<VarStmt> fields;
        public final boolean exported;
        TypeStmt(String name, List<VarStmt> fields, boolean exported) {
            this.name = name;
            this.fields = Collections.unmodifiableList(fields);
            this.exported = exported;
        }

        TypeStmt exportedCopy() { return new TypeStmt(name, fields, true); }

        public void accept(StmtVisitor visitor) { visitor.visitTypeStmt(this); }
    }

    public static final class ImportStmt implements Stmt {
        public final String path;
        public final String alias; // may be null
        ImportStmt(String path, String alias) {
            this.path = path;
            this.alias = alias;
        }
        public void accept(StmtVisitor visitor) { visitor.visitImportStmt(this); }
    }
}
