package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitCallExpr(Call expr);
        R visitGetExpr(GetExpr expr);
        R visitIndexExpr(IndexExpr expr);
        R visitConditionalExpr(Conditional expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitSwitchExpr(SwitchExpr expr);
    }

    public enum LiteralKind { NUMBER, STRING, BOOLEAN, COLOR, NA }

    // -------------------------
    // Operators
    // -------------------------

    /** Arithmetic, comparison and word-logical ({@code and}/{@code or}) operators. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final String operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, String operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final String operator;
        public final ExprInterface right;

        public Unary(String operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Conditional implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenValue;
        public final ExprInterface elseValue;

        public Conditional(ExprInterface condition, ExprInterface thenValue, ExprInterface elseValue) {
            this.condition = condition;
            this.thenValue = thenValue;
            this.elseValue = elseValue;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }
    }

    /**
     * Reassignment. {@code target} is a {@link Variable}, {@link GetExpr}, {@link IndexExpr}
     * or an {@link ArrayLiteral} of variables (tuple reassignment).
     */
    public static final class Assign implements ExprInterface {
        public final ExprInterface target;
        public final String operator;
        public final ExprInterface value;

        public Assign(ExprInterface target, String operator, ExprInterface value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    // -------------------------
    // Atoms
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Object value;
        public final String raw;
        public final LiteralKind kind;
        public final SourceLocation location;

        public Literal(Object value, String raw, LiteralKind kind, SourceLocation location) {
            this.value = value;
            this.raw = raw;
            this.kind = kind;
            this.location = location;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;
        public final SourceLocation location;

        public Variable(String name, SourceLocation location) {
            this.name = name;
            this.location = location;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ArrayLiteral(List<ExprInterface> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    // -------------------------
    // Calls and access
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final List<CallArg> arguments;
        public final List<TypeAnnotation> typeArguments;
        public final SourceLocation location;

        public Call(ExprInterface callee, List<CallArg> arguments, List<TypeAnnotation> typeArguments,
                    SourceLocation location) {
            this.callee = callee;
            this.arguments = Collections.unmodifiableList(arguments);
            this.typeArguments = Collections.unmodifiableList(typeArguments);
            this.location = location;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /**
     * Call argument, positional or named:
     *   plot(close, title = "Close")
     */
    public static final class CallArg {
        public final String name; // null when positional
        public final ExprInterface value;

        public CallArg(String name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public boolean isNamed() { return name != null; }
    }

    /** Dotted member access: {@code receiver.name}. */
    public static final class GetExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final String name;

        public GetExpr(ExprInterface receiver, String name) {
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    /** Bracket access. On a plain identifier this is a historical (bars-back) read. */
    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;

        public IndexExpr(ExprInterface target, ExprInterface index) {
            this.target = target;
            this.index = index;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class SwitchExpr implements ExprInterface {
        public final ExprInterface discriminant; // may be null
        public final List<Statement.SwitchCase> cases;

        public SwitchExpr(ExprInterface discriminant, List<Statement.SwitchCase> cases) {
            this.discriminant = discriminant;
            this.cases = Collections.unmodifiableList(cases);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSwitchExpr(this);
        }
    }
}
