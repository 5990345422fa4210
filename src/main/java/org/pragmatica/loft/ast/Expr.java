package org.pragmatica.loft.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Expression node.
 */
public sealed interface Expr {

    record NumberLiteral(BigDecimal value) implements Expr {}

    record StringLiteral(String value) implements Expr {}

    record BooleanLiteral(boolean value) implements Expr {}

    record Identifier(String name) implements Expr {}

    /**
     * Binary operation; {@code op} is the operator symbol, e.g. {@code "+"} or {@code "&&"}.
     */
    record BinOp(String op, Expr left, Expr right) implements Expr {}

    /**
     * Prefix operation, {@code -} or {@code !}.
     */
    record UnaryOp(String op, Expr operand) implements Expr {}

    record Call(Expr callee, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }

    record FieldAccess(Expr object, String field) implements Expr {}

    record Index(Expr target, Expr index) implements Expr {}

    record ArrayLiteral(List<Expr> elements) implements Expr {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /**
     * {@code Name { field: value, ... }}.
     */
    record StructLiteral(String name, List<FieldInit> fields) implements Expr {
        public StructLiteral {
            fields = List.copyOf(fields);
        }
    }

    /**
     * {@code v => body} or {@code (a: T, b) => body}. A braced body is an {@link Block}.
     */
    record Lambda(List<LambdaParam> params, Optional<Type> returnType, Expr body) implements Expr {
        public Lambda {
            params = List.copyOf(params);
        }
    }

    record Block(List<Stmt> statements) implements Expr {
        public Block {
            statements = List.copyOf(statements);
        }
    }

    record Await(Expr expr) implements Expr {}

    /**
     * Eagerly started asynchronous expression.
     */
    record Async(Expr expr) implements Expr {}

    /**
     * Lazily evaluated asynchronous expression.
     */
    record Lazy(Expr expr) implements Expr {}

    record TemplateLiteral(List<TemplatePart> parts) implements Expr {
        public TemplateLiteral {
            parts = List.copyOf(parts);
        }
    }

    record Match(Expr subject, List<MatchArm<Expr>> arms) implements Expr {
        public Match {
            arms = List.copyOf(arms);
        }
    }

    /**
     * Error propagation, {@code expr?}.
     */
    record Try(Expr expr) implements Expr {}
}
