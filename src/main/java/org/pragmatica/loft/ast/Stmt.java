package org.pragmatica.loft.ast;

import java.util.List;
import java.util.Optional;

/**
 * Statement node.
 *
 * <p>Bodies of functions, loops and trait default methods are always {@link Block}s.
 */
public sealed interface Stmt {

    /**
     * {@code learn "a::b::c"}; the path is the literal split on {@code ::}.
     */
    record ImportDecl(List<String> path) implements Stmt {
        public ImportDecl {
            path = List.copyOf(path);
        }
    }

    record VarDecl(String name, Optional<Type> type, boolean mutable, Optional<Expr> value) implements Stmt {}

    record ConstDecl(String name, Optional<Type> type, Expr value) implements Stmt {}

    /**
     * Function declaration.
     *
     * @param name       Function name
     * @param typeParams Names of generic type parameters, in declaration order
     * @param params     Parameters; an untyped {@code self} gets type {@code Self}
     * @param returnType Declared return type, if any
     * @param body       Function body
     * @param async      Declared with {@code async fn}
     * @param exported   Declared with {@code teach fn}
     */
    record FunctionDecl(
        String name,
        List<String> typeParams,
        List<Param> params,
        Optional<Type> returnType,
        Block body,
        boolean async,
        boolean exported
    ) implements Stmt {
        public FunctionDecl {
            typeParams = List.copyOf(typeParams);
            params = List.copyOf(params);
        }
    }

    /**
     * {@code #[name(args)] stmt}.
     */
    record AttrStmt(Attribute attribute, Stmt stmt) implements Stmt {}

    record StructDecl(String name, List<FieldDecl> fields) implements Stmt {
        public StructDecl {
            fields = List.copyOf(fields);
        }
    }

    /**
     * {@code impl Type { ... }} or {@code impl Trait for Type { ... }}.
     */
    record ImplBlock(String typeName, Optional<String> traitName, List<FunctionDecl> methods) implements Stmt {
        public ImplBlock {
            methods = List.copyOf(methods);
        }
    }

    record TraitDecl(String name, List<TraitMethod> methods) implements Stmt {
        public TraitDecl {
            methods = List.copyOf(methods);
        }
    }

    record EnumDecl(String name, List<EnumVariant> variants) implements Stmt {
        public EnumDecl {
            variants = List.copyOf(variants);
        }
    }

    record Assign(String name, Expr value) implements Stmt {}

    record If(Expr condition, Stmt thenBranch, Optional<Stmt> elseBranch) implements Stmt {}

    record While(Expr condition, Block body) implements Stmt {}

    record For(String variable, Expr iterable, Block body) implements Stmt {}

    record Match(Expr subject, List<MatchArm<Stmt>> arms) implements Stmt {
        public Match {
            arms = List.copyOf(arms);
        }
    }

    record Return(Optional<Expr> value) implements Stmt {}

    record Break() implements Stmt {}

    record Continue() implements Stmt {}

    record Expression(Expr expr) implements Stmt {}

    record Block(List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }
    }
}
