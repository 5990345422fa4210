package org.pragmatica.loft.ast;

import java.util.List;

/**
 * Method declared inside a {@code trait}: either a bare signature or one with a default body.
 */
public sealed interface TraitMethod {
    String name();

    List<Param> params();

    Type returnType();

    record Signature(String name, List<Param> params, Type returnType) implements TraitMethod {
        public Signature {
            params = List.copyOf(params);
        }
    }

    record Default(String name, List<Param> params, Type returnType, Stmt.Block body) implements TraitMethod {
        public Default {
            params = List.copyOf(params);
        }
    }
}
