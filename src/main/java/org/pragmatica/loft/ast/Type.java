package org.pragmatica.loft.ast;

import java.util.List;

/**
 * Type annotation.
 */
public sealed interface Type {

    record Named(String name) implements Type {}

    /**
     * {@code Base<T, U>}.
     */
    record Generic(String base, List<Type> typeArgs) implements Type {
        public Generic {
            typeArgs = List.copyOf(typeArgs);
        }
    }

    /**
     * Function type. Not produced by the parser; built by consumers that need to describe callables.
     */
    record Function(List<Type> params, Type returnType) implements Type {
        public Function {
            params = List.copyOf(params);
        }
    }
}
