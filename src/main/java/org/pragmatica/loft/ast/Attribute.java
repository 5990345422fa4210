package org.pragmatica.loft.ast;

import java.util.List;

public record Attribute(String name, List<Expr> args) {
    public Attribute {
        args = List.copyOf(args);
    }
}
