package org.pragmatica.loft.ast;

public record FieldInit(String name, Expr value) {}
