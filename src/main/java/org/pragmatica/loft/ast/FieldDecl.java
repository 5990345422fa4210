package org.pragmatica.loft.ast;

public record FieldDecl(String name, Type type) {}
