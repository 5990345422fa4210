package org.pragmatica.loft.ast;

/**
 * Function or method parameter.
 */
public record Param(String name, Type type) {}
