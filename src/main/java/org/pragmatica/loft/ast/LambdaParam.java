package org.pragmatica.loft.ast;

import java.util.Optional;

/**
 * Lambda parameter; the type annotation is optional.
 */
public record LambdaParam(String name, Optional<Type> type) {}
