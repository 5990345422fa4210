package org.pragmatica.loft.parser;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Binding strength of binary operators; higher binds tighter. All operators are left-associative.
 *
 * <p>Assignment operators bind loosest, so {@code self.count = self.count + 1} folds as one
 * {@code BinOp("=", ...)} over a field access. Operators that end an expression ({@code =>},
 * {@code ->}, {@code .}, {@code ?}) are absent and never fold.
 */
public final class Precedence {
    public static final int LOWEST = 0;

    private static final Map<String, Integer> TABLE = Map.ofEntries(
        Map.entry("=", LOWEST),
        Map.entry("+=", LOWEST),
        Map.entry("-=", LOWEST),
        Map.entry("*=", LOWEST),
        Map.entry("/=", LOWEST),
        Map.entry("||", 1),
        Map.entry("&&", 2),
        Map.entry("==", 3),
        Map.entry("!=", 3),
        Map.entry("<", 4),
        Map.entry("<=", 4),
        Map.entry(">", 4),
        Map.entry(">=", 4),
        Map.entry("|", 5),
        Map.entry("^", 6),
        Map.entry("&", 7),
        Map.entry("<<", 8),
        Map.entry(">>", 8),
        Map.entry("+", 9),
        Map.entry("-", 9),
        Map.entry("*", 10),
        Map.entry("/", 10),
        Map.entry("%", 10)
    );

    private Precedence() {}

    /**
     * Precedence of a binary operator, or empty if the symbol is not a binary operator.
     */
    public static OptionalInt of(String operator) {
        var precedence = TABLE.get(operator);
        return precedence == null ? OptionalInt.empty() : OptionalInt.of(precedence);
    }
}
