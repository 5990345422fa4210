package org.pragmatica.loft.parser;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PrecedenceTest {

    @Test
    void assignmentOperators_bindLoosest() {
        assertThat(new String[]{"=", "+=", "-=", "*=", "/="})
            .allSatisfy(op -> assertEquals(OptionalInt.of(Precedence.LOWEST), Precedence.of(op)));
        assertTrue(Precedence.of("||").getAsInt() > Precedence.LOWEST);
    }

    @Test
    void expressionTerminators_areNotBinary() {
        assertThat(new String[]{"=>", "->", ".", "?", "::", "!"})
            .allSatisfy(op -> assertTrue(Precedence.of(op).isEmpty(), op));
    }

    @Test
    void multiplicative_bindsTightest() {
        assertEquals(OptionalInt.of(10), Precedence.of("%"));
        assertTrue(Precedence.of("*").getAsInt() > Precedence.of("+").getAsInt());
    }
}
