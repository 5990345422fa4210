package org.pragmatica.loft.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.loft.Loft;
import org.pragmatica.loft.source.SourceLocation;
import org.pragmatica.loft.source.SourceSpan;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static ParseError failure(String source) {
        return assertThrows(ParseError.class, () -> Loft.parse(source, "test"));
    }

    @Test
    void render_underlinesOffendingToken() {
        var error = failure("let x = ;");

        var expected = """
            error: Unexpected token in expression: ';'
              --> test:1:9
              |
            1 | let x = ;
              |         ^ Unexpected token in expression: ';'
              |
            """;
        assertEquals(expected, error.render("let x = ;"));
    }

    @Test
    void location_reportsByteOffsetAfterNonAsciiText() {
        var source = "let s = \"\u00E9\";\nlet y = ;";
        var error = failure(source);

        assertEquals(2, error.line());
        assertEquals(9, error.column());
        assertEquals(22, error.offset());
        assertEquals(";", error.span().extract(source));
    }

    @Test
    void render_alignsUnderlineByCodePoints() {
        var source = "let \uD835\uDC65 = ;";
        var error = failure(source);

        var rendered = error.render(source);
        assertTrue(rendered.contains("1 | " + source + "\n  |         ^ "), rendered);
    }

    @Test
    void render_onlyShowsErrorLineAndStripsCarriageReturn() {
        var source = "let a = 1;\r\nlet b = ;\r\n";
        var error = failure(source);

        var rendered = error.render(source);
        assertTrue(rendered.contains("2 | let b = ;\n"), rendered);
        assertFalse(rendered.contains("\r"));
        assertFalse(rendered.contains("let a"));
    }

    @Test
    void render_widensGutterForMultiDigitLines() {
        var source = "\n".repeat(9) + "let x = ;";
        var error = failure(source);

        var rendered = error.render(source);
        assertTrue(rendered.contains("10 | let x = ;\n"), rendered);
        assertTrue(rendered.contains("   |         ^"), rendered);
    }

    @Test
    void underline_coversWholeSpan() {
        var span = SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 9, 8));
        var diagnostic = Diagnostic.error("bad name", span).withLabel("here");

        var rendered = diagnostic.format("let abcd = 1;", "main.lf");
        assertTrue(rendered.contains("  |     ^^^^ here\n"), rendered);
    }

    @Test
    void unlabeledDiagnostic_stillUnderlines() {
        var diagnostic = Diagnostic.error("oops", SourceSpan.at(SourceLocation.at(1, 3, 2)));

        var rendered = diagnostic.format("abc", "main.lf");
        assertTrue(rendered.contains("  |   ^\n"), rendered);
    }

    @Test
    void help_isRenderedAsNote() {
        var error = failure("let x = ;").withHelp("add a value after '='");

        assertTrue(error.render("let x = ;").endsWith("  |\n  = help: add a value after '='\n"));
        assertEquals("add a value after '='", error.help().orElseThrow());
    }

    @Test
    void formatSimple_isOneLine() {
        var error = failure("let x = ;");

        assertEquals("test:1:9: error: Unexpected token in expression: ';'",
                     error.toDiagnostic().formatSimple("test"));
    }

    @Test
    void parseError_messageCarriesPathAndLocation() {
        var error = failure("let x = ;");

        assertEquals("Error in test @ 1:9:\nUnexpected token in expression: ';'", error.getMessage());
        assertEquals(ParseError.Kind.SYNTAX, error.kind());
        assertEquals("test", error.path());
        assertEquals(8, error.offset());
        assertEquals(OptionalInt.of(1), error.length());
        assertTrue(error.help().isEmpty());
    }

    @Test
    void errorAtEndOfInput_hasNoLength() {
        var error = failure("let x =");

        assertEquals(8, error.column());
        assertEquals(OptionalInt.empty(), error.length());
    }
}
