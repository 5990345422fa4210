package org.pragmatica.loft.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.loft.source.SourceLocation;

import static org.junit.jupiter.api.Assertions.*;

class PositionedInputStreamTest {

    @Test
    void next_tracksLineAndColumn() {
        var input = PositionedInputStream.of("test", "ab\nc");

        assertEquals('a', input.next());
        assertEquals(SourceLocation.at(1, 2, 1), input.savePosition());

        input.next();
        input.next();
        assertEquals(SourceLocation.at(2, 1, 3), input.savePosition());

        assertEquals('c', input.peek());
        assertEquals('c', input.next());
        assertTrue(input.eof());
    }

    @Test
    void next_countsBytesForOffsetAndCodePointsForColumn() {
        var input = PositionedInputStream.of("test", "\u00E9\uD835\uDC65\nx");

        assertEquals(0xE9, input.next());
        assertEquals(SourceLocation.at(1, 2, 2, 1), input.savePosition());

        assertEquals(0x1D465, input.peek());
        assertEquals(0x1D465, input.next());
        assertEquals(SourceLocation.at(1, 3, 6, 3), input.savePosition());

        input.next();
        assertEquals(SourceLocation.at(2, 1, 7, 4), input.savePosition());
        assertEquals('x', input.next());
        assertTrue(input.eof());
    }

    @Test
    void endOfInput_returnsEofWithoutMoving() {
        var input = PositionedInputStream.of("test", "");

        assertTrue(input.eof());
        assertEquals(PositionedInputStream.EOF, input.peek());
        assertEquals(PositionedInputStream.EOF, input.next());
        assertEquals(SourceLocation.START, input.savePosition());
    }

    @Test
    void restorePosition_rewindsToCheckpoint() {
        var input = PositionedInputStream.of("test", "x\nyz");
        input.next();
        var checkpoint = input.savePosition();

        input.next();
        input.next();
        input.next();
        assertTrue(input.eof());

        input.restorePosition(checkpoint);
        assertEquals('\n', input.next());
        assertEquals(SourceLocation.at(2, 1, 2), input.savePosition());
    }

    @Test
    void origin_shiftsReportedPositions() {
        var origin = SourceLocation.at(3, 5, 20);
        var input = PositionedInputStream.of("test", "xy", origin);

        assertEquals(origin, input.savePosition());
        input.next();
        assertEquals(SourceLocation.at(3, 6, 21), input.savePosition());

        var span = input.spanFrom(origin);
        assertEquals(1, span.length());

        input.restorePosition(origin);
        assertEquals('x', input.next());
    }
}
