package max.chess.rules.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CoordinateTest {

    @ParameterizedTest
    @CsvSource({"0,0,a1", "7,0,h1", "0,7,a8", "7,7,h8", "4,1,e2", "3,4,d5"})
    public void textIsFileLetterThenRankDigit(int x, int y, String expected) {
        assertEquals(expected, Coordinate.of(x, y).toText());
    }

    @Test
    public void flatIndexIsFilePlusEightTimesRank() {
        // Given
        Coordinate e2 = Coordinate.of(4, 1);

        // Then
        assertEquals(12, e2.flatIndex);
        assertSame(e2, Coordinate.of(12));
    }

    @Test
    public void offsetOffTheBoardIsNull() {
        assertNull(Coordinate.of(7, 7).offset(1, 0));
        assertNull(Coordinate.of(0, 0).offset(0, -1));
        assertSame(Coordinate.of(5, 2), Coordinate.of(4, 0).offset(1, 2));
    }

    @Test
    public void outOfBoardCoordinateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Coordinate.of(8, 0));
        assertThrows(IllegalArgumentException.class, () -> Coordinate.of(64));
    }

    @Test
    public void colourFlipIsTotal() {
        assertEquals(Colour.BLACK, Colour.WHITE.flip());
        assertEquals(Colour.WHITE, Colour.BLACK.flip());
    }

    @Test
    public void onlyRookBishopAndQueenSlide() {
        for(PieceKind kind : PieceKind.VALUES) {
            boolean expected = kind == PieceKind.ROOK || kind == PieceKind.BISHOP || kind == PieceKind.QUEEN;
            assertEquals(expected, kind.isSliding(), kind.name());
        }
    }
}
