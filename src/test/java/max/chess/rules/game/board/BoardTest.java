package max.chess.rules.game.board;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoardTest {

    @Test
    public void standardBoardHasThirtyTwoUnmovedPieces() {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // Then
        assertEquals(32, board.count(p -> !p.hasMoved()));
        assertEquals(Piece.of(PieceKind.KING, Colour.WHITE), board.getPiece(Coordinate.of(4, 0)));
        assertEquals(Piece.of(PieceKind.QUEEN, Colour.BLACK), board.getPiece(Coordinate.of(3, 7)));
        assertEquals(Coordinate.of(4, 7), board.getKingCoordinate(Colour.BLACK));
        for(int i = 0; i < 64; i++) {
            assertEquals(Coordinate.of(i), board.getSquare(i).coordinate());
        }
    }

    @Test
    public void relocationMarksThePieceAsMoved() {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // When
        board.relocate(Coordinate.of(6, 0), Coordinate.of(5, 2));

        // Then
        assertNull(board.getPiece(Coordinate.of(6, 0)));
        assertTrue(board.getPiece(Coordinate.of(5, 2)).hasMoved());
    }

    @Test
    public void copyIsIndependent() {
        // Given
        Board board = BoardGenerator.newStandardBoard();
        Board copy = new Board(board);

        // When
        copy.clear(Coordinate.of(0, 0));

        // Then
        assertNotEquals(board, copy);
        assertFalse(board.isEmpty(Coordinate.of(0, 0)));
    }

    @Test
    public void missingKingIsAnInvariantViolation() {
        Board board = BoardGenerator.newEmptyBoard();
        assertThrows(IllegalStateException.class, () -> board.getKingCoordinate(Colour.WHITE));
    }

    @Test
    public void promotionToPawnOrKingIsRejected() {
        Board board = BoardGenerator.newEmptyBoard();
        board.setPiece(Coordinate.of(0, 6), Piece.of(PieceKind.PAWN, Colour.WHITE));
        assertThrows(IllegalArgumentException.class,
                () -> board.promote(Coordinate.of(0, 6), Coordinate.of(0, 7), PieceKind.KING));
    }

    @Test
    public void performedMoveText() {
        assertEquals("e2e4", new PerformedMove(Coordinate.of(4, 1), Coordinate.of(4, 3)).toText());
    }

    @Test
    public void asciiDiagramStartsWithRankEight() {
        String diagram = BoardGenerator.newStandardBoard().toString();
        assertTrue(diagram.startsWith("8  r n b q k b n r"));
        assertTrue(diagram.contains("1  R N B Q K B N R"));
    }
}
