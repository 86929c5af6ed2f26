package max.chess.rules.game;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.utils.notations.MoveIOUtils;

public final class GameFixtures {

    /**
     * Builds a game from 8 rows, rank 8 first, uppercase White, lowercase Black, '.' for empty.
     * Pawns away from their starting rank are marked as moved, every other piece is unmoved.
     */
    public static GameState from(Colour toMove, String... rows) {
        if(rows.length != 8) {
            throw new IllegalArgumentException("Expected 8 rows, got " + rows.length);
        }
        GameState game = GameState.empty().setTurn(toMove);
        for(int row = 0; row < 8; row++) {
            int rank = 7 - row;
            for(int file = 0; file < 8; file++) {
                char letter = rows[row].charAt(file);
                if(letter == '.') {
                    continue;
                }
                Piece piece = Piece.fromLetter(letter);
                if(piece.kind() == PieceKind.PAWN && rank != (piece.colour() == Colour.WHITE ? 1 : 6)) {
                    piece = piece.moved();
                }
                game.board().setPiece(Coordinate.of(file, rank), piece);
            }
        }
        return game;
    }

    public static Coordinate sq(String square) {
        return MoveIOUtils.getCoordinateFromSquare(square);
    }

    // Finds the legal move for "e2e4" and plays it, completing the turn
    public static Move play(GameState game, String text) {
        Coordinate[] squares = MoveIOUtils.getCoordinatesFromMoveText(text);
        Move move = MoveGenerator.findMoveTo(game.getMoves(squares[0], true), squares[1]);
        if(move == null) {
            throw new IllegalStateException(text + " is not legal in\n" + game);
        }
        game.playMove(move);
        return move;
    }

    private GameFixtures() {
    }
}
