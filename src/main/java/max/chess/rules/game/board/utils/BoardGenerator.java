package max.chess.rules.game.board.utils;

import max.chess.rules.common.Coordinate;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;

public class BoardGenerator {
    // Rank 1 first, file a first
    private static final String[] STANDARD_LAYOUT = {
            "RNBQKBNR",
            "PPPPPPPP",
            "........",
            "........",
            "........",
            "........",
            "pppppppp",
            "rnbqkbnr"
    };

    public static Board newStandardBoard() {
        Board board = new Board();
        for(int rank = 0; rank < 8; rank++) {
            String row = STANDARD_LAYOUT[rank];
            for(int file = 0; file < 8; file++) {
                char letter = row.charAt(file);
                if(letter != '.') {
                    board.setPiece(Coordinate.of(file, rank), Piece.fromLetter(letter));
                }
            }
        }
        return board;
    }

    public static Board newEmptyBoard() {
        return new Board();
    }
}
