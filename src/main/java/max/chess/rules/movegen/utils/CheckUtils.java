package max.chess.rules.movegen.utils;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.game.GameState;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.MoveGenerator;

public final class CheckUtils {

    /**
     * Recomputed from scratch: every enemy piece's pseudo-legal destinations are tested against the king square.
     * Legality filtering is never used here, otherwise check detection would recurse.
     */
    public static boolean isInCheck(Board board, Colour kingColour) {
        int kingIndex = board.getKingCoordinate(kingColour).flatIndex;
        for(int i = 0; i < 64; i++) {
            Piece piece = board.getPiece(i);
            if(piece == null || piece.colour() == kingColour) {
                continue;
            }
            if(MoveGenerator.getPseudoLegalDestinations(board, Coordinate.of(i)).contains(kingIndex)) {
                return true;
            }
        }
        return false;
    }

    // Plays the plain relocation on a copy of the whole game, the live game is left untouched
    public static boolean wouldKingBeInCheck(GameState game, Coordinate source, Coordinate destination, Colour kingColour) {
        GameState scratch = game.copy();
        scratch.board().relocate(source, destination);
        return isInCheck(scratch.board(), kingColour);
    }

    private CheckUtils() {
    }
}
