package max.chess.rules.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Coordinate;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.utils.DestinationUtils;
import max.chess.rules.movegen.utils.MovementTables;

// Rook, bishop and queen
public final class SlidingPiece {
    public static IntSet getPseudoLegalDestinations(Board board, Coordinate source, Piece slider) {
        if(!slider.kind().isSliding()) {
            throw new IllegalStateException(slider.kind() + " is not a sliding piece");
        }
        return DestinationUtils.slide(board, source, slider.colour(), MovementTables.getOffsets(slider.kind()));
    }

    private SlidingPiece() {
    }
}
