package max.chess.rules.player;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.GameState;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;

import java.util.List;

/**
 * Plays whatever the input layer selected through {@link #select(Coordinate, Coordinate)}.
 */
public class HumanPlayer extends MirroredPlayer {
    private volatile Move selectedMove;

    public HumanPlayer(Colour colour, GameState live) {
        super(colour, live);
    }

    /**
     * Validates the move against the mirror. Selecting a square not holding one of this player's pieces, or a
     * target outside the legal moves, is rejected.
     */
    public boolean select(Coordinate source, Coordinate target) {
        if(mirror.getTurn() != colour()) {
            return false;
        }
        Piece piece = mirror.board().getPiece(source);
        if(piece == null || piece.colour() != colour()) {
            return false;
        }

        Move move = MoveGenerator.findMoveTo(mirror.getMoves(source, true), target);
        if(move == null) {
            return false;
        }
        selectedMove = move;
        return true;
    }

    public List<Move> getLegalMoves(Coordinate source) {
        if(mirror.board().isEmpty(source)) {
            return List.of();
        }
        return mirror.getMoves(source, true);
    }

    public void setPromotionKind(PieceKind kind) {
        mirror.setPromotionKind(kind);
    }

    public boolean hasSelection() {
        return selectedMove != null;
    }

    @Override
    protected Move chooseMove(GameState mirror) {
        Move move = selectedMove;
        selectedMove = null;
        return move;
    }
}
