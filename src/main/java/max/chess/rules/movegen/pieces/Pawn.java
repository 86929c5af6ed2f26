package max.chess.rules.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;

public final class Pawn {

    public static IntSet getPseudoLegalDestinations(Board board, Coordinate source, Piece pawn) {
        IntSet destinations = new IntLinkedOpenHashSet(4);
        int forward = pawn.colour().forward();

        Coordinate oneUp = source.offset(0, forward);
        if(oneUp == null) {
            return destinations;
        }

        // a blocked first square also blocks the double push
        if(board.isEmpty(oneUp)) {
            destinations.add(oneUp.flatIndex);
            if(!pawn.hasMoved()) {
                Coordinate twoUp = source.offset(0, 2 * forward);
                if(twoUp != null && board.isEmpty(twoUp)) {
                    destinations.add(twoUp.flatIndex);
                }
            }
        }

        for(int side = -1; side <= 1; side += 2) {
            Coordinate diagonal = source.offset(side, forward);
            if(diagonal == null) {
                continue;
            }
            Piece target = board.getPiece(diagonal);
            if(target != null) {
                if(target.isEnemyOf(pawn.colour())) {
                    destinations.add(diagonal.flatIndex);
                }
            } else if(isEnPassantCapture(board, source, diagonal, pawn.colour())) {
                destinations.add(diagonal.flatIndex);
            }
        }

        return destinations;
    }

    /**
     * True when {@code destination} is an empty forward diagonal of {@code source} and the square beside the pawn, on
     * the destination file, holds an enemy pawn flagged en-passant-eligible.
     */
    public static boolean isEnPassantCapture(Board board, Coordinate source, Coordinate destination, Colour colour) {
        if(Math.abs(destination.x - source.x) != 1 || destination.y - source.y != colour.forward()) {
            return false;
        }
        if(!board.isEmpty(destination)) {
            return false;
        }
        Piece passed = board.getPiece(Coordinate.of(destination.x, source.y));
        return passed != null
                && passed.kind() == PieceKind.PAWN
                && passed.isEnemyOf(colour)
                && passed.enPassantEligible();
    }

    public static boolean isDoublePush(Coordinate source, Coordinate destination, Piece pawn) {
        return !pawn.hasMoved() && source.x == destination.x && Math.abs(destination.y - source.y) == 2;
    }

    public static boolean isPromotion(Coordinate destination, Piece pawn) {
        return destination.y == pawn.colour().promotionRank();
    }

    private Pawn() {
    }
}
