package max.chess.rules.utils.notations;

import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.PerformedMove;

import java.util.List;
import java.util.stream.Collectors;

public class MoveIOUtils {

    public static Coordinate getCoordinateFromSquare(String square) {
        if(square == null || square.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1', got " + square);
        }
        char letter = Character.toLowerCase(square.charAt(0));
        char digit = square.charAt(1);
        if(letter < 'a' || letter > 'h') {
            throw new IllegalArgumentException("square letter should be in [a-h], got " + letter);
        }
        if(digit < '1' || digit > '8') {
            throw new IllegalArgumentException("square digit should be in [1-8], got " + digit);
        }
        return Coordinate.of(letter - 97, digit - 49);
    }

    /** Splits {@code e2e4} into its source and destination squares. */
    public static Coordinate[] getCoordinatesFromMoveText(String text) {
        if(text == null || text.length() != 4) {
            throw new IllegalArgumentException("move should be format 'e2e4', got " + text);
        }
        return new Coordinate[]{
                getCoordinateFromSquare(text.substring(0, 2)),
                getCoordinateFromSquare(text.substring(2, 4))
        };
    }

    public static PieceKind getPromotionKindFromLetter(char letter) {
        PieceKind kind = PieceKind.fromLetter(letter);
        if(!kind.isPromotionCandidate()) {
            throw new IllegalArgumentException("Cannot promote to " + kind);
        }
        return kind;
    }

    public static String writeHistory(List<PerformedMove> history) {
        return history.stream().map(PerformedMove::toText).collect(Collectors.joining(" "));
    }
}
