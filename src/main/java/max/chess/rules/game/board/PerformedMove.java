package max.chess.rules.game.board;

import max.chess.rules.common.Coordinate;

public record PerformedMove(Coordinate source, Coordinate destination) {

    /** Source then destination coordinate text, e.g. {@code e2e4}. */
    public String toText() {
        return source.toText() + destination.toText();
    }

    @Override
    public String toString() {
        return toText();
    }
}
