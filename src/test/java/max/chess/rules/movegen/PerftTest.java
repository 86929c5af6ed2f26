package max.chess.rules.movegen;

import max.chess.rules.game.GameState;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PerftTest {

    private static long perft(GameState game, int depth) {
        List<Move> moves = MoveGenerator.generateMoves(game);
        if(depth == 1) {
            return moves.size();
        }
        long nodes = 0;
        for(Move move : moves) {
            GameState next = game.copy();
            next.playMove(move);
            nodes += perft(next, depth - 1);
        }
        return nodes;
    }

    @ParameterizedTest
    @CsvSource({"1,20", "2,400", "3,8902"})
    public void startingPositionNodeCounts(int depth, long expected) {
        assertEquals(expected, perft(GameState.newGame(), depth));
    }
}
