package max.chess.rules.player;

import max.chess.rules.common.Colour;
import max.chess.rules.game.GameState;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;

import java.util.List;
import java.util.Random;

// Uniform choice among the legal moves, no evaluation
public class RandomPlayer extends MirroredPlayer {
    private final Random random;

    public RandomPlayer(Colour colour, GameState live, Random random) {
        super(colour, live);
        this.random = random;
    }

    @Override
    protected Move chooseMove(GameState mirror) {
        List<Move> moves = MoveGenerator.generateMoves(mirror, colour());
        if(moves.isEmpty()) {
            return null;
        }
        return moves.get(random.nextInt(moves.size()));
    }
}
