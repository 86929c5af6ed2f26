package max.chess.rules.player;

import max.chess.rules.common.Colour;
import max.chess.rules.game.GameState;
import max.chess.rules.movegen.Move;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A player keeping its own copy of the game. Moves come in from the coordinator on {@link #inbound()} and go out on
 * {@link #outbound()}; each tick handles at most one incoming move before the player may compute its own.
 */
public abstract class MirroredPlayer implements Player {
    private static final Logger LOGGER = LoggerFactory.getLogger(MirroredPlayer.class);

    private final Colour colour;
    protected final GameState mirror;
    private final Queue<Move> inbound = new ConcurrentLinkedQueue<>();
    private final Queue<Move> outbound = new ConcurrentLinkedQueue<>();

    protected MirroredPlayer(Colour colour, GameState live) {
        this.colour = Objects.requireNonNull(colour);
        this.mirror = live.copy();
    }

    /** Picks the next move on the mirror, or null when there is nothing to play yet. */
    protected abstract Move chooseMove(GameState mirror);

    @Override
    public final boolean tick() {
        Move incoming = inbound.poll();
        if(incoming != null) {
            mirror.playMove(incoming);
            return true;
        }

        if(mirror.getTurn() != colour) {
            return false;
        }

        Move move = chooseMove(mirror);
        if(move == null) {
            return false;
        }
        outbound.offer(move);
        mirror.playMove(move);
        LOGGER.debug("{} player sent {}", colour, move);
        return true;
    }

    @Override
    public Colour colour() {
        return colour;
    }

    public GameState mirror() {
        return mirror;
    }

    Queue<Move> inbound() {
        return inbound;
    }

    Queue<Move> outbound() {
        return outbound;
    }
}
