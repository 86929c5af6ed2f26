package max.chess.rules.player;

import max.chess.rules.common.Colour;

public interface Player {
    Colour colour();

    /**
     * One non-blocking step of the player's loop.
     *
     * @return whether the player applied or sent a move
     */
    boolean tick();
}
