package max.chess.rules.movegen.utils;

import max.chess.rules.common.Colour;
import max.chess.rules.game.GameState;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static max.chess.rules.game.GameFixtures.from;
import static max.chess.rules.game.GameFixtures.sq;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CheckUtilsTest {

    private static Set<String> legalDestinations(GameState game, String square) {
        return game.getMoves(sq(square), true).stream()
                .map(m -> m.destination().toText())
                .collect(Collectors.toSet());
    }

    @Test
    public void rookOnTheSameFileGivesCheck() {
        // Given
        GameState game = from(Colour.WHITE,
                "....r..k",
                "........",
                "........",
                "........",
                "........",
                "........",
                "........",
                "....K...");

        // Then
        assertTrue(CheckUtils.isInCheck(game.board(), Colour.WHITE));
        assertFalse(CheckUtils.isInCheck(game.board(), Colour.BLACK));
    }

    @Test
    public void blockedLineGivesNoCheck() {
        GameState game = from(Colour.WHITE,
                "....r..k",
                "........",
                "........",
                "....p...",
                "........",
                "........",
                "........",
                "....K...");
        assertFalse(game.isInCheck(Colour.WHITE));
    }

    @Test
    public void pinnedRookOnlyMovesAlongThePin() {
        // Given
        GameState game = from(Colour.WHITE,
                "....r..k",
                "........",
                "........",
                "........",
                "........",
                "........",
                "....R...",
                "....K...");

        // When
        Set<String> destinations = legalDestinations(game, "e2");

        // Then
        assertEquals(Set.of("e3", "e4", "e5", "e6", "e7", "e8"), destinations);
    }

    @Test
    public void pinnedKnightCannotMove() {
        GameState game = from(Colour.WHITE,
                "....r..k",
                "........",
                "........",
                "........",
                "........",
                "........",
                "....N...",
                "....K...");
        assertTrue(game.getMoves(sq("e2"), true).isEmpty());
        assertEquals(6, game.getMoves(sq("e2"), false).size());
    }

    @Test
    public void kingDoesNotStepIntoAttack() {
        // Given
        GameState game = from(Colour.WHITE,
                "...r...k",
                "........",
                "........",
                "........",
                "........",
                "........",
                "........",
                "....K...");

        // Then
        assertEquals(Set.of("e2", "f1", "f2"), legalDestinations(game, "e1"));
    }

    @Test
    public void wouldKingBeInCheckLeavesTheGameUntouched() {
        // Given
        GameState game = from(Colour.WHITE,
                "....r..k",
                "........",
                "........",
                "........",
                "........",
                "........",
                "....N...",
                "....K...");
        GameState before = game.copy();

        // When
        boolean exposed = CheckUtils.wouldKingBeInCheck(game, sq("e2"), sq("c3"), Colour.WHITE);

        // Then
        assertTrue(exposed);
        assertEquals(before, game);
    }

    @Test
    public void missingKingIsAnInvariantViolation() {
        GameState game = GameState.empty();
        assertThrows(IllegalStateException.class, () -> game.isInCheck(Colour.WHITE));
    }
}
