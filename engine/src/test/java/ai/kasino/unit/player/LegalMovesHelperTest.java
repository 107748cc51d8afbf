package ai.kasino.unit.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.engine.KasinoEngine;
import ai.kasino.engine.MoveResult;
import ai.kasino.game.GamePhase;
import ai.kasino.game.GameState;
import ai.kasino.player.LegalMovesHelper;
import ai.kasino.player.MoveCommand;
import ai.kasino.unit.helpers.GameStateBuilder;
import ai.kasino.unit.helpers.GameStateTestHelper;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Legal command listing.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>listsCapturesBuildsAndDrifts</b> - exact command set for a small position</li>
 *   <li><b>everyListedCommandApplies</b> - listing and applying agree</li>
 *   <li><b>buildOwnerGetsAugmentsButNoDrift</b> - drift is blocked while owning a build</li>
 *   <li><b>opponentBuildCanBeIncreased</b> - increase appears with its build number</li>
 *   <li><b>nothingListedOutsidePlay</b> - scoring phase has no commands</li>
 * </ul>
 */
class LegalMovesHelperTest {

    private final KasinoEngine engine = new KasinoEngine();

    @Test
    void listsCapturesBuildsAndDrifts() {
        GameState state = GameStateBuilder.twoPlayers()
                .hand("p1", "7♠", "3♠")
                .table("3♥", "4♣", "4♦")
                .build();

        List<String> moves = LegalMovesHelper.listLegalMoves(engine, state);

        Set<String> expected = Set.of(
                "capture 7♠ 1",
                "capture 7♠ 2",
                "capture 3♠ 1",
                "build 7 3♠ 4♣",
                "build 7 3♠ 4♦",
                "drift 7♠",
                "drift 3♠");
        assertEquals(expected, Set.copyOf(moves));
        assertEquals(expected.size(), moves.size());
    }

    @Test
    void everyListedCommandApplies() {
        GameState state = GameStateBuilder.twoPlayers()
                .hand("p1", "7♠", "3♠", "8♣", "5♥")
                .table("3♥", "4♣", "4♦", "5♦")
                .pile("p2", "2♣")
                .build("p2", 5, "3♦ 2♥")
                .build();

        List<String> moves = LegalMovesHelper.listLegalMoves(engine, state);
        assertFalse(moves.isEmpty());

        for (String move : moves) {
            MoveResult result = MoveCommand.parse(move).apply(engine, state);
            assertTrue(result.success, move + " -> " + result);
            GameStateTestHelper.assertFullDeck(result.state);
            GameStateTestHelper.assertBuildsConsistent(result.state);
        }
    }

    @Test
    void buildOwnerGetsAugmentsButNoDrift() {
        GameState state = GameStateBuilder.twoPlayers()
                .hand("p1", "8♥", "8♣")
                .build("p1", 8, "5♠ 3♦")
                .build();

        List<String> moves = LegalMovesHelper.listLegalMoves(engine, state);

        assertTrue(moves.contains("augment B1 8♥"));
        assertTrue(moves.contains("augment B1 8♣"));
        assertTrue(moves.contains("capture 8♥ 1"));
        assertTrue(moves.stream().noneMatch(m -> m.startsWith("drift")));
    }

    @Test
    void opponentBuildCanBeIncreased() {
        GameState state = GameStateBuilder.twoPlayers()
                .hand("p1", "3♠", "8♣")
                .table("9♥")
                .build("p2", 5, "3♦ 2♥")
                .build();

        List<String> moves = LegalMovesHelper.listLegalMoves(engine, state);

        assertTrue(moves.contains("increase B1 3♠"));
        assertFalse(moves.contains("increase B1 8♣"));
    }

    @Test
    void nothingListedOutsidePlay() {
        GameState state = GameStateBuilder.twoPlayers()
                .hand("p1", "3♠")
                .phase(GamePhase.SCORING)
                .build();

        assertTrue(LegalMovesHelper.listLegalMoves(engine, state).isEmpty());
    }
}
