package ai.kasino.player;

import ai.kasino.game.GameState;
import java.util.List;

/**
 * Represents a player capable of providing the next command for the match loop.
 */
public interface Player {

    /**
     * Provide the next command for the seat whose turn it is (e.g. "capture 7♠ 1", "drift 3♥").
     *
     * @param state      current game state; {@link GameState#currentPlayer()} is the seat to move.
     * @param legalMoves the commands the engine accepts for this turn, as listed by
     *                   {@link LegalMovesHelper}.
     * @param feedback   why the previous command was refused, or an empty string.
     * @return raw command string, or null to signal the match should stop.
     */
    String nextCommand(GameState state, List<String> legalMoves, String feedback);
}
