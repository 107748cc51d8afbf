package ai.kasino.game;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One executed move, kept for display and replay.
 *
 * @param playerId the acting player
 * @param type what kind of move it was
 * @param cardPlayed the hand card played, or the first table card for a table-only build
 * @param cardsCaptured captured cards for a capture, stolen cards for a steal, otherwise empty
 * @param description human-readable summary
 * @param timestamp when the engine applied the move
 */
public record GameAction(
        String playerId,
        ActionType type,
        Card cardPlayed,
        List<Card> cardsCaptured,
        String description,
        Instant timestamp) {

    public GameAction {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cardPlayed, "cardPlayed");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(timestamp, "timestamp");
        cardsCaptured = cardsCaptured == null ? List.of() : List.copyOf(cardsCaptured);
    }
}
