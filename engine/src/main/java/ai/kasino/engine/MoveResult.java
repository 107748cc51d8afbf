package ai.kasino.engine;

import ai.kasino.game.GameState;
import java.util.Objects;

/**
 * Encapsulates the result of a move attempt.
 * <p>
 * On success {@link #state} is the new snapshot. On rejection it is the very input snapshot,
 * unchanged, and {@link #reason} says why, with {@link #message} as user-facing text.
 */
public final class MoveResult {
    /** Whether the move was applied. */
    public final boolean success;

    /** Resulting state; the input state when rejected. */
    public final GameState state;

    /** Why the move was rejected; {@code null} on success. */
    public final RejectionReason reason;

    /** Descriptive message (success summary or rejection details). */
    public final String message;

    private MoveResult(boolean success, GameState state, RejectionReason reason, String message) {
        this.success = success;
        this.state = Objects.requireNonNull(state, "state");
        this.reason = reason;
        this.message = message;
    }

    /**
     * Creates a successful result.
     *
     * @param state the new state
     * @param message summary of what happened
     */
    public static MoveResult success(GameState state, String message) {
        return new MoveResult(true, state, null, message);
    }

    /**
     * Creates a rejection that hands back the unchanged input state.
     *
     * @param unchanged the input state
     * @param reason why the move is illegal
     * @param message details for the player
     */
    public static MoveResult rejected(GameState unchanged, RejectionReason reason, String message) {
        return new MoveResult(false, unchanged, Objects.requireNonNull(reason, "reason"), message);
    }

    @Override
    public String toString() {
        return success ? "MoveResult(success: " + message + ")" : "MoveResult(" + reason + ": " + message + ")";
    }
}
