package ai.kasino.game;

/**
 * Phases of a Casino hand.
 * <p>
 * {@code DEALING → PLAYING → (PLAYING_SECOND, two players only) → SCORING → GAME_OVER}.
 * {@code SECOND_DEAL} names the transient re-deal between the two halves of a two-player hand.
 */
public enum GamePhase {
    DEALING,
    PLAYING,
    SECOND_DEAL,
    /** Two players, second ten cards each; drifting is always allowed. */
    PLAYING_SECOND,
    /** The hand is over and awaits {@code applyScores}. */
    SCORING,
    /** A player reached the target score. */
    GAME_OVER;

    /** Whether players may act in this phase. */
    public boolean isPlayable() {
        return this == PLAYING || this == PLAYING_SECOND;
    }
}
