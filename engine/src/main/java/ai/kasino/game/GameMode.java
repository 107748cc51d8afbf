package ai.kasino.game;

/**
 * How a match was set up. Informational only; the rules are the same in every mode.
 */
public enum GameMode {
    /** Against the computer. */
    SINGLE_PLAYER,
    /** Online against other people. */
    MULTIPLAYER,
    /** No stakes. */
    PRACTICE
}
