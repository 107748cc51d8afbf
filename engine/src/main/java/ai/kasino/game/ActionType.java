package ai.kasino.game;

/**
 * Kinds of moves recorded in the {@link ActionLog}.
 */
public enum ActionType {
    CAPTURE,
    BUILD_CREATE,
    BUILD_AUGMENT,
    BUILD_INCREASE,
    DRIFT,
    /** A build that took the top card of an opponent's capture pile. */
    STEAL_AND_BUILD
}
