package ai.kasino.engine;

/**
 * Why the engine refused a move. Paired with a message in {@link MoveResult}.
 */
public enum RejectionReason {
    /** Playing phase is over (scoring or game over). */
    NOT_PLAYABLE,
    CARD_NOT_IN_HAND,
    CARD_NOT_ON_TABLE,
    /** A stolen card is not among the top cards of an opponent's capture pile. */
    CARD_NOT_STEALABLE,
    /** Stealing needs a card played from hand at the same time. */
    STEAL_WITHOUT_HAND_CARD,
    /** The player must resolve their build of another value first. */
    OWNS_OTHER_BUILD,
    /** No other card of a build's value would remain in hand. */
    NO_CAPTURING_CARD,
    /** The build value is outside 1..10. */
    VALUE_OUT_OF_RANGE,
    NO_CARDS,
    /** The cards cannot be split into groups of the declared value. */
    NO_EXACT_PARTITION,
    UNKNOWN_BUILD,
    NOT_BUILD_OWNER,
    /** Only an opponent's build may be increased. */
    OWN_BUILD,
    /** Augmented builds cannot be increased. */
    BUILD_AUGMENTED,
    /** A player who owns a build may not drift outside the second deal. */
    DRIFT_BLOCKED,
    /** The card captures nothing, or the chosen capture option does not exist. */
    NO_CAPTURE
}
