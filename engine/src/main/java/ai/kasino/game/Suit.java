package ai.kasino.game;

/**
 * Enumeration representing the four suits of the Casino deck.
 * <p>
 * Each suit is represented by a Unicode symbol and a single-letter code so card names can be
 * typed on a plain keyboard ("7S" as well as "7♠"). Spades matter for scoring: five captured
 * spades earn a point, six or more earn two.
 * <p>
 * The declaration order (spades, hearts, diamonds, clubs) is the deck order used to assign
 * card ids, so it must not change.
 */
public enum Suit {
    /** Spades, ♠; counted for the spades bonus and home of the spy two. */
    SPADES("♠", 'S'),
    /** Hearts, ♥. */
    HEARTS("♥", 'H'),
    /** Diamonds, ♦; home of the big ten. */
    DIAMONDS("♦", 'D'),
    /** Clubs, ♣. */
    CLUBS("♣", 'C');

    /** The Unicode symbol representing this suit (e.g., "♣", "♦"). */
    private final String symbol;
    /** ASCII letter accepted in typed card names. */
    private final char letter;

    Suit(String symbol, char letter) {
        this.symbol = symbol;
        this.letter = letter;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦", "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the ASCII letter for this suit.
     *
     * @return one of 'S', 'H', 'D', 'C'
     */
    public char getLetter() {
        return letter;
    }

    /**
     * Resolves a suit from its symbol or letter (case-insensitive).
     *
     * @param text the symbol ("♠") or letter ("s")
     * @return the matching suit, or {@code null} if nothing matches
     */
    public static Suit fromCode(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Suit suit : values()) {
            if (suit.symbol.equals(text) || (text.length() == 1
                    && Character.toUpperCase(text.charAt(0)) == suit.letter)) {
                return suit;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
