package ai.kasino.game;

import java.util.Objects;

/**
 * A single card of the 40-card Casino deck (Ace through 10, no picture cards).
 * <p>
 * Cards are immutable and identified by their {@link #getId() id}: every set-membership and
 * removal operation in the engine is keyed on the id, never on position. Within one deck the
 * id determines rank and suit (see {@link Deck}).
 */
public final class Card {
    /** Lowest rank (Ace). */
    public static final int MIN_RANK = 1;
    /** Highest rank; builds can never be declared above this value. */
    public static final int MAX_RANK = 10;

    /** Rank 1 (Ace) through 10. */
    private final int rank;
    /** The suit of this card. */
    private final Suit suit;
    /** Unique id, e.g. {@code card_17}. */
    private final String id;

    /**
     * Constructs a card.
     *
     * @param rank the rank, 1 (Ace) to 10
     * @param suit the suit; must not be null
     * @param id the unique id; must not be null
     * @throws IllegalArgumentException if the rank is outside 1..10
     */
    public Card(int rank, Suit suit, String id) {
        if (rank < MIN_RANK || rank > MAX_RANK) {
            throw new IllegalArgumentException("Rank out of range: " + rank);
        }
        this.rank = rank;
        this.suit = Objects.requireNonNull(suit, "suit");
        this.id = Objects.requireNonNull(id, "id");
    }

    public int getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the value used for captures and builds. An Ace counts as 1.
     *
     * @return the capture value (equal to the rank)
     */
    public int captureValue() {
        return rank;
    }

    /** The spy two (2♠) is worth one point to whoever captures it. */
    public boolean isSpyTwo() {
        return rank == 2 && suit == Suit.SPADES;
    }

    /** The big ten (10♦) is worth two points to whoever captures it. */
    public boolean isBigTen() {
        return rank == 10 && suit == Suit.DIAMONDS;
    }

    public boolean isAce() {
        return rank == 1;
    }

    public boolean isSpade() {
        return suit == Suit.SPADES;
    }

    /**
     * Returns the display label of the rank: "A" for the Ace, the number otherwise.
     *
     * @return the rank label
     */
    public String label() {
        return rank == 1 ? "A" : Integer.toString(rank);
    }

    /**
     * Returns the short name of this card, e.g. "A♠" or "10♦".
     *
     * @return the short name
     */
    public String shortName() {
        return label() + suit.getSymbol();
    }

    /**
     * Checks whether this card matches a typed name, accepting the suit symbol or its letter
     * ("10♦", "10d", "AS"). Comparison ignores case and surrounding whitespace.
     *
     * @param name the name to match
     * @return {@code true} if the name designates this card
     */
    public boolean matchesShortName(String name) {
        if (name == null) {
            return false;
        }
        String trimmed = name.trim();
        if (trimmed.equalsIgnoreCase(shortName())) {
            return true;
        }
        return trimmed.equalsIgnoreCase(label() + suit.getLetter());
    }

    @Override
    public String toString() {
        return shortName();
    }

    /**
     * Two cards are equal when they carry the same id.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return id.equals(card.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
