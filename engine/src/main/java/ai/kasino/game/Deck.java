package ai.kasino.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * The 40-card South African Casino deck: Ace to 10 in each of the four suits.
 * <p>
 * Ids are assigned in a fixed order ({@code card_0} is the Ace of spades, {@code card_39} the
 * 10 of clubs), so the same id always names the same card across deals, logs and replays.
 */
public final class Deck {
    /** Number of cards in the deck. */
    public static final int SIZE = 40;

    private static final List<Card> STANDARD = createStandard();

    private Deck() {
    }

    /**
     * Returns the unshuffled deck in id order.
     *
     * @return an unmodifiable list of all 40 cards
     */
    public static List<Card> standard() {
        return STANDARD;
    }

    /**
     * Returns a freshly shuffled copy of the deck.
     *
     * @param random source of randomness; must not be null
     * @return a new mutable list holding all 40 cards in random order
     */
    public static List<Card> shuffled(Random random) {
        Objects.requireNonNull(random, "random");
        List<Card> cards = new ArrayList<>(STANDARD);
        Collections.shuffle(cards, random);
        return cards;
    }

    /**
     * Looks up the card with the given rank and suit.
     *
     * @param rank 1..10
     * @param suit the suit
     * @return the deck's card
     * @throws IllegalArgumentException if the rank is outside 1..10
     */
    public static Card card(int rank, Suit suit) {
        if (rank < Card.MIN_RANK || rank > Card.MAX_RANK) {
            throw new IllegalArgumentException("Rank out of range: " + rank);
        }
        return STANDARD.get(suit.ordinal() * Card.MAX_RANK + rank - 1);
    }

    /**
     * Parses a typed card name such as "7♠", "10d" or "AS" into the deck's card.
     *
     * @param name the card name
     * @return the deck's card
     * @throws IllegalArgumentException if the name does not designate a card
     */
    public static Card parse(String name) {
        if (name == null || name.trim().length() < 2) {
            throw new IllegalArgumentException("Not a card: " + name);
        }
        String trimmed = name.trim();
        Suit suit = Suit.fromCode(trimmed.substring(trimmed.length() - 1));
        String rankText = trimmed.substring(0, trimmed.length() - 1);
        if (suit == null) {
            throw new IllegalArgumentException("Unknown suit in card: " + name);
        }
        int rank;
        if (rankText.equalsIgnoreCase("A")) {
            rank = 1;
        } else {
            try {
                rank = Integer.parseInt(rankText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Unknown rank in card: " + name, e);
            }
        }
        return card(rank, suit);
    }

    private static List<Card> createStandard() {
        List<Card> cards = new ArrayList<>(SIZE);
        int index = 0;
        for (Suit suit : Suit.values()) {
            for (int rank = Card.MIN_RANK; rank <= Card.MAX_RANK; rank++) {
                cards.add(new Card(rank, suit, "card_" + index++));
            }
        }
        return Collections.unmodifiableList(cards);
    }
}
