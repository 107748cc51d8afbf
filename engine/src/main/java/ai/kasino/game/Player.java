package ai.kasino.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A seat at the Casino table: identity, the private hand and the public capture pile.
 * <p>
 * The capture pile is kept in deposit order; its last card is the top card, the only one an
 * opponent may steal into a build. Instances are immutable; use {@link #withHand(List)} and
 * {@link #withCapturePile(List)} to derive updated players.
 */
public final class Player {
    private final String id;
    private final String displayName;
    private final List<Card> hand;
    private final List<Card> capturePile;

    public Player(String id, String displayName) {
        this(id, displayName, List.of(), List.of());
    }

    public Player(String id, String displayName, List<Card> hand, List<Card> capturePile) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.hand = List.copyOf(hand);
        this.capturePile = List.copyOf(capturePile);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<Card> getHand() {
        return hand;
    }

    public List<Card> getCapturePile() {
        return capturePile;
    }

    public Player withHand(List<Card> newHand) {
        return new Player(id, displayName, newHand, capturePile);
    }

    public Player withCapturePile(List<Card> newPile) {
        return new Player(id, displayName, hand, newPile);
    }

    /**
     * Returns a copy without the given card in hand (matched by id).
     */
    public Player withoutHandCard(Card card) {
        List<Card> newHand = new ArrayList<>(hand);
        newHand.removeIf(c -> c.getId().equals(card.getId()));
        return withHand(newHand);
    }

    /**
     * Returns a copy with the cards appended to the capture pile, the last one on top.
     */
    public Player withCaptured(List<Card> cards) {
        List<Card> newPile = new ArrayList<>(capturePile);
        newPile.addAll(cards);
        return withCapturePile(newPile);
    }

    /** Top card of the capture pile, the one opponents may steal. */
    public Optional<Card> topCaptureCard() {
        return capturePile.isEmpty() ? Optional.empty() : Optional.of(capturePile.get(capturePile.size() - 1));
    }

    public boolean holds(Card card) {
        return hand.contains(card);
    }

    public int capturedCardCount() {
        return capturePile.size();
    }

    public int spadesCount() {
        return (int) capturePile.stream().filter(Card::isSpade).count();
    }

    /**
     * Spades bonus: five captured spades score 1, six or more score 2.
     */
    public int spadesScore() {
        int spades = spadesCount();
        if (spades >= 6) {
            return 2;
        }
        return spades >= 5 ? 1 : 0;
    }

    public boolean hasSpyTwo() {
        return capturePile.stream().anyMatch(Card::isSpyTwo);
    }

    public boolean hasBigTen() {
        return capturePile.stream().anyMatch(Card::isBigTen);
    }

    public int aceCount() {
        return (int) capturePile.stream().filter(Card::isAce).count();
    }

    @Override
    public String toString() {
        return displayName + "(" + id + ", hand=" + hand.size() + ", captured=" + capturePile.size() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Player)) {
            return false;
        }
        Player other = (Player) o;
        return id.equals(other.id)
                && displayName.equals(other.displayName)
                && hand.equals(other.hand)
                && capturePile.equals(other.capturePile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, hand, capturePile);
    }
}
