package ai.kasino.engine;

import ai.kasino.game.Build;
import ai.kasino.game.Card;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One way of capturing with a hand card: the matching singles, the matching builds and a set of
 * non-overlapping combinations, all taken together.
 * <p>
 * Options are produced by {@link KasinoEngine#findCaptures} and are only valid against the state
 * they were computed from.
 */
public final class CaptureOption {
    private final Card handCard;
    private final List<Card> singles;
    private final List<Build> builds;
    private final List<List<Card>> combinations;
    private final List<Card> opponentPileCards;

    public CaptureOption(
            Card handCard,
            List<Card> singles,
            List<Build> builds,
            List<List<Card>> combinations,
            List<Card> opponentPileCards) {
        this.handCard = Objects.requireNonNull(handCard, "handCard");
        this.singles = List.copyOf(singles);
        this.builds = List.copyOf(builds);
        List<List<Card>> combos = new ArrayList<>(combinations.size());
        for (List<Card> combo : combinations) {
            combos.add(List.copyOf(combo));
        }
        this.combinations = Collections.unmodifiableList(combos);
        this.opponentPileCards = List.copyOf(opponentPileCards);
    }

    public Card getHandCard() {
        return handCard;
    }

    public List<Card> getSingles() {
        return singles;
    }

    public List<Build> getBuilds() {
        return builds;
    }

    public List<List<Card>> getCombinations() {
        return combinations;
    }

    /** Top cards taken from opponents' capture piles. Always empty for a plain capture. */
    public List<Card> getOpponentPileCards() {
        return opponentPileCards;
    }

    /**
     * Number of captured cards, not counting the hand card.
     */
    public int totalCaptured() {
        int count = singles.size() + opponentPileCards.size();
        for (Build build : builds) {
            count += build.cardCount();
        }
        for (List<Card> combo : combinations) {
            count += combo.size();
        }
        return count;
    }

    /**
     * All captured cards in pile order: singles, build cards group by group, combinations,
     * stolen cards. The hand card is not included.
     */
    public List<Card> allCapturedCards() {
        List<Card> all = new ArrayList<>(singles);
        for (Build build : builds) {
            all.addAll(build.allCards());
        }
        for (List<Card> combo : combinations) {
            all.addAll(combo);
        }
        all.addAll(opponentPileCards);
        return all;
    }

    /**
     * Human-readable summary, e.g. {@code 7♠ & build(s) of 7 & 3♥+4♣}.
     */
    public String description() {
        List<String> parts = new ArrayList<>();
        if (!singles.isEmpty()) {
            parts.add(singles.stream().map(Card::shortName).collect(Collectors.joining(", ")));
        }
        if (!builds.isEmpty()) {
            parts.add("build(s) of " + builds.get(0).getCaptureValue());
        }
        for (List<Card> combo : combinations) {
            parts.add(combo.stream().map(Card::shortName).collect(Collectors.joining("+")));
        }
        if (!opponentPileCards.isEmpty()) {
            parts.add("stole " + opponentPileCards.stream().map(Card::shortName).collect(Collectors.joining(", ")));
        }
        return String.join(" & ", parts);
    }

    @Override
    public String toString() {
        return "capture with " + handCard.shortName() + ": " + description();
    }
}
