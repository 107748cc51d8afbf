package ai.kasino.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An owned construct on the table: a declared capture value and the card groups backing it.
 * <p>
 * Every group sums exactly to the declared value; a build with more than one group is
 * <em>augmented</em>. The owner must hold a card of the declared value to redeem it later.
 * Builds are immutable; the engine replaces them with modified copies.
 */
public final class Build {
    private final String id;
    private final String ownerId;
    private final int captureValue;
    private final List<List<Card>> cardGroups;

    /**
     * Constructs a build.
     *
     * @param id the build id (see {@link #deriveId(List)})
     * @param ownerId id of the owning player
     * @param captureValue the declared value, 1..10
     * @param cardGroups the groups backing the build; copied defensively
     */
    public Build(String id, String ownerId, int captureValue, List<List<Card>> cardGroups) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.captureValue = captureValue;
        List<List<Card>> copy = new ArrayList<>(cardGroups.size());
        for (List<Card> group : cardGroups) {
            copy.add(List.copyOf(group));
        }
        this.cardGroups = Collections.unmodifiableList(copy);
    }

    /**
     * Derives a build id from the cards it contains: the sorted card ids joined with
     * underscores and prefixed by {@code build_}. The same cards always give the same id,
     * so no counter is needed to identify a build.
     *
     * @param cardGroups the groups of the new build
     * @return the derived id
     */
    public static String deriveId(List<List<Card>> cardGroups) {
        return cardGroups.stream()
                .flatMap(List::stream)
                .map(Card::getId)
                .sorted()
                .collect(Collectors.joining("_", "build_", ""));
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public int getCaptureValue() {
        return captureValue;
    }

    public List<List<Card>> getCardGroups() {
        return cardGroups;
    }

    /**
     * Returns every card of the build, group by group.
     *
     * @return an unmodifiable flattened list
     */
    public List<Card> allCards() {
        List<Card> all = new ArrayList<>();
        for (List<Card> group : cardGroups) {
            all.addAll(group);
        }
        return Collections.unmodifiableList(all);
    }

    public int cardCount() {
        int count = 0;
        for (List<Card> group : cardGroups) {
            count += group.size();
        }
        return count;
    }

    /** Whether the build holds more than one group of its value. */
    public boolean isAugmented() {
        return cardGroups.size() > 1;
    }

    /** Returns a copy with the given groups appended, keeping id, owner and value. */
    public Build withAddedGroups(List<List<Card>> groups) {
        List<List<Card>> merged = new ArrayList<>(cardGroups);
        merged.addAll(groups);
        return new Build(id, ownerId, captureValue, merged);
    }

    /**
     * Display string such as {@code [8: 4♠+4♥ | 8♦]}.
     */
    public String displayString() {
        String groups = cardGroups.stream()
                .map(g -> g.stream().map(Card::shortName).collect(Collectors.joining("+")))
                .collect(Collectors.joining(" | "));
        return "[" + captureValue + ": " + groups + "]";
    }

    @Override
    public String toString() {
        return displayString() + " owned by " + ownerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Build)) {
            return false;
        }
        Build build = (Build) o;
        return captureValue == build.captureValue
                && id.equals(build.id)
                && ownerId.equals(build.ownerId)
                && cardGroups.equals(build.cardGroups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ownerId, captureValue, cardGroups);
    }
}
