package ai.kasino.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Chooses among overlapping groups of items.
 * <p>
 * Given candidate groups that may share items, {@link #maximalSelections(List)} searches every
 * combination of pairwise-disjoint groups and keeps those covering the largest number of
 * items. Item identity is {@link Object#equals(Object)}.
 */
public final class DisjointSelection {
    private DisjointSelection() {
    }

    /**
     * Returns every selection of pairwise-disjoint groups whose total item count is maximal.
     * <p>
     * A single group is returned as the only selection. Groups keep their input order inside
     * each selection.
     *
     * @param groups candidate groups; not modified
     * @param <T> item type
     * @return the maximal selections; empty only when {@code groups} is empty
     */
    public static <T> List<List<List<T>>> maximalSelections(List<List<T>> groups) {
        Objects.requireNonNull(groups, "groups");
        if (groups.isEmpty()) {
            return Collections.emptyList();
        }
        if (groups.size() == 1) {
            return List.of(List.of(groups.get(0)));
        }
        Search<T> search = new Search<>(groups);
        search.run(0, new ArrayList<>(), new HashSet<>(), 0);
        return search.best;
    }

    /** Whether two groups share at least one item. */
    public static <T> boolean overlaps(List<T> a, List<T> b) {
        Set<T> seen = new HashSet<>(a);
        for (T item : b) {
            if (seen.contains(item)) {
                return true;
            }
        }
        return false;
    }

    private static final class Search<T> {
        private final List<List<T>> groups;
        private final List<List<List<T>>> best = new ArrayList<>();
        private int bestCount;

        private Search(List<List<T>> groups) {
            this.groups = groups;
        }

        private void run(int index, List<List<T>> chosen, Set<T> used, int count) {
            if (!chosen.isEmpty()) {
                if (count > bestCount) {
                    bestCount = count;
                    best.clear();
                    best.add(List.copyOf(chosen));
                } else if (count == bestCount) {
                    best.add(List.copyOf(chosen));
                }
            }
            for (int i = index; i < groups.size(); i++) {
                List<T> group = groups.get(i);
                if (!Collections.disjoint(used, group)) {
                    continue;
                }
                chosen.add(group);
                used.addAll(group);
                run(i + 1, chosen, used, count + group.size());
                used.removeAll(group);
                chosen.remove(chosen.size() - 1);
            }
        }
    }
}
