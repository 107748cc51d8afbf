package ai.kasino.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Splits value-bearing items into groups that each sum exactly to a target.
 * <p>
 * The number of groups is fixed at {@code total / target}, which is the fewest possible. The
 * search rejects early when the total is not a multiple of the target or when a single item
 * exceeds it, then backtracks over the items in descending value order. At each step a group
 * whose running sum equals a sum already tried for that item is skipped, since placing the
 * item there would explore an identical sub-tree.
 * <p>
 * This is an existence search: the first complete assignment is returned.
 */
public final class ExactPartition {
    private ExactPartition() {
    }

    /**
     * Partitions the items into groups summing to {@code target}.
     *
     * @param items the items to place; not modified. An empty list partitions into no groups.
     * @param value maps an item to its (positive) value
     * @param target the sum every group must reach
     * @param <T> item type
     * @return the groups, or empty if no exact partition exists
     */
    public static <T> Optional<List<List<T>>> partition(List<T> items, ToIntFunction<? super T> value, int target) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(value, "value");
        if (items.isEmpty()) {
            return Optional.of(List.of());
        }
        if (target <= 0) {
            return Optional.empty();
        }
        int total = 0;
        for (T item : items) {
            int v = value.applyAsInt(item);
            if (v <= 0 || v > target) {
                return Optional.empty();
            }
            total += v;
        }
        if (total % target != 0) {
            return Optional.empty();
        }

        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt((T t) -> value.applyAsInt(t)).reversed());

        int groupCount = total / target;
        List<List<T>> groups = new ArrayList<>(groupCount);
        for (int i = 0; i < groupCount; i++) {
            groups.add(new ArrayList<>());
        }
        int[] sums = new int[groupCount];
        if (!place(sorted, value, target, 0, groups, sums)) {
            return Optional.empty();
        }
        List<List<T>> result = new ArrayList<>(groupCount);
        for (List<T> group : groups) {
            result.add(List.copyOf(group));
        }
        return Optional.of(List.copyOf(result));
    }

    /**
     * Whether an exact partition exists.
     */
    public static <T> boolean isPartitionable(List<T> items, ToIntFunction<? super T> value, int target) {
        return partition(items, value, target).isPresent();
    }

    private static <T> boolean place(
            List<T> sorted,
            ToIntFunction<? super T> value,
            int target,
            int index,
            List<List<T>> groups,
            int[] sums) {
        if (index == sorted.size()) {
            return true;
        }
        T item = sorted.get(index);
        int v = value.applyAsInt(item);
        Set<Integer> tried = new HashSet<>();
        for (int g = 0; g < groups.size(); g++) {
            if (sums[g] + v > target || !tried.add(sums[g])) {
                continue;
            }
            groups.get(g).add(item);
            sums[g] += v;
            if (place(sorted, value, target, index + 1, groups, sums)) {
                return true;
            }
            groups.get(g).remove(groups.get(g).size() - 1);
            sums[g] -= v;
        }
        return false;
    }
}
