package ai.kasino.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Enumerates every subset of value-bearing items that sums to a target.
 * <p>
 * Items are sorted by descending value and a suffix-sum table bounds the search: a branch is
 * abandoned as soon as all remaining items together fall short of the remaining target, and
 * an item larger than the remaining target is skipped. Values must be positive.
 * <p>
 * Subsets are reported with their items in descending value order. Items with equal values are
 * distinct, so two different cards of the same rank yield two different subsets.
 */
public final class SubsetSums {
    private SubsetSums() {
    }

    /**
     * Finds all subsets with at least {@code minSize} items whose values sum to {@code target}.
     *
     * @param items the candidate items; not modified
     * @param value maps an item to its (positive) value
     * @param target the required sum
     * @param minSize smallest subset size to report (1 reports singletons too)
     * @param <T> item type
     * @return the matching subsets; empty if there are none or the target is not positive
     */
    public static <T> List<List<T>> findAll(List<T> items, ToIntFunction<? super T> value, int target, int minSize) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(value, "value");
        if (items.isEmpty() || target <= 0) {
            return Collections.emptyList();
        }
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt((T t) -> value.applyAsInt(t)).reversed());

        int n = sorted.size();
        int[] values = new int[n];
        int[] suffixSum = new int[n + 1];
        for (int i = n - 1; i >= 0; i--) {
            values[i] = value.applyAsInt(sorted.get(i));
            if (values[i] <= 0) {
                throw new IllegalArgumentException("Item values must be positive: " + sorted.get(i));
            }
            suffixSum[i] = suffixSum[i + 1] + values[i];
        }

        List<List<T>> results = new ArrayList<>();
        search(sorted, values, suffixSum, target, 0, new ArrayList<>(), results);
        if (minSize <= 1) {
            return results;
        }
        List<List<T>> filtered = new ArrayList<>();
        for (List<T> subset : results) {
            if (subset.size() >= minSize) {
                filtered.add(subset);
            }
        }
        return filtered;
    }

    private static <T> void search(
            List<T> sorted,
            int[] values,
            int[] suffixSum,
            int remaining,
            int start,
            List<T> current,
            List<List<T>> results) {
        if (remaining == 0) {
            if (!current.isEmpty()) {
                results.add(List.copyOf(current));
            }
            return;
        }
        if (start >= sorted.size() || suffixSum[start] < remaining) {
            return;
        }
        for (int i = start; i < sorted.size(); i++) {
            if (values[i] > remaining) {
                continue;
            }
            current.add(sorted.get(i));
            search(sorted, values, suffixSum, remaining - values[i], i + 1, current, results);
            current.remove(current.size() - 1);
        }
    }
}
