package ai.kasino.unit.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.search.ExactPartition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Exact-sum partitioning used to validate builds.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>splitsIntoGroupsOfTarget</b> - 5,3,4,4 into two groups of 8</li>
 *   <li><b>needsBacktrackingWhenGreedyFails</b> - a first placement that dead-ends is undone</li>
 *   <li><b>rejectsTotalsThatAreNotMultiples</b> - quick rejection on total % target</li>
 *   <li><b>rejectsItemsLargerThanTarget</b> - a 9 can never sit in a group of 8</li>
 *   <li><b>emptyInputPartitionsIntoNothing</b> - no items, no groups</li>
 * </ul>
 */
class ExactPartitionTest {

    @Test
    void splitsIntoGroupsOfTarget() {
        Optional<List<List<Integer>>> groups = ExactPartition.partition(List.of(5, 3, 4, 4), Integer::intValue, 8);

        assertTrue(groups.isPresent());
        assertEquals(2, groups.get().size());
        for (List<Integer> group : groups.get()) {
            assertEquals(8, group.stream().mapToInt(Integer::intValue).sum());
        }
    }

    @Test
    void needsBacktrackingWhenGreedyFails() {
        // Placing 4+3 together first dead-ends; the answer is 4+2+2 and 3+3+2.
        List<Integer> items = List.of(4, 3, 3, 2, 2, 2);
        Optional<List<List<Integer>>> groups = ExactPartition.partition(items, Integer::intValue, 8);

        assertTrue(groups.isPresent());
        List<Integer> flattened = new ArrayList<>();
        groups.get().forEach(flattened::addAll);
        assertEquals(items.size(), flattened.size());
        for (List<Integer> group : groups.get()) {
            assertEquals(8, group.stream().mapToInt(Integer::intValue).sum());
        }
    }

    @Test
    void rejectsTotalsThatAreNotMultiples() {
        assertFalse(ExactPartition.isPartitionable(List.of(5, 4), Integer::intValue, 8));
    }

    @Test
    void rejectsImpossibleSplitOfCorrectTotal() {
        // 6+6+4 = 16 but no group of 8 exists.
        assertFalse(ExactPartition.isPartitionable(List.of(6, 6, 4), Integer::intValue, 8));
    }

    @Test
    void rejectsItemsLargerThanTarget() {
        assertFalse(ExactPartition.isPartitionable(List.of(9, 7), Integer::intValue, 8));
        assertFalse(ExactPartition.isPartitionable(List.of(4), Integer::intValue, 0));
    }

    @Test
    void emptyInputPartitionsIntoNothing() {
        assertEquals(Optional.of(List.of()), ExactPartition.partition(List.<Integer>of(), Integer::intValue, 8));
    }
}
