package ai.kasino.unit.game;

import static ai.kasino.unit.helpers.GameStateBuilder.cards;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.game.Build;
import ai.kasino.game.Card;
import java.util.List;
import org.junit.jupiter.api.Test;

class BuildTest {

    @Test
    void idIsDerivedFromCardsRegardlessOfGrouping() {
        List<List<Card>> a = List.of(cards("4♠", "4♥"), cards("8♦"));
        List<List<Card>> b = List.of(cards("8♦"), cards("4♥", "4♠"));
        assertEquals(Build.deriveId(a), Build.deriveId(b));
        assertTrue(Build.deriveId(a).startsWith("build_"));
    }

    @Test
    void addingGroupsKeepsIdAndMarksAugmented() {
        Build build = new Build("build_x", "p1", 8, List.of(cards("5♠", "3♦")));
        assertFalse(build.isAugmented());

        Build augmented = build.withAddedGroups(List.of(cards("8♣")));
        assertEquals("build_x", augmented.getId());
        assertTrue(augmented.isAugmented());
        assertEquals(3, augmented.cardCount());
        assertEquals("[8: 5♠+3♦ | 8♣]", augmented.displayString());
        assertEquals(1, build.getCardGroups().size());
    }

    @Test
    void groupsAreImmutable() {
        Build build = new Build("b", "p1", 7, List.of(cards("3♠", "4♠")));
        assertThrows(UnsupportedOperationException.class, () -> build.getCardGroups().get(0).clear());
        assertThrows(UnsupportedOperationException.class, () -> build.allCards().clear());
    }
}
