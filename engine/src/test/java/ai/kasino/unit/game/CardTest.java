package ai.kasino.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.game.Card;
import ai.kasino.game.Deck;
import ai.kasino.game.Suit;
import org.junit.jupiter.api.Test;

class CardTest {

    @Test
    void scoringCardsAreFlagged() {
        Card spyTwo = Deck.parse("2♠");
        Card bigTen = Deck.parse("10♦");
        Card ace = Deck.parse("A♥");

        assertTrue(spyTwo.isSpyTwo());
        assertTrue(spyTwo.isSpade());
        assertTrue(bigTen.isBigTen());
        assertTrue(ace.isAce());
        assertFalse(Deck.parse("2♣").isSpyTwo());
        assertFalse(Deck.parse("10♠").isBigTen());
    }

    @Test
    void aceCapturesAsOne() {
        assertEquals(1, Deck.parse("A♣").captureValue());
        assertEquals("A♣", Deck.parse("A♣").shortName());
        assertEquals("10♥", Deck.parse("10♥").shortName());
    }

    @Test
    void matchesSymbolOrLetterIgnoringCase() {
        Card card = Deck.parse("10♦");
        assertTrue(card.matchesShortName("10♦"));
        assertTrue(card.matchesShortName("10d"));
        assertTrue(card.matchesShortName("10D"));
        assertFalse(card.matchesShortName("10♥"));
        assertFalse(card.matchesShortName(null));
    }

    @Test
    void equalityIsById() {
        Card a = new Card(5, Suit.HEARTS, "x");
        Card b = new Card(6, Suit.CLUBS, "x");
        assertEquals(a, b);
        assertNotEquals(a, new Card(5, Suit.HEARTS, "y"));
    }

    @Test
    void rankOutsideAceToTenIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Card(0, Suit.SPADES, "c"));
        assertThrows(IllegalArgumentException.class, () -> new Card(11, Suit.SPADES, "c"));
    }
}
