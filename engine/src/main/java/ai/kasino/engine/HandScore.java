package ai.kasino.engine;

/**
 * Per-category points one player earned in a hand.
 *
 * @param mostCards 2 for the most captured cards, 1 each when tied for most
 * @param spades 1 for five captured spades, 2 for six or more
 * @param spyTwo 1 for the 2♠
 * @param bigTen 2 for the 10♦
 * @param aces 1 per captured ace
 */
public record HandScore(int mostCards, int spades, int spyTwo, int bigTen, int aces) {

    public int total() {
        return mostCards + spades + spyTwo + bigTen + aces;
    }
}
