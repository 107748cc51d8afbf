package ai.kasino.engine;

import ai.kasino.game.GamePhase;
import ai.kasino.game.GameState;
import ai.kasino.game.Player;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring rules for a completed hand and the running match.
 * <p>
 * Hand points: most cards 2 (1 each if tied), spades 1 for five or 2 for six and more, spy two 1,
 * big ten 2, each ace 1. The spades bonus is a threshold, not additive.
 */
final class ScoreCalculator {
    /** Captured cards needed for the tiebreak point. */
    static final int TIEBREAK_CARD_COUNT = 21;

    private ScoreCalculator() {
    }

    static Map<String, HandScore> breakdown(GameState state) {
        int maxCards = 0;
        for (Player p : state.getPlayers()) {
            maxCards = Math.max(maxCards, p.capturedCardCount());
        }
        int withMost = 0;
        for (Player p : state.getPlayers()) {
            if (p.capturedCardCount() == maxCards) {
                withMost++;
            }
        }
        boolean tiedMost = withMost > 1;

        Map<String, HandScore> scores = new LinkedHashMap<>();
        for (Player p : state.getPlayers()) {
            int mostCards = 0;
            if (p.capturedCardCount() == maxCards) {
                mostCards = tiedMost ? 1 : 2;
            }
            scores.put(p.getId(), new HandScore(
                    mostCards,
                    p.spadesScore(),
                    p.hasSpyTwo() ? 1 : 0,
                    p.hasBigTen() ? 2 : 0,
                    p.aceCount()));
        }
        return scores;
    }

    static Map<String, Integer> totals(GameState state) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        breakdown(state).forEach((id, score) -> totals.put(id, score.total()));
        return totals;
    }

    /**
     * Adds the hand's points to the match scores, applies the 21-card tiebreak when hand and
     * match scores are both level, and moves to {@link GamePhase#GAME_OVER} once anyone reaches
     * the target.
     */
    static GameState apply(GameState state) {
        Map<String, Integer> hand = totals(state);
        Map<String, Integer> match = new LinkedHashMap<>(state.getMatchScores());
        hand.forEach((id, points) -> match.merge(id, points, Integer::sum));

        if (new HashSet<>(hand.values()).size() == 1 && new HashSet<>(match.values()).size() == 1) {
            for (Player p : state.getPlayers()) {
                if (p.capturedCardCount() >= TIEBREAK_CARD_COUNT) {
                    match.merge(p.getId(), 1, Integer::sum);
                }
            }
        }

        boolean reached = match.values().stream().anyMatch(v -> v >= state.getTargetScore());
        return state.toBuilder()
                .matchScores(match)
                .phase(reached ? GamePhase.GAME_OVER : GamePhase.SCORING)
                .build();
    }

    static List<String> winners(GameState state) {
        List<String> winners = new ArrayList<>();
        if (state.getPhase() != GamePhase.GAME_OVER) {
            return winners;
        }
        int best = state.getMatchScores().values().stream().mapToInt(Integer::intValue).max().orElse(0);
        state.getMatchScores().forEach((id, score) -> {
            if (score == best) {
                winners.add(id);
            }
        });
        return winners;
    }
}
