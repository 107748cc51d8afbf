package ai.kasino;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link Game#play()} call.
 */
public final class MatchResult {
    private final boolean completed;
    private final List<String> winners;
    private final Map<String, Integer> matchScores;
    private final int handsPlayed;
    private final int moves;
    private final long durationNanos;

    public MatchResult(
            boolean completed,
            List<String> winners,
            Map<String, Integer> matchScores,
            int handsPlayed,
            int moves,
            long durationNanos) {
        this.completed = completed;
        this.winners = List.copyOf(winners);
        this.matchScores = Map.copyOf(matchScores);
        this.handsPlayed = handsPlayed;
        this.moves = moves;
        this.durationNanos = durationNanos;
    }

    /** True when the match reached the target score, false when it was cut short. */
    public boolean isCompleted() {
        return completed;
    }

    public List<String> getWinners() {
        return winners;
    }

    public Map<String, Integer> getMatchScores() {
        return matchScores;
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }

    public int getMoves() {
        return moves;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    @Override
    public String toString() {
        return "MatchResult(completed=" + completed
                + ", winners=" + winners
                + ", scores=" + matchScores
                + ", hands=" + handsPlayed
                + ", moves=" + moves + ")";
    }
}
