package ai.kasino.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a Casino hand in progress.
 * <p>
 * Holds the seats, the table (loose cards and builds), the undealt draw pile, the turn
 * pointer, the last capturer, the match score ledger and the action log. Nothing here is ever
 * mutated: every engine operation derives a new snapshot through {@link #toBuilder()}.
 * <p>
 * <strong>Invariants:</strong>
 * <ul>
 *   <li>{@code currentPlayerIndex < players.size()}.</li>
 *   <li>Table cards, build cards, hands, capture piles and the draw pile together hold the full
 *       40-card deck, each id exactly once.</li>
 *   <li>At most one build exists per (owner, value).</li>
 * </ul>
 * <p>
 * The accessors below the field getters are the read-only queries an AI or UI needs: current
 * hand, table, builds, opponents' top capture cards and captured-card counts.
 */
public final class GameState {
    private final String gameId;
    private final GameMode mode;
    private final GamePhase phase;
    private final List<Player> players;
    private final int currentPlayerIndex;
    private final List<Card> tableCards;
    private final List<Build> builds;
    private final List<Card> drawPile;
    private final int lastCapturePlayerIndex;
    private final ActionLog actionLog;
    private final boolean secondDeal;
    private final Map<String, Integer> matchScores;
    private final int targetScore;
    private final int handNumber;

    private GameState(Builder b) {
        this.gameId = Objects.requireNonNull(b.gameId, "gameId");
        this.mode = Objects.requireNonNull(b.mode, "mode");
        this.phase = Objects.requireNonNull(b.phase, "phase");
        this.players = List.copyOf(b.players);
        if (players.isEmpty()) {
            throw new IllegalArgumentException("A game needs players");
        }
        if (b.currentPlayerIndex < 0 || b.currentPlayerIndex >= players.size()) {
            throw new IllegalArgumentException("Current player index out of range: " + b.currentPlayerIndex);
        }
        this.currentPlayerIndex = b.currentPlayerIndex;
        this.tableCards = List.copyOf(b.tableCards);
        this.builds = List.copyOf(b.builds);
        this.drawPile = List.copyOf(b.drawPile);
        this.lastCapturePlayerIndex = b.lastCapturePlayerIndex;
        this.actionLog = Objects.requireNonNull(b.actionLog, "actionLog");
        this.secondDeal = b.secondDeal;
        this.matchScores = Collections.unmodifiableMap(new LinkedHashMap<>(b.matchScores));
        this.targetScore = b.targetScore;
        this.handNumber = b.handNumber;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this snapshot's values, for record-style updates.
     */
    public Builder toBuilder() {
        return new Builder()
                .gameId(gameId)
                .mode(mode)
                .phase(phase)
                .players(players)
                .currentPlayerIndex(currentPlayerIndex)
                .tableCards(tableCards)
                .builds(builds)
                .drawPile(drawPile)
                .lastCapturePlayerIndex(lastCapturePlayerIndex)
                .actionLog(actionLog)
                .secondDeal(secondDeal)
                .matchScores(matchScores)
                .targetScore(targetScore)
                .handNumber(handNumber);
    }

    public String getGameId() {
        return gameId;
    }

    public GameMode getMode() {
        return mode;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public List<Card> getTableCards() {
        return tableCards;
    }

    public List<Build> getBuilds() {
        return builds;
    }

    public List<Card> getDrawPile() {
        return drawPile;
    }

    /** Index of the player who captured last, or -1 if nobody has captured this hand. */
    public int getLastCapturePlayerIndex() {
        return lastCapturePlayerIndex;
    }

    public ActionLog getActionLog() {
        return actionLog;
    }

    /** Whether the two-player second deal has happened this hand. */
    public boolean isSecondDeal() {
        return secondDeal;
    }

    /** Cumulative match score per player id. */
    public Map<String, Integer> getMatchScores() {
        return matchScores;
    }

    public int getTargetScore() {
        return targetScore;
    }

    public int getHandNumber() {
        return handNumber;
    }

    public int playerCount() {
        return players.size();
    }

    public Player currentPlayer() {
        return players.get(currentPlayerIndex);
    }

    public int nextPlayerIndex() {
        return (currentPlayerIndex + 1) % players.size();
    }

    /**
     * @throws IllegalArgumentException if no player has this id
     */
    public Player getPlayer(String playerId) {
        return players.stream()
                .filter(p -> p.getId().equals(playerId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown player: " + playerId));
    }

    public int indexOfPlayer(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId().equals(playerId)) {
                return i;
            }
        }
        return -1;
    }

    public List<Player> getOpponents(String playerId) {
        List<Player> opponents = new ArrayList<>();
        for (Player p : players) {
            if (!p.getId().equals(playerId)) {
                opponents.add(p);
            }
        }
        return opponents;
    }

    /**
     * Top capture card of every opponent of the current player that has one, keyed by player id.
     */
    public Map<String, Card> opponentTopCards() {
        Map<String, Card> tops = new LinkedHashMap<>();
        for (Player p : getOpponents(currentPlayer().getId())) {
            p.topCaptureCard().ifPresent(c -> tops.put(p.getId(), c));
        }
        return tops;
    }

    /** Captured card count per player id, in seat order. */
    public Map<String, Integer> capturedCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Player p : players) {
            counts.put(p.getId(), p.capturedCardCount());
        }
        return counts;
    }

    public Optional<Build> findBuild(String buildId) {
        return builds.stream().filter(b -> b.getId().equals(buildId)).findFirst();
    }

    /** The build the player owns at the given value, if any. */
    public Optional<Build> findOwnedBuild(String ownerId, int value) {
        return builds.stream()
                .filter(b -> b.getOwnerId().equals(ownerId) && b.getCaptureValue() == value)
                .findFirst();
    }

    public boolean ownsBuild(String playerId) {
        return builds.stream().anyMatch(b -> b.getOwnerId().equals(playerId));
    }

    public boolean currentPlayerOwnsBuild() {
        return ownsBuild(currentPlayer().getId());
    }

    /**
     * A player who owns a build may not drift, except during the second deal.
     */
    public boolean canCurrentPlayerDrift() {
        return secondDeal || !currentPlayerOwnsBuild();
    }

    /** Loose table cards followed by every build card. */
    public List<Card> allTableCards() {
        List<Card> all = new ArrayList<>(tableCards);
        for (Build build : builds) {
            all.addAll(build.allCards());
        }
        return all;
    }

    public boolean allHandsEmpty() {
        return players.stream().allMatch(p -> p.getHand().isEmpty());
    }

    /**
     * Every card in the snapshot, wherever it lies. Used to check the conservation invariant.
     */
    public List<Card> allCards() {
        List<Card> all = allTableCards();
        for (Player p : players) {
            all.addAll(p.getHand());
            all.addAll(p.getCapturePile());
        }
        all.addAll(drawPile);
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameState)) {
            return false;
        }
        GameState other = (GameState) o;
        return currentPlayerIndex == other.currentPlayerIndex
                && lastCapturePlayerIndex == other.lastCapturePlayerIndex
                && secondDeal == other.secondDeal
                && targetScore == other.targetScore
                && handNumber == other.handNumber
                && gameId.equals(other.gameId)
                && mode == other.mode
                && phase == other.phase
                && players.equals(other.players)
                && tableCards.equals(other.tableCards)
                && builds.equals(other.builds)
                && drawPile.equals(other.drawPile)
                && actionLog.equals(other.actionLog)
                && matchScores.equals(other.matchScores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gameId, mode, phase, players, currentPlayerIndex, tableCards, builds,
                drawPile, lastCapturePlayerIndex, actionLog, secondDeal, matchScores, targetScore, handNumber);
    }

    @Override
    public String toString() {
        return "GameState(" + gameId
                + ", hand=" + handNumber
                + ", phase=" + phase
                + ", turn=" + currentPlayer().getId()
                + ", table=" + tableCards
                + ", builds=" + builds
                + ", draw=" + drawPile.size()
                + ", scores=" + matchScores + ")";
    }

    /**
     * Builder for {@link GameState}. Collections are copied when {@link #build()} is called.
     */
    public static final class Builder {
        private String gameId = "game";
        private GameMode mode = GameMode.PRACTICE;
        private GamePhase phase = GamePhase.DEALING;
        private List<Player> players = List.of();
        private int currentPlayerIndex;
        private List<Card> tableCards = List.of();
        private List<Build> builds = List.of();
        private List<Card> drawPile = List.of();
        private int lastCapturePlayerIndex = -1;
        private ActionLog actionLog = ActionLog.empty(ActionLog.DEFAULT_CAPACITY);
        private boolean secondDeal;
        private Map<String, Integer> matchScores = Map.of();
        private int targetScore = 11;
        private int handNumber = 1;

        private Builder() {
        }

        public Builder gameId(String gameId) {
            this.gameId = gameId;
            return this;
        }

        public Builder mode(GameMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder phase(GamePhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder players(List<Player> players) {
            this.players = players;
            return this;
        }

        public Builder currentPlayerIndex(int currentPlayerIndex) {
            this.currentPlayerIndex = currentPlayerIndex;
            return this;
        }

        public Builder tableCards(List<Card> tableCards) {
            this.tableCards = tableCards;
            return this;
        }

        public Builder builds(List<Build> builds) {
            this.builds = builds;
            return this;
        }

        public Builder drawPile(List<Card> drawPile) {
            this.drawPile = drawPile;
            return this;
        }

        public Builder lastCapturePlayerIndex(int lastCapturePlayerIndex) {
            this.lastCapturePlayerIndex = lastCapturePlayerIndex;
            return this;
        }

        public Builder actionLog(ActionLog actionLog) {
            this.actionLog = actionLog;
            return this;
        }

        public Builder secondDeal(boolean secondDeal) {
            this.secondDeal = secondDeal;
            return this;
        }

        public Builder matchScores(Map<String, Integer> matchScores) {
            this.matchScores = matchScores;
            return this;
        }

        public Builder targetScore(int targetScore) {
            this.targetScore = targetScore;
            return this;
        }

        public Builder handNumber(int handNumber) {
            this.handNumber = handNumber;
            return this;
        }

        public GameState build() {
            return new GameState(this);
        }
    }
}
