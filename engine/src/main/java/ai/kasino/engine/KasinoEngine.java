package ai.kasino.engine;

import ai.kasino.config.KasinoProperties;
import ai.kasino.game.ActionLog;
import ai.kasino.game.ActionType;
import ai.kasino.game.Build;
import ai.kasino.game.Card;
import ai.kasino.game.Deck;
import ai.kasino.game.GameAction;
import ai.kasino.game.GameMode;
import ai.kasino.game.GamePhase;
import ai.kasino.game.GameState;
import ai.kasino.game.Player;
import ai.kasino.search.DisjointSelection;
import ai.kasino.search.ExactPartition;
import ai.kasino.search.SubsetSums;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rules engine for South African Casino.
 * <p>
 * Every operation is a pure transition {@code (GameState, args) -> GameState}: the input
 * snapshot is never modified, so the engine can be shared between threads as long as each
 * game applies one move per snapshot.
 * <p>
 * <strong>Rules enforced:</strong>
 * <ul>
 *   <li>40-card deck; 2 players get 10 + 10 with a second deal of 10 each, 3 players get 13
 *       each plus one card on the table, 4 players get 10 each.</li>
 *   <li>A capture takes every matching single, every matching build and a maximal set of
 *       non-overlapping combinations; the capturing card goes on top of the pile.</li>
 *   <li>Builds are exact-sum groups owned by one player, who must keep a card to capture them.
 *       Same-value builds of one owner merge; opponents may increase single-group builds.</li>
 *   <li>The top card of an opponent's capture pile may be stolen into a build, but only while
 *       playing a hand card.</li>
 *   <li>A build owner cannot drift, except during the second deal.</li>
 *   <li>The last capturer sweeps the table at the end of the hand.</li>
 * </ul>
 * <p>
 * Build and drift moves return a {@link MoveResult}; an illegal move yields the unchanged input
 * state plus a {@link RejectionReason}. Contract violations (bad player counts, capture options
 * from another state, acting outside the playing phases) throw.
 */
@Component
public class KasinoEngine {
    private static final Logger log = LoggerFactory.getLogger(KasinoEngine.class);

    /** Cards per player in a two- or four-player deal and in the second deal. */
    public static final int CARDS_PER_DEAL = 10;
    /** Cards per player in a three-player deal. */
    public static final int THREE_PLAYER_HAND = 13;
    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 4;
    public static final int DEFAULT_TARGET_SCORE = 11;

    private final int targetScore;
    private final int maxActionLog;
    private final Clock clock;

    public KasinoEngine() {
        this(DEFAULT_TARGET_SCORE, ActionLog.DEFAULT_CAPACITY, Clock.systemUTC());
    }

    @Autowired
    public KasinoEngine(KasinoProperties properties) {
        this(properties.getTargetScore(), properties.getMaxActionLog(), Clock.systemUTC());
    }

    /**
     * @param targetScore match score that ends a match
     * @param maxActionLog action log capacity for new games
     * @param clock source of action timestamps
     */
    public KasinoEngine(int targetScore, int maxActionLog, Clock clock) {
        if (targetScore <= 0) {
            throw new IllegalArgumentException("Target score must be positive: " + targetScore);
        }
        if (maxActionLog <= 0) {
            throw new IllegalArgumentException("Action log capacity must be positive: " + maxActionLog);
        }
        this.targetScore = targetScore;
        this.maxActionLog = maxActionLog;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int getTargetScore() {
        return targetScore;
    }

    // ===================================================
    //  DEALING
    // ===================================================

    /**
     * Starts a match with a random game id and a freshly shuffled deck.
     *
     * @see #initializeGame(String, List, GameMode, Random)
     */
    public GameState initializeGame(List<Player> players, GameMode mode) {
        return initializeGame(UUID.randomUUID().toString(), players, mode, new Random());
    }

    /**
     * Starts a match: shuffles the 40-card deck and deals according to the player count.
     * <ul>
     *   <li>2 players: 10 cards each, the other 20 kept back for the second deal.</li>
     *   <li>3 players: 13 cards each and one card face up on the table.</li>
     *   <li>4 players: 10 cards each, empty table.</li>
     * </ul>
     * Player 0 starts and every match score is 0. Existing hands and capture piles of the given
     * players are discarded.
     *
     * @param gameId identifier carried on the state
     * @param players the seats in turn order
     * @param mode how the match was set up
     * @param random source for the shuffle
     * @return the first snapshot, in {@link GamePhase#PLAYING}
     * @throws IllegalArgumentException if there are fewer than 2 or more than 4 players
     */
    public GameState initializeGame(String gameId, List<Player> players, GameMode mode, Random random) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(players, "players");
        Objects.requireNonNull(mode, "mode");
        if (players.size() < MIN_PLAYERS || players.size() > MAX_PLAYERS) {
            throw new IllegalArgumentException("Casino needs 2 to 4 players, got " + players.size());
        }
        Map<String, Integer> matchScores = new LinkedHashMap<>();
        for (Player p : players) {
            matchScores.put(p.getId(), 0);
        }
        if (matchScores.size() != players.size()) {
            throw new IllegalArgumentException("Player ids must be unique");
        }
        GameState state = deal(players, random)
                .gameId(gameId)
                .mode(mode)
                .matchScores(matchScores)
                .targetScore(targetScore)
                .handNumber(1)
                .build();
        if (log.isDebugEnabled()) {
            log.debug("Dealt game {} for {} players", gameId, players.size());
        }
        return state;
    }

    /**
     * Deals the next hand of a match to the same players, keeping match scores.
     *
     * @see #startNextHand(GameState, Random)
     */
    public GameState startNextHand(GameState state) {
        return startNextHand(state, new Random());
    }

    /**
     * Deals the next hand of a match: fresh deck, empty capture piles, player 0 to start, hand
     * number incremented, action log cleared. Match scores, target score, game id and mode carry
     * over.
     *
     * @param state a state whose hand has been scored
     * @param random source for the shuffle
     * @return the first snapshot of the new hand
     * @throws IllegalStateException if the state is not in {@link GamePhase#SCORING}
     */
    public GameState startNextHand(GameState state, Random random) {
        if (state.getPhase() != GamePhase.SCORING) {
            throw new IllegalStateException("Next hand can only be dealt after scoring, phase is " + state.getPhase());
        }
        GameState next = deal(state.getPlayers(), random)
                .gameId(state.getGameId())
                .mode(state.getMode())
                .matchScores(state.getMatchScores())
                .targetScore(state.getTargetScore())
                .handNumber(state.getHandNumber() + 1)
                .build();
        if (log.isDebugEnabled()) {
            log.debug("Dealt hand {} of game {}", next.getHandNumber(), next.getGameId());
        }
        return next;
    }

    private GameState.Builder deal(List<Player> players, Random random) {
        List<Card> deck = Deck.shuffled(random);
        int perPlayer = players.size() == 3 ? THREE_PLAYER_HAND : CARDS_PER_DEAL;
        List<Player> dealt = new ArrayList<>(players.size());
        int next = 0;
        for (Player p : players) {
            dealt.add(new Player(p.getId(), p.getDisplayName(), deck.subList(next, next + perPlayer), List.of()));
            next += perPlayer;
        }
        List<Card> table = new ArrayList<>();
        List<Card> drawPile = new ArrayList<>();
        if (players.size() == 3) {
            table.add(deck.get(next));
        } else if (players.size() == 2) {
            drawPile.addAll(deck.subList(next, deck.size()));
        }
        return GameState.builder()
                .phase(GamePhase.PLAYING)
                .players(dealt)
                .currentPlayerIndex(0)
                .tableCards(table)
                .builds(List.of())
                .drawPile(drawPile)
                .lastCapturePlayerIndex(-1)
                .secondDeal(false)
                .actionLog(ActionLog.empty(maxActionLog));
    }

    // ===================================================
    //  CAPTURES
    // ===================================================

    /**
     * Finds every legal capture for a card played from hand.
     * <p>
     * A capture must take all loose cards of the card's value, all builds of that value and a
     * maximal set of non-overlapping combinations (two or more loose cards of other values
     * summing to the card's value). Choice only arises when combinations overlap; then one option
     * is returned per maximal set. Plain captures never steal from opponents' piles.
     *
     * @param state current snapshot
     * @param handCard the card to play
     * @return the capture options; empty if the card captures nothing
     */
    public List<CaptureOption> findCaptures(GameState state, Card handCard) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(handCard, "handCard");
        int target = handCard.captureValue();

        List<Card> singles = new ArrayList<>();
        List<Card> others = new ArrayList<>();
        for (Card c : state.getTableCards()) {
            if (c.captureValue() == target) {
                singles.add(c);
            } else {
                others.add(c);
            }
        }
        List<Build> builds = state.getBuilds().stream()
                .filter(b -> b.getCaptureValue() == target)
                .collect(Collectors.toList());
        List<List<Card>> combos = SubsetSums.findAll(others, Card::captureValue, target, 2);

        List<CaptureOption> options = new ArrayList<>();
        if (singles.isEmpty() && builds.isEmpty() && combos.isEmpty()) {
            return options;
        }
        if (combos.isEmpty()) {
            options.add(new CaptureOption(handCard, singles, builds, List.of(), List.of()));
            return options;
        }
        for (List<List<Card>> selection : DisjointSelection.maximalSelections(combos)) {
            options.add(new CaptureOption(handCard, singles, builds, selection, List.of()));
        }
        return options;
    }

    /**
     * Applies a capture option found by {@link #findCaptures(GameState, Card)} on the same state.
     * <p>
     * The captured cards go onto the current player's pile in option order (singles, builds
     * group by group, combinations, stolen cards) with the hand card on top. The player becomes
     * the last capturer.
     *
     * @param state current snapshot
     * @param handCard the card played; must be the option's hand card
     * @param option the chosen capture
     * @return the new snapshot
     * @throws IllegalArgumentException if the option does not fit this state
     * @throws IllegalStateException if the hand is not in a playing phase
     */
    public GameState executeCapture(GameState state, Card handCard, CaptureOption option) {
        Objects.requireNonNull(option, "option");
        requirePlayable(state);
        int playerIdx = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();

        if (!option.getHandCard().equals(handCard)) {
            throw new IllegalArgumentException("Capture option was computed for " + option.getHandCard()
                    + ", not " + handCard);
        }
        if (!player.holds(handCard)) {
            throw new IllegalArgumentException(handCard + " is not in " + player.getId() + "'s hand");
        }
        Set<Card> fromTable = new HashSet<>(option.getSingles());
        for (List<Card> combo : option.getCombinations()) {
            fromTable.addAll(combo);
        }
        if (!state.getTableCards().containsAll(fromTable)) {
            throw new IllegalArgumentException("Capture option refers to cards not on the table");
        }
        if (!state.getBuilds().containsAll(option.getBuilds())) {
            throw new IllegalArgumentException("Capture option refers to builds not on the table");
        }
        if (!areStealable(state, option.getOpponentPileCards())) {
            throw new IllegalArgumentException("Capture option steals cards that are not on top of a pile");
        }

        List<Card> captured = option.allCapturedCards();
        List<Card> pileAddition = new ArrayList<>(captured);
        pileAddition.add(handCard);

        List<Player> players = removeStolen(state, option.getOpponentPileCards());
        players.set(playerIdx, player.withoutHandCard(handCard).withCaptured(pileAddition));

        List<Card> table = new ArrayList<>(state.getTableCards());
        table.removeAll(fromTable);
        Set<String> capturedBuildIds = option.getBuilds().stream().map(Build::getId).collect(Collectors.toSet());
        List<Build> builds = state.getBuilds().stream()
                .filter(b -> !capturedBuildIds.contains(b.getId()))
                .collect(Collectors.toList());

        String description = player.getDisplayName() + " captured " + captured.size()
                + " cards with " + handCard.shortName();
        return state.toBuilder()
                .players(players)
                .tableCards(table)
                .builds(builds)
                .lastCapturePlayerIndex(playerIdx)
                .actionLog(append(state, player, ActionType.CAPTURE, handCard, captured, description))
                .build();
    }

    // ===================================================
    //  BUILDS
    // ===================================================

    /**
     * Builds from table cards, an optional hand card and optional stolen cards.
     * <p>
     * The contributed cards are partitioned into groups that each sum to the declared value.
     * Loose table cards of exactly that value that were not selected join as singleton groups.
     * If the player already owns a build of this value the new groups are merged into it;
     * otherwise a new build is created with an id derived from its cards.
     * <p>
     * Rejected when: stealing without a hand card; the player owns a build of another value; no
     * other card of the declared value would stay in hand; the value is outside 1..10; nothing is
     * contributed; a card is not where it is claimed to be; or no exact partition exists.
     *
     * @param state current snapshot
     * @param handCard the hand card played into the build, or {@code null} for a table-only build
     * @param tableCards loose table cards selected for the build
     * @param declaredValue the build's capture value
     * @param stolenCards top cards taken from opponents' capture piles
     * @return the result; on rejection the state is unchanged
     */
    public MoveResult createBuild(
            GameState state,
            Card handCard,
            List<Card> tableCards,
            int declaredValue,
            List<Card> stolenCards) {
        Objects.requireNonNull(tableCards, "tableCards");
        Objects.requireNonNull(stolenCards, "stolenCards");
        if (!state.getPhase().isPlayable()) {
            return reject(state, RejectionReason.NOT_PLAYABLE, "No moves allowed in phase " + state.getPhase());
        }
        int playerIdx = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();

        if (!stolenCards.isEmpty() && handCard == null) {
            return reject(state, RejectionReason.STEAL_WITHOUT_HAND_CARD,
                    "Stealing requires playing a card from hand at the same time.");
        }
        if (declaredValue < Card.MIN_RANK || declaredValue > Card.MAX_RANK) {
            return reject(state, RejectionReason.VALUE_OUT_OF_RANGE,
                    "Builds must be worth 1 to 10, not " + declaredValue + ".");
        }
        Optional<Build> otherBuild = state.getBuilds().stream()
                .filter(b -> b.getOwnerId().equals(player.getId()) && b.getCaptureValue() != declaredValue)
                .findFirst();
        if (otherBuild.isPresent()) {
            return reject(state, RejectionReason.OWNS_OTHER_BUILD,
                    "Capture or augment your build of " + otherBuild.get().getCaptureValue() + " first.");
        }
        if (!keepsCapturingCard(player, declaredValue, handCard)) {
            return reject(state, RejectionReason.NO_CAPTURING_CARD,
                    "You need another " + declaredValue + " in hand to build " + declaredValue + ".");
        }
        if (handCard != null && !player.holds(handCard)) {
            return reject(state, RejectionReason.CARD_NOT_IN_HAND, handCard.shortName() + " is not in your hand.");
        }
        if (!areLoose(state, tableCards)) {
            return reject(state, RejectionReason.CARD_NOT_ON_TABLE, "Build cards must be loose table cards.");
        }
        if (!areStealable(state, stolenCards)) {
            return reject(state, RejectionReason.CARD_NOT_STEALABLE,
                    "Only the top cards of an opponent's capture pile can be stolen.");
        }

        List<Card> contributed = new ArrayList<>(tableCards);
        if (handCard != null) {
            contributed.add(handCard);
        }
        contributed.addAll(stolenCards);
        if (contributed.isEmpty()) {
            return reject(state, RejectionReason.NO_CARDS, "A build needs at least one card.");
        }
        Optional<List<List<Card>>> partition = ExactPartition.partition(contributed, Card::captureValue, declaredValue);
        if (partition.isEmpty()) {
            return reject(state, RejectionReason.NO_EXACT_PARTITION,
                    "Those cards do not split into groups of " + declaredValue + ".");
        }

        List<List<Card>> groups = new ArrayList<>(partition.get());
        Set<Card> consumedTable = new HashSet<>(tableCards);
        for (Card loose : state.getTableCards()) {
            if (loose.captureValue() == declaredValue && consumedTable.add(loose)) {
                groups.add(List.of(loose));
            }
        }

        Optional<Build> existing = state.findOwnedBuild(player.getId(), declaredValue);
        Build result;
        List<Build> builds;
        if (existing.isPresent()) {
            result = existing.get().withAddedGroups(groups);
            builds = replaceBuild(state.getBuilds(), existing.get().getId(), result);
        } else {
            result = new Build(Build.deriveId(groups), player.getId(), declaredValue, groups);
            builds = new ArrayList<>(state.getBuilds());
            builds.add(result);
        }

        List<Player> players = removeStolen(state, stolenCards);
        players.set(playerIdx, handCard == null ? player : player.withoutHandCard(handCard));
        List<Card> table = new ArrayList<>(state.getTableCards());
        table.removeAll(consumedTable);

        ActionType type;
        String description;
        if (!stolenCards.isEmpty()) {
            type = ActionType.STEAL_AND_BUILD;
            description = player.getDisplayName() + " built " + result.displayString() + " (stole "
                    + stolenCards.stream().map(Card::shortName).collect(Collectors.joining(", ")) + ")";
        } else {
            type = existing.isPresent() ? ActionType.BUILD_AUGMENT : ActionType.BUILD_CREATE;
            description = player.getDisplayName() + " built " + result.displayString();
        }
        Card played = handCard != null ? handCard : tableCards.get(0);
        GameState next = state.toBuilder()
                .players(players)
                .tableCards(table)
                .builds(builds)
                .actionLog(append(state, player, type, played, stolenCards, description))
                .build();
        return MoveResult.success(next, description);
    }

    /**
     * Adds a new group of the build's value to a build the current player owns.
     * <p>
     * The new group is made of the given table cards, the optional hand card and the optional
     * stolen card, and must sum exactly to the build's value. Stealing requires a hand card, and
     * after playing the hand card the player must still hold a card of the build's value.
     *
     * @param state current snapshot
     * @param buildId id of the build to augment
     * @param tableCards loose table cards for the new group
     * @param handCard hand card for the new group, or {@code null}
     * @param stolenCard top card of an opponent's capture pile, or {@code null}
     * @return the result; on rejection the state is unchanged
     */
    public MoveResult augmentBuild(
            GameState state,
            String buildId,
            List<Card> tableCards,
            Card handCard,
            Card stolenCard) {
        Objects.requireNonNull(tableCards, "tableCards");
        if (!state.getPhase().isPlayable()) {
            return reject(state, RejectionReason.NOT_PLAYABLE, "No moves allowed in phase " + state.getPhase());
        }
        Optional<Build> found = state.findBuild(buildId);
        if (found.isEmpty()) {
            return reject(state, RejectionReason.UNKNOWN_BUILD, "No build " + buildId + " on the table.");
        }
        Build build = found.get();
        int playerIdx = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();

        if (stolenCard != null && handCard == null) {
            return reject(state, RejectionReason.STEAL_WITHOUT_HAND_CARD,
                    "Stealing requires playing a card from hand at the same time.");
        }
        if (!build.getOwnerId().equals(player.getId())) {
            return reject(state, RejectionReason.NOT_BUILD_OWNER, "You can only augment your own build.");
        }
        if (handCard != null && !player.holds(handCard)) {
            return reject(state, RejectionReason.CARD_NOT_IN_HAND, handCard.shortName() + " is not in your hand.");
        }
        if (!areLoose(state, tableCards)) {
            return reject(state, RejectionReason.CARD_NOT_ON_TABLE, "Build cards must be loose table cards.");
        }
        List<Card> stolen = stolenCard == null ? List.of() : List.of(stolenCard);
        if (!areStealable(state, stolen)) {
            return reject(state, RejectionReason.CARD_NOT_STEALABLE,
                    "Only the top card of an opponent's capture pile can be stolen.");
        }

        List<Card> group = new ArrayList<>(tableCards);
        if (handCard != null) {
            group.add(handCard);
        }
        group.addAll(stolen);
        if (group.isEmpty()) {
            return reject(state, RejectionReason.NO_CARDS, "Augmenting needs at least one card.");
        }
        int sum = group.stream().mapToInt(Card::captureValue).sum();
        if (sum != build.getCaptureValue()) {
            return reject(state, RejectionReason.NO_EXACT_PARTITION,
                    "The new group adds up to " + sum + ", not " + build.getCaptureValue() + ".");
        }
        if (handCard != null && !keepsCapturingCard(player, build.getCaptureValue(), handCard)) {
            return reject(state, RejectionReason.NO_CAPTURING_CARD,
                    "You need to keep another " + build.getCaptureValue() + " in hand.");
        }

        Build augmented = build.withAddedGroups(List.of(group));
        List<Player> players = removeStolen(state, stolen);
        players.set(playerIdx, handCard == null ? player : player.withoutHandCard(handCard));
        List<Card> table = new ArrayList<>(state.getTableCards());
        table.removeAll(tableCards);

        String description = player.getDisplayName() + " augmented build to " + augmented.displayString();
        Card played = handCard != null ? handCard : group.get(0);
        GameState next = state.toBuilder()
                .players(players)
                .tableCards(table)
                .builds(replaceBuild(state.getBuilds(), build.getId(), augmented))
                .actionLog(append(state, player, ActionType.BUILD_AUGMENT, played, stolen, description))
                .build();
        return MoveResult.success(next, description);
    }

    /**
     * Raises an opponent's single-group build by the value of a hand card and takes it over.
     * <p>
     * The new value is the old value plus the hand card's value and may not exceed 10; the
     * increaser must hold another card of the new value. If the increaser already owns a build
     * of the new value, the increased cards join it as one more group and the old build
     * disappears; otherwise the build keeps its id with the new owner, value and single group.
     * <p>
     * The increaser may already own builds of other values; the hand card may not be the last
     * card that captures one of them.
     *
     * @param state current snapshot
     * @param buildId id of the opponent's build
     * @param handCard the card added to the build
     * @return the result; on rejection the state is unchanged
     */
    public MoveResult increaseBuild(GameState state, String buildId, Card handCard) {
        Objects.requireNonNull(handCard, "handCard");
        if (!state.getPhase().isPlayable()) {
            return reject(state, RejectionReason.NOT_PLAYABLE, "No moves allowed in phase " + state.getPhase());
        }
        Optional<Build> found = state.findBuild(buildId);
        if (found.isEmpty()) {
            return reject(state, RejectionReason.UNKNOWN_BUILD, "No build " + buildId + " on the table.");
        }
        Build build = found.get();
        int playerIdx = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();

        if (!player.holds(handCard)) {
            return reject(state, RejectionReason.CARD_NOT_IN_HAND, handCard.shortName() + " is not in your hand.");
        }
        if (build.getOwnerId().equals(player.getId())) {
            return reject(state, RejectionReason.OWN_BUILD, "You cannot increase your own build.");
        }
        if (build.isAugmented()) {
            return reject(state, RejectionReason.BUILD_AUGMENTED, "Augmented builds cannot be increased.");
        }
        int newValue = build.getCaptureValue() + handCard.captureValue();
        if (newValue > Card.MAX_RANK) {
            return reject(state, RejectionReason.VALUE_OUT_OF_RANGE,
                    "Increasing to " + newValue + " would exceed 10.");
        }
        if (!keepsCapturingCard(player, newValue, handCard)) {
            return reject(state, RejectionReason.NO_CAPTURING_CARD,
                    "You need another " + newValue + " in hand to increase to " + newValue + ".");
        }
        for (Build own : state.getBuilds()) {
            if (own.getOwnerId().equals(player.getId()) && own.getCaptureValue() != newValue
                    && !keepsCapturingCard(player, own.getCaptureValue(), handCard)) {
                return reject(state, RejectionReason.NO_CAPTURING_CARD,
                        "You need to keep a " + own.getCaptureValue() + " for your own build.");
            }
        }

        List<Card> increasedGroup = new ArrayList<>(build.allCards());
        increasedGroup.add(handCard);

        Optional<Build> mergeTarget = state.findOwnedBuild(player.getId(), newValue);
        List<Build> builds;
        if (mergeTarget.isPresent()) {
            Build merged = mergeTarget.get().withAddedGroups(List.of(increasedGroup));
            builds = new ArrayList<>();
            for (Build b : state.getBuilds()) {
                if (b.getId().equals(build.getId())) {
                    continue;
                }
                builds.add(b.getId().equals(merged.getId()) ? merged : b);
            }
        } else {
            Build increased = new Build(build.getId(), player.getId(), newValue, List.of(increasedGroup));
            builds = replaceBuild(state.getBuilds(), build.getId(), increased);
        }

        List<Player> players = new ArrayList<>(state.getPlayers());
        players.set(playerIdx, player.withoutHandCard(handCard));

        String description = player.getDisplayName() + " increased build to " + newValue;
        GameState next = state.toBuilder()
                .players(players)
                .builds(builds)
                .actionLog(append(state, player, ActionType.BUILD_INCREASE, handCard, List.of(), description))
                .build();
        return MoveResult.success(next, description);
    }

    // ===================================================
    //  DRIFT
    // ===================================================

    /**
     * Plays a hand card face up onto the table without capturing.
     * <p>
     * Not allowed while the player owns a build, except during the second deal.
     *
     * @param state current snapshot
     * @param handCard the card to drift
     * @return the result; on rejection the state is unchanged
     */
    public MoveResult drift(GameState state, Card handCard) {
        Objects.requireNonNull(handCard, "handCard");
        if (!state.getPhase().isPlayable()) {
            return reject(state, RejectionReason.NOT_PLAYABLE, "No moves allowed in phase " + state.getPhase());
        }
        Player player = state.currentPlayer();
        if (!player.holds(handCard)) {
            return reject(state, RejectionReason.CARD_NOT_IN_HAND, handCard.shortName() + " is not in your hand.");
        }
        if (!state.canCurrentPlayerDrift()) {
            return reject(state, RejectionReason.DRIFT_BLOCKED, "You own a build; capture or build instead.");
        }

        List<Player> players = new ArrayList<>(state.getPlayers());
        players.set(state.getCurrentPlayerIndex(), player.withoutHandCard(handCard));
        List<Card> table = new ArrayList<>(state.getTableCards());
        table.add(handCard);

        String description = player.getDisplayName() + " drifted " + handCard.shortName();
        GameState next = state.toBuilder()
                .players(players)
                .tableCards(table)
                .actionLog(append(state, player, ActionType.DRIFT, handCard, List.of(), description))
                .build();
        return MoveResult.success(next, description);
    }

    // ===================================================
    //  TURNS & DEALS
    // ===================================================

    /**
     * Passes the turn to the next player.
     * <p>
     * Once every hand is empty, a two-player game that still has its draw pile gets the second
     * deal (10 cards each, player 0 to start, phase {@link GamePhase#PLAYING_SECOND}); any other
     * game ends the hand: the last capturer takes every card left on the table and in builds and
     * the phase becomes {@link GamePhase#SCORING}.
     *
     * @param state current snapshot
     * @return the next snapshot
     * @throws IllegalStateException if the hand is not in a playing phase
     */
    public GameState nextTurn(GameState state) {
        requirePlayable(state);
        GameState next = state.toBuilder().currentPlayerIndex(state.nextPlayerIndex()).build();
        if (!next.allHandsEmpty()) {
            return next;
        }
        if (next.playerCount() == 2 && !next.isSecondDeal() && !next.getDrawPile().isEmpty()) {
            return dealSecondRound(next);
        }
        return endHand(next);
    }

    private GameState dealSecondRound(GameState state) {
        List<Card> drawPile = state.getDrawPile();
        if (drawPile.size() < 2 * CARDS_PER_DEAL) {
            throw new IllegalStateException("Second deal needs " + 2 * CARDS_PER_DEAL
                    + " cards, draw pile has " + drawPile.size());
        }
        List<Player> players = new ArrayList<>(state.getPlayers());
        players.set(0, players.get(0).withHand(drawPile.subList(0, CARDS_PER_DEAL)));
        players.set(1, players.get(1).withHand(drawPile.subList(CARDS_PER_DEAL, 2 * CARDS_PER_DEAL)));
        if (log.isDebugEnabled()) {
            log.debug("Second deal in game {}", state.getGameId());
        }
        return state.toBuilder()
                .players(players)
                .drawPile(drawPile.subList(2 * CARDS_PER_DEAL, drawPile.size()))
                .secondDeal(true)
                .phase(GamePhase.PLAYING_SECOND)
                .currentPlayerIndex(0)
                .build();
    }

    private GameState endHand(GameState state) {
        List<Player> players = new ArrayList<>(state.getPlayers());
        int lastIdx = state.getLastCapturePlayerIndex();
        List<Card> remaining = state.allTableCards();
        if (lastIdx >= 0 && !remaining.isEmpty()) {
            players.set(lastIdx, players.get(lastIdx).withCaptured(remaining));
            if (log.isDebugEnabled()) {
                log.debug("{} sweeps {} remaining cards", players.get(lastIdx).getId(), remaining.size());
            }
        }
        // Nobody captured this hand: the table stays where it is.
        List<Card> table = lastIdx >= 0 ? List.of() : state.getTableCards();
        List<Build> builds = lastIdx >= 0 ? List.of() : state.getBuilds();
        return state.toBuilder()
                .players(players)
                .tableCards(table)
                .builds(builds)
                .phase(GamePhase.SCORING)
                .build();
    }

    // ===================================================
    //  SCORING
    // ===================================================

    /**
     * Computes each player's points for the hand just played, keyed by player id.
     */
    public Map<String, Integer> calculateScores(GameState state) {
        return ScoreCalculator.totals(state);
    }

    /**
     * Same as {@link #calculateScores(GameState)} with the points split by category.
     */
    public Map<String, HandScore> scoreBreakdown(GameState state) {
        return ScoreCalculator.breakdown(state);
    }

    /**
     * Adds the hand's points to the match scores.
     * <p>
     * When the hand scores are all equal and the resulting match scores are all equal too, every
     * player with 21 or more captured cards gets one extra point. The phase becomes
     * {@link GamePhase#GAME_OVER} once any match score reaches the target, otherwise it stays
     * {@link GamePhase#SCORING} and the next hand can be dealt.
     *
     * @throws IllegalStateException if the hand has not ended
     */
    public GameState applyScores(GameState state) {
        if (state.getPhase() != GamePhase.SCORING) {
            throw new IllegalStateException("Scores can only be applied after a hand, phase is " + state.getPhase());
        }
        GameState scored = ScoreCalculator.apply(state);
        if (log.isDebugEnabled()) {
            log.debug("Hand {} of game {} scored: {}", state.getHandNumber(), state.getGameId(), scored.getMatchScores());
        }
        return scored;
    }

    /**
     * Player ids with the highest match score once the match is over; empty before that.
     */
    public List<String> winners(GameState state) {
        return ScoreCalculator.winners(state);
    }

    // ===================================================
    //  HELPERS
    // ===================================================

    private void requirePlayable(GameState state) {
        Objects.requireNonNull(state, "state");
        if (!state.getPhase().isPlayable()) {
            throw new IllegalStateException("No moves allowed in phase " + state.getPhase());
        }
    }

    private MoveResult reject(GameState state, RejectionReason reason, String message) {
        if (log.isDebugEnabled()) {
            log.debug("Rejected move by {}: {} ({})", state.currentPlayer().getId(), reason, message);
        }
        return MoveResult.rejected(state, reason, message);
    }

    /** Whether the player still holds a card of {@code value} besides the one being played. */
    private static boolean keepsCapturingCard(Player player, int value, Card played) {
        return player.getHand().stream()
                .anyMatch(c -> c.captureValue() == value && !c.equals(played));
    }

    /** Distinct loose table cards. */
    private static boolean areLoose(GameState state, List<Card> cards) {
        Set<Card> distinct = new HashSet<>(cards);
        return distinct.size() == cards.size() && state.getTableCards().containsAll(distinct);
    }

    /**
     * Whether the cards can be taken from opponents' capture piles: for every opponent, the
     * cards taken from their pile must be exactly its top cards.
     */
    private static boolean areStealable(GameState state, List<Card> stolen) {
        if (stolen.isEmpty()) {
            return true;
        }
        Set<Card> remaining = new HashSet<>(stolen);
        if (remaining.size() != stolen.size()) {
            return false;
        }
        for (Player opponent : state.getOpponents(state.currentPlayer().getId())) {
            List<Card> pile = opponent.getCapturePile();
            int taken = 0;
            for (Card c : pile) {
                if (remaining.contains(c)) {
                    taken++;
                }
            }
            if (taken == 0) {
                continue;
            }
            List<Card> top = pile.subList(pile.size() - taken, pile.size());
            if (!remaining.containsAll(top)) {
                return false;
            }
            remaining.removeAll(top);
        }
        return remaining.isEmpty();
    }

    /** Copy of the seats with the stolen cards removed from their owners' piles. */
    private static List<Player> removeStolen(GameState state, List<Card> stolen) {
        List<Player> players = new ArrayList<>(state.getPlayers());
        if (stolen.isEmpty()) {
            return players;
        }
        Set<Card> stolenSet = new HashSet<>(stolen);
        for (int i = 0; i < players.size(); i++) {
            if (i == state.getCurrentPlayerIndex()) {
                continue;
            }
            Player p = players.get(i);
            List<Card> pile = new ArrayList<>(p.getCapturePile());
            if (pile.removeIf(stolenSet::contains)) {
                players.set(i, p.withCapturePile(pile));
            }
        }
        return players;
    }

    private static List<Build> replaceBuild(List<Build> builds, String buildId, Build replacement) {
        List<Build> result = new ArrayList<>(builds.size());
        for (Build b : builds) {
            result.add(b.getId().equals(buildId) ? replacement : b);
        }
        return result;
    }

    private ActionLog append(
            GameState state,
            Player player,
            ActionType type,
            Card played,
            List<Card> cards,
            String description) {
        return state.getActionLog().append(
                new GameAction(player.getId(), type, played, cards, description, clock.instant()));
    }
}
