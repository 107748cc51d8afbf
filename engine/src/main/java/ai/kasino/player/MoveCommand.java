package ai.kasino.player;

import ai.kasino.engine.CaptureOption;
import ai.kasino.engine.KasinoEngine;
import ai.kasino.engine.MoveResult;
import ai.kasino.engine.RejectionReason;
import ai.kasino.game.Build;
import ai.kasino.game.Card;
import ai.kasino.game.GameState;
import ai.kasino.game.Player;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed text command, ready to be applied to a state through the engine.
 * <p>
 * Grammar (case-insensitive keywords, cards as short names such as {@code 7♠}, {@code 10d},
 * {@code AS}):
 * <pre>
 *   capture &lt;card&gt; [n]               n-th capture option for the hand card (default 1)
 *   drift &lt;card&gt;
 *   build &lt;value&gt; &lt;card&gt; [card...]     build from one hand card plus table / stolen cards
 *   augment B&lt;n&gt; &lt;card&gt; [card...]     add a group to the player's own build
 *   increase B&lt;n&gt; &lt;card&gt;
 * </pre>
 * Builds are numbered {@code B1..Bn} in table order. Card tokens are resolved by where the card
 * lies for the current player: hand, then table, then the top of an opponent's capture pile.
 * Naming a second card from the same pile reaches one card deeper, so {@code build 9 3♠ 4♦ 2♣}
 * steals the top two cards of a pile whose top card is {@code 4♦} with {@code 2♣} beneath it.
 */
public final class MoveCommand {

    public enum Kind {
        CAPTURE,
        DRIFT,
        BUILD,
        AUGMENT,
        INCREASE
    }

    private final Kind kind;
    private final Integer number;
    private final List<String> cardTokens;

    private MoveCommand(Kind kind, Integer number, List<String> cardTokens) {
        this.kind = kind;
        this.number = number;
        this.cardTokens = List.copyOf(cardTokens);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Capture option index, build value or build number, depending on the kind; null for drift.
     */
    public Integer getNumber() {
        return number;
    }

    public List<String> getCardTokens() {
        return cardTokens;
    }

    /**
     * Parses a command line.
     *
     * @param input raw command text
     * @return the parsed command
     * @throws IllegalArgumentException if the text is not a well-formed command
     */
    public static MoveCommand parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Empty command");
        }
        String[] parts = input.trim().split("\\s+");
        String keyword = parts[0].toLowerCase(Locale.ROOT);
        switch (keyword) {
            case "capture":
                if (parts.length == 2) {
                    return new MoveCommand(Kind.CAPTURE, 1, List.of(parts[1]));
                }
                requireLength(input, parts, 3);
                return new MoveCommand(Kind.CAPTURE, parseInt(input, parts[2]), List.of(parts[1]));
            case "drift":
                requireLength(input, parts, 2);
                return new MoveCommand(Kind.DRIFT, null, List.of(parts[1]));
            case "build":
                if (parts.length < 4) {
                    throw new IllegalArgumentException("Usage: build <value> <hand card> <card>...: " + input);
                }
                return new MoveCommand(Kind.BUILD, parseInt(input, parts[1]), tail(parts, 2));
            case "augment":
                if (parts.length < 3) {
                    throw new IllegalArgumentException("Usage: augment B<n> <card>...: " + input);
                }
                return new MoveCommand(Kind.AUGMENT, parseBuildRef(input, parts[1]), tail(parts, 2));
            case "increase":
                requireLength(input, parts, 3);
                return new MoveCommand(Kind.INCREASE, parseBuildRef(input, parts[1]), List.of(parts[2]));
            default:
                throw new IllegalArgumentException("Unknown command: " + input);
        }
    }

    /**
     * Applies this command for the current player.
     * <p>
     * Card tokens that name no card where the command needs one, and capture numbers outside the
     * listed options, are reported as rejections like any other illegal move.
     *
     * @param engine the rules engine
     * @param state current snapshot
     * @return the engine's result
     */
    public MoveResult apply(KasinoEngine engine, GameState state) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(state, "state");
        if (!state.getPhase().isPlayable()) {
            return MoveResult.rejected(state, RejectionReason.NOT_PLAYABLE, "No moves allowed in phase " + state.getPhase());
        }
        Player player = state.currentPlayer();
        switch (kind) {
            case CAPTURE:
                return applyCapture(engine, state, player);
            case DRIFT: {
                Optional<Card> card = findIn(player.getHand(), cardTokens.get(0));
                if (card.isEmpty()) {
                    return notInHand(state, cardTokens.get(0));
                }
                return engine.drift(state, card.get());
            }
            case BUILD:
                return applyBuild(engine, state, player);
            case AUGMENT:
                return applyAugment(engine, state, player);
            case INCREASE: {
                Optional<Build> build = buildAt(state, number);
                if (build.isEmpty()) {
                    return unknownBuild(state);
                }
                Optional<Card> card = findIn(player.getHand(), cardTokens.get(0));
                if (card.isEmpty()) {
                    return notInHand(state, cardTokens.get(0));
                }
                return engine.increaseBuild(state, build.get().getId(), card.get());
            }
            default:
                throw new IllegalStateException("Unhandled command kind " + kind);
        }
    }

    private MoveResult applyCapture(KasinoEngine engine, GameState state, Player player) {
        Optional<Card> card = findIn(player.getHand(), cardTokens.get(0));
        if (card.isEmpty()) {
            return notInHand(state, cardTokens.get(0));
        }
        List<CaptureOption> options = engine.findCaptures(state, card.get());
        if (options.isEmpty()) {
            return MoveResult.rejected(state, RejectionReason.NO_CAPTURE, card.get().shortName() + " captures nothing.");
        }
        if (number < 1 || number > options.size()) {
            return MoveResult.rejected(state, RejectionReason.NO_CAPTURE,
                    "Choose a capture between 1 and " + options.size() + ".");
        }
        CaptureOption option = options.get(number - 1);
        return MoveResult.success(engine.executeCapture(state, card.get(), option), option.description());
    }

    private MoveResult applyBuild(KasinoEngine engine, GameState state, Player player) {
        Optional<Card> handCard = findIn(player.getHand(), cardTokens.get(0));
        if (handCard.isEmpty()) {
            return notInHand(state, cardTokens.get(0));
        }
        List<Card> table = new ArrayList<>();
        List<Card> stolen = new ArrayList<>();
        MoveResult unresolved = resolveOthers(state, table, stolen);
        if (unresolved != null) {
            return unresolved;
        }
        return engine.createBuild(state, handCard.get(), table, number, stolen);
    }

    private MoveResult applyAugment(KasinoEngine engine, GameState state, Player player) {
        Optional<Build> build = buildAt(state, number);
        if (build.isEmpty()) {
            return unknownBuild(state);
        }
        Card handCard = null;
        List<Card> table = new ArrayList<>();
        List<Card> stolen = new ArrayList<>();
        Map<String, Integer> depths = new HashMap<>();
        for (String token : cardTokens) {
            Optional<Card> inHand = findIn(player.getHand(), token);
            if (inHand.isPresent() && handCard == null) {
                handCard = inHand.get();
                continue;
            }
            Optional<Card> onTable = findIn(state.getTableCards(), token);
            if (onTable.isPresent()) {
                table.add(onTable.get());
                continue;
            }
            Optional<Card> onPile = findOnPile(state, token, depths);
            if (onPile.isPresent()) {
                stolen.add(onPile.get());
                continue;
            }
            return MoveResult.rejected(state, RejectionReason.CARD_NOT_ON_TABLE, "Cannot find " + token + ".");
        }
        if (stolen.size() > 1) {
            return MoveResult.rejected(state, RejectionReason.CARD_NOT_STEALABLE,
                    "Only one card can be stolen into an augment.");
        }
        return engine.augmentBuild(state, build.get().getId(), table, handCard, stolen.isEmpty() ? null : stolen.get(0));
    }

    /** Resolves every token after the hand card into table cards or stolen pile cards. */
    private MoveResult resolveOthers(GameState state, List<Card> table, List<Card> stolen) {
        Map<String, Integer> depths = new HashMap<>();
        for (String token : cardTokens.subList(1, cardTokens.size())) {
            Optional<Card> onTable = findIn(state.getTableCards(), token);
            if (onTable.isPresent()) {
                table.add(onTable.get());
                continue;
            }
            Optional<Card> onPile = findOnPile(state, token, depths);
            if (onPile.isPresent()) {
                stolen.add(onPile.get());
                continue;
            }
            return MoveResult.rejected(state, RejectionReason.CARD_NOT_ON_TABLE, "Cannot find " + token + ".");
        }
        return null;
    }

    private static Optional<Card> findIn(List<Card> cards, String token) {
        return cards.stream().filter(c -> c.matchesShortName(token)).findFirst();
    }

    /**
     * Matches the next card down each opponent's capture pile; {@code depths} counts the cards
     * already taken from every pile by earlier tokens of the same command.
     */
    private static Optional<Card> findOnPile(GameState state, String token, Map<String, Integer> depths) {
        for (Player opponent : state.getOpponents(state.currentPlayer().getId())) {
            List<Card> pile = opponent.getCapturePile();
            int depth = depths.getOrDefault(opponent.getId(), 0);
            if (depth >= pile.size()) {
                continue;
            }
            Card next = pile.get(pile.size() - 1 - depth);
            if (next.matchesShortName(token)) {
                depths.put(opponent.getId(), depth + 1);
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    private static Optional<Build> buildAt(GameState state, int buildNumber) {
        List<Build> builds = state.getBuilds();
        if (buildNumber < 1 || buildNumber > builds.size()) {
            return Optional.empty();
        }
        return Optional.of(builds.get(buildNumber - 1));
    }

    private static MoveResult notInHand(GameState state, String token) {
        return MoveResult.rejected(state, RejectionReason.CARD_NOT_IN_HAND, token + " is not in your hand.");
    }

    private MoveResult unknownBuild(GameState state) {
        return MoveResult.rejected(state, RejectionReason.UNKNOWN_BUILD, "No build B" + number + " on the table.");
    }

    private static void requireLength(String input, String[] parts, int length) {
        if (parts.length != length) {
            throw new IllegalArgumentException("Wrong number of arguments: " + input);
        }
    }

    private static int parseInt(String input, String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number but got '" + token + "' in: " + input, e);
        }
    }

    private static int parseBuildRef(String input, String token) {
        if (token.length() < 2 || Character.toUpperCase(token.charAt(0)) != 'B') {
            throw new IllegalArgumentException("Expected a build reference like B1 but got '" + token + "' in: " + input);
        }
        return parseInt(input, token.substring(1));
    }

    private static List<String> tail(String[] parts, int from) {
        List<String> out = new ArrayList<>();
        for (int i = from; i < parts.length; i++) {
            out.add(parts[i]);
        }
        return out;
    }

    /**
     * Renders the command back to text, using the tokens as given.
     */
    @Override
    public String toString() {
        String cards = String.join(" ", cardTokens);
        switch (kind) {
            case CAPTURE:
                return "capture " + cards + " " + number;
            case DRIFT:
                return "drift " + cards;
            case BUILD:
                return "build " + number + " " + cards;
            case AUGMENT:
                return "augment B" + number + " " + cards;
            default:
                return "increase B" + number + " " + cards;
        }
    }
}
