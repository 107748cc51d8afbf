package ai.kasino;

import ai.kasino.config.KasinoProperties;
import ai.kasino.engine.HandScore;
import ai.kasino.engine.KasinoEngine;
import ai.kasino.engine.MoveResult;
import ai.kasino.game.GameMode;
import ai.kasino.game.GamePhase;
import ai.kasino.game.GameState;
import ai.kasino.player.LegalMovesHelper;
import ai.kasino.player.MoveCommand;
import ai.kasino.player.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final KasinoEngine engine;
    private final Player player;
    private final KasinoProperties properties;

    public Game(KasinoEngine engine, Player player, KasinoProperties properties) {
        this.engine = engine;
        this.player = player;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        MatchResult result = play();
        log.info("Match finished: winners={} scores={} hands={} moves={}",
                result.getWinners(), result.getMatchScores(), result.getHandsPlayed(), result.getMoves());
    }

    /**
     * Core match loop used by both the CLI runner and automated tests.
     *
     * <p>Every seat is driven by the same {@link Player}. Each iteration:
     * <ol>
     *     <li>Scores a finished hand and deals the next one until the match is over.</li>
     *     <li>Lists the legal commands and asks the player for one.</li>
     *     <li>Applies the command; a refused command is fed back with its reason and the same
     *         seat asks again.</li>
     *     <li>Passes the turn, which also triggers the second deal and the end-of-hand sweep.</li>
     * </ol>
     *
     * @return winners, scores, hands played, applied moves and how long the match took.
     */
    public MatchResult play() {
        Random random = properties.getSeed() == null ? new Random() : new Random(properties.getSeed());
        String solverId = player.getClass().getSimpleName();
        List<ai.kasino.game.Player> seats = new ArrayList<>();
        for (int i = 1; i <= properties.getPlayers(); i++) {
            seats.add(new ai.kasino.game.Player("player_" + i, "Player " + i));
        }
        GameState state = engine.initializeGame(UUID.randomUUID().toString(), seats, GameMode.PRACTICE, random);

        final int maxIterations = properties.getMaxMovesPerMatch();
        String feedback = "";
        int iterations = 0;
        int successfulMoves = 0;
        int handMoves = 0;
        int handsPlayed = 0;
        long startNanos = System.nanoTime();

        while (state.getPhase() != GamePhase.GAME_OVER) {
            if (state.getPhase() == GamePhase.SCORING) {
                Map<String, HandScore> handScores = engine.scoreBreakdown(state);
                state = engine.applyScores(state);
                handsPlayed++;
                if (log.isDebugEnabled()) {
                    log.debug("Hand {} scores {}; match {}", state.getHandNumber(), handScores, state.getMatchScores());
                }
                if (EpisodeLogger.isEnabled()) {
                    EpisodeLogger.logSummary(state, handScores, solverId, handMoves, System.nanoTime() - startNanos);
                }
                handMoves = 0;
                if (state.getPhase() == GamePhase.SCORING) {
                    state = engine.startNextHand(state, random);
                }
                continue;
            }

            List<String> legalMoves = LegalMovesHelper.listLegalMoves(engine, state);
            if (legalMoves.isEmpty()) {
                log.warn("No legal command for {} in {}; stopping match", state.currentPlayer().getId(), state);
                break;
            }
            String input = player.nextCommand(state, legalMoves, feedback);
            if (input == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed. Exiting for player {}", solverId);
                }
                break;
            }
            input = input.trim();

            iterations++;
            if (iterations > maxIterations) {
                if (log.isDebugEnabled()) {
                    log.debug("Maximum iteration limit reached ({}); stopping match for {}", maxIterations, solverId);
                }
                break;
            }

            MoveCommand command;
            try {
                command = MoveCommand.parse(input);
            } catch (IllegalArgumentException e) {
                feedback = "Usage error: " + e.getMessage();
                if (log.isDebugEnabled()) {
                    log.debug("Invalid command format from {}: {}", solverId, input);
                }
                continue;
            }

            MoveResult result = command.apply(engine, state);
            if (!result.success) {
                feedback = "Your last command was illegal: " + input + " (" + result.reason + ": " + result.message + ")";
                if (log.isDebugEnabled()) {
                    log.debug("Illegal command from {}: {} ({})", solverId, input, result.reason);
                }
                continue;
            }
            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logStep(state, solverId, iterations, legalMoves, input);
            }
            if (log.isDebugEnabled()) {
                log.debug("{}: {}", state.currentPlayer().getId(), result.message);
            }
            feedback = "";
            successfulMoves++;
            handMoves++;
            state = engine.nextTurn(result.state);
        }

        long durationNanos = System.nanoTime() - startNanos;
        boolean completed = state.getPhase() == GamePhase.GAME_OVER;
        return new MatchResult(completed, engine.winners(state), state.getMatchScores(),
                handsPlayed, successfulMoves, durationNanos);
    }
}
