package ai.kasino;

import ai.kasino.engine.HandScore;
import ai.kasino.game.Build;
import ai.kasino.game.Card;
import ai.kasino.game.GameState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs for episode data.
 *
 * <p>Logs are routed to a separate file (episode.log) by the logging configuration so they can be
 * filtered and replayed. Cards are written by id, so every line maps back to the exact deck.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit a single structured JSON line describing the state BEFORE a move, the legal moves
     * available and the chosen command.
     *
     * <p>The line is prefixed with "EPISODE_STEP " so downstream tools can filter it out of mixed
     * logs easily. Only what the moving player can see is written: their own hand, the table, the
     * top card and size of every capture pile, and the draw pile size.
     */
    public static void logStep(
            GameState stateBefore,
            String solverId,
            int stepIndex,
            List<String> legalMoves,
            String chosenCommand) {
        Map<String, Object> line = stepLine(stateBefore, solverId, stepIndex, legalMoves, chosenCommand);
        write("EPISODE_STEP", line);
    }

    /**
     * The fields of a step line, in output order.
     */
    public static Map<String, Object> stepLine(
            GameState stateBefore,
            String solverId,
            int stepIndex,
            List<String> legalMoves,
            String chosenCommand) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", "step");
        line.put("game_id", stateBefore.getGameId());
        line.put("hand", stateBefore.getHandNumber());
        line.put("solver", solverId);
        line.put("step_index", stepIndex);
        line.put("player", stateBefore.currentPlayer().getId());
        line.put("phase", stateBefore.getPhase().name());
        line.put("chosen_command", chosenCommand);
        line.put("hand_cards", ids(stateBefore.currentPlayer().getHand()));
        line.put("table", ids(stateBefore.getTableCards()));

        List<Map<String, Object>> builds = new ArrayList<>();
        for (Build build : stateBefore.getBuilds()) {
            Map<String, Object> b = new LinkedHashMap<>();
            b.put("id", build.getId());
            b.put("owner", build.getOwnerId());
            b.put("value", build.getCaptureValue());
            b.put("cards", ids(build.allCards()));
            builds.add(b);
        }
        line.put("builds", builds);

        Map<String, String> tops = new LinkedHashMap<>();
        stateBefore.opponentTopCards().forEach((id, card) -> tops.put(id, card.getId()));
        line.put("opponent_tops", tops);
        line.put("captured_counts", stateBefore.capturedCounts());
        line.put("draw_size", stateBefore.getDrawPile().size());
        line.put("legal_moves", legalMoves);
        return line;
    }

    /**
     * Emit a single structured JSON line summarising a finished hand.
     */
    public static void logSummary(
            GameState scoredState,
            Map<String, HandScore> handScores,
            String solverId,
            int moves,
            long durationNanos) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", "summary");
        line.put("game_id", scoredState.getGameId());
        line.put("hand", scoredState.getHandNumber());
        line.put("solver", solverId);
        line.put("moves", moves);
        Map<String, Integer> handTotals = new LinkedHashMap<>();
        handScores.forEach((id, score) -> handTotals.put(id, score.total()));
        line.put("hand_scores", handTotals);
        line.put("captured_counts", scoredState.capturedCounts());
        line.put("match_scores", scoredState.getMatchScores());
        line.put("phase", scoredState.getPhase().name());
        line.put("duration_nanos", durationNanos);
        write("EPISODE_SUMMARY", line);
    }

    private static void write(String prefix, Map<String, Object> line) {
        try {
            String json = OBJECT_MAPPER.writeValueAsString(line);
            if (log.isInfoEnabled()) {
                log.info("{} {}", prefix, json);
            }
        } catch (JsonProcessingException e) {
            // Logging must never interfere with gameplay.
            log.warn("Failed to serialise {} line", prefix, e);
        }
    }

    private static List<String> ids(List<Card> cards) {
        List<String> out = new ArrayList<>(cards.size());
        for (Card c : cards) {
            out.add(c.getId());
        }
        return out;
    }
}
