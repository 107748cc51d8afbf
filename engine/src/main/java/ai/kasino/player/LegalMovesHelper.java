package ai.kasino.player;

import ai.kasino.engine.CaptureOption;
import ai.kasino.engine.KasinoEngine;
import ai.kasino.game.Build;
import ai.kasino.game.Card;
import ai.kasino.game.GameState;
import ai.kasino.game.Player;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the commands the current player may issue, in the text form {@link MoveCommand} parses.
 * <p>
 * The list covers:
 * <ul>
 *   <li><b>capture</b>: every capture option of every hand card ({@code capture 7♠ 2}).</li>
 *   <li><b>build</b>: one hand card with one loose table card ({@code build 8 5♥ 3♣}).</li>
 *   <li><b>augment</b>: one hand card as a new group of the player's own build
 *       ({@code augment B1 8♦}).</li>
 *   <li><b>increase</b>: one hand card on an opponent's build ({@code increase B2 2♠}).</li>
 *   <li><b>drift</b>: every hand card, unless the player owns a build outside the second deal.</li>
 * </ul>
 * Multi-card builds and steals are legal too but are not enumerated. Every listed command is
 * checked against the engine, so applying it always succeeds.
 */
public final class LegalMovesHelper {
    private LegalMovesHelper() {
    }

    /**
     * Return all currently legal commands for the current player, without duplicates.
     */
    public static List<String> listLegalMoves(KasinoEngine engine, GameState state) {
        if (engine == null || state == null || !state.getPhase().isPlayable()) {
            return Collections.emptyList();
        }
        Player player = state.currentPlayer();
        Set<String> moves = new LinkedHashSet<>();

        for (Card card : player.getHand()) {
            List<CaptureOption> options = engine.findCaptures(state, card);
            for (int i = 1; i <= options.size(); i++) {
                moves.add("capture " + card.shortName() + " " + i);
            }
        }

        for (Card card : player.getHand()) {
            for (Card loose : state.getTableCards()) {
                int value = card.captureValue() + loose.captureValue();
                if (value > Card.MAX_RANK) {
                    continue;
                }
                if (engine.createBuild(state, card, List.of(loose), value, List.of()).success) {
                    moves.add("build " + value + " " + card.shortName() + " " + loose.shortName());
                }
            }
        }

        List<Build> builds = state.getBuilds();
        for (int b = 0; b < builds.size(); b++) {
            Build build = builds.get(b);
            String ref = "B" + (b + 1);
            boolean own = build.getOwnerId().equals(player.getId());
            for (Card card : player.getHand()) {
                if (own) {
                    if (engine.augmentBuild(state, build.getId(), List.of(), card, null).success) {
                        moves.add("augment " + ref + " " + card.shortName());
                    }
                } else if (engine.increaseBuild(state, build.getId(), card).success) {
                    moves.add("increase " + ref + " " + card.shortName());
                }
            }
        }

        if (state.canCurrentPlayerDrift()) {
            for (Card card : player.getHand()) {
                moves.add("drift " + card.shortName());
            }
        }
        return new ArrayList<>(moves);
    }
}
