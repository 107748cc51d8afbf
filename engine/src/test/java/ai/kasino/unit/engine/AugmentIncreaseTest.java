package ai.kasino.unit.engine;

import static ai.kasino.unit.helpers.GameStateBuilder.card;
import static ai.kasino.unit.helpers.GameStateBuilder.cards;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.engine.KasinoEngine;
import ai.kasino.engine.MoveResult;
import ai.kasino.engine.RejectionReason;
import ai.kasino.game.ActionLog;
import ai.kasino.game.ActionType;
import ai.kasino.game.Build;
import ai.kasino.game.GameState;
import ai.kasino.unit.helpers.GameStateBuilder;
import ai.kasino.unit.helpers.GameStateTestHelper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AugmentIncreaseTest {

    private final KasinoEngine engine = new KasinoEngine(11, ActionLog.DEFAULT_CAPACITY,
            Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));

    private static void assertRejected(GameState state, MoveResult result, RejectionReason reason) {
        assertFalse(result.success, "expected " + reason);
        assertEquals(reason, result.reason, result.message);
        assertSame(state, result.state);
    }

    @Nested
    @DisplayName("augmentBuild")
    class Augment {

        private GameState ownBuildOfEight(String... hand) {
            return GameStateBuilder.twoPlayers()
                    .hand("p1", hand)
                    .table("6♥", "2♣", "3♥")
                    .pile("p2", "9♣", "5♦")
                    .build("p1", 8, "5♠ 3♦")
                    .build();
        }

        @Test
        void handCardOfTheValueBecomesANewGroup() {
            GameState state = ownBuildOfEight("8♥", "8♣");
            String id = state.getBuilds().get(0).getId();

            MoveResult result = engine.augmentBuild(state, id, List.of(), card("8♥"), null);

            assertTrue(result.success, result.message);
            Build build = result.state.getBuilds().get(0);
            assertEquals(id, build.getId());
            assertEquals(2, build.getCardGroups().size());
            assertEquals(cards("8♣"), result.state.getPlayer("p1").getHand());
            assertEquals(ActionType.BUILD_AUGMENT, result.state.getActionLog().last().type());
            GameStateTestHelper.assertFullDeck(result.state);
            GameStateTestHelper.assertBuildsConsistent(result.state);
        }

        @Test
        void tableCardsAloneCanFormTheGroup() {
            GameState state = ownBuildOfEight("8♣");
            String id = state.getBuilds().get(0).getId();

            MoveResult result = engine.augmentBuild(state, id, cards("6♥", "2♣"), null, null);

            assertTrue(result.success, result.message);
            assertEquals(cards("3♥"), result.state.getTableCards());
            assertEquals(4, result.state.getBuilds().get(0).cardCount());
        }

        @Test
        void stolenCardJoinsHandCard() {
            GameState state = ownBuildOfEight("3♠", "8♣");
            String id = state.getBuilds().get(0).getId();

            MoveResult result = engine.augmentBuild(state, id, List.of(), card("3♠"), card("5♦"));

            assertTrue(result.success, result.message);
            assertEquals(cards("9♣"), result.state.getPlayer("p2").getCapturePile());
            GameStateTestHelper.assertFullDeck(result.state);
        }

        @Test
        void rejections() {
            GameState state = ownBuildOfEight("8♥", "3♠", "2♠");
            String id = state.getBuilds().get(0).getId();

            assertRejected(state, engine.augmentBuild(state, "build_nope", List.of(), card("8♥"), null),
                    RejectionReason.UNKNOWN_BUILD);
            assertRejected(state, engine.augmentBuild(state, id, cards("3♥"), null, card("5♦")),
                    RejectionReason.STEAL_WITHOUT_HAND_CARD);
            assertRejected(state, engine.augmentBuild(state, id, cards("3♥"), card("2♠"), null),
                    RejectionReason.NO_EXACT_PARTITION);
            assertRejected(state, engine.augmentBuild(state, id, List.of(), card("3♠"), card("9♣")),
                    RejectionReason.CARD_NOT_STEALABLE);
            assertRejected(state, engine.augmentBuild(state, id, List.of(), null, null),
                    RejectionReason.NO_CARDS);
            // playing the only 8 would leave nothing to capture with
            assertRejected(state, engine.augmentBuild(state, id, List.of(), card("8♥"), null),
                    RejectionReason.NO_CAPTURING_CARD);
        }

        @Test
        void opponentCannotAugment() {
            GameState state = ownBuildOfEight("8♥").toBuilder().currentPlayerIndex(1).build();
            String id = state.getBuilds().get(0).getId();

            assertRejected(state, engine.augmentBuild(state, id, cards("6♥", "2♣"), null, null),
                    RejectionReason.NOT_BUILD_OWNER);
        }
    }

    @Nested
    @DisplayName("increaseBuild")
    class Increase {

        @Test
        void opponentBuildIsRaisedAndTakenOver() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "8♣")
                    .build("p2", 5, "3♦ 2♥")
                    .build();
            String id = state.getBuilds().get(0).getId();

            MoveResult result = engine.increaseBuild(state, id, card("3♠"));

            assertTrue(result.success, result.message);
            Build build = result.state.getBuilds().get(0);
            assertEquals(id, build.getId());
            assertEquals("p1", build.getOwnerId());
            assertEquals(8, build.getCaptureValue());
            assertEquals(1, build.getCardGroups().size());
            assertEquals(3, build.cardCount());
            assertEquals(ActionType.BUILD_INCREASE, result.state.getActionLog().last().type());
            GameStateTestHelper.assertFullDeck(result.state);
            GameStateTestHelper.assertBuildsConsistent(result.state);
        }

        @Test
        void increasedBuildMergesIntoOwnBuildOfNewValue() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "8♣")
                    .build("p1", 8, "6♠ 2♦")
                    .build("p2", 5, "4♦ A♥")
                    .build();
            String ownId = state.getBuilds().get(0).getId();
            String theirId = state.getBuilds().get(1).getId();

            MoveResult result = engine.increaseBuild(state, theirId, card("3♠"));

            assertTrue(result.success, result.message);
            assertEquals(1, result.state.getBuilds().size());
            Build merged = result.state.getBuilds().get(0);
            assertEquals(ownId, merged.getId());
            assertEquals(2, merged.getCardGroups().size());
            assertEquals(5, merged.cardCount());
            GameStateTestHelper.assertFullDeck(result.state);
            GameStateTestHelper.assertBuildsConsistent(result.state);
        }

        @Test
        void rejections() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "7♣", "2♣", "9♥")
                    .build("p2", 8, "5♠ 3♦")
                    .build("p2", 5, "3♣ 2♥", "4♦ A♥")
                    .build("p2", 7, "7♦")
                    .build();
            String eight = state.getBuilds().get(0).getId();
            String augmentedFive = state.getBuilds().get(1).getId();
            String seven = state.getBuilds().get(2).getId();

            assertRejected(state, engine.increaseBuild(state, eight, card("3♠")),
                    RejectionReason.VALUE_OUT_OF_RANGE);
            assertRejected(state, engine.increaseBuild(state, augmentedFive, card("2♣")),
                    RejectionReason.BUILD_AUGMENTED);
            assertRejected(state, engine.increaseBuild(state, seven, card("3♠")),
                    RejectionReason.NO_CAPTURING_CARD);
            assertRejected(state, engine.increaseBuild(state, seven, card("A♠")),
                    RejectionReason.CARD_NOT_IN_HAND);
            assertRejected(state, engine.increaseBuild(state, "build_nope", card("3♠")),
                    RejectionReason.UNKNOWN_BUILD);
        }

        @Test
        void cannotIncreaseOwnBuild() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "2♠", "8♣", "6♣")
                    .build("p1", 6, "4♦ 2♥")
                    .build();

            assertRejected(state, engine.increaseBuild(state, state.getBuilds().get(0).getId(), card("2♠")),
                    RejectionReason.OWN_BUILD);
        }

        @Test
        void ownerOfAnotherBuildCanTakeOverASecondOne() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "8♣", "9♣")
                    .build("p1", 9, "6♠ 3♦")
                    .build("p2", 5, "4♦ A♥")
                    .build();
            String nine = state.getBuilds().get(0).getId();
            String five = state.getBuilds().get(1).getId();

            MoveResult result = engine.increaseBuild(state, five, card("3♠"));

            assertTrue(result.success, result.message);
            assertEquals(2, result.state.getBuilds().size());
            assertEquals("p1", result.state.findBuild(nine).orElseThrow().getOwnerId());
            Build increased = result.state.findBuild(five).orElseThrow();
            assertEquals("p1", increased.getOwnerId());
            assertEquals(8, increased.getCaptureValue());
            assertEquals(cards("8♣", "9♣"), result.state.getPlayer("p1").getHand());
            GameStateTestHelper.assertFullDeck(result.state);
            GameStateTestHelper.assertBuildsConsistent(result.state);
        }

        @Test
        void cannotSpendTheLastCardForOwnBuild() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "5♣", "8♣")
                    .build("p1", 5, "4♠ A♦")
                    .build("p2", 3, "2♦ A♥")
                    .build();

            assertRejected(state, engine.increaseBuild(state, state.getBuilds().get(1).getId(), card("5♣")),
                    RejectionReason.NO_CAPTURING_CARD);
        }
    }
}
