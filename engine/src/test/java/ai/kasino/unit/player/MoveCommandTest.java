package ai.kasino.unit.player;

import static ai.kasino.unit.helpers.GameStateBuilder.card;
import static ai.kasino.unit.helpers.GameStateBuilder.cards;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.kasino.engine.KasinoEngine;
import ai.kasino.engine.MoveResult;
import ai.kasino.engine.RejectionReason;
import ai.kasino.game.ActionType;
import ai.kasino.game.GameState;
import ai.kasino.player.MoveCommand;
import ai.kasino.unit.helpers.GameStateBuilder;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MoveCommandTest {

    private final KasinoEngine engine = new KasinoEngine();

    @Nested
    class Parsing {

        @Test
        void captureDefaultsToFirstOption() {
            MoveCommand command = MoveCommand.parse("capture 7♠");
            assertEquals(MoveCommand.Kind.CAPTURE, command.getKind());
            assertEquals(1, command.getNumber());
            assertEquals(List.of("7♠"), command.getCardTokens());
        }

        @Test
        void keywordsAreCaseInsensitiveAndSpacingIsLoose() {
            MoveCommand command = MoveCommand.parse("  BUILD  8   3s  5d ");
            assertEquals(MoveCommand.Kind.BUILD, command.getKind());
            assertEquals(8, command.getNumber());
            assertEquals(List.of("3s", "5d"), command.getCardTokens());
        }

        @Test
        void buildReferencesAreNumbered() {
            assertEquals(2, MoveCommand.parse("augment B2 8♥").getNumber());
            assertEquals(1, MoveCommand.parse("increase b1 3♠").getNumber());
            assertNull(MoveCommand.parse("drift 3♠").getNumber());
        }

        @Test
        void textRoundTrips() {
            for (String text : List.of("capture 7♠ 2", "drift 3♠", "build 8 3♠ 5♦", "augment B1 8♥", "increase B2 3♠")) {
                assertEquals(text, MoveCommand.parse(text).toString());
            }
        }

        @Test
        void malformedCommandsAreRejected() {
            for (String text : new String[] {"", "jump 7♠", "capture", "capture 7♠ x", "drift",
                    "build x 7♠ 3♥", "build 8 7♠", "augment 1 8♥", "increase B1", "increase Bx 3♠"}) {
                assertThrows(IllegalArgumentException.class, () -> MoveCommand.parse(text), text);
            }
        }
    }

    @Nested
    class Applying {

        @Test
        void secondCaptureOptionIsChosen() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "7♠")
                    .table("3♥", "4♣", "4♦")
                    .build();
            MoveResult first = MoveCommand.parse("capture 7♠ 1").apply(engine, state);
            MoveResult second = MoveCommand.parse("capture 7♠ 2").apply(engine, state);

            assertTrue(first.success);
            assertTrue(second.success);
            assertEquals(1, first.state.getTableCards().size());
            assertFalse(first.state.getTableCards().equals(second.state.getTableCards()));
        }

        @Test
        void captureProblemsAreRejections() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "7♠", "9♠")
                    .table("7♦")
                    .build();

            MoveResult nothing = MoveCommand.parse("capture 9♠").apply(engine, state);
            MoveResult outOfRange = MoveCommand.parse("capture 7♠ 2").apply(engine, state);
            MoveResult notHeld = MoveCommand.parse("capture 7♦").apply(engine, state);

            assertEquals(RejectionReason.NO_CAPTURE, nothing.reason);
            assertEquals(RejectionReason.NO_CAPTURE, outOfRange.reason);
            assertEquals(RejectionReason.CARD_NOT_IN_HAND, notHeld.reason);
            assertSame(state, outOfRange.state);
        }

        @Test
        void tokensResolveToOpponentPileTop() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "8♣")
                    .pile("p2", "9♣", "5♦")
                    .build();

            MoveResult result = MoveCommand.parse("build 8 3s 5d").apply(engine, state);

            assertTrue(result.success, result.message);
            assertEquals(ActionType.STEAL_AND_BUILD, result.state.getActionLog().last().type());
            assertEquals(cards("9♣"), result.state.getPlayer("p2").getCapturePile());
        }

        @Test
        void secondTokenFromOnePileReachesTheCardBeneath() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "3♠", "9♥")
                    .pile("p2", "A♣", "2♣", "4♦")
                    .build();

            MoveResult result = MoveCommand.parse("build 9 3♠ 4♦ 2♣").apply(engine, state);

            assertTrue(result.success, result.message);
            assertEquals(cards("A♣"), result.state.getPlayer("p2").getCapturePile());
            assertEquals(3, result.state.getBuilds().get(0).cardCount());

            MoveResult wrongOrder = MoveCommand.parse("build 9 3♠ 2♣ 4♦").apply(engine, state);
            assertFalse(wrongOrder.success);
            assertEquals(RejectionReason.CARD_NOT_ON_TABLE, wrongOrder.reason);
        }

        @Test
        void augmentMixesHandAndTableCards() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "6♥", "8♣")
                    .table("2♣")
                    .build("p1", 8, "5♠ 3♦")
                    .build();

            MoveResult result = MoveCommand.parse("augment B1 6♥ 2♣").apply(engine, state);

            assertTrue(result.success, result.message);
            assertEquals(2, result.state.getBuilds().get(0).getCardGroups().size());
            assertEquals(List.of(card("8♣")), result.state.getPlayer("p1").getHand());
        }

        @Test
        void unknownBuildAndUnknownCard() {
            GameState state = GameStateBuilder.twoPlayers()
                    .hand("p1", "8♥", "8♣")
                    .build("p1", 8, "5♠ 3♦")
                    .build();

            assertEquals(RejectionReason.UNKNOWN_BUILD,
                    MoveCommand.parse("augment B3 8♥").apply(engine, state).reason);
            assertEquals(RejectionReason.CARD_NOT_ON_TABLE,
                    MoveCommand.parse("augment B1 8♥ 7♦").apply(engine, state).reason);
            assertEquals(RejectionReason.CARD_NOT_IN_HAND,
                    MoveCommand.parse("increase B1 2♥").apply(engine, state).reason);
        }
    }
}
