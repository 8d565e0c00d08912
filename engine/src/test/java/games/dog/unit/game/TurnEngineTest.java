package games.dog.unit.game;

import static games.dog.unit.helpers.DogTestHelper.assertConservation;
import static games.dog.unit.helpers.DogTestHelper.card;
import static games.dog.unit.helpers.DogTestHelper.gameWith;
import static games.dog.unit.helpers.DogTestHelper.marbleAt;
import static games.dog.unit.helpers.DogTestHelper.move;
import static games.dog.unit.helpers.DogTestHelper.positions;
import static org.junit.jupiter.api.Assertions.*;

import games.dog.game.Action;
import games.dog.game.DogGame;
import games.dog.game.GamePhase;
import games.dog.game.GameState;
import games.dog.game.InvalidActionException;
import games.dog.game.Marble;
import games.dog.game.RoundDealer;
import games.dog.game.Team;
import games.dog.unit.helpers.GameStateBuilder;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Applying actions: moves, captures, swaps, jokers, folds, the card exchange and turn order.
 *
 * <p>Every test checks card conservation after the action, since each one moves cards
 * between hands and piles.
 */
class TurnEngineTest {

    @Test
    void numberedCardMovesAndProtectsTheMarble() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "2♣", "5♥")
                .marble(0, 0, 10)
                .build());

        game.applyAction(move("2♣", 10, 12));

        GameState state = game.getState();
        Marble moved = marbleAt(state, 12);
        assertTrue(moved.isSave());
        assertEquals(List.of(card("5♥")), state.getPlayer(0).getHand());
        assertTrue(state.getDiscardPile().contains(card("2♣")));
        assertEquals(1, state.getActivePlayerIdx());
        assertConservation(state);
    }

    @Test
    void landingOnAMarbleSendsItHome() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "2♣")
                .marble(0, 0, 10)
                .marble(1, 0, 12)
                .build());

        game.applyAction(move("2♣", 10, 12));

        GameState state = game.getState();
        Marble captured = state.getPlayer(1).getMarbles().get(0);
        assertEquals(72, captured.getPos());
        assertFalse(captured.isSave());
        assertEquals(0, state.seatOf(marbleAt(state, 12)));
        assertConservation(state);
    }

    @Test
    void capturedMarbleTakesTheLowestFreeKennelSquare() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "3♠")
                .marble(0, 0, 10)
                .marble(1, 0, 30)
                .marble(1, 2, 13)
                .build());

        game.applyAction(move("3♠", 10, 13));

        // Squares 72 and 74 were free; 72 is taken.
        assertEquals(List.of(30, 73, 72, 75), positions(game.getState(), 1));
    }

    @Test
    void aceLeavesTheKennel() {
        DogGame game = gameWith(GameStateBuilder.newGame().hand(0, "A♠").build());

        game.applyAction(move("A♠", 64, 0));

        Marble out = marbleAt(game.getState(), 0);
        assertTrue(out.isSave());
        assertEquals(List.of(0, 65, 66, 67), positions(game.getState(), 0));
    }

    @Test
    void jokerLeavesTheKennelAndIsDiscarded() {
        DogGame game = gameWith(GameStateBuilder.newGame().hand(0, "JKR", "3♠").build());

        game.applyAction(move("JKR", 64, 0));

        GameState state = game.getState();
        assertEquals(List.of(0, 65, 66, 67), positions(state, 0));
        assertTrue(marbleAt(state, 0).isSave());
        assertEquals(List.of(card("3♠")), state.getPlayer(0).getHand());
        assertTrue(state.getDiscardPile().contains(card("JKR")));
        assertNull(state.getActiveCard());
        assertEquals(1, state.getActivePlayerIdx());
        assertConservation(state);
    }

    @Test
    void partnerMarbleMovesOnceOwnMarblesAreHome() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "2♣")
                .finished(0)
                .marble(2, 0, 30)
                .build());

        game.applyAction(move("2♣", 30, 32));

        GameState state = game.getState();
        Marble moved = state.getPlayer(2).getMarbles().get(0);
        assertEquals(32, moved.getPos());
        assertTrue(moved.isSave());
        assertTrue(state.getPlayer(0).getHand().isEmpty());
        assertEquals(1, state.getActivePlayerIdx());
        assertConservation(state);
    }

    @Test
    void partnerMarbleCannotMoveWhileOwnMarblesAreOut() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "2♣")
                .marble(2, 0, 30)
                .build());

        assertThrows(InvalidActionException.class, () -> game.applyAction(move("2♣", 30, 32)));
        assertEquals(30, game.getState().getPlayer(2).getMarbles().get(0).getPos());
    }

    @Test
    void jackSwapsPositionsExactly() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "J♥")
                .safeMarble(0, 0, 5)
                .marble(1, 0, 10)
                .build());

        game.applyAction(move("J♥", 5, 10));

        GameState state = game.getState();
        assertEquals(10, state.getPlayer(0).getMarbles().get(0).getPos());
        assertEquals(5, state.getPlayer(1).getMarbles().get(0).getPos());
        assertTrue(state.getPlayer(0).getMarbles().get(0).isSave());
        assertFalse(state.getPlayer(1).getMarbles().get(0).isSave());
        assertConservation(state);
    }

    @Test
    void noneFoldsTheHandAndPassesTheTurn() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "4♠", "Q♥")
                .hand(1, "2♣")
                .build());
        int discardBefore = game.getState().getDiscardPile().size();

        game.applyAction(null);

        GameState state = game.getState();
        assertTrue(state.getPlayer(0).getHand().isEmpty());
        assertEquals(discardBefore + 2, state.getDiscardPile().size());
        assertEquals(1, state.getActivePlayerIdx());
        assertConservation(state);
    }

    @Test
    void noneWithAnEmptyHandJustPassesTheTurn() {
        DogGame game = gameWith(GameStateBuilder.newGame().hand(1, "2♣").build());

        game.applyAction(null);

        assertEquals(1, game.getState().getActivePlayerIdx());
        assertEquals(1, game.getState().getRound());
    }

    @Test
    void jokerDeclaresACardAndIsDiscarded() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "JKR", "3♠")
                .safeMarble(0, 0, 5)
                .build());

        game.applyAction(Action.substitute(card("JKR"), card("2♣")));

        GameState state = game.getState();
        assertEquals(card("2♣"), state.getActiveCard());
        assertEquals(List.of(card("3♠")), state.getPlayer(0).getHand());
        assertTrue(state.getDiscardPile().contains(card("JKR")));
        assertEquals(0, state.getActivePlayerIdx());
        assertEquals(Set.of(move("2♣", 5, 7)), game.getListAction());
        assertConservation(state);

        game.applyAction(move("2♣", 5, 7));

        assertNull(state.getActiveCard());
        assertEquals(List.of(card("3♠")), state.getPlayer(0).getHand());
        assertEquals(1, state.getActivePlayerIdx());
        assertConservation(state);
    }

    @Test
    void jokerCannotBeAnythingButAceOrKingInTheBeginningPhase() {
        DogGame game = gameWith(GameStateBuilder.newGame().hand(0, "JKR").build());

        assertThrows(InvalidActionException.class,
                () -> game.applyAction(Action.substitute(card("JKR"), card("5♥"))));
        assertNull(game.getState().getActiveCard());
    }

    @Test
    void cardNotInHandIsRejectedWithoutChanges() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "5♥")
                .marble(0, 0, 10)
                .build());

        assertThrows(InvalidActionException.class, () -> game.applyAction(move("2♣", 10, 12)));

        GameState state = game.getState();
        assertEquals(List.of(10, 65, 66, 67), positions(state, 0));
        assertEquals(List.of(card("5♥")), state.getPlayer(0).getHand());
        assertEquals(0, state.getActivePlayerIdx());
    }

    @Test
    void moveWithoutAMarbleIsRejected() {
        DogGame game = gameWith(GameStateBuilder.newGame().hand(0, "2♣").build());

        assertThrows(InvalidActionException.class, () -> game.applyAction(move("2♣", 10, 12)));
    }

    @Test
    void fourCannotBePlayed() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "4♠")
                .marble(0, 0, 10)
                .build());

        assertThrows(InvalidActionException.class, () -> game.applyAction(move("4♠", 10, 14)));
        assertEquals(List.of(card("4♠")), game.getState().getPlayer(0).getHand());
    }

    @Test
    void cardExchangeGivesEachPartnerTheChosenCard() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .exchangePending()
                .hand(0, "2♣", "3♣")
                .hand(1, "5♣", "6♣")
                .hand(2, "8♣", "9♣")
                .hand(3, "10♣", "A♣")
                .build());
        GameState state = game.getState();

        game.applyAction(Action.exchange(card("2♣")));
        assertEquals(1, state.getActivePlayerIdx());
        assertEquals(card("2♣"), state.getExchangeCard(0));
        assertConservation(state);

        game.applyAction(Action.exchange(card("5♣")));
        game.applyAction(Action.exchange(card("8♣")));
        game.applyAction(Action.exchange(card("10♣")));

        assertTrue(state.isCardExchanged());
        assertEquals(0, state.getActivePlayerIdx());
        assertEquals(List.of(card("3♣"), card("8♣")), state.getPlayer(0).getHand());
        assertEquals(List.of(card("6♣"), card("10♣")), state.getPlayer(1).getHand());
        assertEquals(List.of(card("9♣"), card("2♣")), state.getPlayer(2).getHand());
        assertEquals(List.of(card("A♣"), card("5♣")), state.getPlayer(3).getHand());
        assertNull(state.getExchangeCard(2));
        assertConservation(state);
    }

    @Test
    void exchangeRequiresACardFromTheHand() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .exchangePending()
                .hand(0, "2♣")
                .build());

        assertThrows(InvalidActionException.class, () -> game.applyAction(null));
        assertThrows(InvalidActionException.class, () -> game.applyAction(Action.exchange(card("K♠"))));
        assertEquals(0, game.getState().getActivePlayerIdx());
    }

    @Test
    void lastTurnOfTheRoundDealsTheNextRound() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .active(3)
                .hand(3, "2♣")
                .safeMarble(3, 0, 50)
                .build());

        game.applyAction(move("2♣", 50, 52));

        GameState state = game.getState();
        assertEquals(2, state.getRound());
        assertEquals(1, state.getStartedPlayerIdx());
        assertEquals(1, state.getActivePlayerIdx());
        assertFalse(state.isCardExchanged());
        for (int seat = 0; seat < 4; seat++) {
            assertEquals(RoundDealer.cardsForRound(2), state.getPlayer(seat).getHand().size());
        }
        assertConservation(state);
    }

    @Test
    void bringingTheLastMarbleHomeWinsTheGame() {
        DogGame game = gameWith(GameStateBuilder.newGame()
                .hand(0, "3♠", "5♥")
                .safeMarble(0, 0, 62)
                .safeMarble(0, 1, 69)
                .safeMarble(0, 2, 70)
                .safeMarble(0, 3, 71)
                .finished(2)
                .build());

        game.applyAction(move("3♠", 62, 68));

        assertEquals(GamePhase.FINISHED, game.getState().getPhase());
        assertEquals(Optional.of(new Team(0, 2)), game.getWinner());
        assertTrue(game.getListAction().isEmpty());
        assertThrows(InvalidActionException.class, () -> game.applyAction(null));
    }
}
