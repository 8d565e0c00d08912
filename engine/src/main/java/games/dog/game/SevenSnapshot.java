package games.dog.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable copy of everything a seven may change, taken before its first step.
 * <p>
 * Restoring puts every marble (position and safe flag), every hand, the active card,
 * the step counter and the active seat back exactly as captured.
 *
 * @param marbles per seat, copies of the seat's marbles in order
 * @param hands per seat, copies of the seat's hand
 * @param activeCard the active card before the seven started, or null
 * @param stepsRemaining the seven step counter before the seven started
 * @param activePlayerIdx the active seat
 */
public record SevenSnapshot(
        List<List<Marble>> marbles,
        List<List<Card>> hands,
        Card activeCard,
        int stepsRemaining,
        int activePlayerIdx) {

    public static SevenSnapshot capture(GameState state) {
        List<List<Marble>> marbles = new ArrayList<>();
        List<List<Card>> hands = new ArrayList<>();
        for (PlayerState player : state.getPlayers()) {
            List<Marble> copies = new ArrayList<>();
            for (Marble marble : player.getMarbles()) {
                copies.add(marble.copy());
            }
            marbles.add(List.copyOf(copies));
            hands.add(List.copyOf(player.getHand()));
        }
        return new SevenSnapshot(
                List.copyOf(marbles),
                List.copyOf(hands),
                state.getActiveCard(),
                state.getSevenStepsRemaining(),
                state.getActivePlayerIdx());
    }

    /**
     * Writes the captured values back into {@code state}. Marble objects keep their
     * identity; only their fields are overwritten.
     */
    public void restore(GameState state) {
        for (int seat = 0; seat < marbles.size(); seat++) {
            PlayerState player = state.getPlayer(seat);
            List<Marble> saved = marbles.get(seat);
            for (int i = 0; i < saved.size(); i++) {
                Marble marble = player.getMarbles().get(i);
                marble.setPos(saved.get(i).getPos());
                marble.setSave(saved.get(i).isSave());
            }
            player.getHand().clear();
            player.getHand().addAll(hands.get(seat));
        }
        state.setActiveCard(activeCard);
        state.setSevenStepsRemaining(stepsRemaining);
        state.setActivePlayerIdx(activePlayerIdx);
    }
}
