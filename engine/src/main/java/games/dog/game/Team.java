package games.dog.game;

/**
 * A pair of partner seats sitting opposite each other ({@code i} and {@code i+2}).
 *
 * @param firstSeat the lower seat index (0 or 1)
 * @param secondSeat the partner seat ({@code firstSeat + 2})
 */
public record Team(int firstSeat, int secondSeat) {

    public Team {
        if (firstSeat < 0 || firstSeat > 1 || secondSeat != firstSeat + 2) {
            throw new IllegalArgumentException("Not a team: " + firstSeat + "/" + secondSeat);
        }
    }

    /**
     * Returns the partner of {@code seat}, which sits two places away.
     */
    public static int partnerOf(int seat) {
        return (seat + 2) % Board.SEATS;
    }
}
