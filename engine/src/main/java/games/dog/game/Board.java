package games.dog.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Position space of the Dog board and the routes marbles take through it.
 * <p>
 * <strong>Layout</strong> for seat {@code i} (0–3):
 * <ul>
 *   <li><strong>Track:</strong> squares 0–63, circular and shared by all seats.
 *       Seat {@code i} enters the track at its start square {@code 16*i}.</li>
 *   <li><strong>Kennel:</strong> squares {@code 64+8i} to {@code 67+8i}.</li>
 *   <li><strong>Finish lane:</strong> squares {@code 68+8i} to {@code 71+8i}.</li>
 * </ul>
 * A marble on the track that walks past its own start square may turn into its
 * finish lane instead of continuing around the track. Routes list the squares a
 * marble steps on, excluding the square it starts from and including its destination.
 */
public final class Board {
    /** Number of squares on the shared track. */
    public static final int TRACK_SIZE = 64;
    /** Number of squares in a kennel and in a finish lane. */
    public static final int LANE_SIZE = 4;
    /** Number of seats at the table. */
    public static final int SEATS = 4;
    /** Marbles owned by each seat. */
    public static final int MARBLES_PER_SEAT = 4;

    private static final int SEAT_STRIDE = 8;
    private static final int START_STRIDE = TRACK_SIZE / SEATS;

    private Board() {
    }

    public static int startSquare(int seat) {
        return START_STRIDE * seat;
    }

    public static int kennelStart(int seat) {
        return TRACK_SIZE + SEAT_STRIDE * seat;
    }

    public static int finishStart(int seat) {
        return kennelStart(seat) + LANE_SIZE;
    }

    public static boolean isOnTrack(int pos) {
        return pos >= 0 && pos < TRACK_SIZE;
    }

    public static boolean isInKennel(int pos, int seat) {
        return pos >= kennelStart(seat) && pos < kennelStart(seat) + LANE_SIZE;
    }

    public static boolean isInFinish(int pos, int seat) {
        return pos >= finishStart(seat) && pos < finishStart(seat) + LANE_SIZE;
    }

    /**
     * Returns the number of forward squares from {@code pos} to the seat's start
     * square. A marble standing on its start square has a full lap ahead of it.
     *
     * @param seat the owning seat
     * @param pos a track square
     * @return the distance in squares, between 1 and {@link #TRACK_SIZE}
     */
    public static int distanceToStart(int seat, int pos) {
        int distance = Math.floorMod(startSquare(seat) - pos, TRACK_SIZE);
        return distance == 0 ? TRACK_SIZE : distance;
    }

    /**
     * Computes the squares walked when a seat's marble advances {@code steps} squares.
     *
     * @param seat the seat owning the marble
     * @param from the marble's current square
     * @param steps the number of squares to advance; must be positive
     * @param intoFinish {@code true} to turn into the finish lane, {@code false} to stay on the track
     * @return the squares stepped on in order (destination last), or {@code null} if
     *         the marble cannot make that walk
     */
    public static List<Integer> walk(int seat, int from, int steps, boolean intoFinish) {
        if (steps <= 0) {
            return null;
        }
        List<Integer> squares = new ArrayList<>(steps);
        if (isInFinish(from, seat)) {
            if (!intoFinish || from + steps >= finishStart(seat) + LANE_SIZE) {
                return null;
            }
            for (int i = 1; i <= steps; i++) {
                squares.add(from + i);
            }
            return squares;
        }
        if (!isOnTrack(from)) {
            return null;
        }
        if (!intoFinish) {
            for (int i = 1; i <= steps; i++) {
                squares.add((from + i) % TRACK_SIZE);
            }
            return squares;
        }
        int toStart = distanceToStart(seat, from);
        int inLane = steps - toStart;
        if (inLane <= 0 || inLane > LANE_SIZE) {
            return null;
        }
        for (int i = 1; i <= toStart; i++) {
            squares.add((from + i) % TRACK_SIZE);
        }
        for (int i = 0; i < inLane; i++) {
            squares.add(finishStart(seat) + i);
        }
        return squares;
    }

    /**
     * Returns how many squares a forward move from {@code from} to {@code to} covers
     * for a marble of the given seat.
     * <ul>
     *   <li>track to track: {@code (to - from) mod 64}</li>
     *   <li>track to own finish lane: distance to the start square plus
     *       {@code to - finishStart + 1}</li>
     *   <li>finish lane to finish lane: {@code to - from}</li>
     * </ul>
     *
     * @return the step count, or {@code -1} if no forward move connects the squares
     */
    public static int stepCost(int seat, int from, int to) {
        if (isOnTrack(from) && isOnTrack(to)) {
            int cost = Math.floorMod(to - from, TRACK_SIZE);
            return cost == 0 ? -1 : cost;
        }
        if (isOnTrack(from) && isInFinish(to, seat)) {
            return distanceToStart(seat, from) + (to - finishStart(seat)) + 1;
        }
        if (isInFinish(from, seat) && isInFinish(to, seat) && to > from) {
            return to - from;
        }
        return -1;
    }

    /**
     * Returns the route of a forward move from {@code from} to {@code to}, as
     * measured by {@link #stepCost(int, int, int)}.
     *
     * @return the squares stepped on (destination last), or {@code null} if unreachable
     */
    public static List<Integer> route(int seat, int from, int to) {
        int cost = stepCost(seat, from, to);
        if (cost < 0) {
            return null;
        }
        List<Integer> squares = walk(seat, from, cost, isInFinish(to, seat));
        if (squares == null || squares.get(squares.size() - 1) != to) {
            return null;
        }
        return squares;
    }
}
