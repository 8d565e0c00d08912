package games.dog.game;

/**
 * Thrown when a partial seven move asks for more squares than the seven has left.
 */
public class StepBudgetExceededException extends IllegalArgumentException {
    private final int requested;
    private final int remaining;

    public StepBudgetExceededException(int requested, int remaining) {
        super("Exceeded remaining steps for SEVEN: requested " + requested + ", remaining " + remaining);
        this.requested = requested;
        this.remaining = remaining;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemaining() {
        return remaining;
    }
}
