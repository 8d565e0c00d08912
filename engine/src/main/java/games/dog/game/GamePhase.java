package games.dog.game;

/**
 * Lifecycle phase of a game.
 */
public enum GamePhase {
    /** Turns are being played. */
    RUNNING,
    /** A team has brought all eight marbles home; no further actions apply. */
    FINISHED
}
