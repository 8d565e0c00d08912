package games.dog.game;

/**
 * A single marble: its square and whether it is safe.
 * <p>
 * A safe marble blocks every other marble, friend or foe, from moving through or
 * onto its square, and cannot be taken by a jack swap. Marbles never change owner;
 * the owner is the {@link PlayerState} holding them.
 */
public class Marble {
    private int pos;
    private boolean save;

    public Marble(int pos, boolean save) {
        this.pos = pos;
        this.save = save;
    }

    public int getPos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public boolean isSave() {
        return save;
    }

    public void setSave(boolean save) {
        this.save = save;
    }

    public Marble copy() {
        return new Marble(pos, save);
    }

    @Override
    public String toString() {
        return "Marble(pos=" + pos + (save ? ", safe" : "") + ")";
    }
}
