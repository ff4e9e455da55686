package io.arrestx.extractor.engine;

/**
 * Detects a scan loop that keeps running without moving the line index.
 *
 * <p>The machine reports the index at the top of each iteration. Once the same index has been seen more than
 * {@code ceiling} times in a row, {@link #observe(int)} answers {@code true} and the counter starts over; the caller
 * is then expected to skip the line.
 */
public final class ProgressGuard {

    private final int ceiling;
    private int lastIndex = -1;
    private int repeats;

    public ProgressGuard(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be at least 1");
        }
        this.ceiling = ceiling;
    }

    public boolean observe(int index) {
        if (index != lastIndex) {
            lastIndex = index;
            repeats = 0;
            return false;
        }
        repeats++;
        if (repeats > ceiling) {
            repeats = 0;
            lastIndex = -1;
            return true;
        }
        return false;
    }

    public int ceiling() {
        return ceiling;
    }
}
