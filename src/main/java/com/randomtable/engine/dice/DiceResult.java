package com.randomtable.engine.dice;

import java.util.Collections;
import java.util.List;

public final class DiceResult {
    public final int total;
    /** Every die rolled, including explosions, in roll order. */
    public final List<Integer> rolls;
    /** Dice counted toward the total. */
    public final List<Integer> kept;
    /** Normalized notation, e.g. {@code 4d6kh3+2}. */
    public final String expression;
    /** Human readable working, e.g. {@code [3, 5] → 8 + 2 = 10}. */
    public final String breakdown;

    public DiceResult(int total, List<Integer> rolls, List<Integer> kept, String expression, String breakdown) {
        this.total = total;
        this.rolls = Collections.unmodifiableList(rolls);
        this.kept = Collections.unmodifiableList(kept);
        this.expression = expression;
        this.breakdown = breakdown;
    }
}
