package com.randomtable.engine;

/** Per-roll switches. */
public final class RollOptions {

    public static final RollOptions DEFAULT = new RollOptions(false);

    public final boolean enableTrace;

    public RollOptions(boolean enableTrace) {
        this.enableTrace = enableTrace;
    }

    public static RollOptions traced() {
        return new RollOptions(true);
    }
}
