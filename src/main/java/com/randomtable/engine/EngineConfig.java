package com.randomtable.engine;

import com.randomtable.engine.model.Metadata;

/** Generation limits. Document metadata may override each value for rolls in that document. */
public final class EngineConfig {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 50;
    public static final int DEFAULT_MAX_EXPLODING_DICE = 100;
    public static final int DEFAULT_MAX_INHERITANCE_DEPTH = 5;

    public int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
    public int maxExplodingDice = DEFAULT_MAX_EXPLODING_DICE;
    public int maxInheritanceDepth = DEFAULT_MAX_INHERITANCE_DEPTH;
    public UniqueOverflowBehavior uniqueOverflowBehavior = UniqueOverflowBehavior.STOP;

    public EngineConfig copy() {
        EngineConfig c = new EngineConfig();
        c.maxRecursionDepth = maxRecursionDepth;
        c.maxExplodingDice = maxExplodingDice;
        c.maxInheritanceDepth = maxInheritanceDepth;
        c.uniqueOverflowBehavior = uniqueOverflowBehavior;
        return c;
    }

    /** A copy with any values present in {@code meta} applied. */
    public EngineConfig withOverrides(Metadata meta) {
        EngineConfig c = copy();
        if (meta == null) return c;
        if (meta.maxRecursionDepth != null) c.maxRecursionDepth = meta.maxRecursionDepth;
        if (meta.maxExplodingDice != null) c.maxExplodingDice = meta.maxExplodingDice;
        if (meta.maxInheritanceDepth != null) c.maxInheritanceDepth = meta.maxInheritanceDepth;
        if (meta.uniqueOverflowBehavior != null) c.uniqueOverflowBehavior = meta.uniqueOverflowBehavior;
        return c;
    }
}
