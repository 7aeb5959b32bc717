package com.randomtable.engine.dice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Dice notation: {@code NdS[k|kh|kl K][!][(+|-|*)M]}, case-insensitive, whitespace ignored.
 *
 * - {@code kh}/{@code k} keep highest K, {@code kl} keep lowest K
 * - {@code !} explodes on the maximum face, bounded by maxExplodingDice extra dice per roll
 *
 * Invalid notation throws IllegalArgumentException.
 */
public final class DiceRoller {

    public static final int MAX_DICE = 10_000;
    public static final int MAX_SIDES = 10_000;

    private static final Pattern DICE = Pattern.compile("^(\\d+)d(\\d+)(k[hl]?\\d+)?(!)?([+\\-*]\\d+)?$");
    private static final Pattern KEEP = Pattern.compile("k(h|l)?(\\d+)");

    private final Random random;

    public DiceRoller(Random random) {
        this.random = random;
    }

    public DiceRoller() {
        this(new Random());
    }

    private static final class Parsed {
        int count;
        int sides;
        Integer keepHighest;
        Integer keepLowest;
        boolean exploding;
        char modifierOp; // 0 when absent
        int modifierValue;
    }

    public DiceResult roll(String expression, int maxExplodingDice) {
        return evaluate(parse(expression), maxExplodingDice);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Parsed parse(String expression) {
        if (expression == null) throw new IllegalArgumentException("Invalid dice expression: null");
        String cleaned = expression.replaceAll("\\s", "").toLowerCase();
        Matcher m = DICE.matcher(cleaned);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid dice expression: " + expression);
        }

        Parsed p = new Parsed();
        try {
            p.count = Integer.parseInt(m.group(1));
            p.sides = Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Dice numbers out of range: " + expression, e);
        }
        if (p.count < 1 || p.sides < 1) {
            throw new IllegalArgumentException("Invalid dice: " + p.count + "d" + p.sides + " - count and sides must be positive");
        }
        if (p.count > MAX_DICE) {
            throw new IllegalArgumentException("Too many dice: " + p.count + "d" + p.sides + " - maximum 10,000 dice per roll");
        }
        if (p.sides > MAX_SIDES) {
            throw new IllegalArgumentException("Dice sides too large: " + p.count + "d" + p.sides + " - maximum 10,000 sides");
        }

        if (m.group(3) != null) {
            Matcher keep = KEEP.matcher(m.group(3));
            if (keep.matches()) {
                int value = Integer.parseInt(keep.group(2));
                if (value < 1 || value > p.count) {
                    throw new IllegalArgumentException("Cannot keep " + value + " dice from " + p.count + "d" + p.sides);
                }
                if ("l".equals(keep.group(1))) p.keepLowest = value;
                else p.keepHighest = value;
            }
        }

        p.exploding = m.group(4) != null;

        if (m.group(5) != null) {
            p.modifierOp = m.group(5).charAt(0);
            p.modifierValue = Integer.parseInt(m.group(5).substring(1));
        }
        return p;
    }

    private DiceResult evaluate(Parsed p, int maxExplodingDice) {
        List<Integer> rolls = new ArrayList<>();
        int explosions = 0;
        for (int i = 0; i < p.count; i++) {
            int roll = face(p.sides);
            rolls.add(roll);
            if (p.exploding) {
                while (roll == p.sides && explosions < maxExplodingDice) {
                    roll = face(p.sides);
                    rolls.add(roll);
                    explosions++;
                }
            }
        }

        List<Integer> kept;
        if (p.keepHighest != null) {
            kept = new ArrayList<>(rolls);
            kept.sort(Collections.reverseOrder());
            kept = new ArrayList<>(kept.subList(0, p.keepHighest));
        } else if (p.keepLowest != null) {
            kept = new ArrayList<>(rolls);
            Collections.sort(kept);
            kept = new ArrayList<>(kept.subList(0, p.keepLowest));
        } else {
            kept = rolls;
        }

        int base = 0;
        for (int k : kept) base += k;
        int total = base;
        switch (p.modifierOp) {
            case '+': total += p.modifierValue; break;
            case '-': total -= p.modifierValue; break;
            case '*': total *= p.modifierValue; break;
            default: break;
        }

        StringBuilder expr = new StringBuilder().append(p.count).append('d').append(p.sides);
        if (p.keepHighest != null) expr.append("kh").append(p.keepHighest);
        if (p.keepLowest != null) expr.append("kl").append(p.keepLowest);
        if (p.exploding) expr.append('!');
        if (p.modifierOp != 0) expr.append(p.modifierOp).append(p.modifierValue);

        StringBuilder breakdown = new StringBuilder("[").append(join(rolls)).append(']');
        if (p.keepHighest != null || p.keepLowest != null) {
            breakdown.append(" → keep [").append(join(kept)).append(']');
        }
        if (p.modifierOp != 0) {
            breakdown.append(" → ").append(base).append(' ').append(p.modifierOp).append(' ').append(p.modifierValue);
        }
        breakdown.append(" = ").append(total);

        return new DiceResult(total, rolls, kept, expr.toString(), breakdown.toString());
    }

    private int face(int sides) {
        return random.nextInt(sides) + 1;
    }

    private static String join(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
