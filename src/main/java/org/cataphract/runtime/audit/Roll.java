package org.cataphract.runtime.audit;

import java.util.List;

/**
 * One dice draw, with everything needed to reproduce it.
 *
 * @param context       Stable name of the draw, e.g. {@code "assault:7:attacker"}.
 * @param seed          Seed the dice were derived from.
 * @param notation      Dice notation, e.g. {@code "2d6"}.
 * @param faces         Individual die results; empty when a fixed override was used.
 * @param fixedOverride Caller-supplied total replacing the dice, or null.
 * @param total         The value the rules used.
 */
public record Roll(String context, long seed, String notation, List<Integer> faces, Integer fixedOverride, int total) {

    public Roll {
        faces = List.copyOf(faces);
    }

    public boolean isFixed() {
        return fixedOverride != null;
    }
}
