package org.cataphract.runtime.rules;

import java.util.Locale;

/**
 * What befalls an army that fails a morale check, indexed by the failed 2d6 roll.
 * Low rolls are the worst.
 */
public enum MoraleConsequence {
    MUTINY(2),
    MASS_DESERTION(3),
    DETACHMENTS_DEFECT(4),
    MAJOR_DESERTION(5),
    ARMY_SPLITS(6),
    DETACHMENT_DEFECTS(7),
    DESERTION(8),
    DETACHMENTS_DEPART(9),
    CAMP_FOLLOWERS(10),
    DETACHMENT_DEPARTS(11),
    NO_CONSEQUENCE(12);

    private final int roll;

    MoraleConsequence(int roll) {
        this.roll = roll;
    }

    public int roll() {
        return roll;
    }

    /**
     * @param roll A 2d6 total; values outside 2..12 are clamped.
     */
    public static MoraleConsequence forRoll(int roll) {
        int clamped = Math.max(2, Math.min(12, roll));
        return values()[clamped - 2];
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
