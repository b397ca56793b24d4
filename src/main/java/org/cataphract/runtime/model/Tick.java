package org.cataphract.runtime.model;

/**
 * A point on the campaign clock: a day and a part of that day.
 *
 * @param day  The day number, starting at 0.
 * @param part The part of the day.
 */
public record Tick(int day, DayPart part) implements Comparable<Tick> {

    public static final int PARTS_PER_DAY = DayPart.values().length;

    public Tick {
        if (day < 0) {
            throw new IllegalArgumentException("Day must not be negative: " + day);
        }
        if (part == null) {
            throw new IllegalArgumentException("Part must not be null");
        }
    }

    public static Tick of(int day, DayPart part) {
        return new Tick(day, part);
    }

    /**
     * @return the number of parts elapsed since day 0 morning.
     */
    public long index() {
        return (long) day * PARTS_PER_DAY + part.ordinal();
    }

    public Tick next() {
        return part == DayPart.NIGHT ? new Tick(day + 1, DayPart.MORNING) : new Tick(day, part.next());
    }

    /**
     * @param parts Number of day-parts to move forward, not negative.
     * @return the tick that many parts later.
     */
    public Tick plusParts(long parts) {
        long target = index() + parts;
        return new Tick((int) (target / PARTS_PER_DAY), DayPart.values()[(int) (target % PARTS_PER_DAY)]);
    }

    public boolean isAfter(Tick other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Tick other) {
        return Long.compare(index(), other.index());
    }

    @Override
    public String toString() {
        return "day " + day + " " + part.wireName();
    }
}
