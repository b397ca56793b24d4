package org.cataphract.testutils;

import org.cataphract.runtime.spi.IRollSource;

/**
 * Roll source whose dice always show the same face, whatever it is derived for.
 */
public final class ScriptedRollSource implements IRollSource {

    private final int face;

    /**
     * @param face The face every die shows, starting at 1.
     */
    public ScriptedRollSource(int face) {
        if (face < 1) {
            throw new IllegalArgumentException("Face must be at least 1: " + face);
        }
        this.face = face;
    }

    @Override
    public long seed() {
        return face;
    }

    @Override
    public int nextInt(int bound) {
        return Math.min(face, bound) - 1;
    }

    @Override
    public IRollSource deriveFor(String scope, long key) {
        return this;
    }
}
