package io.github.flock.rumor;

import com.google.common.math.IntMath;

import java.math.RoundingMode;

/**
 * Number of gossip rounds a changed rumor stays hot: {@code round(multiplier * (ceil(log2(n)) + 1))} for a
 * cluster of {@code n} members, or a fixed value when one is configured.
 */
public class RumorHeat {

    private final float multiplier;
    private final int fixed;

    private RumorHeat(float multiplier, int fixed) {
        this.multiplier = multiplier;
        this.fixed = fixed;
    }

    public static RumorHeat scaled(float multiplier) {
        return new RumorHeat(multiplier, 0);
    }

    public static RumorHeat fixed(int rounds) {
        return new RumorHeat(0, rounds);
    }

    public int maxHeat(int clusterSize) {
        if (fixed > 0) {
            return fixed;
        }
        if (clusterSize <= 1) {
            return 1;
        }
        int log2Ceiling = IntMath.log2(clusterSize, RoundingMode.CEILING);
        return Math.max(1, Math.round(multiplier * (log2Ceiling + 1)));
    }
}
