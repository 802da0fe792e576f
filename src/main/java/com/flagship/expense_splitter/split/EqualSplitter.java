package com.flagship.expense_splitter.split;

import java.util.Arrays;

/**
 * Splits an amount of minor units among a number of members as evenly as possible.
 */
public final class EqualSplitter {

    private EqualSplitter() {
        // Utility class
    }

    /**
     * Every slot gets {@code total / among} (truncated toward zero). The leftover units are
     * handed out one per slot from index 0, in the direction of total's sign, so the result
     * sums to total exactly and no two slots differ by more than one unit.
     *
     * <pre>
     * splitEqualAmong(100, 9)  = [12, 11, 11, 11, 11, 11, 11, 11, 11]
     * splitEqualAmong(-100, 9) = [-12, -11, -11, -11, -11, -11, -11, -11, -11]
     * </pre>
     *
     * @throws IllegalArgumentException if among is not positive
     */
    public static long[] splitEqualAmong(long total, int among) {
        if (among <= 0) {
            throw new IllegalArgumentException("Cannot split among " + among + " members");
        }
        long base = total / among;
        // Java's remainder carries the sign of the dividend
        long remainder = total % among;

        long[] shares = new long[among];
        Arrays.fill(shares, base);
        long step = Long.signum(remainder);
        for (int i = 0; i < Math.abs(remainder); i++) {
            shares[i] += step;
        }
        return shares;
    }
}
