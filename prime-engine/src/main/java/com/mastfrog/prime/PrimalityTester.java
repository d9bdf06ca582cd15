/*
 * The MIT License
 *
 * Copyright 2017 Tim Boudreau.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.prime;

import com.mastfrog.util.preconditions.Checks;
import java.math.BigInteger;

/**
 * Decides primality of arbitrary integers. Between 0xffff and roughly
 * 3.3&times;10<sup>24</sup>, uses Miller-Rabin with a set of witness bases known
 * to be deterministic for numbers below the matching threshold (see
 * <a href="https://en.wikipedia.org/wiki/Miller%E2%80%93Rabin_primality_test">the
 * list of deterministic witness sets</a>). Outside that range it falls back to
 * trial division by a mod-30 wheel, which is always correct, and faster than
 * Miller-Rabin for small numbers, but slow for very large ones.
 *
 * @author Tim Boudreau
 */
public final class PrimalityTester {

    private static final BigInteger THIRTY = BigInteger.valueOf(30);
    private static final BigInteger FIVE = BigInteger.valueOf(5);
    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger TWO = BigInteger.valueOf(2);
    // below this, wheel division beats Miller-Rabin; the value has no deeper significance
    private static final BigInteger SMALL_NUMBER_LIMIT = BigInteger.valueOf(0xffff);
    private static final int[] WHEEL_OFFSETS = {0, 4, 6, 10, 12, 16, 22, 24};

    private static final BigInteger[] THRESHOLDS = {
        new BigInteger("1373653"),
        new BigInteger("9080191"),
        new BigInteger("25326001"),
        new BigInteger("3215031751"),
        new BigInteger("4759123141"),
        new BigInteger("1122004669633"),
        new BigInteger("2152302898747"),
        new BigInteger("3474749660383"),
        new BigInteger("341550071728321"),
        new BigInteger("3825123056546413051"),
        new BigInteger("318665857834031151167461"),
        new BigInteger("3317044064679887385961981")
    };

    private static final long[][] BASES = {
        {2, 3},
        {31, 73},
        {2, 3, 5},
        {2, 3, 5, 7},
        {2, 7, 61},
        {2, 13, 23, 1662803},
        {2, 3, 5, 7, 11},
        {2, 3, 5, 7, 11, 13},
        {2, 3, 5, 7, 11, 13, 17},
        {2, 3, 5, 7, 11, 13, 17, 19, 23},
        {2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37},
        {2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41}
    };

    public boolean isPrime(long value) {
        return isPrime(BigInteger.valueOf(value));
    }

    public boolean isPrime(BigInteger value) {
        Checks.notNull("value", value);
        if (value.compareTo(THREE) <= 0) {
            return value.compareTo(TWO) >= 0;
        }
        long[] bases = millerRabinBases(value);
        if (bases != null) {
            return millerRabin(value, bases);
        }
        return wheelDivision(value);
    }

    /**
     * Find the deterministic witness set for a value, or null if the value is
     * below the small-number limit or beyond the largest known threshold.
     */
    static long[] millerRabinBases(BigInteger value) {
        if (value.compareTo(SMALL_NUMBER_LIMIT) < 0) {
            return null;
        }
        for (int i = 0; i < THRESHOLDS.length; i++) {
            if (value.compareTo(THRESHOLDS[i]) < 0) {
                return BASES[i];
            }
        }
        return null;
    }

    static boolean millerRabin(BigInteger n, long[] bases) {
        if (!n.testBit(0)) {
            return false;
        }
        BigInteger nMinusOne = n.subtract(BigInteger.ONE);
        int s = nMinusOne.getLowestSetBit();
        BigInteger d = nMinusOne.shiftRight(s);
        for (long base : bases) {
            BigInteger a = BigInteger.valueOf(base);
            BigInteger x = a.modPow(d, n);
            if (x.equals(BigInteger.ONE) || x.equals(nMinusOne) || a.equals(n)) {
                continue;
            }
            boolean reachedMinusOne = false;
            for (int i = 1; i < s; i++) {
                x = x.multiply(x).mod(n);
                if (x.equals(nMinusOne)) {
                    reachedMinusOne = true;
                    break;
                }
            }
            if (!reachedMinusOne) {
                return false;
            }
        }
        return true;
    }

    static boolean wheelDivision(BigInteger n) {
        if (n.equals(FIVE)) {
            return true;
        }
        if (!THIRTY.gcd(n).equals(BigInteger.ONE)) {
            return false;
        }
        if (n.bitLength() < Long.SIZE - 1) {
            return wheelDivision(n.longValueExact());
        }
        BigInteger sqrt = n.sqrt();
        long root = sqrt.bitLength() < Long.SIZE - 1 ? sqrt.longValue() : Long.MAX_VALUE - 30;
        for (long p = 7; p <= root; p += 30) {
            for (int offset : WHEEL_OFFSETS) {
                if (n.mod(BigInteger.valueOf(p + offset)).signum() == 0) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean wheelDivision(long n) {
        long root = SegmentedSieveCache.isqrt(n);
        for (long p = 7; p <= root; p += 30) {
            for (int offset : WHEEL_OFFSETS) {
                if (n % (p + offset) == 0) {
                    return false;
                }
            }
        }
        return true;
    }
}
