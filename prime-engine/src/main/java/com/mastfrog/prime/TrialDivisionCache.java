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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide table of confirmed primes, extended one candidate pair at a time
 * by trial division against the primes already found. Only numbers congruent
 * to 1 and 5 modulo 6 are examined, so 2 and 3 are never tried as divisors.
 * <p>
 * The divisor limit is tracked as an index into the table plus the square of
 * the prime just past it, so the square root of a candidate is never
 * computed.
 *
 * @author Tim Boudreau
 */
final class TrialDivisionCache {

    private static final Logger LOG = Logger.getLogger(TrialDivisionCache.class.getName());

    private final PrimeTable primes = new PrimeTable();
    // no primes lie between primes.last() and nextToCheck; nextToCheck % 6 == 1
    private long nextToCheck = 103;
    // index of the largest prime below sqrt(nextToCheck)
    private int divisorLimitIndex = 3;
    // square of the prime at divisorLimitIndex + 1
    private long divisorLimitNextSquared = 121;

    static TrialDivisionCache shared() {
        return Holder.INSTANCE;
    }

    /**
     * Get the prime at the passed zero-based index.
     *
     * @param index An index
     * @return A prime
     */
    synchronized long get(int index) {
        Checks.nonNegative("index", index);
        while (index >= primes.size()) {
            if (nextToCheck + 4 > divisorLimitNextSquared) {
                divisorLimitIndex++;
                long next = primes.get(divisorLimitIndex + 1);
                divisorLimitNextSquared = next * next;
            }
            int before = primes.size();
            if (hasNoDivisor(nextToCheck)) {
                primes.add(nextToCheck);
            }
            nextToCheck += 4;
            if (hasNoDivisor(nextToCheck)) {
                primes.add(nextToCheck);
            }
            nextToCheck += 2;
            logGrowth(before);
        }
        return primes.get(index);
    }

    synchronized int size() {
        return primes.size();
    }

    private boolean hasNoDivisor(long candidate) {
        for (int i = 2; i <= divisorLimitIndex; i++) {
            if (candidate % primes.get(i) == 0) {
                return false;
            }
        }
        return true;
    }

    private void logGrowth(int before) {
        int after = primes.size();
        if (after != before && Integer.highestOneBit(after) != Integer.highestOneBit(before)
                && LOG.isLoggable(Level.FINE)) {
            LOG.log(Level.FINE, "Trial division cache holds {0} primes, next candidate {1}",
                    new Object[]{after, nextToCheck});
        }
    }

    @Override
    public synchronized String toString() {
        return "TrialDivisionCache(" + primes + ", next " + nextToCheck + ")";
    }

    private static final class Holder {

        static final TrialDivisionCache INSTANCE = new TrialDivisionCache();
    }
}
