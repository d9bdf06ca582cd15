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
import org.apache.lucene.util.OpenBitSet;

/**
 * Process-wide table of confirmed primes, extended on demand by sieving one
 * segment of odd numbers at a time over Lucene's OpenBitSet. Only the current
 * segment is held as bits; the primes already found are what prepare it.
 * <p>
 * A segment never reaches past twice the largest cached prime, so every
 * composite in it has a prime factor no larger than that prime and the cache
 * already knows every prime it needs to sieve with.
 *
 * @author Tim Boudreau
 */
final class SegmentedSieveCache {

    static final int DEFAULT_SEGMENT_SIZE = 1_000_000;
    private static final Logger LOG = Logger.getLogger(SegmentedSieveCache.class.getName());

    private final PrimeTable primes = new PrimeTable();
    private final int segmentSize;
    // always even
    private long maxChecked;

    SegmentedSieveCache() {
        this(DEFAULT_SEGMENT_SIZE);
    }

    SegmentedSieveCache(int segmentSize) {
        if (segmentSize <= 0 || segmentSize % 2 != 0) {
            throw new IllegalArgumentException("Segment size must be a positive even number, "
                    + "not " + segmentSize);
        }
        this.segmentSize = segmentSize;
        this.maxChecked = primes.last() + 1;
    }

    static SegmentedSieveCache shared() {
        return Holder.INSTANCE;
    }

    /**
     * Get the nth prime, counting from zero, sieving as many further segments
     * as needed to reach it.
     *
     * @param n A zero-based index
     * @return The prime at that index
     */
    synchronized long nthPrime(int n) {
        Checks.nonNegative("n", n);
        while (primes.size() <= n) {
            sieveSegment();
        }
        return primes.get(n);
    }

    synchronized int size() {
        return primes.size();
    }

    synchronized long maxChecked() {
        return maxChecked;
    }

    private void sieveSegment() {
        long maxCachedPrime = primes.last();
        if (maxCachedPrime > maxChecked) {
            maxChecked = maxCachedPrime + 1;
        }
        long segmentMin = maxChecked;
        long segmentMax = Math.min(segmentMin + segmentSize, Math.multiplyExact(maxCachedPrime, 2));
        long root = isqrt(segmentMax);
        // bit i stands for segmentMin + 1 + 2i
        long count = (segmentMax - segmentMin) / 2;
        OpenBitSet segment = new OpenBitSet(count);
        segment.set(0, count);
        for (int i = 1; i < primes.size(); i++) {
            long prime = primes.get(i);
            if (prime > root) {
                break;
            }
            long composite = Math.floorMod(-(segmentMin + 1 + prime) / 2, prime);
            for (; composite < count; composite += prime) {
                segment.fastClear(composite);
            }
        }
        int before = primes.size();
        for (long bit = segment.nextSetBit(0); bit >= 0; bit = segment.nextSetBit(bit + 1)) {
            primes.add(segmentMin + 1 + 2 * bit);
        }
        maxChecked = segmentMax;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.log(Level.FINE, "Sieved ({0}, {1}]: {2} new primes, {3} cached",
                    new Object[]{segmentMin, segmentMax, primes.size() - before, primes.size()});
        }
    }

    static long isqrt(long value) {
        long root = (long) Math.sqrt(value);
        while (root > value / Math.max(root, 1)) {
            root--;
        }
        while (root + 1 <= value / (root + 1)) {
            root++;
        }
        return root;
    }

    @Override
    public synchronized String toString() {
        return "SegmentedSieveCache(" + primes + ", checked to " + maxChecked + ")";
    }

    private static final class Holder {

        static final SegmentedSieveCache INSTANCE = new SegmentedSieveCache();
    }
}
