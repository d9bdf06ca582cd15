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
 * Generates primes by walking the shared segmented sieve cache, which sieves
 * further segments as the cursor reaches its end.
 *
 * @author Tim Boudreau
 */
public final class EratosthenesGenerator implements PrimeGenerator {

    private final SegmentedSieveCache cache;
    private int lastPrimeIndex = -1;
    private BigInteger upperBound;

    public EratosthenesGenerator() {
        this(null);
    }

    public EratosthenesGenerator(BigInteger upperBound) {
        this(SegmentedSieveCache.shared(), upperBound);
    }

    EratosthenesGenerator(SegmentedSieveCache cache, BigInteger upperBound) {
        this.cache = Checks.notNull("cache", cache);
        this.upperBound = upperBound;
    }

    @Override
    public BigInteger succ() {
        return BigInteger.valueOf(cache.nthPrime(++lastPrimeIndex));
    }

    @Override
    public void rewind() {
        lastPrimeIndex = -1;
    }

    @Override
    public BigInteger upperBound() {
        return upperBound;
    }

    @Override
    public void upperBound(BigInteger bound) {
        this.upperBound = bound;
    }

    @Override
    public String toString() {
        return "EratosthenesGenerator(index " + lastPrimeIndex + ", bound " + upperBound + ")";
    }
}
