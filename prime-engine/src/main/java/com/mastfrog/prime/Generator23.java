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

import java.math.BigInteger;

/**
 * Generates 2, 3 and then every integer not divisible by 2 or 3. A poor
 * pseudo-prime sequence, since a third of what it emits is composite, but it
 * needs no memory and no cache, which makes it the right choice for
 * factoring numbers which are not huge but have many small factors.
 *
 * @author Tim Boudreau
 */
public final class Generator23 implements PrimeGenerator {

    private final CoarseFilter filter = new CoarseFilter();
    private BigInteger upperBound;

    public Generator23() {
        this(null);
    }

    public Generator23(BigInteger upperBound) {
        this.upperBound = upperBound;
    }

    @Override
    public BigInteger succ() {
        return BigInteger.valueOf(filter.succ());
    }

    @Override
    public void rewind() {
        filter.rewind();
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
        return "Generator23(at " + filter.current() + ", bound " + upperBound + ")";
    }
}
