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

/**
 * Zero-state source of prime candidates: 2, 3, 5, and then every number not
 * divisible by 2 or 3, reached by alternately adding 2 and 4. Cheap and
 * memory-free, but it emits composites such as 25 and 35 too, so it is only
 * suitable where a superset of the primes is good enough.
 *
 * @author Tim Boudreau
 */
final class CoarseFilter {

    private long value = 1;
    private int step;

    long succ() {
        if (step != 0) {
            value = Math.addExact(value, step);
            step = 6 - step;
        } else if (value == 1) {
            value = 2;
        } else if (value == 2) {
            value = 3;
        } else {
            value = 5;
            step = 2;
        }
        return value;
    }

    long current() {
        return value;
    }

    void rewind() {
        value = 1;
        step = 0;
    }

    @Override
    public String toString() {
        return "CoarseFilter(" + value + ", step " + step + ")";
    }
}
