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

import java.util.Arrays;

/**
 * Append-only, growable array of confirmed primes backing the two caches.
 * Not thread-safe; callers guard it.
 *
 * @author Tim Boudreau
 */
final class PrimeTable {

    static final long[] SEED = new long[]{
        2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, 53, 59, 61,
        67, 71, 73, 79, 83, 89, 97, 101};

    private long[] primes;
    private int size;

    PrimeTable() {
        primes = Arrays.copyOf(SEED, 1024);
        size = SEED.length;
    }

    void add(long prime) {
        if (size == primes.length) {
            primes = Arrays.copyOf(primes, primes.length + (primes.length >> 1));
        }
        primes[size++] = prime;
    }

    long get(int index) {
        return primes[index];
    }

    long last() {
        return primes[size - 1];
    }

    int size() {
        return size;
    }

    @Override
    public String toString() {
        return "PrimeTable(" + size + " primes, last " + last() + ")";
    }
}
