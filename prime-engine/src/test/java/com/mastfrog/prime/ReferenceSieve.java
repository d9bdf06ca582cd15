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

import java.util.ArrayList;
import java.util.List;

/**
 * Plain, unsegmented sieve to check the real implementations against.
 */
final class ReferenceSieve {

    private final boolean[] composite;

    ReferenceSieve(int max) {
        composite = new boolean[max + 1];
        composite[0] = true;
        if (max >= 1) {
            composite[1] = true;
        }
        for (int i = 2; (long) i * i <= max; i++) {
            if (!composite[i]) {
                for (int j = i * i; j <= max; j += i) {
                    composite[j] = true;
                }
            }
        }
    }

    boolean isPrime(int value) {
        return !composite[value];
    }

    List<Long> primes() {
        List<Long> result = new ArrayList<>();
        for (int i = 2; i < composite.length; i++) {
            if (!composite[i]) {
                result.add((long) i);
            }
        }
        return result;
    }
}
