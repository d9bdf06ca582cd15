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
import java.util.List;
import java.util.stream.Stream;

/**
 * Static access to the shared {@link Prime} instance.
 *
 * @author Tim Boudreau
 */
public final class Primes {

    private Primes() {
        throw new AssertionError();
    }

    public static boolean isPrime(long value) {
        return Prime.instance().isPrime(value);
    }

    public static boolean isPrime(BigInteger value) {
        return Prime.instance().isPrime(value);
    }

    public static boolean isPrime(BigInteger value, PrimeGenerator generator) {
        return Prime.instance().isPrime(value, generator);
    }

    public static boolean contains(Object obj) {
        return Prime.instance().contains(obj);
    }

    public static List<PrimePower> primeDivision(long value) {
        return Prime.instance().primeDivision(value);
    }

    public static List<PrimePower> primeDivision(BigInteger value) {
        return Prime.instance().primeDivision(value);
    }

    public static List<PrimePower> primeDivision(BigInteger value, PrimeGenerator generator) {
        return Prime.instance().primeDivision(value, generator);
    }

    public static BigInteger intFromPrimeDivision(List<PrimePower> factors) {
        return Prime.instance().intFromPrimeDivision(factors);
    }

    public static PrimeGenerator each() {
        return Prime.instance().each();
    }

    public static PrimeGenerator each(BigInteger bound) {
        return Prime.instance().each(bound);
    }

    public static PrimeGenerator each(BigInteger bound, PrimeGenerator generator) {
        return Prime.instance().each(bound, generator);
    }

    public static Stream<BigInteger> stream() {
        return Prime.instance().stream();
    }

    public static List<BigInteger> first(int count) {
        return Prime.instance().first(count);
    }
}
