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
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * The set of all prime numbers: primality tests, factorization and
 * enumeration in one place. Stateless apart from the process-wide prime
 * caches its generators share, so a single instance, {@link #instance()}, is
 * all anyone needs; {@link Primes} exposes it through static methods.
 *
 * @author Tim Boudreau
 */
@Singleton
public final class Prime {

    private static final Prime INSTANCE = new Prime(new PrimalityTester(), new Factorizer());

    private final PrimalityTester tester;
    private final Factorizer factorizer;

    @Inject
    public Prime(PrimalityTester tester, Factorizer factorizer) {
        this.tester = Checks.notNull("tester", tester);
        this.factorizer = Checks.notNull("factorizer", factorizer);
    }

    public static Prime instance() {
        return INSTANCE;
    }

    public boolean isPrime(long value) {
        return tester.isPrime(value);
    }

    public boolean isPrime(BigInteger value) {
        return tester.isPrime(value);
    }

    /**
     * Test primality by trial division against the values of a generator.
     * Much slower than {@link #isPrime(BigInteger)} for large values.
     *
     * @param value A value
     * @param generator A generator, consumed from its current position
     * @return true if the value is prime
     * @throws IllegalStateException if the generator's upper bound is reached
     * before the square root of the value, leaving primality undecided
     */
    public boolean isPrime(BigInteger value, PrimeGenerator generator) {
        Checks.notNull("value", value);
        Checks.notNull("generator", generator);
        if (value.compareTo(BigInteger.valueOf(2)) < 0) {
            return false;
        }
        for (BigInteger candidate : generator) {
            BigInteger[] qr = value.divideAndRemainder(candidate);
            if (qr[0].compareTo(candidate) < 0) {
                return true;
            }
            if (qr[1].signum() == 0) {
                return false;
            }
        }
        throw new IllegalStateException(generator + " ran out of candidates before the square root of "
                + value);
    }

    /**
     * Returns true if the passed object is an integral number which is prime.
     *
     * @param obj Anything, including null
     * @return Whether it is a prime
     */
    public boolean contains(Object obj) {
        if (obj instanceof BigInteger) {
            return isPrime((BigInteger) obj);
        }
        if (obj instanceof Long || obj instanceof Integer || obj instanceof Short || obj instanceof Byte) {
            return isPrime(((Number) obj).longValue());
        }
        return false;
    }

    public List<PrimePower> primeDivision(long value) {
        return primeDivision(BigInteger.valueOf(value));
    }

    public List<PrimePower> primeDivision(BigInteger value) {
        return primeDivision(value, new Generator23());
    }

    public List<PrimePower> primeDivision(BigInteger value, PrimeGenerator generator) {
        return factorizer.primeDivision(value, generator);
    }

    public BigInteger intFromPrimeDivision(List<PrimePower> factors) {
        return factorizer.intFromPrimeDivision(factors);
    }

    public PrimeGenerator each() {
        return each(null);
    }

    public PrimeGenerator each(BigInteger bound) {
        return each(bound, new EratosthenesGenerator());
    }

    /**
     * Bound a generator for iteration.
     *
     * @param bound The inclusive upper bound, or null for none
     * @param generator A generator
     * @return The same generator
     */
    public PrimeGenerator each(BigInteger bound, PrimeGenerator generator) {
        Checks.notNull("generator", generator);
        generator.upperBound(bound);
        return generator;
    }

    public Stream<BigInteger> stream() {
        return each().stream();
    }

    public List<BigInteger> first(int count) {
        Checks.nonNegative("count", count);
        return stream().limit(count).collect(Collectors.toList());
    }
}
