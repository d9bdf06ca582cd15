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
 * One entry of a prime factorization: a prime and its multiplicity. A
 * factorization of a negative number starts with the pseudo-factor -1 raised
 * to the first power.
 *
 * @author Tim Boudreau
 */
public final class PrimePower {

    static final PrimePower NEGATIVE_ONE = new PrimePower(BigInteger.ONE.negate(), 1);

    private final BigInteger prime;
    private final int exponent;

    public PrimePower(BigInteger prime, int exponent) {
        this.prime = Checks.notNull("prime", prime);
        Checks.nonNegative("exponent", exponent);
        this.exponent = exponent;
    }

    public static PrimePower of(long prime, int exponent) {
        return new PrimePower(BigInteger.valueOf(prime), exponent);
    }

    public BigInteger prime() {
        return prime;
    }

    public int exponent() {
        return exponent;
    }

    public BigInteger value() {
        return prime.pow(exponent);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof PrimePower)) {
            return false;
        }
        PrimePower other = (PrimePower) o;
        return exponent == other.exponent && prime.equals(other.prime);
    }

    @Override
    public int hashCode() {
        return prime.hashCode() * 31 + exponent;
    }

    @Override
    public String toString() {
        return exponent == 1 ? prime.toString() : prime + "^" + exponent;
    }
}
