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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factors integers by trial division against the values of a prime
 * generator, and multiplies factorizations back out.
 * <p>
 * The generator may emit composites as well as primes: by the time a
 * composite candidate comes up, every prime factor smaller than it has
 * already been divided out, so it can never divide what remains.
 *
 * @author Tim Boudreau
 */
public final class Factorizer {

    /**
     * Factor a value using candidates pulled from the generator from its
     * current position onward, honoring its upper bound.
     *
     * @param value A nonzero value
     * @param generator A generator that produces every prime in ascending
     * order, and possibly some composites
     * @return An unmodifiable list of prime powers, with primes in ascending
     * order, preceded by -1 if the value is negative
     * @throws ArithmeticException if the value is zero
     */
    public List<PrimePower> primeDivision(BigInteger value, PrimeGenerator generator) {
        Checks.notNull("value", value);
        Checks.notNull("generator", generator);
        if (value.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        List<PrimePower> result = new ArrayList<>();
        if (value.signum() < 0) {
            result.add(PrimePower.NEGATIVE_ONE);
            value = value.negate();
        }
        for (BigInteger prime : generator) {
            int count = 0;
            BigInteger quotient;
            for (;;) {
                BigInteger[] qr = value.divideAndRemainder(prime);
                quotient = qr[0];
                if (qr[1].signum() != 0) {
                    break;
                }
                value = quotient;
                count++;
            }
            if (count != 0) {
                result.add(new PrimePower(prime, count));
            }
            if (quotient.compareTo(prime) <= 0) {
                break;
            }
        }
        if (value.compareTo(BigInteger.ONE) > 0) {
            result.add(new PrimePower(value, 1));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Multiply out a factorization. The empty factorization is 1.
     *
     * @param factors Prime powers
     * @return Their product
     */
    public BigInteger intFromPrimeDivision(List<PrimePower> factors) {
        Checks.notNull("factors", factors);
        BigInteger result = BigInteger.ONE;
        for (PrimePower factor : factors) {
            result = result.multiply(factor.value());
        }
        return result;
    }
}
