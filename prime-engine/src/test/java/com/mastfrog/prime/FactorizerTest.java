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

import static com.mastfrog.prime.PrimeGeneratorTest.big;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 *
 * @author Tim Boudreau
 */
public class FactorizerTest {

    private final Factorizer factorizer = new Factorizer();
    private final PrimalityTester tester = new PrimalityTester();

    @Test
    public void testFortyFive() {
        assertEquals(Arrays.asList(PrimePower.of(3, 2), PrimePower.of(5, 1)),
                factorizer.primeDivision(big(45), new Generator23()));
        assertEquals(Arrays.asList(PrimePower.of(-1, 1), PrimePower.of(3, 2), PrimePower.of(5, 1)),
                factorizer.primeDivision(big(-45), new Generator23()));
        assertEquals(big(45), factorizer.intFromPrimeDivision(
                Arrays.asList(PrimePower.of(3, 2), PrimePower.of(5, 1))));
    }

    @Test(expected = ArithmeticException.class)
    public void testZero() {
        factorizer.primeDivision(BigInteger.ZERO, new Generator23());
    }

    @Test
    public void testUnits() {
        assertEquals(Collections.emptyList(), factorizer.primeDivision(BigInteger.ONE, new Generator23()));
        assertEquals(Collections.singletonList(PrimePower.of(-1, 1)),
                factorizer.primeDivision(big(-1), new EratosthenesGenerator()));
        assertEquals(BigInteger.ONE, factorizer.intFromPrimeDivision(Collections.emptyList()));
    }

    @Test
    public void testRoundTripsWithEveryGenerator() {
        Random rnd = new Random(5_318_008L);
        for (int i = 0; i < 1_500; i++) {
            long val = rnd.nextInt(2_000_000_001) - 1_000_000_000L;
            if (val == 0) {
                continue;
            }
            assertFactorization(val, new Generator23());
            assertFactorization(val, new EratosthenesGenerator());
            assertFactorization(val, new TrialDivisionGenerator());
        }
    }

    @Test
    public void testRoundTripsOfEdgeValues() {
        long[] vals = {1, -1, 2, -2, 4, 1 << 29, 999_999_937, -999_999_937, 1_000_000_000,
            -1_000_000_000, 999_999_999, 31_607L * 31_607L, 2 * 3 * 5 * 7 * 11 * 13 * 17 * 19 * 23};
        for (long val : vals) {
            assertFactorization(val, new Generator23());
            assertFactorization(val, new EratosthenesGenerator());
        }
    }

    @Test
    public void testLargePrimeFactor() {
        // 2^31 - 1 is prime
        BigInteger mersenne = BigInteger.ONE.shiftLeft(31).subtract(BigInteger.ONE);
        List<PrimePower> pd = factorizer.primeDivision(mersenne.multiply(big(12)), new Generator23());
        assertEquals(Arrays.asList(PrimePower.of(2, 2), PrimePower.of(3, 1), new PrimePower(mersenne, 1)), pd);
    }

    @Test
    public void testPrimePowers() {
        assertEquals(Collections.singletonList(PrimePower.of(2, 40)),
                factorizer.primeDivision(BigInteger.ONE.shiftLeft(40), new Generator23()));
        assertEquals(Collections.singletonList(PrimePower.of(7, 9)),
                factorizer.primeDivision(big(7).pow(9), new TrialDivisionGenerator()));
    }

    @Test
    public void testBoundedGeneratorLeavesRemainder() {
        // 35 * 143 = 5 * 7 * 11 * 13; candidates stop at 7
        List<PrimePower> pd = factorizer.primeDivision(big(5005), new EratosthenesGenerator(big(7)));
        assertEquals(Arrays.asList(PrimePower.of(5, 1), PrimePower.of(7, 1), PrimePower.of(143, 1)), pd);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultIsUnmodifiable() {
        factorizer.primeDivision(big(12), new Generator23()).add(PrimePower.of(5, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeExponentRejected() {
        PrimePower.of(3, -1);
    }

    @Test
    public void testPrimePowerToString() {
        assertEquals("3^2", PrimePower.of(3, 2).toString());
        assertEquals("5", PrimePower.of(5, 1).toString());
        assertEquals(big(9), PrimePower.of(3, 2).value());
    }

    private void assertFactorization(long val, PrimeGenerator gen) {
        List<PrimePower> pd = factorizer.primeDivision(big(val), gen);
        assertEquals("Round trip of " + val + " via " + pd, big(val), factorizer.intFromPrimeDivision(pd));
        BigInteger last = BigInteger.ONE;
        for (int i = 0; i < pd.size(); i++) {
            PrimePower pp = pd.get(i);
            if (i == 0 && val < 0) {
                assertEquals(PrimePower.of(-1, 1), pp);
                continue;
            }
            assertTrue("Not ascending in " + pd + " for " + val, pp.prime().compareTo(last) > 0);
            assertTrue("Not prime: " + pp + " in " + pd + " for " + val, tester.isPrime(pp.prime()));
            assertTrue(pp.exponent() >= 1);
            last = pp.prime();
        }
    }
}
