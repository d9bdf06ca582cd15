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
import org.junit.Test;
import static org.junit.Assert.*;

/**
 *
 * @author Tim Boudreau
 */
public class PrimalityTesterTest {

    private final PrimalityTester tester = new PrimalityTester();

    private static final String[] THRESHOLDS = {"1373653", "9080191", "25326001", "3215031751",
        "4759123141", "1122004669633", "2152302898747", "3474749660383", "341550071728321",
        "3825123056546413051", "318665857834031151167461"};

    @Test
    public void testAgreesWithSieveUpToAMillion() {
        ReferenceSieve ref = new ReferenceSieve(1_000_000);
        for (int i = 0; i <= 1_000_000; i++) {
            assertEquals("Wrong answer for " + i, ref.isPrime(i), tester.isPrime(i));
        }
    }

    @Test
    public void testSimpleCases() {
        assertFalse(tester.isPrime(57));
        assertTrue(tester.isPrime(97));
        assertFalse(tester.isPrime(-7));
        assertFalse(tester.isPrime(0));
        assertFalse(tester.isPrime(1));
        assertTrue(tester.isPrime(2));
        assertTrue(tester.isPrime(3));
        assertFalse(tester.isPrime(4));
        assertTrue(tester.isPrime(5));
        assertFalse(tester.isPrime(25));
        assertFalse(tester.isPrime(49));
        assertTrue(tester.isPrime(65_521));
        assertTrue(tester.isPrime(65_537));
        assertFalse(tester.isPrime(65_535));
    }

    @Test
    public void testStrongPseudoprimesAtThresholds() {
        // each is a strong pseudoprime to every base of the row below it
        for (String s : new String[]{"1373653", "25326001", "3215031751", "2152302898747",
            "3474749660383", "341550071728321", "3825123056546413051"}) {
            assertFalse(s, tester.isPrime(new BigInteger(s)));
        }
    }

    @Test
    public void testAgreesWithProbablePrimeAroundThresholds() {
        for (String s : THRESHOLDS) {
            BigInteger threshold = new BigInteger(s);
            for (int delta = -300; delta <= 300; delta++) {
                BigInteger val = threshold.add(BigInteger.valueOf(delta));
                assertEquals("Wrong answer for " + val, val.isProbablePrime(50), tester.isPrime(val));
            }
        }
    }

    @Test
    public void testBelowLargestThreshold() {
        BigInteger threshold = new BigInteger("3317044064679887385961981");
        for (int delta = 1; delta <= 300; delta++) {
            BigInteger val = threshold.subtract(BigInteger.valueOf(delta));
            assertEquals("Wrong answer for " + val, val.isProbablePrime(50), tester.isPrime(val));
        }
    }

    @Test
    public void testLargePrimesInTable() {
        assertTrue(tester.isPrime(new BigInteger("2305843009213693951"))); // 2^61 - 1
        assertTrue(tester.isPrime(2_147_483_647L)); // 2^31 - 1
        assertFalse(tester.isPrime(new BigInteger("2305843009213693953")));
        assertTrue(tester.isPrime(Long.MAX_VALUE - 24)); // largest long prime
        assertFalse(tester.isPrime(Long.MAX_VALUE));
    }

    @Test
    public void testBeyondTableFallsBackToWheel() {
        BigInteger last = new BigInteger("3317044064679887385961981");
        assertNull(PrimalityTester.millerRabinBases(last));
        assertFalse(tester.isPrime(last.add(BigInteger.ONE)));
        assertFalse(tester.isPrime(last.multiply(BigInteger.valueOf(7))));
        assertFalse(tester.isPrime(last.multiply(BigInteger.valueOf(37))));
        // 10^40 + 1 is divisible by 10^8 + 1 = 17 * 5882353
        assertFalse(tester.isPrime(BigInteger.TEN.pow(40).add(BigInteger.ONE)));
        assertFalse(tester.isPrime(BigInteger.valueOf(1_000_003).pow(5)));
    }

    @Test
    public void testBasisSelection() {
        assertNull(PrimalityTester.millerRabinBases(BigInteger.valueOf(0xfffe)));
        assertArrayEquals(new long[]{2, 3}, PrimalityTester.millerRabinBases(BigInteger.valueOf(0xffff)));
        assertArrayEquals(new long[]{31, 73}, PrimalityTester.millerRabinBases(new BigInteger("1373653")));
        assertArrayEquals(new long[]{2, 7, 61}, PrimalityTester.millerRabinBases(new BigInteger("4759123140")));
    }

    @Test
    public void testWheelDivisionDirectly() {
        ReferenceSieve ref = new ReferenceSieve(200_000);
        for (int i = 4; i <= 200_000; i++) {
            assertEquals("Wrong answer for " + i, ref.isPrime(i),
                    PrimalityTester.wheelDivision(BigInteger.valueOf(i)));
        }
    }
}
