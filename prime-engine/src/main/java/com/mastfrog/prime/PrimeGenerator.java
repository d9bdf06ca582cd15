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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.ObjLongConsumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A stateful cursor over an ascending sequence of prime numbers, or of
 * pseudo-primes (a sequence which contains every prime but may contain some
 * composites as well), with an optional inclusive upper bound.
 * <p>
 * Implementations supply {@link #succ()}, {@link #rewind()} and the bound; the
 * bounded iteration, streaming and indexed iteration here are layered on top
 * of those and shared by every implementation. The iterator and stream share
 * the generator's own cursor, so consuming them advances the generator, and a
 * generator is not safe for use by more than one thread at a time.
 *
 * @author Tim Boudreau
 */
public interface PrimeGenerator extends Iterable<BigInteger> {

    /**
     * Advance the cursor and return the next value in the sequence. Ignores
     * the upper bound.
     *
     * @return The next prime or pseudo-prime
     */
    BigInteger succ();

    /**
     * Reset the cursor to the start of the sequence. The upper bound is left
     * as it is.
     */
    void rewind();

    /**
     * The inclusive upper bound for iteration, or null if unbounded.
     *
     * @return The bound or null
     */
    BigInteger upperBound();

    /**
     * Set the inclusive upper bound for iteration; null means iterate
     * forever.
     *
     * @param bound The bound or null
     */
    void upperBound(BigInteger bound);

    default BigInteger next() {
        return succ();
    }

    /**
     * Returns an iterator which pulls values from this generator until one
     * exceeds the upper bound. The value that exceeds the bound is consumed
     * from the generator but not returned.
     *
     * @return An iterator
     */
    @Override
    default Iterator<BigInteger> iterator() {
        return new Iterator<BigInteger>() {
            private BigInteger pending;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (done) {
                    return false;
                }
                if (pending == null) {
                    BigInteger candidate = succ();
                    BigInteger bound = upperBound();
                    if (bound != null && candidate.compareTo(bound) > 0) {
                        done = true;
                        return false;
                    }
                    pending = candidate;
                }
                return true;
            }

            @Override
            public BigInteger next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Past upper bound " + upperBound());
                }
                BigInteger result = pending;
                pending = null;
                return result;
            }
        };
    }

    default Stream<BigInteger> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL), false);
    }

    /**
     * Iterate the values within the bound, passing each with a running index.
     *
     * @param offset The index passed with the first value
     * @param consumer A consumer
     */
    default void withIndex(long offset, ObjLongConsumer<BigInteger> consumer) {
        long index = offset;
        for (BigInteger value : this) {
            consumer.accept(value, index++);
        }
    }
}
