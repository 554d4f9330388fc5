/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.fastquantiles.stats;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single retained value of a {@link Sketch} together with its rank bookkeeping.
 * <p>
 * If {@code rmin} is the sum of {@code g} over this sample and every sample before it, the
 * true rank of {@code value} lies in {@code [rmin, rmin + delta]}.  Samples are immutable;
 * any change to the bookkeeping produces a new instance.
 */
public final class Sample<T> {
    private final T value;
    private final long g;
    private final long delta;

    public Sample(T value, long g, long delta) {
        Preconditions.checkNotNull(value, "Sample value");
        Preconditions.checkArgument(g >= 1, "g must be at least 1, got %s", g);
        Preconditions.checkArgument(delta >= 0, "delta must not be negative, got %s", delta);
        this.value = value;
        this.g = g;
        this.delta = delta;
    }

    /**
     * Creates a sample that is known to sit at an exact rank, such as a new minimum or maximum
     * or a value of an exact run.
     */
    public static <T> Sample<T> exact(T value) {
        return new Sample<T>(value, 1, 0);
    }

    /**
     * Folds {@code a} into its successor {@code b}.  The ranks {@code a} represented are now
     * represented by {@code b}, whose uncertainty does not change.
     *
     * @param a The sample being removed.
     * @param b The sample immediately after {@code a}.
     * @return The replacement for {@code b}.
     */
    public static <T> Sample<T> combineAdjacent(Sample<T> a, Sample<T> b) {
        return new Sample<T>(b.value, a.g + b.g, b.delta);
    }

    /**
     * @return true if {@code a} can be folded into its successor {@code b} without
     * {@code g + delta} of the result exceeding {@code cap}.
     */
    public static boolean isCompactable(Sample<?> a, Sample<?> b, long cap) {
        return a.g + b.g + b.delta <= cap;
    }

    /**
     * @return A copy of this sample that also represents one more rank, used when a recorded
     * value is dropped in favour of its successor.
     */
    Sample<T> absorb() {
        return new Sample<T>(value, g + 1, delta);
    }

    public T value() {
        return value;
    }

    public long g() {
        return g;
    }

    public long delta() {
        return delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sample)) {
            return false;
        }
        Sample<?> other = (Sample<?>) o;
        return g == other.g && delta == other.delta && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value, g, delta);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "value=" + value +
                ", g=" + g +
                ", delta=" + delta +
                '}';
    }
}
