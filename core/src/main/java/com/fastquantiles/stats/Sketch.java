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

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Ordering;
import com.google.common.collect.PeekingIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Mergeable summary of a stream of ordered values that answers quantile queries with a bounded
 * rank error.
 * <p>
 * This is a variant of the epsilon-approximate summary by Greenwald and Khanna.  With
 * {@code n} values recorded, the value returned for a quantile {@code q} has a true rank within
 * {@code epsilon * n} of {@code q * n}, clamped to [1, n].  The minimum and the maximum are
 * always kept exactly.  Memory grows roughly as {@code (1 / epsilon) log(epsilon * n)}.
 * <p>
 * The retained samples live in a tree of sorted runs.  Recording a value either keeps a new
 * sample or lets the next retained sample absorb its rank, and every {@code ceil(1 / (2 epsilon))}
 * records the whole tree is compacted and rebuilt balanced.
 * <p>
 * Sketches built independently, for instance one per thread, can be combined with
 * {@link #merge(Sketch)}.  A sketch is not thread-safe: it must have a single owner while values
 * are recorded, and merging hands both operands over to the result.
 *
 * @param <T> The type of recorded values, totally ordered by the sketch's comparator.
 */
public class Sketch<T> {
    private static final Logger log = LoggerFactory.getLogger(Sketch.class);

    static final int MIN_NODE_CAPACITY = 3;
    private static final int SMALLEST_DEFAULT_CAPACITY = 8;
    private static final int LARGEST_DEFAULT_CAPACITY = 128;

    private final double epsilon;
    private final int nodeCapacity;
    private final Comparator<? super T> comparator;
    private final long compressFrequency;

    private SamplesNode<T> root;
    private long count = 0;
    private boolean consumed = false;

    /**
     * Creates a sketch for naturally ordered values with the default node capacity.
     *
     * @param epsilon The maximum rank error as a fraction of the number of values, in (0, 1).
     * @return the new, empty Sketch
     */
    public static <T extends Comparable<? super T>> Sketch<T> create(double epsilon) {
        return new Sketch<T>(epsilon, defaultNodeCapacity(epsilon), Ordering.<T>natural());
    }

    /**
     * Creates a sketch for values ordered by a comparator with the default node capacity.
     *
     * @param epsilon    The maximum rank error as a fraction of the number of values, in (0, 1).
     * @param comparator A total order over the values.
     * @return the new, empty Sketch
     */
    public static <T> Sketch<T> create(double epsilon, Comparator<? super T> comparator) {
        return new Sketch<T>(epsilon, defaultNodeCapacity(epsilon), comparator);
    }

    /**
     * Creates an empty sketch.
     *
     * @param epsilon      The maximum rank error as a fraction of the number of values, in (0, 1).
     * @param nodeCapacity The maximum number of samples per tree node, at least 3.  Larger nodes
     *                     give a shallower tree at the cost of slower insertion into each node.
     *                     This should be about sqrt(10 / epsilon).
     * @param comparator   A total order over the values.
     * @throws InvalidConfigurationException if epsilon or nodeCapacity is out of range.
     */
    public Sketch(double epsilon, int nodeCapacity, Comparator<? super T> comparator) {
        checkEpsilon(epsilon);
        if (nodeCapacity < MIN_NODE_CAPACITY) {
            throw new InvalidConfigurationException(String.format(
                    "Node capacity should be at least %d, got %d", MIN_NODE_CAPACITY, nodeCapacity));
        }
        this.epsilon = epsilon;
        this.nodeCapacity = nodeCapacity;
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
        this.compressFrequency = (long) Math.ceil(1 / (2 * epsilon));
        this.root = new SamplesNode<T>(comparator, nodeCapacity);
    }

    /**
     * @return A node capacity of about sqrt(10 / epsilon), kept between 8 and 128.
     */
    public static int defaultNodeCapacity(double epsilon) {
        checkEpsilon(epsilon);
        int capacity = (int) Math.ceil(Math.sqrt(10 / epsilon));
        return Math.max(SMALLEST_DEFAULT_CAPACITY, Math.min(LARGEST_DEFAULT_CAPACITY, capacity));
    }

    private static void checkEpsilon(double epsilon) {
        if (!(epsilon > 0 && epsilon < 1)) {
            throw new InvalidConfigurationException("Epsilon should be in (0,1), got " + epsilon);
        }
    }

    /**
     * Adds a value to the summary.
     *
     * @param value The value to record, never null.
     */
    public void record(T value) {
        Preconditions.checkNotNull(value, "Cannot record null");
        checkUsable();
        count++;
        root.insert(value, cap());
        if (count % compressFrequency == 0) {
            compress();
        }
    }

    /**
     * Forgets every sample that the current error bound allows to forget and rebalances the tree.
     * This happens periodically while recording, so calling it directly is only useful to get the
     * smallest possible summary, for example before keeping a sketch around for a long time.
     */
    public void compress() {
        checkUsable();
        int before = root.size();
        if (before <= 2) {
            return;
        }
        List<Sample<T>> kept = SamplesCompressor.compress(root.iterator(), cap(), before);
        root = SamplesNode.build(kept, comparator, nodeCapacity);
        log.debug("Compressed {} samples to {} after {} values", before, kept.size(), count);
    }

    /**
     * Combines this sketch with another one built from a different part of the stream.
     * <p>
     * For a sample {@code x} of one operand, let {@code y} be the last sample of the other operand
     * that sorts before {@code x} and {@code z} the first one after it.  The rank of {@code x} in
     * the union is bounded by
     * <pre>
     *     rmin(x) = rmin1(x) + rmin2(y)        (0 if there is no y)
     *     rmax(x) = rmax1(x) + rmax2(z) - 1    (rmax1(x) + n2 if there is no z)
     * </pre>
     * following Greenwald and Khanna, "Power-conserving computation of order-statistics over
     * sensor networks" (PODS 2004).  Any two neighbours of the union then satisfy
     * {@code g + delta <= floor(2 epsilon n1) + floor(2 epsilon n2) - 1 <= floor(2 epsilon (n1 + n2))},
     * so the result keeps the same epsilon.  Values that compare equal sort with this sketch's
     * samples first.
     * <p>
     * Both operands are consumed: neither can be used after this call.
     *
     * @param other A sketch with the same epsilon and an equal comparator.
     * @return A new sketch summarizing the values of both operands.
     * @throws IncompatibleMergeException if the epsilons or the comparators differ.
     */
    public Sketch<T> merge(Sketch<T> other) {
        Preconditions.checkNotNull(other, "other");
        Preconditions.checkArgument(other != this, "Cannot merge a sketch with itself");
        checkUsable();
        other.checkUsable();
        if (Double.compare(epsilon, other.epsilon) != 0) {
            throw new IncompatibleMergeException(String.format(
                    "Cannot merge sketches built with different epsilon (%s and %s)", epsilon, other.epsilon));
        }
        if (!comparator.equals(other.comparator)) {
            throw new IncompatibleMergeException(String.format(
                    "Cannot merge sketches ordered by different comparators (%s and %s)", comparator, other.comparator));
        }

        Sketch<T> result = new Sketch<T>(epsilon, nodeCapacity, comparator);
        result.count = count + other.count;
        List<Sample<T>> combined = combine(other);
        List<Sample<T>> kept = SamplesCompressor.compress(combined.iterator(), result.cap(), combined.size());
        result.root = SamplesNode.build(kept, comparator, nodeCapacity);
        log.debug("Merged sketches of {} and {} values into {} samples", count, other.count, kept.size());

        consume();
        other.consume();
        return result;
    }

    private List<Sample<T>> combine(Sketch<T> other) {
        PeekingIterator<Sample<T>> mine = Iterators.peekingIterator(root.iterator());
        PeekingIterator<Sample<T>> theirs = Iterators.peekingIterator(other.root.iterator());
        List<Sample<T>> combined = new ArrayList<Sample<T>>(root.size() + other.root.size());

        // rmin of the last sample taken from each side
        long myRank = 0;
        long theirRank = 0;
        long previous = 0;
        while (mine.hasNext() || theirs.hasNext()) {
            boolean takeMine = !theirs.hasNext()
                    || (mine.hasNext() && comparator.compare(mine.peek().value(), theirs.peek().value()) <= 0);
            Sample<T> x;
            long rmin;
            long rmax;
            if (takeMine) {
                x = mine.next();
                myRank += x.g();
                rmin = myRank + theirRank;
                rmax = myRank + x.delta() + maxRankBefore(theirs, theirRank, other.count);
            } else {
                x = theirs.next();
                theirRank += x.g();
                rmin = theirRank + myRank;
                rmax = theirRank + x.delta() + maxRankBefore(mine, myRank, count);
            }
            combined.add(new Sample<T>(x.value(), rmin - previous, rmax - rmin));
            previous = rmin;
        }
        return combined;
    }

    /**
     * @return the largest number of values from one operand that can sort before a sample
     * of the other operand, given the first sample of this operand that sorts after it
     */
    private static <T> long maxRankBefore(PeekingIterator<Sample<T>> next, long rankSoFar, long total) {
        if (!next.hasNext()) {
            return total;
        }
        Sample<T> z = next.peek();
        return rankSoFar + z.g() + z.delta() - 1;
    }

    /**
     * Merges a list of sketches by combining them pairwise, like a balanced tree, so that each
     * value takes part in about log2(k) merges.  All sketches of the list are consumed, except
     * when the list has a single element, which is returned as is.
     *
     * @param sketches The sketches to combine, at least one.
     * @return A sketch summarizing all values.
     */
    public static <T> Sketch<T> mergeAll(List<Sketch<T>> sketches) {
        Preconditions.checkArgument(!sketches.isEmpty(), "Need at least one sketch to merge");
        List<Sketch<T>> level = new ArrayList<Sketch<T>>(sketches);
        while (level.size() > 1) {
            List<Sketch<T>> next = new ArrayList<Sketch<T>>((level.size() + 1) / 2);
            for (int i = 0; i + 1 < level.size(); i += 2) {
                next.add(level.get(i).merge(level.get(i + 1)));
            }
            if (level.size() % 2 == 1) {
                next.add(level.get(level.size() - 1));
            }
            level = next;
        }
        return level.get(0);
    }

    /**
     * Finds a recorded value whose rank is close to {@code q * count()}.
     * <p>
     * The samples are scanned in ascending order, keeping track of the bounds
     * {@code [rmin, rmin + delta]} on each sample's rank.  The target rank {@code q * count()} is
     * not rounded, but it is clamped to {@code [1, count()]} since no value sits below rank 1.  The
     * sample with the smallest worst-case distance to the target wins, the later one on a tie, and
     * the scan stops as soon as no later sample can do as well.  Quantiles 0 and 1 always return
     * the exact minimum and maximum.
     * <p>
     * The distance is at most {@code epsilon * count()}, or half a rank while
     * {@code 2 * epsilon * count()} is below 1 and every value is still kept exactly.
     *
     * @param q The desired fraction, in [0, 1].
     * @return The value and its maximum rank error as a fraction of {@link #count()}.
     * @throws InvalidQuantileException if q is not in [0, 1].
     * @throws EmptySketchException     if nothing was recorded.
     */
    public QuantileEstimate<T> quantile(double q) {
        checkUsable();
        if (!(q >= 0 && q <= 1)) {
            throw new InvalidQuantileException(q);
        }
        if (count == 0) {
            throw new EmptySketchException();
        }

        double rank = Math.min(count, Math.max(1, q * count));
        Sample<T> best = null;
        double bestError = Double.POSITIVE_INFINITY;
        long rmin = 0;
        Iterator<Sample<T>> samples = root.iterator();
        while (samples.hasNext()) {
            Sample<T> sample = samples.next();
            rmin += sample.g();
            if (rmin - rank > bestError) {
                break;
            }
            double error = Math.max(rank - rmin, rmin + sample.delta() - rank);
            if (error <= bestError) {
                best = sample;
                bestError = error;
            }
        }
        return new QuantileEstimate<T>(best.value(), bestError / count);
    }

    /**
     * Returns the worst rank error any quantile query could currently have, as a fraction of
     * {@link #count()}.  This is at most epsilon once {@code 2 * epsilon * count()} reaches 1, and
     * usually well below it right after a compaction.
     */
    public double maxCurrentError() {
        checkUsable();
        if (count == 0) {
            return 0;
        }
        long worst = 0;
        boolean minimum = true;
        for (Sample<T> sample : root) {
            if (minimum) {
                minimum = false;
                continue;
            }
            worst = Math.max(worst, sample.g() + sample.delta());
        }
        return worst / (2.0 * count);
    }

    /**
     * Returns a new, empty sketch configured like this one.
     */
    Sketch<T> emptyCopy() {
        return new Sketch<T>(epsilon, nodeCapacity, comparator);
    }

    /**
     * Returns a new sketch configured like this one that holds the given values exactly.
     *
     * @param sorted Values in ascending order of this sketch's comparator.
     */
    Sketch<T> exactCopyOf(List<T> sorted) {
        List<Sample<T>> samples = new ArrayList<Sample<T>>(sorted.size());
        for (T value : sorted) {
            samples.add(Sample.exact(value));
        }
        Sketch<T> r = emptyCopy();
        r.root = SamplesNode.build(samples, comparator, nodeCapacity);
        r.count = sorted.size();
        return r;
    }

    /**
     * @return the current limit on {@code g + delta} for samples other than the minimum
     */
    long cap() {
        return (long) Math.floor(2 * epsilon * count);
    }

    /**
     * Returns the number of values recorded in this sketch.  If you want to know how many
     * samples are kept, try {@link #sampleCount()}.
     */
    public long count() {
        return count;
    }

    public double epsilon() {
        return epsilon;
    }

    public int nodeCapacity() {
        return nodeCapacity;
    }

    public Comparator<? super T> comparator() {
        return comparator;
    }

    /**
     * @return The number of samples currently retained.
     */
    public int sampleCount() {
        checkUsable();
        return root.size();
    }

    int depth() {
        return root.depth();
    }

    /**
     * Lets you go through the retained samples in ascending order.  Each call to
     * {@code iterator()} starts a new traversal.  The sketch must not be modified while a traversal
     * is in progress.
     */
    public Iterable<Sample<T>> samples() {
        checkUsable();
        return new Iterable<Sample<T>>() {
            @Override
            public Iterator<Sample<T>> iterator() {
                checkUsable();
                return root.iterator();
            }
        };
    }

    /**
     * Verifies all structural invariants of this sketch: ordering, bookkeeping of the tree, exact
     * edges, {@code sum(g) == count()} and the bound on {@code g + delta}.
     *
     * @throws IllegalStateException if anything is broken.
     */
    public void checkInvariants() {
        checkUsable();
        root.checkInvariants();

        long limit = Math.max(1, cap());
        long total = 0;
        int visited = 0;
        Sample<T> last = null;
        for (Sample<T> sample : root) {
            if (last == null) {
                if (sample.g() != 1 || sample.delta() != 0) {
                    throw new IllegalStateException("Minimum is not exact: " + sample);
                }
            } else if (sample.g() + sample.delta() > limit) {
                throw new IllegalStateException(String.format("%s exceeds g + delta <= %d", sample, limit));
            }
            total += sample.g();
            visited++;
            last = sample;
        }
        if (visited != root.size()) {
            throw new IllegalStateException(String.format("Traversal visited %d of %d samples", visited, root.size()));
        }
        if (total != count) {
            throw new IllegalStateException(String.format("Sum of g is %d but %d values were recorded", total, count));
        }
        if (last != null && last.delta() != 0) {
            throw new IllegalStateException("Maximum is not exact: " + last);
        }
    }

    private void checkUsable() {
        Preconditions.checkState(!consumed, "Sketch was consumed by a merge");
    }

    private void consume() {
        consumed = true;
        root = null;
    }

    @Override
    public String toString() {
        return "Sketch{" +
                "epsilon=" + epsilon +
                ", count=" + count +
                ", samples=" + (consumed ? "consumed" : root.size()) +
                '}';
    }
}
