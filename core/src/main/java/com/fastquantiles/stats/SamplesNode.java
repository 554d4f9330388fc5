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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * A node of the tree of samples kept by a {@link Sketch}.
 * <p>
 * Each node holds a sorted run of at most {@code capacity} samples.  Everything in the left
 * subtree sorts before the run and everything in the right subtree sorts after it, so an in-order
 * walk yields all samples in ascending order.  Values that compare equal stay in the order they
 * were recorded.
 * <p>
 * The node also tracks the number of samples in its whole subtree, which lets callers check that
 * a traversal really visits everything.
 */
final class SamplesNode<T> implements Iterable<Sample<T>> {
    final List<Sample<T>> samples;
    SamplesNode<T> left;
    SamplesNode<T> right;

    private final Comparator<? super T> comparator;
    private final int capacity;
    private int size;

    SamplesNode(Comparator<? super T> comparator, int capacity) {
        this.comparator = comparator;
        this.capacity = capacity;
        this.samples = new ArrayList<Sample<T>>(capacity + 1);
    }

    /**
     * Builds a balanced tree out of samples that are already in ascending order.  Runs are only
     * filled halfway so that later insertions do not split them right away.
     *
     * @return The root of the new tree, an empty node if there are no samples.
     */
    static <T> SamplesNode<T> build(List<Sample<T>> sorted, Comparator<? super T> comparator, int capacity) {
        SamplesNode<T> root = build(sorted, 0, sorted.size(), comparator, capacity);
        if (root == null) {
            root = new SamplesNode<T>(comparator, capacity);
        }
        return root;
    }

    private static <T> SamplesNode<T> build(List<Sample<T>> sorted, int from, int to,
                                            Comparator<? super T> comparator, int capacity) {
        if (from >= to) {
            return null;
        }
        int fill = Math.max(1, capacity / 2);
        int start = from;
        int end = to;
        if (to - from > fill) {
            start = from + (to - from - fill) / 2;
            end = start + fill;
        }

        SamplesNode<T> node = new SamplesNode<T>(comparator, capacity);
        node.samples.addAll(sorted.subList(start, end));
        node.left = build(sorted, from, start, comparator, capacity);
        node.right = build(sorted, end, to, comparator, capacity);
        node.size = to - from;
        return node;
    }

    /**
     * Records a value below this node, which must be the root of its tree.
     * <p>
     * The value is placed after every retained sample that compares less than or equal to it.
     * The first retained sample after it, its successor, decides what happens:
     * <ul>
     * <li>no successor: the value is the new maximum and is kept exactly</li>
     * <li>the successor is the minimum: the value is the new minimum and is kept exactly</li>
     * <li>the successor can take one more rank without exceeding {@code cap}: the value is
     * dropped and the successor absorbs its rank</li>
     * <li>otherwise a new sample is kept whose uncertainty is bounded by the successor's</li>
     * </ul>
     *
     * @param value The value being recorded.
     * @param cap   The current limit on {@code g + delta}.
     * @return true if a new sample was kept, false if the value was absorbed by its successor.
     */
    boolean insert(T value, long cap) {
        List<SamplesNode<T>> path = new ArrayList<SamplesNode<T>>();
        SamplesNode<T> node = this;
        SamplesNode<T> successorNode = null;
        int successorIndex = -1;
        boolean newMinimum = true;
        boolean leftSpine = true;
        int position;

        while (true) {
            path.add(node);
            List<Sample<T>> run = node.samples;
            if (run.isEmpty()) {
                position = 0;
                break;
            }
            if (comparator.compare(value, run.get(0).value()) < 0) {
                successorNode = node;
                successorIndex = 0;
                if (node.left == null) {
                    position = 0;
                    break;
                }
                node = node.left;
                continue;
            }
            newMinimum = false;
            if (comparator.compare(value, run.get(run.size() - 1).value()) >= 0) {
                if (node.right == null) {
                    // successor, if any, was remembered on the way down
                    position = run.size();
                    break;
                }
                leftSpine = false;
                node = node.right;
                continue;
            }
            position = upperBound(run, value);
            successorNode = node;
            successorIndex = position;
            break;
        }

        Sample<T> successor = successorNode == null ? null : successorNode.samples.get(successorIndex);
        if (successor != null && !newMinimum && successor.g() + successor.delta() + 1 <= cap) {
            successorNode.samples.set(successorIndex, successor.absorb());
            return false;
        }

        Sample<T> sample;
        if (successor == null || newMinimum) {
            sample = Sample.exact(value);
        } else {
            sample = new Sample<T>(value, 1, successor.g() + successor.delta() - 1);
        }
        node.samples.add(position, sample);
        for (SamplesNode<T> n : path) {
            n.size++;
        }

        if (node.samples.size() > capacity) {
            int removed = node.compactRun(cap, leftSpine && node.left == null);
            for (SamplesNode<T> n : path) {
                n.size -= removed;
            }
            if (node.samples.size() > capacity) {
                node.split();
            }
        }
        return true;
    }

    private int upperBound(List<Sample<T>> run, T value) {
        int lo = 0;
        int hi = run.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (comparator.compare(run.get(mid).value(), value) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Compacts adjacent pairs inside this node's run.  Neighbours in other nodes are left to the
     * periodic compaction of the whole tree.
     *
     * @param cap          The current limit on {@code g + delta}.
     * @param holdsMinimum Whether the run starts with the minimum of the whole tree.
     * @return The number of samples that were removed.
     */
    int compactRun(long cap, boolean holdsMinimum) {
        int before = samples.size();
        SamplesCompressor<T> compressor = new SamplesCompressor<T>(cap, before, holdsMinimum);
        for (Sample<T> sample : samples) {
            compressor.push(sample);
        }
        List<Sample<T>> kept = compressor.finish();
        samples.clear();
        samples.addAll(kept);
        return before - kept.size();
    }

    /**
     * Keeps only the middle sample of an over-full run.  The lower half moves to a new left child
     * that adopts the current left subtree, the upper half to a new right child that adopts the
     * current right subtree.
     */
    void split() {
        int middle = samples.size() / 2;

        SamplesNode<T> lower = new SamplesNode<T>(comparator, capacity);
        lower.samples.addAll(samples.subList(0, middle));
        lower.left = left;
        lower.size = lower.samples.size() + sizeOf(left);

        SamplesNode<T> upper = new SamplesNode<T>(comparator, capacity);
        upper.samples.addAll(samples.subList(middle + 1, samples.size()));
        upper.right = right;
        upper.size = upper.samples.size() + sizeOf(right);

        Sample<T> pivot = samples.get(middle);
        samples.clear();
        samples.add(pivot);
        left = lower;
        right = upper;
    }

    private static int sizeOf(SamplesNode<?> node) {
        return node == null ? 0 : node.size;
    }

    /**
     * @return the number of samples in this subtree
     */
    int size() {
        return size;
    }

    /**
     * @return the number of levels of this subtree
     */
    int depth() {
        int l = left == null ? 0 : left.depth();
        int r = right == null ? 0 : right.depth();
        return Math.max(l, r) + 1;
    }

    Sample<T> first() {
        SamplesNode<T> node = this;
        while (node.left != null) {
            node = node.left;
        }
        return node.samples.isEmpty() ? null : node.samples.get(0);
    }

    Sample<T> last() {
        SamplesNode<T> node = this;
        while (node.right != null) {
            node = node.right;
        }
        return node.samples.isEmpty() ? null : node.samples.get(node.samples.size() - 1);
    }

    /**
     * Iterates through all samples of this subtree in ascending order.
     */
    @Override
    public Iterator<Sample<T>> iterator() {
        return new NodeIterator<T>(this);
    }

    /**
     * Verifies the ordering and bookkeeping of this subtree.
     *
     * @throws IllegalStateException if the subtree is broken.
     */
    void checkInvariants() {
        if (samples.isEmpty()) {
            if (left != null || right != null) {
                throw new IllegalStateException("Node without samples has children");
            }
        }
        if (samples.size() > capacity) {
            throw new IllegalStateException(String.format("Run of %d samples exceeds capacity %d", samples.size(), capacity));
        }
        if (size != samples.size() + sizeOf(left) + sizeOf(right)) {
            throw new IllegalStateException(String.format("Size %d doesn't match children %d + %d + %d",
                    size, sizeOf(left), samples.size(), sizeOf(right)));
        }
        for (int i = 1; i < samples.size(); i++) {
            if (comparator.compare(samples.get(i - 1).value(), samples.get(i).value()) > 0) {
                throw new IllegalStateException(String.format("Run out of order at %d: %s > %s",
                        i, samples.get(i - 1), samples.get(i)));
            }
        }
        if (left != null) {
            left.checkInvariants();
            if (comparator.compare(left.last().value(), samples.get(0).value()) > 0) {
                throw new IllegalStateException("Left subtree sorts after " + samples.get(0));
            }
        }
        if (right != null) {
            right.checkInvariants();
            if (comparator.compare(right.first().value(), samples.get(samples.size() - 1).value()) < 0) {
                throw new IllegalStateException("Right subtree sorts before " + samples.get(samples.size() - 1));
            }
        }
    }
}
