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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks all samples below a node in ascending order: the left subtree, then the node's own run,
 * then the right subtree.
 * <p>
 * The traversal is lazy, so callers can stop as soon as they have what they need.  It is a single
 * pass: once exhausted a new iterator has to be created.  The tree must not be modified while an
 * iterator over it is in use.
 */
class NodeIterator<T> implements Iterator<Sample<T>> {
    // nodes whose left subtree is being visited, innermost on top
    private final Deque<SamplesNode<T>> stack = new ArrayDeque<SamplesNode<T>>();

    private SamplesNode<T> current = null;
    private int index = 0;
    private Sample<T> next = null;

    NodeIterator(SamplesNode<T> root) {
        pushLeftSpine(root);
    }

    private void pushLeftSpine(SamplesNode<T> node) {
        while (node != null) {
            stack.push(node);
            node = node.left;
        }
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = computeNext();
        }
        return next != null;
    }

    @Override
    public Sample<T> next() {
        if (hasNext()) {
            Sample<T> r = next;
            next = null;
            return r;
        } else {
            throw new NoSuchElementException("Can't iterate past end of data");
        }
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException("Samples can only be removed by compaction");
    }

    // null once every run has been visited
    private Sample<T> computeNext() {
        while (true) {
            if (current != null) {
                if (index < current.samples.size()) {
                    return current.samples.get(index++);
                }
                // own run is done, the right subtree comes next
                SamplesNode<T> right = current.right;
                current = null;
                pushLeftSpine(right);
            }
            if (stack.isEmpty()) {
                return null;
            }
            current = stack.pop();
            index = 0;
        }
    }
}
