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

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import org.junit.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NodeIteratorTest extends AbstractTest {
    private SamplesNode<Integer> randomTree(int n) {
        SamplesNode<Integer> root = new SamplesNode<Integer>(Ordering.<Integer>natural(), randomIntBetween(3, 10));
        for (int i = 0; i < n; i++) {
            root.insert(randomIntBetween(-1000, 1000), 0);
        }
        return root;
    }

    @Test
    public void testVisitsEverythingInOrder() {
        for (int n : new int[]{0, 1, 2, 17, 500}) {
            SamplesNode<Integer> root = randomTree(n);
            int visited = 0;
            Integer previous = null;
            for (Sample<Integer> sample : root) {
                if (previous != null) {
                    assertTrue(previous <= sample.value());
                }
                previous = sample.value();
                visited++;
            }
            assertEquals(n, visited);
            assertEquals(root.size(), visited);
        }
    }

    @Test
    public void testIndependentTraversals() {
        SamplesNode<Integer> root = randomTree(100);
        Iterator<Sample<Integer>> a = root.iterator();
        a.next();
        a.next();
        List<Sample<Integer>> all = Lists.newArrayList(root.iterator());
        assertEquals(100, all.size());
        assertEquals(all.get(2), a.next());
    }

    @Test
    public void testEarlyStop() {
        SamplesNode<Integer> root = SamplesNode.build(samples(50), Ordering.<Integer>natural(), 4);
        Iterator<Sample<Integer>> it = root.iterator();
        for (int i = 0; i < 10; i++) {
            assertEquals(i, it.next().value().intValue());
        }
        assertTrue(it.hasNext());
    }

    @Test
    public void testExhausted() {
        Iterator<Sample<Integer>> it = SamplesNode.build(samples(2), Ordering.<Integer>natural(), 4).iterator();
        it.next();
        it.next();
        assertFalse(it.hasNext());
        try {
            it.next();
            fail("Should have thrown NoSuchElementException");
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNoRemove() {
        Iterator<Sample<Integer>> it = SamplesNode.build(samples(2), Ordering.<Integer>natural(), 4).iterator();
        it.next();
        it.remove();
    }

    private static List<Sample<Integer>> samples(int n) {
        List<Sample<Integer>> r = Lists.newArrayList();
        for (int i = 0; i < n; i++) {
            r.add(Sample.exact(i));
        }
        return r;
    }
}
