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
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SamplesCompressorTest extends AbstractTest {
    private static List<Sample<Integer>> uncertain(int n, long delta) {
        List<Sample<Integer>> r = Lists.newArrayList();
        for (int i = 0; i < n; i++) {
            r.add(new Sample<Integer>(i, 1, delta));
        }
        return r;
    }

    @Test
    public void testCompress() {
        List<Sample<Integer>> r = SamplesCompressor.compress(uncertain(9, 2).iterator(), 5, 9);
        assertEquals(Lists.newArrayList(
                new Sample<Integer>(0, 1, 2),
                new Sample<Integer>(3, 3, 2),
                new Sample<Integer>(6, 3, 2),
                new Sample<Integer>(8, 2, 2)), r);
    }

    @Test
    public void testPreservesTotal() {
        List<Sample<Integer>> input = uncertain(1000, 3);
        List<Sample<Integer>> r = SamplesCompressor.compress(input.iterator(), 40, input.size());
        long total = 0;
        for (Sample<Integer> sample : r) {
            total += sample.g();
            assertTrue(sample.g() + sample.delta() <= 40);
        }
        assertEquals(1000, total);
        assertEquals(0, r.get(0).value().intValue());
        assertEquals(999, r.get(r.size() - 1).value().intValue());
        assertTrue(r.size() < 40);
    }

    @Test
    public void testNothingToCompact() {
        List<Sample<Integer>> input = uncertain(10, 0);
        assertEquals(input, SamplesCompressor.compress(input.iterator(), 1, input.size()));
    }

    @Test
    public void testEmpty() {
        assertTrue(SamplesCompressor.compress(uncertain(0, 0).iterator(), 10, 0).isEmpty());
    }

    @Test
    public void testFirstOnlyKeptWhenAsked() {
        SamplesCompressor<Integer> compressor = new SamplesCompressor<Integer>(10, 3, false);
        for (Sample<Integer> sample : uncertain(3, 0)) {
            compressor.push(sample);
        }
        assertEquals(Lists.newArrayList(new Sample<Integer>(2, 3, 0)), compressor.finish());

        compressor = new SamplesCompressor<Integer>(10, 3, true);
        for (Sample<Integer> sample : uncertain(3, 0)) {
            compressor.push(sample);
        }
        assertEquals(Lists.newArrayList(new Sample<Integer>(0, 1, 0), new Sample<Integer>(2, 2, 0)), compressor.finish());
    }

    @Test(expected = IllegalStateException.class)
    public void testSinglePass() {
        SamplesCompressor<Integer> compressor = new SamplesCompressor<Integer>(10, 3, true);
        compressor.finish();
        compressor.push(Sample.exact(1));
    }
}
