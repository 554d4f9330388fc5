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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Compacts samples that are handed over in ascending order.
 * <p>
 * The most recent sample is held back and folded into the next one whenever the pair is
 * compactable, so each kept sample ends up representing as many ranks as the cap allows.  The
 * last sample is never removed.  When the first sample is the exact minimum of a sketch it is
 * kept as is.
 */
class SamplesCompressor<T> {
    private final long cap;
    private final boolean keepFirst;
    private final List<Sample<T>> compressed;
    private Sample<T> pending = null;
    private boolean done = false;

    SamplesCompressor(long cap, int expectedSize, boolean keepFirst) {
        this.cap = cap;
        this.keepFirst = keepFirst;
        this.compressed = new ArrayList<Sample<T>>(expectedSize);
    }

    /**
     * Compacts a whole ascending sequence of samples that starts with the minimum.
     */
    static <T> List<Sample<T>> compress(Iterator<Sample<T>> samples, long cap, int expectedSize) {
        SamplesCompressor<T> compressor = new SamplesCompressor<T>(cap, expectedSize, true);
        while (samples.hasNext()) {
            compressor.push(samples.next());
        }
        return compressor.finish();
    }

    void push(Sample<T> sample) {
        Preconditions.checkState(!done, "Compressor was already finished");
        if (pending != null) {
            if (Sample.isCompactable(pending, sample, cap)) {
                sample = Sample.combineAdjacent(pending, sample);
            } else {
                compressed.add(pending);
            }
            pending = sample;
        } else if (keepFirst && compressed.isEmpty()) {
            compressed.add(sample);
        } else {
            pending = sample;
        }
    }

    List<Sample<T>> finish() {
        Preconditions.checkState(!done, "Compressor was already finished");
        done = true;
        if (pending != null) {
            compressed.add(pending);
            pending = null;
        }
        return compressed;
    }
}
