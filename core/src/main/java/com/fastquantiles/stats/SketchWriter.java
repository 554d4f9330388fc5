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
import java.util.Collections;
import java.util.List;

/**
 * Feeds values into a {@link Sketch} in batches.
 * <p>
 * Values are collected in a buffer.  When the buffer is full it is sorted, turned into a sketch
 * that holds the batch exactly and merged into the accumulated sketch.  Sorting a batch once is
 * much cheaper than descending the tree for every value, so this is the preferred way to load a
 * large stream.  The error bound is the same as for recording the values one by one.
 */
public class SketchWriter<T> {
    public static final int DEFAULT_BUFFER_CAPACITY = 1000;

    private final int bufferCapacity;
    private final List<T> buffer;
    private Sketch<T> sketch;

    public SketchWriter(Sketch<T> sketch) {
        this(sketch, DEFAULT_BUFFER_CAPACITY);
    }

    /**
     * @param sketch         The sketch to add values to.  The writer takes it over.
     * @param bufferCapacity How many values to collect before merging them, at least 1.
     */
    public SketchWriter(Sketch<T> sketch, int bufferCapacity) {
        Preconditions.checkNotNull(sketch, "sketch");
        if (bufferCapacity < 1) {
            throw new InvalidConfigurationException("Buffer capacity should be positive, got " + bufferCapacity);
        }
        this.sketch = sketch;
        this.bufferCapacity = bufferCapacity;
        this.buffer = new ArrayList<T>(bufferCapacity);
    }

    public void record(T value) {
        Preconditions.checkNotNull(value, "Cannot record null");
        checkOpen();
        buffer.add(value);
        if (buffer.size() >= bufferCapacity) {
            flush();
        }
    }

    public void recordAll(Iterable<? extends T> values) {
        for (T value : values) {
            record(value);
        }
    }

    /**
     * Merges whatever is buffered into the sketch.
     */
    public void flush() {
        checkOpen();
        if (buffer.isEmpty()) {
            return;
        }
        Collections.sort(buffer, sketch.comparator());
        Sketch<T> batch = sketch.exactCopyOf(buffer);
        sketch = sketch.merge(batch);
        buffer.clear();
    }

    /**
     * @return the number of values recorded so far, including the buffered ones
     */
    public long count() {
        checkOpen();
        return sketch.count() + buffer.size();
    }

    /**
     * Flushes the buffer and hands the sketch over to the caller.  The writer cannot be used
     * afterwards.
     */
    public Sketch<T> toSketch() {
        flush();
        Sketch<T> r = sketch;
        sketch = null;
        return r;
    }

    private void checkOpen() {
        Preconditions.checkState(sketch != null, "Writer was already turned into a sketch");
    }
}
