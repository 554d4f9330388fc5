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


package com.fastquantiles.quality;

import com.fastquantiles.stats.Sketch;
import com.fastquantiles.stats.SketchWriter;
import org.apache.mahout.math.jet.random.AbstractContinousDistribution;
import org.apache.mahout.math.jet.random.Exponential;
import org.apache.mahout.math.jet.random.Gamma;
import org.apache.mahout.math.jet.random.Normal;
import org.apache.mahout.math.jet.random.Uniform;

import java.util.Random;

/**
 * Ways of building sketches and of generating data for the quality measurements.
 */
public class Util {
    /**
     * Returns how far, as a fraction of the data size, the rank of {@code value} in {@code sorted}
     * is from {@code q * n} clamped to [1, n].  Repeated values may sit at any
     * rank of their run of ties.
     */
    public static double rankError(double[] sorted, double q, double value) {
        int n = sorted.length;
        double target = Math.min(n, Math.max(1, q * n));
        long lowest = countBelow(sorted, value, false) + 1;
        long highest = countBelow(sorted, value, true);
        if (highest < lowest) {
            throw new IllegalArgumentException(value + " is not part of the data");
        }
        if (target < lowest) {
            return (lowest - target) / n;
        } else if (target > highest) {
            return (target - highest) / n;
        } else {
            return 0;
        }
    }

    private static int countBelow(double[] sorted, double value, boolean inclusive) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value || (inclusive && sorted[mid] == value)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    enum Factory {
        RECORD {
            @Override
            Sketch<Double> build(double epsilon, double[] data) {
                Sketch<Double> sketch = Sketch.create(epsilon);
                for (double x : data) {
                    sketch.record(x);
                }
                return sketch;
            }
        },

        WRITER {
            @Override
            Sketch<Double> build(double epsilon, double[] data) {
                SketchWriter<Double> writer = new SketchWriter<Double>(Sketch.<Double>create(epsilon));
                for (double x : data) {
                    writer.record(x);
                }
                return writer.toSketch();
            }
        };

        abstract Sketch<Double> build(double epsilon, double[] data);
    }

    enum Distribution {
        UNIFORM {
            @Override
            public AbstractContinousDistribution create(Random gen) {
                return new Uniform(0, 1, gen);
            }
        },

        GAMMA {
            @Override
            public AbstractContinousDistribution create(Random gen) {
                return new Gamma(0.1, 0.1, gen);
            }
        },

        EXPONENTIAL {
            @Override
            public AbstractContinousDistribution create(Random gen) {
                return new Exponential(1, gen);
            }
        },

        NORMAL {
            @Override
            public AbstractContinousDistribution create(Random gen) {
                return new Normal(0, 1, gen);
            }
        },

        // few distinct values, lots of ties
        ROUNDED {
            @Override
            public AbstractContinousDistribution create(Random gen) {
                final Exponential base = new Exponential(0.5, gen);
                return new AbstractContinousDistribution() {
                    @Override
                    public double nextDouble() {
                        return Math.floor(base.nextDouble());
                    }
                };
            }
        };

        public abstract AbstractContinousDistribution create(Random gen);
    }
}
