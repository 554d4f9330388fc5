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

/**
 * The answer to a quantile query: a recorded value and the worst-case distance between its true
 * rank and the requested rank, as a fraction of the number of recorded values.
 */
public final class QuantileEstimate<T> {
    private final T value;
    private final double error;

    QuantileEstimate(T value, double error) {
        this.value = value;
        this.error = error;
    }

    public T value() {
        return value;
    }

    /**
     * @return The maximum rank error of {@link #value()}, never more than the sketch's epsilon
     * once {@code 2 * epsilon * count} reaches 1.
     */
    public double error() {
        return error;
    }

    @Override
    public String toString() {
        return "QuantileEstimate{" +
                "value=" + value +
                ", error=" + error +
                '}';
    }
}
