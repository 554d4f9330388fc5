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

import com.google.common.collect.Ordering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.Properties;

/**
 * Creates sketches and writers configured from a properties file.
 * <p>
 * The no-argument constructor reads {@value #PROPERTIES_FILE_NAME} from the working directory,
 * or from the classpath if there is no such file.  Recognized keys are
 * <ul>
 * <li>{@value #EPSILON_KEY}, default 0.01</li>
 * <li>{@value #NODE_CAPACITY_KEY}, default derived from epsilon</li>
 * <li>{@value #BUFFER_CAPACITY_KEY}, default {@value SketchWriter#DEFAULT_BUFFER_CAPACITY}</li>
 * </ul>
 */
public class SketchFactory {
    private static final Logger log = LoggerFactory.getLogger(SketchFactory.class);

    public static final String PROPERTIES_FILE_NAME = "sketch.properties";
    public static final String EPSILON_KEY = "sketch.epsilon";
    public static final String NODE_CAPACITY_KEY = "sketch.nodeCapacity";
    public static final String BUFFER_CAPACITY_KEY = "sketch.writer.bufferCapacity";

    public static final double DEFAULT_EPSILON = 0.01;

    private final double epsilon;
    private final int nodeCapacity;
    private final int bufferCapacity;

    public SketchFactory() {
        this(loadProperties());
    }

    /**
     * @param props Configuration; missing keys take their default.
     * @throws InvalidConfigurationException if a value is malformed or out of range.
     */
    public SketchFactory(Properties props) {
        epsilon = parseDouble(props, EPSILON_KEY, DEFAULT_EPSILON);
        // validates epsilon as well
        int derived = Sketch.defaultNodeCapacity(epsilon);
        nodeCapacity = parseInt(props, NODE_CAPACITY_KEY, derived);
        if (nodeCapacity < Sketch.MIN_NODE_CAPACITY) {
            throw new InvalidConfigurationException(String.format(
                    "%s should be at least %d, got %d", NODE_CAPACITY_KEY, Sketch.MIN_NODE_CAPACITY, nodeCapacity));
        }
        bufferCapacity = parseInt(props, BUFFER_CAPACITY_KEY, SketchWriter.DEFAULT_BUFFER_CAPACITY);
        if (bufferCapacity < 1) {
            throw new InvalidConfigurationException(String.format(
                    "%s should be positive, got %d", BUFFER_CAPACITY_KEY, bufferCapacity));
        }
    }

    private static Properties loadProperties() {
        Properties props = new Properties();
        File f = new File(PROPERTIES_FILE_NAME);
        try (InputStream is = f.exists() ?
                new FileInputStream(f)
                : SketchFactory.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE_NAME)) {
            if (is == null) {
                log.warn("No {} found, using default configuration", PROPERTIES_FILE_NAME);
            } else {
                props.load(is);
            }
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read " + PROPERTIES_FILE_NAME, e);
        }
        return props;
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(String.format("%s should be a number, got '%s'", key, value), e);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(String.format("%s should be an integer, got '%s'", key, value), e);
        }
    }

    public <T extends Comparable<? super T>> Sketch<T> newSketch() {
        return new Sketch<T>(epsilon, nodeCapacity, Ordering.<T>natural());
    }

    public <T> Sketch<T> newSketch(Comparator<? super T> comparator) {
        return new Sketch<T>(epsilon, nodeCapacity, comparator);
    }

    public <T extends Comparable<? super T>> SketchWriter<T> newWriter() {
        return new SketchWriter<T>(this.<T>newSketch(), bufferCapacity);
    }

    public <T> SketchWriter<T> newWriter(Comparator<? super T> comparator) {
        return new SketchWriter<T>(newSketch(comparator), bufferCapacity);
    }

    public double epsilon() {
        return epsilon;
    }

    public int nodeCapacity() {
        return nodeCapacity;
    }

    public int bufferCapacity() {
        return bufferCapacity;
    }
}
