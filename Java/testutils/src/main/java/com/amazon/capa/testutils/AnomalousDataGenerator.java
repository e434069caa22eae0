/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.capa.testutils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * This class samples standard normal rows and injects anomalies into them. An
 * injected anomaly covers an interval of rows and a subset of the columns; inside
 * it the values are drawn with a shifted mean and a scaled standard deviation.
 */
public class AnomalousDataGenerator {

    private final long seed;

    private final List<InjectedAnomaly> anomalies = new ArrayList<>();

    public AnomalousDataGenerator(long seed) {
        this.seed = seed;
    }

    public AnomalousDataGenerator() {
        this(new Random().nextLong());
    }

    /**
     * Adds an anomaly shifting the mean of the given columns.
     *
     * @param start      first row
     * @param end        last row, inclusive
     * @param meanShift  added to the affected values
     * @param components affected columns; all columns if none are given
     * @return this generator
     */
    public AnomalousDataGenerator addMeanShift(int start, int end, double meanShift, int... components) {
        anomalies.add(new InjectedAnomaly(start, end, meanShift, 1.0, components));
        return this;
    }

    /**
     * Adds an anomaly scaling the standard deviation of the given columns.
     *
     * @param start      first row
     * @param end        last row, inclusive
     * @param sigma      the standard deviation inside the anomaly
     * @param components affected columns; all columns if none are given
     * @return this generator
     */
    public AnomalousDataGenerator addVarianceShift(int start, int end, double sigma, int... components) {
        anomalies.add(new InjectedAnomaly(start, end, 0.0, sigma, components));
        return this;
    }

    public List<InjectedAnomaly> getAnomalies() {
        return new ArrayList<>(anomalies);
    }

    public double[][] generate(int numberOfRows, int numberOfColumns) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                result[i][j] = dist.nextDouble();
            }
        }
        for (InjectedAnomaly anomaly : anomalies) {
            if (anomaly.end >= numberOfRows) {
                throw new IllegalArgumentException("anomaly " + anomaly + " exceeds " + numberOfRows + " rows");
            }
            int[] columns = anomaly.components.length == 0 ? allColumns(numberOfColumns) : anomaly.components;
            for (int i = anomaly.start; i <= anomaly.end; i++) {
                for (int j : columns) {
                    result[i][j] = anomaly.meanShift + anomaly.sigma * result[i][j];
                }
            }
        }
        return result;
    }

    private static int[] allColumns(int numberOfColumns) {
        int[] columns = new int[numberOfColumns];
        for (int j = 0; j < numberOfColumns; j++) {
            columns[j] = j;
        }
        return columns;
    }

    public static class InjectedAnomaly {
        public final int start;
        public final int end;
        public final double meanShift;
        public final double sigma;
        public final int[] components;

        InjectedAnomaly(int start, int end, double meanShift, double sigma, int[] components) {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("incorrect interval");
            }
            this.start = start;
            this.end = end;
            this.meanShift = meanShift;
            this.sigma = sigma;
            this.components = Arrays.copyOf(components, components.length);
        }

        @Override
        public String toString() {
            return "[" + start + ", " + end + "] mean " + meanShift + " sigma " + sigma + " components "
                    + Arrays.toString(components);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }
    }
}
