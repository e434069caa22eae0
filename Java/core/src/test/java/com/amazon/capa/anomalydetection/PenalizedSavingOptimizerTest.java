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

package com.amazon.capa.anomalydetection;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.capa.penalty.CapaPenalties;
import com.amazon.capa.penalty.Penalty;

public class PenalizedSavingOptimizerTest {

    // maximum over all non-empty subsets, enumerated through bit masks
    private static double bruteForce(double[] saving, Penalty penalty) {
        double best = Double.NEGATIVE_INFINITY;
        for (int mask = 1; mask < (1 << saving.length); mask++) {
            double total = 0;
            for (int j = 0; j < saving.length; j++) {
                if ((mask & (1 << j)) != 0) {
                    total += saving[j];
                }
            }
            best = Math.max(best, total - penalty.getCumulativePenalty(Integer.bitCount(mask)));
        }
        return best;
    }

    private static double[] randomSaving(Random random, int dimensions) {
        double[] saving = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            saving[j] = 20 * random.nextDouble() * random.nextDouble();
        }
        return saving;
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 4, 7, 10 })
    public void testAgainstBruteForce(int dimensions) {
        Random random = new Random(dimensions);
        for (int trial = 0; trial < 50; trial++) {
            double[] betas = new double[dimensions];
            for (int j = 0; j < dimensions; j++) {
                betas[j] = 10 * random.nextDouble();
            }
            Penalty penalty = new Penalty(5 * random.nextDouble(), betas);
            PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(penalty);
            double[] saving = randomSaving(random, dimensions);
            assertThat(optimizer.penalize(saving), closeTo(bruteForce(saving, penalty), 1e-9));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 5, 10 })
    public void testCapaPenaltiesAgainstBruteForce(int dimensions) {
        Random random = new Random(17 + dimensions);
        Penalty[] penalties = new Penalty[] { CapaPenalties.dense(100, dimensions, 1, 0.3),
                CapaPenalties.sparse(100, dimensions, 1, 0.3), CapaPenalties.intermediate(100, dimensions, 1, 0.3),
                CapaPenalties.combined(100, dimensions, 1, 0.3) };
        for (Penalty penalty : penalties) {
            PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(penalty);
            for (int trial = 0; trial < 20; trial++) {
                double[] saving = randomSaving(random, dimensions);
                assertThat(optimizer.penalize(saving), closeTo(bruteForce(saving, penalty), 1e-9));
            }
        }
    }

    @Test
    public void testZeroBetas() {
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(new Penalty(3, new double[3]));
        assertEquals(4.0, optimizer.penalize(new double[] { 1, 2, 4 }));
        assertArrayEquals(new int[] { 0, 1, 2 }, optimizer.getOptimalSubset(new double[] { 1, 2, 4 }));
    }

    @Test
    public void testConstantBetas() {
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(new Penalty(1, new double[] { 2, 2, 2 }));
        // only the components above the threshold contribute
        assertEquals(8.0, optimizer.penalize(new double[] { 1, 10, 3 }));
        assertArrayEquals(new int[] { 1, 2 }, optimizer.getOptimalSubset(new double[] { 1, 10, 3 }));
        // nothing above the threshold: the single largest component
        assertEquals(-1.5, optimizer.penalize(new double[] { 0.5, 1.5, 1 }));
        assertArrayEquals(new int[] { 1 }, optimizer.getOptimalSubset(new double[] { 0.5, 1.5, 1 }));
    }

    @Test
    public void testNegativeBetas() {
        Penalty penalty = new Penalty(0, new double[] { -5, -5 });
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(penalty);
        assertEquals(12.0, optimizer.penalize(new double[] { 1, 1 }));
        assertArrayEquals(new int[] { 0, 1 }, optimizer.getOptimalSubset(new double[] { 1, 1 }));

        Penalty mixed = new Penalty(1, new double[] { -3, -1e-9, -2 });
        double[] saving = new double[] { 2, 0.5, 4 };
        assertThat(new PenalizedSavingOptimizer(mixed).penalize(saving), closeTo(bruteForce(saving, mixed), 1e-9));
    }

    @Test
    public void testTiesPreferSmallerSubset() {
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(new Penalty(0, new double[] { 1, 2 }));
        assertArrayEquals(new int[] { 0 }, optimizer.getOptimalSubset(new double[] { 5, 2 }));
        assertEquals(4.0, optimizer.penalize(new double[] { 5, 2 }));
    }

    @Test
    public void testSubsetIsSortedAndConsistent() {
        Random random = new Random(3);
        Penalty penalty = CapaPenalties.combined(300, 8, 1, 0.5);
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(penalty);
        for (int trial = 0; trial < 20; trial++) {
            double[] saving = randomSaving(random, 8);
            int[] subset = optimizer.getOptimalSubset(saving);
            int[] sorted = Arrays.copyOf(subset, subset.length);
            Arrays.sort(sorted);
            assertArrayEquals(sorted, subset);
            double value = Arrays.stream(subset).mapToDouble(i -> saving[i]).sum()
                    - penalty.getCumulativePenalty(subset.length);
            assertThat(optimizer.penalize(saving), closeTo(value, 1e-9));
        }
    }

    @Test
    public void testBatch() {
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(new Penalty(1, new double[2]));
        assertArrayEquals(new double[] { 2, -1 }, optimizer.penalize(new double[][] { { 1, 2 }, { 0, 0 } }));
        assertEquals(2, optimizer.getDimensions());
    }

    @Test
    public void testIncorrectComponents() {
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(Penalty.zero(3));
        assertThrows(IllegalArgumentException.class, () -> optimizer.penalize(new double[2]));
        assertThrows(IllegalArgumentException.class, () -> optimizer.getOptimalSubset(new double[4]));
        assertThrows(NullPointerException.class, () -> new PenalizedSavingOptimizer(null));
    }
}
