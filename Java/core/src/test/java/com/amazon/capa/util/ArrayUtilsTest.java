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

package com.amazon.capa.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ArrayUtilsTest {

    @ParameterizedTest
    @CsvSource({ "3.0:1.0:2.0,0:2:1", "1.0:1.0:5.0,2:0:1", "0.0,0", "2.0:2.0:2.0,0:1:2" })
    public void argsortDescending(String input, String expected) {
        int[] order = ArrayUtils.argsortDescending(array(input));
        assertArrayEquals(Arrays.stream(expected.split(":")).mapToInt(Integer::valueOf).toArray(), order);
    }

    private double[] array(String arrayString) {
        return Arrays.stream(arrayString.split(":")).mapToDouble(Double::valueOf).toArray();
    }

    @Test
    public void testColumnPrefixSums() {
        double[][] data = new double[][] { { 1, -1 }, { 2, 3 }, { -4, 0.5 } };
        double[][] sums = ArrayUtils.columnPrefixSums(data, false);
        assertEquals(4, sums.length);
        assertArrayEquals(new double[] { 0, 0 }, sums[0]);
        assertArrayEquals(new double[] { 3, 2 }, sums[2]);
        assertArrayEquals(new double[] { -1, 2.5 }, sums[3]);

        double[][] squares = ArrayUtils.columnPrefixSums(data, true);
        assertArrayEquals(new double[] { 21, 10.25 }, squares[3]);
        assertThrows(IllegalArgumentException.class, () -> ArrayUtils.columnPrefixSums(new double[0][], false));
    }

    @Test
    public void testDiffSumMax() {
        assertArrayEquals(new double[] { 1, -3, 0 }, ArrayUtils.diff(new double[] { 0, 1, -2, -2 }));
        assertEquals(0, ArrayUtils.diff(new double[] { 7 }).length);
        assertEquals(-4.0, ArrayUtils.sum(new double[] { 0, 1, -2, -3 }));
        assertEquals(0.0, ArrayUtils.sum(new double[0]));
        assertEquals(1.0, ArrayUtils.max(new double[] { 0, 1, -2, -3 }));
        assertThrows(IllegalArgumentException.class, () -> ArrayUtils.max(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> ArrayUtils.diff(new double[0]));
    }
}
