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

import static com.amazon.capa.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * A utility class for data arrays.
 */
public class ArrayUtils {

    /**
     * Returns the indices of the array ordered by decreasing value. Equal values
     * keep their original relative order.
     *
     * @param values the values to order
     * @return a permutation of {@code 0 .. values.length - 1}
     */
    public static int[] argsortDescending(double[] values) {
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());
        int[] answer = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = order[i];
        }
        return answer;
    }

    /**
     * Column-wise prefix sums with a leading row of zeros, so that the sum of rows
     * {@code start..end} (inclusive) in column j is
     * {@code sums[end + 1][j] - sums[start][j]}.
     *
     * @param data    the rows
     * @param squared if true, the squares of the values are accumulated
     * @return an array of {@code data.length + 1} rows
     */
    public static double[][] columnPrefixSums(double[][] data, boolean squared) {
        checkArgument(data.length > 0, "cannot accumulate an empty array");
        int columns = data[0].length;
        double[][] sums = new double[data.length + 1][columns];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < columns; j++) {
                double value = squared ? data[i][j] * data[i][j] : data[i][j];
                sums[i + 1][j] = sums[i][j] + value;
            }
        }
        return sums;
    }

    /**
     * Successive differences {@code answer[i] = values[i + 1] - values[i]}.
     *
     * @param values at least one value
     * @return an array one shorter than the input
     */
    public static double[] diff(double[] values) {
        checkArgument(values.length > 0, "cannot difference an empty array");
        double[] answer = new double[values.length - 1];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = values[i + 1] - values[i];
        }
        return answer;
    }

    public static double sum(double[] values) {
        double answer = 0;
        for (double value : values) {
            answer += value;
        }
        return answer;
    }

    public static double max(double[] values) {
        checkArgument(values.length > 0, "cannot take the maximum of an empty array");
        double answer = values[0];
        for (int i = 1; i < values.length; i++) {
            answer = Math.max(answer, values[i]);
        }
        return answer;
    }
}
