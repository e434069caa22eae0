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

package com.amazon.capa.saving;

import static com.amazon.capa.CommonUtils.checkArgument;

import lombok.Getter;

import com.amazon.capa.util.ArrayUtils;

/**
 * Column-wise prefix sums of a sequence, answering interval sums in constant
 * time per component.
 */
public class CumulativeSums {

    private final double[][] sums;

    @Getter
    private final int length;

    @Getter
    private final int dimensions;

    public CumulativeSums(double[][] data, boolean squared) {
        sums = ArrayUtils.columnPrefixSums(data, squared);
        length = data.length;
        dimensions = data[0].length;
    }

    /**
     * @param start  first index
     * @param end    last index, inclusive
     * @param column the component
     * @return the sum of the column over the interval
     */
    public double intervalSum(int start, int end, int column) {
        return sums[end + 1][column] - sums[start][column];
    }

    void checkIntervals(int[] starts, int[] ends) {
        checkArgument(starts.length == ends.length, "starts and ends must have the same length");
        for (int i = 0; i < starts.length; i++) {
            checkArgument(0 <= starts[i] && starts[i] <= ends[i] && ends[i] < length,
                    "incorrect interval [" + starts[i] + ", " + ends[i] + "] for length " + length);
        }
    }
}
