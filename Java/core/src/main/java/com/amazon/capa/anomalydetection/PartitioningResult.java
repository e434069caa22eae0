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

import static com.amazon.capa.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * The tables filled by one forward pass of {@link OptimalPartitioning}.
 */
public class PartitioningResult {

    /**
     * marks an index at which no anomaly ends
     */
    public static final int NO_ANOMALY = -1;

    // optimalSavings[0] = 0, optimalSavings[t + 1] is the optimum over rows 0..t
    private final double[] optimalSavings;

    // start of the anomaly ending at each index, or NO_ANOMALY
    private final int[] anomalyStarts;

    public PartitioningResult(double[] optimalSavings, int[] anomalyStarts) {
        checkArgument(optimalSavings.length == anomalyStarts.length + 1, "incorrect lengths");
        this.optimalSavings = optimalSavings;
        this.anomalyStarts = anomalyStarts;
    }

    public int getLength() {
        return anomalyStarts.length;
    }

    /**
     * @return the table of length n + 1, starting with the empty prefix
     */
    public double[] getOptimalSavings() {
        return Arrays.copyOf(optimalSavings, optimalSavings.length);
    }

    /**
     * @return the optimal saving of every non-empty prefix, of length n
     */
    public double[] getPrefixSavings() {
        return Arrays.copyOfRange(optimalSavings, 1, optimalSavings.length);
    }

    public int[] getAnomalyStarts() {
        return Arrays.copyOf(anomalyStarts, anomalyStarts.length);
    }

    public int getAnomalyStart(int index) {
        return anomalyStarts[index];
    }
}
