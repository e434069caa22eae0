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

import static java.lang.Math.log;
import static java.lang.Math.max;

/**
 * Saving for a change in variance of Gaussian data with a baseline of zero mean
 * and unit variance. With {@code v} the mean of squares over the interval, the
 * saving of a component is {@code length * (v - 1 - log(v))}.
 */
public class VarianceSaving implements ISaving<CumulativeSums> {

    /**
     * lower bound of the estimated variance, keeps the saving of constant
     * intervals finite
     */
    public static final double MIN_VARIANCE = 1e-10;

    @Override
    public CumulativeSums initialize(double[][] data) {
        return new CumulativeSums(data, true);
    }

    @Override
    public double[][] evaluate(CumulativeSums parameters, int[] starts, int[] ends) {
        parameters.checkIntervals(starts, ends);
        double[][] answer = new double[starts.length][parameters.getDimensions()];
        for (int i = 0; i < starts.length; i++) {
            double length = ends[i] - starts[i] + 1;
            for (int j = 0; j < answer[i].length; j++) {
                double variance = max(parameters.intervalSum(starts[i], ends[i], j) / length, MIN_VARIANCE);
                answer[i][j] = length * (variance - 1 - log(variance));
            }
        }
        return answer;
    }
}
