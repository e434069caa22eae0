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

/**
 * Saving for a change in mean of Gaussian data with a baseline of zero mean and
 * unit variance: twice the log-likelihood gain of fitting the interval mean,
 * which is {@code (sum of the interval)^2 / length} per component.
 */
public class MeanSaving implements ISaving<CumulativeSums> {

    @Override
    public CumulativeSums initialize(double[][] data) {
        return new CumulativeSums(data, false);
    }

    @Override
    public double[][] evaluate(CumulativeSums parameters, int[] starts, int[] ends) {
        parameters.checkIntervals(starts, ends);
        double[][] answer = new double[starts.length][parameters.getDimensions()];
        for (int i = 0; i < starts.length; i++) {
            double length = ends[i] - starts[i] + 1;
            for (int j = 0; j < answer[i].length; j++) {
                double sum = parameters.intervalSum(starts[i], ends[i], j);
                answer[i][j] = sum * sum / length;
            }
        }
        return answer;
    }
}
