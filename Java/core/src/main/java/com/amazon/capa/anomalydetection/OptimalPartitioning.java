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
import static com.amazon.capa.CommonUtils.checkNotNull;
import static com.amazon.capa.CommonUtils.checkState;
import static com.amazon.capa.anomalydetection.PartitioningResult.NO_ANOMALY;
import static java.lang.Math.max;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.capa.penalty.Penalty;
import com.amazon.capa.saving.ISaving;

/**
 * The penalized optimal partitioning recursion of MVCAPA. A single pass from
 * left to right decides, for every index t, whether the best explanation of rows
 * 0..t ends with a normal observation, with a collective anomaly ending at t, or
 * with a point anomaly at t. The winning decision is recorded so that the
 * anomalies can be recovered afterwards by {@link AnomalyReconstructor}.
 *
 * @param <P> the parameters of the saving
 */
@Getter
public class OptimalPartitioning<P> {

    private final ISaving<P> saving;

    private final PenalizedSavingOptimizer collectiveOptimizer;

    private final PenalizedSavingOptimizer pointOptimizer;

    private final int minSegmentLength;

    private final int maxSegmentLength;

    public OptimalPartitioning(ISaving<P> saving, Penalty collectivePenalty, Penalty pointPenalty,
            int minSegmentLength, int maxSegmentLength) {
        this.saving = checkNotNull(saving, "saving must not be null");
        checkNotNull(collectivePenalty, "collective penalty must not be null");
        checkNotNull(pointPenalty, "point penalty must not be null");
        checkArgument(collectivePenalty.getDimensions() == pointPenalty.getDimensions(),
                "penalties must have the same dimensions");
        checkArgument(minSegmentLength >= 2, "min segment length must be at least 2");
        checkArgument(maxSegmentLength >= minSegmentLength, "max segment length must be at least min segment length");
        this.collectiveOptimizer = new PenalizedSavingOptimizer(collectivePenalty);
        this.pointOptimizer = new PenalizedSavingOptimizer(pointPenalty);
        this.minSegmentLength = minSegmentLength;
        this.maxSegmentLength = maxSegmentLength;
    }

    /**
     * Runs the recursion over a sequence of the given length.
     *
     * @param parameters the saving parameters of the sequence
     * @param length     number of rows n of the sequence
     * @return the optimal saving of every prefix and the start of the anomaly (if
     *         any) ending at every index
     */
    public PartitioningResult partition(P parameters, int length) {
        checkArgument(length >= minSegmentLength, "sequence must have at least min segment length rows");
        double[] optimalSavings = new double[length + 1];
        int[] anomalyStarts = new int[length];
        Arrays.fill(anomalyStarts, NO_ANOMALY);

        for (int t = minSegmentLength - 1; t < length; t++) {
            double best = optimalSavings[t];
            int start = NO_ANOMALY;

            int lowerStart = max(0, t - maxSegmentLength + 1);
            int upperStart = t - minSegmentLength + 2;
            if (upperStart > lowerStart) {
                int[] starts = new int[upperStart - lowerStart];
                int[] ends = new int[starts.length];
                for (int i = 0; i < starts.length; i++) {
                    starts[i] = lowerStart + i;
                    ends[i] = t;
                }
                double[] penalized = collectiveOptimizer.penalize(evaluate(parameters, starts, ends));
                double collective = Double.NEGATIVE_INFINITY;
                int collectiveStart = lowerStart;
                for (int i = 0; i < starts.length; i++) {
                    double candidate = optimalSavings[starts[i]] + penalized[i];
                    if (candidate > collective) {
                        collective = candidate;
                        collectiveStart = starts[i];
                    }
                }
                if (collective > best) {
                    best = collective;
                    start = collectiveStart;
                }
            }

            int[] point = new int[] { t };
            double pointSaving = optimalSavings[t] + pointOptimizer.penalize(evaluate(parameters, point, point)[0]);
            if (pointSaving > best) {
                best = pointSaving;
                start = t;
            }

            optimalSavings[t + 1] = best;
            anomalyStarts[t] = start;
        }
        return new PartitioningResult(optimalSavings, anomalyStarts);
    }

    double[][] evaluate(P parameters, int[] starts, int[] ends) {
        double[][] savings = saving.evaluate(parameters, starts, ends);
        checkState(savings != null && savings.length == starts.length, "saving returned an incorrect number of rows");
        for (double[] row : savings) {
            checkState(row.length == collectiveOptimizer.getDimensions(),
                    "saving returned an incorrect number of components");
        }
        return savings;
    }
}
