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

package com.amazon.capa.penalty;

import static com.amazon.capa.CommonUtils.checkArgument;
import static java.lang.Math.log;
import static java.lang.Math.min;
import static java.lang.Math.sqrt;

import java.util.Arrays;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;

import com.amazon.capa.util.ArrayUtils;

/**
 * The penalty functions of the CAPA family of detectors. All of them take the
 * sample size n, the dimension p, the number of parameters per segment and a
 * non-negative scale.
 */
public class CapaPenalties {

    private CapaPenalties() {
    }

    static void checkShape(int sampleSize, int dimensions, int parameterCount, double scale) {
        checkArgument(sampleSize > 0, "sample size must be positive");
        checkArgument(dimensions > 0, "dimensions must be positive");
        checkArgument(parameterCount > 0, "parameter count must be positive");
        checkArgument(scale >= 0 && Double.isFinite(scale), "scale must be non-negative and finite");
    }

    /**
     * Penalty for anomalies expected to affect all components: a single global
     * cost and no per-component cost.
     *
     * @param sampleSize     sample size n
     * @param dimensions     dimension p
     * @param parameterCount parameters per segment
     * @param scale          scaling factor
     * @return the dense penalty
     */
    public static Penalty dense(int sampleSize, int dimensions, int parameterCount, double scale) {
        checkShape(sampleSize, dimensions, parameterCount, scale);
        double psi = log(sampleSize);
        double degrees = (double) dimensions * parameterCount;
        double alpha = scale * (degrees + 2 * sqrt(degrees * psi) + 2 * psi);
        return new Penalty(alpha, new double[dimensions]);
    }

    /**
     * Penalty for anomalies expected to affect few components: a small global cost
     * and a constant cost for every affected component.
     *
     * @param sampleSize     sample size n
     * @param dimensions     dimension p
     * @param parameterCount parameters per segment
     * @param scale          scaling factor
     * @return the sparse penalty
     */
    public static Penalty sparse(int sampleSize, int dimensions, int parameterCount, double scale) {
        checkShape(sampleSize, dimensions, parameterCount, scale);
        double alpha = 2 * scale * log(sampleSize);
        double[] betas = new double[dimensions];
        Arrays.fill(betas, 2 * scale * log((double) parameterCount * dimensions));
        return new Penalty(alpha, betas);
    }

    /**
     * Penalty balancing dense and sparse anomalies, derived from the tail of a
     * chi-squared distribution with {@code parameterCount} degrees of freedom. The
     * closed form is defined for 1 to p - 1 components; the cost of the p-th
     * component is zero.
     *
     * @param sampleSize     sample size n
     * @param dimensions     dimension p, at least 2
     * @param parameterCount parameters per segment
     * @param scale          scaling factor
     * @return the intermediate penalty
     */
    public static Penalty intermediate(int sampleSize, int dimensions, int parameterCount, double scale) {
        checkShape(sampleSize, dimensions, parameterCount, scale);
        checkArgument(dimensions >= 2, "intermediate penalty requires at least 2 dimensions");
        ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(parameterCount);
        double psi = log(sampleSize) + log(dimensions);
        // curve[0] = 0, curve[j] = penalty for j components, held flat at j = p
        double[] curve = new double[dimensions + 1];
        for (int j = 1; j < dimensions; j++) {
            double quantile = chiSquared.inverseCumulativeProbability(1.0 - (double) j / dimensions);
            double tail = 2.0 * dimensions * quantile * chiSquared.density(quantile);
            double size = (double) j * parameterCount + tail;
            curve[j] = scale * (2 * psi + size + 2 * sqrt(size * psi));
        }
        curve[dimensions] = curve[dimensions - 1];
        return new Penalty(0.0, ArrayUtils.diff(curve));
    }

    /**
     * The pointwise minimum of the dense, sparse and intermediate penalties, over
     * the number of affected components. For a single component there is nothing
     * to balance and the dense penalty of one dimension is used.
     *
     * @param sampleSize     sample size n
     * @param dimensions     dimension p
     * @param parameterCount parameters per segment
     * @param scale          scaling factor
     * @return the combined penalty
     */
    public static Penalty combined(int sampleSize, int dimensions, int parameterCount, double scale) {
        checkShape(sampleSize, dimensions, parameterCount, scale);
        if (dimensions < 2) {
            // a single component has nothing to select, the dense penalty applies
            return dense(sampleSize, 1, parameterCount, scale);
        }
        double[] dense = dense(sampleSize, dimensions, parameterCount, scale).getCumulativePenalties();
        double[] sparse = sparse(sampleSize, dimensions, parameterCount, scale).getCumulativePenalties();
        double[] intermediate = intermediate(sampleSize, dimensions, parameterCount, scale).getCumulativePenalties();
        double[] curve = new double[dimensions + 1];
        for (int k = 0; k < dimensions; k++) {
            curve[k + 1] = min(dense[k], min(sparse[k], intermediate[k]));
        }
        return new Penalty(0.0, ArrayUtils.diff(curve));
    }
}
