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
import static com.amazon.capa.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * The cost of declaring an anomaly. {@code alpha} is paid once per anomaly and
 * {@code betas[k - 1]} is the additional cost of the k-th component implicated
 * in it, so an anomaly affecting k components costs
 * {@code alpha + betas[0] + ... + betas[k - 1]}.
 */
public class Penalty {

    /**
     * betas below this value are treated as zero
     */
    public static final double ZERO_TOLERANCE = 1e-8;

    @Getter
    private final double alpha;

    private final double[] betas;

    public Penalty(double alpha, double[] betas) {
        checkNotNull(betas, "betas must not be null");
        checkArgument(betas.length > 0, "betas must have one entry per component");
        checkArgument(Double.isFinite(alpha), "alpha must be finite");
        for (double beta : betas) {
            checkArgument(Double.isFinite(beta), "betas must be finite");
        }
        this.alpha = alpha;
        this.betas = Arrays.copyOf(betas, betas.length);
    }

    /**
     * @param dimensions number of components
     * @return a penalty which costs nothing
     */
    public static Penalty zero(int dimensions) {
        return new Penalty(0.0, new double[dimensions]);
    }

    public int getDimensions() {
        return betas.length;
    }

    public double[] getBetas() {
        return Arrays.copyOf(betas, betas.length);
    }

    /**
     * @param components the number of affected components, between 1 and the
     *                   dimension
     * @return the total penalty of an anomaly affecting that many components
     */
    public double getCumulativePenalty(int components) {
        checkArgument(components >= 1 && components <= betas.length, "incorrect number of components");
        double answer = alpha;
        for (int i = 0; i < components; i++) {
            answer += betas[i];
        }
        return answer;
    }

    /**
     * @return the cumulative penalty for 1, 2, ... , p affected components
     */
    public double[] getCumulativePenalties() {
        double[] answer = new double[betas.length];
        double running = alpha;
        for (int i = 0; i < betas.length; i++) {
            running += betas[i];
            answer[i] = running;
        }
        return answer;
    }

    /**
     * @return true if every beta is within {@link #ZERO_TOLERANCE} of zero, on
     *         either side
     */
    public boolean hasZeroBetas() {
        for (double beta : betas) {
            if (Math.abs(beta) >= ZERO_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    public boolean hasConstantBetas() {
        for (double beta : betas) {
            if (beta != betas[0]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Penalty{alpha=" + alpha + ", betas=" + Arrays.toString(betas) + "}";
    }
}
