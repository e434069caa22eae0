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

import java.util.Arrays;

import lombok.Getter;

import com.amazon.capa.penalty.Penalty;
import com.amazon.capa.util.ArrayUtils;

/**
 * Collapses the per-component savings of an interval into one penalized value by
 * choosing the subset of components with the largest penalized saving. Since the
 * penalty depends only on the size of the subset, the best subset of size k is
 * always the k largest savings, so sorting each row once is enough.
 */
public class PenalizedSavingOptimizer {

    @Getter
    private final Penalty penalty;

    private final double alpha;

    private final double[] betas;

    private final boolean zeroBetas;

    private final boolean constantBetas;

    public PenalizedSavingOptimizer(Penalty penalty) {
        this.penalty = checkNotNull(penalty, "penalty must not be null");
        this.alpha = penalty.getAlpha();
        this.betas = penalty.getBetas();
        this.zeroBetas = penalty.hasZeroBetas();
        this.constantBetas = penalty.hasConstantBetas();
    }

    public int getDimensions() {
        return betas.length;
    }

    /**
     * @param saving the savings of one interval, one per component
     * @return the largest penalized saving over all non-empty subsets of
     *         components
     */
    public double penalize(double[] saving) {
        checkArgument(saving.length == betas.length, "incorrect number of components");
        if (zeroBetas) {
            return ArrayUtils.sum(saving) - alpha;
        }
        if (constantBetas) {
            double threshold = betas[0];
            double total = 0;
            boolean any = false;
            for (double value : saving) {
                if (value > threshold) {
                    total += value - threshold;
                    any = true;
                }
            }
            return (any) ? total - alpha : ArrayUtils.max(saving) - threshold - alpha;
        }
        int[] order = ArrayUtils.argsortDescending(saving);
        return bestPrefix(saving, order)[1];
    }

    /**
     * @param savings one row per interval
     * @return the penalized saving of every row
     */
    public double[] penalize(double[][] savings) {
        double[] answer = new double[savings.length];
        for (int i = 0; i < savings.length; i++) {
            answer[i] = penalize(savings[i]);
        }
        return answer;
    }

    /**
     * The components attaining the penalized saving, i.e., the indices of the
     * k largest savings for the maximizing k. Ties in k resolve to the smaller
     * subset.
     *
     * @param saving the savings of one interval, one per component
     * @return component indices in ascending order
     */
    public int[] getOptimalSubset(double[] saving) {
        checkArgument(saving.length == betas.length, "incorrect number of components");
        int[] order = ArrayUtils.argsortDescending(saving);
        int size = (int) bestPrefix(saving, order)[0];
        int[] answer = Arrays.copyOf(order, size);
        Arrays.sort(answer);
        return answer;
    }

    // returns {size, value} of the best prefix of the ordered savings
    double[] bestPrefix(double[] saving, int[] order) {
        double running = -alpha;
        double best = Double.NEGATIVE_INFINITY;
        int size = 0;
        for (int k = 0; k < order.length; k++) {
            running += saving[order[k]] - betas[k];
            if (running > best) {
                best = running;
                size = k + 1;
            }
        }
        return new double[] { size, best };
    }
}
