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
 * A saving measures, per component, the evidence that an interval deviates from
 * the baseline model. Larger is more anomalous and values are non-negative.
 *
 * @param <P> the precomputed parameters of one sequence; opaque to callers
 */
public interface ISaving<P> {

    /**
     * Precomputes whatever {@link #evaluate} needs. Called once per sequence.
     *
     * @param data the sequence, one row per time index
     * @return parameters to be passed to {@link #evaluate}
     */
    P initialize(double[][] data);

    /**
     * Savings of a batch of intervals.
     *
     * @param parameters the output of {@link #initialize}
     * @param starts     first index of each interval
     * @param ends       last index (inclusive) of each interval
     * @return a matrix with one row per interval and one column per component
     */
    double[][] evaluate(P parameters, int[] starts, int[] ends);

    /**
     * @return the number of parameters per segment of the underlying model, used
     *         to size the penalties
     */
    default int getParameterCount() {
        return 1;
    }
}
