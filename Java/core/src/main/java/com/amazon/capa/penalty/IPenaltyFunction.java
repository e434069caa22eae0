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

/**
 * Produces the penalty of an anomaly for a sequence of a given shape.
 */
@FunctionalInterface
public interface IPenaltyFunction {

    /**
     * @param sampleSize     number of rows n, positive
     * @param dimensions     number of components p, at least 1
     * @param parameterCount number of parameters per segment in the saving model
     * @param scale          multiplier of the penalty, non-negative
     * @return a penalty with one beta per component
     */
    Penalty getPenalty(int sampleSize, int dimensions, int parameterCount, double scale);
}
