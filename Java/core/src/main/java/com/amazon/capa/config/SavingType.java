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

package com.amazon.capa.config;

import com.amazon.capa.saving.ISaving;
import com.amazon.capa.saving.MeanSaving;
import com.amazon.capa.saving.VarianceSaving;

public enum SavingType {

    /**
     * shift in the mean of standardized data
     */
    MEAN,
    /**
     * shift in the variance of standardized data
     */
    VARIANCE;

    public ISaving<?> create() {
        switch (this) {
        case MEAN:
            return new MeanSaving();
        case VARIANCE:
            return new VarianceSaving();
        default:
            throw new IllegalStateException("no saving for " + this);
        }
    }
}
