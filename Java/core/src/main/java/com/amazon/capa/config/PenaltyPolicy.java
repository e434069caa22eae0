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

import static com.amazon.capa.CommonUtils.checkNotNull;

import java.util.Locale;

import com.amazon.capa.penalty.CapaPenalties;
import com.amazon.capa.penalty.IPenaltyFunction;
import com.amazon.capa.penalty.Penalty;

public enum PenaltyPolicy implements IPenaltyFunction {

    /**
     * favors anomalies that affect all the components
     */
    DENSE {
        @Override
        public Penalty getPenalty(int sampleSize, int dimensions, int parameterCount, double scale) {
            return CapaPenalties.dense(sampleSize, dimensions, parameterCount, scale);
        }
    },
    /**
     * favors anomalies that affect a few components
     */
    SPARSE {
        @Override
        public Penalty getPenalty(int sampleSize, int dimensions, int parameterCount, double scale) {
            return CapaPenalties.sparse(sampleSize, dimensions, parameterCount, scale);
        }
    },
    /**
     * in between dense and sparse; needs at least two components
     */
    INTERMEDIATE {
        @Override
        public Penalty getPenalty(int sampleSize, int dimensions, int parameterCount, double scale) {
            return CapaPenalties.intermediate(sampleSize, dimensions, parameterCount, scale);
        }
    },
    /**
     * the smallest of the three above for every number of affected components
     */
    COMBINED {
        @Override
        public Penalty getPenalty(int sampleSize, int dimensions, int parameterCount, double scale) {
            return CapaPenalties.combined(sampleSize, dimensions, parameterCount, scale);
        }
    };

    public static PenaltyPolicy fromName(String name) {
        checkNotNull(name, "penalty name must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown penalty: " + name, e);
        }
    }
}
