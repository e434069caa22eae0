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

import static com.amazon.capa.CommonUtils.checkNotNull;
import static com.amazon.capa.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;

import com.amazon.capa.returntypes.Anomaly;
import com.amazon.capa.returntypes.Segment;
import com.amazon.capa.saving.ISaving;

/**
 * Finds the components implicated in each anomaly. The recursion only keeps the
 * penalized value of an interval, so the saving of every anomaly is evaluated
 * again and the maximizing subset is read off.
 */
public class AffectedComponentFinder {

    private AffectedComponentFinder() {
    }

    /**
     * @param saving     the saving used for detection
     * @param parameters its parameters for the sequence
     * @param segments   the anomalous segments
     * @param optimizer  the optimizer holding the penalty of these segments
     * @param <P>        the parameters of the saving
     * @return the anomalies, in the order of the segments
     */
    public static <P> List<Anomaly> find(ISaving<P> saving, P parameters, List<Segment> segments,
            PenalizedSavingOptimizer optimizer) {
        checkNotNull(saving, "saving must not be null");
        checkNotNull(optimizer, "optimizer must not be null");
        List<Anomaly> answer = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            double[][] savings = saving.evaluate(parameters, new int[] { segment.getStart() },
                    new int[] { segment.getEnd() });
            checkState(savings.length == 1 && savings[0].length == optimizer.getDimensions(),
                    "saving returned an incorrect shape");
            answer.add(new Anomaly(segment, optimizer.getOptimalSubset(savings[0])));
        }
        return answer;
    }
}
