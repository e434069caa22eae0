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

import static com.amazon.capa.CommonUtils.checkState;
import static com.amazon.capa.anomalydetection.PartitioningResult.NO_ANOMALY;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.amazon.capa.returntypes.Segment;

/**
 * Recovers the anomalies of the optimal partition by walking the recorded
 * anomaly starts from the last index backwards. The interior of a collective
 * anomaly is skipped, which makes the segments disjoint.
 */
public class AnomalyReconstructor {

    private AnomalyReconstructor() {
    }

    /**
     * @param anomalyStarts for every index, the start of the anomaly ending there
     *                      or {@link PartitioningResult#NO_ANOMALY}
     * @return the anomalous segments in ascending order
     */
    public static List<Segment> reconstruct(int[] anomalyStarts) {
        List<Segment> answer = new ArrayList<>();
        int i = anomalyStarts.length - 1;
        while (i >= 0) {
            int start = anomalyStarts[i];
            if (start == NO_ANOMALY) {
                i--;
            } else {
                checkState(0 <= start && start <= i, "incorrect anomaly start " + start + " at " + i);
                answer.add(new Segment(start, i));
                i = start - 1;
            }
        }
        Collections.reverse(answer);
        return answer;
    }

    public static List<Segment> reconstruct(PartitioningResult result) {
        return reconstruct(result.getAnomalyStarts());
    }

    public static List<Segment> collective(List<Segment> segments) {
        return segments.stream().filter(s -> !s.isPoint()).collect(Collectors.toList());
    }

    public static List<Segment> points(List<Segment> segments) {
        return segments.stream().filter(Segment::isPoint).collect(Collectors.toList());
    }
}
