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

package com.amazon.capa.returntypes;

import static com.amazon.capa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.capa.penalty.Penalty;

/**
 * The outcome of one detection run.
 */
public class CapaDescriptor {

    @Getter
    private final List<Anomaly> collectiveAnomalies;

    /**
     * empty if point anomalies were ignored
     */
    @Getter
    private final List<Anomaly> pointAnomalies;

    // optimalSavings[t] is the best penalized saving of rows 0..t
    private final double[] optimalSavings;

    @Getter
    private final Penalty collectivePenalty;

    @Getter
    private final Penalty pointPenalty;

    public CapaDescriptor(List<Anomaly> collectiveAnomalies, List<Anomaly> pointAnomalies, double[] optimalSavings,
            Penalty collectivePenalty, Penalty pointPenalty) {
        checkNotNull(optimalSavings, "optimal savings must not be null");
        this.collectiveAnomalies = Collections.unmodifiableList(new ArrayList<>(collectiveAnomalies));
        this.pointAnomalies = Collections.unmodifiableList(new ArrayList<>(pointAnomalies));
        this.optimalSavings = Arrays.copyOf(optimalSavings, optimalSavings.length);
        this.collectivePenalty = collectivePenalty;
        this.pointPenalty = pointPenalty;
    }

    public double[] getOptimalSavings() {
        return Arrays.copyOf(optimalSavings, optimalSavings.length);
    }

    /**
     * the increase of the optimal saving at every index; positive values mark the
     * end of an anomaly
     *
     * @return one score per row
     */
    public double[] getScores() {
        double[] scores = new double[optimalSavings.length];
        double previous = 0;
        for (int i = 0; i < optimalSavings.length; i++) {
            scores[i] = optimalSavings[i] - previous;
            previous = optimalSavings[i];
        }
        return scores;
    }

    /**
     * @return all reported anomalies ordered by start
     */
    public List<Anomaly> getAnomalies() {
        List<Anomaly> answer = new ArrayList<>(collectiveAnomalies);
        answer.addAll(pointAnomalies);
        answer.sort((a, b) -> Integer.compare(a.getStart(), b.getStart()));
        return answer;
    }

    public int getNumberOfAnomalies() {
        return collectiveAnomalies.size() + pointAnomalies.size();
    }

    public int getLength() {
        return optimalSavings.length;
    }
}
