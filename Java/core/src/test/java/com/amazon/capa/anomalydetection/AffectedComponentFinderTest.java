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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.capa.penalty.Penalty;
import com.amazon.capa.returntypes.Anomaly;
import com.amazon.capa.returntypes.Segment;
import com.amazon.capa.saving.CumulativeSums;
import com.amazon.capa.saving.ISaving;
import com.amazon.capa.saving.MeanSaving;

@ExtendWith(MockitoExtension.class)
public class AffectedComponentFinderTest {

    @Mock
    private ISaving<Object> mockSaving;

    @Test
    public void testFind() {
        double[][] data = new double[6][3];
        data[2][1] = 10;
        data[3][1] = 10;
        data[5][0] = 8;
        data[5][2] = -9;
        MeanSaving saving = new MeanSaving();
        CumulativeSums sums = saving.initialize(data);
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(new Penalty(1, new double[] { 5, 5, 5 }));

        List<Anomaly> anomalies = AffectedComponentFinder.find(saving, sums,
                Arrays.asList(new Segment(2, 3), new Segment(5, 5)), optimizer);
        assertEquals(2, anomalies.size());
        assertEquals(new Anomaly(2, 3, new int[] { 1 }), anomalies.get(0));
        assertArrayEquals(new int[] { 0, 2 }, anomalies.get(1).getAffectedComponents());
        assertEquals(5, anomalies.get(1).getStart());
    }

    @Test
    public void testEmpty() {
        MeanSaving saving = new MeanSaving();
        assertEquals(0, AffectedComponentFinder.find(saving, saving.initialize(new double[2][2]),
                Collections.emptyList(), new PenalizedSavingOptimizer(Penalty.zero(2))).size());
    }

    @Test
    public void testIncorrectShape() {
        when(mockSaving.evaluate(any(), any(int[].class), any(int[].class))).thenReturn(new double[1][3]);
        PenalizedSavingOptimizer optimizer = new PenalizedSavingOptimizer(Penalty.zero(2));
        assertThrows(IllegalStateException.class, () -> AffectedComponentFinder.find(mockSaving, new Object(),
                Collections.singletonList(new Segment(0, 1)), optimizer));
    }
}
