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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class AnomalyTest {

    @Test
    public void testComponentsAreSortedAndCopied() {
        int[] components = new int[] { 4, 0, 2 };
        Anomaly anomaly = new Anomaly(new Segment(10, 12), components);
        components[0] = 7;
        assertArrayEquals(new int[] { 0, 2, 4 }, anomaly.getAffectedComponents());
        anomaly.getAffectedComponents()[0] = 9;
        assertArrayEquals(new int[] { 0, 2, 4 }, anomaly.getAffectedComponents());
        assertEquals(3, anomaly.getNumberOfAffectedComponents());
        assertTrue(anomaly.isAffected(2));
        assertFalse(anomaly.isAffected(1));
        assertEquals(3, anomaly.getLength());
        assertEquals("[10, 12] components [0, 2, 4]", anomaly.toString());
    }

    @Test
    public void testEquality() {
        assertEquals(new Anomaly(1, 3, new int[] { 2, 1 }), new Anomaly(1, 3, new int[] { 1, 2 }));
        assertNotEquals(new Anomaly(1, 3, new int[] { 1 }), new Anomaly(1, 3, new int[] { 1, 2 }));
        assertNotEquals(new Anomaly(1, 3, new int[] { 1 }), new Anomaly(1, 4, new int[] { 1 }));
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(1, 3, new int[0]));
        assertThrows(NullPointerException.class, () -> new Anomaly(1, 3, null));
        assertThrows(IllegalArgumentException.class, () -> new Anomaly(3, 1, new int[] { 0 }));
    }
}
