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

import static com.amazon.capa.CommonUtils.checkArgument;
import static com.amazon.capa.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.EqualsAndHashCode;

/**
 * A detected anomaly together with the components it affects.
 */
@EqualsAndHashCode(callSuper = true)
public class Anomaly extends Segment {

    // ascending, non-empty
    private final int[] affectedComponents;

    public Anomaly(int start, int end, int[] affectedComponents) {
        super(start, end);
        checkNotNull(affectedComponents, "affected components must not be null");
        checkArgument(affectedComponents.length > 0, "an anomaly affects at least one component");
        this.affectedComponents = Arrays.copyOf(affectedComponents, affectedComponents.length);
        Arrays.sort(this.affectedComponents);
    }

    public Anomaly(Segment segment, int[] affectedComponents) {
        this(segment.getStart(), segment.getEnd(), affectedComponents);
    }

    public int[] getAffectedComponents() {
        return Arrays.copyOf(affectedComponents, affectedComponents.length);
    }

    public int getNumberOfAffectedComponents() {
        return affectedComponents.length;
    }

    public boolean isAffected(int component) {
        return Arrays.binarySearch(affectedComponents, component) >= 0;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "] components " + Arrays.toString(affectedComponents);
    }
}
