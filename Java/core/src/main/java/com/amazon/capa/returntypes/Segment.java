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

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A closed interval {@code [start, end]} of time indices. A segment of length one
 * is a point anomaly, a longer one is a collective anomaly.
 */
@Getter
@EqualsAndHashCode
public class Segment {

    protected final int start;

    protected final int end;

    public Segment(int start, int end) {
        checkArgument(start >= 0, "start must be non-negative");
        checkArgument(start <= end, "start cannot exceed end");
        this.start = start;
        this.end = end;
    }

    public int getLength() {
        return end - start + 1;
    }

    public boolean isPoint() {
        return start == end;
    }

    public boolean contains(int index) {
        return start <= index && index <= end;
    }

    public boolean overlaps(Segment other) {
        return start <= other.end && other.start <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
