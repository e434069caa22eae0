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

package com.amazon.capa;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Validates a sequence given as rows of observations: it must be non-empty,
     * rectangular with at least one column, and contain only finite values.
     *
     * @param data the sequence, one row per time index
     * @return the number of columns
     * @throws IllegalArgumentException if any of the conditions fail
     */
    public static int checkSequence(double[][] data) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 0, "data must contain at least one row");
        checkNotNull(data[0], "rows must not be null");
        int columns = data[0].length;
        checkArgument(columns > 0, "data must contain at least one column");
        for (int i = 0; i < data.length; i++) {
            checkNotNull(data[i], "rows must not be null");
            checkArgument(data[i].length == columns, "row " + i + " has " + data[i].length
                    + " values, expected " + columns);
            for (int j = 0; j < columns; j++) {
                checkArgument(Double.isFinite(data[i][j]),
                        "data cannot contain missing or infinite values, found " + data[i][j] + " at (" + i + ", "
                                + j + ")");
            }
        }
        return columns;
    }
}
