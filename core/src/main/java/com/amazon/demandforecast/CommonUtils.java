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

package com.amazon.demandforecast;

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
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
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
     * Division that returns the sentinel 0 instead of propagating an infinite or
     * undefined value when the denominator is zero.
     *
     * @param numerator   the numerator
     * @param denominator the denominator
     * @return numerator / denominator, or 0 if the denominator is 0
     */
    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0) {
            return 0;
        }
        return numerator / denominator;
    }

    public static double clip(double value, double lower, double upper) {
        checkArgument(lower <= upper, "incorrect clip range");
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * rounds half away from zero to the given number of decimals, used for
     * reported percentages
     */
    public static double round(double value, int decimals) {
        checkArgument(decimals >= 0, "decimals cannot be negative");
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public static boolean isMissing(double value) {
        return Double.isNaN(value);
    }

    public static double[][] copyOf(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        double[][] answer = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            answer[i] = matrix[i].clone();
        }
        return answer;
    }
}
