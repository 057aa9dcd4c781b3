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

package com.amazon.demandforecast.statistics;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.util.Arrays;

import com.amazon.demandforecast.config.RollingAlignment;

/**
 * Fixed size moving window statistics. An output is defined only when its
 * window lies within the input and contains no missing value; otherwise it is
 * NaN.
 */
public class RollingStatistics {

    private RollingStatistics() {
    }

    /**
     * @return the first index (inclusive) of the window labelled by index
     */
    static int windowStart(int index, int window, RollingAlignment alignment) {
        int offset = (alignment == RollingAlignment.CENTERED) ? (window - 1) / 2 : 0;
        return index + 1 + offset - window;
    }

    public static double[] mean(double[] values, int window, RollingAlignment alignment) {
        checkArgument(window > 0, "window must be positive");
        double[] answer = new double[values.length];
        Arrays.fill(answer, Double.NaN);
        for (int i = 0; i < values.length; i++) {
            int start = windowStart(i, window, alignment);
            if (isComplete(values, start, window)) {
                answer[i] = windowMean(values, start, window);
            }
        }
        return answer;
    }

    /**
     * the sample standard deviation (n - 1 in the denominator) of each window,
     * computed in two passes
     */
    public static double[] standardDeviation(double[] values, int window, RollingAlignment alignment) {
        checkArgument(window > 0, "window must be positive");
        double[] answer = new double[values.length];
        Arrays.fill(answer, Double.NaN);
        if (window < 2) {
            return answer;
        }
        for (int i = 0; i < values.length; i++) {
            int start = windowStart(i, window, alignment);
            if (isComplete(values, start, window)) {
                double mean = windowMean(values, start, window);
                double sum = 0;
                for (int j = start; j < start + window; j++) {
                    sum += (values[j] - mean) * (values[j] - mean);
                }
                answer[i] = Math.sqrt(sum / (window - 1));
            }
        }
        return answer;
    }

    static boolean isComplete(double[] values, int start, int window) {
        if (start < 0 || start + window > values.length) {
            return false;
        }
        for (int j = start; j < start + window; j++) {
            if (Double.isNaN(values[j])) {
                return false;
            }
        }
        return true;
    }

    static double windowMean(double[] values, int start, int window) {
        double sum = 0;
        for (int j = start; j < start + window; j++) {
            sum += values[j];
        }
        return sum / window;
    }
}
