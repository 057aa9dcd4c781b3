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

package com.amazon.demandforecast.preprocessor;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * Fills gaps in a column in two passes. Short gaps are forward filled, up to
 * {@code forwardFillLimit} consecutive values; whatever remains is linearly
 * interpolated between the surrounding known values. A gap at the end holds
 * the last known value and a gap at the start stays missing, to be dropped
 * later.
 */
public class MissingValueHandler {

    public static final int DEFAULT_FORWARD_FILL_LIMIT = 3;

    private final int forwardFillLimit;

    public MissingValueHandler(int forwardFillLimit) {
        checkArgument(forwardFillLimit >= 0, "forward fill limit cannot be negative");
        this.forwardFillLimit = forwardFillLimit;
    }

    public MissingValueHandler() {
        this(DEFAULT_FORWARD_FILL_LIMIT);
    }

    public double[] fill(double[] column) {
        return interpolate(forwardFill(column));
    }

    double[] forwardFill(double[] column) {
        double[] answer = Arrays.copyOf(column, column.length);
        double last = Double.NaN;
        int run = 0;
        for (int i = 0; i < answer.length; i++) {
            if (Double.isNaN(column[i])) {
                if (!Double.isNaN(last) && run < forwardFillLimit) {
                    answer[i] = last;
                }
                ++run;
            } else {
                last = column[i];
                run = 0;
            }
        }
        return answer;
    }

    double[] interpolate(double[] column) {
        double[] answer = Arrays.copyOf(column, column.length);
        int previous = -1;
        for (int i = 0; i < answer.length; i++) {
            if (!Double.isNaN(answer[i])) {
                if (previous >= 0 && i - previous > 1) {
                    double step = (answer[i] - answer[previous]) / (i - previous);
                    for (int j = previous + 1; j < i; j++) {
                        answer[j] = answer[previous] + step * (j - previous);
                    }
                }
                previous = i;
            }
        }
        if (previous >= 0) {
            for (int j = previous + 1; j < answer.length; j++) {
                answer[j] = answer[previous];
            }
        }
        return answer;
    }

    public int getForwardFillLimit() {
        return forwardFillLimit;
    }
}
