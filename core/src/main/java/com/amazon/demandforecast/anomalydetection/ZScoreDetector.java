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

package com.amazon.demandforecast.anomalydetection;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.demandforecast.config.RollingAlignment;
import com.amazon.demandforecast.statistics.RollingStatistics;

/**
 * Flags values far from the mean of a centered rolling window, measured in
 * rolling sample standard deviations. Positions where the window is incomplete
 * or the deviation is zero are never flagged.
 */
@Getter
public class ZScoreDetector implements IAnomalyMethod {

    public static final double HIGH_SEVERITY_FACTOR = 1.5;

    private final double threshold;

    private final int window;

    public ZScoreDetector(double threshold, int window) {
        checkArgument(threshold > 0, "threshold must be positive");
        checkArgument(window > 1, "window must be at least 2");
        this.threshold = threshold;
        this.window = window;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.ZSCORE;
    }

    @Override
    public List<AnomalyRecord> detect(double[] values, LocalDateTime[] timestamps) {
        double[] mean = RollingStatistics.mean(values, window, RollingAlignment.CENTERED);
        double[] std = RollingStatistics.standardDeviation(values, window, RollingAlignment.CENTERED);
        List<AnomalyRecord> answer = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i]) || Double.isNaN(std[i]) || std[i] == 0) {
                continue;
            }
            double z = Math.abs(values[i] - mean[i]) / std[i];
            if (z > threshold) {
                Severity severity = (z > HIGH_SEVERITY_FACTOR * threshold) ? Severity.HIGH : Severity.MEDIUM;
                answer.add(new AnomalyRecord(i, IAnomalyMethod.timestampAt(timestamps, i), values[i], getMethod(),
                        severity, mean[i] - threshold * std[i], mean[i] + threshold * std[i], z));
            }
        }
        return answer;
    }
}
