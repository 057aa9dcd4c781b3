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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Flags values outside the Tukey fences {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}
 * of the whole series. The quartiles interpolate linearly between order
 * statistics and ignore missing values.
 */
public class IqrDetector implements IAnomalyMethod {

    public static final double FENCE_FACTOR = 1.5;

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.IQR;
    }

    @Override
    public List<AnomalyRecord> detect(double[] values, LocalDateTime[] timestamps) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        List<AnomalyRecord> answer = new ArrayList<>();
        if (present.length == 0) {
            return answer;
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(present);
        double q1 = percentile.evaluate(25);
        double q3 = percentile.evaluate(75);
        double iqr = q3 - q1;
        double lower = q1 - FENCE_FACTOR * iqr;
        double upper = q3 + FENCE_FACTOR * iqr;
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value < lower || value > upper) {
                Severity severity = (value < lower - iqr || value > upper + iqr) ? Severity.HIGH : Severity.MEDIUM;
                double deviation = Math.min(Math.abs(value - lower), Math.abs(value - upper));
                answer.add(new AnomalyRecord(i, IAnomalyMethod.timestampAt(timestamps, i), value, getMethod(),
                        severity, lower, upper, deviation));
            }
        }
        return answer;
    }
}
