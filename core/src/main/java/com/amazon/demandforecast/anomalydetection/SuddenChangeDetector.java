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

/**
 * Flags relative changes between consecutive observations larger than a
 * threshold. Pairs with a missing value or a zero previous value are skipped.
 */
@Getter
public class SuddenChangeDetector implements IAnomalyMethod {

    public static final double HIGH_SEVERITY_FACTOR = 2.0;

    private final double changeThreshold;

    public SuddenChangeDetector(double changeThreshold) {
        checkArgument(changeThreshold > 0, "threshold must be positive");
        this.changeThreshold = changeThreshold;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.PCT_CHANGE;
    }

    @Override
    public List<AnomalyRecord> detect(double[] values, LocalDateTime[] timestamps) {
        List<AnomalyRecord> answer = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            double current = values[i];
            if (Double.isNaN(previous) || Double.isNaN(current) || previous == 0) {
                continue;
            }
            double change = (current - previous) / previous;
            if (Math.abs(change) > changeThreshold) {
                Severity severity = (Math.abs(change) > HIGH_SEVERITY_FACTOR * changeThreshold) ? Severity.HIGH
                        : Severity.MEDIUM;
                ChangeDirection direction = (change > 0) ? ChangeDirection.SPIKE : ChangeDirection.DROP;
                double bound = Math.abs(previous) * changeThreshold;
                answer.add(new AnomalyRecord(i, IAnomalyMethod.timestampAt(timestamps, i), current, getMethod(),
                        severity, previous - bound, previous + bound, Math.abs(change) * 100, previous, change * 100,
                        direction));
            }
        }
        return answer;
    }
}
