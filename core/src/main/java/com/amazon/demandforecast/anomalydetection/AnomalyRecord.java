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

import lombok.Getter;
import lombok.ToString;

/**
 * A single flagged observation. The previous value, change percent and
 * direction are only defined for {@link AnomalyMethod#PCT_CHANGE} records.
 */
@Getter
@ToString
public class AnomalyRecord {

    private final int index;

    // null when the values were supplied without timestamps
    private final LocalDateTime timestamp;

    private final double observedValue;

    private final AnomalyMethod method;

    private final Severity severity;

    private final double expectedLower;

    private final double expectedUpper;

    // the z-score, the distance to the nearest IQR bound or the absolute change
    // percent
    private final double score;

    private final double previousValue;

    private final double changePercent;

    private final ChangeDirection direction;

    public AnomalyRecord(int index, LocalDateTime timestamp, double observedValue, AnomalyMethod method,
            Severity severity, double expectedLower, double expectedUpper, double score) {
        this(index, timestamp, observedValue, method, severity, expectedLower, expectedUpper, score, Double.NaN,
                Double.NaN, null);
    }

    public AnomalyRecord(int index, LocalDateTime timestamp, double observedValue, AnomalyMethod method,
            Severity severity, double expectedLower, double expectedUpper, double score, double previousValue,
            double changePercent, ChangeDirection direction) {
        this.index = index;
        this.timestamp = timestamp;
        this.observedValue = observedValue;
        this.method = method;
        this.severity = severity;
        this.expectedLower = expectedLower;
        this.expectedUpper = expectedUpper;
        this.score = score;
        this.previousValue = previousValue;
        this.changePercent = changePercent;
        this.direction = direction;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }
}
