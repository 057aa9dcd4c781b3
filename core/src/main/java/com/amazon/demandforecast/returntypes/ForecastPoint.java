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

package com.amazon.demandforecast.returntypes;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One step of an ensemble forecast. The raw estimates are NaN when the
 * corresponding model did not contribute.
 */
@Getter
@ToString
@AllArgsConstructor
public class ForecastPoint {

    private final LocalDateTime timestamp;

    private final double predictedValue;

    private final double lowerBound;

    private final double upperBound;

    /**
     * between 0 and 100
     */
    private final double confidence;

    private final double rawSequenceEstimate;

    private final double rawTrendEstimate;

    public boolean hasSequenceEstimate() {
        return !Double.isNaN(rawSequenceEstimate);
    }

    public boolean hasTrendEstimate() {
        return !Double.isNaN(rawTrendEstimate);
    }
}
