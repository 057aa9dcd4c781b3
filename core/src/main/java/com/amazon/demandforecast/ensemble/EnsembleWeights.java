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

package com.amazon.demandforecast.ensemble;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import lombok.Getter;
import lombok.ToString;

/**
 * Relative weights of the sequence and trend forecasts in the combined point
 * estimate.
 */
@Getter
@ToString
public class EnsembleWeights {

    public static final double DEFAULT_SEQUENCE_WEIGHT = 0.6;

    public static final double DEFAULT_TREND_WEIGHT = 0.4;

    public static final EnsembleWeights DEFAULT = new EnsembleWeights(DEFAULT_SEQUENCE_WEIGHT, DEFAULT_TREND_WEIGHT);

    private final double sequenceWeight;

    private final double trendWeight;

    public EnsembleWeights(double sequenceWeight, double trendWeight) {
        checkArgument(sequenceWeight >= 0 && trendWeight >= 0, "weights cannot be negative");
        checkArgument(sequenceWeight + trendWeight > 0, "weights cannot both be zero");
        this.sequenceWeight = sequenceWeight;
        this.trendWeight = trendWeight;
    }
}
