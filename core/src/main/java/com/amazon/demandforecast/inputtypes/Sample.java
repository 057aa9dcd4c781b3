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

package com.amazon.demandforecast.inputtypes;

import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * A read only view of a single row of a {@link TimeSeries}.
 */
@Getter
public class Sample {

    private final LocalDateTime timestamp;

    private final double target;

    private final Map<String, Double> covariates;

    public Sample(LocalDateTime timestamp, double target, Map<String, Double> covariates) {
        this.timestamp = checkNotNull(timestamp, "timestamp cannot be null");
        this.target = target;
        this.covariates = (covariates == null) ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(covariates));
    }

    public Sample(LocalDateTime timestamp, double target) {
        this(timestamp, target, null);
    }

    @Override
    public String toString() {
        return "Sample{" + timestamp + ", " + target + ", " + covariates + "}";
    }
}
