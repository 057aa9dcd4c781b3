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

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.time.LocalDateTime;
import java.util.Arrays;

import lombok.Getter;

/**
 * The forecast of a single model over a horizon. Models that do not produce
 * bounds of their own carry degenerate ranges (lower == value == upper) and
 * report {@code hasNativeBounds() == false}. A model may also attach its own
 * confidence in percent for each step.
 */
public class ComponentForecast {

    @Getter
    private final String name;

    private final LocalDateTime[] timestamps;

    private final RangeVector range;

    private final boolean nativeBounds;

    private final double[] confidence;

    public ComponentForecast(String name, LocalDateTime[] timestamps, RangeVector range, boolean nativeBounds) {
        this(name, timestamps, range, nativeBounds, null);
    }

    /**
     * @param confidence per step confidence in [0, 100], or null when the model
     *                   has none
     */
    public ComponentForecast(String name, LocalDateTime[] timestamps, RangeVector range, boolean nativeBounds,
            double[] confidence) {
        this.name = checkNotNull(name, "name cannot be null");
        checkNotNull(timestamps, "timestamps cannot be null");
        checkNotNull(range, "range cannot be null");
        checkArgument(timestamps.length == range.size(), "timestamps and values must have equal length");
        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
        this.range = new RangeVector(range);
        this.nativeBounds = nativeBounds;
        if (confidence != null) {
            checkArgument(confidence.length == timestamps.length, "timestamps and confidence must have equal length");
            for (double value : confidence) {
                checkArgument(value >= 0 && value <= 100, "confidence must be in [0, 100]");
            }
            this.confidence = Arrays.copyOf(confidence, confidence.length);
        } else {
            this.confidence = null;
        }
    }

    public ComponentForecast(String name, LocalDateTime[] timestamps, double[] values) {
        this(name, timestamps, new RangeVector(values), false);
    }

    public int size() {
        return timestamps.length;
    }

    public boolean hasNativeBounds() {
        return nativeBounds;
    }

    public boolean hasConfidence() {
        return confidence != null;
    }

    public double getConfidence(int i) {
        checkArgument(confidence != null, name + " has no confidence");
        return confidence[i];
    }

    public LocalDateTime getTimestamp(int i) {
        return timestamps[i];
    }

    public LocalDateTime[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public double getValue(int i) {
        return range.values[i];
    }

    public double getUpper(int i) {
        return range.upper[i];
    }

    public double getLower(int i) {
        return range.lower[i];
    }

    public double[] getValues() {
        return Arrays.copyOf(range.values, range.values.length);
    }

    public RangeVector getRange() {
        return new RangeVector(range);
    }
}
