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

package com.amazon.demandforecast.trend;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * A periodic component expressed as a truncated Fourier series.
 */
@Getter
public class Seasonality {

    public static final Seasonality DAILY = new Seasonality("daily", 24, 4);

    public static final Seasonality WEEKLY = new Seasonality("weekly", 168, 3);

    public static final Seasonality YEARLY = new Seasonality("yearly", 8766, 10);

    private final String name;

    private final double periodHours;

    private final int order;

    public Seasonality(String name, double periodHours, int order) {
        this.name = checkNotNull(name, "name cannot be null");
        checkArgument(!TrendComponents.TREND.equals(name), "reserved name");
        checkArgument(periodHours > 0, "period must be positive");
        checkArgument(order > 0, "order must be positive");
        this.periodHours = periodHours;
        this.order = order;
    }

    public int getColumns() {
        return 2 * order;
    }

    /**
     * writes sin and cos terms of orders 1..order into row starting at offset
     *
     * @param hours absolute time in hours
     */
    public void fill(double hours, double[] row, int offset) {
        for (int k = 1; k <= order; k++) {
            double angle = 2 * Math.PI * k * hours / periodHours;
            row[offset + 2 * (k - 1)] = Math.sin(angle);
            row[offset + 2 * (k - 1) + 1] = Math.cos(angle);
        }
    }

    @Override
    public String toString() {
        return name + "(" + periodHours + "h, order " + order + ")";
    }
}
