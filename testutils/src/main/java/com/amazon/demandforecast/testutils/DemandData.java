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

package com.amazon.demandforecast.testutils;

import java.time.LocalDateTime;

/**
 * Hourly synthetic demand with a temperature covariate and the positions of
 * the injected events.
 */
public class DemandData {

    public final LocalDateTime[] timestamps;

    public final double[] demand;

    public final double[] temperature;

    public final int[] eventIndices;

    public DemandData(LocalDateTime[] timestamps, double[] demand, double[] temperature, int[] eventIndices) {
        this.timestamps = timestamps;
        this.demand = demand;
        this.temperature = temperature;
        this.eventIndices = eventIndices;
    }

    public int size() {
        return demand.length;
    }
}
