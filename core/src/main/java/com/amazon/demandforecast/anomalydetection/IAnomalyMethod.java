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
import java.util.List;

/**
 * A single detection method applied to a complete series.
 */
public interface IAnomalyMethod {

    AnomalyMethod getMethod();

    /**
     * @param values     the observations, NaN for missing ones
     * @param timestamps the timestamps of the observations, may be null
     * @return the flagged observations in index order
     */
    List<AnomalyRecord> detect(double[] values, LocalDateTime[] timestamps);

    static LocalDateTime timestampAt(LocalDateTime[] timestamps, int index) {
        return (timestamps == null) ? null : timestamps[index];
    }
}
