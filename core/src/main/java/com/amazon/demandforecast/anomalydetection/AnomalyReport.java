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

import static com.amazon.demandforecast.CommonUtils.round;
import static com.amazon.demandforecast.CommonUtils.safeDivide;

import java.util.List;

import lombok.Getter;

/**
 * The anomalies found by each method over one series. The anomaly rate is the
 * percentage of values flagged by the z-score method only.
 */
@Getter
public class AnomalyReport {

    private final List<AnomalyRecord> zscoreAnomalies;

    private final List<AnomalyRecord> iqrAnomalies;

    private final List<AnomalyRecord> suddenChanges;

    private final int count;

    public AnomalyReport(List<AnomalyRecord> zscoreAnomalies, List<AnomalyRecord> iqrAnomalies,
            List<AnomalyRecord> suddenChanges, int count) {
        this.zscoreAnomalies = List.copyOf(zscoreAnomalies);
        this.iqrAnomalies = List.copyOf(iqrAnomalies);
        this.suddenChanges = List.copyOf(suddenChanges);
        this.count = count;
    }

    public int getTotalAnomalies() {
        return zscoreAnomalies.size() + iqrAnomalies.size() + suddenChanges.size();
    }

    public double getAnomalyRate() {
        return round(safeDivide(zscoreAnomalies.size(), count) * 100, 2);
    }

    public List<AnomalyRecord> get(AnomalyMethod method) {
        switch (method) {
        case ZSCORE:
            return zscoreAnomalies;
        case IQR:
            return iqrAnomalies;
        default:
            return suddenChanges;
        }
    }

    @Override
    public String toString() {
        return "AnomalyReport{zscore=" + zscoreAnomalies.size() + ", iqr=" + iqrAnomalies.size() + ", suddenChanges="
                + suddenChanges.size() + ", rate=" + getAnomalyRate() + "}";
    }
}
