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

package com.amazon.demandforecast.preprocessor;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The engineered, gap-filled rows of a series that survived the removal of
 * rows with missing values. Every row remembers its index in the original
 * series so that windows never straddle a removed row.
 */
public class FeatureTable {

    private final List<String> featureNames;

    private final int[] rowIndex;

    private final LocalDateTime[] timestamps;

    private final double[] target;

    private final double[][] features;

    public FeatureTable(List<String> featureNames, int[] rowIndex, LocalDateTime[] timestamps, double[] target,
            double[][] features) {
        checkArgument(rowIndex.length == target.length && timestamps.length == target.length
                && features.length == target.length, "incorrect lengths");
        this.featureNames = Collections.unmodifiableList(featureNames);
        this.rowIndex = rowIndex;
        this.timestamps = timestamps;
        this.target = target;
        this.features = features;
    }

    public int size() {
        return target.length;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getFeatureCount() {
        return featureNames.size();
    }

    public int getRowIndex(int i) {
        return rowIndex[i];
    }

    public LocalDateTime getTimestamp(int i) {
        return timestamps[i];
    }

    public double[] getTarget() {
        return Arrays.copyOf(target, target.length);
    }

    public double[][] getFeatures() {
        return features;
    }

    /**
     * @return true if the rows [from, to) were consecutive in the original series
     */
    public boolean isContiguous(int from, int to) {
        checkArgument(from >= 0 && from < to && to <= rowIndex.length, "incorrect range");
        return rowIndex[to - 1] - rowIndex[from] == to - 1 - from;
    }
}
