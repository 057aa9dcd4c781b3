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
import java.util.Collections;
import java.util.List;

/**
 * Chronologically ordered training windows of a series together with the most
 * recent complete window, which seeds a multi step rollout.
 */
public class SupervisedData {

    private final List<FeatureWindow> windows;

    private final List<String> featureNames;

    private final double[][] latestWindow;

    private final LocalDateTime latestTimestamp;

    public SupervisedData(List<FeatureWindow> windows, List<String> featureNames, double[][] latestWindow,
            LocalDateTime latestTimestamp) {
        this.windows = Collections.unmodifiableList(windows);
        this.featureNames = Collections.unmodifiableList(featureNames);
        this.latestWindow = latestWindow;
        this.latestTimestamp = latestTimestamp;
    }

    public int size() {
        return windows.size();
    }

    public List<FeatureWindow> getWindows() {
        return windows;
    }

    /**
     * @return the names of the columns after the target column of each row
     */
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getSequenceLength() {
        return latestWindow.length;
    }

    /**
     * @return the width of every row, the target column included
     */
    public int getWidth() {
        return featureNames.size() + 1;
    }

    public double[][] getLatestWindow() {
        double[][] answer = new double[latestWindow.length][];
        for (int i = 0; i < latestWindow.length; i++) {
            answer[i] = latestWindow[i].clone();
        }
        return answer;
    }

    /**
     * @return the timestamp of the last row of the latest window
     */
    public LocalDateTime getLatestTimestamp() {
        return latestTimestamp;
    }

    public double[][][] getX() {
        return getX(0, windows.size());
    }

    public double[] getY() {
        return getY(0, windows.size());
    }

    public double[][][] getX(int from, int to) {
        checkArgument(from >= 0 && from <= to && to <= windows.size(), "incorrect range");
        double[][][] answer = new double[to - from][][];
        for (int i = from; i < to; i++) {
            answer[i - from] = windows.get(i).getRows();
        }
        return answer;
    }

    public double[] getY(int from, int to) {
        checkArgument(from >= 0 && from <= to && to <= windows.size(), "incorrect range");
        double[] answer = new double[to - from];
        for (int i = from; i < to; i++) {
            answer[i - from] = windows.get(i).getLabel();
        }
        return answer;
    }

    /**
     * the index separating the first fraction of the windows from the rest,
     * preserving chronological order
     */
    public int splitIndex(double fraction) {
        checkArgument(fraction > 0 && fraction <= 1, "fraction must be in (0,1]");
        return (int) (windows.size() * fraction);
    }
}
