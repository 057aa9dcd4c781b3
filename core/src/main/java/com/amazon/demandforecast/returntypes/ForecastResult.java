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

import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.List;

/**
 * The immutable outcome of an ensemble forecast: one point per horizon step and
 * the failures of any model that could not contribute.
 */
public class ForecastResult {

    private final List<ForecastPoint> points;

    private final List<ModelFailure> failures;

    public ForecastResult(List<ForecastPoint> points, List<ModelFailure> failures) {
        this.points = List.copyOf(checkNotNull(points, "points cannot be null"));
        this.failures = (failures == null) ? Collections.emptyList() : List.copyOf(failures);
    }

    public ForecastResult(List<ForecastPoint> points) {
        this(points, null);
    }

    public List<ForecastPoint> getPoints() {
        return points;
    }

    public List<ModelFailure> getFailures() {
        return failures;
    }

    public ForecastPoint get(int i) {
        return points.get(i);
    }

    public int size() {
        return points.size();
    }

    public boolean isDegraded() {
        return !failures.isEmpty();
    }

    public double[] getPredictedValues() {
        double[] answer = new double[points.size()];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = points.get(i).getPredictedValue();
        }
        return answer;
    }

    public RangeVector toRangeVector() {
        int n = points.size();
        double[] values = new double[n];
        double[] upper = new double[n];
        double[] lower = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = points.get(i).getPredictedValue();
            upper[i] = points.get(i).getUpperBound();
            lower[i] = points.get(i).getLowerBound();
        }
        return new RangeVector(values, upper, lower);
    }
}
