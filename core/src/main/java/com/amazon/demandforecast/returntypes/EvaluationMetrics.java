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

import lombok.Getter;
import lombok.ToString;

/**
 * Accuracy of a forecast against the values that were actually observed.
 */
@Getter
@ToString
public class EvaluationMetrics {

    private final double mae;

    private final double mse;

    private final double rmse;

    /**
     * mean absolute percentage error in percent, over the observations that are
     * not zero
     */
    private final double mape;

    /**
     * fraction (in [0,1]) of observations inside the forecast bounds
     */
    private final double intervalCoverage;

    private final int count;

    public EvaluationMetrics(double mae, double mse, double mape, double intervalCoverage, int count) {
        this.mae = mae;
        this.mse = mse;
        this.rmse = Math.sqrt(mse);
        this.mape = mape;
        this.intervalCoverage = intervalCoverage;
        this.count = count;
    }

    public static EvaluationMetrics of(double[] actual, ForecastResult forecast) {
        checkArgument(actual.length == forecast.size(), "actual values and forecast must have equal length");
        checkArgument(actual.length > 0, "nothing to evaluate");
        RangeVector range = forecast.toRangeVector();
        return of(actual, range.values, range.lower, range.upper);
    }

    public static EvaluationMetrics of(double[] actual, ComponentForecast forecast) {
        checkArgument(actual.length == forecast.size(), "actual values and forecast must have equal length");
        RangeVector range = forecast.getRange();
        if (!forecast.hasNativeBounds()) {
            return of(actual, range.values, null, null);
        }
        return of(actual, range.values, range.lower, range.upper);
    }

    /**
     * @param actual    the observed values
     * @param predicted the point forecasts
     * @param lower     the lower bounds, or null when the forecast has none
     * @param upper     the upper bounds, or null when the forecast has none
     * @return the metrics; the coverage is NaN without bounds
     */
    public static EvaluationMetrics of(double[] actual, double[] predicted, double[] lower, double[] upper) {
        checkArgument(actual.length == predicted.length, "actual and predicted values must have equal length");
        checkArgument(actual.length > 0, "nothing to evaluate");
        boolean bounded = lower != null && upper != null;
        double absolute = 0;
        double squared = 0;
        double percent = 0;
        int percentCount = 0;
        int covered = 0;
        for (int i = 0; i < actual.length; i++) {
            double error = actual[i] - predicted[i];
            absolute += Math.abs(error);
            squared += error * error;
            if (actual[i] != 0) {
                percent += Math.abs(error / actual[i]);
                ++percentCount;
            }
            if (bounded && actual[i] >= lower[i] && actual[i] <= upper[i]) {
                ++covered;
            }
        }
        double mape = (percentCount == 0) ? 0 : 100 * percent / percentCount;
        double coverage = bounded ? (double) covered / actual.length : Double.NaN;
        return new EvaluationMetrics(absolute / actual.length, squared / actual.length, mape, coverage,
                actual.length);
    }
}
