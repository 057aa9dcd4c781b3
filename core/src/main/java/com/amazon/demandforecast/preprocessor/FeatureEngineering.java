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

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.demandforecast.config.RollingAlignment;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.statistics.RollingStatistics;

/**
 * Derives the model features of a series. The column order is fixed: calendar
 * features, covariates in insertion order, lags of the target, then rolling
 * mean and rolling standard deviation for each window.
 */
public class FeatureEngineering {

    public static final String[] TIME_FEATURES = { "hour_sin", "hour_cos", "month_sin", "month_cos", "day_of_week",
            "is_weekend" };

    private final int[] lags;

    private final int[] rollingWindows;

    private final RollingAlignment rollingAlignment;

    private final MissingValueHandler missingValueHandler;

    public FeatureEngineering(int[] lags, int[] rollingWindows, RollingAlignment rollingAlignment,
            MissingValueHandler missingValueHandler) {
        this.lags = Arrays.copyOf(lags, lags.length);
        this.rollingWindows = Arrays.copyOf(rollingWindows, rollingWindows.length);
        this.rollingAlignment = rollingAlignment;
        this.missingValueHandler = missingValueHandler;
    }

    public static double[] timeFeatures(LocalDateTime timestamp) {
        double hour = timestamp.getHour();
        double month = timestamp.getMonthValue();
        int dayOfWeek = dayOfWeek(timestamp);
        return new double[] { Math.sin(2 * Math.PI * hour / 24), Math.cos(2 * Math.PI * hour / 24),
                Math.sin(2 * Math.PI * month / 12), Math.cos(2 * Math.PI * month / 12), dayOfWeek,
                (dayOfWeek >= 5) ? 1 : 0 };
    }

    /**
     * @return the day of the week with Monday as 0 and Sunday as 6
     */
    public static int dayOfWeek(LocalDateTime timestamp) {
        return timestamp.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue();
    }

    public static double[] lag(double[] values, int lag) {
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = (i >= lag) ? values[i - lag] : Double.NaN;
        }
        return answer;
    }

    public List<String> featureNames(TimeSeries series) {
        List<String> names = new ArrayList<>(Arrays.asList(TIME_FEATURES));
        names.addAll(series.getCovariateNames());
        String target = series.getTargetName();
        for (int lag : lags) {
            names.add(target + "_lag_" + lag);
        }
        for (int window : rollingWindows) {
            names.add(target + "_rolling_mean_" + window);
            names.add(target + "_rolling_std_" + window);
        }
        return names;
    }

    /**
     * builds the features from the raw target, fills gaps in every column and
     * drops the rows where any value is still missing
     */
    public FeatureTable build(TimeSeries series) {
        int n = series.size();
        List<String> names = featureNames(series);
        double[] rawTarget = series.getTargetValues();

        List<double[]> columns = new ArrayList<>();
        double[][] calendar = new double[n][];
        for (int i = 0; i < n; i++) {
            calendar[i] = timeFeatures(series.getTimestamp(i));
        }
        for (int j = 0; j < TIME_FEATURES.length; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = calendar[i][j];
            }
            columns.add(column);
        }
        for (String covariate : series.getCovariateNames()) {
            columns.add(series.getCovariate(covariate));
        }
        for (int lag : lags) {
            columns.add(lag(rawTarget, lag));
        }
        for (int window : rollingWindows) {
            columns.add(RollingStatistics.mean(rawTarget, window, rollingAlignment));
            columns.add(RollingStatistics.standardDeviation(rawTarget, window, rollingAlignment));
        }

        double[] target = missingValueHandler.fill(rawTarget);
        List<double[]> filled = new ArrayList<>(columns.size());
        for (double[] column : columns) {
            filled.add(missingValueHandler.fill(column));
        }

        int kept = 0;
        boolean[] complete = new boolean[n];
        for (int i = 0; i < n; i++) {
            complete[i] = !Double.isNaN(target[i]);
            for (int j = 0; j < filled.size() && complete[i]; j++) {
                complete[i] = !Double.isNaN(filled.get(j)[i]);
            }
            if (complete[i]) {
                ++kept;
            }
        }

        int[] rowIndex = new int[kept];
        LocalDateTime[] timestamps = new LocalDateTime[kept];
        double[] keptTarget = new double[kept];
        double[][] features = new double[kept][filled.size()];
        int row = 0;
        for (int i = 0; i < n; i++) {
            if (complete[i]) {
                rowIndex[row] = i;
                timestamps[row] = series.getTimestamp(i);
                keptTarget[row] = target[i];
                for (int j = 0; j < filled.size(); j++) {
                    features[row][j] = filled.get(j)[i];
                }
                ++row;
            }
        }
        return new FeatureTable(names, rowIndex, timestamps, keptTarget, features);
    }

    public int[] getLags() {
        return Arrays.copyOf(lags, lags.length);
    }

    public int[] getRollingWindows() {
        return Arrays.copyOf(rollingWindows, rollingWindows.length);
    }
}
