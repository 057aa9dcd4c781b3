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
import static com.amazon.demandforecast.CommonUtils.safeDivide;

import java.time.LocalDateTime;
import java.util.Arrays;

import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.preprocessor.FeatureEngineering;
import com.amazon.demandforecast.statistics.Deviation;

/**
 * Mean historical values by hour of the day and by day of the week, together
 * with the overall mean and sample standard deviation. An hour or a day
 * without observations has a NaN entry and falls back to the overall mean.
 */
public class PatternTable {

    public static final int HOURS = 24;

    public static final int DAYS = 7;

    private final double[] hourlyMean;

    private final double[] dailyMean;

    private final double globalMean;

    private final double globalStd;

    public PatternTable(double[] hourlyMean, double[] dailyMean, double globalMean, double globalStd) {
        checkArgument(hourlyMean.length == HOURS, "expected 24 hourly entries");
        checkArgument(dailyMean.length == DAYS, "expected 7 daily entries");
        checkArgument(!Double.isNaN(globalMean), "global mean must be defined");
        this.hourlyMean = Arrays.copyOf(hourlyMean, HOURS);
        this.dailyMean = Arrays.copyOf(dailyMean, DAYS);
        this.globalMean = globalMean;
        this.globalStd = Double.isNaN(globalStd) ? 0 : globalStd;
    }

    /**
     * builds a new table from scratch; missing values are ignored
     */
    public static PatternTable fit(LocalDateTime[] timestamps, double[] values) {
        checkArgument(timestamps.length == values.length, "timestamps and values must have equal length");
        Deviation global = new Deviation();
        Deviation[] hours = new Deviation[HOURS];
        Deviation[] days = new Deviation[DAYS];
        for (int i = 0; i < HOURS; i++) {
            hours[i] = new Deviation();
        }
        for (int i = 0; i < DAYS; i++) {
            days[i] = new Deviation();
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                global.update(values[i]);
                hours[timestamps[i].getHour()].update(values[i]);
                days[FeatureEngineering.dayOfWeek(timestamps[i])].update(values[i]);
            }
        }
        if (global.isEmpty()) {
            throw new InsufficientDataException(Stage.TREND_MODEL, 0, 1);
        }
        double[] hourlyMean = new double[HOURS];
        double[] dailyMean = new double[DAYS];
        for (int i = 0; i < HOURS; i++) {
            hourlyMean[i] = hours[i].isEmpty() ? Double.NaN : hours[i].getMean();
        }
        for (int i = 0; i < DAYS; i++) {
            dailyMean[i] = days[i].isEmpty() ? Double.NaN : days[i].getMean();
        }
        return new PatternTable(hourlyMean, dailyMean, global.getMean(), global.getSampleDeviation());
    }

    public double hourly(int hour) {
        return Double.isNaN(hourlyMean[hour]) ? globalMean : hourlyMean[hour];
    }

    public double daily(int day) {
        return Double.isNaN(dailyMean[day]) ? globalMean : dailyMean[day];
    }

    /**
     * the hourly mean adjusted by the ratio of the weekday mean to the global mean
     */
    public double estimate(LocalDateTime timestamp) {
        double factor = safeDivide(daily(FeatureEngineering.dayOfWeek(timestamp)), globalMean);
        return hourly(timestamp.getHour()) * factor;
    }

    public double[] getHourlyMean() {
        return Arrays.copyOf(hourlyMean, HOURS);
    }

    public double[] getDailyMean() {
        return Arrays.copyOf(dailyMean, DAYS);
    }

    public double getGlobalMean() {
        return globalMean;
    }

    public double getGlobalStd() {
        return globalStd;
    }
}
