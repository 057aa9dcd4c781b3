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

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.amazon.demandforecast.config.SeasonalityMode;

/**
 * The fitted parameters of a decomposition. Time is measured in units of the
 * training span, starting at 0; the target is divided by its largest absolute
 * training value.
 */
@Getter
public class DecompositionFit {

    private final SeasonalityMode mode;

    private final LocalDateTime start;

    private final Duration step;

    private final int historyLength;

    private final double startHours;

    private final double spanHours;

    private final double yScale;

    private final double[] changepoints;

    /**
     * offset, slope and the slope change at each changepoint
     */
    private final double[] trendCoefficients;

    private final List<Seasonality> seasonalities;

    private final double[] seasonalCoefficients;

    private final double residualStd;

    private final double meanAbsDelta;

    private final double intervalWidth;

    public DecompositionFit(SeasonalityMode mode, LocalDateTime start, Duration step, int historyLength,
            double startHours, double spanHours, double yScale, double[] changepoints, double[] trendCoefficients,
            List<Seasonality> seasonalities, double[] seasonalCoefficients, double residualStd, double meanAbsDelta,
            double intervalWidth) {
        this.mode = checkNotNull(mode, "mode cannot be null");
        this.start = checkNotNull(start, "start cannot be null");
        this.step = checkNotNull(step, "step cannot be null");
        checkArgument(historyLength > 1, "incorrect history length");
        checkArgument(spanHours > 0, "span must be positive");
        checkArgument(yScale > 0, "scale must be positive");
        checkArgument(trendCoefficients.length == changepoints.length + 2, "incorrect number of trend coefficients");
        int columns = 0;
        for (Seasonality seasonality : seasonalities) {
            columns += seasonality.getColumns();
        }
        checkArgument(seasonalCoefficients.length == columns, "incorrect number of seasonal coefficients");
        checkArgument(intervalWidth > 0 && intervalWidth < 1, "interval width must be in (0,1)");
        this.historyLength = historyLength;
        this.startHours = startHours;
        this.spanHours = spanHours;
        this.yScale = yScale;
        this.changepoints = Arrays.copyOf(changepoints, changepoints.length);
        this.trendCoefficients = Arrays.copyOf(trendCoefficients, trendCoefficients.length);
        this.seasonalities = Collections.unmodifiableList(seasonalities);
        this.seasonalCoefficients = Arrays.copyOf(seasonalCoefficients, seasonalCoefficients.length);
        this.residualStd = residualStd;
        this.meanAbsDelta = meanAbsDelta;
        this.intervalWidth = intervalWidth;
    }

    public static double hours(LocalDateTime timestamp) {
        return timestamp.toEpochSecond(ZoneOffset.UTC) / 3600.0;
    }

    public double scaledTime(LocalDateTime timestamp) {
        return (hours(timestamp) - startHours) / spanHours;
    }

    /**
     * the piecewise linear trend in scaled units
     */
    public double trend(double t) {
        double value = trendCoefficients[0] + trendCoefficients[1] * t;
        for (int j = 0; j < changepoints.length; j++) {
            if (t > changepoints[j]) {
                value += trendCoefficients[j + 2] * (t - changepoints[j]);
            }
        }
        return value;
    }

    /**
     * the contribution of one seasonality in scaled units (a ratio for the
     * multiplicative mode)
     */
    public double seasonal(int index, double hours) {
        int offset = 0;
        for (int i = 0; i < index; i++) {
            offset += seasonalities.get(i).getColumns();
        }
        Seasonality seasonality = seasonalities.get(index);
        double[] row = new double[seasonality.getColumns()];
        seasonality.fill(hours, row, 0);
        double value = 0;
        for (int j = 0; j < row.length; j++) {
            value += row[j] * seasonalCoefficients[offset + j];
        }
        return value;
    }

    public double seasonal(double hours) {
        double value = 0;
        for (int i = 0; i < seasonalities.size(); i++) {
            value += seasonal(i, hours);
        }
        return value;
    }

    /**
     * the point estimate in original units
     */
    public double value(LocalDateTime timestamp) {
        double hours = hours(timestamp);
        double trend = trend((hours - startHours) / spanHours);
        double seasonal = seasonal(hours);
        return (mode == SeasonalityMode.ADDITIVE) ? (trend + seasonal) * yScale : trend * (1 + seasonal) * yScale;
    }

    /**
     * the standard deviation of an estimate: the residual deviation widened by
     * the expected effect of changepoints after the training span, which occur
     * at the historical rate with slope changes of the historical mean magnitude
     */
    public double standardDeviation(LocalDateTime timestamp) {
        double hours = hours(timestamp);
        double beyond = Math.max(0, (hours - startHours) / spanHours - 1);
        double trendVariance = changepoints.length * 2 * meanAbsDelta * meanAbsDelta * beyond * beyond * beyond / 3;
        double trendStd = yScale * Math.sqrt(trendVariance);
        if (mode == SeasonalityMode.MULTIPLICATIVE) {
            trendStd *= Math.abs(1 + seasonal(hours));
        }
        return Math.sqrt(residualStd * residualStd + trendStd * trendStd);
    }

    /**
     * the multiple of the standard deviation that covers the interval width of a
     * normal distribution
     */
    public double intervalMultiplier() {
        return new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + intervalWidth / 2);
    }

    public LocalDateTime getEnd() {
        return start.plus(step.multipliedBy(historyLength - 1));
    }

    public double[] getChangepoints() {
        return Arrays.copyOf(changepoints, changepoints.length);
    }

    public double[] getTrendCoefficients() {
        return Arrays.copyOf(trendCoefficients, trendCoefficients.length);
    }

    public double[] getSeasonalCoefficients() {
        return Arrays.copyOf(seasonalCoefficients, seasonalCoefficients.length);
    }
}
