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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import com.amazon.demandforecast.config.SeasonalityMode;
import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.RangeVector;
import com.amazon.demandforecast.state.trend.DecompositionMapper;
import com.amazon.demandforecast.state.trend.DecompositionState;
import com.amazon.demandforecast.statistics.Deviation;

/**
 * Regression of the target on a piecewise linear trend and Fourier
 * seasonalities.
 * <p>
 * The trend is {@code k t + m + sum_j delta_j (t - s_j)+} with changepoints
 * {@code s_j} spread over the first part of the history. The fit is a
 * penalized least squares problem, each coefficient carrying the penalty
 * {@code 1 / (2 scale^2)} of its prior scale, solved by a QR decomposition of
 * the augmented design matrix. In the multiplicative mode the trend is fit
 * first and the seasonalities then explain the ratio {@code y / trend - 1}.
 */
@Slf4j
public class DecompositionTrendForecaster implements ITrendForecaster {

    public static final String NAME = "decomposition";

    public static final int DEFAULT_NUMBER_OF_CHANGEPOINTS = 25;

    public static final double DEFAULT_CHANGEPOINT_RANGE = 0.8;

    public static final double DEFAULT_CHANGEPOINT_PRIOR_SCALE = 0.05;

    public static final double DEFAULT_SEASONALITY_PRIOR_SCALE = 10.0;

    public static final double DEFAULT_TREND_PRIOR_SCALE = 5.0;

    public static final double DEFAULT_INTERVAL_WIDTH = 0.95;

    public static final SeasonalityMode DEFAULT_SEASONALITY_MODE = SeasonalityMode.ADDITIVE;

    /**
     * number of steps after the history included in the components
     */
    public static final int COMPONENT_FUTURE_STEPS = 24;

    @Getter
    private final int numberOfChangepoints;

    @Getter
    private final double changepointRange;

    @Getter
    private final double changepointPriorScale;

    @Getter
    private final double seasonalityPriorScale;

    @Getter
    private final double intervalWidth;

    @Getter
    private final SeasonalityMode seasonalityMode;

    private final List<Seasonality> seasonalities;

    @Getter
    private DecompositionFit fit;

    public DecompositionTrendForecaster(Builder builder) {
        checkArgument(builder.numberOfChangepoints >= 0, "number of changepoints cannot be negative");
        checkArgument(builder.changepointRange > 0 && builder.changepointRange <= 1,
                "changepoint range must be in (0,1]");
        checkArgument(builder.changepointPriorScale > 0, "changepoint prior scale must be positive");
        checkArgument(builder.seasonalityPriorScale > 0, "seasonality prior scale must be positive");
        checkArgument(builder.intervalWidth > 0 && builder.intervalWidth < 1, "interval width must be in (0,1)");
        this.numberOfChangepoints = builder.numberOfChangepoints;
        this.changepointRange = builder.changepointRange;
        this.changepointPriorScale = builder.changepointPriorScale;
        this.seasonalityPriorScale = builder.seasonalityPriorScale;
        this.intervalWidth = builder.intervalWidth;
        this.seasonalityMode = checkNotNull(builder.seasonalityMode, "mode cannot be null");
        List<Seasonality> list = new ArrayList<>();
        if (builder.dailySeasonality) {
            list.add(Seasonality.DAILY);
        }
        if (builder.weeklySeasonality) {
            list.add(Seasonality.WEEKLY);
        }
        if (builder.yearlySeasonality) {
            list.add(Seasonality.YEARLY);
        }
        for (Seasonality extra : builder.extraSeasonalities) {
            for (Seasonality present : list) {
                checkArgument(!present.getName().equals(extra.getName()), "duplicate seasonality " + extra.getName());
            }
            list.add(extra);
        }
        this.seasonalities = Collections.unmodifiableList(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Seasonality> getSeasonalities() {
        return seasonalities;
    }

    @Override
    public TrendModelType getType() {
        return TrendModelType.DECOMPOSITION;
    }

    @Override
    public boolean isTrained() {
        return fit != null;
    }

    public void restore(DecompositionFit fit) {
        this.fit = checkNotNull(fit, "fit cannot be null");
    }

    @Override
    public void train(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        int count = 0;
        for (int i = 0; i < series.size(); i++) {
            if (!Double.isNaN(series.getTarget(i))) {
                ++count;
            }
        }
        if (count < 2) {
            throw new InsufficientDataException(Stage.TREND_MODEL, count, 2);
        }
        double[] hours = new double[count];
        double[] y = new double[count];
        int index = 0;
        double yScale = 0;
        for (int i = 0; i < series.size(); i++) {
            double value = series.getTarget(i);
            if (!Double.isNaN(value)) {
                hours[index] = DecompositionFit.hours(series.getTimestamp(i));
                y[index] = value;
                yScale = Math.max(yScale, Math.abs(value));
                ++index;
            }
        }
        if (yScale == 0) {
            yScale = 1;
        }
        double startHours = hours[0];
        double spanHours = hours[count - 1] - hours[0];
        double[] t = new double[count];
        double[] scaled = new double[count];
        for (int i = 0; i < count; i++) {
            t[i] = (hours[i] - startHours) / spanHours;
            scaled[i] = y[i] / yScale;
        }
        double[] changepoints = changepoints(t);

        double[][] trendDesign = new double[count][];
        double[][] seasonalDesign = new double[count][];
        for (int i = 0; i < count; i++) {
            trendDesign[i] = trendRow(t[i], changepoints);
            seasonalDesign[i] = seasonalRow(hours[i]);
        }
        double[] trendPenalties = trendPenalties(changepoints.length);
        double[] seasonalPenalties = seasonalPenalties(seasonalDesign[0].length);

        double[] trendCoefficients;
        double[] seasonalCoefficients;
        if (seasonalityMode == SeasonalityMode.ADDITIVE) {
            double[][] design = new double[count][];
            for (int i = 0; i < count; i++) {
                design[i] = concat(trendDesign[i], seasonalDesign[i]);
            }
            double[] solution = solve(design, scaled, concat(trendPenalties, seasonalPenalties));
            trendCoefficients = Arrays.copyOfRange(solution, 0, trendPenalties.length);
            seasonalCoefficients = Arrays.copyOfRange(solution, trendPenalties.length, solution.length);
        } else {
            trendCoefficients = solve(trendDesign, scaled, trendPenalties);
            List<double[]> rows = new ArrayList<>();
            List<Double> ratios = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                double trend = dot(trendDesign[i], trendCoefficients);
                if (Math.abs(trend) > 1e-12) {
                    rows.add(seasonalDesign[i]);
                    ratios.add(scaled[i] / trend - 1);
                }
            }
            if (seasonalPenalties.length == 0 || rows.isEmpty()) {
                seasonalCoefficients = new double[seasonalPenalties.length];
            } else {
                double[] target = new double[ratios.size()];
                for (int i = 0; i < target.length; i++) {
                    target[i] = ratios.get(i);
                }
                seasonalCoefficients = solve(rows.toArray(new double[0][]), target, seasonalPenalties);
            }
        }

        double meanAbsDelta = 0;
        for (int j = 2; j < trendCoefficients.length; j++) {
            meanAbsDelta += Math.abs(trendCoefficients[j]);
        }
        meanAbsDelta = (changepoints.length == 0) ? 0 : meanAbsDelta / changepoints.length;

        DecompositionFit candidate = new DecompositionFit(seasonalityMode, series.getTimestamp(0), series.getStep(),
                series.size(), startHours, spanHours, yScale, changepoints, trendCoefficients, seasonalities,
                seasonalCoefficients, 0, meanAbsDelta, intervalWidth);
        Deviation residuals = new Deviation();
        for (int i = 0; i < series.size(); i++) {
            double value = series.getTarget(i);
            if (!Double.isNaN(value)) {
                residuals.update(value - candidate.value(series.getTimestamp(i)));
            }
        }
        double residualStd = (residuals.getCount() < 2) ? 0 : residuals.getSampleDeviation();
        fit = new DecompositionFit(seasonalityMode, series.getTimestamp(0), series.getStep(), series.size(),
                startHours, spanHours, yScale, changepoints, trendCoefficients, seasonalities, seasonalCoefficients,
                residualStd, meanAbsDelta, intervalWidth);
        log.info("trained decomposition on {} values with {} changepoints and {} seasonalities, residual std {}",
                count, changepoints.length, seasonalities.size(), residualStd);
    }

    /**
     * evenly spaced over the first changepointRange of the observations,
     * excluding the first one
     */
    double[] changepoints(double[] t) {
        int history = (int) Math.floor(t.length * changepointRange);
        int number = Math.min(numberOfChangepoints, Math.max(0, history - 1));
        double[] answer = new double[number];
        for (int j = 1; j <= number; j++) {
            int index = (int) Math.round((double) j * (history - 1) / number);
            answer[j - 1] = t[index];
        }
        return answer;
    }

    static double[] trendRow(double t, double[] changepoints) {
        double[] row = new double[changepoints.length + 2];
        row[0] = 1;
        row[1] = t;
        for (int j = 0; j < changepoints.length; j++) {
            row[j + 2] = Math.max(0, t - changepoints[j]);
        }
        return row;
    }

    double[] seasonalRow(double hours) {
        int columns = 0;
        for (Seasonality seasonality : seasonalities) {
            columns += seasonality.getColumns();
        }
        double[] row = new double[columns];
        int offset = 0;
        for (Seasonality seasonality : seasonalities) {
            seasonality.fill(hours, row, offset);
            offset += seasonality.getColumns();
        }
        return row;
    }

    double[] trendPenalties(int changepoints) {
        double[] answer = new double[changepoints + 2];
        answer[0] = penalty(DEFAULT_TREND_PRIOR_SCALE);
        answer[1] = penalty(DEFAULT_TREND_PRIOR_SCALE);
        for (int j = 0; j < changepoints; j++) {
            answer[j + 2] = penalty(changepointPriorScale);
        }
        return answer;
    }

    double[] seasonalPenalties(int columns) {
        double[] answer = new double[columns];
        Arrays.fill(answer, penalty(seasonalityPriorScale));
        return answer;
    }

    static double penalty(double priorScale) {
        return 1.0 / (2 * priorScale * priorScale);
    }

    /**
     * minimizes |X w - y|^2 + sum_j penalties_j w_j^2
     */
    static double[] solve(double[][] design, double[] y, double[] penalties) {
        int rows = design.length;
        int columns = penalties.length;
        double[][] augmented = new double[rows + columns][columns];
        double[] target = new double[rows + columns];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(design[i], 0, augmented[i], 0, columns);
            target[i] = y[i];
        }
        for (int j = 0; j < columns; j++) {
            augmented[rows + j][j] = Math.sqrt(penalties[j]);
        }
        try {
            RealVector solution = new QRDecomposition(MatrixUtils.createRealMatrix(augmented)).getSolver()
                    .solve(new ArrayRealVector(target, false));
            return solution.toArray();
        } catch (SingularMatrixException e) {
            throw new ForecastException(Stage.TREND_MODEL, "degenerate design matrix", e);
        }
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double[] concat(double[] a, double[] b) {
        double[] answer = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, answer, a.length, b.length);
        return answer;
    }

    @Override
    public ComponentForecast predictFuture(int steps) {
        checkTrained();
        checkArgument(steps > 0, "steps must be positive");
        LocalDateTime end = fit.getEnd();
        LocalDateTime[] timestamps = new LocalDateTime[steps];
        for (int i = 0; i < steps; i++) {
            timestamps[i] = end.plus(fit.getStep().multipliedBy(i + 1));
        }
        return predict(timestamps);
    }

    @Override
    public ComponentForecast predict(LocalDateTime[] timestamps) {
        checkTrained();
        checkArgument(timestamps.length > 0, "no timestamps to predict");
        double multiplier = fit.intervalMultiplier();
        double[] values = new double[timestamps.length];
        double[] upper = new double[timestamps.length];
        double[] lower = new double[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            values[i] = fit.value(timestamps[i]);
            double width = multiplier * fit.standardDeviation(timestamps[i]);
            upper[i] = values[i] + width;
            lower[i] = values[i] - width;
        }
        return new ComponentForecast(NAME, timestamps, new RangeVector(values, upper, lower), true);
    }

    @Override
    public TrendComponents components() {
        checkTrained();
        List<Seasonality> fitted = fit.getSeasonalities();
        int length = fit.getHistoryLength() + COMPONENT_FUTURE_STEPS;
        LocalDateTime[] timestamps = new LocalDateTime[length];
        for (int i = 0; i < length; i++) {
            timestamps[i] = fit.getStart().plus(fit.getStep().multipliedBy(i));
        }
        TrendComponents answer = new TrendComponents(timestamps);
        double[] trend = new double[length];
        double[][] seasonal = new double[fitted.size()][length];
        for (int i = 0; i < length; i++) {
            double hours = DecompositionFit.hours(timestamps[i]);
            double scaledTrend = fit.trend(fit.scaledTime(timestamps[i]));
            trend[i] = scaledTrend * fit.getYScale();
            for (int s = 0; s < fitted.size(); s++) {
                double component = fit.seasonal(s, hours) * fit.getYScale();
                seasonal[s][i] = (fit.getMode() == SeasonalityMode.ADDITIVE) ? component : component * scaledTrend;
            }
        }
        answer.put(TrendComponents.TREND, trend);
        for (int s = 0; s < fitted.size(); s++) {
            answer.put(fitted.get(s).getName(), seasonal[s]);
        }
        return answer;
    }

    @Override
    public void save(ModelStore store, String name) {
        checkTrained();
        store.save(name, new DecompositionMapper().toState(this));
    }

    @Override
    public LoadResult<ITrendForecaster> load(ModelStore store, String name) {
        LoadResult<DecompositionState> stored = store.load(name, DecompositionState.class);
        if (!stored.isLoaded()) {
            return LoadResult.failed(stored);
        }
        try {
            restore(new DecompositionMapper().toFit(stored.getValue()));
        } catch (ForecastException | IllegalArgumentException e) {
            log.warn("artifact {} cannot be restored: {}", name, e.getMessage());
            return LoadResult.corrupt(name, e.getMessage());
        }
        return LoadResult.loaded(this);
    }

    void checkTrained() {
        if (fit == null) {
            throw new NotTrainedException(Stage.TREND_MODEL, NAME + " forecaster");
        }
    }

    public static class Builder {
        private int numberOfChangepoints = DEFAULT_NUMBER_OF_CHANGEPOINTS;
        private double changepointRange = DEFAULT_CHANGEPOINT_RANGE;
        private double changepointPriorScale = DEFAULT_CHANGEPOINT_PRIOR_SCALE;
        private double seasonalityPriorScale = DEFAULT_SEASONALITY_PRIOR_SCALE;
        private double intervalWidth = DEFAULT_INTERVAL_WIDTH;
        private SeasonalityMode seasonalityMode = DEFAULT_SEASONALITY_MODE;
        private boolean dailySeasonality = true;
        private boolean weeklySeasonality = true;
        private boolean yearlySeasonality = true;
        private final List<Seasonality> extraSeasonalities = new ArrayList<>();

        public Builder numberOfChangepoints(int numberOfChangepoints) {
            this.numberOfChangepoints = numberOfChangepoints;
            return this;
        }

        public Builder changepointRange(double changepointRange) {
            this.changepointRange = changepointRange;
            return this;
        }

        public Builder changepointPriorScale(double changepointPriorScale) {
            this.changepointPriorScale = changepointPriorScale;
            return this;
        }

        public Builder seasonalityPriorScale(double seasonalityPriorScale) {
            this.seasonalityPriorScale = seasonalityPriorScale;
            return this;
        }

        public Builder intervalWidth(double intervalWidth) {
            this.intervalWidth = intervalWidth;
            return this;
        }

        public Builder seasonalityMode(SeasonalityMode seasonalityMode) {
            this.seasonalityMode = seasonalityMode;
            return this;
        }

        public Builder dailySeasonality(boolean dailySeasonality) {
            this.dailySeasonality = dailySeasonality;
            return this;
        }

        public Builder weeklySeasonality(boolean weeklySeasonality) {
            this.weeklySeasonality = weeklySeasonality;
            return this;
        }

        public Builder yearlySeasonality(boolean yearlySeasonality) {
            this.yearlySeasonality = yearlySeasonality;
            return this;
        }

        public Builder addSeasonality(String name, double periodHours, int order) {
            this.extraSeasonalities.add(new Seasonality(name, periodHours, order));
            return this;
        }

        public DecompositionTrendForecaster build() {
            return new DecompositionTrendForecaster(this);
        }
    }
}
