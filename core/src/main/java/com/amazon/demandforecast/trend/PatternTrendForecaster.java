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
import static com.amazon.demandforecast.CommonUtils.clip;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Random;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.FeatureEngineering;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.RangeVector;
import com.amazon.demandforecast.state.trend.PatternTableMapper;
import com.amazon.demandforecast.state.trend.PatternTrendState;

/**
 * The lightweight trend forecaster: a lookup in a {@link PatternTable} with a
 * small seeded Gaussian jitter, clipped at {@link #MAX_JITTER} standard
 * deviations, a constant band and a confidence that decays over the horizon.
 */
@Slf4j
public class PatternTrendForecaster implements ITrendForecaster {

    public static final String NAME = "pattern";

    public static final double DEFAULT_JITTER_FRACTION = 0.05;

    public static final double DEFAULT_BAND_FRACTION = 0.3;

    public static final long DEFAULT_RANDOM_SEED = 42;

    public static final double MAX_JITTER = 3;

    public static final double BASE_CONFIDENCE = 85;

    public static final double MIN_CONFIDENCE = 60;

    public static final double MAX_CONFIDENCE = 95;

    @Getter
    private final double jitterFraction;

    @Getter
    private final double bandFraction;

    @Getter
    private final long randomSeed;

    @Getter
    private PatternTable table;

    @Getter
    private LocalDateTime start;

    @Getter
    private LocalDateTime end;

    @Getter
    private Duration step;

    public PatternTrendForecaster(Builder builder) {
        checkArgument(builder.jitterFraction >= 0, "jitter cannot be negative");
        checkArgument(builder.bandFraction >= 0, "band cannot be negative");
        this.jitterFraction = builder.jitterFraction;
        this.bandFraction = builder.bandFraction;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TrendModelType getType() {
        return TrendModelType.PATTERN;
    }

    @Override
    public boolean isTrained() {
        return table != null;
    }

    @Override
    public void train(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        table = PatternTable.fit(series.getTimestamps(), series.getTargetValues());
        start = series.getTimestamp(0);
        end = series.getLastTimestamp();
        step = series.getStep();
        log.info("trained pattern table on {} values, mean {} std {}", series.size(), table.getGlobalMean(),
                table.getGlobalStd());
    }

    public void restore(PatternTable table, LocalDateTime start, LocalDateTime end, Duration step) {
        checkArgument(!end.isBefore(start), "incorrect range");
        this.table = checkNotNull(table, "table cannot be null");
        this.start = start;
        this.end = end;
        this.step = checkNotNull(step, "step cannot be null");
    }

    @Override
    public ComponentForecast predictFuture(int steps) {
        checkTrained();
        checkArgument(steps > 0, "steps must be positive");
        LocalDateTime[] timestamps = new LocalDateTime[steps];
        for (int i = 0; i < steps; i++) {
            timestamps[i] = end.plus(step.multipliedBy(i + 1));
        }
        return predict(timestamps);
    }

    @Override
    public ComponentForecast predict(LocalDateTime[] timestamps) {
        checkTrained();
        checkArgument(timestamps.length > 0, "no timestamps to predict");
        Random random = new Random(randomSeed);
        double std = table.getGlobalStd();
        double band = bandFraction * std;
        double[] values = new double[timestamps.length];
        double[] upper = new double[timestamps.length];
        double[] lower = new double[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            double noise = clip(random.nextGaussian(), -MAX_JITTER, MAX_JITTER);
            values[i] = table.estimate(timestamps[i]) + noise * jitterFraction * std;
            upper[i] = values[i] + band;
            lower[i] = values[i] - band;
        }
        return new ComponentForecast(NAME, timestamps, new RangeVector(values, upper, lower), true,
                confidence(timestamps.length));
    }

    /**
     * a confidence in percent for each step of a horizon, decaying from the base
     * confidence with the distance into the horizon
     */
    public static double[] confidence(int horizon) {
        checkArgument(horizon > 0, "horizon must be positive");
        double[] answer = new double[horizon];
        for (int i = 0; i < horizon; i++) {
            answer[i] = clip(BASE_CONFIDENCE * Math.exp(-i / (horizon * 0.5)), MIN_CONFIDENCE, MAX_CONFIDENCE);
        }
        return answer;
    }

    @Override
    public TrendComponents components() {
        checkTrained();
        int length = (int) (Duration.between(start, end).toSeconds() / step.toSeconds()) + 1
                + DecompositionTrendForecaster.COMPONENT_FUTURE_STEPS;
        LocalDateTime[] timestamps = new LocalDateTime[length];
        double[] trend = new double[length];
        double[] daily = new double[length];
        double[] weekly = new double[length];
        double mean = table.getGlobalMean();
        for (int i = 0; i < length; i++) {
            timestamps[i] = start.plus(step.multipliedBy(i));
            trend[i] = mean;
            daily[i] = table.hourly(timestamps[i].getHour()) - mean;
            weekly[i] = table.daily(FeatureEngineering.dayOfWeek(timestamps[i])) - mean;
        }
        TrendComponents answer = new TrendComponents(timestamps);
        answer.put(TrendComponents.TREND, trend);
        answer.put(Seasonality.DAILY.getName(), daily);
        answer.put(Seasonality.WEEKLY.getName(), weekly);
        return answer;
    }

    @Override
    public void save(ModelStore store, String name) {
        checkTrained();
        store.save(name, new PatternTableMapper().toState(this));
    }

    @Override
    public LoadResult<ITrendForecaster> load(ModelStore store, String name) {
        LoadResult<PatternTrendState> stored = store.load(name, PatternTrendState.class);
        if (!stored.isLoaded()) {
            return LoadResult.failed(stored);
        }
        try {
            new PatternTableMapper().restore(this, stored.getValue());
        } catch (ForecastException | IllegalArgumentException e) {
            log.warn("artifact {} cannot be restored: {}", name, e.getMessage());
            return LoadResult.corrupt(name, e.getMessage());
        }
        return LoadResult.loaded(this);
    }

    void checkTrained() {
        if (table == null) {
            throw new NotTrainedException(Stage.TREND_MODEL, NAME + " forecaster");
        }
    }

    public static class Builder {
        private double jitterFraction = DEFAULT_JITTER_FRACTION;
        private double bandFraction = DEFAULT_BAND_FRACTION;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder jitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        public Builder bandFraction(double bandFraction) {
            this.bandFraction = bandFraction;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public PatternTrendForecaster build() {
            return new PatternTrendForecaster(this);
        }
    }
}
