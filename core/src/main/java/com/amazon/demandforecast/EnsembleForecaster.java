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

package com.amazon.demandforecast;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.ensemble.EnsembleCombiner;
import com.amazon.demandforecast.ensemble.EnsembleWeights;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.errors.ShapeMismatchException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.preprocessor.SupervisedData;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.EvaluationMetrics;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.returntypes.ModelFailure;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;
import com.amazon.demandforecast.sequence.ISequenceForecaster;
import com.amazon.demandforecast.state.preprocessor.PreprocessorMapper;
import com.amazon.demandforecast.state.preprocessor.PreprocessorState;
import com.amazon.demandforecast.trend.ITrendForecaster;

/**
 * A forecaster that combines a neural sequence model over engineered features
 * with a trend and seasonality model of the raw target.
 * <p>
 * Each instance owns its preprocessor and both models; instances share nothing
 * and several can be trained side by side, for example one per region. The
 * two forecasting paths fail independently: a failure of one is logged,
 * recorded in the result and the forecast proceeds with the other.
 *
 * <pre>
 * EnsembleForecaster forecaster = EnsembleForecaster.builder().sequenceLength(24).build();
 * forecaster.train(history);
 * ForecastResult result = forecaster.forecast(recent, 24);
 * </pre>
 */
@Slf4j
public class EnsembleForecaster {

    public static final double DEFAULT_TRAIN_FRACTION = 0.8;

    public static final int DEFAULT_HORIZON = 24;

    public static final String SEQUENCE_NAME = "sequence";

    public static final String TREND_NAME = "trend";

    public static final String PREPROCESSOR_SUFFIX = "-preprocessor";

    public static final String SEQUENCE_SUFFIX = "-" + SEQUENCE_NAME;

    public static final String TREND_SUFFIX = "-" + TREND_NAME;

    @Getter
    private Preprocessor preprocessor;

    @Getter
    private final ISequenceForecaster sequenceForecaster;

    @Getter
    private final ITrendForecaster trendForecaster;

    @Getter
    private final EnsembleCombiner combiner;

    @Getter
    private final EnsembleWeights weights;

    @Getter
    private final double trainFraction;

    public EnsembleForecaster(Builder builder) {
        checkArgument(builder.trainFraction > 0 && builder.trainFraction <= 1, "train fraction must be in (0,1]");
        this.preprocessor = (builder.preprocessor != null) ? builder.preprocessor
                : Preprocessor.builder().sequenceLength(builder.sequenceLength).build();
        this.sequenceForecaster = (builder.sequenceForecaster != null) ? builder.sequenceForecaster
                : AbstractNetworkForecaster.builder().type(builder.sequenceModelType).build();
        this.trendForecaster = (builder.trendForecaster != null) ? builder.trendForecaster
                : ITrendForecaster.of(builder.trendModelType);
        this.combiner = checkNotNull(builder.combiner, "combiner cannot be null");
        this.weights = checkNotNull(builder.weights, "weights cannot be null");
        this.trainFraction = builder.trainFraction;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isTrained() {
        return preprocessor.isFitted() && sequenceForecaster.isTrained() && trendForecaster.isTrained();
    }

    /**
     * fits the preprocessor and both models. The first part of the windows
     * trains the sequence model and the rest validates it; the trend model sees
     * the whole series.
     */
    public void train(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        log.info("training ensemble on {} values from {} to {}", series.size(), series.getTimestamp(0),
                series.getLastTimestamp());
        SupervisedData data = preprocessor.fitTransform(series);
        int split = data.splitIndex(trainFraction);
        if (split == 0) {
            split = data.size();
        }
        double[][][] validationX = (split < data.size()) ? data.getX(split, data.size()) : null;
        double[] validationY = (split < data.size()) ? data.getY(split, data.size()) : null;
        sequenceForecaster.train(data.getX(0, split), data.getY(0, split), validationX, validationY);
        trendForecaster.train(series);
        log.info("ensemble trained with {} training and {} validation windows", split, data.size() - split);
    }

    public ForecastResult forecast(TimeSeries recent, int horizon) {
        return forecast(recent, horizon, null);
    }

    /**
     * @param recent           recent history, long enough for the features and
     *                         one full window
     * @param horizon          number of steps after the last timestamp of recent
     * @param futureCovariates raw covariate values over the horizon by name, or
     *                         null to carry the last observed values forward
     * @return one point per step
     * @throws NotTrainedException        before training
     * @throws InsufficientDataException when recent does not fill one window
     * @throws ShapeMismatchException    when recent has other covariates than
     *                                   the training series
     */
    public ForecastResult forecast(TimeSeries recent, int horizon, Map<String, double[]> futureCovariates) {
        checkNotNull(recent, "series cannot be null");
        checkArgument(horizon > 0, "horizon must be positive");
        checkTrained();
        LocalDateTime[] timestamps = recent.futureTimestamps(horizon);
        List<ModelFailure> failures = new ArrayList<>();

        SupervisedData data = preprocessor.transform(recent);
        double[][] window = data.getLatestWindow();
        double[][] futureRows = null;
        if (futureCovariates != null && !futureCovariates.isEmpty()) {
            futureRows = preprocessor.futureRows(window[window.length - 1], timestamps, futureCovariates);
        }

        ComponentForecast sequence = null;
        try {
            sequence = sequenceForecast(window, timestamps, futureRows);
        } catch (RuntimeException e) {
            failures.add(failure(e, Stage.SEQUENCE_MODEL, SEQUENCE_NAME));
        }

        ComponentForecast trend = null;
        try {
            trend = trendForecaster.predict(timestamps);
        } catch (RuntimeException e) {
            failures.add(failure(e, Stage.TREND_MODEL, TREND_NAME));
        }
        return combiner.combine(timestamps, sequence, trend, weights, failures);
    }

    ComponentForecast sequenceForecast(double[][] window, LocalDateTime[] timestamps, double[][] futureRows) {
        double[] scaled = sequenceForecaster.predictSequence(window, timestamps.length, futureRows);
        return new ComponentForecast(SEQUENCE_NAME, timestamps, preprocessor.inverseTransformTarget(scaled));
    }

    static ModelFailure failure(RuntimeException e, Stage defaultStage, String model) {
        Stage stage = (e instanceof ForecastException) ? ((ForecastException) e).getStage() : defaultStage;
        log.warn("{} forecast failed, continuing without it", model, e);
        return new ModelFailure(stage, model, e.getMessage());
    }

    /**
     * forecasts the last horizon values of a series from the values before them
     */
    public EvaluationMetrics evaluate(TimeSeries series, int horizon) {
        checkArgument(horizon > 0 && horizon < series.size(), "horizon must be in (0, size)");
        TimeSeries history = series.head(series.size() - horizon);
        double[] actual = series.tail(horizon).getTargetValues();
        EvaluationMetrics metrics = EvaluationMetrics.of(actual, forecast(history, horizon));
        log.info("evaluation over {} steps: {}", horizon, metrics);
        return metrics;
    }

    /**
     * writes three artifacts named after the given name with the suffixes
     * {@link #PREPROCESSOR_SUFFIX}, {@link #SEQUENCE_SUFFIX} and
     * {@link #TREND_SUFFIX}
     */
    public void save(ModelStore store, String name) {
        checkTrained();
        store.save(name + PREPROCESSOR_SUFFIX, new PreprocessorMapper().toState(preprocessor));
        sequenceForecaster.save(store, name + SEQUENCE_SUFFIX);
        trendForecaster.save(store, name + TREND_SUFFIX);
        log.info("saved ensemble {} to {}", name, store.getDirectory());
    }

    /**
     * replaces the parameters of this instance with stored ones. When a later
     * artifact fails to load the earlier ones may already be replaced; callers
     * retrain in that case.
     */
    public LoadResult<EnsembleForecaster> load(ModelStore store, String name) {
        LoadResult<PreprocessorState> stored = store.load(name + PREPROCESSOR_SUFFIX, PreprocessorState.class);
        if (!stored.isLoaded()) {
            return LoadResult.failed(stored);
        }
        Preprocessor restored;
        try {
            restored = new PreprocessorMapper().toModel(stored.getValue());
            checkArgument(restored.isFitted(), "preprocessor was saved before fitting");
        } catch (ForecastException | IllegalArgumentException e) {
            log.warn("artifact {} cannot be restored: {}", name + PREPROCESSOR_SUFFIX, e.getMessage());
            return LoadResult.corrupt(name + PREPROCESSOR_SUFFIX, e.getMessage());
        }
        LoadResult<ISequenceForecaster> sequence = sequenceForecaster.load(store, name + SEQUENCE_SUFFIX);
        if (!sequence.isLoaded()) {
            return LoadResult.failed(sequence);
        }
        if (sequenceForecaster.getSequenceLength() != restored.getSequenceLength()
                || sequenceForecaster.getWidth() != restored.getWidth()) {
            log.warn("stored network of {} x {} does not match the stored features",
                    sequenceForecaster.getSequenceLength(), sequenceForecaster.getWidth());
            return LoadResult.corrupt(name + SEQUENCE_SUFFIX, "network shape does not match the preprocessor");
        }
        LoadResult<ITrendForecaster> trend = trendForecaster.load(store, name + TREND_SUFFIX);
        if (!trend.isLoaded()) {
            return LoadResult.failed(trend);
        }
        preprocessor = restored;
        log.info("loaded ensemble {} from {}", name, store.getDirectory());
        return LoadResult.loaded(this);
    }

    /**
     * loads the stored ensemble, training and saving a new one only when it is
     * absent or unreadable
     *
     * @return the result of the load attempt
     */
    public LoadResult<EnsembleForecaster> loadOrTrain(ModelStore store, String name, TimeSeries series) {
        LoadResult<EnsembleForecaster> result = load(store, name);
        if (!result.isLoaded()) {
            log.info("{}, training", result);
            train(series);
            save(store, name);
        }
        return result;
    }

    void checkTrained() {
        if (!isTrained()) {
            throw new NotTrainedException(Stage.COMBINER, "ensemble forecaster");
        }
    }

    public static class Builder {
        private Preprocessor preprocessor;
        private ISequenceForecaster sequenceForecaster;
        private ITrendForecaster trendForecaster;
        private int sequenceLength = Preprocessor.DEFAULT_SEQUENCE_LENGTH;
        private SequenceModelType sequenceModelType = AbstractNetworkForecaster.DEFAULT_TYPE;
        private TrendModelType trendModelType = TrendModelType.DECOMPOSITION;
        private EnsembleCombiner combiner = new EnsembleCombiner();
        private EnsembleWeights weights = EnsembleWeights.DEFAULT;
        private double trainFraction = DEFAULT_TRAIN_FRACTION;

        public Builder preprocessor(Preprocessor preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        public Builder sequenceForecaster(ISequenceForecaster sequenceForecaster) {
            this.sequenceForecaster = sequenceForecaster;
            return this;
        }

        public Builder trendForecaster(ITrendForecaster trendForecaster) {
            this.trendForecaster = trendForecaster;
            return this;
        }

        /**
         * ignored when a preprocessor is supplied
         */
        public Builder sequenceLength(int sequenceLength) {
            this.sequenceLength = sequenceLength;
            return this;
        }

        public Builder sequenceModelType(SequenceModelType sequenceModelType) {
            this.sequenceModelType = sequenceModelType;
            return this;
        }

        public Builder trendModelType(TrendModelType trendModelType) {
            this.trendModelType = trendModelType;
            return this;
        }

        public Builder combiner(EnsembleCombiner combiner) {
            this.combiner = combiner;
            return this;
        }

        public Builder weights(EnsembleWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder trainFraction(double trainFraction) {
            this.trainFraction = trainFraction;
            return this;
        }

        public EnsembleForecaster build() {
            return new EnsembleForecaster(this);
        }
    }
}
