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

package com.amazon.demandforecast.sequence;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.errors.ShapeMismatchException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.state.sequence.SequenceForecasterMapper;
import com.amazon.demandforecast.state.sequence.SequenceForecasterState;

/**
 * The training loop, multi step rollout and persistence shared by the network
 * based forecasters. Training minimizes the mean squared error with Adam,
 * stops after {@code patience} epochs without improvement of the monitored
 * loss and restores the best parameters; the learning rate is halved after
 * {@code learningRatePatience} such epochs, down to a floor.
 */
@Slf4j
public abstract class AbstractNetworkForecaster implements ISequenceForecaster {

    public static final int DEFAULT_BATCH_SIZE = 32;

    public static final double DEFAULT_LEARNING_RATE = 0.001;

    public static final int DEFAULT_PATIENCE = 10;

    public static final int DEFAULT_LEARNING_RATE_PATIENCE = 5;

    public static final double DEFAULT_LEARNING_RATE_FACTOR = 0.5;

    public static final double DEFAULT_MIN_LEARNING_RATE = 1e-5;

    public static final double DEFAULT_DROPOUT = 0.2;

    public static final long DEFAULT_RANDOM_SEED = 42;

    public static final SequenceModelType DEFAULT_TYPE = SequenceModelType.RECURRENT;

    @Getter
    protected final int epochs;

    @Getter
    protected final int batchSize;

    @Getter
    protected final double learningRate;

    @Getter
    protected final int patience;

    @Getter
    protected final int learningRatePatience;

    @Getter
    protected final double learningRateFactor;

    @Getter
    protected final double minLearningRate;

    @Getter
    protected final long randomSeed;

    protected final int[] layerSizes;

    protected MultiLayerNetwork network;

    @Getter
    protected int sequenceLength;

    @Getter
    protected int width;

    @Getter
    protected TrainingHistory history = new TrainingHistory();

    protected AbstractNetworkForecaster(Builder builder, int defaultEpochs, int[] defaultLayerSizes) {
        this.epochs = (builder.epochs == null) ? defaultEpochs : builder.epochs;
        this.layerSizes = (builder.layerSizes == null) ? defaultLayerSizes
                : Arrays.copyOf(builder.layerSizes, builder.layerSizes.length);
        checkArgument(epochs > 0, "epochs must be positive");
        checkArgument(builder.batchSize > 0, "batch size must be positive");
        checkArgument(builder.learningRate > 0, "learning rate must be positive");
        checkArgument(builder.minLearningRate > 0 && builder.minLearningRate <= builder.learningRate,
                "incorrect minimum learning rate");
        checkArgument(builder.learningRateFactor > 0 && builder.learningRateFactor < 1,
                "learning rate factor must be in (0,1)");
        checkArgument(builder.patience > 0 && builder.learningRatePatience > 0, "patience must be positive");
        for (int size : layerSizes) {
            checkArgument(size > 0, "layer sizes must be positive");
        }
        this.batchSize = builder.batchSize;
        this.learningRate = builder.learningRate;
        this.patience = builder.patience;
        this.learningRatePatience = builder.learningRatePatience;
        this.learningRateFactor = builder.learningRateFactor;
        this.minLearningRate = builder.minLearningRate;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * the network architecture for windows of the given shape
     */
    protected abstract MultiLayerConfiguration configuration(int sequenceLength, int width);

    /**
     * converts windows to the input layout of the trained network
     */
    protected abstract INDArray toInput(double[][][] x);

    /**
     * fits whatever input statistics the network uses into a pending state,
     * called once per training run before any call to
     * {@link #toTrainingInput(double[][][])}
     */
    protected void prepareInput(double[][][] x) {
    }

    /**
     * converts windows with the pending input statistics
     */
    protected INDArray toTrainingInput(double[][][] x) {
        return toInput(x);
    }

    /**
     * makes the pending input statistics current; called only once the fit has
     * succeeded
     */
    protected void commitInput() {
    }

    /**
     * when train is given no validation windows, the number of most recent
     * training windows held out for early stopping; 0 monitors the training loss
     */
    protected int holdOut(int count) {
        return 0;
    }

    public int[] getLayerSizes() {
        return Arrays.copyOf(layerSizes, layerSizes.length);
    }

    public MultiLayerNetwork getNetwork() {
        checkTrained();
        return network;
    }

    @Override
    public boolean isTrained() {
        return network != null;
    }

    @Override
    public void train(double[][][] x, double[] y, double[][][] xVal, double[] yVal) {
        checkNotNull(x, "windows cannot be null");
        checkNotNull(y, "labels cannot be null");
        checkArgument(x.length == y.length, "windows and labels must have equal length");
        checkArgument(x.length > 0, "no windows to train on");
        checkArgument((xVal == null) == (yVal == null), "validation windows and labels go together");
        int length = x[0].length;
        checkArgument(length > 0, "windows cannot be empty");
        int columns = x[0][0].length;
        checkShape(x, length, columns);

        double[][][] trainX = x;
        double[] trainY = y;
        double[][][] validationX = xVal;
        double[] validationY = yVal;
        if (xVal == null) {
            int held = holdOut(x.length);
            if (held > 0) {
                int split = x.length - held;
                trainX = Arrays.copyOfRange(x, 0, split);
                trainY = Arrays.copyOfRange(y, 0, split);
                validationX = Arrays.copyOfRange(x, split, x.length);
                validationY = Arrays.copyOfRange(y, split, y.length);
            }
        } else {
            checkArgument(xVal.length == yVal.length, "validation windows and labels must have equal length");
            if (xVal.length == 0) {
                validationX = null;
                validationY = null;
            } else {
                checkShape(xVal, length, columns);
            }
        }

        // the current model stays usable until the candidate is fit
        prepareInput(trainX);
        MultiLayerNetwork candidate = new MultiLayerNetwork(configuration(length, columns));
        candidate.init();

        DataSet trainData = new DataSet(toTrainingInput(trainX), toLabels(trainY));
        DataSet validationData = (validationX == null) ? null
                : new DataSet(toTrainingInput(validationX), toLabels(validationY));
        TrainingHistory fitted = fit(candidate, trainData, validationData);
        network = candidate;
        sequenceLength = length;
        width = columns;
        history = fitted;
        commitInput();
        log.info("trained {} forecaster on {} windows of {} x {} in {} epochs, best loss {}", getType(),
                trainX.length, length, columns, history.getEpochs(), bestLoss(history, validationData != null));
    }

    TrainingHistory fit(MultiLayerNetwork candidate, DataSet trainData, DataSet validationData) {
        TrainingHistory record = new TrainingHistory();
        double rate = learningRate;
        double best = Double.MAX_VALUE;
        INDArray bestParams = candidate.params().dup();
        int wait = 0;
        int rateWait = 0;
        for (int epoch = 0; epoch < epochs; epoch++) {
            trainData.shuffle(randomSeed + epoch);
            List<DataSet> batches = trainData.batchBy(batchSize);
            for (DataSet batch : batches) {
                candidate.fit(batch);
            }
            double trainingLoss = candidate.score(trainData);
            double validationLoss = (validationData == null) ? Double.NaN : candidate.score(validationData);
            double monitored = (validationData == null) ? trainingLoss : validationLoss;
            record.record(trainingLoss, validationLoss, rate);
            log.debug("epoch {} training loss {} validation loss {} learning rate {}", epoch, trainingLoss,
                    validationLoss, rate);

            if (monitored < best) {
                best = monitored;
                bestParams = candidate.params().dup();
                record.setBestEpoch(epoch);
                wait = 0;
                rateWait = 0;
            } else {
                ++wait;
                ++rateWait;
                if (rateWait >= learningRatePatience && rate > minLearningRate) {
                    rate = Math.max(rate * learningRateFactor, minLearningRate);
                    candidate.setLearningRate(rate);
                    rateWait = 0;
                    log.debug("reducing learning rate to {}", rate);
                }
                if (wait >= patience) {
                    record.setStoppedEarly(true);
                    break;
                }
            }
        }
        candidate.setParams(bestParams);
        return record;
    }

    static double bestLoss(TrainingHistory history, boolean validation) {
        if (history.getBestEpoch() < 0) {
            return Double.NaN;
        }
        List<Double> losses = validation ? history.getValidationLoss() : history.getTrainingLoss();
        return losses.get(history.getBestEpoch());
    }

    @Override
    public double[] predict(double[][][] x) {
        checkTrained();
        checkNotNull(x, "windows cannot be null");
        if (x.length == 0) {
            return new double[0];
        }
        checkShape(x, sequenceLength, width);
        INDArray output = network.output(toInput(x), false);
        double[] answer = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            answer[i] = output.getDouble(i, 0);
        }
        return answer;
    }

    @Override
    public double[] predictSequence(double[][] lastWindow, int steps, double[][] futureRows) {
        checkTrained();
        checkArgument(steps >= 0, "steps cannot be negative");
        checkNotNull(lastWindow, "window cannot be null");
        checkShape(new double[][][] { lastWindow }, sequenceLength, width);
        double[][] current = new double[sequenceLength][];
        for (int i = 0; i < sequenceLength; i++) {
            current[i] = lastWindow[i].clone();
        }
        double[] answer = new double[steps];
        for (int step = 0; step < steps; step++) {
            double estimate = predict(new double[][][] { current })[0];
            answer[step] = estimate;
            double[] row;
            if (futureRows != null && step < futureRows.length && futureRows[step] != null) {
                checkArgument(futureRows[step].length == width, "incorrect width of future row");
                row = futureRows[step].clone();
            } else {
                row = current[sequenceLength - 1].clone();
            }
            row[0] = estimate;
            System.arraycopy(current, 1, current, 0, sequenceLength - 1);
            current[sequenceLength - 1] = row;
        }
        return answer;
    }

    /**
     * installs previously trained parameters
     */
    public void restore(MultiLayerNetwork network, int sequenceLength, int width) {
        checkNotNull(network, "network cannot be null");
        checkArgument(sequenceLength > 0 && width > 0, "incorrect shape");
        this.network = network;
        this.sequenceLength = sequenceLength;
        this.width = width;
        this.history = new TrainingHistory();
    }

    @Override
    public void save(ModelStore store, String name) {
        checkTrained();
        store.save(name, new SequenceForecasterMapper().toState(this));
    }

    @Override
    public LoadResult<ISequenceForecaster> load(ModelStore store, String name) {
        LoadResult<SequenceForecasterState> stored = store.load(name, SequenceForecasterState.class);
        if (!stored.isLoaded()) {
            return LoadResult.failed(stored);
        }
        try {
            new SequenceForecasterMapper().restore(this, stored.getValue());
        } catch (ForecastException | IllegalArgumentException e) {
            log.warn("artifact {} cannot be restored: {}", name, e.getMessage());
            return LoadResult.corrupt(name, e.getMessage());
        }
        return LoadResult.loaded(this);
    }

    protected void checkTrained() {
        if (!isTrained()) {
            throw new NotTrainedException(Stage.SEQUENCE_MODEL, getType().name().toLowerCase() + " forecaster");
        }
    }

    void checkShape(double[][][] x, int length, int columns) {
        for (double[][] window : x) {
            int windowColumns = (window.length == 0) ? 0 : window[0].length;
            if (window.length != length || windowColumns != columns) {
                throw new ShapeMismatchException(Stage.SEQUENCE_MODEL, length, columns, window.length,
                        windowColumns);
            }
            for (double[] row : window) {
                if (row.length != columns) {
                    throw new ShapeMismatchException(Stage.SEQUENCE_MODEL, length, columns, window.length,
                            row.length);
                }
            }
        }
    }

    static INDArray toLabels(double[] y) {
        double[][] labels = new double[y.length][1];
        for (int i = 0; i < y.length; i++) {
            labels[i][0] = y[i];
        }
        return Nd4j.create(labels);
    }

    public static class Builder {
        private SequenceModelType type = DEFAULT_TYPE;
        private Integer epochs;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private double learningRate = DEFAULT_LEARNING_RATE;
        private int patience = DEFAULT_PATIENCE;
        private int learningRatePatience = DEFAULT_LEARNING_RATE_PATIENCE;
        private double learningRateFactor = DEFAULT_LEARNING_RATE_FACTOR;
        private double minLearningRate = DEFAULT_MIN_LEARNING_RATE;
        private double dropout = DEFAULT_DROPOUT;
        private double validationFraction = FeedForwardSequenceForecaster.DEFAULT_VALIDATION_FRACTION;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private int[] layerSizes;

        public Builder type(SequenceModelType type) {
            this.type = checkNotNull(type, "type cannot be null");
            return this;
        }

        public Builder epochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder patience(int patience) {
            this.patience = patience;
            return this;
        }

        public Builder learningRatePatience(int learningRatePatience) {
            this.learningRatePatience = learningRatePatience;
            return this;
        }

        public Builder learningRateFactor(double learningRateFactor) {
            this.learningRateFactor = learningRateFactor;
            return this;
        }

        public Builder minLearningRate(double minLearningRate) {
            this.minLearningRate = minLearningRate;
            return this;
        }

        public Builder dropout(double dropout) {
            this.dropout = dropout;
            return this;
        }

        public Builder validationFraction(double validationFraction) {
            this.validationFraction = validationFraction;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * sizes of the hidden layers; for the recurrent network the two recurrent
         * layers followed by the two dense layers
         */
        public Builder layerSizes(int... layerSizes) {
            this.layerSizes = layerSizes;
            return this;
        }

        public SequenceModelType getType() {
            return type;
        }

        double getDropout() {
            return dropout;
        }

        double getValidationFraction() {
            return validationFraction;
        }

        public ISequenceForecaster build() {
            switch (type) {
            case FEED_FORWARD:
                return new FeedForwardSequenceForecaster(this);
            case RECURRENT:
            default:
                return new RecurrentSequenceForecaster(this);
            }
        }
    }
}
