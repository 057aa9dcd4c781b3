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
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.demandforecast.config.RollingAlignment;
import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.ScalerNotFittedException;
import com.amazon.demandforecast.errors.ShapeMismatchException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.preprocessor.transform.FittedScaler;
import com.amazon.demandforecast.preprocessor.transform.IScaler;

/**
 * Turns a raw series into scaled supervised windows. The target and the
 * feature matrix are scaled independently, with statistics fit once by
 * {@link #fitTransform(TimeSeries)} and reused by {@link #transform(TimeSeries)}
 * and {@link #inverseTransformTarget(double[])}.
 */
@Getter
@Slf4j
public class Preprocessor {

    public static final String DEFAULT_TARGET_NAME = TimeSeries.DEFAULT_TARGET_NAME;

    public static final int[] DEFAULT_LAGS = { 1, 24, 168 };

    public static final int[] DEFAULT_ROLLING_WINDOWS = { 24, 168 };

    public static final int DEFAULT_SEQUENCE_LENGTH = 24;

    public static final ScalingMethod DEFAULT_SCALING_METHOD = ScalingMethod.MIN_MAX;

    public static final RollingAlignment DEFAULT_ROLLING_ALIGNMENT = RollingAlignment.TRAILING;

    private final String targetName;

    private final int[] lags;

    private final int[] rollingWindows;

    private final int sequenceLength;

    private final int forwardFillLimit;

    private final ScalingMethod scalingMethod;

    private final RollingAlignment rollingAlignment;

    private final FeatureEngineering featureEngineering;

    private FittedScaler targetScaler;

    private FittedScaler featureScaler;

    private List<String> featureNames;

    public Preprocessor(Builder builder) {
        checkArgument(builder.sequenceLength > 0, "sequence length must be positive");
        for (int lag : builder.lags) {
            checkArgument(lag > 0, "lags must be positive");
        }
        for (int window : builder.rollingWindows) {
            checkArgument(window > 1, "rolling windows must be larger than 1");
        }
        this.targetName = checkNotNull(builder.targetName, "target name cannot be null");
        this.lags = Arrays.copyOf(builder.lags, builder.lags.length);
        this.rollingWindows = Arrays.copyOf(builder.rollingWindows, builder.rollingWindows.length);
        this.sequenceLength = builder.sequenceLength;
        this.forwardFillLimit = builder.forwardFillLimit;
        this.scalingMethod = builder.scalingMethod;
        this.rollingAlignment = builder.rollingAlignment;
        this.featureEngineering = new FeatureEngineering(lags, rollingWindows, rollingAlignment,
                new MissingValueHandler(forwardFillLimit));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * restores a preprocessor with previously fitted statistics
     */
    public void setFittedState(FittedScaler targetScaler, FittedScaler featureScaler, List<String> featureNames) {
        checkArgument(targetScaler.getColumns() == 1, "target scaler must have a single column");
        checkArgument(featureScaler.getColumns() == featureNames.size(), "feature scaler does not match names");
        this.targetScaler = targetScaler;
        this.featureScaler = featureScaler;
        this.featureNames = new ArrayList<>(featureNames);
    }

    public boolean isFitted() {
        return targetScaler != null;
    }

    /**
     * engineers features, fits both scalers on the result and produces the
     * training windows
     *
     * @param series the training series, not modified
     * @return the windows in chronological order
     */
    public SupervisedData fitTransform(TimeSeries series) {
        checkSeries(series);
        FeatureTable table = featureEngineering.build(series);
        if (table.size() < sequenceLength + 1) {
            throw new InsufficientDataException(Stage.PREPROCESSING, table.size(), sequenceLength + 1);
        }
        double[] target = table.getTarget();
        double[][] targetColumn = new double[target.length][];
        for (int i = 0; i < target.length; i++) {
            targetColumn[i] = new double[] { target[i] };
        }
        targetScaler = IScaler.of(scalingMethod).fit(targetColumn);
        featureScaler = IScaler.of(scalingMethod).fit(table.getFeatures());
        featureNames = new ArrayList<>(table.getFeatureNames());
        SupervisedData answer = window(table);
        if (answer.size() == 0) {
            throw new InsufficientDataException(Stage.PREPROCESSING, 0, 1);
        }
        log.debug("fit {} windows of {} x {} from {} usable rows", answer.size(), sequenceLength, answer.getWidth(),
                table.size());
        return answer;
    }

    /**
     * engineers and scales features with the statistics of the previous fit
     *
     * @param series recent history, at least as long as the sequence length after
     *               the removal of incomplete rows
     * @return windows of the series, possibly none, and the latest window
     */
    public SupervisedData transform(TimeSeries series) {
        checkFitted();
        checkSeries(series);
        FeatureTable table = featureEngineering.build(series);
        if (!table.getFeatureNames().equals(featureNames)) {
            throw new ShapeMismatchException(Stage.PREPROCESSING, sequenceLength, featureNames.size() + 1,
                    sequenceLength, table.getFeatureCount() + 1);
        }
        if (table.size() < sequenceLength) {
            throw new InsufficientDataException(Stage.PREPROCESSING, table.size(), sequenceLength);
        }
        return window(table);
    }

    public double transformTarget(double value) {
        checkFitted();
        return targetScaler.transform(0, value);
    }

    public double[] inverseTransformTarget(double[] values) {
        checkFitted();
        return targetScaler.invertColumn(0, values);
    }

    /**
     * scaled feature rows for future steps. Calendar features follow the future
     * timestamps and covariates take the supplied values; every other feature
     * keeps its value from the last observed row.
     *
     * @param lastRow          the last row of a window, target column included
     * @param timestamps       the future timestamps
     * @param futureCovariates raw covariate values per future step, by name
     * @return one full row (target column set to 0) per future step
     */
    public double[][] futureRows(double[] lastRow, LocalDateTime[] timestamps, Map<String, double[]> futureCovariates) {
        checkFitted();
        checkArgument(lastRow.length == featureNames.size() + 1, "incorrect row width");
        double[][] answer = new double[timestamps.length][];
        for (int step = 0; step < timestamps.length; step++) {
            double[] row = Arrays.copyOf(lastRow, lastRow.length);
            row[0] = 0;
            double[] calendar = FeatureEngineering.timeFeatures(timestamps[step]);
            for (int j = 0; j < calendar.length; j++) {
                row[j + 1] = featureScaler.transform(j, calendar[j]);
            }
            for (Map.Entry<String, double[]> entry : futureCovariates.entrySet()) {
                int column = featureNames.indexOf(entry.getKey());
                checkArgument(column >= 0, "unknown covariate " + entry.getKey());
                double[] values = entry.getValue();
                if (step < values.length && !Double.isNaN(values[step])) {
                    row[column + 1] = featureScaler.transform(column, values[step]);
                }
            }
            answer[step] = row;
        }
        return answer;
    }

    public FittedScaler getTargetScaler() {
        checkFitted();
        return targetScaler;
    }

    public FittedScaler getFeatureScaler() {
        checkFitted();
        return featureScaler;
    }

    public List<String> getFeatureNames() {
        checkFitted();
        return new ArrayList<>(featureNames);
    }

    public int[] getLags() {
        return Arrays.copyOf(lags, lags.length);
    }

    public int[] getRollingWindows() {
        return Arrays.copyOf(rollingWindows, rollingWindows.length);
    }

    /**
     * @return the width of a window row, the target column included
     */
    public int getWidth() {
        checkFitted();
        return featureNames.size() + 1;
    }

    void checkFitted() {
        if (targetScaler == null || featureScaler == null) {
            throw new ScalerNotFittedException(scalingMethod.name());
        }
    }

    void checkSeries(TimeSeries series) {
        checkNotNull(series, "series cannot be null");
        checkArgument(series.getTargetName().equals(targetName),
                "expected target " + targetName + " found " + series.getTargetName());
    }

    SupervisedData window(FeatureTable table) {
        double[] scaledTarget = targetScaler.transformColumn(0, table.getTarget());
        double[][] scaledFeatures = featureScaler.transform(table.getFeatures());
        int width = table.getFeatureCount() + 1;
        double[][] rows = new double[table.size()][width];
        for (int i = 0; i < table.size(); i++) {
            rows[i][0] = scaledTarget[i];
            System.arraycopy(scaledFeatures[i], 0, rows[i], 1, width - 1);
        }

        List<FeatureWindow> windows = new ArrayList<>();
        for (int i = sequenceLength; i < table.size(); i++) {
            if (table.isContiguous(i - sequenceLength, i + 1)) {
                windows.add(new FeatureWindow(copyRows(rows, i - sequenceLength, i), scaledTarget[i],
                        table.getTimestamp(i)));
            }
        }
        int end = table.size();
        if (!table.isContiguous(end - sequenceLength, end)) {
            throw new InsufficientDataException(Stage.PREPROCESSING, 0, sequenceLength);
        }
        return new SupervisedData(windows, table.getFeatureNames(), copyRows(rows, end - sequenceLength, end),
                table.getTimestamp(end - 1));
    }

    static double[][] copyRows(double[][] rows, int from, int to) {
        double[][] answer = new double[to - from][];
        for (int i = from; i < to; i++) {
            answer[i - from] = rows[i].clone();
        }
        return answer;
    }

    public static class Builder {
        private String targetName = DEFAULT_TARGET_NAME;
        private int[] lags = DEFAULT_LAGS;
        private int[] rollingWindows = DEFAULT_ROLLING_WINDOWS;
        private int sequenceLength = DEFAULT_SEQUENCE_LENGTH;
        private int forwardFillLimit = MissingValueHandler.DEFAULT_FORWARD_FILL_LIMIT;
        private ScalingMethod scalingMethod = DEFAULT_SCALING_METHOD;
        private RollingAlignment rollingAlignment = DEFAULT_ROLLING_ALIGNMENT;

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder lags(int... lags) {
            this.lags = lags;
            return this;
        }

        public Builder rollingWindows(int... rollingWindows) {
            this.rollingWindows = rollingWindows;
            return this;
        }

        public Builder sequenceLength(int sequenceLength) {
            this.sequenceLength = sequenceLength;
            return this;
        }

        public Builder forwardFillLimit(int forwardFillLimit) {
            this.forwardFillLimit = forwardFillLimit;
            return this;
        }

        public Builder scalingMethod(ScalingMethod scalingMethod) {
            this.scalingMethod = scalingMethod;
            return this;
        }

        public Builder rollingAlignment(RollingAlignment rollingAlignment) {
            this.rollingAlignment = rollingAlignment;
            return this;
        }

        public Preprocessor build() {
            return new Preprocessor(this);
        }
    }
}
