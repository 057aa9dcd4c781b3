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

package com.amazon.demandforecast.inputtypes;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered, fixed step time series of a target column with zero or more
 * covariate columns. The data is stored column-wise; missing values are
 * represented by NaN. Timestamps are strictly increasing with a fixed step.
 *
 * The series is never modified by the forecasting pipeline; all accessors that
 * return arrays return copies.
 */
public class TimeSeries {

    public static final String DEFAULT_TARGET_NAME = "demand";

    public static final Duration DEFAULT_STEP = Duration.ofHours(1);

    private final String targetName;

    private final Duration step;

    private final LocalDateTime[] timestamps;

    private final double[] target;

    private final LinkedHashMap<String, double[]> covariates;

    public TimeSeries(String targetName, Duration step, LocalDateTime[] timestamps, double[] target,
            Map<String, double[]> covariates) {
        checkNotNull(targetName, "target name cannot be null");
        checkNotNull(timestamps, "timestamps cannot be null");
        checkNotNull(target, "target cannot be null");
        checkArgument(timestamps.length == target.length, "timestamps and target must have equal length");
        this.targetName = targetName;
        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
        this.target = Arrays.copyOf(target, target.length);
        this.covariates = new LinkedHashMap<>();
        if (covariates != null) {
            for (Map.Entry<String, double[]> entry : covariates.entrySet()) {
                checkArgument(!targetName.equals(entry.getKey()), "covariate cannot shadow the target");
                checkArgument(entry.getValue().length == target.length, "incorrect length for " + entry.getKey());
                this.covariates.put(entry.getKey(), Arrays.copyOf(entry.getValue(), target.length));
            }
        }
        if (step == null) {
            this.step = (timestamps.length > 1) ? Duration.between(timestamps[0], timestamps[1]) : DEFAULT_STEP;
        } else {
            this.step = step;
        }
        checkArgument(!this.step.isNegative() && !this.step.isZero(), "step must be positive");
        for (int i = 0; i < timestamps.length; i++) {
            checkNotNull(timestamps[i], "timestamps cannot contain null");
            if (i > 0) {
                checkArgument(timestamps[i].isAfter(timestamps[i - 1]), "timestamps must be strictly increasing");
                checkArgument(Duration.between(timestamps[i - 1], timestamps[i]).equals(this.step),
                        "timestamps must have a fixed step, violated at index " + i);
            }
        }
    }

    public TimeSeries(String targetName, LocalDateTime[] timestamps, double[] target) {
        this(targetName, null, timestamps, target, null);
    }

    /**
     * a series of consecutive values starting at a given time
     */
    public static TimeSeries of(LocalDateTime start, Duration step, double[] target, Map<String, double[]> covariates) {
        checkNotNull(start, "start cannot be null");
        LocalDateTime[] timestamps = new LocalDateTime[target.length];
        for (int i = 0; i < target.length; i++) {
            timestamps[i] = start.plus(step.multipliedBy(i));
        }
        return new TimeSeries(DEFAULT_TARGET_NAME, step, timestamps, target, covariates);
    }

    public static TimeSeries of(LocalDateTime start, double[] target) {
        return of(start, DEFAULT_STEP, target, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return target.length;
    }

    public boolean isEmpty() {
        return target.length == 0;
    }

    public String getTargetName() {
        return targetName;
    }

    public Duration getStep() {
        return step;
    }

    public LocalDateTime getTimestamp(int index) {
        checkArgument(index >= 0 && index < timestamps.length, "incorrect index");
        return timestamps[index];
    }

    public LocalDateTime[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public LocalDateTime getLastTimestamp() {
        checkArgument(timestamps.length > 0, "empty series");
        return timestamps[timestamps.length - 1];
    }

    public double getTarget(int index) {
        checkArgument(index >= 0 && index < target.length, "incorrect index");
        return target[index];
    }

    public double[] getTargetValues() {
        return Arrays.copyOf(target, target.length);
    }

    public List<String> getCovariateNames() {
        return Collections.unmodifiableList(new ArrayList<>(covariates.keySet()));
    }

    public boolean hasCovariate(String name) {
        return covariates.containsKey(name);
    }

    public double[] getCovariate(String name) {
        double[] values = covariates.get(name);
        checkArgument(values != null, "no covariate named " + name);
        return Arrays.copyOf(values, values.length);
    }

    public double getCovariate(String name, int index) {
        double[] values = covariates.get(name);
        checkArgument(values != null, "no covariate named " + name);
        return values[index];
    }

    public Sample getSample(int index) {
        Map<String, Double> row = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : covariates.entrySet()) {
            row.put(entry.getKey(), entry.getValue()[index]);
        }
        return new Sample(getTimestamp(index), target[index], row);
    }

    /**
     * @param from inclusive start index
     * @param to   exclusive end index
     * @return a new series with the rows in [from, to)
     */
    public TimeSeries slice(int from, int to) {
        checkArgument(from >= 0 && from <= to && to <= target.length, "incorrect range");
        Map<String, double[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : covariates.entrySet()) {
            sliced.put(entry.getKey(), Arrays.copyOfRange(entry.getValue(), from, to));
        }
        return new TimeSeries(targetName, step, Arrays.copyOfRange(timestamps, from, to),
                Arrays.copyOfRange(target, from, to), sliced);
    }

    public TimeSeries head(int length) {
        return slice(0, Math.min(length, target.length));
    }

    public TimeSeries tail(int length) {
        return slice(Math.max(0, target.length - length), target.length);
    }

    /**
     * @param horizon number of future steps
     * @return the timestamps of the next horizon steps after the last timestamp
     */
    public LocalDateTime[] futureTimestamps(int horizon) {
        checkArgument(horizon >= 0, "horizon cannot be negative");
        LocalDateTime last = getLastTimestamp();
        LocalDateTime[] answer = new LocalDateTime[horizon];
        for (int i = 0; i < horizon; i++) {
            answer[i] = last.plus(step.multipliedBy(i + 1));
        }
        return answer;
    }

    public static class Builder {
        private String targetName = DEFAULT_TARGET_NAME;
        private Duration step;
        private final List<LocalDateTime> timestamps = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
        private final List<Map<String, Double>> rows = new ArrayList<>();
        private final List<String> covariateNames = new ArrayList<>();

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder step(Duration step) {
            this.step = step;
            return this;
        }

        public Builder add(LocalDateTime timestamp, double value) {
            return add(timestamp, value, Collections.emptyMap());
        }

        public Builder add(LocalDateTime timestamp, double value, Map<String, Double> covariates) {
            timestamps.add(timestamp);
            values.add(value);
            rows.add(covariates);
            for (String name : covariates.keySet()) {
                if (!covariateNames.contains(name)) {
                    covariateNames.add(name);
                }
            }
            return this;
        }

        public Builder add(Sample sample) {
            return add(sample.getTimestamp(), sample.getTarget(), sample.getCovariates());
        }

        public TimeSeries build() {
            int size = values.size();
            double[] target = new double[size];
            Map<String, double[]> covariates = new LinkedHashMap<>();
            for (String name : covariateNames) {
                covariates.put(name, new double[size]);
            }
            for (int i = 0; i < size; i++) {
                target[i] = values.get(i);
                for (String name : covariateNames) {
                    Double value = rows.get(i).get(name);
                    covariates.get(name)[i] = (value == null) ? Double.NaN : value;
                }
            }
            return new TimeSeries(targetName, step, timestamps.toArray(new LocalDateTime[0]), target, covariates);
        }
    }
}
