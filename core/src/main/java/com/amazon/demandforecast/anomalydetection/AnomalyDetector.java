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

package com.amazon.demandforecast.anomalydetection;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;
import static com.amazon.demandforecast.CommonUtils.round;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.statistics.Deviation;

/**
 * Runs the z-score, IQR and sudden change methods over a series and turns the
 * findings into alerts. The detector keeps no state between calls.
 */
@Slf4j
@Getter
public class AnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 3.0;

    public static final int DEFAULT_WINDOW = 24;

    public static final double DEFAULT_SUDDEN_CHANGE_THRESHOLD = 0.3;

    public static final int DEFAULT_MAX_STATISTICAL_ALERTS = 5;

    public static final int DEFAULT_MAX_CHANGE_ALERTS = 3;

    public static final String DEFAULT_UNIT = "MW";

    public static final String STATISTICAL_RECOMMENDATION =
            "Investigate potential equipment malfunction or unexpected load";

    public static final String CHANGE_RECOMMENDATION =
            "Check for grid events, equipment failures, or data quality issues";

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final double threshold;

    private final int window;

    private final double suddenChangeThreshold;

    private final int maxStatisticalAlerts;

    private final int maxChangeAlerts;

    private final String unit;

    private final ZScoreDetector zScoreDetector;

    private final IqrDetector iqrDetector;

    private final SuddenChangeDetector suddenChangeDetector;

    public AnomalyDetector(Builder builder) {
        checkArgument(builder.maxStatisticalAlerts >= 0 && builder.maxChangeAlerts >= 0,
                "alert limits cannot be negative");
        this.threshold = builder.threshold;
        this.window = builder.window;
        this.suddenChangeThreshold = builder.suddenChangeThreshold;
        this.maxStatisticalAlerts = builder.maxStatisticalAlerts;
        this.maxChangeAlerts = builder.maxChangeAlerts;
        this.unit = checkNotNull(builder.unit, "unit cannot be null");
        this.zScoreDetector = new ZScoreDetector(threshold, window);
        this.iqrDetector = new IqrDetector();
        this.suddenChangeDetector = new SuddenChangeDetector(suddenChangeThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param values     the observations
     * @param timestamps their timestamps, or null
     * @return the anomalies found by each method
     */
    public AnomalyReport analyze(double[] values, LocalDateTime[] timestamps) {
        checkNotNull(values, "values cannot be null");
        checkArgument(timestamps == null || timestamps.length == values.length,
                "values and timestamps must have equal length");
        AnomalyReport report = new AnomalyReport(zScoreDetector.detect(values, timestamps),
                iqrDetector.detect(values, timestamps), suddenChangeDetector.detect(values, timestamps),
                values.length);
        log.debug("analyzed {} values: {}", values.length, report);
        return report;
    }

    public AnomalyReport analyze(TimeSeries series) {
        return analyze(series.getTargetValues(), series.getTimestamps());
    }

    /**
     * the first z-score anomalies followed by the first sudden changes, in index
     * order within each group
     */
    public List<Alert> alerts(double[] values, LocalDateTime[] timestamps) {
        AnomalyReport report = analyze(values, timestamps);
        List<Alert> answer = new ArrayList<>();
        List<AnomalyRecord> statistical = report.getZscoreAnomalies();
        for (int i = 0; i < Math.min(maxStatisticalAlerts, statistical.size()); i++) {
            AnomalyRecord record = statistical.get(i);
            String message = String.format(Locale.ROOT, "Unusual consumption detected: %.0f %s (Z-score: %.2f)",
                    record.getObservedValue(), unit, record.getScore());
            answer.add(new Alert(AlertType.STATISTICAL_ANOMALY, record.getSeverity(), describe(record), message,
                    STATISTICAL_RECOMMENDATION));
        }
        List<AnomalyRecord> changes = report.getSuddenChanges();
        for (int i = 0; i < Math.min(maxChangeAlerts, changes.size()); i++) {
            AnomalyRecord record = changes.get(i);
            String message = String.format(Locale.ROOT, "Sudden %s: %.1f%% change (%.0f → %.0f %s)",
                    record.getDirection().name().toLowerCase(Locale.ROOT), Math.abs(record.getChangePercent()),
                    record.getPreviousValue(), record.getObservedValue(), unit);
            answer.add(new Alert(AlertType.SUDDEN_CHANGE, record.getSeverity(), describe(record), message,
                    CHANGE_RECOMMENDATION));
        }
        return answer;
    }

    public List<Alert> alerts(TimeSeries series) {
        return alerts(series.getTargetValues(), series.getTimestamps());
    }

    static String describe(AnomalyRecord record) {
        return record.hasTimestamp() ? TIMESTAMP_FORMAT.format(record.getTimestamp()) : "Index " + record.getIndex();
    }

    /**
     * the distance of a value from the mean of a history in population standard
     * deviations, relative to the threshold and capped at 100
     *
     * @return a score in [0, 100] rounded to two decimals; 0 if the history has
     *         no spread
     */
    public double anomalyScore(double value, double[] history) {
        checkNotNull(history, "history cannot be null");
        checkArgument(history.length > 0, "history cannot be empty");
        Deviation deviation = new Deviation(history);
        double std = deviation.getDeviation();
        if (std == 0 || Double.isNaN(std)) {
            return 0;
        }
        double z = Math.abs(value - deviation.getMean()) / std;
        return round(Math.min(100, z / threshold * 100), 2);
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int window = DEFAULT_WINDOW;
        private double suddenChangeThreshold = DEFAULT_SUDDEN_CHANGE_THRESHOLD;
        private int maxStatisticalAlerts = DEFAULT_MAX_STATISTICAL_ALERTS;
        private int maxChangeAlerts = DEFAULT_MAX_CHANGE_ALERTS;
        private String unit = DEFAULT_UNIT;

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder window(int window) {
            this.window = window;
            return this;
        }

        public Builder suddenChangeThreshold(double suddenChangeThreshold) {
            this.suddenChangeThreshold = suddenChangeThreshold;
            return this;
        }

        public Builder maxStatisticalAlerts(int maxStatisticalAlerts) {
            this.maxStatisticalAlerts = maxStatisticalAlerts;
            return this;
        }

        public Builder maxChangeAlerts(int maxChangeAlerts) {
            this.maxChangeAlerts = maxChangeAlerts;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public AnomalyDetector build() {
            return new AnomalyDetector(this);
        }
    }
}
