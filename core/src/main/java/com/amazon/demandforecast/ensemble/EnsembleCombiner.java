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

package com.amazon.demandforecast.ensemble;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;
import static com.amazon.demandforecast.CommonUtils.clip;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.demandforecast.errors.EnsembleFailureException;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.ForecastPoint;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.returntypes.ModelFailure;

/**
 * Merges the forecasts of the sequence and trend models into a single forecast
 * with bounds and a confidence score.
 * <p>
 * When both forecasts are present the point is their weighted average and the
 * band half width is proportional to their disagreement. When only one is
 * present it is used as is, with its own bounds if it has any and a band
 * proportional to its magnitude otherwise; a survivor that carries its own
 * confidence keeps it. The combiner holds no state.
 */
@Getter
public class EnsembleCombiner {

    public static final double DEFAULT_DISAGREEMENT_FACTOR = 0.5;

    public static final double DEFAULT_SINGLE_MODEL_BAND = 0.1;

    private final double disagreementFactor;

    private final double singleModelBand;

    public EnsembleCombiner(Builder builder) {
        checkArgument(builder.disagreementFactor >= 0, "disagreement factor cannot be negative");
        checkArgument(builder.singleModelBand >= 0, "single model band cannot be negative");
        this.disagreementFactor = builder.disagreementFactor;
        this.singleModelBand = builder.singleModelBand;
    }

    public EnsembleCombiner() {
        this(new Builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ForecastResult combine(LocalDateTime[] timestamps, ComponentForecast sequence, ComponentForecast trend,
            EnsembleWeights weights) {
        return combine(timestamps, sequence, trend, weights, null);
    }

    /**
     * @param timestamps the timestamps of the horizon
     * @param sequence   the sequence forecast, null if unavailable
     * @param trend      the trend forecast, null if unavailable
     * @param weights    the weights used when both are present
     * @param failures   failures recorded upstream, carried into the result
     * @return the combined forecast
     * @throws EnsembleFailureException if neither forecast is present
     */
    public ForecastResult combine(LocalDateTime[] timestamps, ComponentForecast sequence, ComponentForecast trend,
            EnsembleWeights weights, List<ModelFailure> failures) {
        checkNotNull(timestamps, "timestamps cannot be null");
        checkNotNull(weights, "weights cannot be null");
        List<ModelFailure> recorded = (failures == null) ? new ArrayList<>() : failures;
        if (sequence == null && trend == null) {
            throw new EnsembleFailureException(recorded);
        }
        checkArgument(sequence == null || sequence.size() == timestamps.length, "incorrect sequence forecast length");
        checkArgument(trend == null || trend.size() == timestamps.length, "incorrect trend forecast length");

        List<ForecastPoint> points = new ArrayList<>(timestamps.length);
        for (int i = 0; i < timestamps.length; i++) {
            double point;
            double lower;
            double upper;
            double score;
            double rawSequence = (sequence == null) ? Double.NaN : sequence.getValue(i);
            double rawTrend = (trend == null) ? Double.NaN : trend.getValue(i);
            if (sequence != null && trend != null) {
                point = weights.getSequenceWeight() * rawSequence + weights.getTrendWeight() * rawTrend;
                double uncertainty = disagreementFactor * Math.abs(rawSequence - rawTrend);
                lower = point - uncertainty;
                upper = point + uncertainty;
                score = confidence(point, lower, upper);
            } else {
                ComponentForecast survivor = (sequence != null) ? sequence : trend;
                point = survivor.getValue(i);
                if (survivor.hasNativeBounds()) {
                    lower = survivor.getLower(i);
                    upper = survivor.getUpper(i);
                } else {
                    double uncertainty = singleModelBand * Math.abs(point);
                    lower = point - uncertainty;
                    upper = point + uncertainty;
                }
                score = survivor.hasConfidence() ? survivor.getConfidence(i) : confidence(point, lower, upper);
            }
            points.add(new ForecastPoint(timestamps[i], point, lower, upper, score, rawSequence, rawTrend));
        }
        return new ForecastResult(points, recorded);
    }

    /**
     * the narrower the band relative to the point, the higher the confidence;
     * in [0, 100] and 0 for a zero point
     */
    public static double confidence(double point, double lower, double upper) {
        if (point == 0 || Double.isNaN(point)) {
            return 0;
        }
        return clip(100 * (1 - (upper - lower) / (2 * point)), 0, 100);
    }

    public static class Builder {
        private double disagreementFactor = DEFAULT_DISAGREEMENT_FACTOR;
        private double singleModelBand = DEFAULT_SINGLE_MODEL_BAND;

        public Builder disagreementFactor(double disagreementFactor) {
            this.disagreementFactor = disagreementFactor;
            return this;
        }

        public Builder singleModelBand(double singleModelBand) {
            this.singleModelBand = singleModelBand;
            return this;
        }

        public EnsembleCombiner build() {
            return new EnsembleCombiner(this);
        }
    }
}
