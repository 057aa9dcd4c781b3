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

import java.time.LocalDateTime;

import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.EvaluationMetrics;

/**
 * A forecaster that models the target as a function of time alone and
 * produces a point estimate with native bounds for any timestamp.
 */
public interface ITrendForecaster {

    /**
     * fits the model on the raw target; every call replaces the previous fit
     */
    void train(TimeSeries series);

    /**
     * @param steps number of steps after the end of the training series
     * @return point, lower and upper per step
     */
    ComponentForecast predictFuture(int steps);

    /**
     * @param timestamps any timestamps, in increasing order
     * @return point, lower and upper per timestamp; the horizon step of a
     *         timestamp is its position in the array
     */
    ComponentForecast predict(LocalDateTime[] timestamps);

    /**
     * @return the additive decomposition of the fit over the training series and
     *         the following day
     */
    TrendComponents components();

    boolean isTrained();

    TrendModelType getType();

    default EvaluationMetrics evaluate(TimeSeries test) {
        return EvaluationMetrics.of(test.getTargetValues(), predict(test.getTimestamps()));
    }

    void save(ModelStore store, String name);

    /**
     * replaces the parameters of this instance with a stored artifact, if one
     * can be read
     */
    LoadResult<ITrendForecaster> load(ModelStore store, String name);

    static ITrendForecaster of(TrendModelType type) {
        switch (type) {
        case PATTERN:
            return PatternTrendForecaster.builder().build();
        case DECOMPOSITION:
        default:
            return DecompositionTrendForecaster.builder().build();
        }
    }
}
