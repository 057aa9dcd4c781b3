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

package com.amazon.demandforecast.examples.forecasting;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.amazon.demandforecast.EnsembleForecaster;
import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.examples.Example;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.returntypes.EvaluationMetrics;
import com.amazon.demandforecast.returntypes.ForecastPoint;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;

/**
 * Trains an ensemble on synthetic hourly demand with a temperature covariate,
 * evaluates it on the last day, stores it and forecasts the following day from
 * the stored copy.
 */
public class EnsembleForecastExample implements Example {

    public static void main(String[] args) throws Exception {
        new EnsembleForecastExample().run();
    }

    @Override
    public String command() {
        return "ensemble_forecast";
    }

    @Override
    public String description() {
        return "train a forecasting ensemble on synthetic demand and forecast the next day";
    }

    @Override
    public void run() throws Exception {
        int days = 21;
        int horizon = 24;
        DemandData data = DemandDataSets.generate(days, 0);
        Map<String, double[]> covariates = new HashMap<>();
        covariates.put("temperature", data.temperature);
        TimeSeries series = TimeSeries.of(data.timestamps[0], TimeSeries.DEFAULT_STEP, data.demand, covariates);

        EnsembleForecaster forecaster = create();
        forecaster.train(series.head(series.size() - horizon));
        EvaluationMetrics metrics = forecaster.evaluate(series, horizon);
        System.out.printf("holdout of %d steps: mae = %.2f, rmse = %.2f, mape = %.2f%%, coverage = %.1f%%%n",
                metrics.getCount(), metrics.getMae(), metrics.getRmse(), metrics.getMape(),
                metrics.getIntervalCoverage());

        Path directory = Files.createTempDirectory("demand-forecast");
        ModelStore store = new ModelStore(directory);
        forecaster.train(series);
        forecaster.save(store, "example");

        EnsembleForecaster restored = create();
        LoadResult<EnsembleForecaster> result = restored.loadOrTrain(store, "example", series);
        System.out.printf("models stored in %s, reload status %s%n", directory, result.getStatus());

        ForecastResult forecast = restored.forecast(series, horizon);
        if (forecast.isDegraded()) {
            System.out.println("forecast produced without " + forecast.getFailures());
        }
        for (ForecastPoint point : forecast.getPoints()) {
            System.out.printf("%s %10.2f [%10.2f, %10.2f] confidence %5.1f%n",
                    AnomalyDetector.TIMESTAMP_FORMAT.format(point.getTimestamp()), point.getPredictedValue(),
                    point.getLowerBound(), point.getUpperBound(), point.getConfidence());
        }
    }

    private static EnsembleForecaster create() {
        return EnsembleForecaster.builder()
                .preprocessor(Preprocessor.builder().lags(1, 24).rollingWindows(24).sequenceLength(24).build())
                .sequenceForecaster(AbstractNetworkForecaster.builder().type(SequenceModelType.FEED_FORWARD)
                        .epochs(20).randomSeed(42).build())
                .build();
    }
}
