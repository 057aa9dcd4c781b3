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

package com.amazon.demandforecast.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.demandforecast.EnsembleForecaster;
import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.returntypes.ForecastPoint;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;
import com.amazon.demandforecast.trend.ITrendForecaster;

/**
 * A command-line application that trains an ensemble on the series read from
 * STDIN and writes the forecast of the following steps to STDOUT.
 */
@Slf4j
public class ForecastRunner extends SeriesRunner {

    public static final List<String> COLUMNS = Arrays.asList("timestamp", "predicted_value", "lower_bound",
            "upper_bound", "confidence", "raw_sequence_estimate", "raw_trend_estimate");

    public ForecastRunner() {
        super(ForecastRunner.class.getName(),
                "Train a forecasting ensemble on the input rows and write a forecast of the following steps.");
        argumentParser.removeArgument("--anomaly-threshold");
        argumentParser.removeArgument("--anomaly-window");
        argumentParser.removeArgument("--sudden-change-threshold");
    }

    public static void main(String... args) throws IOException {
        ForecastRunner runner = new ForecastRunner();
        runner.parse(args);
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    protected EnsembleForecaster createForecaster() {
        AbstractNetworkForecaster.Builder sequence = AbstractNetworkForecaster.builder()
                .type(argumentParser.getSequenceModel()).randomSeed(argumentParser.getRandomSeed());
        if (argumentParser.getEpochs() > 0) {
            sequence.epochs(argumentParser.getEpochs());
        }
        Preprocessor preprocessor = Preprocessor.builder().targetName(argumentParser.getTargetName())
                .sequenceLength(argumentParser.getSequenceLength()).build();
        return EnsembleForecaster.builder().preprocessor(preprocessor).sequenceForecaster(sequence.build())
                .trendForecaster(ITrendForecaster.of(argumentParser.getTrendModel())).build();
    }

    @Override
    protected void process(CsvSeries table, PrintWriter out) {
        TimeSeries series = table.getSeries();
        EnsembleForecaster forecaster = createForecaster();
        if (argumentParser.getModelDirectory().isEmpty()) {
            forecaster.train(series);
        } else {
            forecaster.loadOrTrain(new ModelStore(Paths.get(argumentParser.getModelDirectory())),
                    argumentParser.getModelName(), series);
        }
        ForecastResult result = forecaster.forecast(series, argumentParser.getHorizon());
        if (result.isDegraded()) {
            log.warn("forecast produced without {}", result.getFailures());
        }
        writeRow(COLUMNS, out);
        for (ForecastPoint point : result.getPoints()) {
            List<String> values = new ArrayList<>(COLUMNS.size());
            values.add(AnomalyDetector.TIMESTAMP_FORMAT.format(point.getTimestamp()));
            values.add(Double.toString(point.getPredictedValue()));
            values.add(Double.toString(point.getLowerBound()));
            values.add(Double.toString(point.getUpperBound()));
            values.add(Double.toString(point.getConfidence()));
            values.add(point.hasSequenceEstimate() ? Double.toString(point.getRawSequenceEstimate()) : "NA");
            values.add(point.hasTrendEstimate() ? Double.toString(point.getRawTrendEstimate()) : "NA");
            writeRow(values, out);
        }
    }
}
