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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.anomalydetection.AnomalyMethod;
import com.amazon.demandforecast.anomalydetection.AnomalyRecord;
import com.amazon.demandforecast.anomalydetection.AnomalyReport;

/**
 * A command-line application that echoes the rows read from STDIN with the
 * severity assigned by each anomaly detection method appended, or NA when the
 * method did not flag the row.
 */
public class AnomalyRunner extends SeriesRunner {

    public static final List<String> RESULT_COLUMNS = Arrays.asList("zscore", "iqr", "pct_change");

    public AnomalyRunner() {
        super(AnomalyRunner.class.getName(),
                "Flag anomalous input rows and append the severity found by each method to the output rows.");
        argumentParser.removeArgument("--horizon");
        argumentParser.removeArgument("--sequence-length");
        argumentParser.removeArgument("--sequence-model");
        argumentParser.removeArgument("--trend-model");
        argumentParser.removeArgument("--epochs");
        argumentParser.removeArgument("--model-dir");
        argumentParser.removeArgument("--model-name");
        argumentParser.removeArgument("--random-seed");
    }

    public static void main(String... args) throws IOException {
        AnomalyRunner runner = new AnomalyRunner();
        runner.parse(args);
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    protected AnomalyDetector createDetector() {
        return AnomalyDetector.builder().threshold(argumentParser.getAnomalyThreshold())
                .window(argumentParser.getAnomalyWindow())
                .suddenChangeThreshold(argumentParser.getSuddenChangeThreshold()).build();
    }

    @Override
    protected void process(CsvSeries table, PrintWriter out) {
        AnomalyReport report = createDetector().analyze(table.getSeries());
        int size = table.getRows().size();
        String[][] severities = new String[AnomalyMethod.values().length][size];
        for (AnomalyMethod method : AnomalyMethod.values()) {
            Arrays.fill(severities[method.ordinal()], "NA");
            for (AnomalyRecord record : report.get(method)) {
                severities[method.ordinal()][record.getIndex()] = record.getSeverity().name();
            }
        }

        List<String> header = new ArrayList<>(Arrays.asList(table.getHeader()));
        header.addAll(RESULT_COLUMNS);
        writeRow(header, out);
        for (int i = 0; i < size; i++) {
            List<String> values = new ArrayList<>(Arrays.asList(table.getRows().get(i)));
            for (AnomalyMethod method : AnomalyMethod.values()) {
                values.add(severities[method.ordinal()][i]);
            }
            writeRow(values, out);
        }
    }
}
