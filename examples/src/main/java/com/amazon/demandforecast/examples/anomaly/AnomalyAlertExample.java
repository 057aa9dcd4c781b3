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

package com.amazon.demandforecast.examples.anomaly;

import com.amazon.demandforecast.anomalydetection.Alert;
import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.anomalydetection.AnomalyMethod;
import com.amazon.demandforecast.anomalydetection.AnomalyReport;
import com.amazon.demandforecast.examples.Example;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;

public class AnomalyAlertExample implements Example {

    public static void main(String[] args) throws Exception {
        new AnomalyAlertExample().run();
    }

    @Override
    public String command() {
        return "anomaly_alerts";
    }

    @Override
    public String description() {
        return "detect anomalies in synthetic demand with injected events and print alerts";
    }

    @Override
    public void run() throws Exception {
        DemandData data = DemandDataSets.generate(DemandDataSets.DEFAULT_START, 14, 7, 0.02);
        TimeSeries series = TimeSeries.of(data.timestamps[0], data.demand);
        AnomalyDetector detector = AnomalyDetector.builder().build();

        AnomalyReport report = detector.analyze(series);
        System.out.printf("%d values with %d injected events%n", report.getCount(), data.eventIndices.length);
        for (AnomalyMethod method : AnomalyMethod.values()) {
            System.out.printf("%-12s %d flagged%n", method, report.get(method).size());
        }
        System.out.printf("anomaly rate %.2f%%%n", report.getAnomalyRate());

        for (Alert alert : detector.alerts(series)) {
            System.out.printf("[%s] %s %s: %s%n    %s%n", alert.getSeverity(), alert.getTimestamp(), alert.getType(),
                    alert.getMessage(), alert.getRecommendation());
        }

        double latest = data.demand[data.size() - 1];
        double[] history = new double[data.size() - 1];
        System.arraycopy(data.demand, 0, history, 0, history.length);
        System.out.printf("anomaly score of the latest value: %.2f%n", detector.anomalyScore(latest, history));
    }
}
