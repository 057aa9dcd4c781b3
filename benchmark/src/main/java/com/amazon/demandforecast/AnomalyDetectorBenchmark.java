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

package com.amazon.demandforecast;

import java.time.LocalDateTime;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.demandforecast.anomalydetection.Alert;
import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.anomalydetection.AnomalyReport;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class AnomalyDetectorBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "30", "365" })
        int days;

        @Param({ "24", "168" })
        int window;

        double[] values;
        LocalDateTime[] timestamps;
        AnomalyDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            DemandData data = DemandDataSets.generate(DemandDataSets.DEFAULT_START, days, 0, 0.02);
            values = data.demand;
            timestamps = data.timestamps;
            detector = AnomalyDetector.builder().window(window).build();
        }
    }

    @Benchmark
    public AnomalyReport analyze(BenchmarkState state) {
        return state.detector.analyze(state.values, state.timestamps);
    }

    @Benchmark
    public List<Alert> alerts(BenchmarkState state) {
        return state.detector.alerts(state.values, state.timestamps);
    }
}
