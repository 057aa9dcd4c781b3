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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.OngoingStubbing;

import com.amazon.demandforecast.anomalydetection.AnomalyDetector;

public class AnomalyRunnerTest {

    private AnomalyRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new AnomalyRunner();
        runner.parse("--anomaly-threshold", "3", "--anomaly-window", "24", "--sudden-change-threshold", "0.3");

        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    private static String row(int hour, double value) {
        LocalDateTime timestamp = LocalDateTime.of(2024, 1, 1, 0, 0).plusHours(hour);
        return AnomalyDetector.TIMESTAMP_FORMAT.format(timestamp) + "," + (int) value;
    }

    @Test
    public void testRun() throws IOException {
        OngoingStubbing<String> stubbing = when(in.readLine()).thenReturn("timestamp,load");
        for (int i = 0; i < 48; i++) {
            double value = (i == 30) ? 300 : ((i % 2 == 0) ? 100 : 102);
            stubbing = stubbing.thenReturn(row(i, value));
        }
        stubbing.thenReturn(null);

        runner.run(in, out);
        verify(out).println("timestamp,load,zscore,iqr,pct_change");
        verify(out).println("2024-01-01 00:00:00,100,NA,NA,NA");
        verify(out).println(startsWith("2024-01-02 06:00:00,300,"));
        verify(out).println("2024-01-02 07:00:00,102,NA,NA,HIGH");
        verify(out, times(48)).println(startsWith("2024-01-0"));
        verify(out).flush();
    }

    @Test
    public void testCreateDetector() {
        runner.parse("--anomaly-threshold", "2", "--sudden-change-threshold", "0.5");
        AnomalyDetector detector = runner.createDetector();
        assertEquals(2, detector.getThreshold());
        assertEquals(24, detector.getWindow());
        assertEquals(0.5, detector.getSuddenChangeThreshold());
    }
}
