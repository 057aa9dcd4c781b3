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

package com.amazon.demandforecast.returntypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class EvaluationMetricsTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 0, 0);

    @Test
    public void testPointMetrics() {
        EvaluationMetrics metrics = EvaluationMetrics.of(new double[] { 100, 200 }, new double[] { 110, 180 }, null,
                null);
        assertEquals(15, metrics.getMae(), 1e-10);
        assertEquals(250, metrics.getMse(), 1e-10);
        assertEquals(Math.sqrt(250), metrics.getRmse(), 1e-10);
        assertEquals(10, metrics.getMape(), 1e-10);
        assertTrue(Double.isNaN(metrics.getIntervalCoverage()));
        assertEquals(2, metrics.getCount());
    }

    @Test
    public void testZeroActualsSkippedInPercentError() {
        EvaluationMetrics metrics = EvaluationMetrics.of(new double[] { 0, 50 }, new double[] { 5, 25 }, null, null);
        assertEquals(50, metrics.getMape(), 1e-10);
        EvaluationMetrics zeros = EvaluationMetrics.of(new double[] { 0 }, new double[] { 5 }, null, null);
        assertEquals(0, zeros.getMape());
    }

    @Test
    public void testCoverage() {
        ForecastResult forecast = new ForecastResult(Arrays.asList(
                new ForecastPoint(START, 100, 90, 110, 90, 100, 100),
                new ForecastPoint(START.plusHours(1), 100, 95, 105, 95, 100, 100)));
        EvaluationMetrics metrics = EvaluationMetrics.of(new double[] { 108, 108 }, forecast);
        assertEquals(0.5, metrics.getIntervalCoverage(), 1e-10);
        assertEquals(8, metrics.getMae(), 1e-10);
        assertThrows(IllegalArgumentException.class, () -> EvaluationMetrics.of(new double[] { 1 }, forecast));
    }

    @Test
    public void testComponentForecast() {
        LocalDateTime[] timestamps = new LocalDateTime[] { START, START.plusHours(1) };
        ComponentForecast plain = new ComponentForecast("sequence", timestamps, new double[] { 10, 20 });
        assertTrue(Double.isNaN(EvaluationMetrics.of(new double[] { 10, 20 }, plain).getIntervalCoverage()));
        ComponentForecast bounded = new ComponentForecast("trend", timestamps,
                new RangeVector(new double[] { 10, 20 }, new double[] { 12, 21 }, new double[] { 8, 19 }), true);
        EvaluationMetrics metrics = EvaluationMetrics.of(new double[] { 11, 25 }, bounded);
        assertEquals(0.5, metrics.getIntervalCoverage(), 1e-10);
        assertEquals(3, metrics.getMae(), 1e-10);
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> EvaluationMetrics.of(new double[0], new double[0], null, null));
        assertThrows(IllegalArgumentException.class,
                () -> EvaluationMetrics.of(new double[1], new double[2], null, null));
    }
}
