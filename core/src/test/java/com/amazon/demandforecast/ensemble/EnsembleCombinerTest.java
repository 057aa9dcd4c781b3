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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.demandforecast.errors.EnsembleFailureException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.ForecastPoint;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.returntypes.ModelFailure;
import com.amazon.demandforecast.returntypes.RangeVector;

public class EnsembleCombinerTest {

    private LocalDateTime[] timestamps;
    private EnsembleCombiner combiner;
    private ComponentForecast sequence;
    private ComponentForecast trend;

    @BeforeEach
    public void setUp() {
        LocalDateTime start = LocalDateTime.of(2024, 6, 1, 0, 0);
        timestamps = new LocalDateTime[] { start, start.plusHours(1) };
        combiner = new EnsembleCombiner();
        sequence = new ComponentForecast("sequence", timestamps, new double[] { 1000, 2000 });
        trend = new ComponentForecast("trend", timestamps, new RangeVector(new double[] { 1100, 1800 },
                new double[] { 1200, 1900 }, new double[] { 1000, 1700 }), true);
    }

    @Test
    public void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> EnsembleCombiner.builder().disagreementFactor(-1).build());
        assertThrows(IllegalArgumentException.class, () -> EnsembleCombiner.builder().singleModelBand(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new EnsembleWeights(-0.1, 1));
        assertThrows(IllegalArgumentException.class, () -> new EnsembleWeights(0, 0));
        assertEquals(0.6, EnsembleWeights.DEFAULT.getSequenceWeight());
        assertEquals(0.4, EnsembleWeights.DEFAULT.getTrendWeight());
    }

    @Test
    public void testBothPresent() {
        ForecastResult result = combiner.combine(timestamps, sequence, trend, EnsembleWeights.DEFAULT);
        assertFalse(result.isDegraded());
        ForecastPoint first = result.get(0);
        assertEquals(1040, first.getPredictedValue(), 1e-9);
        assertEquals(990, first.getLowerBound(), 1e-9);
        assertEquals(1090, first.getUpperBound(), 1e-9);
        assertEquals(1000, first.getRawSequenceEstimate());
        assertEquals(1100, first.getRawTrendEstimate());
        assertEquals(100 * (1 - 100.0 / 2080), first.getConfidence(), 1e-9);

        ForecastPoint second = result.get(1);
        assertEquals(1920, second.getPredictedValue(), 1e-9);
        assertEquals(1820, second.getLowerBound(), 1e-9);
        assertEquals(2020, second.getUpperBound(), 1e-9);
    }

    @Test
    public void testWeightsNotNormalized() {
        ForecastResult result = combiner.combine(timestamps, sequence, trend, new EnsembleWeights(1, 1));
        assertEquals(2100, result.get(0).getPredictedValue(), 1e-9);
    }

    @Test
    public void testSequenceOnly() {
        List<ModelFailure> failures = Collections
                .singletonList(new ModelFailure(Stage.TREND_MODEL, "trend", "not trained"));
        ForecastResult result = combiner.combine(timestamps, sequence, null, EnsembleWeights.DEFAULT, failures);
        assertTrue(result.isDegraded());
        assertEquals(failures, result.getFailures());
        ForecastPoint first = result.get(0);
        assertEquals(1000, first.getPredictedValue());
        assertEquals(900, first.getLowerBound(), 1e-9);
        assertEquals(1100, first.getUpperBound(), 1e-9);
        assertEquals(90, first.getConfidence(), 1e-9);
        assertTrue(Double.isNaN(first.getRawTrendEstimate()));
    }

    @Test
    public void testTrendOnlyKeepsNativeBounds() {
        ForecastResult result = combiner.combine(timestamps, null, trend, EnsembleWeights.DEFAULT);
        ForecastPoint second = result.get(1);
        assertEquals(1800, second.getPredictedValue());
        assertEquals(1700, second.getLowerBound());
        assertEquals(1900, second.getUpperBound());
        assertTrue(Double.isNaN(second.getRawSequenceEstimate()));
    }

    @Test
    public void testSurvivorConfidence() {
        ComponentForecast pattern = new ComponentForecast("trend", timestamps, trend.getRange(), true,
                new double[] { 85, 70 });
        ForecastResult alone = combiner.combine(timestamps, null, pattern, EnsembleWeights.DEFAULT);
        assertEquals(85, alone.get(0).getConfidence());
        assertEquals(70, alone.get(1).getConfidence());

        // both present: the disagreement decides
        ForecastResult both = combiner.combine(timestamps, sequence, pattern, EnsembleWeights.DEFAULT);
        assertEquals(100 * (1 - 100.0 / 2080), both.get(0).getConfidence(), 1e-9);

        assertFalse(trend.hasConfidence());
        assertThrows(IllegalArgumentException.class, () -> trend.getConfidence(0));
        assertThrows(IllegalArgumentException.class,
                () -> new ComponentForecast("trend", timestamps, trend.getRange(), true, new double[] { 85 }));
        assertThrows(IllegalArgumentException.class,
                () -> new ComponentForecast("trend", timestamps, trend.getRange(), true, new double[] { 85, 101 }));
    }

    @Test
    public void testNegativeSinglePoint() {
        ComponentForecast negative = new ComponentForecast("sequence", timestamps, new double[] { -100, 0 });
        ForecastResult result = combiner.combine(timestamps, negative, null, EnsembleWeights.DEFAULT);
        assertEquals(-110, result.get(0).getLowerBound(), 1e-9);
        assertEquals(-90, result.get(0).getUpperBound(), 1e-9);
        assertEquals(0, result.get(1).getConfidence());
    }

    @Test
    public void testNeitherPresent() {
        List<ModelFailure> failures = Collections
                .singletonList(new ModelFailure(Stage.SEQUENCE_MODEL, "sequence", "failed"));
        EnsembleFailureException exception = assertThrows(EnsembleFailureException.class,
                () -> combiner.combine(timestamps, null, null, EnsembleWeights.DEFAULT, failures));
        assertSame(Stage.COMBINER, exception.getStage());
        assertEquals(1, exception.getFailures().size());
    }

    @Test
    public void testLengthMismatch() {
        LocalDateTime[] longer = new LocalDateTime[] { timestamps[0], timestamps[1], timestamps[1].plusHours(1) };
        assertThrows(IllegalArgumentException.class,
                () -> combiner.combine(longer, sequence, trend, EnsembleWeights.DEFAULT));
    }

    @Test
    public void testConfidence() {
        assertEquals(0, EnsembleCombiner.confidence(0, -1, 1));
        assertEquals(0, EnsembleCombiner.confidence(Double.NaN, -1, 1));
        assertEquals(100, EnsembleCombiner.confidence(100, 100, 100));
        assertEquals(0, EnsembleCombiner.confidence(10, -100, 100));
        assertEquals(100, EnsembleCombiner.confidence(-10, -11, -9));
        assertEquals(50, EnsembleCombiner.confidence(100, 50, 150), 1e-9);
    }
}
