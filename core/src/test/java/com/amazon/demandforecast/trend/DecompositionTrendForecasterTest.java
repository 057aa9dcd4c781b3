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

import static com.amazon.demandforecast.testutils.DemandDataSets.periodic;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.demandforecast.config.SeasonalityMode;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.EvaluationMetrics;
import com.amazon.demandforecast.testutils.DemandDataSets;

public class DecompositionTrendForecasterTest {

    private static final int LENGTH = 24 * 21;

    private TimeSeries series;

    private DecompositionTrendForecaster.Builder dailyOnly() {
        return DecompositionTrendForecaster.builder().numberOfChangepoints(5).weeklySeasonality(false)
                .yearlySeasonality(false);
    }

    private static double expected(int index) {
        return 1000 + 100 * Math.cos(2 * Math.PI * index / 24) + 0.5 * index;
    }

    @BeforeEach
    public void setUp() {
        series = TimeSeries.of(DemandDataSets.DEFAULT_START, periodic(LENGTH, 24, 100, 1000, 0.5, 5, 0));
    }

    @Test
    public void testConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> DecompositionTrendForecaster.builder().numberOfChangepoints(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> DecompositionTrendForecaster.builder().changepointRange(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> DecompositionTrendForecaster.builder().intervalWidth(1).build());
        assertThrows(IllegalArgumentException.class,
                () -> DecompositionTrendForecaster.builder().addSeasonality("daily", 24, 2).build());
        assertThrows(IllegalArgumentException.class,
                () -> DecompositionTrendForecaster.builder().addSeasonality(TrendComponents.TREND, 24, 2).build());
        DecompositionTrendForecaster forecaster = DecompositionTrendForecaster.builder()
                .addSeasonality("monthly", 730.5, 5).build();
        assertEquals(4, forecaster.getSeasonalities().size());
    }

    @Test
    public void testNotTrained() {
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        assertFalse(forecaster.isTrained());
        assertThrows(NotTrainedException.class, () -> forecaster.predictFuture(1));
        assertThrows(NotTrainedException.class, forecaster::components);
        assertThrows(InsufficientDataException.class, () -> forecaster.train(series.head(1)));
    }

    @ParameterizedTest
    @EnumSource(SeasonalityMode.class)
    public void testForecast(SeasonalityMode mode) {
        DecompositionTrendForecaster forecaster = dailyOnly().seasonalityMode(mode).build();
        forecaster.train(series);
        assertTrue(forecaster.isTrained());
        ComponentForecast forecast = forecaster.predictFuture(24);
        assertEquals(24, forecast.size());
        assertEquals(series.getLastTimestamp().plusHours(1), forecast.getTimestamp(0));
        assertTrue(forecast.hasNativeBounds());
        for (int i = 0; i < 24; i++) {
            assertEquals(expected(LENGTH + i), forecast.getValue(i), 40);
            assertTrue(forecast.getLower(i) <= forecast.getValue(i));
            assertTrue(forecast.getUpper(i) >= forecast.getValue(i));
        }
    }

    @Test
    public void testBoundsWidenWithHorizon() {
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        forecaster.train(series);
        ComponentForecast forecast = forecaster.predictFuture(200);
        double first = forecast.getUpper(0) - forecast.getLower(0);
        double last = forecast.getUpper(199) - forecast.getLower(199);
        assertTrue(first > 0);
        assertTrue(last >= first);

        DecompositionTrendForecaster narrow = dailyOnly().intervalWidth(0.5).build();
        narrow.train(series);
        ComponentForecast narrower = narrow.predictFuture(1);
        assertTrue(narrower.getUpper(0) - narrower.getLower(0) < first);
    }

    @Test
    public void testMissingValuesIgnored() {
        double[] values = series.getTargetValues();
        values[10] = Double.NaN;
        values[300] = Double.NaN;
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        forecaster.train(TimeSeries.of(DemandDataSets.DEFAULT_START, values));
        assertEquals(expected(LENGTH), forecaster.predictFuture(1).getValue(0), 40);
    }

    @Test
    public void testComponentsAddUp() {
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        forecaster.train(series);
        TrendComponents components = forecaster.components();
        assertEquals(LENGTH + DecompositionTrendForecaster.COMPONENT_FUTURE_STEPS, components.size());
        assertEquals(Arrays.asList(TrendComponents.TREND, "daily"), components.getNames());
        double sum = components.get(TrendComponents.TREND)[LENGTH] + components.get("daily")[LENGTH];
        assertEquals(forecaster.predictFuture(1).getValue(0), sum, 1e-6);
    }

    @Test
    public void testPredictArbitraryTimestamps() {
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        forecaster.train(series);
        LocalDateTime[] timestamps = series.futureTimestamps(3);
        ComponentForecast direct = forecaster.predict(timestamps);
        assertArrayEquals(forecaster.predictFuture(3).getValues(), direct.getValues(), 1e-10);

        EvaluationMetrics metrics = forecaster.evaluate(series.tail(48));
        assertTrue(metrics.getMae() < 20);
        assertTrue(metrics.getIntervalCoverage() > 0.8);
    }

    @Test
    public void testSaveAndLoad(@TempDir Path directory) {
        ModelStore store = new ModelStore(directory);
        DecompositionTrendForecaster forecaster = dailyOnly().build();
        forecaster.train(series);
        forecaster.save(store, "decomposition");

        DecompositionTrendForecaster restored = DecompositionTrendForecaster.builder().build();
        LoadResult<ITrendForecaster> result = restored.load(store, "decomposition");
        assertTrue(result.isLoaded());
        ComponentForecast expected = forecaster.predictFuture(12);
        ComponentForecast actual = restored.predictFuture(12);
        assertArrayEquals(expected.getValues(), actual.getValues(), 1e-9);
        assertEquals(expected.getUpper(11), actual.getUpper(11), 1e-9);
    }
}
