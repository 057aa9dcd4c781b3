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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.returntypes.ComponentForecast;

public class PatternTrendForecasterTest {

    // a Monday
    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private TimeSeries series;

    @BeforeEach
    public void setUp() {
        double[] values = new double[48];
        for (int i = 0; i < 24; i++) {
            values[i] = 100 + i;
            values[i + 24] = 200 + i;
        }
        series = TimeSeries.of(START, values);
    }

    @Test
    public void testTable() {
        PatternTable table = PatternTable.fit(series.getTimestamps(), series.getTargetValues());
        assertEquals(161.5, table.getGlobalMean(), 1e-10);
        assertEquals(153, table.hourly(3), 1e-10);
        assertEquals(111.5, table.daily(0), 1e-10);
        assertEquals(211.5, table.daily(1), 1e-10);
        // no observations on the other days
        assertTrue(Double.isNaN(table.getDailyMean()[2]));
        assertEquals(161.5, table.daily(2), 1e-10);
        assertEquals(153, table.estimate(START.plusDays(2).plusHours(3)), 1e-10);
        assertEquals(153 * 111.5 / 161.5, table.estimate(START.plusHours(3)), 1e-10);
    }

    @Test
    public void testTableMissingValues() {
        double[] values = series.getTargetValues();
        values[0] = Double.NaN;
        values[24] = Double.NaN;
        PatternTable table = PatternTable.fit(series.getTimestamps(), values);
        assertTrue(Double.isNaN(table.getHourlyMean()[0]));
        assertEquals(table.getGlobalMean(), table.hourly(0));

        double[] empty = new double[] { Double.NaN, Double.NaN };
        assertThrows(InsufficientDataException.class,
                () -> PatternTable.fit(new LocalDateTime[] { START, START.plusHours(1) }, empty));
        assertThrows(IllegalArgumentException.class,
                () -> new PatternTable(new double[23], new double[7], 0, 0));
    }

    @Test
    public void testNotTrained() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        assertFalse(forecaster.isTrained());
        assertThrows(NotTrainedException.class, () -> forecaster.predictFuture(3));
        assertThrows(NotTrainedException.class, forecaster::components);
        assertThrows(IllegalArgumentException.class,
                () -> PatternTrendForecaster.builder().jitterFraction(-1).build());
    }

    @Test
    public void testPredictWithoutJitter() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().jitterFraction(0).build();
        forecaster.train(series);
        ComponentForecast forecast = forecaster.predictFuture(2);
        assertEquals(START.plusDays(2), forecast.getTimestamp(0));
        assertEquals(150, forecast.getValue(0), 1e-10);
        assertEquals(151, forecast.getValue(1), 1e-10);
        assertTrue(forecast.hasNativeBounds());
        double band = 0.3 * forecaster.getTable().getGlobalStd();
        assertEquals(150 + band, forecast.getUpper(0), 1e-10);
        assertEquals(150 - band, forecast.getLower(0), 1e-10);
    }

    @Test
    public void testJitterIsReproducible() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        forecaster.train(series);
        ComponentForecast first = forecaster.predictFuture(5);
        ComponentForecast second = forecaster.predictFuture(5);
        assertArrayEquals(first.getValues(), second.getValues());

        PatternTrendForecaster other = PatternTrendForecaster.builder().randomSeed(7).build();
        other.train(series);
        assertNotEquals(first.getValue(0), other.predictFuture(5).getValue(0));
    }

    @Test
    public void testConfidence() {
        double[] confidence = PatternTrendForecaster.confidence(4);
        assertEquals(85, confidence[0], 1e-10);
        assertEquals(60, confidence[3], 1e-10);
        for (double value : confidence) {
            assertTrue(value >= 60 && value <= 95);
        }
        assertThrows(IllegalArgumentException.class, () -> PatternTrendForecaster.confidence(0));
    }

    @Test
    public void testForecastCarriesConfidence() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        forecaster.train(series);
        ComponentForecast forecast = forecaster.predictFuture(4);
        assertTrue(forecast.hasConfidence());
        double[] expected = PatternTrendForecaster.confidence(4);
        for (int i = 0; i < 4; i++) {
            assertEquals(expected[i], forecast.getConfidence(i), 1e-10);
        }
        assertTrue(forecast.getConfidence(0) > forecast.getConfidence(3));
    }

    @Test
    public void testJitterIsBounded() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().jitterFraction(1).randomSeed(11).build();
        forecaster.train(series);
        ComponentForecast forecast = forecaster.predictFuture(2000);
        double limit = PatternTrendForecaster.MAX_JITTER * forecaster.getTable().getGlobalStd();
        for (int i = 0; i < forecast.size(); i++) {
            double estimate = forecaster.getTable().estimate(forecast.getTimestamp(i));
            assertTrue(Math.abs(forecast.getValue(i) - estimate) <= limit + 1e-9);
        }
    }

    @Test
    public void testWeekOfDailyPeaks() {
        double[] values = new double[7 * 24];
        for (int i = 0; i < values.length; i++) {
            int hour = i % 24;
            values[i] = (hour == 18) ? 300 : (hour == 3) ? 20 : 100;
        }
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        forecaster.train(TimeSeries.of(START, values));
        ComponentForecast forecast = forecaster.predictFuture(24);
        assertEquals(18, forecast.getTimestamp(18).getHour());
        assertEquals(3, forecast.getTimestamp(3).getHour());
        assertTrue(forecast.getValue(18) > forecast.getValue(3));
        for (int i = 0; i < 24; i++) {
            if (i != 18) {
                assertTrue(forecast.getValue(18) > forecast.getValue(i));
            }
            if (i != 3) {
                assertTrue(forecast.getValue(3) < forecast.getValue(i));
            }
        }
    }

    @Test
    public void testComponents() {
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        forecaster.train(series);
        TrendComponents components = forecaster.components();
        assertEquals(72, components.size());
        assertTrue(components.has(TrendComponents.TREND));
        assertTrue(components.has("daily"));
        assertTrue(components.has("weekly"));
        assertEquals(161.5, components.get(TrendComponents.TREND)[0], 1e-10);
        assertEquals(153 - 161.5, components.get("daily")[3], 1e-10);
        assertEquals(111.5 - 161.5, components.get("weekly")[0], 1e-10);
    }

    @Test
    public void testSaveAndLoad(@TempDir Path directory) {
        ModelStore store = new ModelStore(directory);
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().randomSeed(3).build();
        forecaster.train(series);
        forecaster.save(store, "pattern");

        PatternTrendForecaster restored = PatternTrendForecaster.builder().randomSeed(3).build();
        LoadResult<ITrendForecaster> result = restored.load(store, "pattern");
        assertTrue(result.isLoaded());
        assertEquals(forecaster.getEnd(), restored.getEnd());
        assertArrayEquals(forecaster.predictFuture(6).getValues(), restored.predictFuture(6).getValues(), 1e-9);

        assertEquals(LoadResult.Status.NOT_FOUND, restored.load(store, "other").getStatus());
    }

    @Test
    public void testFactory() {
        assertTrue(ITrendForecaster.of(TrendModelType.PATTERN) instanceof PatternTrendForecaster);
        assertTrue(ITrendForecaster.of(TrendModelType.DECOMPOSITION) instanceof DecompositionTrendForecaster);
    }
}
