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

package com.amazon.demandforecast.preprocessor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.ScalerNotFittedException;
import com.amazon.demandforecast.errors.ShapeMismatchException;
import com.amazon.demandforecast.inputtypes.TimeSeries;

public class PreprocessorTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private Preprocessor preprocessor;
    private TimeSeries series;

    @BeforeEach
    public void setUp() {
        preprocessor = Preprocessor.builder().lags(1).rollingWindows(2).sequenceLength(4).build();
        double[] values = new double[50];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        series = TimeSeries.of(START, values);
    }

    @Test
    public void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.builder().sequenceLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.builder().lags(0).build());
        assertThrows(IllegalArgumentException.class, () -> Preprocessor.builder().rollingWindows(1).build());
        assertThrows(NullPointerException.class, () -> Preprocessor.builder().targetName(null).build());
        Preprocessor defaults = Preprocessor.builder().build();
        assertArrayEquals(new int[] { 1, 24, 168 }, defaults.getLags());
        assertArrayEquals(new int[] { 24, 168 }, defaults.getRollingWindows());
        assertEquals(24, defaults.getSequenceLength());
        assertFalse(defaults.isFitted());
    }

    @Test
    public void testFitTransform() {
        SupervisedData data = preprocessor.fitTransform(series);
        assertTrue(preprocessor.isFitted());
        // one row lost to the lag and the window, four more to the first window
        assertEquals(45, data.size());
        assertEquals(4, data.getSequenceLength());
        assertEquals(10, data.getWidth());
        assertEquals(10, preprocessor.getWidth());
        assertEquals(START.plusHours(49), data.getLatestTimestamp());
        assertEquals(1.0, data.getY()[data.size() - 1], 1e-10);
        assertEquals(0.0, data.getX()[0][0][0], 1e-10);

        double[][] latest = data.getLatestWindow();
        assertEquals(4, latest.length);
        assertEquals(1.0, latest[3][0], 1e-10);

        assertEquals(0.5, preprocessor.transformTarget(25), 1e-10);
        assertArrayEquals(new double[] { 25, 1 },
                preprocessor.inverseTransformTarget(new double[] { 0.5, 0 }), 1e-10);
    }

    @Test
    public void testSplitIndex() {
        SupervisedData data = preprocessor.fitTransform(series);
        assertEquals(36, data.splitIndex(0.8));
        assertEquals(45, data.splitIndex(1.0));
        assertThrows(IllegalArgumentException.class, () -> data.splitIndex(0));
        assertEquals(36, data.getX(0, 36).length);
        assertEquals(9, data.getY(36, 45).length);
    }

    @Test
    public void testInsufficientData() {
        InsufficientDataException exception = assertThrows(InsufficientDataException.class,
                () -> preprocessor.fitTransform(series.head(4)));
        assertEquals(3, exception.getAvailable());
        assertEquals(5, exception.getRequired());
    }

    @Test
    public void testTransformRequiresFit() {
        assertThrows(ScalerNotFittedException.class, () -> preprocessor.transform(series));
        assertThrows(ScalerNotFittedException.class, () -> preprocessor.transformTarget(1));
        assertThrows(ScalerNotFittedException.class, () -> preprocessor.getWidth());
    }

    @Test
    public void testTransformReusesStatistics() {
        preprocessor.fitTransform(series);
        SupervisedData recent = preprocessor.transform(series.tail(10));
        assertEquals(START.plusHours(49), recent.getLatestTimestamp());
        // the statistics of the fit, not of the recent values
        assertEquals(1.0, recent.getLatestWindow()[3][0], 1e-10);
        assertThrows(InsufficientDataException.class, () -> preprocessor.transform(series.tail(4)));
    }

    @Test
    public void testTransformRejectsDifferentFeatures() {
        preprocessor.fitTransform(series);
        double[] temperature = new double[10];
        TimeSeries other = TimeSeries.of(START, TimeSeries.DEFAULT_STEP, series.tail(10).getTargetValues(),
                Collections.singletonMap("temperature", temperature));
        assertThrows(ShapeMismatchException.class, () -> preprocessor.transform(other));

        TimeSeries renamed = new TimeSeries("load", series.getTimestamps(), series.getTargetValues());
        assertThrows(IllegalArgumentException.class, () -> preprocessor.transform(renamed));
    }

    @Test
    public void testFutureRows() {
        SupervisedData data = preprocessor.fitTransform(series);
        double[] last = data.getLatestWindow()[3];
        LocalDateTime[] future = series.futureTimestamps(2);
        double[][] rows = preprocessor.futureRows(last, future, Collections.emptyMap());
        assertEquals(2, rows.length);
        assertEquals(0, rows[0][0]);
        double hourSin = FeatureEngineering.timeFeatures(future[1])[0];
        assertEquals(preprocessor.getFeatureScaler().transform(0, hourSin), rows[1][1], 1e-10);
        // lag and rolling features hold their last values
        assertEquals(last[7], rows[1][7]);
        assertEquals(last[9], rows[1][9]);

        assertThrows(IllegalArgumentException.class, () -> preprocessor.futureRows(new double[3], future,
                Collections.emptyMap()));
        assertThrows(IllegalArgumentException.class, () -> preprocessor.futureRows(last, future,
                Collections.singletonMap("temperature", new double[2])));
    }
}
