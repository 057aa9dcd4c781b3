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

package com.amazon.demandforecast.preprocessor.transform;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.returntypes.RangeVector;

public class ScalerTest {

    private final double[][] data = new double[][] { { 1, 10, 5 }, { 3, 20, 5 }, { 5, 30, 5 } };

    @Test
    public void testMinMax() {
        FittedScaler scaler = new MinMaxScaler().fit(data);
        assertEquals(ScalingMethod.MIN_MAX, scaler.getMethod());
        assertArrayEquals(new double[] { 1, 10, 5 }, scaler.getShift());
        assertArrayEquals(new double[] { 4, 20, 1 }, scaler.getScale());
        assertArrayEquals(new double[] { 0.5, 0.5, 0 }, scaler.transform(data[1]), 1e-10);
        assertArrayEquals(new double[] { 1, 1, 0 }, scaler.transform(data[2]), 1e-10);
    }

    @Test
    public void testStandard() {
        FittedScaler scaler = new StandardScaler().fit(data);
        assertEquals(ScalingMethod.STANDARD, scaler.getMethod());
        assertEquals(3, scaler.getShift()[0], 1e-10);
        assertEquals(Math.sqrt(8.0 / 3), scaler.getScale()[0], 1e-10);
        assertEquals(1, scaler.getScale()[2]);
        assertEquals(0, scaler.transform(1, 20), 1e-10);
    }

    @Test
    public void testMissingValues() {
        double[][] gaps = new double[][] { { 1, Double.NaN }, { Double.NaN, Double.NaN }, { 3, Double.NaN } };
        FittedScaler scaler = new MinMaxScaler().fit(gaps);
        assertArrayEquals(new double[] { 1, 0 }, scaler.getShift());
        assertArrayEquals(new double[] { 2, 1 }, scaler.getScale());
        FittedScaler standard = new StandardScaler().fit(gaps);
        assertEquals(2, standard.getShift()[0], 1e-10);
        assertEquals(1, standard.getScale()[1]);
    }

    @ParameterizedTest
    @EnumSource(ScalingMethod.class)
    public void testInversion(ScalingMethod method) {
        FittedScaler scaler = IScaler.of(method).fit(data);
        assertEquals(method, scaler.getMethod());
        double[] column = new double[] { 12, 17.5, -3 };
        assertArrayEquals(column, scaler.invertColumn(1, scaler.transformColumn(1, column)), 1e-9);
    }

    @Test
    public void testInvertRange() {
        FittedScaler scaler = new MinMaxScaler().fit(data);
        RangeVector range = new RangeVector(new double[] { 0.5 }, new double[] { 0.75 }, new double[] { 0.25 });
        scaler.invertRange(range, 1);
        assertEquals(20, range.values[0], 1e-10);
        assertEquals(25, range.upper[0], 1e-10);
        assertEquals(15, range.lower[0], 1e-10);
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new MinMaxScaler().fit(new double[0][]));
        assertThrows(IllegalArgumentException.class,
                () -> new StandardScaler().fit(new double[][] { { 1, 2 }, { 1 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new FittedScaler(ScalingMethod.MIN_MAX, new double[] { 0 }, new double[] { 0 }));
        FittedScaler scaler = new MinMaxScaler().fit(data);
        assertThrows(IllegalArgumentException.class, () -> scaler.transform(3, 1));
        assertThrows(IllegalArgumentException.class, () -> scaler.transform(new double[2]));
        assertTrue(scaler.getColumns() == 3);
    }
}
