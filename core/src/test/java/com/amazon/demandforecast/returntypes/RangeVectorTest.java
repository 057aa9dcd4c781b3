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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RangeVectorTest {

    int horizon;
    private RangeVector vector;

    @BeforeEach
    public void setUp() {
        horizon = 3;
        vector = new RangeVector(horizon);
    }

    @Test
    public void testNew() {
        assertThrows(IllegalArgumentException.class, () -> new RangeVector(0));
        assertThrows(IllegalArgumentException.class, () -> new RangeVector(new double[0]));
        double[] expected = new double[horizon];
        assertArrayEquals(expected, vector.values);
        assertArrayEquals(expected, vector.upper);
        assertArrayEquals(expected, vector.lower);

        assertThrows(IllegalArgumentException.class,
                () -> new RangeVector(expected, expected, new double[horizon + 1]));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeVector(expected, new double[] { -1, 0, 0 }, expected));
        assertDoesNotThrow(() -> new RangeVector(expected, expected, new double[] { -1, 0, 0 }));

        RangeVector copy = new RangeVector(vector);
        copy.values[0] = 5;
        assertEquals(0, vector.values[0]);
        assertEquals(horizon, copy.size());
    }

    @Test
    public void testScale() {
        vector.upper[0] = 1.1;
        vector.lower[1] = -2.2;
        assertThrows(IllegalArgumentException.class, () -> vector.scale(0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> vector.scale(horizon, 1.0));
        vector.scale(0, 10);
        vector.scale(1, 2);
        assertArrayEquals(new double[] { 11, 0, 0 }, vector.upper, 1e-10);
        assertArrayEquals(new double[] { 0, -4.4, 0 }, vector.lower, 1e-10);
    }

    @Test
    public void testShift() {
        vector.upper[0] = 1.1;
        vector.lower[1] = -2.2;
        assertThrows(IllegalArgumentException.class, () -> vector.shift(-1, 1));
        vector.shift(0, -5);
        vector.shift(1, 5);
        assertArrayEquals(new double[] { -5, 5, 0 }, vector.values, 1e-10);
        assertArrayEquals(new double[] { -3.9, 5, 0 }, vector.upper, 1e-10);
        assertArrayEquals(new double[] { -5, 2.8, 0 }, vector.lower, 1e-10);
    }
}
