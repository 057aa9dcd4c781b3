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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "bad"));
        assertDoesNotThrow(() -> CommonUtils.checkArgument(true, "bad"));
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "bad"));
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "null"));
        String value = "value";
        assertSame(value, CommonUtils.checkNotNull(value, "null"));
    }

    @Test
    public void testSafeDivide() {
        assertEquals(0, CommonUtils.safeDivide(5, 0));
        assertEquals(2.5, CommonUtils.safeDivide(5, 2));
    }

    @Test
    public void testClipAndRound() {
        assertEquals(100, CommonUtils.clip(120, 0, 100));
        assertEquals(0, CommonUtils.clip(-3, 0, 100));
        assertEquals(42, CommonUtils.clip(42, 0, 100));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.clip(1, 2, 1));
        assertEquals(3.14, CommonUtils.round(3.14159, 2));
        assertEquals(12.3, CommonUtils.round(12.3456, 1), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.round(1, -1));
    }

    @Test
    public void testCopyOf() {
        double[][] matrix = new double[][] { { 1, 2 }, { 3 } };
        double[][] copy = CommonUtils.copyOf(matrix);
        assertNotSame(matrix[0], copy[0]);
        assertArrayEquals(matrix[1], copy[1]);
        copy[0][0] = 7;
        assertEquals(1, matrix[0][0]);
    }
}
