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

package com.amazon.demandforecast.anomalydetection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class SuddenChangeDetectorTest {

    @Test
    public void testDetect() {
        double[] values = new double[] { 100, 100, 140, 140, 50, 0, 10, Double.NaN, 20 };
        List<AnomalyRecord> records = new SuddenChangeDetector(0.3).detect(values, null);
        assertEquals(3, records.size());

        AnomalyRecord spike = records.get(0);
        assertEquals(2, spike.getIndex());
        assertEquals(AnomalyMethod.PCT_CHANGE, spike.getMethod());
        assertEquals(ChangeDirection.SPIKE, spike.getDirection());
        assertEquals(Severity.MEDIUM, spike.getSeverity());
        assertEquals(100, spike.getPreviousValue());
        assertEquals(140, spike.getObservedValue());
        assertEquals(40, spike.getChangePercent(), 1e-10);
        assertEquals(70, spike.getExpectedLower(), 1e-10);
        assertEquals(130, spike.getExpectedUpper(), 1e-10);

        AnomalyRecord drop = records.get(1);
        assertEquals(4, drop.getIndex());
        assertEquals(ChangeDirection.DROP, drop.getDirection());
        assertEquals(Severity.HIGH, drop.getSeverity());
        assertEquals(-90.0 / 140 * 100, drop.getChangePercent(), 1e-10);
        assertEquals(90.0 / 140 * 100, drop.getScore(), 1e-10);

        // the change from zero is skipped
        assertEquals(5, records.get(2).getIndex());
        assertEquals(-100, records.get(2).getChangePercent(), 1e-10);
    }

    @Test
    public void testSmallChanges() {
        assertTrue(new SuddenChangeDetector(0.3).detect(new double[] { 100, 129, 100 }, null).isEmpty());
        assertTrue(new SuddenChangeDetector(0.3).detect(new double[] { 100 }, null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new SuddenChangeDetector(0));
    }
}
