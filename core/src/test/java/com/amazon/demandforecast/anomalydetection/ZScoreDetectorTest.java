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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ZScoreDetectorTest {

    private final double[] values = new double[] { 10, 10, 10, 10, 10, 50, 10, 10, 10, 10, 10 };

    @Test
    public void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> new ZScoreDetector(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new ZScoreDetector(3, 1));
    }

    @Test
    public void testDetect() {
        List<AnomalyRecord> records = new ZScoreDetector(1.5, 5).detect(values, null);
        assertEquals(1, records.size());
        AnomalyRecord record = records.get(0);
        assertEquals(5, record.getIndex());
        assertNull(record.getTimestamp());
        assertEquals(50, record.getObservedValue());
        assertEquals(AnomalyMethod.ZSCORE, record.getMethod());
        double std = Math.sqrt(320);
        assertEquals(32 / std, record.getScore(), 1e-10);
        assertEquals(Severity.MEDIUM, record.getSeverity());
        assertEquals(18 - 1.5 * std, record.getExpectedLower(), 1e-10);
        assertEquals(18 + 1.5 * std, record.getExpectedUpper(), 1e-10);

        List<AnomalyRecord> lower = new ZScoreDetector(1.0, 5).detect(values, null);
        assertEquals(Severity.HIGH, lower.get(0).getSeverity());
    }

    @Test
    public void testConstantAndMissingValuesNeverFlagged() {
        assertTrue(new ZScoreDetector(1, 3).detect(new double[] { 5, 5, 5, 5, 5 }, null).isEmpty());
        double[] gaps = values.clone();
        gaps[4] = Double.NaN;
        // the window centered on the spike contains the gap
        assertTrue(new ZScoreDetector(1.5, 5).detect(gaps, null).isEmpty());
        assertTrue(new ZScoreDetector(1.5, 50).detect(values, null).isEmpty());
    }
}
