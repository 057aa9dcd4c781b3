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

package com.amazon.demandforecast.state.preprocessor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.demandforecast.config.RollingAlignment;
import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.preprocessor.SupervisedData;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;

public class PreprocessorMapperTest {

    private Preprocessor preprocessor() {
        return Preprocessor.builder().lags(1, 3).rollingWindows(4).sequenceLength(6)
                .scalingMethod(ScalingMethod.STANDARD).rollingAlignment(RollingAlignment.CENTERED).build();
    }

    @Test
    public void testUnfitted() {
        PreprocessorMapper mapper = new PreprocessorMapper();
        PreprocessorState state = mapper.toState(preprocessor());
        assertFalse(state.isFitted());
        Preprocessor copy = mapper.toModel(state);
        assertFalse(copy.isFitted());
        assertArrayEquals(new int[] { 1, 3 }, copy.getLags());
        assertEquals(RollingAlignment.CENTERED, copy.getRollingAlignment());
        assertEquals(ScalingMethod.STANDARD, copy.getScalingMethod());
    }

    @Test
    public void testFittedThroughStore(@TempDir Path directory) {
        DemandData data = DemandDataSets.generate(3, 5);
        TimeSeries series = TimeSeries.of(data.timestamps[0], data.demand);
        Preprocessor preprocessor = preprocessor();
        SupervisedData expected = preprocessor.fitTransform(series);

        ModelStore store = new ModelStore(directory);
        store.save("preprocessor", new PreprocessorMapper().toState(preprocessor));
        LoadResult<PreprocessorState> loaded = store.load("preprocessor", PreprocessorState.class);
        assertTrue(loaded.isLoaded());
        Preprocessor copy = new PreprocessorMapper().toModel(loaded.getValue());
        assertTrue(copy.isFitted());
        assertEquals(preprocessor.getFeatureNames(), copy.getFeatureNames());
        assertEquals(preprocessor.transformTarget(5000), copy.transformTarget(5000), 1e-12);

        SupervisedData actual = copy.transform(series);
        assertEquals(expected.size(), actual.size());
        assertArrayEquals(expected.getLatestWindow()[5], actual.getLatestWindow()[5], 1e-12);
    }

    @Test
    public void testIncompleteState() {
        PreprocessorMapper mapper = new PreprocessorMapper();
        PreprocessorState state = mapper.toState(preprocessor());
        state.setFitted(true);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
        state.setFitted(false);
        state.setLags(null);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        ScalerState scaler = new ScalerState();
        scaler.setMethod("MIN_MAX");
        scaler.setShift(new double[] { 1 });
        assertThrows(IllegalArgumentException.class, () -> new ScalerMapper().toModel(scaler));
    }
}
