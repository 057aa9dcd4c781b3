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

package com.amazon.demandforecast.examples.serialization;

import com.amazon.demandforecast.examples.Example;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.state.trend.PatternTableMapper;
import com.amazon.demandforecast.state.trend.PatternTrendState;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;
import com.amazon.demandforecast.trend.PatternTrendForecaster;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a pattern trend forecaster using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {

    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a pattern trend forecaster with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        DemandData data = DemandDataSets.generate(28, 0);
        PatternTrendForecaster forecaster = PatternTrendForecaster.builder().build();
        forecaster.train(TimeSeries.of(data.timestamps[0], data.demand));

        // Convert to an array of bytes and print the size

        PatternTableMapper mapper = new PatternTableMapper();
        Schema<PatternTrendState> schema = RuntimeSchema.getSchema(PatternTrendState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            bytes = ProtostuffIOUtil.toByteArray(mapper.toState(forecaster), schema, buffer);
        } finally {
            buffer.clear();
        }
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore and compare a week of forecasts

        PatternTrendState state2 = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state2, schema);
        PatternTrendForecaster forecaster2 = mapper.toModel(state2);

        int horizon = 168;
        ComponentForecast forecast = forecaster.predictFuture(horizon);
        ComponentForecast forecast2 = forecaster2.predictFuture(horizon);
        int differences = 0;
        for (int i = 0; i < horizon; i++) {
            if (forecast.getValue(i) != forecast2.getValue(i)) {
                differences++;
            }
        }

        if (differences > 0) {
            throw new IllegalStateException(differences + " of " + horizon + " forecasts differ");
        }
        System.out.printf("Looks good! All %d forecasts of the restored model agree.%n", horizon);
    }
}
