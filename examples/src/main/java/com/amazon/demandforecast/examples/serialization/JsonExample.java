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

import java.nio.charset.StandardCharsets;

import com.amazon.demandforecast.examples.Example;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.state.trend.DecompositionMapper;
import com.amazon.demandforecast.state.trend.DecompositionState;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;
import com.amazon.demandforecast.trend.DecompositionTrendForecaster;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize a decomposition trend forecaster to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a decomposition trend forecaster as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Train a trend forecaster on two weeks of hourly demand

        DemandData data = DemandDataSets.generate(14, 0);
        DecompositionTrendForecaster forecaster = DecompositionTrendForecaster.builder().build();
        forecaster.train(TimeSeries.of(data.timestamps[0], data.demand));

        // Convert to JSON and print the number of bytes

        DecompositionMapper mapper = new DecompositionMapper();
        ObjectMapper jsonMapper = new ObjectMapper();

        String json = jsonMapper.writeValueAsString(mapper.toState(forecaster));

        System.out.printf("number of changepoints = %d, seasonalities = %d%n", forecaster.getNumberOfChangepoints(),
                forecaster.getSeasonalities().size());
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        // Restore from JSON and compare the forecasts of the two models

        DecompositionTrendForecaster forecaster2 = mapper
                .toModel(jsonMapper.readValue(json, DecompositionState.class));

        int horizon = 48;
        ComponentForecast forecast = forecaster.predictFuture(horizon);
        ComponentForecast forecast2 = forecaster2.predictFuture(horizon);

        double maxDifference = 0;
        for (int i = 0; i < horizon; i++) {
            maxDifference = Math.max(maxDifference, Math.abs(forecast.getValue(i) - forecast2.getValue(i)));
        }

        if (maxDifference > 1e-6) {
            throw new IllegalStateException("restored forecaster differs by " + maxDifference);
        }
        System.out.printf("Looks good! The %d step forecasts of the two models agree.%n", horizon);
    }
}
