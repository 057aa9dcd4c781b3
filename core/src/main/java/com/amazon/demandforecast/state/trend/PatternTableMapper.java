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

package com.amazon.demandforecast.state.trend;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import com.amazon.demandforecast.state.IStateMapper;
import com.amazon.demandforecast.trend.PatternTable;
import com.amazon.demandforecast.trend.PatternTrendForecaster;

public class PatternTableMapper implements IStateMapper<PatternTrendForecaster, PatternTrendState> {

    @Override
    public PatternTrendState toState(PatternTrendForecaster model) {
        checkArgument(model.isTrained(), "only trained forecasters can be saved");
        PatternTable table = model.getTable();
        PatternTrendState state = new PatternTrendState();
        state.setJitterFraction(model.getJitterFraction());
        state.setBandFraction(model.getBandFraction());
        state.setRandomSeed(model.getRandomSeed());
        state.setStart(model.getStart().toString());
        state.setEnd(model.getEnd().toString());
        state.setStepSeconds(model.getStep().getSeconds());
        double[] hourly = new double[PatternTable.HOURS];
        for (int i = 0; i < hourly.length; i++) {
            hourly[i] = table.hourly(i);
        }
        double[] daily = new double[PatternTable.DAYS];
        for (int i = 0; i < daily.length; i++) {
            daily[i] = table.daily(i);
        }
        state.setHourlyMean(hourly);
        state.setDailyMean(daily);
        state.setGlobalMean(table.getGlobalMean());
        state.setGlobalStd(table.getGlobalStd());
        return state;
    }

    @Override
    public PatternTrendForecaster toModel(PatternTrendState state, long seed) {
        PatternTrendForecaster model = PatternTrendForecaster.builder().jitterFraction(state.getJitterFraction())
                .bandFraction(state.getBandFraction()).randomSeed(state.getRandomSeed()).build();
        restore(model, state);
        return model;
    }

    /**
     * replaces the table of an existing forecaster
     */
    public void restore(PatternTrendForecaster model, PatternTrendState state) {
        checkArgument(state.getHourlyMean() != null, "missing hourly means");
        checkArgument(state.getDailyMean() != null, "missing daily means");
        checkArgument(state.getStart() != null && state.getEnd() != null, "missing range");
        checkArgument(state.getStepSeconds() > 0, "incorrect step");
        PatternTable table = new PatternTable(state.getHourlyMean(), state.getDailyMean(), state.getGlobalMean(),
                state.getGlobalStd());
        try {
            model.restore(table, LocalDateTime.parse(state.getStart()), LocalDateTime.parse(state.getEnd()),
                    Duration.ofSeconds(state.getStepSeconds()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("incorrect range " + state.getStart() + " " + state.getEnd(), e);
        }
    }
}
