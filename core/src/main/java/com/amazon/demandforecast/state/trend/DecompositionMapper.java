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
import java.util.ArrayList;
import java.util.List;

import com.amazon.demandforecast.config.SeasonalityMode;
import com.amazon.demandforecast.state.IStateMapper;
import com.amazon.demandforecast.trend.DecompositionFit;
import com.amazon.demandforecast.trend.DecompositionTrendForecaster;
import com.amazon.demandforecast.trend.Seasonality;

public class DecompositionMapper implements IStateMapper<DecompositionTrendForecaster, DecompositionState> {

    @Override
    public DecompositionState toState(DecompositionTrendForecaster model) {
        checkArgument(model.isTrained(), "only trained forecasters can be saved");
        DecompositionFit fit = model.getFit();
        DecompositionState state = new DecompositionState();
        state.setNumberOfChangepoints(model.getNumberOfChangepoints());
        state.setChangepointRange(model.getChangepointRange());
        state.setChangepointPriorScale(model.getChangepointPriorScale());
        state.setSeasonalityPriorScale(model.getSeasonalityPriorScale());
        state.setIntervalWidth(fit.getIntervalWidth());
        state.setSeasonalityMode(fit.getMode().name());
        state.setStart(fit.getStart().toString());
        state.setStepSeconds(fit.getStep().getSeconds());
        state.setHistoryLength(fit.getHistoryLength());
        state.setStartHours(fit.getStartHours());
        state.setSpanHours(fit.getSpanHours());
        state.setYScale(fit.getYScale());
        state.setChangepoints(fit.getChangepoints());
        state.setTrendCoefficients(fit.getTrendCoefficients());
        List<Seasonality> seasonalities = fit.getSeasonalities();
        String[] names = new String[seasonalities.size()];
        double[] periods = new double[seasonalities.size()];
        int[] orders = new int[seasonalities.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = seasonalities.get(i).getName();
            periods[i] = seasonalities.get(i).getPeriodHours();
            orders[i] = seasonalities.get(i).getOrder();
        }
        state.setSeasonalityNames(names);
        state.setSeasonalityPeriods(periods);
        state.setSeasonalityOrders(orders);
        state.setSeasonalCoefficients(fit.getSeasonalCoefficients());
        state.setResidualStd(fit.getResidualStd());
        state.setMeanAbsDelta(fit.getMeanAbsDelta());
        return state;
    }

    @Override
    public DecompositionTrendForecaster toModel(DecompositionState state, long seed) {
        checkArgument(state.getSeasonalityMode() != null, "missing seasonality mode");
        DecompositionTrendForecaster.Builder builder = DecompositionTrendForecaster.builder()
                .numberOfChangepoints(state.getNumberOfChangepoints()).changepointRange(state.getChangepointRange())
                .changepointPriorScale(state.getChangepointPriorScale())
                .seasonalityPriorScale(state.getSeasonalityPriorScale()).intervalWidth(state.getIntervalWidth())
                .seasonalityMode(SeasonalityMode.valueOf(state.getSeasonalityMode())).dailySeasonality(false)
                .weeklySeasonality(false).yearlySeasonality(false);
        DecompositionFit fit = toFit(state);
        for (Seasonality seasonality : fit.getSeasonalities()) {
            builder.addSeasonality(seasonality.getName(), seasonality.getPeriodHours(), seasonality.getOrder());
        }
        DecompositionTrendForecaster model = builder.build();
        model.restore(fit);
        return model;
    }

    public DecompositionFit toFit(DecompositionState state) {
        checkArgument(state.getSeasonalityMode() != null, "missing seasonality mode");
        checkArgument(state.getStart() != null, "missing start");
        checkArgument(state.getStepSeconds() > 0, "incorrect step");
        checkArgument(state.getChangepoints() != null, "missing changepoints");
        checkArgument(state.getTrendCoefficients() != null, "missing trend coefficients");
        checkArgument(state.getSeasonalityNames() != null, "missing seasonalities");
        checkArgument(state.getSeasonalityPeriods() != null, "missing seasonality periods");
        checkArgument(state.getSeasonalityOrders() != null, "missing seasonality orders");
        checkArgument(state.getSeasonalCoefficients() != null, "missing seasonal coefficients");
        int count = state.getSeasonalityNames().length;
        checkArgument(state.getSeasonalityPeriods().length == count && state.getSeasonalityOrders().length == count,
                "incorrect seasonality description");
        List<Seasonality> seasonalities = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            seasonalities.add(new Seasonality(state.getSeasonalityNames()[i], state.getSeasonalityPeriods()[i],
                    state.getSeasonalityOrders()[i]));
        }
        LocalDateTime start;
        try {
            start = LocalDateTime.parse(state.getStart());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("incorrect start " + state.getStart(), e);
        }
        return new DecompositionFit(SeasonalityMode.valueOf(state.getSeasonalityMode()), start,
                Duration.ofSeconds(state.getStepSeconds()), state.getHistoryLength(), state.getStartHours(),
                state.getSpanHours(), state.getYScale(), state.getChangepoints(), state.getTrendCoefficients(),
                seasonalities, state.getSeasonalCoefficients(), state.getResidualStd(), state.getMeanAbsDelta(),
                state.getIntervalWidth());
    }
}
