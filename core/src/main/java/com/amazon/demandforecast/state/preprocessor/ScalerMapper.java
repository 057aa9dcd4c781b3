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

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.preprocessor.transform.FittedScaler;
import com.amazon.demandforecast.state.IStateMapper;

public class ScalerMapper implements IStateMapper<FittedScaler, ScalerState> {

    @Override
    public ScalerState toState(FittedScaler model) {
        ScalerState state = new ScalerState();
        state.setMethod(model.getMethod().name());
        state.setShift(model.getShift());
        state.setScale(model.getScale());
        return state;
    }

    @Override
    public FittedScaler toModel(ScalerState state, long seed) {
        checkArgument(state.getMethod() != null, "missing method");
        checkArgument(state.getShift() != null, "missing shift");
        checkArgument(state.getScale() != null, "missing scale");
        checkArgument(state.getShift().length == state.getScale().length, "incorrect lengths");
        return new FittedScaler(ScalingMethod.valueOf(state.getMethod()), state.getShift(), state.getScale());
    }
}
