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

import java.util.Arrays;

import com.amazon.demandforecast.config.RollingAlignment;
import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.state.IStateMapper;

public class PreprocessorMapper implements IStateMapper<Preprocessor, PreprocessorState> {

    @Override
    public PreprocessorState toState(Preprocessor model) {
        PreprocessorState state = new PreprocessorState();
        state.setTargetName(model.getTargetName());
        state.setLags(model.getLags());
        state.setRollingWindows(model.getRollingWindows());
        state.setSequenceLength(model.getSequenceLength());
        state.setForwardFillLimit(model.getForwardFillLimit());
        state.setScalingMethod(model.getScalingMethod().name());
        state.setRollingAlignment(model.getRollingAlignment().name());
        state.setFitted(model.isFitted());
        if (model.isFitted()) {
            ScalerMapper scalerMapper = new ScalerMapper();
            state.setFeatureNames(model.getFeatureNames().toArray(new String[0]));
            state.setTargetScaler(scalerMapper.toState(model.getTargetScaler()));
            state.setFeatureScaler(scalerMapper.toState(model.getFeatureScaler()));
        }
        return state;
    }

    @Override
    public Preprocessor toModel(PreprocessorState state, long seed) {
        checkArgument(state.getTargetName() != null, "missing target name");
        checkArgument(state.getLags() != null && state.getRollingWindows() != null, "missing lags or windows");
        checkArgument(state.getScalingMethod() != null && state.getRollingAlignment() != null,
                "missing configuration");
        Preprocessor preprocessor = Preprocessor.builder().targetName(state.getTargetName()).lags(state.getLags())
                .rollingWindows(state.getRollingWindows()).sequenceLength(state.getSequenceLength())
                .forwardFillLimit(state.getForwardFillLimit())
                .scalingMethod(ScalingMethod.valueOf(state.getScalingMethod()))
                .rollingAlignment(RollingAlignment.valueOf(state.getRollingAlignment())).build();
        if (state.isFitted()) {
            ScalerMapper scalerMapper = new ScalerMapper();
            checkArgument(state.getFeatureNames() != null, "missing feature names");
            checkArgument(state.getTargetScaler() != null && state.getFeatureScaler() != null, "missing scalers");
            preprocessor.setFittedState(scalerMapper.toModel(state.getTargetScaler()),
                    scalerMapper.toModel(state.getFeatureScaler()), Arrays.asList(state.getFeatureNames()));
        }
        return preprocessor;
    }
}
