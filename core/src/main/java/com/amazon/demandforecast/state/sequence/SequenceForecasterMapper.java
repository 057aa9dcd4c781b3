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

package com.amazon.demandforecast.state.sequence;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;
import com.amazon.demandforecast.sequence.FeedForwardSequenceForecaster;
import com.amazon.demandforecast.state.IStateMapper;
import com.amazon.demandforecast.state.preprocessor.ScalerMapper;

public class SequenceForecasterMapper implements IStateMapper<AbstractNetworkForecaster, SequenceForecasterState> {

    @Override
    public SequenceForecasterState toState(AbstractNetworkForecaster model) {
        SequenceForecasterState state = new SequenceForecasterState();
        state.setType(model.getType().name());
        state.setSequenceLength(model.getSequenceLength());
        state.setWidth(model.getWidth());
        state.setLayerSizes(model.getLayerSizes());
        state.setEpochs(model.getEpochs());
        state.setBatchSize(model.getBatchSize());
        state.setLearningRate(model.getLearningRate());
        state.setRandomSeed(model.getRandomSeed());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            ModelSerializer.writeModel(model.getNetwork(), bytes, false);
        } catch (IOException e) {
            throw new ForecastException(Stage.PERSISTENCE, "cannot serialize network", e);
        }
        state.setNetwork(bytes.toByteArray());
        if (model instanceof FeedForwardSequenceForecaster) {
            state.setInputScaler(
                    new ScalerMapper().toState(((FeedForwardSequenceForecaster) model).getInputScaler()));
        }
        return state;
    }

    @Override
    public AbstractNetworkForecaster toModel(SequenceForecasterState state, long seed) {
        AbstractNetworkForecaster model = (AbstractNetworkForecaster) AbstractNetworkForecaster.builder()
                .type(SequenceModelType.valueOf(state.getType())).layerSizes(state.getLayerSizes())
                .epochs(state.getEpochs()).batchSize(state.getBatchSize()).learningRate(state.getLearningRate())
                .randomSeed(state.getRandomSeed()).build();
        restore(model, state);
        return model;
    }

    /**
     * replaces the parameters of an existing forecaster of the same type
     */
    public void restore(AbstractNetworkForecaster model, SequenceForecasterState state) {
        checkArgument(state.getType() != null, "missing type");
        checkArgument(model.getType() == SequenceModelType.valueOf(state.getType()),
                "stored " + state.getType() + " network cannot replace a " + model.getType() + " network");
        checkArgument(state.getNetwork() != null, "missing network");
        MultiLayerNetwork network;
        try {
            network = ModelSerializer.restoreMultiLayerNetwork(new ByteArrayInputStream(state.getNetwork()));
        } catch (IOException | RuntimeException e) {
            throw new ForecastException(Stage.PERSISTENCE, "cannot read network", e);
        }
        if (model instanceof FeedForwardSequenceForecaster) {
            checkArgument(state.getInputScaler() != null, "missing input scaler");
            ((FeedForwardSequenceForecaster) model).restore(network, state.getSequenceLength(), state.getWidth(),
                    new ScalerMapper().toModel(state.getInputScaler()));
        } else {
            model.restore(network, state.getSequenceLength(), state.getWidth());
        }
    }
}
