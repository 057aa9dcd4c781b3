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

package com.amazon.demandforecast.sequence;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.DropoutLayer;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import com.amazon.demandforecast.config.SequenceModelType;

/**
 * Two stacked LSTM layers, the second one reduced to its last time step, each
 * followed by dropout, then two relu layers and a linear output.
 */
public class RecurrentSequenceForecaster extends AbstractNetworkForecaster {

    public static final int DEFAULT_EPOCHS = 50;

    public static final int[] DEFAULT_LAYER_SIZES = { 64, 32, 32, 16 };

    private final double dropout;

    public RecurrentSequenceForecaster(Builder builder) {
        super(builder, DEFAULT_EPOCHS, DEFAULT_LAYER_SIZES);
        checkArgument(layerSizes.length == 4, "expected two recurrent and two dense layer sizes");
        checkArgument(builder.getDropout() >= 0 && builder.getDropout() < 1, "dropout must be in [0,1)");
        this.dropout = builder.getDropout();
    }

    @Override
    public SequenceModelType getType() {
        return SequenceModelType.RECURRENT;
    }

    public double getDropout() {
        return dropout;
    }

    @Override
    protected MultiLayerConfiguration configuration(int sequenceLength, int width) {
        // dl4j takes the probability of retaining an activation
        double retain = 1.0 - dropout;
        return new NeuralNetConfiguration.Builder().seed(randomSeed).dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER).updater(new Adam(learningRate)).list()
                .layer(new LSTM.Builder().nIn(width).nOut(layerSizes[0]).activation(Activation.TANH).build())
                .layer(new DropoutLayer.Builder(retain).build())
                .layer(new LastTimeStep(
                        new LSTM.Builder().nIn(layerSizes[0]).nOut(layerSizes[1]).activation(Activation.TANH).build()))
                .layer(new DropoutLayer.Builder(retain).build())
                .layer(new DenseLayer.Builder().nIn(layerSizes[1]).nOut(layerSizes[2]).activation(Activation.RELU)
                        .build())
                .layer(new DenseLayer.Builder().nIn(layerSizes[2]).nOut(layerSizes[3]).activation(Activation.RELU)
                        .build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE).nIn(layerSizes[3]).nOut(1)
                        .activation(Activation.IDENTITY).build())
                .setInputType(InputType.recurrent(width, sequenceLength)).build();
    }

    /**
     * windows are [batch][time][features]; recurrent layers expect
     * [batch][features][time]
     */
    @Override
    protected INDArray toInput(double[][][] x) {
        return Nd4j.create(x).permute(0, 2, 1).dup('c');
    }
}
