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
import static com.amazon.demandforecast.CommonUtils.checkState;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.preprocessor.transform.FittedScaler;
import com.amazon.demandforecast.preprocessor.transform.StandardScaler;

/**
 * A lightweight alternative to the recurrent network: the window is flattened,
 * standardized with statistics owned by the forecaster and passed through
 * relu layers.
 */
public class FeedForwardSequenceForecaster extends AbstractNetworkForecaster {

    public static final int DEFAULT_EPOCHS = 100;

    public static final int[] DEFAULT_LAYER_SIZES = { 64, 32, 16 };

    public static final double DEFAULT_VALIDATION_FRACTION = 0.2;

    private final double validationFraction;

    private FittedScaler inputScaler;

    private FittedScaler pendingScaler;

    public FeedForwardSequenceForecaster(Builder builder) {
        super(builder, DEFAULT_EPOCHS, DEFAULT_LAYER_SIZES);
        checkArgument(layerSizes.length > 0, "at least one hidden layer is required");
        checkArgument(builder.getValidationFraction() >= 0 && builder.getValidationFraction() < 1,
                "validation fraction must be in [0,1)");
        this.validationFraction = builder.getValidationFraction();
    }

    @Override
    public SequenceModelType getType() {
        return SequenceModelType.FEED_FORWARD;
    }

    public FittedScaler getInputScaler() {
        checkTrained();
        return inputScaler;
    }

    public void restore(MultiLayerNetwork network, int sequenceLength, int width, FittedScaler inputScaler) {
        checkArgument(inputScaler.getColumns() == sequenceLength * width, "input scaler does not match shape");
        restore(network, sequenceLength, width);
        this.inputScaler = inputScaler;
    }

    @Override
    protected int holdOut(int count) {
        int held = (int) (count * validationFraction);
        // keep at least one window to train on
        return (held >= count) ? 0 : held;
    }

    @Override
    protected void prepareInput(double[][][] x) {
        pendingScaler = new StandardScaler().fit(flatten(x));
    }

    @Override
    protected INDArray toTrainingInput(double[][][] x) {
        checkState(pendingScaler != null, "input statistics are not prepared");
        return Nd4j.create(pendingScaler.transform(flatten(x)));
    }

    @Override
    protected void commitInput() {
        inputScaler = pendingScaler;
        pendingScaler = null;
    }

    @Override
    protected MultiLayerConfiguration configuration(int sequenceLength, int width) {
        NeuralNetConfiguration.ListBuilder list = new NeuralNetConfiguration.Builder().seed(randomSeed)
                .dataType(DataType.DOUBLE).weightInit(WeightInit.XAVIER).updater(new Adam(learningRate)).list();
        int inputs = sequenceLength * width;
        for (int size : layerSizes) {
            list.layer(new DenseLayer.Builder().nIn(inputs).nOut(size).activation(Activation.RELU).build());
            inputs = size;
        }
        return list
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE).nIn(inputs).nOut(1)
                        .activation(Activation.IDENTITY).build())
                .setInputType(InputType.feedForward(sequenceLength * width)).build();
    }

    @Override
    protected INDArray toInput(double[][][] x) {
        checkState(inputScaler != null, "input statistics are not available");
        return Nd4j.create(inputScaler.transform(flatten(x)));
    }

    static double[][] flatten(double[][][] x) {
        double[][] answer = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            int width = (x[i].length == 0) ? 0 : x[i][0].length;
            answer[i] = new double[x[i].length * width];
            for (int j = 0; j < x[i].length; j++) {
                System.arraycopy(x[i][j], 0, answer[i], j * width, width);
            }
        }
        return answer;
    }
}
