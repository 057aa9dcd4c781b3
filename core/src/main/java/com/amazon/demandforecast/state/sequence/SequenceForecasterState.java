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

import static com.amazon.demandforecast.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

import com.amazon.demandforecast.state.preprocessor.ScalerState;

@Data
public class SequenceForecasterState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private String type;
    private int sequenceLength;
    private int width;
    private int[] layerSizes;
    private int epochs;
    private int batchSize;
    private double learningRate;
    private long randomSeed;

    /**
     * the network configuration and parameters in the deeplearning4j model format
     */
    private byte[] network;

    /**
     * present for networks that standardize their input
     */
    private ScalerState inputScaler;
}
