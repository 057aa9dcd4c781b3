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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Per epoch losses and learning rates of a training run.
 */
public class TrainingHistory {

    private final List<Double> trainingLoss = new ArrayList<>();

    private final List<Double> validationLoss = new ArrayList<>();

    private final List<Double> learningRate = new ArrayList<>();

    @Getter
    @Setter
    private int bestEpoch = -1;

    @Getter
    @Setter
    private boolean stoppedEarly;

    void record(double training, double validation, double rate) {
        trainingLoss.add(training);
        validationLoss.add(validation);
        learningRate.add(rate);
    }

    public int getEpochs() {
        return trainingLoss.size();
    }

    public List<Double> getTrainingLoss() {
        return Collections.unmodifiableList(trainingLoss);
    }

    public List<Double> getValidationLoss() {
        return Collections.unmodifiableList(validationLoss);
    }

    public List<Double> getLearningRate() {
        return Collections.unmodifiableList(learningRate);
    }
}
