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

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;

/**
 * A regressor over fixed length windows of scaled rows that estimates the
 * scaled target one step after the window.
 */
public interface ISequenceForecaster {

    /**
     * fits the model; the validation windows may be null
     *
     * @param x    windows of [sequence length][width]
     * @param y    the label of each window
     * @param xVal optional validation windows
     * @param yVal optional validation labels
     */
    void train(double[][][] x, double[] y, double[][][] xVal, double[] yVal);

    /**
     * @param x windows with the shape seen in training
     * @return one estimate per window
     */
    double[] predict(double[][][] x);

    /**
     * repeated one step prediction where each estimate becomes the target column
     * of a new last row
     *
     * @param lastWindow the seed window, not modified
     * @param steps      number of steps
     * @param futureRows optional rows supplying the other columns of each new
     *                   row; the last known row is repeated when absent
     * @return the estimates, in scaled units
     */
    double[] predictSequence(double[][] lastWindow, int steps, double[][] futureRows);

    boolean isTrained();

    SequenceModelType getType();

    int getSequenceLength();

    int getWidth();

    TrainingHistory getHistory();

    void save(ModelStore store, String name);

    /**
     * replaces the parameters of this instance with a stored artifact, if one
     * can be read
     */
    LoadResult<ISequenceForecaster> load(ModelStore store, String name);
}
