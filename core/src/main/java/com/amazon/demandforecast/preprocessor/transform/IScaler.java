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

package com.amazon.demandforecast.preprocessor.transform;

import com.amazon.demandforecast.config.ScalingMethod;

/**
 * A scaler computes column statistics from a training matrix. The only way to
 * obtain something that can transform values is a successful fit, so a
 * transformation with unfitted statistics is not expressible.
 */
public interface IScaler {

    /**
     * computes the statistics of every column of data; missing values (NaN) are
     * ignored
     *
     * @param data rows of equal length
     * @return the fitted scaler
     */
    FittedScaler fit(double[][] data);

    ScalingMethod getMethod();

    static IScaler of(ScalingMethod method) {
        switch (method) {
        case STANDARD:
            return new StandardScaler();
        case MIN_MAX:
        default:
            return new MinMaxScaler();
        }
    }
}
