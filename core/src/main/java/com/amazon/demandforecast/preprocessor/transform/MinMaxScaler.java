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

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import com.amazon.demandforecast.config.ScalingMethod;

/**
 * Maps every column to [0,1] over the range seen in the fit. A constant column
 * is only shifted.
 */
public class MinMaxScaler implements IScaler {

    @Override
    public FittedScaler fit(double[][] data) {
        checkArgument(data.length > 0, "cannot fit on empty data");
        int columns = data[0].length;
        double[] min = new double[columns];
        double[] max = new double[columns];
        for (int j = 0; j < columns; j++) {
            min[j] = Double.MAX_VALUE;
            max[j] = -Double.MAX_VALUE;
        }
        for (double[] row : data) {
            checkArgument(row.length == columns, "rows must have equal length");
            for (int j = 0; j < columns; j++) {
                if (!Double.isNaN(row[j])) {
                    min[j] = Math.min(min[j], row[j]);
                    max[j] = Math.max(max[j], row[j]);
                }
            }
        }
        double[] scale = new double[columns];
        for (int j = 0; j < columns; j++) {
            if (min[j] > max[j]) {
                // all values missing
                min[j] = 0;
                scale[j] = 1;
            } else {
                scale[j] = (max[j] > min[j]) ? max[j] - min[j] : 1.0;
            }
        }
        return new FittedScaler(ScalingMethod.MIN_MAX, min, scale);
    }

    @Override
    public ScalingMethod getMethod() {
        return ScalingMethod.MIN_MAX;
    }
}
