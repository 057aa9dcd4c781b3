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
import com.amazon.demandforecast.statistics.Deviation;

/**
 * Removes the mean of every column and divides by the population standard
 * deviation. A constant column is only shifted.
 */
public class StandardScaler implements IScaler {

    @Override
    public FittedScaler fit(double[][] data) {
        checkArgument(data.length > 0, "cannot fit on empty data");
        int columns = data[0].length;
        Deviation[] deviations = new Deviation[columns];
        for (int j = 0; j < columns; j++) {
            deviations[j] = new Deviation();
        }
        for (double[] row : data) {
            checkArgument(row.length == columns, "rows must have equal length");
            for (int j = 0; j < columns; j++) {
                deviations[j].update(row[j]);
            }
        }
        double[] shift = new double[columns];
        double[] scale = new double[columns];
        for (int j = 0; j < columns; j++) {
            if (deviations[j].isEmpty()) {
                scale[j] = 1;
            } else {
                shift[j] = deviations[j].getMean();
                double deviation = deviations[j].getDeviation();
                scale[j] = (deviation > 0) ? deviation : 1.0;
            }
        }
        return new FittedScaler(ScalingMethod.STANDARD, shift, scale);
    }

    @Override
    public ScalingMethod getMethod() {
        return ScalingMethod.STANDARD;
    }
}
