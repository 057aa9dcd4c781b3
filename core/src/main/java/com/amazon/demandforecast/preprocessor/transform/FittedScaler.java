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

import java.util.Arrays;

import com.amazon.demandforecast.config.ScalingMethod;
import com.amazon.demandforecast.returntypes.RangeVector;

/**
 * Column-wise affine normalization {@code (v - shift) / scale} with the
 * statistics of a completed fit. The inversion uses the same statistics.
 */
public class FittedScaler {

    private final ScalingMethod method;

    private final double[] shift;

    private final double[] scale;

    public FittedScaler(ScalingMethod method, double[] shift, double[] scale) {
        checkArgument(shift.length == scale.length, "incorrect lengths");
        for (double value : scale) {
            checkArgument(value > 0, "scale must be positive");
        }
        this.method = method;
        this.shift = Arrays.copyOf(shift, shift.length);
        this.scale = Arrays.copyOf(scale, scale.length);
    }

    public ScalingMethod getMethod() {
        return method;
    }

    public int getColumns() {
        return shift.length;
    }

    public double[] getShift() {
        return Arrays.copyOf(shift, shift.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }

    /**
     * a normalization function
     *
     * @param column the column whose statistics are used
     * @param value  argument to be normalized
     * @return the normalized value
     */
    public double transform(int column, double value) {
        checkArgument(column >= 0 && column < shift.length, "incorrect column");
        return (value - shift[column]) / scale[column];
    }

    public double invert(int column, double value) {
        checkArgument(column >= 0 && column < shift.length, "incorrect column");
        return value * scale[column] + shift[column];
    }

    public double[] transform(double[] row) {
        checkArgument(row.length == shift.length, "incorrect length");
        double[] output = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            output[i] = (row[i] - shift[i]) / scale[i];
        }
        return output;
    }

    public double[][] transform(double[][] data) {
        double[][] output = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            output[i] = transform(data[i]);
        }
        return output;
    }

    /**
     * transforms a single column of values with the statistics of one column
     */
    public double[] transformColumn(int column, double[] values) {
        double[] output = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            output[i] = transform(column, values[i]);
        }
        return output;
    }

    public double[] invertColumn(int column, double[] values) {
        double[] output = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            output[i] = invert(column, values[i]);
        }
        return output;
    }

    /**
     * inverts a forecast (and upper and lower limits) provided by RangeVector
     * ranges in place
     *
     * @param ranges provides the values in scaled units
     * @param column the column whose statistics are used
     */
    public void invertRange(RangeVector ranges, int column) {
        checkArgument(column >= 0 && column < shift.length, "incorrect column");
        for (int i = 0; i < ranges.size(); i++) {
            ranges.scale(i, scale[column]);
            ranges.shift(i, shift[column]);
        }
    }
}
