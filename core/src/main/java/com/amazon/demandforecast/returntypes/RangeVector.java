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

package com.amazon.demandforecast.returntypes;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.Arrays;

/**
 * A RangeVector is used when we want to track a quantity over a forecast
 * horizon and its upper and lower bounds
 */
public class RangeVector {

    public final double[] values;

    /**
     * An array of values corresponding to the upper ranges at each step.
     */
    public final double[] upper;
    /**
     * An array of values corresponding to the lower ranges at each step
     */
    public final double[] lower;

    public RangeVector(int horizon) {
        checkArgument(horizon > 0, "horizon must be greater than 0");
        values = new double[horizon];
        upper = new double[horizon];
        lower = new double[horizon];
    }

    /**
     * Construct a new RangeVector from the given values and bounds.
     * 
     * @param values the values being estimated in a range
     * @param upper  the higher values of the ranges
     * @param lower  the lower values in the ranges
     */
    public RangeVector(double[] values, double[] upper, double[] lower) {
        checkArgument(values.length > 0, " horizon must be > 0");
        checkArgument(values.length == upper.length && upper.length == lower.length, "lengths must be equal");
        for (int i = 0; i < values.length; i++) {
            checkArgument(upper[i] >= values[i] && values[i] >= lower[i], "incorrect semantics");
        }
        this.values = Arrays.copyOf(values, values.length);
        this.upper = Arrays.copyOf(upper, upper.length);
        this.lower = Arrays.copyOf(lower, lower.length);
    }

    public RangeVector(double[] values) {
        checkArgument(values.length > 0, "horizon must be > 0 ");
        this.values = Arrays.copyOf(values, values.length);
        this.upper = Arrays.copyOf(values, values.length);
        this.lower = Arrays.copyOf(values, values.length);
    }

    /**
     * Create a deep copy of the base RangeVector.
     *
     * @param base The RangeVector to copy.
     */
    public RangeVector(RangeVector base) {
        int horizon = base.values.length;
        this.values = Arrays.copyOf(base.values, horizon);
        this.upper = Arrays.copyOf(base.upper, horizon);
        this.lower = Arrays.copyOf(base.lower, horizon);
    }

    public int size() {
        return values.length;
    }

    public void shift(int i, double shift) {
        checkArgument(i >= 0 && i < values.length, "incorrect index");
        values[i] += shift;
        // managing precision
        upper[i] = max(values[i], upper[i] + shift);
        lower[i] = min(values[i], lower[i] + shift);
    }

    public void scale(int i, double weight) {
        checkArgument(i >= 0 && i < values.length, "incorrect index");
        checkArgument(weight > 0, " negative weight not permitted");
        values[i] = values[i] * weight;
        // managing precision
        upper[i] = max(upper[i] * weight, values[i]);
        lower[i] = min(lower[i] * weight, values[i]);
    }

}
