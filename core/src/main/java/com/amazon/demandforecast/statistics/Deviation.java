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

package com.amazon.demandforecast.statistics;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

/**
 * Running sums for the mean and the standard deviation of a stream of values.
 * NaN values are ignored.
 */
public class Deviation {

    protected double weight = 0;

    protected double sumSquared = 0;

    protected double sum = 0;

    public Deviation() {
    }

    public Deviation(double[] values) {
        for (double value : values) {
            update(value);
        }
    }

    public Deviation(double[] values, int from, int to) {
        for (int i = from; i < to; i++) {
            update(values[i]);
        }
    }

    public double getMean() {
        checkArgument(weight > 0, "incorrect invocation for mean");
        return sum / weight;
    }

    public void update(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        sum += value;
        sumSquared += value * value;
        weight += 1.0;
    }

    /**
     * @return the population standard deviation
     */
    public double getDeviation() {
        checkArgument(weight > 0, "incorrect invocation for standard deviation");
        double temp = sum / weight;
        double answer = sumSquared / weight - temp * temp;
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    /**
     * @return the sample standard deviation (n - 1 in the denominator), NaN for
     *         fewer than two values
     */
    public double getSampleDeviation() {
        if (weight < 2) {
            return Double.NaN;
        }
        double temp = sum / weight;
        double answer = (sumSquared - weight * temp * temp) / (weight - 1);
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    public double getCount() {
        return weight;
    }

    public boolean isEmpty() {
        return weight == 0;
    }

}
