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

package com.amazon.demandforecast.state.trend;

import static com.amazon.demandforecast.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

@Data
public class DecompositionState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    // configuration
    private int numberOfChangepoints;
    private double changepointRange;
    private double changepointPriorScale;
    private double seasonalityPriorScale;
    private double intervalWidth;
    private String seasonalityMode;

    // fit
    private String start;
    private long stepSeconds;
    private int historyLength;
    private double startHours;
    private double spanHours;
    private double yScale;
    private double[] changepoints;
    private double[] trendCoefficients;
    private String[] seasonalityNames;
    private double[] seasonalityPeriods;
    private int[] seasonalityOrders;
    private double[] seasonalCoefficients;
    private double residualStd;
    private double meanAbsDelta;
}
