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

package com.amazon.demandforecast.trend;

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named additive components of a fit, for example the trend and one column per
 * seasonality, evaluated at common timestamps.
 */
public class TrendComponents {

    public static final String TREND = "trend";

    private final LocalDateTime[] timestamps;

    private final LinkedHashMap<String, double[]> components = new LinkedHashMap<>();

    public TrendComponents(LocalDateTime[] timestamps) {
        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
    }

    public void put(String name, double[] values) {
        checkArgument(values.length == timestamps.length, "incorrect length for " + name);
        components.put(name, Arrays.copyOf(values, values.length));
    }

    public LocalDateTime[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(components.keySet()));
    }

    public boolean has(String name) {
        return components.containsKey(name);
    }

    public double[] get(String name) {
        double[] values = components.get(name);
        checkArgument(values != null, "no component named " + name);
        return Arrays.copyOf(values, values.length);
    }

    public Map<String, double[]> asMap() {
        Map<String, double[]> answer = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : components.entrySet()) {
            answer.put(entry.getKey(), Arrays.copyOf(entry.getValue(), entry.getValue().length));
        }
        return answer;
    }

    public int size() {
        return timestamps.length;
    }
}
