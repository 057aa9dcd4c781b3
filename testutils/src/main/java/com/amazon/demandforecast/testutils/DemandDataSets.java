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

package com.amazon.demandforecast.testutils;

import static java.lang.Math.PI;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Random;

public class DemandDataSets {

    public static final LocalDateTime DEFAULT_START = LocalDateTime.of(2024, 1, 1, 0, 0);

    /**
     * hourly demand made of a base load, a daytime peak, lower weekends, a yearly
     * swing, temperature driven load, random events on 2% of the hours and
     * noise; never below 1000
     */
    public static DemandData generate(int days, long seed) {
        return generate(DEFAULT_START, days, seed, 0.02);
    }

    public static DemandData generate(LocalDateTime start, int days, long seed, double eventFraction) {
        int hours = days * 24;
        Random prg = new Random(seed);
        Random noiseprg = new Random(prg.nextLong());
        LocalDateTime[] timestamps = new LocalDateTime[hours];
        double[] demand = new double[hours];
        double[] temperature = new double[hours];

        for (int i = 0; i < hours; i++) {
            timestamps[i] = start.plusHours(i);
            temperature[i] = 20 + 15 * Math.sin(4 * PI * i / Math.max(1, hours - 1)) + 3 * noiseprg.nextGaussian();
        }

        int events = (int) (hours * eventFraction);
        int[] eventIndices = new int[events];
        boolean[] isEvent = new boolean[hours];
        int count = 0;
        while (count < events) {
            int index = prg.nextInt(hours);
            if (!isEvent[index]) {
                isEvent[index] = true;
                eventIndices[count++] = index;
            }
        }
        Arrays.sort(eventIndices);

        for (int i = 0; i < hours; i++) {
            int hour = timestamps[i].getHour();
            int dayOfWeek = timestamps[i].getDayOfWeek().getValue() - 1;
            int dayOfYear = timestamps[i].getDayOfYear() - 1;
            double value = 5000 + 100 * noiseprg.nextGaussian();
            value += (hour >= 6 && hour <= 22) ? 2000 * Math.sin((hour - 6) * PI / 16) : -500;
            value += (dayOfWeek >= 5) ? -800 : 400;
            value += 1500 * Math.abs(Math.sin(2 * PI * dayOfYear / 365));
            if (temperature[i] > 30) {
                value += (temperature[i] - 30) * 100;
            } else if (temperature[i] < 10) {
                value += (10 - temperature[i]) * 80;
            }
            if (isEvent[i]) {
                value += (prg.nextBoolean() ? 1 : -1) * (500 + 1000 * prg.nextDouble());
            }
            value += 50 * noiseprg.nextGaussian();
            demand[i] = Math.max(value, 1000);
        }
        return new DemandData(timestamps, demand, temperature, eventIndices);
    }

    /**
     * a cosine of the given period with a linear slope and gaussian noise
     */
    public static double[] periodic(int num, int period, double amplitude, double level, double slope, double noise,
            long seed) {
        Random noiseprg = new Random(seed);
        double[] answer = new double[num];
        for (int i = 0; i < num; i++) {
            answer[i] = level + amplitude * Math.cos(2 * PI * i / period) + slope * i + noise * noiseprg.nextGaussian();
        }
        return answer;
    }

    public static LocalDateTime[] hourly(LocalDateTime start, int num) {
        LocalDateTime[] answer = new LocalDateTime[num];
        for (int i = 0; i < num; i++) {
            answer[i] = start.plusHours(i);
        }
        return answer;
    }

    /**
     * a copy of values with the listed positions multiplied by factor
     */
    public static double[] withSpikes(double[] values, double factor, int... indices) {
        double[] answer = Arrays.copyOf(values, values.length);
        for (int index : indices) {
            answer[index] *= factor;
        }
        return answer;
    }
}
