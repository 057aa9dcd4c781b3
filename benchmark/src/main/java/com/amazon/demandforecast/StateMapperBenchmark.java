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

package com.amazon.demandforecast;

import java.nio.charset.StandardCharsets;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.profilers.OutputSizeProfiler;
import com.amazon.demandforecast.state.trend.DecompositionMapper;
import com.amazon.demandforecast.state.trend.DecompositionState;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;
import com.amazon.demandforecast.trend.DecompositionTrendForecaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class StateMapperBenchmark {
    public static final int NUM_ROUND_TRIPS = 20;
    public static final int HORIZON = 24;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "14", "56" })
        int days;

        @Param({ "0", "25" })
        int numberOfChangepoints;

        DecompositionState trendState;
        String json;
        byte[] protostuff;

        @Setup(Level.Trial)
        public void setUpModel() throws JsonProcessingException {
            DemandData data = DemandDataSets.generate(days, 0);
            DecompositionTrendForecaster forecaster = DecompositionTrendForecaster.builder()
                    .numberOfChangepoints(numberOfChangepoints).build();
            forecaster.train(TimeSeries.of(data.timestamps[0], data.demand));

            trendState = new DecompositionMapper().toState(forecaster);
            json = new ObjectMapper().writeValueAsString(trendState);

            Schema<DecompositionState> schema = RuntimeSchema.getSchema(DecompositionState.class);
            LinkedBuffer buffer = LinkedBuffer.allocate(512);
            try {
                protostuff = ProtostuffIOUtil.toByteArray(trendState, schema, buffer);
            } finally {
                buffer.clear();
            }
        }
    }

    private byte[] bytes;

    @TearDown(Level.Iteration)
    public void tearDown() {
        OutputSizeProfiler.setTestArray(bytes);
    }

    @Benchmark
    @OperationsPerInvocation(NUM_ROUND_TRIPS)
    public DecompositionState roundTripFromState(BenchmarkState state, Blackhole blackhole) {
        DecompositionState trendState = state.trendState;
        DecompositionMapper mapper = new DecompositionMapper();

        for (int i = 0; i < NUM_ROUND_TRIPS; i++) {
            DecompositionTrendForecaster forecaster = mapper.toModel(trendState);
            blackhole.consume(forecaster.predictFuture(HORIZON));
            trendState = mapper.toState(forecaster);
        }

        return trendState;
    }

    @Benchmark
    @OperationsPerInvocation(NUM_ROUND_TRIPS)
    public String roundTripFromJson(BenchmarkState state, Blackhole blackhole) throws JsonProcessingException {
        String json = state.json;
        DecompositionMapper mapper = new DecompositionMapper();

        for (int i = 0; i < NUM_ROUND_TRIPS; i++) {
            ObjectMapper jsonMapper = new ObjectMapper();
            DecompositionTrendForecaster forecaster = mapper
                    .toModel(jsonMapper.readValue(json, DecompositionState.class));
            blackhole.consume(forecaster.predictFuture(HORIZON));
            json = jsonMapper.writeValueAsString(mapper.toState(forecaster));
        }

        bytes = json.getBytes(StandardCharsets.UTF_8);
        return json;
    }

    @Benchmark
    @OperationsPerInvocation(NUM_ROUND_TRIPS)
    public byte[] roundTripFromProtostuff(BenchmarkState state, Blackhole blackhole) {
        bytes = state.protostuff;
        DecompositionMapper mapper = new DecompositionMapper();

        for (int i = 0; i < NUM_ROUND_TRIPS; i++) {
            Schema<DecompositionState> schema = RuntimeSchema.getSchema(DecompositionState.class);
            DecompositionState trendState = schema.newMessage();
            ProtostuffIOUtil.mergeFrom(bytes, trendState, schema);

            DecompositionTrendForecaster forecaster = mapper.toModel(trendState);
            blackhole.consume(forecaster.predictFuture(HORIZON));

            LinkedBuffer buffer = LinkedBuffer.allocate(512);
            try {
                bytes = ProtostuffIOUtil.toByteArray(mapper.toState(forecaster), schema, buffer);
            } finally {
                buffer.clear();
            }
        }

        return bytes;
    }
}
