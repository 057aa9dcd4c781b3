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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.ensemble.EnsembleWeights;
import com.amazon.demandforecast.errors.EnsembleFailureException;
import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.InsufficientDataException;
import com.amazon.demandforecast.errors.NotTrainedException;
import com.amazon.demandforecast.errors.Stage;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.persist.LoadResult;
import com.amazon.demandforecast.persist.ModelStore;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.returntypes.ComponentForecast;
import com.amazon.demandforecast.returntypes.EvaluationMetrics;
import com.amazon.demandforecast.returntypes.ForecastPoint;
import com.amazon.demandforecast.returntypes.ForecastResult;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;
import com.amazon.demandforecast.sequence.ISequenceForecaster;
import com.amazon.demandforecast.testutils.DemandData;
import com.amazon.demandforecast.testutils.DemandDataSets;
import com.amazon.demandforecast.trend.ITrendForecaster;
import com.amazon.demandforecast.trend.PatternTrendForecaster;

public class EnsembleForecasterTest {

    private static final int HORIZON = 6;

    private TimeSeries series;
    private Preprocessor preprocessor;
    private ISequenceForecaster sequence;
    private ITrendForecaster trend;
    private EnsembleForecaster forecaster;

    @BeforeEach
    public void setUp() {
        DemandData data = DemandDataSets.generate(5, 3);
        series = TimeSeries.of(data.timestamps[0], data.demand);
        preprocessor = smallPreprocessor();
        sequence = mock(ISequenceForecaster.class);
        trend = mock(ITrendForecaster.class);
        forecaster = EnsembleForecaster.builder().preprocessor(preprocessor).sequenceForecaster(sequence)
                .trendForecaster(trend).build();
    }

    private static Preprocessor smallPreprocessor() {
        return Preprocessor.builder().lags(1, 2).rollingWindows(3).sequenceLength(4).build();
    }

    private static EnsembleForecaster small() {
        ISequenceForecaster network = AbstractNetworkForecaster.builder().type(SequenceModelType.FEED_FORWARD)
                .epochs(2).batchSize(16).layerSizes(4, 4).randomSeed(1).build();
        return EnsembleForecaster.builder().preprocessor(smallPreprocessor()).sequenceForecaster(network)
                .trendForecaster(PatternTrendForecaster.builder().build()).build();
    }

    private void markTrained() {
        preprocessor.fitTransform(series);
        when(sequence.isTrained()).thenReturn(true);
        when(trend.isTrained()).thenReturn(true);
    }

    private void trendReturns(double value) {
        when(trend.predict(any())).thenAnswer(invocation -> {
            LocalDateTime[] timestamps = invocation.getArgument(0);
            double[] values = new double[timestamps.length];
            Arrays.fill(values, value);
            return new ComponentForecast(EnsembleForecaster.TREND_NAME, timestamps, values);
        });
    }

    @Test
    public void testConfig() {
        assertThrows(IllegalArgumentException.class, () -> EnsembleForecaster.builder().trainFraction(0).build());
        assertThrows(NullPointerException.class, () -> EnsembleForecaster.builder().weights(null).build());

        EnsembleForecaster defaults = EnsembleForecaster.builder().sequenceLength(12).build();
        assertEquals(12, defaults.getPreprocessor().getSequenceLength());
        assertEquals(SequenceModelType.RECURRENT, defaults.getSequenceForecaster().getType());
        assertEquals(EnsembleWeights.DEFAULT, defaults.getWeights());
        assertFalse(defaults.isTrained());
    }

    @Test
    public void testNotTrained() {
        NotTrainedException e = assertThrows(NotTrainedException.class, () -> forecaster.forecast(series, HORIZON));
        assertEquals(Stage.COMBINER, e.getStage());
        assertThrows(NotTrainedException.class, () -> forecaster.save(mock(ModelStore.class), "ensemble"));
    }

    @Test
    public void testTrainDelegates() {
        forecaster.train(series);
        assertTrue(preprocessor.isFitted());
        verify(sequence).train(any(), any(), any(), any());
        verify(trend).train(series);
    }

    @Test
    public void testCombinedForecast() {
        markTrained();
        double[] scaled = new double[HORIZON];
        Arrays.fill(scaled, 0.5);
        when(sequence.predictSequence(any(), anyInt(), isNull())).thenReturn(scaled);
        trendReturns(1000);

        ForecastResult result = forecaster.forecast(series, HORIZON);
        assertEquals(HORIZON, result.size());
        assertFalse(result.isDegraded());

        double rawSequence = preprocessor.inverseTransformTarget(new double[] { 0.5 })[0];
        ForecastPoint first = result.get(0);
        assertEquals(series.getLastTimestamp().plusHours(1), first.getTimestamp());
        assertEquals(rawSequence, first.getRawSequenceEstimate(), 1e-9);
        assertEquals(1000, first.getRawTrendEstimate(), 1e-9);
        assertEquals(0.6 * rawSequence + 0.4 * 1000, first.getPredictedValue(), 1e-9);
        assertTrue(first.getLowerBound() <= first.getPredictedValue());
        assertTrue(first.getUpperBound() >= first.getPredictedValue());
    }

    @Test
    public void testSequenceFailureDegrades() {
        markTrained();
        when(sequence.predictSequence(any(), anyInt(), isNull())).thenThrow(new IllegalStateException("boom"));
        trendReturns(1000);

        ForecastResult result = forecaster.forecast(series, HORIZON);
        assertTrue(result.isDegraded());
        assertEquals(1, result.getFailures().size());
        assertEquals(Stage.SEQUENCE_MODEL, result.getFailures().get(0).getStage());
        assertEquals(EnsembleForecaster.SEQUENCE_NAME, result.getFailures().get(0).getModel());
        assertEquals("boom", result.getFailures().get(0).getMessage());
        for (ForecastPoint point : result.getPoints()) {
            assertFalse(point.hasSequenceEstimate());
            assertEquals(1000, point.getPredictedValue(), 1e-9);
            assertEquals(900, point.getLowerBound(), 1e-9);
            assertEquals(1100, point.getUpperBound(), 1e-9);
        }
    }

    @Test
    public void testTrendFailureKeepsStage() {
        markTrained();
        double[] scaled = new double[HORIZON];
        when(sequence.predictSequence(any(), anyInt(), isNull())).thenReturn(scaled);
        when(trend.predict(any())).thenThrow(new ForecastException(Stage.PREPROCESSING, "bad calendar"));

        ForecastResult result = forecaster.forecast(series, HORIZON);
        assertTrue(result.isDegraded());
        assertEquals(Stage.PREPROCESSING, result.getFailures().get(0).getStage());
        assertEquals(EnsembleForecaster.TREND_NAME, result.getFailures().get(0).getModel());
        assertFalse(result.get(0).hasTrendEstimate());
    }

    @Test
    public void testShortHistoryIsNotRecovered() {
        markTrained();
        trendReturns(1000);

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> forecaster.forecast(series.tail(3), 4));
        assertEquals(Stage.PREPROCESSING, e.getStage());
        verify(sequence, never()).predictSequence(any(), anyInt(), any());
        verify(trend, never()).predict(any());
    }

    @Test
    public void testBothFail() {
        markTrained();
        when(sequence.predictSequence(any(), anyInt(), isNull())).thenThrow(new IllegalStateException("first"));
        when(trend.predict(any())).thenThrow(new IllegalStateException("second"));

        EnsembleFailureException e = assertThrows(EnsembleFailureException.class,
                () -> forecaster.forecast(series, HORIZON));
        assertEquals(Stage.COMBINER, e.getStage());
        assertEquals(2, e.getFailures().size());
        assertEquals(Stage.TREND_MODEL, e.getFailures().get(1).getStage());
    }

    @Test
    public void testTrainForecastEvaluate() {
        EnsembleForecaster ensemble = small();
        ensemble.train(series);
        assertTrue(ensemble.isTrained());

        ForecastResult result = ensemble.forecast(series, HORIZON);
        assertEquals(HORIZON, result.size());
        assertFalse(result.isDegraded());
        assertArrayEquals(series.futureTimestamps(HORIZON), result.getPoints().stream()
                .map(ForecastPoint::getTimestamp).toArray(LocalDateTime[]::new));
        for (ForecastPoint point : result.getPoints()) {
            assertTrue(point.hasSequenceEstimate());
            assertTrue(point.hasTrendEstimate());
            assertTrue(point.getConfidence() >= 0 && point.getConfidence() <= 100);
        }

        EvaluationMetrics metrics = ensemble.evaluate(series, HORIZON);
        assertEquals(HORIZON, metrics.getCount());
        assertTrue(metrics.getMae() >= 0);
        assertThrows(IllegalArgumentException.class, () -> ensemble.evaluate(series, series.size()));
    }

    @Test
    public void testSaveAndLoad(@TempDir Path directory) {
        ModelStore store = new ModelStore(directory);
        EnsembleForecaster ensemble = small();
        ensemble.train(series);
        ensemble.save(store, "region-1");
        assertTrue(Files.exists(store.pathFor("region-1" + EnsembleForecaster.PREPROCESSOR_SUFFIX)));
        assertTrue(Files.exists(store.pathFor("region-1" + EnsembleForecaster.SEQUENCE_SUFFIX)));
        assertTrue(Files.exists(store.pathFor("region-1" + EnsembleForecaster.TREND_SUFFIX)));

        EnsembleForecaster copy = small();
        LoadResult<EnsembleForecaster> loaded = copy.load(store, "region-1");
        assertEquals(LoadResult.Status.LOADED, loaded.getStatus());
        assertTrue(copy.isTrained());
        assertArrayEquals(ensemble.forecast(series, HORIZON).getPredictedValues(),
                copy.forecast(series, HORIZON).getPredictedValues(), 1e-6);

        assertEquals(LoadResult.Status.NOT_FOUND, small().load(store, "region-2").getStatus());
    }

    @Test
    public void testLoadOrTrain(@TempDir Path directory) {
        ModelStore store = new ModelStore(directory);
        EnsembleForecaster first = small();
        assertEquals(LoadResult.Status.NOT_FOUND, first.loadOrTrain(store, "ensemble", series).getStatus());
        assertTrue(first.isTrained());

        EnsembleForecaster second = small();
        assertEquals(LoadResult.Status.LOADED, second.loadOrTrain(store, "ensemble", series).getStatus());
        assertTrue(second.isTrained());
    }
}
