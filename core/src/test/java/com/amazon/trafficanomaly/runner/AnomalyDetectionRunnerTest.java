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

package com.amazon.trafficanomaly.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.UnknownDetectionMethodException;
import com.amazon.trafficanomaly.inputtypes.DataPoint;
import com.amazon.trafficanomaly.returntypes.AnomalyResult;

public class AnomalyDetectionRunnerTest {

    private AnomalyDetectionRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new AnomalyDetectionRunner();
        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testRunTrainsOnLeadingLines() throws IOException {
        runner.parse("--methods", "zscore", "--training-size", "2", "--header-row", "true", "--number-of-trees",
                "5", "--sample-size", "8");
        when(in.readLine()).thenReturn("requests").thenReturn("5").thenReturn("5").thenReturn("5").thenReturn(null);

        runner.run(in, out);

        verify(out).println("requests,ensemble_anomaly,ensemble_score,zscore");
        verify(out, times(2)).println("5,NA,NA,NA");
        verify(out).println("5,false,0.0,false");
        assertEquals(2, runner.getTrainingCount());
    }

    @Test
    public void testRunWithTimestamps() throws IOException {
        runner.parse("--methods", "rate_change", "--training-size", "0", "--timestamped", "true");
        when(in.readLine()).thenReturn("0,10").thenReturn("1,10").thenReturn("2,1000").thenReturn(null);

        runner.run(in, out);

        verify(out).println("0,10,false,0.0,false");
        verify(out).println("1,10,false,0.0,false");
        verify(out).println("2,1000,false,1.0,false");
    }

    @Test
    public void testWrongNumberOfFields() throws IOException {
        runner.parse("--training-size", "0", "--timestamped", "true");
        when(in.readLine()).thenReturn("1.0").thenReturn(null);

        assertThrows(IllegalArgumentException.class, () -> runner.run(in, out));
        verify(out, never()).flush();
    }

    @Test
    public void testUnknownMethodFailsFast() throws IOException {
        runner.parse("--methods", "zscore,bogus", "--training-size", "0");
        when(in.readLine()).thenReturn("1.0").thenReturn(null);

        assertThrows(UnknownDetectionMethodException.class, () -> runner.run(in, out));
    }

    @Test
    public void testUnknownMethodFailsBeforeTrainingOutput() throws IOException {
        runner.parse("--methods", "zscore,bogus", "--training-size", "3");
        when(in.readLine()).thenReturn("1.0").thenReturn("2.0").thenReturn("3.0").thenReturn(null);

        UnknownDetectionMethodException exception = assertThrows(UnknownDetectionMethodException.class,
                () -> runner.run(in, out));
        assertEquals(Collections.singleton("bogus"), exception.getUnknownMethods());
        verify(out, never()).println(anyString());
        verify(in, times(1)).readLine();
    }

    @Test
    public void testWarnsWhenInputEndsDuringTraining() throws IOException {
        Logger logger = (Logger) LoggerFactory.getLogger(SimpleRunner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            runner.parse("--methods", "zscore", "--training-size", "3");
            when(in.readLine()).thenReturn("5").thenReturn("6").thenReturn(null);

            runner.run(in, out);
        } finally {
            logger.detachAppender(appender);
        }

        verify(out).println("5,NA,NA,NA");
        verify(out).println("6,NA,NA,NA");
        verify(out).flush();
        assertEquals(2, runner.getTrainingCount());

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("Input ended after 2 of 3 training values; no detection was run", event.getFormattedMessage());
    }

    @Test
    public void testEnsembleTransformer() {
        AnomalyDetectionPipeline pipeline = mock(AnomalyDetectionPipeline.class);
        AnomalyDetectionRunner.EnsembleTransformer transformer = new AnomalyDetectionRunner.EnsembleTransformer(
                pipeline, new LinkedHashSet<>(Arrays.asList("mad", "zscore")));

        DataPoint point = new DataPoint(3, 42.0);
        Map<String, AnomalyResult> results = new LinkedHashMap<>();
        results.put("zscore", new AnomalyResult(true, 4.0, 3.0, "zscore", Collections.emptyMap()));
        results.put("mad", new AnomalyResult(false, 1.0, 3.5, "mad", Collections.emptyMap()));
        AnomalyResult ensemble = new AnomalyResult(false, 2.5, 0.5, "ensemble", Collections.emptyMap());
        when(pipeline.detect(point, transformer.getMethods())).thenReturn(results);
        when(pipeline.aggregateResults(results)).thenReturn(ensemble);

        assertEquals(Arrays.asList("false", "2.5", "false", "true"), transformer.getResultValues(point));
        assertEquals(Arrays.asList("ensemble_anomaly", "ensemble_score", "mad", "zscore"),
                transformer.getResultColumnNames());
        assertEquals(Arrays.asList("NA", "NA", "NA", "NA"), transformer.getEmptyResultValue());
        assertEquals(pipeline, transformer.getPipeline());
    }
}
