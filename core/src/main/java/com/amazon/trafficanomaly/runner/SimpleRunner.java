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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.BiFunction;

import lombok.extern.slf4j.Slf4j;

import com.amazon.trafficanomaly.AnomalyDetectionPipeline;
import com.amazon.trafficanomaly.UnknownDetectionMethodException;
import com.amazon.trafficanomaly.config.UnknownMethodPolicy;
import com.amazon.trafficanomaly.inputtypes.DataPoint;

/**
 * A simple command-line application that parses command-line arguments, creates
 * an AnomalyDetectionPipeline based on those arguments, reads values from STDIN
 * and writes results to STDOUT. The first lines of input, up to the training
 * size, are used to train the pipeline and are echoed with placeholder results.
 */
@Slf4j
public class SimpleRunner {

    protected final ArgumentParser argumentParser;
    protected final BiFunction<AnomalyDetectionPipeline, Set<String>, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected double[] trainingBuffer;
    protected int trainingCount;
    protected int fieldCount;
    protected int lineNumber;
    protected long dataLineCount;

    /**
     * Create a new SimpleRunner.
     *
     * @param runnerClass          The name of the runner class. This will be
     *                             displayed in the help text.
     * @param runnerDescription    A description of the runner class. This will be
     *                             displayed in the help text.
     * @param algorithmInitializer A factory method to create a new LineTransformer
     *                             instance from a pipeline and the selected
     *                             detection methods.
     */
    public SimpleRunner(String runnerClass, String runnerDescription,
            BiFunction<AnomalyDetectionPipeline, Set<String>, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    /**
     * Create a new SimpleRunner.
     *
     * @param argumentParser       A argument parser that will be used by this
     *                             runner to parse command-line arguments.
     * @param algorithmInitializer A factory method to create a new LineTransformer
     *                             instance from a pipeline and the selected
     *                             detection methods.
     */
    public SimpleRunner(ArgumentParser argumentParser,
            BiFunction<AnomalyDetectionPipeline, Set<String>, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read data from an input stream, apply the desired transformation, and write
     * the result to an output stream.
     *
     * @param in  An input stream where input values will be read.
     * @param out An output stream where the result values will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (algorithm == null) {
                prepareAlgorithm(argumentParser.getTimestamped() ? 2 : 1);
            }

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values, out);
        }

        finish(out);
        out.flush();
    }

    /**
     * Set up the internal pipeline and line transformer.
     *
     * @param fields The number of fields on each input line.
     */
    protected void prepareAlgorithm(int fields) {
        fieldCount = fields;
        trainingBuffer = new double[argumentParser.getTrainingSize()];
        trainingCount = 0;

        AnomalyDetectionPipeline pipeline = AnomalyDetectionPipeline.builder()
                .numberOfTrees(argumentParser.getNumberOfTrees()).sampleSize(argumentParser.getSampleSize())
                .windowSize(argumentParser.getWindowSize()).seasonality(argumentParser.getSeasonality())
                .randomSeed(argumentParser.getRandomSeed()).unknownMethodPolicy(UnknownMethodPolicy.REJECT).build();

        // typos in --methods fail before any line is written
        Set<String> methods = argumentParser.getMethods();
        Set<String> unknown = new LinkedHashSet<>(methods);
        unknown.removeAll(pipeline.getRegisteredMethods());
        if (!unknown.isEmpty()) {
            throw new UnknownDetectionMethodException(unknown, pipeline.getRegisteredMethods());
        }

        algorithm = algorithmInitializer.apply(pipeline, methods);
    }

    /**
     * Write a header row to the output stream.
     *
     * @param values The array of values that are used to create the header. These
     *               values will be joined together using the user-specified
     *               delimiter.
     * @param out    The output stream where the header will be written.
     */
    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    /**
     * Process a single line of input data and write the result to the output
     * stream.
     *
     * @param values An array of string values taken from the input stream.
     * @param out    The output stream where the transformed line will be written.
     */
    protected void processLine(String[] values, PrintWriter out) {
        if (values.length != fieldCount) {
            throw new IllegalArgumentException(String.format(
                    "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, fieldCount,
                    values.length));
        }

        DataPoint point = parsePoint(values);
        dataLineCount++;

        List<String> result;
        if (trainingCount < trainingBuffer.length) {
            trainingBuffer[trainingCount++] = point.getValue();
            if (trainingCount == trainingBuffer.length) {
                algorithm.getPipeline().train(trainingBuffer);
            }
            result = algorithm.getEmptyResultValue();
        } else {
            result = algorithm.getResultValues(point);
        }

        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        result.forEach(joiner::add);

        out.println(joiner.toString());
    }

    /**
     * Parse the array of string values into an observation. Lines without a
     * timestamp are stamped with their position among the data lines.
     *
     * @param stringValues An array of string-encoded double values.
     * @return the observation
     */
    protected DataPoint parsePoint(String[] stringValues) {
        if (fieldCount == 2) {
            return new DataPoint(Double.parseDouble(stringValues[0].trim()),
                    Double.parseDouble(stringValues[1].trim()));
        }
        return new DataPoint(dataLineCount, Double.parseDouble(stringValues[0].trim()));
    }

    /**
     * This method is used to write any final output to the output stream after the
     * input stream has been fully processed.
     *
     * @param out The output stream where additional output text may be written.
     */
    protected void finish(PrintWriter out) {
        if (trainingBuffer != null && trainingCount < trainingBuffer.length) {
            log.warn("Input ended after {} of {} training values; no detection was run", trainingCount,
                    trainingBuffer.length);
        }
    }

    /**
     * @return the number of values consumed as training data so far.
     */
    protected int getTrainingCount() {
        return trainingCount;
    }
}
