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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(100, parser.getNumberOfTrees());
        assertEquals(256, parser.getSampleSize());
        assertEquals(100, parser.getWindowSize());
        assertEquals(24, parser.getSeasonality());
        assertEquals(100, parser.getTrainingSize());
        assertThat(parser.getMethods(), contains("zscore", "iqr", "mad", "isolation_forest"));
        assertFalse(parser.getTimestamped());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(42, parser.getRandomSeed());
    }

    @Test
    public void testParse() {
        parser.parse("--number-of-trees", "222", "--sample-size", "123", "--window-size", "50", "--seasonality", "7",
                "--training-size", "0", "--methods", "mad, rate_change", "--timestamped", "true", "--delimiter", "\t",
                "--header-row", "true", "--random-seed", "9");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals(50, parser.getWindowSize());
        assertEquals(7, parser.getSeasonality());
        assertEquals(0, parser.getTrainingSize());
        assertThat(parser.getMethods(), contains("mad", "rate_change"));
        assertTrue(parser.getTimestamped());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(9, parser.getRandomSeed());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-n", "222", "-s", "123", "-w", "50", "-t", "20", "-m", "zscore", "-d", ";");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals(50, parser.getWindowSize());
        assertEquals(20, parser.getTrainingSize());
        assertThat(parser.getMethods(), contains("zscore"));
        assertEquals(";", parser.getDelimiter());
    }
}
