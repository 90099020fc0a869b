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


package com.amazon.topologicaloutlier.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.topologicaloutlier.config.DistanceVariant;
import com.amazon.topologicaloutlier.config.FailurePolicy;
import com.amazon.topologicaloutlier.config.ScoringStrategy;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(DistanceVariant.RAW_SERIES, parser.getDistanceVariant());
        assertEquals(ScoringStrategy.MIN_INCIDENT_EDGE, parser.getScoringStrategy());
        assertEquals(FailurePolicy.ABORT, parser.getFailurePolicy());
        assertEquals(ArgumentParser.SeriesMetric.INTERPOLATED, parser.getSeriesMetric());
        assertEquals(1.0, parser.getDtwBandFraction());
        assertEquals(32, parser.getQueryTimestampCount());
        assertTrue(Double.isNaN(parser.getQueryStart()));
        assertTrue(Double.isNaN(parser.getQueryEnd()));
        assertEquals(1, parser.getMaxDimension());
        assertEquals(Double.POSITIVE_INFINITY, parser.getMaxDiameter());
        assertEquals(0, parser.getNearestNeighbors());
        assertEquals(2, parser.getEmbeddingDimension());
        assertEquals(1, parser.getEmbeddingDelay());
        assertFalse(parser.getParallelExecutionEnabled());
        assertEquals(0, parser.getThreadPoolSize());
        assertEquals(0, parser.getTopK());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
    }

    @Test
    public void testParse() {
        parser.parse("--distance-variant", "wasserstein_gp", "--scoring-strategy", "TREE_ECCENTRICITY",
                "--failure-policy", "exclude", "--series-metric", "dtw", "--dtw-band", "0.25",
                "--query-timestamp-count", "12", "--query-start", "1.5", "--query-end", "9", "--max-dimension", "2",
                "--max-diameter", "3.5", "--nearest-neighbors", "4", "--embedding-dimension", "3",
                "--embedding-delay", "2", "--parallel-execution-enabled", "true", "--thread-pool-size", "6",
                "--top-k", "5", "--delimiter", "\t", "--header-row", "true");

        assertEquals(DistanceVariant.WASSERSTEIN_GP, parser.getDistanceVariant());
        assertEquals(ScoringStrategy.TREE_ECCENTRICITY, parser.getScoringStrategy());
        assertEquals(FailurePolicy.EXCLUDE, parser.getFailurePolicy());
        assertEquals(ArgumentParser.SeriesMetric.DTW, parser.getSeriesMetric());
        assertEquals(0.25, parser.getDtwBandFraction());
        assertEquals(12, parser.getQueryTimestampCount());
        assertEquals(1.5, parser.getQueryStart());
        assertEquals(9.0, parser.getQueryEnd());
        assertEquals(2, parser.getMaxDimension());
        assertEquals(3.5, parser.getMaxDiameter());
        assertEquals(4, parser.getNearestNeighbors());
        assertEquals(3, parser.getEmbeddingDimension());
        assertEquals(2, parser.getEmbeddingDelay());
        assertTrue(parser.getParallelExecutionEnabled());
        assertEquals(6, parser.getThreadPoolSize());
        assertEquals(5, parser.getTopK());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-v", "DIAGRAM_DISTANCE", "-s", "diagram_bulk", "-f", "EXCLUDE", "-m", "weighted_interpolated",
                "-q", "8", "-D", "0", "-k", "3", "-e", "4", "-p", "true", "-t", "2", "-d", ";");

        assertEquals(DistanceVariant.DIAGRAM_DISTANCE, parser.getDistanceVariant());
        assertEquals(ScoringStrategy.DIAGRAM_BULK, parser.getScoringStrategy());
        assertEquals(FailurePolicy.EXCLUDE, parser.getFailurePolicy());
        assertEquals(ArgumentParser.SeriesMetric.WEIGHTED_INTERPOLATED, parser.getSeriesMetric());
        assertEquals(8, parser.getQueryTimestampCount());
        assertEquals(0, parser.getMaxDimension());
        assertEquals(3, parser.getNearestNeighbors());
        assertEquals(4, parser.getEmbeddingDimension());
        assertTrue(parser.getParallelExecutionEnabled());
        assertEquals(2, parser.getThreadPoolSize());
        assertEquals(";", parser.getDelimiter());
    }
}
