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


package com.amazon.topologicaloutlier.distance;

import static com.amazon.topologicaloutlier.TestUtils.line;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.topologicaloutlier.TestUtils;
import com.amazon.topologicaloutlier.errors.InsufficientDataException;
import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.testutils.TimeSeriesTestData;

public class SeriesDistanceTest {

    @Test
    public void testInterpolatedOnSharedTimestamps() {
        InterpolatedSeriesDistance distance = new InterpolatedSeriesDistance();
        assertEquals(1.0, distance.distance(line("a", 1, 0, 10), line("b", 1, 1, 10)), 1e-12);
        assertEquals(0.0, distance.distance(line("a", 1, 0, 10), line("c", 1, 0, 10)));
    }

    @Test
    public void testInterpolatedOnDisjointTimestamps() {
        TimeSeries a = TimeSeries.of("a", new double[] { 0, 2 }, new double[] { 0, 2 });
        TimeSeries b = TimeSeries.of("b", new double[] { 1, 3 }, new double[] { 0, 0 });
        assertArrayEquals(new double[] { 0, 1, 2, 3 }, InterpolatedSeriesDistance.mergedTimestamps(a, b));
        // differences 0, 1, 2, 2 on the merged grid
        assertEquals(1.5, new InterpolatedSeriesDistance().distance(a, b), 1e-12);
        assertEquals(1.5, new InterpolatedSeriesDistance().distance(b, a), 1e-12);
    }

    @Test
    public void testWeightingDiscountsNoisySamples() {
        double[] t = { 0, 1, 2 };
        double[] u = { 3, 0.1, 0.1 };
        TimeSeries a = new TimeSeries("a", t, new double[] { 2, 0, 0 }, u);
        TimeSeries b = new TimeSeries("b", t, new double[] { 0, 0, 0 }, u);
        double plain = new InterpolatedSeriesDistance().distance(a, b);
        double weighted = new InterpolatedSeriesDistance(true).distance(a, b);
        assertEquals(Math.sqrt(4.0 / 3), plain, 1e-12);
        assertTrue(weighted < 0.1);
        assertEquals(weighted, new InterpolatedSeriesDistance(true).distance(b, a), 1e-12);
    }

    @Test
    public void testWeightingWithoutUncertainty() {
        TimeSeries a = line("a", 0.5, 0, 8);
        TimeSeries b = line("b", 0.5, 2, 8);
        assertEquals(2.0, new InterpolatedSeriesDistance(true).distance(a, b), 1e-9);
    }

    @Test
    public void testDynamicTimeWarping() {
        DynamicTimeWarpingDistance distance = new DynamicTimeWarpingDistance();
        TimeSeries zeros = TimeSeries.of("z", new double[] { 0, 1, 2 }, new double[] { 0, 0, 0 });
        TimeSeries ones = TimeSeries.of("o", new double[] { 0, 1, 2 }, new double[] { 1, 1, 1 });
        assertEquals(1.0, distance.distance(zeros, ones), 1e-12);

        TimeSeries ramp = TimeSeries.of("r", new double[] { 0, 1, 2 }, new double[] { 0, 1, 2 });
        TimeSeries stretched = TimeSeries.of("s", new double[] { 0, 1, 2, 3 }, new double[] { 0, 1, 1, 2 });
        assertEquals(0.0, distance.distance(ramp, stretched));
        assertEquals(0.0, distance.distance(stretched, ramp));
    }

    @Test
    public void testDynamicTimeWarpingIsSymmetric() {
        List<TimeSeries> series = TestUtils.toTimeSeries(new TimeSeriesTestData().generate(4, 25, 5));
        DynamicTimeWarpingDistance banded = new DynamicTimeWarpingDistance(0.2);
        for (TimeSeries a : series) {
            assertEquals(0.0, banded.distance(a, a));
            for (TimeSeries b : series) {
                assertEquals(banded.distance(a, b), banded.distance(b, a));
                assertTrue(banded.distance(a, b) >= new DynamicTimeWarpingDistance().distance(a, b));
            }
        }
    }

    @Test
    public void testInvalidInputs() {
        TimeSeries single = TimeSeries.of("x", new double[] { 0 }, new double[] { 1 });
        TimeSeries pair = TimeSeries.of("y", new double[] { 0, 1 }, new double[] { 1, 2 });
        assertThrows(InsufficientDataException.class, () -> new InterpolatedSeriesDistance().distance(single, pair));
        assertThrows(InsufficientDataException.class, () -> new DynamicTimeWarpingDistance().distance(pair, single));
        assertThrows(IllegalArgumentException.class, () -> new DynamicTimeWarpingDistance(0));
        assertThrows(IllegalArgumentException.class, () -> new DynamicTimeWarpingDistance(1.5));
    }
}
