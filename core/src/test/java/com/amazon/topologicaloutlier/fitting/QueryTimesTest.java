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


package com.amazon.topologicaloutlier.fitting;

import static com.amazon.topologicaloutlier.TestUtils.line;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

public class QueryTimesTest {

    @Test
    public void testUniform() {
        assertArrayEquals(new double[] { 0, 0.25, 0.5, 0.75, 1 }, QueryTimes.uniform(0, 1, 5), 1e-15);
        assertArrayEquals(new double[] { 3 }, QueryTimes.uniform(3, 7, 1));
        double[] grid = QueryTimes.uniform(0.1, 0.7, 7);
        assertEquals(0.7, grid[6]);
        assertEquals(7, grid.length);
    }

    @Test
    public void testSpanning() {
        TimeSeries early = line("a", 1, 0, 5);
        TimeSeries late = TimeSeries.of("b", new double[] { 2, 8 }, new double[] { 0, 0 });
        assertArrayEquals(new double[] { 0, 4, 8 }, QueryTimes.spanning(Arrays.asList(early, late), 3));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> QueryTimes.uniform(1, 0, 3));
        assertThrows(IllegalArgumentException.class, () -> QueryTimes.uniform(0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> QueryTimes.uniform(0, Double.NaN, 3));
        assertThrows(IllegalArgumentException.class, () -> QueryTimes.spanning(Collections.emptyList(), 3));
    }
}
