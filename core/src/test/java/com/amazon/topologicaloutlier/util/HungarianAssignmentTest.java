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


package com.amazon.topologicaloutlier.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class HungarianAssignmentTest {

    private static double bruteForce(double[][] cost, int row, boolean[] used) {
        if (row == cost.length) {
            return 0;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int j = 0; j < cost.length; j++) {
            if (!used[j]) {
                used[j] = true;
                best = Math.min(best, cost[row][j] + bruteForce(cost, row + 1, used));
                used[j] = false;
            }
        }
        return best;
    }

    @Test
    public void testSmallExample() {
        double[][] cost = { { 4, 1, 3 }, { 2, 0, 5 }, { 3, 2, 2 } };
        assertArrayEquals(new int[] { 1, 0, 2 }, HungarianAssignment.solve(cost));
        assertEquals(5.0, HungarianAssignment.minimumCost(cost));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 5, 6 })
    public void testAgainstBruteForce(int n) {
        Random random = new Random(n);
        double[][] cost = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                cost[i][j] = random.nextDouble() * 10;
            }
        }
        assertEquals(bruteForce(cost, 0, new boolean[n]), HungarianAssignment.minimumCost(cost), 1e-9);
    }

    @Test
    public void testEmptyAndInvalid() {
        assertEquals(0, HungarianAssignment.solve(new double[0][0]).length);
        assertThrows(IllegalArgumentException.class, () -> HungarianAssignment.solve(new double[][] { { 1, 2 } }));
        assertThrows(IllegalArgumentException.class,
                () -> HungarianAssignment.solve(new double[][] { { Double.POSITIVE_INFINITY } }));
    }
}
