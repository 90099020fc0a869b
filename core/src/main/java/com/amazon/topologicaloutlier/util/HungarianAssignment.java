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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Minimum cost perfect matching on a square cost matrix, using the
 * potential-based O(n^3) formulation of the Hungarian algorithm. Costs must be
 * finite.
 */
public class HungarianAssignment {

    private HungarianAssignment() {
    }

    /**
     * @param cost a square matrix of finite costs
     * @return {@code assignment[row] = column} of an optimal matching
     */
    public static int[] solve(double[][] cost) {
        checkNotNull(cost, "cost must not be null");
        int n = cost.length;
        for (double[] row : cost) {
            checkArgument(row.length == n, "cost matrix must be square");
            for (double c : row) {
                checkArgument(Double.isFinite(c), "costs must be finite");
            }
        }

        // 1-based arrays, index 0 is the virtual start column
        double[] u = new double[n + 1];
        double[] v = new double[n + 1];
        int[] rowOfColumn = new int[n + 1];
        int[] way = new int[n + 1];

        for (int i = 1; i <= n; i++) {
            rowOfColumn[0] = i;
            int column = 0;
            double[] minSlack = new double[n + 1];
            boolean[] used = new boolean[n + 1];
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            do {
                used[column] = true;
                int row = rowOfColumn[column];
                double delta = Double.POSITIVE_INFINITY;
                int next = 0;
                for (int j = 1; j <= n; j++) {
                    if (!used[j]) {
                        double slack = cost[row - 1][j - 1] - u[row] - v[j];
                        if (slack < minSlack[j]) {
                            minSlack[j] = slack;
                            way[j] = column;
                        }
                        if (minSlack[j] < delta) {
                            delta = minSlack[j];
                            next = j;
                        }
                    }
                }
                for (int j = 0; j <= n; j++) {
                    if (used[j]) {
                        u[rowOfColumn[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minSlack[j] -= delta;
                    }
                }
                column = next;
            } while (rowOfColumn[column] != 0);
            do {
                int previous = way[column];
                rowOfColumn[column] = rowOfColumn[previous];
                column = previous;
            } while (column != 0);
        }

        int[] assignment = new int[n];
        for (int j = 1; j <= n; j++) {
            assignment[rowOfColumn[j] - 1] = j - 1;
        }
        return assignment;
    }

    /**
     * @param cost a square matrix of finite costs
     * @return the total cost of an optimal matching
     */
    public static double minimumCost(double[][] cost) {
        int[] assignment = solve(cost);
        double total = 0;
        for (int i = 0; i < assignment.length; i++) {
            total += cost[i][assignment[i]];
        }
        return total;
    }
}
