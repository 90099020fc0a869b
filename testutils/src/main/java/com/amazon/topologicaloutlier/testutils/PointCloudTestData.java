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


package com.amazon.topologicaloutlier.testutils;

import java.util.Random;

/**
 * Point clouds and distance matrices with known topology.
 */
public class PointCloudTestData {

    public static final double PAIR_DISTANCE = 0.1;

    public static final double BRIDGE_DISTANCE = 10.0;

    public static final double OUTLIER_DISTANCE = 50.0;

    private PointCloudTestData() {
    }

    /**
     * Two tight pairs {0, 1} and {2, 3} far apart from each other, and a fifth
     * point 4 at the same large distance from all the others.
     *
     * @return a 5 x 5 distance matrix
     */
    public static double[][] twoPairsAndOutlier() {
        double[][] distances = new double[5][5];
        for (int i = 0; i < 5; i++) {
            for (int j = 0; j < 5; j++) {
                if (i == j) {
                    continue;
                }
                if (i == 4 || j == 4) {
                    distances[i][j] = OUTLIER_DISTANCE;
                } else if (i / 2 == j / 2) {
                    distances[i][j] = PAIR_DISTANCE;
                } else {
                    distances[i][j] = BRIDGE_DISTANCE;
                }
            }
        }
        return distances;
    }

    /**
     * @param n number of points
     * @return an n x n matrix of zeros
     */
    public static double[][] identicalPoints(int n) {
        return new double[n][n];
    }

    /**
     * @param points rows are points
     * @return the matrix of Euclidean distances
     */
    public static double[][] euclideanDistances(double[][] points) {
        int n = points.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double sum = 0;
                for (int k = 0; k < points[i].length; k++) {
                    double diff = points[i][k] - points[j][k];
                    sum += diff * diff;
                }
                distances[i][j] = Math.sqrt(sum);
                distances[j][i] = distances[i][j];
            }
        }
        return distances;
    }

    /**
     * @param n         number of points
     * @param dimension number of coordinates
     * @param seed      random seed
     * @return points uniformly distributed in the unit cube
     */
    public static double[][] uniformPoints(int n, int dimension, long seed) {
        Random random = new Random(seed);
        double[][] points = new double[n][dimension];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < dimension; j++) {
                points[i][j] = random.nextDouble();
            }
        }
        return points;
    }

    /**
     * @param n      number of points
     * @param radius radius of the circle
     * @return points equally spaced on a circle in the plane
     */
    public static double[][] circle(int n, double radius) {
        double[][] points = new double[n][2];
        for (int i = 0; i < n; i++) {
            double angle = 2 * Math.PI * i / n;
            points[i][0] = radius * Math.cos(angle);
            points[i][1] = radius * Math.sin(angle);
        }
        return points;
    }
}
