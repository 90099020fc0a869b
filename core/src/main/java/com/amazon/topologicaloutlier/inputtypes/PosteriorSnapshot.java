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

package com.amazon.topologicaloutlier.inputtypes;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.CommonUtils.copyOf;

import java.util.Arrays;

import lombok.Getter;

/**
 * The mean and covariance of a fitted stochastic process evaluated at an
 * ordered set of query timestamps. All snapshots compared in one run share the
 * same query timestamps.
 *
 * The covariance is stored symmetrized; it may still have tiny negative
 * eigenvalues from rounding in the fit.
 */
public class PosteriorSnapshot {

    /**
     * largest relative asymmetry |K_ij - K_ji| / max|K| accepted on input
     */
    public static final double SYMMETRY_TOLERANCE = 1e-6;

    @Getter
    private final String seriesId;
    private final double[] queryTimes;
    private final double[] mean;
    private final double[][] covariance;

    public PosteriorSnapshot(String seriesId, double[] queryTimes, double[] mean, double[][] covariance) {
        checkNotNull(seriesId, "seriesId must not be null");
        checkNotNull(queryTimes, "queryTimes must not be null");
        checkNotNull(mean, "mean must not be null");
        checkNotNull(covariance, "covariance must not be null");
        int n = queryTimes.length;
        checkArgument(mean.length == n, "mean must have one entry per query time");
        checkArgument(covariance.length == n, "covariance must have one row per query time");
        double scale = 0;
        for (double[] row : covariance) {
            checkArgument(row.length == n, "covariance must be square");
            for (double v : row) {
                checkArgument(Double.isFinite(v), "covariance entries must be finite");
                scale = Math.max(scale, Math.abs(v));
            }
        }
        double[][] symmetric = new double[n][n];
        for (int i = 0; i < n; i++) {
            symmetric[i][i] = covariance[i][i];
            for (int j = i + 1; j < n; j++) {
                checkArgument(Math.abs(covariance[i][j] - covariance[j][i]) <= SYMMETRY_TOLERANCE * scale,
                        "covariance of " + seriesId + " is not symmetric");
                double average = 0.5 * (covariance[i][j] + covariance[j][i]);
                symmetric[i][j] = average;
                symmetric[j][i] = average;
            }
        }
        this.seriesId = seriesId;
        this.queryTimes = Arrays.copyOf(queryTimes, n);
        this.mean = Arrays.copyOf(mean, n);
        this.covariance = symmetric;
    }

    public int getDimension() {
        return queryTimes.length;
    }

    public double[] getQueryTimes() {
        return Arrays.copyOf(queryTimes, queryTimes.length);
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[][] getCovariance() {
        return copyOf(covariance);
    }

    /**
     * @param other another snapshot
     * @return true if both snapshots were evaluated at exactly the same query
     *         timestamps
     */
    public boolean sharesQueryTimes(PosteriorSnapshot other) {
        return Arrays.equals(queryTimes, other.queryTimes);
    }
}
