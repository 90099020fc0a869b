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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;
import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

/**
 * Dynamic time warping over the sample values, ignoring the timestamps, with
 * the absolute difference as local cost. The warping path may be restricted to
 * a Sakoe-Chiba band whose half width is a fraction of the longer series; the
 * band is always widened enough to reach the last cell.
 *
 * The result is divided by the length of the longer series so that series of
 * different lengths remain comparable. Dynamic time warping is symmetric and
 * zero on identical inputs, but does not satisfy the triangle inequality.
 */
@Getter
public class DynamicTimeWarpingDistance implements IDistanceMetric<TimeSeries> {

    private final double bandFraction;

    /**
     * unconstrained warping
     */
    public DynamicTimeWarpingDistance() {
        this(1.0);
    }

    /**
     * @param bandFraction half width of the band as a fraction of the longer
     *                     series, in (0, 1]
     */
    public DynamicTimeWarpingDistance(double bandFraction) {
        checkArgument(bandFraction > 0 && bandFraction <= 1.0, "bandFraction must be in (0, 1]");
        this.bandFraction = bandFraction;
    }

    @Override
    public double distance(TimeSeries a, TimeSeries b) {
        checkSufficient(a.size() >= 2, "series " + a.getId() + " has fewer than two samples");
        checkSufficient(b.size() >= 2, "series " + b.getId() + " has fewer than two samples");
        // the shorter series indexes the rows so that swapping the inputs
        // evaluates the same recurrence
        double[] x = a.getValues();
        double[] y = b.getValues();
        if (x.length > y.length || (x.length == y.length && compare(x, y) > 0)) {
            double[] t = x;
            x = y;
            y = t;
        }
        int n = x.length;
        int m = y.length;
        int band = max((int) Math.ceil(bandFraction * m), m - n);

        double[] previous = new double[m + 1];
        double[] current = new double[m + 1];
        Arrays.fill(previous, Double.POSITIVE_INFINITY);
        previous[0] = 0;
        for (int i = 1; i <= n; i++) {
            Arrays.fill(current, Double.POSITIVE_INFINITY);
            int from = max(1, i - band);
            int to = min(m, i + band);
            for (int j = from; j <= to; j++) {
                double best = min(previous[j - 1], min(previous[j], current[j - 1]));
                current[j] = abs(x[i - 1] - y[j - 1]) + best;
            }
            double[] t = previous;
            previous = current;
            current = t;
        }
        return previous[m] / m;
    }

    private static int compare(double[] x, double[] y) {
        for (int i = 0; i < x.length; i++) {
            int c = Double.compare(x[i], y[i]);
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }
}
