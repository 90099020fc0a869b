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

import static com.amazon.topologicaloutlier.errors.InsufficientDataException.checkSufficient;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

/**
 * Compares two irregularly sampled series by bringing both onto the union of
 * their timestamps. A series is linearly interpolated between its samples and
 * held constant outside of its own range. The distance is the root mean square
 * of the aligned differences.
 *
 * When weighting is enabled each aligned difference is weighted by the inverse
 * of the combined interpolated variance {@code 1 / (s_a^2 + s_b^2 + floor)} so
 * that precise samples count more than noisy ones.
 */
@Getter
public class InterpolatedSeriesDistance implements IDistanceMetric<TimeSeries> {

    public static final double DEFAULT_VARIANCE_FLOOR = 1e-12;

    private final boolean uncertaintyWeighted;
    private final double varianceFloor;

    public InterpolatedSeriesDistance() {
        this(false, DEFAULT_VARIANCE_FLOOR);
    }

    public InterpolatedSeriesDistance(boolean uncertaintyWeighted) {
        this(uncertaintyWeighted, DEFAULT_VARIANCE_FLOOR);
    }

    public InterpolatedSeriesDistance(boolean uncertaintyWeighted, double varianceFloor) {
        this.uncertaintyWeighted = uncertaintyWeighted;
        this.varianceFloor = varianceFloor;
    }

    @Override
    public double distance(TimeSeries a, TimeSeries b) {
        checkSufficient(a.size() >= 2, "series " + a.getId() + " has fewer than two samples");
        checkSufficient(b.size() >= 2, "series " + b.getId() + " has fewer than two samples");
        double[] grid = mergedTimestamps(a, b);

        double weightedSum = 0;
        double totalWeight = 0;
        for (double t : grid) {
            double difference = a.valueAt(t) - b.valueAt(t);
            double weight = 1.0;
            if (uncertaintyWeighted) {
                double sa = a.uncertaintyAt(t);
                double sb = b.uncertaintyAt(t);
                weight = 1.0 / (sa * sa + sb * sb + varianceFloor);
            }
            weightedSum += weight * difference * difference;
            totalWeight += weight;
        }
        return Math.sqrt(weightedSum / totalWeight);
    }

    static double[] mergedTimestamps(TimeSeries a, TimeSeries b) {
        double[] first = a.getTimestamps();
        double[] second = b.getTimestamps();
        double[] merged = new double[first.length + second.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < first.length || j < second.length) {
            double next;
            if (j == second.length || (i < first.length && first[i] <= second[j])) {
                next = first[i++];
            } else {
                next = second[j++];
            }
            if (k == 0 || merged[k - 1] != next) {
                merged[k++] = next;
            }
        }
        return Arrays.copyOf(merged, k);
    }
}
