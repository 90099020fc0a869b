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


package com.amazon.topologicaloutlier;

import java.util.List;
import java.util.stream.Collectors;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;
import com.amazon.topologicaloutlier.testutils.TimeSeriesTestData;

public class TestUtils {

    public static final double EPSILON = 1e-10;

    private TestUtils() {
    }

    public static TimeSeries toTimeSeries(TimeSeriesTestData.SeriesData data) {
        return new TimeSeries(data.id, data.timestamps, data.values, data.uncertainties);
    }

    public static List<TimeSeries> toTimeSeries(List<TimeSeriesTestData.SeriesData> data) {
        return data.stream().map(TestUtils::toTimeSeries).collect(Collectors.toList());
    }

    public static TimeSeries line(String id, double slope, double intercept, int length) {
        double[] t = new double[length];
        double[] v = new double[length];
        for (int i = 0; i < length; i++) {
            t[i] = i;
            v[i] = intercept + slope * i;
        }
        return TimeSeries.of(id, t, v);
    }
}
