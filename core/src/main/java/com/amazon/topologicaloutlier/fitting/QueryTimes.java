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

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.topologicaloutlier.inputtypes.TimeSeries;

/**
 * Uniform grids of query timestamps shared by every posterior of a run.
 */
public class QueryTimes {

    private QueryTimes() {
    }

    /**
     * @param start first timestamp
     * @param end   last timestamp, not before {@code start}
     * @param count number of timestamps, at least 1; a single timestamp is
     *              placed at {@code start}
     * @return {@code count} equally spaced timestamps from start to end
     */
    public static double[] uniform(double start, double end, int count) {
        checkArgument(Double.isFinite(start) && Double.isFinite(end), "range must be finite");
        checkArgument(start <= end, "start must not be after end");
        checkArgument(count >= 1, "count must be positive");
        double[] answer = new double[count];
        if (count == 1) {
            answer[0] = start;
            return answer;
        }
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            answer[i] = start + i * step;
        }
        answer[count - 1] = end;
        return answer;
    }

    /**
     * @param series a non-empty collection of series
     * @param count  number of timestamps
     * @return a uniform grid from the earliest start to the latest end
     */
    public static double[] spanning(List<TimeSeries> series, int count) {
        checkNotNull(series, "series must not be null");
        checkArgument(!series.isEmpty(), "at least one series is required");
        double start = Double.POSITIVE_INFINITY;
        double end = Double.NEGATIVE_INFINITY;
        for (TimeSeries s : series) {
            if (s.size() > 0) {
                start = Math.min(start, s.getStartTime());
                end = Math.max(end, s.getEndTime());
            }
        }
        checkArgument(start <= end, "at least one series must have samples");
        return uniform(start, end, count);
    }
}
